package org.springaicommunity.corpus.curator;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Enumerates {@code *.jsonl} batch files below a root directory.
 *
 * <p>
 * The returned stream is lazy: a directory is listed only when the iteration reaches it,
 * so the walk never holds more than one directory listing per level of depth. Entries of a
 * directory are visited in file-name order. A directory that cannot be listed is logged and
 * skipped; the walk continues with its siblings. Symbolic links are not followed.
 */
public class PartitionWalker {

	private static final Logger logger = LoggerFactory.getLogger(PartitionWalker.class);

	static final String JSONL_SUFFIX = ".jsonl";

	/**
	 * Walk the tree below {@code root}.
	 * @param root directory to walk
	 * @return lazy, single-use stream of absolute {@code .jsonl} file paths
	 */
	public Stream<Path> walk(Path root) {
		Iterator<Path> iterator = new JsonlFileIterator(root.toAbsolutePath().normalize());
		return StreamSupport.stream(
				Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
	}

	/**
	 * Walk the tree below {@code root} and collect the result.
	 * @param root directory to walk
	 * @return all {@code .jsonl} files in walk order
	 */
	public List<Path> list(Path root) {
		try (Stream<Path> files = walk(root)) {
			return files.toList();
		}
	}

	/**
	 * Open a listing of one directory.
	 * @param directory directory to list
	 * @return the directory's entries
	 * @throws IOException if the directory cannot be listed
	 */
	protected DirectoryStream<Path> openDirectory(Path directory) throws IOException {
		return Files.newDirectoryStream(directory);
	}

	private List<Path> listDirectory(Path directory) {
		List<Path> entries = new ArrayList<>();
		try (DirectoryStream<Path> stream = openDirectory(directory)) {
			for (Path entry : stream) {
				entries.add(entry);
			}
		}
		catch (IOException e) {
			logger.warn("Error reading directory {}: {}", directory, e.getMessage());
			return List.of();
		}
		entries.sort(Comparator.comparing(p -> p.getFileName().toString()));
		return entries;
	}

	static boolean isJsonlFile(Path path) {
		Path fileName = path.getFileName();
		return fileName != null && fileName.toString().endsWith(JSONL_SUFFIX);
	}

	private final class JsonlFileIterator implements Iterator<Path> {

		// Pending entries, one frame per directory that has been listed but not finished
		private final Deque<Iterator<Path>> frames = new ArrayDeque<>();

		@Nullable
		private Path next;

		JsonlFileIterator(Path root) {
			frames.push(listDirectory(root).iterator());
		}

		@Override
		public boolean hasNext() {
			while (next == null && !frames.isEmpty()) {
				Iterator<Path> frame = frames.peek();
				if (!frame.hasNext()) {
					frames.pop();
					continue;
				}
				Path entry = frame.next();
				if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
					frames.push(listDirectory(entry).iterator());
				}
				else if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS) && isJsonlFile(entry)) {
					next = entry;
				}
			}
			return next != null;
		}

		@Override
		public Path next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			Path result = next;
			next = null;
			return result;
		}

	}

}
