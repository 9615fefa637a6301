package org.springaicommunity.corpus.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Moves a fully written temporary file over its target.
 *
 * <p>
 * An atomic rename is attempted first. When the file system refuses it (for example
 * across devices) the temporary file is copied over the target and then deleted.
 */
final class FileReplacement {

	private static final Logger logger = LoggerFactory.getLogger(FileReplacement.class);

	static final String TEMP_SUFFIX = ".tmp";

	private FileReplacement() {
	}

	static Path tempSiblingOf(Path target) {
		return target.resolveSibling(target.getFileName().toString() + TEMP_SUFFIX);
	}

	static void replace(Path temp, Path target) throws IOException {
		replace(temp, target, FileReplacement::atomicMove);
	}

	static void replace(Path temp, Path target, Move rename) throws IOException {
		try {
			rename.move(temp, target);
		}
		catch (IOException | UnsupportedOperationException e) {
			logger.debug("Atomic rename of {} failed ({}), falling back to copy", temp, e.getMessage());
			Files.copy(temp, target, StandardCopyOption.REPLACE_EXISTING);
			Files.delete(temp);
		}
	}

	private static void atomicMove(Path source, Path target) throws IOException {
		Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
	}

	static void deleteQuietly(Path temp) {
		try {
			Files.deleteIfExists(temp);
		}
		catch (IOException e) {
			logger.error("Error cleaning up temp file {}: {}", temp, e.getMessage());
		}
	}

	@FunctionalInterface
	interface Move {

		void move(Path source, Path target) throws IOException;

	}

}
