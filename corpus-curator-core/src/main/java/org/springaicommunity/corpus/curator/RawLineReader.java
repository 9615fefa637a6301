package org.springaicommunity.corpus.curator;

import org.jspecify.annotations.Nullable;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/**
 * Splits a byte stream on {@code '\n'} without decoding it.
 *
 * <p>
 * Returned lines exclude the line feed but keep any other byte, including a carriage
 * return before it. A final line without a line feed is still returned.
 */
final class RawLineReader implements Closeable {

	private final InputStream in;

	private final byte[] buffer;

	private final ByteArrayOutputStream line = new ByteArrayOutputStream();

	private int position;

	private int limit;

	RawLineReader(InputStream in, int bufferSize) {
		this.in = in;
		this.buffer = new byte[bufferSize];
	}

	/**
	 * Read the next line.
	 * @return the line's bytes, or {@code null} at end of stream
	 * @throws IOException if the stream cannot be read
	 */
	byte @Nullable [] readLine() throws IOException {
		line.reset();
		boolean read = false;
		while (true) {
			if (position == limit) {
				int count = in.read(buffer);
				if (count < 0) {
					return read ? line.toByteArray() : null;
				}
				position = 0;
				limit = count;
			}
			read = true;
			for (int i = position; i < limit; i++) {
				if (buffer[i] == '\n') {
					line.write(buffer, position, i - position);
					position = i + 1;
					return line.toByteArray();
				}
			}
			line.write(buffer, position, limit - position);
			position = limit;
		}
	}

	@Override
	public void close() throws IOException {
		in.close();
	}

}
