package org.springaicommunity.corpus.curator;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Batch file contents with a stray Latin-1 byte inside an otherwise valid record.
 */
final class InvalidUtf8 {

	/** 0xE9 is a three byte UTF-8 lead; followed by a quote it decodes to one U+FFFD. */
	static final byte STRAY_BYTE = (byte) 0xE9;

	private InvalidUtf8() {
	}

	/**
	 * Two records: {@code u1} with content {@code "ok"} and {@code u2} with content
	 * {@code "caf"} followed by the stray byte.
	 */
	static byte[] batchWithBadByte() {
		return bytes("{\"url\":\"u1\",\"content_text\":\"ok\"}\n", "{\"url\":\"u2\",\"content_text\":\"caf",
				STRAY_BYTE, "\"}\n");
	}

	/**
	 * Concatenate strings (as UTF-8), single bytes and byte arrays.
	 */
	static byte[] bytes(Object... parts) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		for (Object part : parts) {
			if (part instanceof Byte b) {
				out.write(b);
			}
			else if (part instanceof byte[] raw) {
				out.writeBytes(raw);
			}
			else {
				out.writeBytes(part.toString().getBytes(StandardCharsets.UTF_8));
			}
		}
		return out.toByteArray();
	}

}
