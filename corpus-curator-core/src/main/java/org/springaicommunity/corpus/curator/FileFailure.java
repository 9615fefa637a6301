package org.springaicommunity.corpus.curator;

import java.nio.file.Path;

/**
 * A batch file whose processing failed.
 *
 * @param file the file
 * @param reason failure description
 */
public record FileFailure(Path file, String reason) {

	static FileFailure of(Path file, Throwable cause) {
		String message = cause.getMessage();
		return new FileFailure(file, message != null ? message : cause.getClass().getSimpleName());
	}

}
