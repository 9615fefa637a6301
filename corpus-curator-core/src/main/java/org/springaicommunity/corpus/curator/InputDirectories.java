package org.springaicommunity.corpus.curator;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Precondition checks shared by the stages.
 */
final class InputDirectories {

	private InputDirectories() {
	}

	static Path requireDirectory(Path inputDir) {
		if (!Files.isDirectory(inputDir)) {
			throw new IllegalStateException("Input directory not found or is not a directory: " + inputDir
					+ " (working directory: " + System.getProperty("user.dir") + ")");
		}
		return inputDir.toAbsolutePath().normalize();
	}

}
