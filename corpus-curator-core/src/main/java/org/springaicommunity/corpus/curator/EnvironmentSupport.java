package org.springaicommunity.corpus.curator;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves environment variables by checking a {@code .env} file first, then falling back
 * to the system environment. The {@code .env} file is loaded once and cached for the
 * lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	/**
	 * Overrides the default worker count.
	 */
	public static final String WORKERS_VARIABLE = "CURATOR_WORKERS";

	/**
	 * Overrides the default number of entries kept by the top-K stage.
	 */
	public static final String TOP_K_VARIABLE = "CURATOR_TOP_K";

	private static final Dotenv CWD_DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private static final Dotenv HOME_DOTENV = loadHomeDotenv();

	private static Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home != null) {
			return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
		}
		return CWD_DOTENV;
	}

	private EnvironmentSupport() {
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * Get a positive integer environment variable.
	 * @param name the variable name
	 * @return the parsed value, or {@code null} if unset
	 * @throws IllegalStateException if the value is set but not a positive integer
	 */
	@Nullable
	public static Integer getPositiveInt(String name) {
		String value = get(name);
		if (value == null || value.isBlank()) {
			return null;
		}
		try {
			int parsed = Integer.parseInt(value.trim());
			if (parsed <= 0) {
				throw new IllegalStateException(name + " must be a positive integer (got: " + value + ")");
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalStateException(name + " must be a positive integer (got: " + value + ")", e);
		}
	}

}
