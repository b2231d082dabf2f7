package org.springaicommunity.github.provider;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Looks up configuration values by name, preferring a {@code .env} file over the process
 * environment. Both {@code .env} files are read once per process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>{@code .env} in the current working directory</li>
 * <li>the process environment ({@link System#getenv})</li>
 * <li>{@code .env} in the user's home directory</li>
 * </ol>
 *
 * Blank values are reported as absent.
 */
public final class EnvironmentSupport {

	private static final Dotenv WORKING_DIR_DOTENV = Dotenv.configure()
		.ignoreIfMissing()
		.ignoreIfMalformed()
		.load();

	private static final @Nullable Dotenv HOME_DOTENV = loadHomeDotenv();

	private EnvironmentSupport() {
	}

	private static @Nullable Dotenv loadHomeDotenv() {
		String home = System.getProperty("user.home");
		if (home == null) {
			return null;
		}
		return Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load();
	}

	/**
	 * Get a configuration value.
	 * @param name the variable name, e.g. {@code GITHUB_TOKEN}
	 * @return the value, or {@code null} if it is unset or blank
	 */
	public static @Nullable String get(String name) {
		// Dotenv#get falls back to System.getenv for the working directory file
		String value = WORKING_DIR_DOTENV.get(name);
		if (isBlank(value) && HOME_DOTENV != null) {
			value = HOME_DOTENV.get(name);
		}
		return isBlank(value) ? null : value;
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

}
