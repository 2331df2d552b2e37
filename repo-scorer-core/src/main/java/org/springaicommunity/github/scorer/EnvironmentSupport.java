package org.springaicommunity.github.scorer;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

/**
 * Resolves configuration from the environment, honouring {@code .env} files.
 *
 * <p>
 * Lookup order for {@link #get(String)}:
 * <ol>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 * The {@code .env} files are loaded once and cached for the lifetime of the process.
 */
public final class EnvironmentSupport {

	/**
	 * Environment variable holding the GitHub personal access token.
	 */
	public static final String GITHUB_TOKEN = "GITHUB_TOKEN";

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
	 * Get an environment variable value. Dotenv's lookup already falls back to the system
	 * environment, so only the home directory file needs an explicit second lookup.
	 * @param name the variable name
	 * @return the value, or {@code null} if not found
	 */
	public static @Nullable String get(String name) {
		String value = CWD_DOTENV.get(name);
		if (value == null) {
			value = HOME_DOTENV.get(name);
		}
		return value;
	}

	/**
	 * The GitHub token, if one is configured and not blank.
	 * @return the token, or {@code null}
	 */
	public static @Nullable String githubToken() {
		String token = get(GITHUB_TOKEN);
		return token == null || token.isBlank() ? null : token.trim();
	}

}
