package org.springaicommunity.gitlab.labels;

import io.github.cdimascio.dotenv.Dotenv;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Resolves connection settings such as {@code GITLAB_TOKEN} and {@code GITLAB_URL}. The
 * {@code .env} files are loaded once and cached for the lifetime of the process.
 *
 * <p>
 * Lookup order:
 * <ol>
 * <li>System environment variable ({@link System#getenv})</li>
 * <li>{@code .env} file in the current working directory (if present)</li>
 * <li>{@code .env} file in the user's home directory (if present)</li>
 * </ol>
 */
public final class EnvironmentSupport {

	public static final String TOKEN_VARIABLE = "GITLAB_TOKEN";

	public static final String URL_VARIABLE = "GITLAB_URL";

	// dotenv-java consults System.getenv before the file contents
	private static final List<Dotenv> SOURCES = loadSources();

	private EnvironmentSupport() {
	}

	private static List<Dotenv> loadSources() {
		Dotenv cwd = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();
		String home = System.getProperty("user.home");
		if (home == null) {
			return List.of(cwd);
		}
		return List.of(cwd, Dotenv.configure().directory(home).ignoreIfMissing().ignoreIfMalformed().load());
	}

	/**
	 * Get an environment variable value.
	 * @param name the variable name
	 * @return the first non-blank value, or {@code null} if not found
	 */
	@Nullable
	public static String get(String name) {
		for (Dotenv source : SOURCES) {
			String value = source.get(name);
			if (value != null && !value.isBlank()) {
				return value.trim();
			}
		}
		return null;
	}

	/**
	 * Get an environment variable value, falling back to a default.
	 * @param name the variable name
	 * @param defaultValue value returned when the variable is not set
	 * @return the value or the default
	 */
	public static String getOrDefault(String name, String defaultValue) {
		String value = get(name);
		return value != null ? value : defaultValue;
	}

}
