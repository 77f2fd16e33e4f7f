package org.springaicommunity.gitlab.labels;

import org.jspecify.annotations.Nullable;

/**
 * A single request to the GitLab REST API, relative to the configured base URL.
 *
 * @param method the HTTP method (GET, POST, PUT, DELETE)
 * @param path the API path, already escaped (e.g. {@code /projects/1/labels})
 * @param queryString the encoded query string without leading {@code ?}, or null
 * @param jsonBody the JSON request body, or null for no body
 */
public record GitLabRequest(String method, String path, @Nullable String queryString, @Nullable String jsonBody) {

	public static GitLabRequest get(String path, @Nullable String queryString) {
		return new GitLabRequest("GET", path, queryString, null);
	}

	public static GitLabRequest post(String path, @Nullable String jsonBody) {
		return new GitLabRequest("POST", path, null, jsonBody);
	}

	public static GitLabRequest put(String path, @Nullable String jsonBody) {
		return new GitLabRequest("PUT", path, null, jsonBody);
	}

	public static GitLabRequest delete(String path, @Nullable String jsonBody) {
		return new GitLabRequest("DELETE", path, null, jsonBody);
	}

	/**
	 * Returns the path with the query string appended, if any.
	 * @return path and query
	 */
	public String pathAndQuery() {
		if (queryString == null || queryString.isEmpty()) {
			return path;
		}
		return path + "?" + queryString;
	}

}
