package org.springaicommunity.gitlab.labels;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Response metadata returned by the transport: status, headers and the raw body.
 *
 * <p>
 * Header names are matched case-insensitively.
 *
 * @param statusCode the HTTP status code
 * @param headers the response headers
 * @param body the raw response body (empty string when the server sent none)
 */
public record GitLabResponse(int statusCode, Map<String, List<String>> headers, String body) {

	public GitLabResponse {
		Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
		headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
		headers = Collections.unmodifiableMap(copy);
	}

	/**
	 * Returns the first value of the named header.
	 * @param name header name (case-insensitive)
	 * @return the first value, or empty if the header is absent
	 */
	public Optional<String> firstHeader(String name) {
		List<String> values = headers.get(name);
		if (values == null || values.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(values.get(0));
	}

	/**
	 * Returns the pagination information GitLab sends in {@code X-*} headers.
	 * @return pagination info (all zeros when the headers are absent)
	 */
	public PageInfo pageInfo() {
		return PageInfo.from(this);
	}

	public boolean isSuccessful() {
		return statusCode >= 200 && statusCode < 300;
	}

}
