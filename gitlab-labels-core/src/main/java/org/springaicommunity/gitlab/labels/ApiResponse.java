package org.springaicommunity.gitlab.labels;

/**
 * A decoded response body paired with the response metadata it came from.
 *
 * @param <T> the decoded body type
 * @param body the decoded body
 * @param response the status, headers and raw body
 */
public record ApiResponse<T>(T body, GitLabResponse response) {

	public int statusCode() {
		return response.statusCode();
	}

	public PageInfo pageInfo() {
		return response.pageInfo();
	}

}
