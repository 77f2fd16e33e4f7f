package org.springaicommunity.gitlab.labels;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a GitLab API call fails.
 *
 * <p>
 * Two cases are distinguished:
 * <ul>
 * <li>Transport failure (connection refused, I/O error, interruption): no response was
 * received, {@link #getResponse()} returns {@code null} and {@link #getStatusCode()}
 * returns -1.</li>
 * <li>API error (non-2xx status): the response metadata and the message extracted from
 * GitLab's JSON error body are attached.</li>
 * </ul>
 */
public class GitLabApiException extends GitLabException {

	private final int statusCode;

	private final @Nullable GitLabResponse response;

	private final @Nullable String serverMessage;

	public GitLabApiException(String message, GitLabResponse response, @Nullable String serverMessage) {
		super(message);
		this.statusCode = response.statusCode();
		this.response = response;
		this.serverMessage = serverMessage;
	}

	public GitLabApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.response = null;
		this.serverMessage = null;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public @Nullable GitLabResponse getResponse() {
		return response;
	}

	/**
	 * Returns the message GitLab put in the error body, flattened to a single line
	 * (e.g.&nbsp;{@code {message: 404 Label Not Found}}).
	 * @return the server message, or {@code null} for transport failures or empty bodies
	 */
	public @Nullable String getServerMessage() {
		return serverMessage;
	}

	/**
	 * Returns true if no response was received.
	 * @return true for transport failures
	 */
	public boolean isTransportError() {
		return response == null;
	}

}
