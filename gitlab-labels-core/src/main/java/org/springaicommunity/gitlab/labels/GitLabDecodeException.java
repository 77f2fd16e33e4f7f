package org.springaicommunity.gitlab.labels;

/**
 * Thrown when a successful response body cannot be decoded into the expected type.
 */
public class GitLabDecodeException extends GitLabException {

	private final GitLabResponse response;

	public GitLabDecodeException(String message, GitLabResponse response, Throwable cause) {
		super(message, cause);
		this.response = response;
	}

	/**
	 * Returns the response whose body failed to decode.
	 * @return the undecodable response
	 */
	public GitLabResponse getResponse() {
		return response;
	}

}
