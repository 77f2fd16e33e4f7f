package org.springaicommunity.gitlab.labels;

/**
 * Base class for all failures raised by the GitLab labels client.
 *
 * <p>
 * Subclasses separate input validation ({@link InvalidIdException}), transport and API
 * status failures ({@link GitLabApiException}) and response decoding
 * ({@link GitLabDecodeException}).
 */
public class GitLabException extends RuntimeException {

	public GitLabException(String message) {
		super(message);
	}

	public GitLabException(String message, Throwable cause) {
		super(message, cause);
	}

}
