package org.springaicommunity.gitlab.labels;

/**
 * Interface for GitLab API HTTP operations.
 *
 * <p>
 * Provides abstraction over the GitLab REST API transport, enabling testability and
 * decorator implementations (caching, retrying, logging) outside this library.
 */
public interface GitLabClient {

	/**
	 * Execute a request against the GitLab REST API.
	 * @param request the request, with a path relative to the API base URL
	 * @return the response of a successful (2xx) call
	 * @throws GitLabApiException if the request fails or GitLab answers with a non-2xx
	 * status
	 */
	GitLabResponse execute(GitLabRequest request);

}
