package org.springaicommunity.gitlab.labels;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

/**
 * Builder for creating GitLab label services without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token and URL from GITLAB_TOKEN / GITLAB_URL (environment or .env)
 * LabelsService labels = GitLabClientBuilder.create()
 *     .tokenFromEnv()
 *     .buildLabelsService();
 *
 * // Self-managed instance
 * LabelsService labels = GitLabClientBuilder.create()
 *     .token("glpat-xxxxx")
 *     .baseUrl("https://gitlab.example.com/api/v4")
 *     .buildLabelsService();
 *
 * Label label = labels.getLabel("group/project", "kind/bug").body();
 *
 * // For testing with mock HTTP client
 * GitLabClient mockClient = mock(GitLabClient.class);
 * LabelsService testLabels = GitLabClientBuilder.create()
 *     .httpClient(mockClient)
 *     .buildLabelsService();
 * }
 * </pre>
 */
public class GitLabClientBuilder {

	private GitLabProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitLabClient httpClient;

	private GitLabClientBuilder() {
		this.properties = new GitLabProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new GitLabClientBuilder
	 */
	public static GitLabClientBuilder create() {
		return new GitLabClientBuilder();
	}

	/**
	 * Set the GitLab access token directly.
	 * @param token personal, project or group access token
	 * @return this builder
	 */
	public GitLabClientBuilder token(String token) {
		this.properties.setToken(token);
		return this;
	}

	/**
	 * Read the token from {@code GITLAB_TOKEN} and, when present, the base URL from
	 * {@code GITLAB_URL}, using {@link EnvironmentSupport}.
	 * @return this builder
	 * @throws IllegalStateException if GITLAB_TOKEN is not set
	 */
	public GitLabClientBuilder tokenFromEnv() {
		String token = EnvironmentSupport.get(EnvironmentSupport.TOKEN_VARIABLE);
		if (token == null) {
			throw new IllegalStateException(
					"GITLAB_TOKEN environment variable is required. Please set your GitLab access token.");
		}
		this.properties.setToken(token);
		this.properties.setBaseUrl(
				EnvironmentSupport.getOrDefault(EnvironmentSupport.URL_VARIABLE, this.properties.getBaseUrl()));
		return this;
	}

	/**
	 * Set the API base URL.
	 * @param baseUrl base URL including {@code /api/v4}
	 * @return this builder
	 */
	public GitLabClientBuilder baseUrl(String baseUrl) {
		this.properties.setBaseUrl(baseUrl);
		return this;
	}

	/**
	 * Set connection properties, replacing token and base URL set earlier.
	 * @param properties connection properties (null to keep the current ones)
	 * @return this builder
	 */
	public GitLabClientBuilder properties(@Nullable GitLabProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper. It must map snake_case JSON keys, as the one from
	 * {@link ObjectMapperFactory} does.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitLabClientBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitLabClient implementation. Useful for testing with mocks or for
	 * adding decorators (caching, logging, retrying).
	 *
	 * <p>
	 * When a custom client is provided, the token is not required.
	 * @param httpClient custom GitLabClient implementation (null to use default)
	 * @return this builder
	 */
	public GitLabClientBuilder httpClient(@Nullable GitLabClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Build a LabelsService.
	 * @return configured LabelsService
	 */
	public LabelsService buildLabelsService() {
		ObjectMapper mapper = resolveObjectMapper();
		GitLabClient client = this.httpClient != null ? this.httpClient : buildHttpClient(mapper);
		return new GitLabLabelsService(client, mapper);
	}

	/**
	 * Build the default HTTP transport directly (for advanced usage).
	 * @return configured GitLabClient
	 */
	public GitLabClient buildHttpClient() {
		return buildHttpClient(resolveObjectMapper());
	}

	private GitLabClient buildHttpClient(ObjectMapper mapper) {
		validate();
		return new GitLabHttpClient(properties, mapper);
	}

	private ObjectMapper resolveObjectMapper() {
		return this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
	}

	private void validate() {
		if (properties.getToken() == null || properties.getToken().trim().isEmpty()) {
			throw new IllegalStateException("GitLab token is required. Call token() or tokenFromEnv() first.");
		}
		if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
			throw new IllegalStateException("GitLab base URL must not be empty");
		}
		if (properties.getConnectTimeoutSeconds() <= 0) {
			throw new IllegalStateException("connectTimeoutSeconds must be positive");
		}
	}

}
