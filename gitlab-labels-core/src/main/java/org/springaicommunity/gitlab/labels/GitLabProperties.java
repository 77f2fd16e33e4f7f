package org.springaicommunity.gitlab.labels;

/**
 * Connection properties for the GitLab REST API.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link GitLabClientBuilder}.
 * Defaults target gitlab.com.
 */
public class GitLabProperties {

	/**
	 * Default API base URL, including the {@code /api/v4} prefix.
	 */
	public static final String DEFAULT_BASE_URL = "https://gitlab.com/api/v4";

	/**
	 * API base URL, including the {@code /api/v4} prefix.
	 */
	private String baseUrl = DEFAULT_BASE_URL;

	/**
	 * Personal, project or group access token sent as {@code PRIVATE-TOKEN}.
	 */
	private String token = "";

	/**
	 * Connection timeout in seconds.
	 */
	private int connectTimeoutSeconds = 30;

	/**
	 * Value of the {@code User-Agent} header.
	 */
	private String userAgent = "gitlab-labels-client";

	static GitLabProperties withToken(String token) {
		GitLabProperties properties = new GitLabProperties();
		properties.setToken(token);
		return properties;
	}

	/**
	 * Returns the API base URL.
	 * @return the base URL
	 */
	public String getBaseUrl() {
		return baseUrl;
	}

	/**
	 * Sets the API base URL, e.g. {@code https://gitlab.example.com/api/v4}.
	 * @param baseUrl the base URL
	 */
	public void setBaseUrl(String baseUrl) {
		this.baseUrl = baseUrl;
	}

	public String getToken() {
		return token;
	}

	public void setToken(String token) {
		this.token = token;
	}

	/**
	 * Returns the connection timeout in seconds.
	 * @return the timeout
	 */
	public int getConnectTimeoutSeconds() {
		return connectTimeoutSeconds;
	}

	/**
	 * Sets the connection timeout in seconds.
	 * @param connectTimeoutSeconds the timeout; must be positive
	 */
	public void setConnectTimeoutSeconds(int connectTimeoutSeconds) {
		this.connectTimeoutSeconds = connectTimeoutSeconds;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

}
