package org.springaicommunity.gitlab.labels;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * HTTP client wrapper for GitLab REST API calls using Java 11+ HttpClient.
 *
 * <p>
 * Authenticates with a {@code PRIVATE-TOKEN} header. Non-2xx responses are turned into
 * {@link GitLabApiException}s carrying the response and the message GitLab put in the
 * error body.
 */
public class GitLabHttpClient implements GitLabClient {

	private static final Logger logger = LoggerFactory.getLogger(GitLabHttpClient.class);

	private final HttpClient httpClient;

	private final String baseUrl;

	private final String token;

	private final String userAgent;

	private final ObjectMapper objectMapper;

	public GitLabHttpClient(String token) {
		this(GitLabProperties.withToken(token), ObjectMapperFactory.create());
	}

	public GitLabHttpClient(GitLabProperties properties, ObjectMapper objectMapper) {
		this.baseUrl = stripTrailingSlash(properties.getBaseUrl());
		this.token = properties.getToken();
		this.userAgent = properties.getUserAgent();
		this.objectMapper = objectMapper;
		this.httpClient = HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.connectTimeout(Duration.ofSeconds(properties.getConnectTimeoutSeconds()))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	public String getBaseUrl() {
		return baseUrl;
	}

	@Override
	public GitLabResponse execute(GitLabRequest request) {
		String url = baseUrl + request.pathAndQuery();
		logger.debug("{} {}", request.method(), url);
		long start = System.currentTimeMillis();

		HttpRequest.BodyPublisher body = request.jsonBody() != null
				? HttpRequest.BodyPublishers.ofString(request.jsonBody()) : HttpRequest.BodyPublishers.noBody();
		HttpRequest.Builder builder = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("PRIVATE-TOKEN", token)
			.header("Accept", "application/json")
			.header("User-Agent", userAgent)
			.method(request.method(), body);
		if (request.jsonBody() != null) {
			builder.header("Content-Type", "application/json");
		}

		try {
			GitLabResponse response = executeRequest(builder.build(), request.method(), url);
			logger.debug("{} {} completed in {}ms ({} bytes)", request.method(), url,
					System.currentTimeMillis() - start, response.body().length());
			return response;
		}
		catch (GitLabApiException e) {
			logger.debug("{} {} failed after {}ms: {}", request.method(), url, System.currentTimeMillis() - start,
					e.getMessage());
			throw e;
		}
	}

	private GitLabResponse executeRequest(HttpRequest request, String method, String url) {
		HttpResponse<String> httpResponse;
		try {
			httpResponse = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitLabApiException(method + " " + url + ": HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitLabApiException(method + " " + url + ": HTTP request interrupted", e);
		}

		String responseBody = httpResponse.body() != null ? httpResponse.body() : "";
		GitLabResponse response = new GitLabResponse(httpResponse.statusCode(), httpResponse.headers().map(),
				responseBody);
		if (response.isSuccessful()) {
			return response;
		}

		String serverMessage = parseErrorBody(responseBody);
		String message = method + " " + url + ": " + response.statusCode()
				+ (serverMessage != null ? " " + serverMessage : "");
		if (response.statusCode() == 401) {
			logger.warn("Unauthorized: check GITLAB_TOKEN ({})", url);
		}
		throw new GitLabApiException(message, response, serverMessage);
	}

	/**
	 * Flatten a GitLab JSON error body into one line. Objects become
	 * {@code {key: value}} entries sorted alphabetically, arrays become
	 * {@code [a, b]}.
	 */
	@Nullable
	String parseErrorBody(String body) {
		if (body.isBlank()) {
			return null;
		}
		try {
			return flatten(objectMapper.readTree(body));
		}
		catch (JsonProcessingException e) {
			return "failed to parse unknown error format: " + body;
		}
	}

	private static String flatten(JsonNode node) {
		if (node.isObject()) {
			List<String> entries = new ArrayList<>();
			Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
			while (fields.hasNext()) {
				Map.Entry<String, JsonNode> field = fields.next();
				entries.add("{" + field.getKey() + ": " + flatten(field.getValue()) + "}");
			}
			Collections.sort(entries);
			return String.join(", ", entries);
		}
		if (node.isArray()) {
			List<String> items = new ArrayList<>();
			node.forEach(item -> items.add(flatten(item)));
			return "[" + String.join(", ", items) + "]";
		}
		return node.asText();
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

}
