package org.springaicommunity.gitlab.labels;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Service for the GitLab project labels API.
 *
 * <p>
 * Builds one {@link GitLabRequest} per operation, sends it through the {@link GitLabClient}
 * and converts the JSON response to strongly-typed DTOs at the service boundary.
 */
public class GitLabLabelsService implements LabelsService {

	private static final Logger logger = LoggerFactory.getLogger(GitLabLabelsService.class);

	private static final TypeReference<Map<String, Object>> QUERY_MAP = new TypeReference<>() {
	};

	private final GitLabClient httpClient;

	private final ObjectMapper objectMapper;

	public GitLabLabelsService(GitLabClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public ApiResponse<List<Label>> listLabels(Object pid, @Nullable ListLabelsOptions options) {
		String path = labelsPath(pid);
		logger.debug("Listing labels of project {}", pid);
		GitLabResponse response = httpClient.execute(GitLabRequest.get(path, toQueryString(options)));
		List<Label> labels = decode(response, objectMapper.getTypeFactory().constructCollectionType(List.class,
				Label.class));
		return new ApiResponse<>(labels, response);
	}

	@Override
	public ApiResponse<Label> getLabel(Object pid, Object labelId) {
		String path = labelPath(pid, labelId);
		GitLabResponse response = httpClient.execute(GitLabRequest.get(path, null));
		return new ApiResponse<>(decodeLabel(response), response);
	}

	@Override
	public ApiResponse<Label> createLabel(Object pid, @Nullable CreateLabelOptions options) {
		String path = labelsPath(pid);
		logger.debug("Creating label in project {}", pid);
		GitLabResponse response = httpClient.execute(GitLabRequest.post(path, toJson(options)));
		return new ApiResponse<>(decodeLabel(response), response);
	}

	@Override
	public GitLabResponse deleteLabel(Object pid, Object labelId, @Nullable DeleteLabelOptions options) {
		String path = labelPath(pid, labelId);
		logger.debug("Deleting label {} of project {}", labelId, pid);
		return httpClient.execute(GitLabRequest.delete(path, toJson(options)));
	}

	@Override
	public ApiResponse<Label> updateLabel(Object pid, Object labelId, @Nullable UpdateLabelOptions options) {
		String path = labelPath(pid, labelId);
		logger.debug("Updating label {} of project {}", labelId, pid);
		GitLabResponse response = httpClient.execute(GitLabRequest.put(path, toJson(options)));
		return new ApiResponse<>(decodeLabel(response), response);
	}

	@Override
	public ApiResponse<Label> subscribeToLabel(Object pid, Object labelId) {
		String path = labelPath(pid, labelId) + "/subscribe";
		GitLabResponse response = httpClient.execute(GitLabRequest.post(path, null));
		return new ApiResponse<>(decodeLabel(response), response);
	}

	@Override
	public GitLabResponse unsubscribeFromLabel(Object pid, Object labelId) {
		String path = labelPath(pid, labelId) + "/unsubscribe";
		return httpClient.execute(GitLabRequest.post(path, null));
	}

	@Override
	public GitLabResponse promoteLabel(Object pid, Object labelId) {
		String path = labelPath(pid, labelId) + "/promote";
		logger.debug("Promoting label {} of project {} to its group", labelId, pid);
		return httpClient.execute(GitLabRequest.put(path, null));
	}

	// ========== Request Building ==========

	private static String labelsPath(Object pid) {
		return "/projects/" + ResourceId.of(pid).toPathSegment() + "/labels";
	}

	// Both identifiers are validated before the path is built.
	private static String labelPath(Object pid, Object labelId) {
		String project = ResourceId.of(pid).toPathSegment();
		String label = ResourceId.of(labelId).toPathSegment();
		return "/projects/" + project + "/labels/" + label;
	}

	@Nullable
	private String toJson(@Nullable Object options) {
		if (options == null) {
			return null;
		}
		try {
			return objectMapper.writeValueAsString(options);
		}
		catch (JsonProcessingException e) {
			throw new GitLabException("Failed to encode " + options.getClass().getSimpleName(), e);
		}
	}

	@Nullable
	String toQueryString(@Nullable Object options) {
		if (options == null) {
			return null;
		}
		Map<String, Object> params = objectMapper.convertValue(options, QUERY_MAP);
		StringJoiner query = new StringJoiner("&");
		params.forEach((name, value) -> {
			if (value != null) {
				query.add(encode(name) + "=" + encode(String.valueOf(value)));
			}
		});
		return query.length() == 0 ? null : query.toString();
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8);
	}

	// ========== JSON Parsing Methods ==========

	private Label decodeLabel(GitLabResponse response) {
		return decode(response, objectMapper.constructType(Label.class));
	}

	private <T> T decode(GitLabResponse response, JavaType type) {
		try {
			T value = objectMapper.readValue(response.body(), type);
			if (value == null) {
				throw new GitLabDecodeException("Empty " + type.getRawClass().getSimpleName() + " in response",
						response, new IllegalStateException("JSON null body"));
			}
			return value;
		}
		catch (JsonProcessingException e) {
			logger.debug("Failed to decode {}: {}", type, e.getOriginalMessage());
			throw new GitLabDecodeException("Failed to decode " + type.getRawClass().getSimpleName()
					+ " from response: " + e.getOriginalMessage(), response, e);
		}
	}

}
