package org.springaicommunity.gitlab.labels;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the GitLab client and label service beans.
 */
@Configuration
public class GitLabConfig {

	@Value("${GITLAB_TOKEN}")
	private String gitlabToken;

	@Value("${GITLAB_URL:" + GitLabProperties.DEFAULT_BASE_URL + "}")
	private String gitlabUrl;

	@Bean
	public GitLabProperties gitLabProperties() {
		GitLabProperties properties = new GitLabProperties();
		properties.setToken(gitlabToken);
		properties.setBaseUrl(gitlabUrl);
		return properties;
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public GitLabClient gitLabClient(GitLabProperties gitLabProperties, ObjectMapper objectMapper) {
		return GitLabClientBuilder.create()
			.properties(gitLabProperties)
			.objectMapper(objectMapper)
			.buildHttpClient();
	}

	@Bean
	public LabelsService labelsService(GitLabClient gitLabClient, ObjectMapper objectMapper) {
		return new GitLabLabelsService(gitLabClient, objectMapper);
	}

}
