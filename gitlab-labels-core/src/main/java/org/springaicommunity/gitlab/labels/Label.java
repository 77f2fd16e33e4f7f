package org.springaicommunity.gitlab.labels;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * Represents a GitLab project or group label.
 *
 * <p>
 * An immutable snapshot of the server state. Optional fields that GitLab returns as JSON
 * {@code null} (or omits) are {@code null} here; counters and flags default to zero and
 * {@code false}.
 *
 * @param id the label ID
 * @param name the label name (unique within the project)
 * @param color the background color in {@code #RRGGBB} form or a CSS color name
 * @param textColor the foreground color GitLab picked for the label
 * @param description an optional description of the label's purpose
 * @param descriptionHtml the rendered description, when GitLab sends one
 * @param openIssuesCount number of open issues carrying the label
 * @param closedIssuesCount number of closed issues carrying the label
 * @param openMergeRequestsCount number of open merge requests carrying the label
 * @param subscribed whether the current user is subscribed to the label
 * @param priority the label priority, or {@code null} if the label is not prioritized
 * @param isProjectLabel whether the label belongs to the project (as opposed to an
 * ancestor group)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Label(long id, String name, String color, @Nullable String textColor, @Nullable String description,
		@Nullable String descriptionHtml, int openIssuesCount, int closedIssuesCount, int openMergeRequestsCount,
		boolean subscribed, @Nullable Integer priority, boolean isProjectLabel) {

	/**
	 * Create a label from the fields most responses carry. Remaining fields take their
	 * empty values.
	 * @param id the label ID
	 * @param name the label name
	 * @param color the label color
	 * @return a new label
	 */
	public static Label of(long id, String name, String color) {
		return new Label(id, name, color, null, null, null, 0, 0, 0, false, null, false);
	}

	/**
	 * Decode a label from its JSON form. Group label payloads may carry {@code title}
	 * instead of {@code name}; the title is used when no name is present.
	 */
	@JsonCreator
	static Label fromJson(@JsonProperty("id") long id, @JsonProperty("name") @Nullable String name,
			@JsonProperty("title") @Nullable String title, @JsonProperty("color") @Nullable String color,
			@JsonProperty("text_color") @Nullable String textColor,
			@JsonProperty("description") @Nullable String description,
			@JsonProperty("description_html") @Nullable String descriptionHtml,
			@JsonProperty("open_issues_count") int openIssuesCount,
			@JsonProperty("closed_issues_count") int closedIssuesCount,
			@JsonProperty("open_merge_requests_count") int openMergeRequestsCount,
			@JsonProperty("subscribed") boolean subscribed, @JsonProperty("priority") @Nullable Integer priority,
			@JsonProperty("is_project_label") boolean isProjectLabel) {
		String resolvedName = (name == null || name.isEmpty()) && title != null ? title : name;
		return new Label(id, resolvedName != null ? resolvedName : "", color != null ? color : "", textColor,
				description, descriptionHtml, openIssuesCount, closedIssuesCount, openMergeRequestsCount, subscribed,
				priority, isProjectLabel);
	}

	public Label withDescription(@Nullable String description) {
		return new Label(id, name, color, textColor, description, descriptionHtml, openIssuesCount, closedIssuesCount,
				openMergeRequestsCount, subscribed, priority, isProjectLabel);
	}

	public Label withPriority(@Nullable Integer priority) {
		return new Label(id, name, color, textColor, description, descriptionHtml, openIssuesCount, closedIssuesCount,
				openMergeRequestsCount, subscribed, priority, isProjectLabel);
	}

	public Label withCounts(int openIssuesCount, int closedIssuesCount, int openMergeRequestsCount) {
		return new Label(id, name, color, textColor, description, descriptionHtml, openIssuesCount, closedIssuesCount,
				openMergeRequestsCount, subscribed, priority, isProjectLabel);
	}

	public Label withSubscribed(boolean subscribed) {
		return new Label(id, name, color, textColor, description, descriptionHtml, openIssuesCount, closedIssuesCount,
				openMergeRequestsCount, subscribed, priority, isProjectLabel);
	}

}
