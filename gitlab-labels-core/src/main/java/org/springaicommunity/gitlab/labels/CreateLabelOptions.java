package org.springaicommunity.gitlab.labels;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Options for creating a project label. Only fields that are set are sent.
 *
 * @param name the label name (required by GitLab)
 * @param color the label color (required by GitLab)
 * @param description an optional description
 * @param priority an optional priority; must be zero or greater
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateLabelOptions(@Nullable String name, @Nullable String color, @Nullable String description,
		@Nullable Integer priority) {

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link CreateLabelOptions}.
	 */
	public static final class Builder {

		private @Nullable String name;

		private @Nullable String color;

		private @Nullable String description;

		private @Nullable Integer priority;

		private Builder() {
		}

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder color(String color) {
			this.color = color;
			return this;
		}

		public Builder description(String description) {
			this.description = description;
			return this;
		}

		public Builder priority(int priority) {
			this.priority = priority;
			return this;
		}

		public CreateLabelOptions build() {
			return new CreateLabelOptions(name, color, description, priority);
		}

	}

}
