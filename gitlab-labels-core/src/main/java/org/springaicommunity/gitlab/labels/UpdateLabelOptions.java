package org.springaicommunity.gitlab.labels;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Options for updating a project label. Every field is optional; only fields that are set
 * are sent, so an explicit empty description clears it while an unset one leaves it
 * unchanged.
 *
 * @param name the current label name (GitLab's legacy way of addressing the label)
 * @param newName the new label name
 * @param color the new color
 * @param description the new description
 * @param priority the new priority
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateLabelOptions(@Nullable String name, @Nullable String newName, @Nullable String color,
		@Nullable String description, @Nullable Integer priority) {

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link UpdateLabelOptions}.
	 */
	public static final class Builder {

		private @Nullable String name;

		private @Nullable String newName;

		private @Nullable String color;

		private @Nullable String description;

		private @Nullable Integer priority;

		private Builder() {
		}

		public Builder name(String name) {
			this.name = name;
			return this;
		}

		public Builder newName(String newName) {
			this.newName = newName;
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

		public UpdateLabelOptions build() {
			return new UpdateLabelOptions(name, newName, color, description, priority);
		}

	}

}
