package org.springaicommunity.gitlab.labels;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Options for deleting a project label.
 *
 * @param name the label name, sent in the request body when set
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeleteLabelOptions(@Nullable String name) {

	public static DeleteLabelOptions named(String name) {
		return new DeleteLabelOptions(name);
	}

}
