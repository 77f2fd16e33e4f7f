package org.springaicommunity.gitlab.labels;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a project or label identifier is neither an integer nor a string. Raised
 * before any request is sent.
 */
public class InvalidIdException extends GitLabException {

	private final @Nullable Object rejectedValue;

	public InvalidIdException(@Nullable Object rejectedValue) {
		super("invalid ID type " + rejectedValue + ", the ID must be an int or a string");
		this.rejectedValue = rejectedValue;
	}

	public @Nullable Object getRejectedValue() {
		return rejectedValue;
	}

}
