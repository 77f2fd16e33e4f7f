package org.springaicommunity.gitlab.labels;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Interface for the GitLab project labels API.
 *
 * <p>
 * Project and label identifiers are accepted as {@link Object} and resolved through
 * {@link ResourceId#of(Object)}: an integral number addresses a resource by ID, a string
 * by path or name. Any other value fails with {@link InvalidIdException} before a request
 * is sent.
 *
 * <p>
 * All methods issue exactly one request and throw {@link GitLabApiException} on transport
 * failure or non-2xx status, and {@link GitLabDecodeException} when a success body cannot
 * be decoded.
 */
public interface LabelsService {

	/**
	 * List the labels of a project, in the order GitLab returns them.
	 * @param pid project ID or path
	 * @param options query options (pagination and filters), or null for none
	 * @return the labels of the requested page
	 */
	ApiResponse<List<Label>> listLabels(Object pid, @Nullable ListLabelsOptions options);

	/**
	 * Get a single project label.
	 * @param pid project ID or path
	 * @param labelId label ID or name
	 * @return the label
	 */
	ApiResponse<Label> getLabel(Object pid, Object labelId);

	/**
	 * Create a project label.
	 * @param pid project ID or path
	 * @param options label attributes; name and color are required by GitLab
	 * @return the created label
	 */
	ApiResponse<Label> createLabel(Object pid, @Nullable CreateLabelOptions options);

	/**
	 * Delete a project label.
	 * @param pid project ID or path
	 * @param labelId label ID or name
	 * @param options body options, or null to send no body
	 * @return response metadata
	 */
	GitLabResponse deleteLabel(Object pid, Object labelId, @Nullable DeleteLabelOptions options);

	/**
	 * Update a project label. Only the options that are set are sent.
	 * @param pid project ID or path
	 * @param labelId label ID or name
	 * @param options new attributes
	 * @return the updated label
	 */
	ApiResponse<Label> updateLabel(Object pid, Object labelId, @Nullable UpdateLabelOptions options);

	/**
	 * Subscribe the authenticated user to a label.
	 * @param pid project ID or path
	 * @param labelId label ID or name
	 * @return the label as seen after subscribing
	 */
	ApiResponse<Label> subscribeToLabel(Object pid, Object labelId);

	/**
	 * Unsubscribe the authenticated user from a label.
	 * @param pid project ID or path
	 * @param labelId label ID or name
	 * @return response metadata
	 */
	GitLabResponse unsubscribeFromLabel(Object pid, Object labelId);

	/**
	 * Promote a project label to a group label.
	 * @param pid project ID or path
	 * @param labelId label ID or name
	 * @return response metadata
	 */
	GitLabResponse promoteLabel(Object pid, Object labelId);

}
