package org.springaicommunity.gitlab.labels;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Query options for listing project labels. Only fields that are set become query
 * parameters.
 *
 * @param page the page to fetch (1-based)
 * @param perPage the number of labels per page
 * @param withCounts whether GitLab should include issue and merge request counts
 * @param includeAncestorGroups whether labels of ancestor groups are included
 * @param search keyword filter on label names
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ListLabelsOptions(@Nullable Integer page, @Nullable Integer perPage, @Nullable Boolean withCounts,
		@Nullable Boolean includeAncestorGroups, @Nullable String search) {

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Builder for {@link ListLabelsOptions}.
	 */
	public static final class Builder {

		private @Nullable Integer page;

		private @Nullable Integer perPage;

		private @Nullable Boolean withCounts;

		private @Nullable Boolean includeAncestorGroups;

		private @Nullable String search;

		private Builder() {
		}

		public Builder page(int page) {
			this.page = page;
			return this;
		}

		public Builder perPage(int perPage) {
			this.perPage = perPage;
			return this;
		}

		public Builder withCounts(boolean withCounts) {
			this.withCounts = withCounts;
			return this;
		}

		public Builder includeAncestorGroups(boolean includeAncestorGroups) {
			this.includeAncestorGroups = includeAncestorGroups;
			return this;
		}

		public Builder search(String search) {
			this.search = search;
			return this;
		}

		public ListLabelsOptions build() {
			return new ListLabelsOptions(page, perPage, withCounts, includeAncestorGroups, search);
		}

	}

}
