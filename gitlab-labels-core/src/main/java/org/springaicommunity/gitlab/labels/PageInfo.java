package org.springaicommunity.gitlab.labels;

/**
 * Offset pagination information from GitLab's response headers.
 *
 * <p>
 * GitLab omits {@code X-Total} and {@code X-Total-Pages} for very large collections and
 * sends empty {@code X-Next-Page}/{@code X-Prev-Page} on the last/first page; both cases
 * map to 0.
 *
 * @param totalItems value of {@code X-Total}
 * @param totalPages value of {@code X-Total-Pages}
 * @param itemsPerPage value of {@code X-Per-Page}
 * @param currentPage value of {@code X-Page}
 * @param nextPage value of {@code X-Next-Page}, 0 on the last page
 * @param previousPage value of {@code X-Prev-Page}, 0 on the first page
 */
public record PageInfo(int totalItems, int totalPages, int itemsPerPage, int currentPage, int nextPage,
		int previousPage) {

	static PageInfo from(GitLabResponse response) {
		return new PageInfo(intHeader(response, "X-Total"), intHeader(response, "X-Total-Pages"),
				intHeader(response, "X-Per-Page"), intHeader(response, "X-Page"), intHeader(response, "X-Next-Page"),
				intHeader(response, "X-Prev-Page"));
	}

	/**
	 * Returns true if GitLab reported a following page.
	 * @return true if there is a next page
	 */
	public boolean hasNextPage() {
		return nextPage > 0;
	}

	private static int intHeader(GitLabResponse response, String name) {
		return response.firstHeader(name).map(String::trim).filter(v -> !v.isEmpty()).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return 0;
			}
		}).orElse(0);
	}

}
