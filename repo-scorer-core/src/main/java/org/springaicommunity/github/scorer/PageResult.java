package org.springaicommunity.github.scorer;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a cursor-paginated GraphQL connection.
 *
 * @param <T> the type of items in the page
 * @param items the items of this page
 * @param endCursor cursor for fetching the next page (null if the connection is empty)
 * @param hasNextPage whether the connection reports more pages
 */
public record PageResult<T>(List<T> items, @Nullable String endCursor, boolean hasNextPage) {

	public PageResult {
		items = List.copyOf(items);
	}

}
