package org.javai.tabletalk.resolve;

import java.util.List;

/**
 * What a strategy gets to work with: the user's question and the names of the scanned files.
 */
public record QueryContext(String query, List<String> availableFiles) {

	public QueryContext {
		query = query != null ? query.trim() : "";
		availableFiles = availableFiles != null ? List.copyOf(availableFiles) : List.of();
	}
}
