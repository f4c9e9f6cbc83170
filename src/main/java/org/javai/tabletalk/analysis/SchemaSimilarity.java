package org.javai.tabletalk.analysis;

import java.util.List;

/**
 * Jaccard similarity of two files' column-name sets.
 */
public record SchemaSimilarity(String file1, String file2, double similarity, List<String> sharedColumns) {

	public SchemaSimilarity {
		if (similarity < 0.0 || similarity > 1.0) {
			throw new IllegalArgumentException("similarity must be in [0, 1]: " + similarity);
		}
		sharedColumns = List.copyOf(sharedColumns);
	}
}
