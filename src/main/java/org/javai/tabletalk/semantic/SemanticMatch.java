package org.javai.tabletalk.semantic;

import org.javai.tabletalk.schema.ColumnRef;

/**
 * A column that matched a search term.
 *
 * @param columnName the matched column
 * @param fileName   the file holding it
 * @param similarity cosine similarity clamped to [0, 1]
 * @param matchType  how the match was found
 */
public record SemanticMatch(String columnName, String fileName, double similarity, MatchType matchType) {

	public enum MatchType {
		SEMANTIC, EXACT, PATTERN;

		@Override
		public String toString() {
			return name().toLowerCase();
		}
	}

	public SemanticMatch {
		if (similarity < 0.0 || similarity > 1.0) {
			throw new IllegalArgumentException("similarity must be in [0, 1]: " + similarity);
		}
		if (matchType == null) {
			matchType = MatchType.SEMANTIC;
		}
	}

	public ColumnRef ref() {
		return new ColumnRef(fileName, columnName);
	}
}
