package org.javai.tabletalk.analysis;

import java.util.List;
import org.javai.tabletalk.schema.DataType;

/**
 * Side-by-side comparison of two file schemas.
 *
 * @param file1               left file
 * @param file2               right file
 * @param commonColumns       columns present in both, with their types on each side
 * @param onlyInFirst         columns unique to {@code file1} with no semantic equivalent
 * @param onlyInSecond        columns unique to {@code file2} with no semantic equivalent
 * @param semanticEquivalents differently named columns judged to mean the same thing
 * @param similarity          (common + equivalents) / union of column names
 * @param semanticChecked     whether semantic matching ran; {@code false} when embeddings are unavailable
 */
public record SchemaDiff(
		String file1,
		String file2,
		List<ColumnComparison> commonColumns,
		List<String> onlyInFirst,
		List<String> onlyInSecond,
		List<SemanticEquivalent> semanticEquivalents,
		double similarity,
		boolean semanticChecked
) {

	public SchemaDiff {
		commonColumns = List.copyOf(commonColumns);
		onlyInFirst = List.copyOf(onlyInFirst);
		onlyInSecond = List.copyOf(onlyInSecond);
		semanticEquivalents = List.copyOf(semanticEquivalents);
	}

	public List<ColumnComparison> typeMismatches() {
		return commonColumns.stream().filter(c -> !c.typesMatch()).toList();
	}

	public record ColumnComparison(String columnName, DataType firstType, DataType secondType) {
		public boolean typesMatch() {
			return firstType == secondType;
		}
	}

	public record SemanticEquivalent(String firstColumn, String secondColumn, double similarity) {
	}
}
