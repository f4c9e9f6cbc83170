package org.javai.tabletalk.tools.catalog;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.javai.tabletalk.analysis.CommonColumn;
import org.javai.tabletalk.analysis.ConceptVariants;
import org.javai.tabletalk.analysis.ConsistencyIssue;
import org.javai.tabletalk.analysis.SchemaDiff;
import org.javai.tabletalk.analysis.SchemaSimilarity;
import org.javai.tabletalk.analysis.TypeMismatch;
import org.javai.tabletalk.schema.ColumnDescriptor;
import org.javai.tabletalk.schema.DataType;
import org.javai.tabletalk.schema.DatabaseStats;
import org.javai.tabletalk.schema.FileSummary;
import org.javai.tabletalk.schema.SqlResult;
import org.javai.tabletalk.semantic.Concept;
import org.javai.tabletalk.semantic.SemanticMatch;

/**
 * Plain-text rendering of analysis results. Output is what the user reads, so it stays short and
 * free of markup.
 */
final class ReportFormatter {

	static final String NO_DATA = "No files have been scanned yet. Scan a directory first.";

	private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
			.withZone(ZoneOffset.UTC);

	private ReportFormatter() {
	}

	static String files(List<FileSummary> files) {
		StringBuilder out = new StringBuilder("Found ").append(files.size()).append(" file(s):\n");
		for (FileSummary file : files) {
			out.append(String.format(Locale.ROOT, "  %s: %d columns, %,d rows, %.2f MB%n",
					file.fileName(), file.columnCount(), file.totalRows(), file.fileSizeMb()));
		}
		return out.toString().trim();
	}

	static String fileSchema(String fileName, List<ColumnDescriptor> columns, boolean detailed) {
		StringBuilder out = new StringBuilder("Schema for ").append(fileName);
		if (!columns.isEmpty()) {
			out.append(String.format(Locale.ROOT, " (%d columns, %,d rows)", columns.size(), columns.get(0).totalRows()));
		}
		out.append(":\n");
		for (ColumnDescriptor column : columns) {
			if (detailed) {
				out.append(String.format(Locale.ROOT, "  %s: %s (%,d nulls, %,d unique)%n",
						column.columnName(), column.dataType().label(), column.nullCount(), column.uniqueCount()));
			}
			else {
				out.append("  ").append(column.columnName()).append('\n');
			}
		}
		return out.toString().trim();
	}

	static String typeMismatches(List<TypeMismatch> mismatches) {
		if (mismatches.isEmpty()) {
			return "No data type inconsistencies found. Every column name uses a single type.";
		}
		StringBuilder out = new StringBuilder("Found ").append(mismatches.size())
				.append(" column(s) with type mismatches:\n");
		for (TypeMismatch mismatch : mismatches) {
			out.append("  ").append(mismatch.columnName()).append(":\n");
			for (Map.Entry<DataType, List<String>> entry : mismatch.filesByType().entrySet()) {
				out.append("    ").append(entry.getKey().label()).append(": ")
						.append(String.join(", ", entry.getValue())).append('\n');
			}
		}
		return out.toString().trim();
	}

	static String commonColumns(List<CommonColumn> columns, int threshold) {
		if (columns.isEmpty()) {
			return "No columns appear in " + threshold + " or more files.";
		}
		StringBuilder out = new StringBuilder("Columns shared by ").append(threshold).append(" or more files:\n");
		for (CommonColumn column : columns) {
			out.append("  ").append(column.columnName()).append(" (").append(column.fileCount()).append(" files")
					.append(column.hasTypeConflict() ? ", types: " + labels(column.dataTypes()) : "")
					.append("): ").append(String.join(", ", column.files())).append('\n');
		}
		return out.toString().trim();
	}

	static String similarSchemas(List<SchemaSimilarity> pairs, double threshold) {
		if (pairs.isEmpty()) {
			return String.format(Locale.ROOT, "No file pairs with schema similarity above %.2f.", threshold);
		}
		StringBuilder out = new StringBuilder("Similar schemas:\n");
		for (SchemaSimilarity pair : pairs) {
			out.append(String.format(Locale.ROOT, "  %s <-> %s: %.0f%% similar, shared: %s%n",
					pair.file1(), pair.file2(), pair.similarity() * 100, String.join(", ", pair.sharedColumns())));
		}
		return out.toString().trim();
	}

	static String schemaDiff(SchemaDiff diff) {
		StringBuilder out = new StringBuilder(String.format(Locale.ROOT, "Schema comparison: %s vs %s (%.0f%% similar)%n",
				diff.file1(), diff.file2(), diff.similarity() * 100));
		out.append("\nCommon columns (").append(diff.commonColumns().size()).append("):\n");
		for (SchemaDiff.ColumnComparison column : diff.commonColumns()) {
			out.append(column.typesMatch() ? "  [same] " : "  [type differs] ").append(column.columnName());
			if (column.typesMatch()) {
				out.append(": ").append(column.firstType().label());
			}
			else {
				out.append(": ").append(column.firstType().label()).append(" vs ").append(column.secondType().label());
			}
			out.append('\n');
		}
		if (!diff.semanticEquivalents().isEmpty()) {
			out.append("\nSemantic equivalents:\n");
			for (SchemaDiff.SemanticEquivalent equivalent : diff.semanticEquivalents()) {
				out.append(String.format(Locale.ROOT, "  %s ~ %s (%.2f)%n",
						equivalent.firstColumn(), equivalent.secondColumn(), equivalent.similarity()));
			}
		}
		if (!diff.onlyInFirst().isEmpty()) {
			out.append("\nOnly in ").append(diff.file1()).append(": ").append(String.join(", ", diff.onlyInFirst())).append('\n');
		}
		if (!diff.onlyInSecond().isEmpty()) {
			out.append("\nOnly in ").append(diff.file2()).append(": ").append(String.join(", ", diff.onlyInSecond())).append('\n');
		}
		if (!diff.semanticChecked()) {
			out.append("\n(Semantic matching unavailable; only exact column names were compared.)");
		}
		return out.toString().trim();
	}

	static String issues(String title, List<ConsistencyIssue> issues, String noneMessage) {
		if (issues.isEmpty()) {
			return noneMessage;
		}
		StringBuilder out = new StringBuilder(title).append(" (").append(issues.size()).append("):\n");
		for (ConsistencyIssue issue : issues) {
			out.append("  ").append(issue.subject());
			if (issue.similarity() != null) {
				out.append(String.format(Locale.ROOT, " (similarity %.2f)", issue.similarity()));
			}
			out.append(":\n");
			for (ColumnDescriptor column : issue.columns()) {
				out.append("    ").append(column.fileName()).append(": ").append(column.columnName())
						.append(" (").append(column.dataType().label()).append(")\n");
			}
			out.append("    Suggestion: ").append(issue.suggestion()).append('\n');
		}
		return out.toString().trim();
	}

	static String conceptGroups(Map<Concept, List<SemanticMatch>> groups) {
		if (groups.isEmpty()) {
			return "No concept groups found.";
		}
		StringBuilder out = new StringBuilder("Semantic concept groups:\n");
		groups.forEach((concept, matches) -> {
			out.append("  ").append(concept.label()).append(" (").append(matches.size()).append(" columns):\n");
			for (SemanticMatch match : matches) {
				out.append(String.format(Locale.ROOT, "    %s in %s (%.2f)%n",
						match.columnName(), match.fileName(), match.similarity()));
			}
		});
		return out.toString().trim();
	}

	static String conceptEvolution(List<ConceptVariants> variants) {
		if (variants.isEmpty()) {
			return "Every concept uses a single column name across files.";
		}
		StringBuilder out = new StringBuilder("Concept naming across files:\n");
		for (ConceptVariants variant : variants) {
			out.append("  ").append(variant.concept().label()).append(":\n");
			variant.filesByName().forEach((name, files) ->
					out.append("    ").append(name).append(": ").append(String.join(", ", files)).append('\n'));
		}
		return out.toString().trim();
	}

	static String matches(String term, List<SemanticMatch> matches, boolean semantic) {
		if (matches.isEmpty()) {
			return "No columns found matching '" + term + "'.";
		}
		StringBuilder out = new StringBuilder(semantic ? "Semantically similar columns for '" : "Columns matching '")
				.append(term).append("':\n");
		for (SemanticMatch match : matches) {
			out.append("  ").append(match.columnName()).append(" in ").append(match.fileName());
			if (semantic) {
				out.append(String.format(Locale.ROOT, " (%s, %.2f)", match.matchType(), match.similarity()));
			}
			out.append('\n');
		}
		return out.toString().trim();
	}

	static String databaseStats(DatabaseStats stats) {
		if (stats.isEmpty()) {
			return NO_DATA;
		}
		return String.format(Locale.ROOT, """
				Database summary:
				  Files: %d
				  Columns: %d
				  Unique column names: %d
				  Average file size: %.2f MB
				  Last scan: %s""",
				stats.totalFiles(), stats.totalColumns(), stats.uniqueColumnNames(), stats.avgFileSizeMb(),
				stats.lastScan() != null ? TIMESTAMP.format(stats.lastScan()) : "unknown");
	}

	static String sqlResult(String sql, SqlResult result) {
		StringBuilder out = new StringBuilder("SQL Query: ").append(sql).append("\n\nResults:\n");
		if (result.isEmpty()) {
			return out.append("  (no rows)").toString();
		}
		out.append("  ").append(String.join(" | ", result.columns())).append('\n');
		for (List<Object> row : result.rows()) {
			out.append("  ").append(row.stream().map(String::valueOf).collect(Collectors.joining(" | "))).append('\n');
		}
		return out.toString().trim();
	}

	private static String labels(Iterable<DataType> types) {
		StringBuilder out = new StringBuilder();
		for (DataType type : types) {
			if (out.length() > 0) {
				out.append('/');
			}
			out.append(type.label());
		}
		return out.toString();
	}
}
