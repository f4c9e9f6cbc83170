package org.javai.tabletalk.tools.catalog;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.javai.tabletalk.analysis.RelationshipAnalyzer;
import org.javai.tabletalk.analysis.SchemaDiff;
import org.javai.tabletalk.analysis.SchemaSnapshot;
import org.javai.tabletalk.config.TableTalkConfig.AnalysisSettings;
import org.javai.tabletalk.error.EmbeddingUnavailableException;
import org.javai.tabletalk.schema.SchemaStore;
import org.javai.tabletalk.tools.api.AnalysisTool;
import org.javai.tabletalk.tools.api.ToolParameter;

/**
 * Tools relating files to each other: shared columns, overlapping schemas, concept groups and
 * pairwise comparison.
 */
public class RelationshipTools {

	static final int DEFAULT_COMMON_THRESHOLD = 2;
	static final double DEFAULT_SIMILARITY_THRESHOLD = 0.5;

	public enum RelationshipAnalysis {
		COMMON_COLUMNS, SIMILAR_SCHEMAS, SEMANTIC_GROUPS, CONCEPT_EVOLUTION;

		@Override
		public String toString() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	public enum ComparisonType {
		SCHEMAS;

		@Override
		public String toString() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	private final SchemaStore store;
	private final RelationshipAnalyzer analyzer;
	private final AnalysisSettings settings;

	public RelationshipTools(SchemaStore store, RelationshipAnalyzer analyzer, AnalysisSettings settings) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
		this.settings = settings != null ? settings : AnalysisSettings.defaults();
	}

	@AnalysisTool(name = "find_relationships",
			description = "Find columns shared between files, files with similar schemas, or columns grouped by meaning")
	public String findRelationships(
			@ToolParameter(name = "analysis_type", required = false, defaultValue = "common_columns",
					description = "Kind of relationship to look for") RelationshipAnalysis analysisType,
			@ToolParameter(name = "threshold", required = false,
					description = "Minimum file count for common_columns, minimum similarity (0-1) otherwise")
			Double threshold) {
		SchemaSnapshot snapshot = SchemaSnapshot.of(store);
		if (snapshot.isEmpty()) {
			return ReportFormatter.NO_DATA;
		}
		switch (analysisType) {
			case COMMON_COLUMNS: {
				int minFiles = threshold != null && threshold >= 1 ? (int) Math.round(threshold) : DEFAULT_COMMON_THRESHOLD;
				return ReportFormatter.commonColumns(analyzer.findCommonColumns(snapshot, minFiles), minFiles);
			}
			case SIMILAR_SCHEMAS: {
				double minSimilarity = unitOr(threshold, DEFAULT_SIMILARITY_THRESHOLD);
				return ReportFormatter.similarSchemas(analyzer.findSimilarSchemas(snapshot, minSimilarity), minSimilarity);
			}
			case SEMANTIC_GROUPS:
				try {
					return ReportFormatter.conceptGroups(
							analyzer.conceptGroups(snapshot, unitOr(threshold, settings.conceptThreshold())));
				}
				catch (EmbeddingUnavailableException e) {
					return "Semantic grouping is unavailable: " + e.getMessage();
				}
			default:
				try {
					return ReportFormatter.conceptEvolution(
							analyzer.conceptEvolution(snapshot, unitOr(threshold, settings.conceptThreshold())));
				}
				catch (EmbeddingUnavailableException e) {
					return "Concept analysis is unavailable: " + e.getMessage();
				}
		}
	}

	@AnalysisTool(name = "compare_items", description = "Compare the schemas of two files")
	public String compareItems(
			@ToolParameter(name = "item1", description = "First file", examples = {"orders.csv"}) String item1,
			@ToolParameter(name = "item2", description = "Second file", examples = {"customers.csv"}) String item2,
			@ToolParameter(name = "comparison_type", required = false, defaultValue = "schemas",
					description = "What to compare") ComparisonType comparisonType) {
		SchemaSnapshot snapshot = SchemaSnapshot.of(store);
		if (snapshot.isEmpty()) {
			return ReportFormatter.NO_DATA;
		}
		FileLookup first = FileLookup.find(item1, snapshot.fileNames());
		if (first.match().isEmpty()) {
			return first.describeMiss();
		}
		FileLookup second = FileLookup.find(item2, snapshot.fileNames());
		if (second.match().isEmpty()) {
			return second.describeMiss();
		}
		Optional<SchemaDiff> diff = analyzer.diffSchemas(snapshot, first.match().get(), second.match().get(),
				settings.diffThreshold());
		return diff.map(ReportFormatter::schemaDiff).orElse("Could not compare " + item1 + " and " + item2 + ".");
	}

	private static double unitOr(Double value, double fallback) {
		return value != null && value >= 0.0 && value <= 1.0 ? value : fallback;
	}
}
