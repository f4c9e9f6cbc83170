package org.javai.tabletalk.tools.catalog;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.javai.tabletalk.analysis.ConsistencyAnalyzer;
import org.javai.tabletalk.analysis.ConsistencyIssue;
import org.javai.tabletalk.analysis.RelationshipAnalyzer;
import org.javai.tabletalk.analysis.SchemaSnapshot;
import org.javai.tabletalk.config.TableTalkConfig.AnalysisSettings;
import org.javai.tabletalk.schema.FileSummary;
import org.javai.tabletalk.schema.SchemaStore;
import org.javai.tabletalk.tools.api.AnalysisTool;
import org.javai.tabletalk.tools.api.ToolParameter;

/**
 * Free-form analysis requests routed by keyword onto the specific analyses.
 */
public class AnalysisTools {

	static final int LARGEST_FILES = 5;

	private final SchemaStore store;
	private final RelationshipAnalyzer relationships;
	private final ConsistencyAnalyzer consistency;
	private final AnalysisSettings settings;

	public AnalysisTools(SchemaStore store, RelationshipAnalyzer relationships, ConsistencyAnalyzer consistency,
			AnalysisSettings settings) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.relationships = Objects.requireNonNull(relationships, "relationships must not be null");
		this.consistency = Objects.requireNonNull(consistency, "consistency must not be null");
		this.settings = settings != null ? settings : AnalysisSettings.defaults();
	}

	@AnalysisTool(name = "run_analysis",
			description = "Run the analysis a free-form description asks for: largest files, type problems, shared columns, similar schemas or data quality")
	public String runAnalysis(
			@ToolParameter(name = "description", description = "What to analyze, in plain words") String description) {
		SchemaSnapshot snapshot = SchemaSnapshot.of(store);
		if (snapshot.isEmpty()) {
			return ReportFormatter.NO_DATA;
		}
		String text = description.toLowerCase(Locale.ROOT);
		if (text.contains("largest") || text.contains("biggest") || text.contains("size")) {
			return largestFiles(snapshot);
		}
		if (text.contains("type")) {
			return ReportFormatter.typeMismatches(relationships.detectTypeMismatches(snapshot));
		}
		if (text.contains("similar")) {
			return ReportFormatter.similarSchemas(
					relationships.findSimilarSchemas(snapshot, RelationshipTools.DEFAULT_SIMILARITY_THRESHOLD),
					RelationshipTools.DEFAULT_SIMILARITY_THRESHOLD);
		}
		if (text.contains("common") || text.contains("shared") || text.contains("relationship")) {
			return ReportFormatter.commonColumns(
					relationships.findCommonColumns(snapshot, RelationshipTools.DEFAULT_COMMON_THRESHOLD),
					RelationshipTools.DEFAULT_COMMON_THRESHOLD);
		}
		if (text.contains("quality") || text.contains("issue") || text.contains("problem")
				|| text.contains("inconsisten") || text.contains("naming")) {
			return qualityReport(snapshot);
		}
		return overview(snapshot);
	}

	private String largestFiles(SchemaSnapshot snapshot) {
		List<FileSummary> largest = relationships.largestFiles(snapshot, LARGEST_FILES);
		return ReportFormatter.files(largest).replaceFirst("^Found \\d+ file\\(s\\):", "Largest files:");
	}

	private String qualityReport(SchemaSnapshot snapshot) {
		List<ConsistencyIssue> issues = consistency.allIssues(snapshot, settings.namingThreshold());
		String report = ReportFormatter.issues("Schema quality issues", issues, "No schema quality issues found.");
		if (!consistency.semanticChecksAvailable()) {
			report += "\n(Semantic naming checks were skipped: embeddings unavailable.)";
		}
		return report;
	}

	private String overview(SchemaSnapshot snapshot) {
		return ReportFormatter.databaseStats(store.databaseStats())
				+ "\n\n" + ReportFormatter.typeMismatches(relationships.detectTypeMismatches(snapshot))
				+ "\n\n" + ReportFormatter.commonColumns(
						relationships.findCommonColumns(snapshot, RelationshipTools.DEFAULT_COMMON_THRESHOLD),
						RelationshipTools.DEFAULT_COMMON_THRESHOLD);
	}
}
