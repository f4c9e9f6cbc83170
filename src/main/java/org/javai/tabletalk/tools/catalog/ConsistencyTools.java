package org.javai.tabletalk.tools.catalog;

import java.util.Locale;
import java.util.Objects;
import org.javai.tabletalk.analysis.ConsistencyAnalyzer;
import org.javai.tabletalk.analysis.RelationshipAnalyzer;
import org.javai.tabletalk.analysis.SchemaSnapshot;
import org.javai.tabletalk.error.EmbeddingUnavailableException;
import org.javai.tabletalk.schema.SchemaStore;
import org.javai.tabletalk.tools.api.AnalysisTool;
import org.javai.tabletalk.tools.api.ToolParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consistency checks across file schemas.
 */
public class ConsistencyTools {

	private static final Logger logger = LoggerFactory.getLogger(ConsistencyTools.class);

	public enum ConsistencyCheck {
		DATA_TYPES, NAMING_PATTERNS, SEMANTIC_NAMING, CONCEPT_CONSISTENCY, ABBREVIATION_DETECTION;

		@Override
		public String toString() {
			return name().toLowerCase(Locale.ROOT);
		}
	}

	private final SchemaStore store;
	private final RelationshipAnalyzer relationships;
	private final ConsistencyAnalyzer consistency;

	public ConsistencyTools(SchemaStore store, RelationshipAnalyzer relationships, ConsistencyAnalyzer consistency) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.relationships = Objects.requireNonNull(relationships, "relationships must not be null");
		this.consistency = Objects.requireNonNull(consistency, "consistency must not be null");
	}

	@AnalysisTool(name = "detect_inconsistencies",
			description = "Detect type mismatches, naming inconsistencies, abbreviations or concepts stored with different types")
	public String detectInconsistencies(
			@ToolParameter(name = "check_type", required = false, defaultValue = "data_types",
					description = "Which check to run") ConsistencyCheck checkType,
			@ToolParameter(name = "threshold", required = false, defaultValue = "0.8",
					description = "Similarity threshold (0-1) for the semantic checks") double threshold) {
		SchemaSnapshot snapshot = SchemaSnapshot.of(store);
		if (snapshot.isEmpty()) {
			return ReportFormatter.NO_DATA;
		}
		switch (checkType) {
			case DATA_TYPES:
				return ReportFormatter.typeMismatches(relationships.detectTypeMismatches(snapshot));
			case NAMING_PATTERNS:
				return namingPatterns(snapshot);
			case CONCEPT_CONSISTENCY:
				return ReportFormatter.issues("Concepts stored with different types",
						consistency.checkConceptTypeConsistency(snapshot),
						"Every concept uses a single data type.");
			case SEMANTIC_NAMING:
				try {
					return ReportFormatter.issues("Naming inconsistencies",
							consistency.detectNamingInconsistencies(snapshot, threshold),
							"No naming inconsistencies found.");
				}
				catch (EmbeddingUnavailableException e) {
					logger.warn("Semantic naming check unavailable, using naming patterns: {}", e.getMessage());
					return "Semantic naming analysis is unavailable; showing naming pattern checks instead.\n\n"
							+ namingPatterns(snapshot);
				}
			default:
				try {
					return ReportFormatter.issues("Possible abbreviations",
							consistency.detectAbbreviations(snapshot, threshold),
							"No abbreviated column names found.");
				}
				catch (EmbeddingUnavailableException e) {
					return "Abbreviation detection is unavailable: " + e.getMessage();
				}
		}
	}

	private String namingPatterns(SchemaSnapshot snapshot) {
		return ReportFormatter.issues("Naming style variations",
				consistency.detectNamingStyleVariations(snapshot),
				"No naming style variations found.");
	}
}
