package org.javai.tabletalk.resolve;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.javai.tabletalk.error.InvalidParametersException;
import org.javai.tabletalk.error.UnknownToolException;
import org.javai.tabletalk.semantic.SemanticMatcher;
import org.javai.tabletalk.testsupport.SchemaFixtures;
import org.javai.tabletalk.tools.ToolRegistry;
import org.javai.tabletalk.tools.catalog.ToolCatalog;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class PlanResolverTest {

	private static final List<String> FILES = List.of("legacy_users.csv", "orders.csv");

	private final ToolRegistry registry = ToolCatalog.create(SchemaFixtures.ordersAndLegacyUsers(),
			SemanticMatcher.unavailable(), null);
	private final PlanResolver resolver = new PlanResolver(registry);

	private ResolutionPlan resolve(String tool, Map<String, ?> parameters, String query) {
		return resolver.resolve(tool, parameters, new QueryContext(query, FILES), StrategyKind.STRUCTURED_OUTPUT,
				null, null);
	}

	@Test
	void unknownToolIsRejected() {
		assertThatThrownBy(() -> resolve("drop_everything", Map.of(), "drop everything"))
				.isInstanceOf(UnknownToolException.class);
	}

	@Test
	void missingRequiredParameterIsRejected() {
		assertThatThrownBy(() -> resolve("get_file_schema", Map.of(), "describe the file"))
				.isInstanceOf(InvalidParametersException.class)
				.hasMessageContaining("file_name");
	}

	@Test
	void recordsStrategyAndFallsBackToToolDescriptionForIntent() {
		ResolutionPlan plan = resolve("get_files", Map.of(), "what do we have");

		assertThat(plan.strategy()).isEqualTo(StrategyKind.STRUCTURED_OUTPUT);
		assertThat(plan.intent()).isEqualTo(registry.descriptor("get_files").orElseThrow().description());
		assertThat(plan.fallback()).isFalse();
		assertThat(plan).hasToString("structured_output -> get_files{}");
	}

	@Test
	void nullValuesAndUnknownKeysAreDropped() {
		Map<String, Object> raw = new HashMap<>();
		raw.put("pattern", null);
		raw.put("colour", "blue");

		assertThat(resolve("get_files", raw, "list files").parameters()).isEmpty();
	}

	@Nested
	@DisplayName("file names")
	class FileNames {

		@Test
		void fileNameWithoutExtensionGetsCsv() {
			assertThat(resolve("get_file_schema", Map.of("file_name", "orders"), "describe orders").parameters())
					.containsEntry("file_name", "orders.csv");
		}

		@Test
		void missingFileArgumentIsTakenFromTheQuestion() {
			ResolutionPlan plan = resolve("compare_items", Map.of("item1", "orders.csv"),
					"compare orders.csv and legacy_users");

			assertThat(plan.parameters())
					.containsEntry("item1", "orders.csv")
					.containsEntry("item2", "legacy_users.csv")
					.containsEntry("comparison_type", "schemas");
		}
	}

	@Nested
	@DisplayName("defaults")
	class Defaults {

		@Test
		void declaredDefaultsFillMissingOptionalParameters() {
			ResolutionPlan plan = resolve("detect_inconsistencies", Map.of(), "check things");

			assertThat(plan.parameters())
					.containsEntry("check_type", "data_types")
					.containsEntry("threshold", 0.8);
		}

		@Test
		void multiWordAllowedValueIsTakenFromTheQuestion() {
			assertThat(resolve("find_relationships", Map.of(), "find similar schemas").parameters())
					.containsEntry("analysis_type", "similar_schemas");
			assertThat(resolve("detect_inconsistencies", Map.of(), "detect abbreviations").parameters())
					.containsEntry("check_type", "abbreviation_detection");
		}

		@Test
		void singleWordAllowedValueIsNotDerived() {
			assertThat(resolve("search_metadata", Map.of("search_term", "id"), "which files have id").parameters())
					.containsEntry("search_type", "column");
		}

		@Test
		void similarityThresholdOnlyTakesUnitNumbers() {
			ResolutionPlan plan = resolve("detect_inconsistencies", Map.of("check_type", "semantic_naming"),
					"top 5 naming issues at 0.85.");

			assertThat(plan.parameters()).containsEntry("threshold", 0.85);
		}

		@Test
		void fileCountThresholdTakesAnyNumber() {
			ResolutionPlan plan = resolve("find_relationships", Map.of("analysis_type", "common_columns"),
					"columns in at least 3 files");

			assertThat(plan.parameters()).containsEntry("threshold", 3.0);
		}

		@Test
		void explicitArgumentsWin() {
			ResolutionPlan plan = resolve("detect_inconsistencies",
					Map.of("check_type", "naming_patterns", "threshold", 0.6), "similar schema naming at 0.9");

			assertThat(plan.parameters())
					.containsEntry("check_type", "naming_patterns")
					.containsEntry("threshold", 0.6);
		}
	}

	@Test
	void outOfRangeConfidenceIsDropped() {
		QueryContext context = new QueryContext("list files", FILES);

		assertThat(resolver.resolve("get_files", Map.of(), context, StrategyKind.STRUCTURED_OUTPUT, "List", 1.7)
				.confidence()).isNull();
		assertThat(resolver.resolve("get_files", Map.of(), context, StrategyKind.STRUCTURED_OUTPUT, "List", 0.9)
				.confidence()).isEqualTo(0.9);
	}
}
