package org.javai.tabletalk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.javai.tabletalk.error.InferenceTimeoutException;
import org.javai.tabletalk.error.SchemaStoreException;
import org.javai.tabletalk.error.UnsafeSqlException;
import org.javai.tabletalk.inference.ChatReply;
import org.javai.tabletalk.inference.InferenceClient;
import org.javai.tabletalk.inference.ToolCallRequest;
import org.javai.tabletalk.resolve.FunctionCallingStrategy;
import org.javai.tabletalk.resolve.PatternMatchingStrategy;
import org.javai.tabletalk.resolve.PlanResolver;
import org.javai.tabletalk.resolve.SqlGenerationStrategy;
import org.javai.tabletalk.resolve.StrategyKind;
import org.javai.tabletalk.resolve.StructuredOutputStrategy;
import org.javai.tabletalk.schema.ColumnDescriptor;
import org.javai.tabletalk.schema.DataType;
import org.javai.tabletalk.schema.DuckDbSchemaStore;
import org.javai.tabletalk.schema.SchemaStore;
import org.javai.tabletalk.semantic.SemanticMatcher;
import org.javai.tabletalk.testsupport.LogCaptorAppender;
import org.javai.tabletalk.testsupport.SchemaFixtures;
import org.javai.tabletalk.tools.ToolRegistry;
import org.javai.tabletalk.tools.catalog.ToolCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Walks the full strategy chain over real tools; only the model endpoint is mocked.
 */
class QueryResolverTest {

	private static final List<String> FILES = List.of("legacy_users.csv", "orders.csv");
	private static final String TYPE_MISMATCHES = """
			Found 1 column(s) with type mismatches:
			  customer_id:
			    integer: orders.csv
			    string: legacy_users.csv""";
	private static final String TYPE_CHECK_PLAN =
			"{\"tool\": \"detect_inconsistencies\", \"parameters\": {\"check_type\": \"data_types\"}}";

	private final InferenceClient client = mock(InferenceClient.class);

	@BeforeEach
	void setUp() {
		when(client.modelId()).thenReturn("llama3.2");
	}

	private QueryResolver resolver(SchemaStore store, boolean functionCalling, boolean sqlEnabled,
			StrategyKind preferred, ResponseSynthesizer synthesizer) {
		ToolRegistry registry = ToolCatalog.create(store, SemanticMatcher.unavailable(), null);
		PlanResolver planResolver = new PlanResolver(registry);
		return new QueryResolver(List.of(
				new PatternMatchingStrategy(planResolver),
				new SqlGenerationStrategy(client, planResolver, sqlEnabled),
				new StructuredOutputStrategy(client, planResolver),
				new FunctionCallingStrategy(client, planResolver, functionCalling)),
				preferred, registry, synthesizer, () -> false);
	}

	private QueryResolver resolver(boolean functionCalling) {
		return resolver(SchemaFixtures.ordersAndLegacyUsers(), functionCalling, false, null, null);
	}

	@Nested
	@DisplayName("strategy chain")
	class Chain {

		@Test
		void ordersByPriorityWithPatternMatchingLast() {
			assertThat(resolver(false).chain()).containsExactly(StrategyKind.FUNCTION_CALLING,
					StrategyKind.STRUCTURED_OUTPUT, StrategyKind.SQL_GENERATION, StrategyKind.PATTERN_MATCHING);
		}

		@Test
		void preferredStrategyGoesFirst() {
			QueryResolver resolver = resolver(SchemaFixtures.ordersAndLegacyUsers(), false, true,
					StrategyKind.SQL_GENERATION, null);

			assertThat(resolver.chain()).containsExactly(StrategyKind.SQL_GENERATION, StrategyKind.FUNCTION_CALLING,
					StrategyKind.STRUCTURED_OUTPUT, StrategyKind.PATTERN_MATCHING);
		}

		@Test
		void patternMatchingCannotBeMovedForward() {
			QueryResolver resolver = resolver(SchemaFixtures.ordersAndLegacyUsers(), false, false,
					StrategyKind.PATTERN_MATCHING, null);

			assertThat(resolver.chain()).endsWith(StrategyKind.PATTERN_MATCHING);
			assertThat(resolver.chain()).startsWith(StrategyKind.FUNCTION_CALLING);
		}

		@Test
		void patternMatchingIsRequired() {
			ToolRegistry registry = ToolCatalog.create(SchemaFixtures.ordersAndLegacyUsers(), SemanticMatcher.unavailable(), null);
			PlanResolver planResolver = new PlanResolver(registry);

			assertThatThrownBy(() -> new QueryResolver(List.of(new StructuredOutputStrategy(client, planResolver)),
					null, registry, null, null))
					.isInstanceOf(IllegalArgumentException.class)
					.hasMessageContaining("pattern matching");
		}
	}

	@Nested
	@DisplayName("resolution")
	class Resolution {

		@Test
		void functionCallingAnswersWhenTheModelCallsATool() {
			when(client.chat(anyList(), anyList())).thenReturn(new ChatReply("",
					List.of(new ToolCallRequest("detect_inconsistencies", "{\"check_type\": \"data_types\"}"))));

			ResolutionResult result = resolver(true).resolve("detect type mismatches", FILES);

			assertThat(result.response()).isEqualTo(TYPE_MISMATCHES);
			assertThat(result.plan().strategy()).isEqualTo(StrategyKind.FUNCTION_CALLING);
			assertThat(result.plan().fallback()).isFalse();
			assertThat(result.metrics().successfulStrategy()).isEqualTo(StrategyKind.FUNCTION_CALLING);
			assertThat(result.metrics().attempts()).hasSize(1);
			verify(client, never()).chat(anyList());
		}

		@Test
		void planFailureFallsBackToTheNextStrategyWithAWarning() {
			when(client.chat(anyList(), anyList())).thenReturn(ChatReply.text("There are some mismatches."));
			when(client.isReachable()).thenReturn(true);
			when(client.chat(anyList())).thenReturn(ChatReply.text(TYPE_CHECK_PLAN));

			ResolutionResult result;
			try (LogCaptorAppender captor = LogCaptorAppender.create(QueryResolver.class, Level.WARN)) {
				result = resolver(true).resolve("detect type mismatches", FILES);

				assertThat(captor.messagesAt(Level.WARN))
						.anyMatch(message -> message.contains("Strategy function_calling failed to plan")
								&& message.contains("Model answered without calling a tool"));
			}

			assertThat(result.response()).isEqualTo(TYPE_MISMATCHES);
			assertThat(result.plan().strategy()).isEqualTo(StrategyKind.STRUCTURED_OUTPUT);
			assertThat(result.plan().fallback()).isTrue();
			assertThat(result.metrics().attempts())
					.extracting(AttemptRecord::strategy, AttemptRecord::outcome)
					.containsExactly(
							tuple(StrategyKind.FUNCTION_CALLING, AttemptOutcome.PARSE_FAILED),
							tuple(StrategyKind.STRUCTURED_OUTPUT, AttemptOutcome.SUCCESS));
		}

		@Test
		void unreachableModelIsSkippedAndPatternMatchingAnswers() {
			when(client.isReachable()).thenReturn(false);

			ResolutionResult result = resolver(false).resolve("detect type mismatches", FILES);

			assertThat(result.response()).isEqualTo(TYPE_MISMATCHES);
			assertThat(result.plan().strategy()).isEqualTo(StrategyKind.PATTERN_MATCHING);
			assertThat(result.plan().fallback()).isFalse();
			assertThat(result.metrics().attempts()).extracting(AttemptRecord::outcome).containsExactly(
					AttemptOutcome.SKIPPED, AttemptOutcome.SKIPPED, AttemptOutcome.SKIPPED, AttemptOutcome.SUCCESS);
			assertThat(result.metrics().totalAttempts()).isEqualTo(1);
			verify(client, never()).chat(anyList());
		}

		@Test
		void timeoutIsRecordedAndFallsBack() {
			when(client.chat(anyList(), anyList()))
					.thenThrow(new InferenceTimeoutException("Inference endpoint did not answer: timed out", null));
			when(client.isReachable()).thenReturn(false);

			ResolutionResult result = resolver(true).resolve("detect type mismatches", FILES);

			assertThat(result.plan().strategy()).isEqualTo(StrategyKind.PATTERN_MATCHING);
			assertThat(result.plan().fallback()).isTrue();
			assertThat(result.metrics().attempts().get(0).outcome()).isEqualTo(AttemptOutcome.TIMEOUT);
			assertThat(result.metrics().attempts().get(0).errorDetails()).contains("timed out");
		}

		@Test
		void unregisteredToolIsAValidationFailure() {
			when(client.isReachable()).thenReturn(true);
			when(client.chat(anyList())).thenReturn(ChatReply.text("{\"tool\": \"drop_table\"}"));

			ResolutionResult result = resolver(false).resolve("show me all files", FILES);

			assertThat(result.metrics().attempts())
					.extracting(AttemptRecord::strategy, AttemptRecord::outcome)
					.containsExactly(
							tuple(StrategyKind.FUNCTION_CALLING, AttemptOutcome.SKIPPED),
							tuple(StrategyKind.STRUCTURED_OUTPUT, AttemptOutcome.VALIDATION_FAILED),
							tuple(StrategyKind.SQL_GENERATION, AttemptOutcome.SKIPPED),
							tuple(StrategyKind.PATTERN_MATCHING, AttemptOutcome.SUCCESS));
			assertThat(result.plan().toolName()).isEqualTo("get_files");
		}

		@Test
		void unexpectedStrategyErrorsAlsoFallBack() {
			when(client.chat(anyList(), anyList())).thenThrow(new IllegalStateException("boom"));
			when(client.isReachable()).thenThrow(new IllegalStateException("probe crashed"));

			ResolutionResult result = resolver(true).resolve("detect type mismatches", FILES);

			assertThat(result.succeeded()).isTrue();
			assertThat(result.metrics().attempts()).extracting(AttemptRecord::outcome).containsExactly(
					AttemptOutcome.PARSE_FAILED, AttemptOutcome.SKIPPED, AttemptOutcome.SKIPPED, AttemptOutcome.SUCCESS);
			assertThat(result.metrics().attempts().get(0).errorDetails()).contains("boom");
		}

		@Test
		void synthesizerRewritesTheToolOutput() {
			when(client.isReachable()).thenReturn(false);
			QueryResolver resolver = resolver(SchemaFixtures.ordersAndLegacyUsers(), false, false, null,
					(query, plan, output) -> "[" + plan.toolName() + "] " + output.lines().findFirst().orElse(""));

			assertThat(resolver.resolveAndExecute("detect type mismatches", FILES))
					.isEqualTo("[detect_inconsistencies] Found 1 column(s) with type mismatches:");
		}

		@Test
		void failingSynthesizerFallsBackToTheToolOutput() {
			when(client.isReachable()).thenReturn(false);
			QueryResolver resolver = resolver(SchemaFixtures.ordersAndLegacyUsers(), false, false, null,
					(query, plan, output) -> {
						throw new IllegalStateException("synthesis down");
					});

			try (LogCaptorAppender logs = LogCaptorAppender.create(QueryResolver.class, Level.WARN)) {
				ResolutionResult result = resolver.resolve("detect type mismatches", FILES);

				assertThat(result.response()).isEqualTo(TYPE_MISMATCHES);
				assertThat(result.metrics().successfulStrategy()).isEqualTo(StrategyKind.PATTERN_MATCHING);
				assertThat(logs.messagesAt(Level.WARN)).anyMatch(m -> m.startsWith("Response synthesis failed"));
			}
		}
	}

	@Test
	void blankQuestionGetsHelp() {
		QueryResolver resolver = resolver(false);

		ResolutionResult result = resolver.resolve("   ", FILES);

		assertThat(result.response())
				.startsWith("Ask questions about your scanned data files")
				.contains("Active strategy: pattern_matching")
				.contains("Semantic matching: unavailable");
		assertThat(result.plan()).isNull();
		assertThat(result.metrics().attempts()).isEmpty();
		verify(client, never()).chat(anyList());
	}

	@Test
	void failureOfTheLastToolBecomesAUserMessage() {
		SchemaStore broken = mock(SchemaStore.class);
		when(broken.listAllFiles()).thenThrow(new SchemaStoreException("Cannot read schema_info",
				new SQLException("database is locked")));
		when(client.isReachable()).thenReturn(false);

		ResolutionResult result = resolver(broken, false, false, null, null).resolve("show me all files", FILES);

		assertThat(result.succeeded()).isFalse();
		assertThat(result.plan()).isNull();
		assertThat(result.response()).isEqualTo("Cannot read schema_info\nSuggestion: "
				+ "Check that files have been scanned and the metadata database is readable.");
		assertThat(result.metrics().finalAttempt().outcome()).isEqualTo(AttemptOutcome.EXECUTION_FAILED);
	}

	@Test
	void statusReportsTheFirstAvailableStrategy() {
		when(client.isReachable()).thenReturn(false);

		assertThat(resolver(true).getStatus().activeStrategy()).isEqualTo(StrategyKind.FUNCTION_CALLING);
		ResolverStatus status = resolver(false).getStatus();
		assertThat(status.activeStrategy()).isEqualTo(StrategyKind.PATTERN_MATCHING);
		assertThat(status.capabilities()).contains("get_files", "detect_inconsistencies").doesNotContain("execute_sql");
		assertThat(status.semanticAvailable()).isFalse();
	}

	@Nested
	@DisplayName("SQL generation")
	class SqlGeneration {

		@TempDir
		Path tempDir;

		private DuckDbSchemaStore store() {
			DuckDbSchemaStore store = new DuckDbSchemaStore(tempDir.resolve("meta.duckdb")).initialize();
			store.storeFileSchema("orders.csv", List.of(ColumnDescriptor.of("orders.csv", "order_id", DataType.INTEGER)));
			return store;
		}

		@Test
		void failedQueryIsRegeneratedWithinTheStrategy() {
			when(client.chat(anyList())).thenReturn(
					ChatReply.text("SELECT filename FROM schema_info"),
					ChatReply.text("SELECT DISTINCT file_name FROM schema_info"));
			QueryResolver resolver = resolver(store(), false, true, StrategyKind.SQL_GENERATION, null);

			ResolutionResult result = resolver.resolve("which files are there", List.of("orders.csv"));

			assertThat(result.response()).isEqualTo(
					"SQL Query: SELECT DISTINCT file_name FROM schema_info\n\nResults:\n  file_name\n  orders.csv");
			assertThat(result.plan().intent()).isEqualTo("Answer with simplified SQL");
			assertThat(result.plan().fallback()).isTrue();
			assertThat(result.metrics().attempts())
					.extracting(AttemptRecord::attemptWithinStrategy, AttemptRecord::outcome)
					.containsExactly(tuple(1, AttemptOutcome.EXECUTION_FAILED), tuple(2, AttemptOutcome.SUCCESS));
		}

		@Test
		void exhaustedRegenerationsFallThroughToPatternMatching() {
			when(client.chat(anyList())).thenReturn(ChatReply.text("SELECT filename FROM schema_info"));
			when(client.isReachable()).thenReturn(false);
			QueryResolver resolver = resolver(store(), false, true, StrategyKind.SQL_GENERATION, null);

			ResolutionResult result = resolver.resolve("list the files", List.of("orders.csv"));

			assertThat(result.plan().strategy()).isEqualTo(StrategyKind.PATTERN_MATCHING);
			assertThat(result.plan().fallback()).isTrue();
			assertThat(result.metrics().attempts())
					.extracting(AttemptRecord::strategy, AttemptRecord::attemptWithinStrategy, AttemptRecord::outcome)
					.containsExactly(
							tuple(StrategyKind.SQL_GENERATION, 1, AttemptOutcome.EXECUTION_FAILED),
							tuple(StrategyKind.SQL_GENERATION, 2, AttemptOutcome.EXECUTION_FAILED),
							tuple(StrategyKind.SQL_GENERATION, 3, AttemptOutcome.EXECUTION_FAILED),
							tuple(StrategyKind.FUNCTION_CALLING, 1, AttemptOutcome.SKIPPED),
							tuple(StrategyKind.STRUCTURED_OUTPUT, 1, AttemptOutcome.SKIPPED),
							tuple(StrategyKind.PATTERN_MATCHING, 1, AttemptOutcome.SUCCESS));
			verify(client, times(3)).chat(anyList());
		}

		@Test
		void unexpectedFailureWhileRegeneratingFallsThroughToPatternMatching() {
			when(client.chat(anyList()))
					.thenReturn(ChatReply.text("SELECT filename FROM schema_info"))
					.thenThrow(new IllegalStateException("boom"));
			when(client.isReachable()).thenReturn(false);
			QueryResolver resolver = resolver(store(), false, true, StrategyKind.SQL_GENERATION, null);

			ResolutionResult result = resolver.resolve("list the files", List.of("orders.csv"));

			assertThat(result.plan().strategy()).isEqualTo(StrategyKind.PATTERN_MATCHING);
			assertThat(result.metrics().attempts())
					.extracting(AttemptRecord::strategy, AttemptRecord::attemptWithinStrategy, AttemptRecord::outcome)
					.startsWith(
							tuple(StrategyKind.SQL_GENERATION, 1, AttemptOutcome.EXECUTION_FAILED),
							tuple(StrategyKind.SQL_GENERATION, 2, AttemptOutcome.PARSE_FAILED));
			assertThat(result.metrics().attempts().get(1).errorDetails()).contains("boom");
		}

		@Test
		void queriesReadingLocalFilesAreRefused() throws IOException {
			Path secret = Files.writeString(tempDir.resolve("secret.txt"), "TOP-SECRET-CONTENT");
			when(client.chat(anyList())).thenReturn(ChatReply.text("SELECT content FROM read_text('" + secret + "')"));
			when(client.isReachable()).thenReturn(false);
			QueryResolver resolver = resolver(store(), false, true, StrategyKind.SQL_GENERATION, null);

			ResolutionResult result = resolver.resolve("list the files", List.of("orders.csv"));

			assertThat(result.response()).doesNotContain("TOP-SECRET-CONTENT");
			assertThat(result.plan().strategy()).isEqualTo(StrategyKind.PATTERN_MATCHING);
			assertThat(result.metrics().attempts().get(0))
					.extracting(AttemptRecord::strategy, AttemptRecord::outcome)
					.containsExactly(StrategyKind.SQL_GENERATION, AttemptOutcome.PARSE_FAILED);
			assertThat(result.metrics().attempts().get(0).errorDetails()).contains("read_text");
		}

		@Test
		void executeSqlToolRefusesOtherTables() {
			ToolRegistry registry = ToolCatalog.create(store(), SemanticMatcher.unavailable(), null);

			assertThatThrownBy(() -> registry.execute("execute_sql", Map.of("sql", "SELECT * FROM duckdb_settings()")))
					.isInstanceOf(UnsafeSqlException.class)
					.hasMessageContaining("duckdb_settings");
		}
	}
}
