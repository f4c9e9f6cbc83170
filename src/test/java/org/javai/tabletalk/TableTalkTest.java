package org.javai.tabletalk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.time.Duration;
import org.apache.logging.log4j.Level;
import org.javai.tabletalk.config.TableTalkConfig;
import org.javai.tabletalk.config.TableTalkConfig.EmbeddingSettings;
import org.javai.tabletalk.config.TableTalkConfig.InferenceSettings;
import org.javai.tabletalk.config.TableTalkConfig.StoreSettings;
import org.javai.tabletalk.inference.ChatReply;
import org.javai.tabletalk.inference.InferenceClient;
import org.javai.tabletalk.resolve.StrategyKind;
import org.javai.tabletalk.semantic.SemanticMatcher;
import org.javai.tabletalk.testsupport.LogCaptorAppender;
import org.javai.tabletalk.testsupport.SchemaFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TableTalkTest {

	private final InferenceClient client = mock(InferenceClient.class);

	@BeforeEach
	void setUp() {
		when(client.modelId()).thenReturn("phi4-mini:latest");
		when(client.isReachable()).thenReturn(false);
	}

	private static TableTalkConfig config(String strategy, boolean synthesize) {
		return new TableTalkConfig(
				new InferenceSettings("http://127.0.0.1:1", "phi4-mini:latest", null, Duration.ofSeconds(1), 0.1,
						strategy, false, synthesize),
				new EmbeddingSettings(false, null, null, null),
				null,
				null);
	}

	private TableTalk.Builder builder(TableTalkConfig config) {
		return TableTalk.builder()
				.config(config)
				.store(SchemaFixtures.ordersAndLegacyUsers())
				.inferenceClient(client)
				.semanticMatcher(SemanticMatcher.unavailable());
	}

	@Test
	void askUsesTheFilesInTheStore() {
		TableTalk tableTalk = builder(config("auto", false)).build();

		assertThat(tableTalk.availableFiles()).containsExactly("legacy_users.csv", "orders.csv");
		assertThat(tableTalk.ask("describe orders"))
				.contains("orders.csv")
				.contains("customer_id")
				.contains("price");
	}

	@Test
	void configuredStrategyIsTriedFirst() {
		TableTalk tableTalk = builder(config("structured_output", false)).build();

		assertThat(tableTalk.resolver().chain()).startsWith(StrategyKind.STRUCTURED_OUTPUT);
		assertThat(tableTalk.getStatus().activeStrategy()).isEqualTo(StrategyKind.PATTERN_MATCHING);
	}

	@Test
	void sqlGenerationStaysOffUnlessConfigured() {
		TableTalk tableTalk = builder(config("auto", false)).build();

		assertThat(tableTalk.resolver().chain()).containsExactly(StrategyKind.FUNCTION_CALLING,
				StrategyKind.STRUCTURED_OUTPUT, StrategyKind.SQL_GENERATION, StrategyKind.PATTERN_MATCHING);
		assertThat(tableTalk.registry().contains("execute_sql")).isFalse();
	}

	@Test
	void unknownStrategyFallsBackToAutomaticOrder() {
		try (LogCaptorAppender captor = LogCaptorAppender.create(TableTalk.class, Level.WARN)) {
			TableTalk tableTalk = builder(config("telepathy", false)).build();

			assertThat(tableTalk.resolver().chain()).startsWith(StrategyKind.FUNCTION_CALLING);
			assertThat(captor.messagesAt(Level.WARN)).containsExactly(
					"Unknown strategy 'telepathy' configured; using automatic selection");
		}
	}

	@Test
	void synthesisRewritesAnswersThroughTheModel() {
		when(client.chat(anyList())).thenReturn(ChatReply.text("  customer_id is an integer in orders.csv only.  "));
		TableTalk tableTalk = builder(config("auto", true)).build();

		assertThat(tableTalk.ask("detect type mismatches")).isEqualTo("customer_id is an integer in orders.csv only.");
	}

	@Test
	void storeIsRequired() {
		assertThatThrownBy(() -> TableTalk.builder().inferenceClient(client).build())
				.isInstanceOf(NullPointerException.class)
				.hasMessage("store must be set");
	}

	@Test
	void openCreatesTheConfiguredDuckDbStore(@TempDir Path dir) {
		Path database = dir.resolve("metadata.duckdb");
		TableTalkConfig base = config("auto", false);
		TableTalkConfig config = new TableTalkConfig(base.inference(), base.embedding(), null,
				new StoreSettings(database.toString()));

		TableTalk tableTalk = TableTalk.open(config);

		assertThat(database).exists();
		assertThat(tableTalk.registry().contains("execute_sql")).isTrue();
		assertThat(tableTalk.getStatus().semanticAvailable()).isFalse();
		assertThat(tableTalk.ask("show me all files")).isEqualTo("No files have been scanned yet. Scan a directory first.");
	}
}
