package org.javai.tabletalk;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.tabletalk.config.TableTalkConfig;
import org.javai.tabletalk.config.TableTalkConfig.InferenceSettings;
import org.javai.tabletalk.inference.InferenceClient;
import org.javai.tabletalk.inference.InferenceClients;
import org.javai.tabletalk.resolve.FunctionCallingStrategy;
import org.javai.tabletalk.resolve.PatternMatchingStrategy;
import org.javai.tabletalk.resolve.PlanResolver;
import org.javai.tabletalk.resolve.ResolutionStrategy;
import org.javai.tabletalk.resolve.SqlGenerationStrategy;
import org.javai.tabletalk.resolve.StrategyKind;
import org.javai.tabletalk.resolve.StructuredOutputStrategy;
import org.javai.tabletalk.schema.DuckDbSchemaStore;
import org.javai.tabletalk.schema.FileSummary;
import org.javai.tabletalk.schema.SchemaStore;
import org.javai.tabletalk.semantic.EmbeddingCache;
import org.javai.tabletalk.semantic.EmbeddingModels;
import org.javai.tabletalk.semantic.SemanticMatcher;
import org.javai.tabletalk.tools.ToolRegistry;
import org.javai.tabletalk.tools.catalog.ToolCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the surrounding application: one store, its tool catalog and the resolver over it.
 *
 * <pre>{@code
 * TableTalk tableTalk = TableTalk.open(new TableTalkConfigLoader().load());
 * String answer = tableTalk.ask("detect type mismatches");
 * }</pre>
 */
public final class TableTalk {

	private static final Logger logger = LoggerFactory.getLogger(TableTalk.class);

	private final SchemaStore store;
	private final ToolRegistry registry;
	private final QueryResolver resolver;

	private TableTalk(SchemaStore store, ToolRegistry registry, QueryResolver resolver) {
		this.store = store;
		this.registry = registry;
		this.resolver = resolver;
	}

	/**
	 * Opens the DuckDB metadata store named in the configuration and wires every collaborator from it.
	 */
	public static TableTalk open(TableTalkConfig config) {
		DuckDbSchemaStore store = new DuckDbSchemaStore(Path.of(config.store().path())).initialize();
		return builder().config(config).store(store).build();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Answers a question about the files currently in the store.
	 */
	public String ask(String query) {
		return resolveAndExecute(query, availableFiles());
	}

	public String resolveAndExecute(String query, List<String> availableFiles) {
		return resolver.resolveAndExecute(query, availableFiles);
	}

	public ResolutionResult resolve(String query, List<String> availableFiles) {
		return resolver.resolve(query, availableFiles);
	}

	public String getHelpText() {
		return resolver.getHelpText();
	}

	public ResolverStatus getStatus() {
		return resolver.getStatus();
	}

	public List<String> availableFiles() {
		return store.listAllFiles().stream().map(FileSummary::fileName).toList();
	}

	public ToolRegistry registry() {
		return registry;
	}

	public QueryResolver resolver() {
		return resolver;
	}

	public static final class Builder {

		private TableTalkConfig config = TableTalkConfig.defaults();
		private SchemaStore store;
		private InferenceClient inferenceClient;
		private SemanticMatcher semanticMatcher;
		private ResponseSynthesizer synthesizer;

		private Builder() {
		}

		public Builder config(TableTalkConfig config) {
			this.config = Objects.requireNonNull(config, "config must not be null");
			return this;
		}

		public Builder store(SchemaStore store) {
			this.store = store;
			return this;
		}

		/**
		 * Chat endpoint for the model-backed strategies. Defaults to an OpenAI-compatible client built
		 * from the inference settings.
		 */
		public Builder inferenceClient(InferenceClient inferenceClient) {
			this.inferenceClient = inferenceClient;
			return this;
		}

		/**
		 * Defaults to the local embedding model from the embedding settings, or an unavailable
		 * matcher when that model cannot be loaded.
		 */
		public Builder semanticMatcher(SemanticMatcher semanticMatcher) {
			this.semanticMatcher = semanticMatcher;
			return this;
		}

		public Builder synthesizer(ResponseSynthesizer synthesizer) {
			this.synthesizer = synthesizer;
			return this;
		}

		public TableTalk build() {
			Objects.requireNonNull(store, "store must be set");
			InferenceSettings inference = config.inference();
			SemanticMatcher matcher = semanticMatcher != null
					? semanticMatcher
					: EmbeddingModels.matcher(config.embedding(), new EmbeddingCache());
			InferenceClient client = inferenceClient != null
					? inferenceClient
					: InferenceClients.openAiCompatible(inference);

			ToolRegistry registry = ToolCatalog.create(store, matcher, config.analysis());
			PlanResolver planResolver = new PlanResolver(registry);

			Optional<StrategyKind> preferred = StrategyKind.fromTag(inference.strategy());
			if (preferred.isEmpty() && !"auto".equals(inference.strategy())) {
				logger.warn("Unknown strategy '{}' configured; using automatic selection", inference.strategy());
			}
			boolean sqlEnabled = preferred.filter(kind -> kind == StrategyKind.SQL_GENERATION).isPresent();
			List<ResolutionStrategy> strategies = List.of(
					new FunctionCallingStrategy(client, planResolver, inference.functionCalling()),
					new StructuredOutputStrategy(client, planResolver),
					new SqlGenerationStrategy(client, planResolver, sqlEnabled),
					new PatternMatchingStrategy(planResolver));

			ResponseSynthesizer effectiveSynthesizer = synthesizer != null
					? synthesizer
					: inference.synthesize() ? new ModelResponseSynthesizer(client) : ResponseSynthesizer.PASS_THROUGH;
			QueryResolver resolver = new QueryResolver(strategies, preferred.orElse(null), registry,
					effectiveSynthesizer, matcher::isAvailable);
			return new TableTalk(store, registry, resolver);
		}
	}
}
