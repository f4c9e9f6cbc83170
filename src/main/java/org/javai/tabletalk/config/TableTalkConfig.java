package org.javai.tabletalk.config;

import java.time.Duration;
import java.util.Locale;

/**
 * Immutable runtime configuration, normally loaded by {@link TableTalkConfigLoader}.
 */
public record TableTalkConfig(
		InferenceSettings inference,
		EmbeddingSettings embedding,
		AnalysisSettings analysis,
		StoreSettings store
) {

	public TableTalkConfig {
		inference = inference != null ? inference : InferenceSettings.defaults();
		embedding = embedding != null ? embedding : EmbeddingSettings.defaults();
		analysis = analysis != null ? analysis : AnalysisSettings.defaults();
		store = store != null ? store : StoreSettings.defaults();
	}

	public static TableTalkConfig defaults() {
		return new TableTalkConfig(null, null, null, null);
	}

	/**
	 * Chat endpoint settings.
	 *
	 * @param baseUrl          OpenAI-compatible endpoint, e.g. a local Ollama server
	 * @param model            model identifier
	 * @param apiKey           key sent to the endpoint; local servers ignore it
	 * @param timeout          bound on each call
	 * @param temperature      sampling temperature for plan extraction
	 * @param strategy         {@code auto} or the tag of a strategy to try first
	 * @param functionCalling  forces function-calling support on, regardless of the model name
	 * @param synthesize       reformat tool output through the model
	 */
	public record InferenceSettings(
			String baseUrl,
			String model,
			String apiKey,
			Duration timeout,
			double temperature,
			String strategy,
			boolean functionCalling,
			boolean synthesize
	) {

		public InferenceSettings {
			if (baseUrl == null || baseUrl.isBlank()) {
				throw new IllegalArgumentException("inference.base-url must not be blank");
			}
			if (model == null || model.isBlank()) {
				throw new IllegalArgumentException("inference.model must not be blank");
			}
			if (timeout == null || timeout.isZero() || timeout.isNegative()) {
				throw new IllegalArgumentException("inference.timeout-seconds must be positive");
			}
			if (temperature < 0.0 || temperature > 2.0) {
				throw new IllegalArgumentException("inference.temperature must be in [0, 2]");
			}
			apiKey = apiKey != null ? apiKey : "ollama";
			strategy = strategy != null ? strategy.trim().toLowerCase(Locale.ROOT) : "auto";
		}

		public static InferenceSettings defaults() {
			return new InferenceSettings("http://localhost:11434", "phi4-mini:latest", "ollama", Duration.ofSeconds(30),
					0.1, "auto", false, false);
		}
	}

	/**
	 * Local embedding model settings. Resource URIs left {@code null} use the library defaults
	 * (all-MiniLM-L6-v2).
	 */
	public record EmbeddingSettings(boolean enabled, String modelUri, String tokenizerUri, String cacheDirectory) {

		public static EmbeddingSettings defaults() {
			return new EmbeddingSettings(true, null, null, null);
		}
	}

	/**
	 * Similarity thresholds for the semantic analyses.
	 */
	public record AnalysisSettings(double namingThreshold, double conceptThreshold, double searchThreshold,
								   double diffThreshold) {

		public AnalysisSettings {
			requireUnit("naming-threshold", namingThreshold);
			requireUnit("concept-threshold", conceptThreshold);
			requireUnit("search-threshold", searchThreshold);
			requireUnit("diff-threshold", diffThreshold);
		}

		public static AnalysisSettings defaults() {
			return new AnalysisSettings(0.8, 0.7, 0.6, 0.75);
		}

		private static void requireUnit(String name, double value) {
			if (value < 0.0 || value > 1.0) {
				throw new IllegalArgumentException("analysis." + name + " must be in [0, 1]: " + value);
			}
		}
	}

	public record StoreSettings(String path) {

		public StoreSettings {
			path = path != null && !path.isBlank() ? path : "database/metadata.duckdb";
		}

		public static StoreSettings defaults() {
			return new StoreSettings(null);
		}
	}
}
