package org.javai.tabletalk.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.javai.tabletalk.config.TableTalkConfig.AnalysisSettings;
import org.javai.tabletalk.config.TableTalkConfig.EmbeddingSettings;
import org.javai.tabletalk.config.TableTalkConfig.InferenceSettings;
import org.javai.tabletalk.config.TableTalkConfig.StoreSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link TableTalkConfig} from YAML.
 * <p>
 * Sources, lowest precedence first: built-in defaults, {@code tabletalk.yml} on the classpath, an
 * optional file, then the environment variables {@code TABLETALK_BASE_URL}, {@code TABLETALK_MODEL}
 * and {@code TABLETALK_STRATEGY}.
 */
public final class TableTalkConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(TableTalkConfigLoader.class);

	public static final String CLASSPATH_RESOURCE = "tabletalk.yml";

	private final Yaml yaml = new Yaml();
	private final Map<String, String> environment;

	public TableTalkConfigLoader() {
		this(System.getenv());
	}

	public TableTalkConfigLoader(Map<String, String> environment) {
		this.environment = environment != null ? environment : Map.of();
	}

	public TableTalkConfig load() {
		return load((Path) null);
	}

	/**
	 * @param overrideFile optional YAML file laid over the classpath defaults; may be {@code null}
	 */
	public TableTalkConfig load(Path overrideFile) {
		Settings settings = new Settings();
		try (InputStream in = TableTalkConfigLoader.class.getClassLoader().getResourceAsStream(CLASSPATH_RESOURCE)) {
			if (in != null) {
				settings.apply(parse(new InputStreamReader(in, StandardCharsets.UTF_8)));
			}
		}
		catch (IOException e) {
			throw new IllegalStateException("Failed to read classpath " + CLASSPATH_RESOURCE, e);
		}
		if (overrideFile != null) {
			try (Reader reader = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
				settings.apply(parse(reader));
				logger.info("Loaded configuration from {}", overrideFile);
			}
			catch (IOException e) {
				throw new IllegalStateException("Failed to read configuration file " + overrideFile, e);
			}
		}
		settings.applyEnvironment(environment);
		return settings.build();
	}

	/**
	 * Parses one YAML document; exposed for callers that hold configuration text in memory.
	 */
	public TableTalkConfig load(Reader reader) {
		Settings settings = new Settings();
		settings.apply(parse(reader));
		settings.applyEnvironment(environment);
		return settings.build();
	}

	private Map<String, Object> parse(Reader reader) {
		Object loaded = yaml.load(reader);
		if (loaded == null) {
			return Map.of();
		}
		if (!(loaded instanceof Map<?, ?> map)) {
			throw new IllegalArgumentException("Configuration root must be a mapping");
		}
		@SuppressWarnings("unchecked")
		Map<String, Object> typed = (Map<String, Object>) map;
		return typed;
	}

	/**
	 * Mutable accumulator; the records themselves stay immutable.
	 */
	private static final class Settings {

		private final InferenceSettings inferenceDefaults = InferenceSettings.defaults();
		private String baseUrl = inferenceDefaults.baseUrl();
		private String model = inferenceDefaults.model();
		private String apiKey = inferenceDefaults.apiKey();
		private long timeoutSeconds = inferenceDefaults.timeout().toSeconds();
		private double temperature = inferenceDefaults.temperature();
		private String strategy = inferenceDefaults.strategy();
		private boolean functionCalling = inferenceDefaults.functionCalling();
		private boolean synthesize = inferenceDefaults.synthesize();

		private boolean embeddingEnabled = true;
		private String modelUri;
		private String tokenizerUri;
		private String cacheDirectory;

		private final AnalysisSettings analysisDefaults = AnalysisSettings.defaults();
		private double namingThreshold = analysisDefaults.namingThreshold();
		private double conceptThreshold = analysisDefaults.conceptThreshold();
		private double searchThreshold = analysisDefaults.searchThreshold();
		private double diffThreshold = analysisDefaults.diffThreshold();

		private String storePath;

		void apply(Map<String, Object> root) {
			Map<String, Object> inference = section(root, "inference");
			baseUrl = string(inference, "base-url", baseUrl);
			model = string(inference, "model", model);
			apiKey = string(inference, "api-key", apiKey);
			timeoutSeconds = (long) number(inference, "timeout-seconds", timeoutSeconds);
			temperature = number(inference, "temperature", temperature);
			strategy = string(inference, "strategy", strategy);
			functionCalling = bool(inference, "function-calling", functionCalling);
			synthesize = bool(inference, "synthesize", synthesize);

			Map<String, Object> embedding = section(root, "embedding");
			embeddingEnabled = bool(embedding, "enabled", embeddingEnabled);
			modelUri = string(embedding, "model-uri", modelUri);
			tokenizerUri = string(embedding, "tokenizer-uri", tokenizerUri);
			cacheDirectory = string(embedding, "cache-directory", cacheDirectory);

			Map<String, Object> analysis = section(root, "analysis");
			namingThreshold = number(analysis, "naming-threshold", namingThreshold);
			conceptThreshold = number(analysis, "concept-threshold", conceptThreshold);
			searchThreshold = number(analysis, "search-threshold", searchThreshold);
			diffThreshold = number(analysis, "diff-threshold", diffThreshold);

			storePath = string(section(root, "store"), "path", storePath);
		}

		void applyEnvironment(Map<String, String> env) {
			baseUrl = env.getOrDefault("TABLETALK_BASE_URL", baseUrl);
			model = env.getOrDefault("TABLETALK_MODEL", model);
			strategy = env.getOrDefault("TABLETALK_STRATEGY", strategy);
		}

		TableTalkConfig build() {
			return new TableTalkConfig(
					new InferenceSettings(baseUrl, model, apiKey, Duration.ofSeconds(timeoutSeconds), temperature,
							strategy, functionCalling, synthesize),
					new EmbeddingSettings(embeddingEnabled, modelUri, tokenizerUri, cacheDirectory),
					new AnalysisSettings(namingThreshold, conceptThreshold, searchThreshold, diffThreshold),
					new StoreSettings(storePath));
		}

		@SuppressWarnings("unchecked")
		private static Map<String, Object> section(Map<String, Object> root, String key) {
			Object value = root.get(key);
			if (value == null) {
				return Map.of();
			}
			if (!(value instanceof Map)) {
				throw new IllegalArgumentException("Configuration section '" + key + "' must be a mapping");
			}
			return (Map<String, Object>) value;
		}

		private static String string(Map<String, Object> section, String key, String fallback) {
			Object value = section.get(key);
			return value != null ? value.toString() : fallback;
		}

		private static double number(Map<String, Object> section, String key, double fallback) {
			Object value = section.get(key);
			if (value == null) {
				return fallback;
			}
			if (value instanceof Number n) {
				return n.doubleValue();
			}
			try {
				return Double.parseDouble(value.toString());
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException("Configuration key '" + key + "' must be a number: " + value, e);
			}
		}

		private static boolean bool(Map<String, Object> section, String key, boolean fallback) {
			Object value = section.get(key);
			if (value == null) {
				return fallback;
			}
			return value instanceof Boolean b ? b : Boolean.parseBoolean(value.toString());
		}
	}
}
