package org.javai.tabletalk.semantic;

import java.util.Optional;
import org.javai.tabletalk.config.TableTalkConfig.EmbeddingSettings;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.transformers.TransformersEmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the local sentence-embedding model. Initialization downloads and loads an ONNX model,
 * which can fail offline; failure leaves semantic matching disabled rather than stopping startup.
 */
public final class EmbeddingModels {

	private static final Logger logger = LoggerFactory.getLogger(EmbeddingModels.class);

	private EmbeddingModels() {
	}

	public static Optional<EmbeddingModel> create(EmbeddingSettings settings) {
		if (!settings.enabled()) {
			logger.info("Semantic matching disabled by configuration");
			return Optional.empty();
		}
		TransformersEmbeddingModel model = new TransformersEmbeddingModel();
		if (settings.modelUri() != null) {
			model.setModelResource(settings.modelUri());
		}
		if (settings.tokenizerUri() != null) {
			model.setTokenizerResource(settings.tokenizerUri());
		}
		if (settings.cacheDirectory() != null) {
			model.setResourceCacheDirectory(settings.cacheDirectory());
		}
		try {
			model.afterPropertiesSet();
			logger.info("Embedding model loaded");
			return Optional.of(model);
		}
		catch (Exception e) {
			logger.warn("Embedding model failed to initialize, semantic matching disabled: {}", e.getMessage());
			return Optional.empty();
		}
	}

	public static SemanticMatcher matcher(EmbeddingSettings settings, EmbeddingCache cache) {
		return create(settings)
				.map(model -> new SemanticMatcher(model, cache))
				.orElseGet(SemanticMatcher::unavailable);
	}
}
