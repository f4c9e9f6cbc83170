package org.javai.tabletalk.semantic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.tabletalk.error.EmbeddingUnavailableException;
import org.javai.tabletalk.schema.ColumnRef;
import org.springframework.ai.embedding.EmbeddingModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Similarity between column names, computed from text embeddings.
 * <p>
 * Every text, search terms included, goes through {@link ColumnNameEnhancer} before it is embedded,
 * so a name compared with itself scores 1.0. Vectors are memoized in the injected
 * {@link EmbeddingCache}.
 * <p>
 * When constructed without a model the matcher reports {@link #isAvailable()} {@code false} and
 * every similarity operation throws {@link EmbeddingUnavailableException}; callers fall back to
 * exact or substring matching.
 */
public final class SemanticMatcher {

	private static final Logger logger = LoggerFactory.getLogger(SemanticMatcher.class);

	private final EmbeddingModel embeddingModel;
	private final EmbeddingCache cache;

	public SemanticMatcher(EmbeddingModel embeddingModel, EmbeddingCache cache) {
		this.embeddingModel = embeddingModel;
		this.cache = cache != null ? cache : new EmbeddingCache();
	}

	public static SemanticMatcher unavailable() {
		return new SemanticMatcher(null, new EmbeddingCache());
	}

	public boolean isAvailable() {
		return embeddingModel != null;
	}

	/**
	 * Candidates whose similarity to {@code term} is at least {@code threshold}, best first. Equal
	 * scores keep candidate order.
	 */
	public List<SemanticMatch> findSimilar(String term, List<ColumnRef> candidates, double threshold) {
		requireAvailable();
		if (term == null || term.isBlank() || candidates.isEmpty()) {
			return List.of();
		}
		String enhancedTerm = ColumnNameEnhancer.enhance(term);
		List<String> texts = new ArrayList<>(candidates.size() + 1);
		texts.add(enhancedTerm);
		for (ColumnRef candidate : candidates) {
			texts.add(ColumnNameEnhancer.enhance(candidate.columnName()));
		}
		Map<String, float[]> vectors = vectorsFor(texts);
		float[] termVector = vectors.get(enhancedTerm);

		List<SemanticMatch> matches = new ArrayList<>();
		for (int i = 0; i < candidates.size(); i++) {
			ColumnRef candidate = candidates.get(i);
			double similarity = clamp(cosine(termVector, vectors.get(texts.get(i + 1))));
			if (similarity >= threshold) {
				SemanticMatch.MatchType type = candidate.columnName().equalsIgnoreCase(term)
						? SemanticMatch.MatchType.EXACT
						: SemanticMatch.MatchType.SEMANTIC;
				matches.add(new SemanticMatch(candidate.columnName(), candidate.fileName(), similarity, type));
			}
		}
		// List.sort is stable, so ties keep candidate order
		matches.sort(Comparator.comparingDouble(SemanticMatch::similarity).reversed());
		return matches;
	}

	/**
	 * Similarity of two column names in [0, 1].
	 */
	public double similarity(String first, String second) {
		requireAvailable();
		String a = ColumnNameEnhancer.enhance(first);
		String b = ColumnNameEnhancer.enhance(second);
		Map<String, float[]> vectors = vectorsFor(List.of(a, b));
		return clamp(cosine(vectors.get(a), vectors.get(b)));
	}

	/**
	 * Groups columns by concept: every example phrase of every concept is matched against the
	 * columns, and the matches of one concept are merged, keeping each column once with its best
	 * score. Concepts without matches are left out.
	 */
	public Map<Concept, List<SemanticMatch>> conceptGroups(List<ColumnRef> columns, double threshold) {
		requireAvailable();
		Map<Concept, List<SemanticMatch>> groups = new LinkedHashMap<>();
		if (columns.isEmpty()) {
			return groups;
		}
		for (Concept concept : Concept.values()) {
			Map<ColumnRef, SemanticMatch> best = new LinkedHashMap<>();
			for (String phrase : concept.examplePhrases()) {
				for (SemanticMatch match : findSimilar(phrase, columns, threshold)) {
					best.merge(match.ref(), match, (kept, candidate) ->
							candidate.similarity() > kept.similarity() ? candidate : kept);
				}
			}
			if (!best.isEmpty()) {
				List<SemanticMatch> merged = new ArrayList<>(best.values());
				merged.sort(Comparator.comparingDouble(SemanticMatch::similarity).reversed());
				groups.put(concept, merged);
			}
		}
		return groups;
	}

	private Map<String, float[]> vectorsFor(List<String> texts) {
		Map<String, float[]> vectors = new LinkedHashMap<>();
		Set<String> missing = new LinkedHashSet<>();
		for (String text : texts) {
			Optional<float[]> cached = cache.get(text);
			if (cached.isPresent()) {
				vectors.put(text, cached.get());
			}
			else {
				missing.add(text);
			}
		}
		if (!missing.isEmpty()) {
			List<String> batch = new ArrayList<>(missing);
			List<float[]> embedded;
			try {
				embedded = embeddingModel.embed(batch);
			}
			catch (RuntimeException e) {
				logger.warn("Embedding provider failed for {} text(s): {}", batch.size(), e.getMessage());
				throw new EmbeddingUnavailableException("Embedding provider failed: " + e.getMessage(), e);
			}
			if (embedded == null || embedded.size() != batch.size()) {
				throw new EmbeddingUnavailableException("Embedding provider returned "
						+ (embedded == null ? "nothing" : embedded.size() + " vectors") + " for " + batch.size() + " texts");
			}
			for (int i = 0; i < batch.size(); i++) {
				vectors.put(batch.get(i), cache.put(batch.get(i), embedded.get(i)));
			}
		}
		return vectors;
	}

	private void requireAvailable() {
		if (!isAvailable()) {
			throw new EmbeddingUnavailableException("Semantic matching is not available: no embedding model loaded");
		}
	}

	/**
	 * Cosine similarity of the L2-normalized vectors; 0 when either vector is all zeros or the
	 * dimensions differ.
	 */
	static double cosine(float[] a, float[] b) {
		if (a == null || b == null || a.length != b.length || a.length == 0) {
			return 0.0;
		}
		double dot = 0.0;
		double normA = 0.0;
		double normB = 0.0;
		for (int i = 0; i < a.length; i++) {
			dot += (double) a[i] * b[i];
			normA += (double) a[i] * a[i];
			normB += (double) b[i] * b[i];
		}
		if (normA == 0.0 || normB == 0.0) {
			return 0.0;
		}
		return dot / (Math.sqrt(normA) * Math.sqrt(normB));
	}

	private static double clamp(double value) {
		return Math.max(0.0, Math.min(1.0, value));
	}
}
