package org.javai.tabletalk.semantic;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-lifetime memo of text to embedding vector. Safe for concurrent reads and inserts;
 * entries are never evicted or persisted.
 */
public final class EmbeddingCache {

	private final Map<String, float[]> vectors = new ConcurrentHashMap<>();

	public Optional<float[]> get(String text) {
		return Optional.ofNullable(vectors.get(text));
	}

	/**
	 * Stores a vector unless one is already present, returning whichever is kept.
	 */
	public float[] put(String text, float[] vector) {
		float[] existing = vectors.putIfAbsent(text, vector);
		return existing != null ? existing : vector;
	}

	public int size() {
		return vectors.size();
	}
}
