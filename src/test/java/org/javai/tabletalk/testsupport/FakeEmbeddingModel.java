package org.javai.tabletalk.testsupport;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.ai.document.Document;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;

/**
 * Deterministic bag-of-words embeddings: one dimension per distinct word, so the cosine of two texts
 * is their word overlap. Aliases fold words together, {@code cust -> customer} for example, to model
 * abbreviations the real model would recognize.
 */
public final class FakeEmbeddingModel implements EmbeddingModel {

	private static final int DIMENSIONS = 512;

	private final Map<String, String> aliases;
	private final Map<String, Integer> vocabulary = new HashMap<>();
	private final List<String> embedded = new CopyOnWriteArrayList<>();

	public FakeEmbeddingModel() {
		this(Map.of());
	}

	public FakeEmbeddingModel(Map<String, String> aliases) {
		this.aliases = Map.copyOf(aliases);
	}

	@Override
	public EmbeddingResponse call(EmbeddingRequest request) {
		List<Embedding> embeddings = new ArrayList<>();
		List<String> texts = request.getInstructions();
		for (int i = 0; i < texts.size(); i++) {
			embeddings.add(new Embedding(vector(texts.get(i)), i));
		}
		return new EmbeddingResponse(embeddings);
	}

	@Override
	public List<float[]> embed(List<String> texts) {
		return texts.stream().map(this::vector).toList();
	}

	@Override
	public float[] embed(String text) {
		return vector(text);
	}

	@Override
	public float[] embed(Document document) {
		return vector(document.getText());
	}

	@Override
	public int dimensions() {
		return DIMENSIONS;
	}

	/**
	 * Every text embedded so far, in order.
	 */
	public List<String> embeddedTexts() {
		return List.copyOf(embedded);
	}

	private synchronized float[] vector(String text) {
		embedded.add(text);
		float[] vector = new float[DIMENSIONS];
		for (String word : text.toLowerCase().split("\\s+")) {
			if (word.isEmpty()) {
				continue;
			}
			String canonical = aliases.getOrDefault(word, word);
			int index = vocabulary.computeIfAbsent(canonical, w -> vocabulary.size() % DIMENSIONS);
			vector[index] = 1.0f;
		}
		return vector;
	}
}
