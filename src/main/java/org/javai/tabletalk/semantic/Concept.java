package org.javai.tabletalk.semantic;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed catalog of semantic roles a column can play. Each role is described by example phrases
 * (embedded for similarity grouping) and by keywords (used for embedding-free inference).
 */
public enum Concept {

	IDENTIFIER("identifiers", List.of("id", "identifier", "primary key", "unique key"),
			Set.of("id", "uuid", "guid", "key")),
	TIMESTAMP("timestamps", List.of("date", "time", "timestamp", "created", "updated"),
			Set.of("date", "time", "timestamp", "datetime", "created", "updated")),
	NAME("names", List.of("name", "title", "label", "text"),
			Set.of("name", "title", "label")),
	USER("users", List.of("customer", "user", "client", "person", "account"),
			Set.of("customer", "user", "client", "person", "account")),
	FINANCIAL("financial", List.of("price", "amount", "cost", "money", "payment"),
			Set.of("price", "amount", "cost", "payment", "revenue", "salary")),
	QUANTITY("quantities", List.of("quantity", "count", "number", "amount"),
			Set.of("quantity", "qty", "count", "number", "num")),
	STATUS("status", List.of("status", "active", "enabled", "state"),
			Set.of("status", "active", "enabled", "state", "flag")),
	RATING("ratings", List.of("rating", "score", "review", "feedback"),
			Set.of("rating", "score", "review", "feedback", "stars")),
	CONTACT("contact", List.of("email", "phone", "address", "contact"),
			Set.of("email", "phone", "address", "contact", "mobile"));

	private final String label;
	private final List<String> examplePhrases;
	private final Set<String> keywords;

	Concept(String label, List<String> examplePhrases, Set<String> keywords) {
		this.label = label;
		this.examplePhrases = examplePhrases;
		this.keywords = keywords;
	}

	public String label() {
		return label;
	}

	public List<String> examplePhrases() {
		return examplePhrases;
	}

	/**
	 * Keyword inference over the column's words, checked in catalog order so that
	 * {@code customer_id} is an identifier before it is a user.
	 */
	public static Optional<Concept> infer(String columnName) {
		List<String> words = ColumnNameEnhancer.words(columnName);
		for (Concept concept : values()) {
			for (String word : words) {
				if (concept.keywords.contains(word)) {
					return Optional.of(concept);
				}
			}
		}
		return Optional.empty();
	}
}
