package org.javai.tabletalk.semantic;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic rewrite of a raw column name into a short phrase an embedding model reads well.
 * <p>
 * {@code customer_id} becomes {@code "customer id identifier primary key person account profile"}:
 * the name is split into lower-case words, then a hint is appended for each role the words suggest.
 * Independent of any embedding model.
 */
public final class ColumnNameEnhancer {

	private static final Set<String> ID_WORDS = Set.of("id", "uuid", "guid", "key");
	private static final Set<String> TIME_WORDS = Set.of("date", "time", "timestamp", "created", "updated",
			"datetime", "at");
	private static final Set<String> NAME_WORDS = Set.of("name", "title", "label");
	private static final Set<String> PERSON_WORDS = Set.of("customer", "user", "client");

	static final String ID_HINT = "identifier primary key";
	static final String TIME_HINT = "timestamp datetime";
	static final String NAME_HINT = "text label";
	static final String PERSON_HINT = "person account profile";

	private ColumnNameEnhancer() {
	}

	public static String enhance(String columnName) {
		List<String> words = words(columnName);
		if (words.isEmpty()) {
			return "";
		}
		StringBuilder enhanced = new StringBuilder(String.join(" ", words));
		if (words.stream().anyMatch(ID_WORDS::contains)) {
			enhanced.append(' ').append(ID_HINT);
		}
		// "at" alone is too weak a signal; only count it after another word, as in created_at
		boolean timeLike = words.stream().anyMatch(w -> TIME_WORDS.contains(w) && !w.equals("at"))
				|| (words.size() > 1 && words.get(words.size() - 1).equals("at"));
		if (timeLike) {
			enhanced.append(' ').append(TIME_HINT);
		}
		if (words.stream().anyMatch(NAME_WORDS::contains)) {
			enhanced.append(' ').append(NAME_HINT);
		}
		if (words.stream().anyMatch(PERSON_WORDS::contains)) {
			enhanced.append(' ').append(PERSON_HINT);
		}
		return enhanced.toString();
	}

	/**
	 * Lower-case words of a column name, split on underscores, hyphens, spaces, dots and camelCase
	 * boundaries. {@code customerID_v2} gives {@code [customer, id, v2]}.
	 */
	public static List<String> words(String columnName) {
		if (columnName == null || columnName.isBlank()) {
			return List.of();
		}
		String split = columnName
				.replaceAll("([A-Z]+)([A-Z][a-z])", "$1 $2")
				.replaceAll("([a-z0-9])([A-Z])", "$1 $2")
				.replaceAll("[_\\-.\\s]+", " ")
				.trim()
				.toLowerCase(Locale.ROOT);
		List<String> words = new ArrayList<>();
		for (String word : split.split(" ")) {
			if (!word.isEmpty()) {
				words.add(word);
			}
		}
		return words;
	}
}
