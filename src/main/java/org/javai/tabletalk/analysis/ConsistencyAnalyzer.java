package org.javai.tabletalk.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.javai.tabletalk.error.EmbeddingUnavailableException;
import org.javai.tabletalk.schema.ColumnDescriptor;
import org.javai.tabletalk.schema.ColumnRef;
import org.javai.tabletalk.schema.DataType;
import org.javai.tabletalk.semantic.ColumnNameEnhancer;
import org.javai.tabletalk.semantic.Concept;
import org.javai.tabletalk.semantic.SemanticMatch;
import org.javai.tabletalk.semantic.SemanticMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Naming and typing consistency checks across files.
 * <p>
 * {@link #detectNamingInconsistencies} and {@link #detectAbbreviations} need embeddings and throw
 * {@link EmbeddingUnavailableException} without them. The other checks are keyword and
 * exact-match based and always run.
 */
public final class ConsistencyAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(ConsistencyAnalyzer.class);

	static final int ABBREVIATION_MIN_LENGTH_GAP = 3;
	private static final List<String> ID_ENTITIES = List.of("customer", "user", "order", "product");

	private final SemanticMatcher matcher;
	private final RelationshipAnalyzer relationships;

	public ConsistencyAnalyzer(SemanticMatcher matcher) {
		this.matcher = matcher != null ? matcher : SemanticMatcher.unavailable();
		this.relationships = new RelationshipAnalyzer(this.matcher);
	}

	public boolean semanticChecksAvailable() {
		return matcher.isAvailable();
	}

	/**
	 * Type mismatches as issues, suggesting the type most files already use.
	 */
	public List<ConsistencyIssue> typeMismatchIssues(SchemaSnapshot snapshot) {
		Map<String, List<ColumnDescriptor>> occurrences = snapshot.occurrencesByName();
		List<ConsistencyIssue> issues = new ArrayList<>();
		for (TypeMismatch mismatch : relationships.detectTypeMismatches(snapshot)) {
			List<ColumnDescriptor> columns = occurrences.get(mismatch.columnName());
			issues.add(new ConsistencyIssue(IssueKind.TYPE_MISMATCH, mismatch.columnName(), columns, null,
					"Standardize '" + mismatch.columnName() + "' as " + mostCommonType(columns).label()));
		}
		return issues;
	}

	/**
	 * Clusters distinct column names whose similarity is at least {@code threshold}. Every cluster
	 * of two or more names is an inconsistency; clusters come back most similar first.
	 */
	public List<ConsistencyIssue> detectNamingInconsistencies(SchemaSnapshot snapshot, double threshold) {
		if (snapshot.isEmpty()) {
			return List.of();
		}
		requireSemantic();
		Map<String, List<ColumnDescriptor>> occurrences = sortedOccurrences(snapshot);
		List<String> names = new ArrayList<>(occurrences.keySet());
		Set<String> processed = new HashSet<>();
		List<ConsistencyIssue> issues = new ArrayList<>();
		for (int i = 0; i < names.size(); i++) {
			String seed = names.get(i);
			if (processed.contains(seed)) {
				continue;
			}
			List<ColumnRef> candidates = new ArrayList<>();
			for (int j = i + 1; j < names.size(); j++) {
				String other = names.get(j);
				if (!processed.contains(other)) {
					candidates.add(occurrences.get(other).get(0).ref());
				}
			}
			processed.add(seed);
			List<SemanticMatch> matches = matcher.findSimilar(seed, candidates, threshold);
			if (matches.isEmpty()) {
				continue;
			}
			List<String> cluster = new ArrayList<>();
			cluster.add(seed);
			List<ColumnDescriptor> columns = new ArrayList<>(occurrences.get(seed));
			for (SemanticMatch match : matches) {
				cluster.add(match.columnName());
				columns.addAll(occurrences.get(match.columnName()));
				processed.add(match.columnName());
			}
			double average = matches.stream().mapToDouble(SemanticMatch::similarity).average().orElse(0.0);
			String subject = Concept.infer(seed).map(Concept::label).orElse(seed);
			issues.add(new ConsistencyIssue(IssueKind.NAMING_INCONSISTENCY, subject, columns, average,
					"Use '" + suggestCanonicalName(cluster) + "' consistently"));
		}
		issues.sort(Comparator.comparingDouble((ConsistencyIssue issue) -> issue.similarity()).reversed());
		logger.debug("Found {} naming inconsistency cluster(s) at threshold {}", issues.size(), threshold);
		return issues;
	}

	/**
	 * Pairs of similar names whose lengths differ by at least three characters, read as a short
	 * form and a long form of the same name.
	 */
	public List<ConsistencyIssue> detectAbbreviations(SchemaSnapshot snapshot, double threshold) {
		if (snapshot.isEmpty()) {
			return List.of();
		}
		requireSemantic();
		Map<String, List<ColumnDescriptor>> occurrences = sortedOccurrences(snapshot);
		List<String> names = new ArrayList<>(occurrences.keySet());
		List<ConsistencyIssue> issues = new ArrayList<>();
		for (int i = 0; i < names.size(); i++) {
			String first = names.get(i);
			List<ColumnRef> candidates = new ArrayList<>();
			for (int j = i + 1; j < names.size(); j++) {
				String other = names.get(j);
				if (Math.abs(other.length() - first.length()) >= ABBREVIATION_MIN_LENGTH_GAP) {
					candidates.add(occurrences.get(other).get(0).ref());
				}
			}
			for (SemanticMatch match : matcher.findSimilar(first, candidates, threshold)) {
				String second = match.columnName();
				String shorter = first.length() < second.length() ? first : second;
				String longer = shorter.equals(first) ? second : first;
				List<ColumnDescriptor> columns = new ArrayList<>(occurrences.get(shorter));
				columns.addAll(occurrences.get(longer));
				issues.add(new ConsistencyIssue(IssueKind.ABBREVIATION, shorter, columns, match.similarity(),
						"Use the full form '" + longer + "' instead of '" + shorter + "'"));
			}
		}
		issues.sort(Comparator.comparingDouble((ConsistencyIssue issue) -> issue.similarity()).reversed());
		return issues;
	}

	/**
	 * Concepts, inferred from keywords in the column names, whose columns use more than one type.
	 */
	public List<ConsistencyIssue> checkConceptTypeConsistency(SchemaSnapshot snapshot) {
		Map<Concept, List<ColumnDescriptor>> byConcept = new EnumMap<>(Concept.class);
		for (ColumnDescriptor column : snapshot.columns()) {
			Optional<Concept> concept = Concept.infer(column.columnName());
			concept.ifPresent(c -> byConcept.computeIfAbsent(c, k -> new ArrayList<>()).add(column));
		}
		List<ConsistencyIssue> issues = new ArrayList<>();
		byConcept.forEach((concept, columns) -> {
			long types = columns.stream().map(ColumnDescriptor::dataType).distinct().count();
			if (types > 1) {
				issues.add(new ConsistencyIssue(IssueKind.CONCEPT_TYPE_MISMATCH, concept.label(), columns, null,
						"Use " + mostCommonType(columns).label() + " for all " + concept.label() + " columns"));
			}
		});
		return issues;
	}

	/**
	 * Names that differ only in case or underscores, such as {@code customerId} and
	 * {@code customer_id}. The snake_case form is suggested.
	 */
	public List<ConsistencyIssue> detectNamingStyleVariations(SchemaSnapshot snapshot) {
		Map<String, List<ColumnDescriptor>> occurrences = sortedOccurrences(snapshot);
		Map<String, List<String>> byNormalized = new LinkedHashMap<>();
		for (String name : occurrences.keySet()) {
			String normalized = name.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
			byNormalized.computeIfAbsent(normalized, n -> new ArrayList<>()).add(name);
		}
		List<ConsistencyIssue> issues = new ArrayList<>();
		byNormalized.forEach((normalized, names) -> {
			if (names.size() > 1) {
				List<ColumnDescriptor> columns = new ArrayList<>();
				names.forEach(n -> columns.addAll(occurrences.get(n)));
				String snake = String.join("_", ColumnNameEnhancer.words(names.get(0)));
				issues.add(new ConsistencyIssue(IssueKind.NAMING_INCONSISTENCY, snake, columns, null,
						"Use the snake_case form '" + snake + "'"));
			}
		});
		return issues;
	}

	/**
	 * Every check that can run: exact checks always, semantic checks when embeddings are available.
	 */
	public List<ConsistencyIssue> allIssues(SchemaSnapshot snapshot, double threshold) {
		List<ConsistencyIssue> issues = new ArrayList<>(typeMismatchIssues(snapshot));
		issues.addAll(checkConceptTypeConsistency(snapshot));
		issues.addAll(detectNamingStyleVariations(snapshot));
		if (matcher.isAvailable()) {
			try {
				issues.addAll(detectNamingInconsistencies(snapshot, threshold));
				issues.addAll(detectAbbreviations(snapshot, threshold));
			}
			catch (EmbeddingUnavailableException e) {
				logger.warn("Semantic consistency checks skipped: {}", e.getMessage());
			}
		}
		return issues;
	}

	/**
	 * {@code <entity>_id} when every name is an identifier and one names a known entity; otherwise
	 * the shortest name, ties broken alphabetically. A name is an identifier when one of its words is
	 * {@code id} or its last word is a short form such as {@code uid}.
	 */
	static String suggestCanonicalName(Collection<String> names) {
		boolean allIds = names.stream().allMatch(ConsistencyAnalyzer::isIdentifier);
		if (allIds) {
			for (String entity : ID_ENTITIES) {
				boolean named = names.stream()
						.anyMatch(name -> name.toLowerCase(Locale.ROOT).contains(entity));
				if (named) {
					return entity + "_id";
				}
			}
		}
		return names.stream()
				.min(Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder()))
				.orElseThrow();
	}

	private static boolean isIdentifier(String name) {
		List<String> words = ColumnNameEnhancer.words(name);
		if (words.isEmpty()) {
			return false;
		}
		String last = words.get(words.size() - 1);
		return words.contains("id") || (last.length() == 3 && last.endsWith("id"));
	}

	private static DataType mostCommonType(List<ColumnDescriptor> columns) {
		Map<DataType, Integer> counts = new EnumMap<>(DataType.class);
		columns.forEach(c -> counts.merge(c.dataType(), 1, Integer::sum));
		// EnumMap iterates in declaration order, so ties resolve to the earlier type
		DataType best = null;
		int bestCount = -1;
		for (Map.Entry<DataType, Integer> entry : counts.entrySet()) {
			if (entry.getValue() > bestCount) {
				best = entry.getKey();
				bestCount = entry.getValue();
			}
		}
		return best != null ? best : DataType.STRING;
	}

	private static Map<String, List<ColumnDescriptor>> sortedOccurrences(SchemaSnapshot snapshot) {
		Map<String, List<ColumnDescriptor>> sorted = new LinkedHashMap<>();
		snapshot.occurrencesByName().entrySet().stream()
				.sorted(Map.Entry.comparingByKey())
				.forEach(e -> sorted.put(e.getKey(), e.getValue()));
		return sorted;
	}

	private void requireSemantic() {
		if (!matcher.isAvailable()) {
			throw new EmbeddingUnavailableException("Naming analysis needs semantic matching, which is not available");
		}
	}
}
