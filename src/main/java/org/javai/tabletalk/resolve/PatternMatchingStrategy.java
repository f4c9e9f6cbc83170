package org.javai.tabletalk.resolve;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.javai.tabletalk.error.TableTalkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic keyword lookup from question to tool. Always produces a plan, so it closes every
 * strategy chain.
 * <p>
 * Rules are checked in order on the lower-cased question; the first that matches wins:
 * <ol>
 *     <li>{@code compare} with two file references: {@code compare_items}; without:
 *     {@code detect_inconsistencies(data_types)}</li>
 *     <li>{@code type} with {@code mismatch}, {@code inconsisten} or {@code conflict}:
 *     {@code detect_inconsistencies(data_types)}</li>
 *     <li>{@code abbreviat}: {@code detect_inconsistencies(abbreviation_detection)}</li>
 *     <li>{@code naming}: {@code detect_inconsistencies(semantic_naming)}</li>
 *     <li>{@code concept} with {@code type}: {@code detect_inconsistencies(concept_consistency)};
 *     {@code concept} or {@code semantic group}: {@code find_relationships(semantic_groups)}</li>
 *     <li>{@code similar} with {@code schema}: {@code find_relationships(similar_schemas)}</li>
 *     <li>common or shared columns, or {@code relationship}: {@code find_relationships(common_columns)}</li>
 *     <li>{@code summary}, {@code overview}, {@code statistic} or {@code stats}: {@code get_statistics}</li>
 *     <li>{@code schema}, {@code structure}, {@code describe} or {@code columns}: {@code get_file_schema}
 *     for a referenced file, otherwise {@code get_schemas}</li>
 *     <li>{@code which files}, {@code find}, {@code search} or {@code contain} with a column-like
 *     term: {@code search_metadata}</li>
 *     <li>anything else: {@code get_files}</li>
 * </ol>
 */
public final class PatternMatchingStrategy implements ResolutionStrategy {

	private static final Logger logger = LoggerFactory.getLogger(PatternMatchingStrategy.class);

	static final Set<String> TARGET_TOOLS = Set.of("compare_items", "detect_inconsistencies", "find_relationships",
			"get_statistics", "get_file_schema", "get_schemas", "search_metadata", "get_files");

	private static final double CONFIDENCE = 0.5;
	private static final Pattern NAMED_TERM = Pattern.compile(
			"\\b(?:named|called|column|columns|field|fields|contain|contains|containing|with|for)\\s+([\\w.-]+)");
	private static final Set<String> STOP_WORDS = Set.of("a", "an", "the", "any", "all", "some", "column", "columns",
			"field", "fields", "file", "files", "named", "called", "with", "for", "that", "which", "what", "data", "me");

	private final PlanResolver planResolver;

	public PatternMatchingStrategy(PlanResolver planResolver) {
		this.planResolver = planResolver;
		List<String> missing = TARGET_TOOLS.stream()
				.filter(tool -> !planResolver.registry().contains(tool))
				.sorted()
				.toList();
		if (!missing.isEmpty()) {
			throw new IllegalArgumentException("Keyword table targets unregistered tools: " + missing);
		}
	}

	@Override
	public StrategyKind kind() {
		return StrategyKind.PATTERN_MATCHING;
	}

	@Override
	public boolean isAvailable() {
		return true;
	}

	@Override
	public ResolutionPlan parse(QueryContext context) {
		Match match = match(context);
		logger.debug("Keyword rule '{}' matched: {}{}", match.intent(), match.tool(), match.parameters());
		try {
			return planResolver.resolve(match.tool(), match.parameters(), context, kind(), match.intent(), CONFIDENCE);
		}
		catch (TableTalkException e) {
			// keyword extraction produced something the tool rejects; listing files always works
			logger.warn("Keyword plan {} rejected ({}); listing files instead", match.tool(), e.getMessage());
			return planResolver.resolve("get_files", Map.of(), context, kind(), "List scanned files", CONFIDENCE);
		}
	}

	Match match(QueryContext context) {
		String q = context.query().toLowerCase(Locale.ROOT);
		List<String> files = FileReferences.extract(context.query(), context.availableFiles());

		if (q.contains("compare")) {
			if (files.size() >= 2) {
				return new Match("Compare two file schemas", "compare_items",
						params("item1", files.get(0), "item2", files.get(1), "comparison_type", "schemas"));
			}
			return inconsistencies("Compare column types across files", "data_types");
		}
		if (q.contains("type") && containsAny(q, "mismatch", "inconsisten", "conflict")) {
			return inconsistencies("Detect data type mismatches", "data_types");
		}
		if (q.contains("abbreviat")) {
			return inconsistencies("Detect abbreviated column names", "abbreviation_detection");
		}
		if (q.contains("naming")) {
			return inconsistencies("Detect naming inconsistencies", "semantic_naming");
		}
		if (q.contains("concept")) {
			if (q.contains("type")) {
				return inconsistencies("Check type consistency per concept", "concept_consistency");
			}
			return relationships("Group columns by concept", "semantic_groups");
		}
		if (q.contains("semantic group")) {
			return relationships("Group columns by concept", "semantic_groups");
		}
		if (q.contains("similar") && q.contains("schema")) {
			return relationships("Find files with similar schemas", "similar_schemas");
		}
		if ((containsAny(q, "common", "shared") && q.contains("column")) || q.contains("relationship")) {
			return relationships("Find columns shared between files", "common_columns");
		}
		if (containsAny(q, "summary", "overview", "statistic", "stats")) {
			if (!files.isEmpty()) {
				return new Match("Show statistics for one file", "get_statistics",
						params("scope", "file", "target", files.get(0)));
			}
			return new Match("Show database statistics", "get_statistics", params("scope", "database"));
		}
		if (containsAny(q, "schema", "structure", "describe", "columns")) {
			if (!files.isEmpty()) {
				return new Match("Show the schema of one file", "get_file_schema", params("file_name", files.get(0)));
			}
			return new Match("Show all schemas", "get_schemas", params());
		}
		if (containsAny(q, "which files", "find", "search", "contain")) {
			String term = columnLikeTerm(q, files);
			if (term != null) {
				return new Match("Search column metadata", "search_metadata",
						params("search_term", term, "search_type", "column"));
			}
		}
		return new Match("List scanned files", "get_files", params());
	}

	/**
	 * An identifier-like token ({@code customer_id}) if there is one, else the word after a marker
	 * such as "named" or "containing".
	 */
	static String columnLikeTerm(String lowerCaseQuery, List<String> fileReferences) {
		for (String token : StringUtils.split(lowerCaseQuery, " \t\r\n,;:\"'`()?!")) {
			String candidate = StringUtils.stripEnd(token, ".");
			if (candidate.contains("_") && !FileReferences.hasDataExtension(candidate)
					&& fileReferences.stream().noneMatch(candidate::equalsIgnoreCase)) {
				return candidate;
			}
		}
		Matcher matcher = NAMED_TERM.matcher(lowerCaseQuery);
		int from = 0;
		// restart at each captured word so "column named email" still reaches "named email"
		while (matcher.find(from)) {
			String candidate = StringUtils.stripEnd(matcher.group(1), ".");
			if (!STOP_WORDS.contains(candidate) && !FileReferences.hasDataExtension(candidate)) {
				return candidate;
			}
			from = matcher.start(1);
		}
		return null;
	}

	private static Match inconsistencies(String intent, String checkType) {
		return new Match(intent, "detect_inconsistencies", params("check_type", checkType));
	}

	private static Match relationships(String intent, String analysisType) {
		return new Match(intent, "find_relationships", params("analysis_type", analysisType));
	}

	private static boolean containsAny(String text, String... needles) {
		for (String needle : needles) {
			if (text.contains(needle)) {
				return true;
			}
		}
		return false;
	}

	private static Map<String, Object> params(String... keyValues) {
		Map<String, Object> map = new LinkedHashMap<>();
		for (int i = 0; i + 1 < keyValues.length; i += 2) {
			map.put(keyValues[i], keyValues[i + 1]);
		}
		return map;
	}

	record Match(String intent, String tool, Map<String, Object> parameters) {
	}
}
