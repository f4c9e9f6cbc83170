package org.javai.tabletalk.resolve;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.javai.tabletalk.error.UnknownToolException;
import org.javai.tabletalk.tools.ParameterType;
import org.javai.tabletalk.tools.ToolArguments;
import org.javai.tabletalk.tools.ToolDescriptor;
import org.javai.tabletalk.tools.ToolParameterDescriptor;
import org.javai.tabletalk.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a strategy's raw tool choice into a {@link ResolutionPlan} validated against the registry.
 * <p>
 * Steps, in order: the tool must be registered; file-name arguments without an extension get
 * {@code .csv}; missing file arguments and optional parameters are filled from the question, then
 * from their declared defaults; finally arguments are normalized, which rejects missing required
 * parameters.
 */
public final class PlanResolver {

	private static final Logger logger = LoggerFactory.getLogger(PlanResolver.class);

	/**
	 * Parameters whose values name a single file.
	 */
	static final Set<String> FILE_PARAMETERS = Set.of("file_name", "item1", "item2");

	private static final Pattern NUMBER = Pattern.compile("(?<![\\w.])\\d+(?:\\.\\d+)?(?!\\w)(?!\\.\\d)");

	private final ToolRegistry registry;

	public PlanResolver(ToolRegistry registry) {
		this.registry = registry;
	}

	public ToolRegistry registry() {
		return registry;
	}

	public ResolutionPlan resolve(String toolName, Map<String, ?> rawParameters, QueryContext context,
			StrategyKind strategy, String intent, Double confidence) {
		ToolDescriptor tool = registry.descriptor(toolName).orElseThrow(() -> new UnknownToolException(toolName));

		Map<String, Object> parameters = new LinkedHashMap<>();
		if (rawParameters != null) {
			rawParameters.forEach((key, value) -> {
				if (key != null && value != null) {
					parameters.put(key, value);
				}
			});
		}
		for (String key : FILE_PARAMETERS) {
			if (parameters.get(key) instanceof String fileName && !fileName.isBlank()) {
				parameters.put(key, FileReferences.withDefaultExtension(fileName));
			}
		}
		fillDefaults(tool, parameters, context);

		Map<String, Object> normalized = ToolArguments.normalize(tool, parameters);
		Double accepted = confidence;
		if (confidence != null && (confidence.isNaN() || confidence < 0.0 || confidence > 1.0)) {
			logger.debug("Ignoring out-of-range confidence {} from {}", confidence, strategy);
			accepted = null;
		}
		ResolutionPlan plan = new ResolutionPlan(
				intent != null && !intent.isBlank() ? intent : tool.description(),
				tool.name(), normalized, accepted, strategy, false);
		logger.debug("Resolved plan {}", plan);
		return plan;
	}

	private static void fillDefaults(ToolDescriptor tool, Map<String, Object> parameters, QueryContext context) {
		String query = context.query().toLowerCase(Locale.ROOT);
		List<String> fileReferences = FileReferences.extract(context.query(), context.availableFiles());
		int nextFileReference = 0;
		for (ToolParameterDescriptor parameter : tool.parameters()) {
			Object present = parameters.get(parameter.name());
			if (present != null && !(present instanceof String s && s.isBlank())) {
				if (FILE_PARAMETERS.contains(parameter.name())) {
					nextFileReference++;
				}
				continue;
			}
			if (parameter.required() && !FILE_PARAMETERS.contains(parameter.name())) {
				continue;
			}
			Optional<Object> derived = Optional.empty();
			if (parameter.hasAllowedValues()) {
				derived = allowedValueMentioned(parameter, query).map(Object.class::cast);
			}
			else if (parameter.type() == ParameterType.INTEGER || parameter.type() == ParameterType.NUMBER) {
				derived = numberMentioned(parameter, query).map(Object.class::cast);
			}
			else if (FILE_PARAMETERS.contains(parameter.name()) && nextFileReference < fileReferences.size()) {
				derived = Optional.of(fileReferences.get(nextFileReference++));
			}
			if (derived.isPresent()) {
				logger.debug("Parameter {} of {} taken from the question: {}", parameter.name(), tool.name(), derived.get());
				parameters.put(parameter.name(), derived.get());
			}
			else if (parameter.defaultValue() != null) {
				parameters.put(parameter.name(), parameter.defaultValue());
			}
		}
	}

	/**
	 * First multi-word allowed value all of whose words occur in the question, compared on their
	 * first four letters: {@code similar_schemas} matches "similar schema", {@code abbreviation_detection}
	 * matches "detect abbreviations". Single-word values are too easily mentioned in passing
	 * ("which files ...") and are never derived.
	 */
	static Optional<String> allowedValueMentioned(ToolParameterDescriptor parameter, String lowerCaseQuery) {
		for (String allowed : parameter.allowedValues()) {
			String[] words = allowed.toLowerCase(Locale.ROOT).split("_");
			if (words.length < 2) {
				continue;
			}
			boolean all = true;
			for (String word : words) {
				String stem = word.length() > 4 ? word.substring(0, 4) : word;
				if (!lowerCaseQuery.contains(stem)) {
					all = false;
					break;
				}
			}
			if (all) {
				return Optional.of(allowed);
			}
		}
		return Optional.empty();
	}

	/**
	 * First number in the question that fits the parameter. Parameters whose declared default lies
	 * in [0, 1] are similarity thresholds and only take numbers in that range.
	 */
	static Optional<Number> numberMentioned(ToolParameterDescriptor parameter, String query) {
		boolean unitRange = isUnitRange(parameter.defaultValue());
		Matcher matcher = NUMBER.matcher(query);
		while (matcher.find()) {
			String text = matcher.group();
			if (parameter.type() == ParameterType.INTEGER) {
				if (!text.contains(".") && text.length() < 18) {
					return Optional.of(Long.parseLong(text));
				}
				continue;
			}
			double value = Double.parseDouble(text);
			if (!unitRange || value <= 1.0) {
				return Optional.of(value);
			}
		}
		return Optional.empty();
	}

	private static boolean isUnitRange(String defaultValue) {
		if (defaultValue == null) {
			return false;
		}
		try {
			double value = Double.parseDouble(defaultValue);
			return value >= 0.0 && value <= 1.0;
		}
		catch (NumberFormatException e) {
			return false;
		}
	}
}
