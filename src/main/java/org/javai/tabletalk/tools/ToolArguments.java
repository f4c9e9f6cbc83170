package org.javai.tabletalk.tools;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.javai.tabletalk.error.InvalidParametersException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Normalizes raw plan arguments against a tool's parameters.
 * <p>
 * Values become {@link String}, {@link Long}, {@link Double} or {@link Boolean}; allowed values are
 * matched case-insensitively and replaced by their canonical spelling; unknown and {@code null}
 * arguments are dropped. Missing required parameters and unconvertible values raise
 * {@link InvalidParametersException}.
 */
public final class ToolArguments {

	private static final Logger logger = LoggerFactory.getLogger(ToolArguments.class);

	private ToolArguments() {
	}

	public static Map<String, Object> normalize(ToolDescriptor tool, Map<String, ?> raw) {
		Map<String, ?> arguments = raw != null ? raw : Map.of();
		for (String key : arguments.keySet()) {
			if (tool.parameter(key).isEmpty()) {
				logger.debug("Dropping unknown argument '{}' for tool {}", key, tool.name());
			}
		}
		Map<String, Object> normalized = new LinkedHashMap<>();
		for (ToolParameterDescriptor parameter : tool.parameters()) {
			Object value = arguments.get(parameter.name());
			if (value instanceof String s && s.isBlank()) {
				value = null;
			}
			if (value == null) {
				if (parameter.required()) {
					throw new InvalidParametersException(
							"Missing required parameter '" + parameter.name() + "' for tool " + tool.name());
				}
				continue;
			}
			normalized.put(parameter.name(), convert(tool, parameter, value));
		}
		return normalized;
	}

	static Object convert(ToolDescriptor tool, ToolParameterDescriptor parameter, Object value) {
		try {
			return switch (parameter.type()) {
				case STRING -> matchAllowed(tool, parameter, asText(value));
				case INTEGER -> toLong(value);
				case NUMBER -> value instanceof Number n ? n.doubleValue() : Double.parseDouble(value.toString().trim());
				case BOOLEAN -> toBoolean(value);
			};
		}
		catch (NumberFormatException e) {
			throw new InvalidParametersException("Parameter '" + parameter.name() + "' of tool " + tool.name()
					+ " expects a " + parameter.type().jsonType() + ", got '" + value + "'");
		}
	}

	private static String asText(Object value) {
		if (value instanceof Double d && d == Math.rint(d) && !d.isInfinite()) {
			return Long.toString(d.longValue());
		}
		return value.toString().trim();
	}

	private static String matchAllowed(ToolDescriptor tool, ToolParameterDescriptor parameter, String value) {
		if (!parameter.hasAllowedValues()) {
			return value;
		}
		for (String allowed : parameter.allowedValues()) {
			if (allowed.equalsIgnoreCase(value)) {
				return allowed;
			}
		}
		throw new InvalidParametersException("Value for parameter '" + parameter.name() + "' of tool " + tool.name()
				+ " must be one of: " + String.join(", ", parameter.allowedValues()));
	}

	private static Long toLong(Object value) {
		if (value instanceof Number n) {
			double d = n.doubleValue();
			if (d != Math.rint(d)) {
				throw new NumberFormatException("not an integer: " + value);
			}
			return n.longValue();
		}
		String text = value.toString().trim();
		if (text.endsWith(".0")) {
			text = text.substring(0, text.length() - 2);
		}
		return Long.parseLong(text);
	}

	private static Boolean toBoolean(Object value) {
		if (value instanceof Boolean b) {
			return b;
		}
		String text = value.toString().trim().toLowerCase(Locale.ROOT);
		return switch (text) {
			case "true", "yes", "1" -> Boolean.TRUE;
			case "false", "no", "0" -> Boolean.FALSE;
			default -> throw new NumberFormatException("not a boolean: " + value);
		};
	}
}
