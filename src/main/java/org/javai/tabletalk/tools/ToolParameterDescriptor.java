package org.javai.tabletalk.tools;

import java.util.List;
import java.util.Objects;

/**
 * Model-facing description of a tool parameter.
 *
 * @param name          the parameter name
 * @param type          JSON-schema type
 * @param description   human-friendly description
 * @param required      whether a plan must supply it
 * @param allowedValues whitelisted values, matched case-insensitively; empty when unconstrained
 * @param defaultValue  value used when an optional parameter is absent, {@code null} for none
 * @param examples      example values for prompts
 */
public record ToolParameterDescriptor(
		String name,
		ParameterType type,
		String description,
		boolean required,
		List<String> allowedValues,
		String defaultValue,
		List<String> examples
) {

	public ToolParameterDescriptor {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Parameter name must not be blank");
		}
		Objects.requireNonNull(type, "type must not be null");
		description = description != null ? description : "";
		allowedValues = allowedValues != null ? List.copyOf(allowedValues) : List.of();
		examples = examples != null ? List.copyOf(examples) : List.of();
		if (defaultValue != null && defaultValue.isEmpty()) {
			defaultValue = null;
		}
	}

	public static ToolParameterDescriptor required(String name, ParameterType type, String description) {
		return new ToolParameterDescriptor(name, type, description, true, List.of(), null, List.of());
	}

	public static ToolParameterDescriptor optional(String name, ParameterType type, String description,
			String defaultValue) {
		return new ToolParameterDescriptor(name, type, description, false, List.of(), defaultValue, List.of());
	}

	public boolean hasAllowedValues() {
		return !allowedValues.isEmpty();
	}
}
