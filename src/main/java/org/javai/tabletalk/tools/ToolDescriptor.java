package org.javai.tabletalk.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import java.util.Optional;

/**
 * Model-facing description of a tool: name, description and parameters.
 */
public record ToolDescriptor(String name, String description, List<ToolParameterDescriptor> parameters) {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	public ToolDescriptor {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Tool name must not be blank");
		}
		description = description != null ? description : "";
		parameters = List.copyOf(parameters);
		long distinct = parameters.stream().map(ToolParameterDescriptor::name).distinct().count();
		if (distinct != parameters.size()) {
			throw new IllegalArgumentException("Duplicate parameter names in tool " + name);
		}
	}

	public Optional<ToolParameterDescriptor> parameter(String parameterName) {
		return parameters.stream().filter(p -> p.name().equals(parameterName)).findFirst();
	}

	/**
	 * JSON schema of the parameters object, as advertised to function-calling models.
	 */
	public ObjectNode parameterSchema() {
		ObjectNode schema = MAPPER.createObjectNode();
		schema.put("type", "object");
		ObjectNode properties = schema.putObject("properties");
		ArrayNode required = MAPPER.createArrayNode();
		for (ToolParameterDescriptor parameter : parameters) {
			ObjectNode property = properties.putObject(parameter.name());
			property.put("type", parameter.type().jsonType());
			if (!parameter.description().isBlank()) {
				property.put("description", parameter.description());
			}
			if (parameter.hasAllowedValues()) {
				ArrayNode values = property.putArray("enum");
				parameter.allowedValues().forEach(values::add);
			}
			if (parameter.defaultValue() != null) {
				property.put("default", parameter.defaultValue());
			}
			if (parameter.required()) {
				required.add(parameter.name());
			}
		}
		schema.set("required", required);
		return schema;
	}

	/**
	 * One-line rendering for plain-text prompts, e.g.
	 * {@code get_file_schema(file_name: string, required) - Show the columns of one file}.
	 */
	public String toPromptLine() {
		StringBuilder line = new StringBuilder(name).append('(');
		for (int i = 0; i < parameters.size(); i++) {
			ToolParameterDescriptor p = parameters.get(i);
			if (i > 0) {
				line.append(", ");
			}
			line.append(p.name()).append(": ").append(p.type().jsonType());
			if (p.hasAllowedValues()) {
				line.append(" one of ").append(String.join("|", p.allowedValues()));
			}
			line.append(p.required() ? ", required" : ", optional");
		}
		return line.append(") - ").append(description).toString();
	}
}
