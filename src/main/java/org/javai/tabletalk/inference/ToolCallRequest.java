package org.javai.tabletalk.inference;

/**
 * A tool call chosen by the model, arguments still as the JSON text the model produced.
 */
public record ToolCallRequest(String name, String argumentsJson) {

	public ToolCallRequest {
		argumentsJson = argumentsJson == null || argumentsJson.isBlank() ? "{}" : argumentsJson;
	}
}
