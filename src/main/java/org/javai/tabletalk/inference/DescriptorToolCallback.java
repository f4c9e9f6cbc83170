package org.javai.tabletalk.inference;

import org.javai.tabletalk.tools.ToolDescriptor;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Advertises a registry tool to the model. Execution stays with the tool registry, so
 * {@link #call(String)} is never reached while internal tool execution is off.
 */
final class DescriptorToolCallback implements ToolCallback {

	private final ToolDefinition definition;

	DescriptorToolCallback(ToolDescriptor descriptor) {
		this.definition = ToolDefinition.builder()
				.name(descriptor.name())
				.description(descriptor.description())
				.inputSchema(descriptor.parameterSchema().toString())
				.build();
	}

	@Override
	public ToolDefinition getToolDefinition() {
		return definition;
	}

	@Override
	public String call(String toolInput) {
		throw new UnsupportedOperationException("Tool " + definition.name() + " is executed by the tool registry");
	}
}
