package org.javai.tabletalk.tools;

/**
 * A registered tool: its description and the handler that runs it.
 */
public record ToolBinding(ToolDescriptor descriptor, ToolHandler handler, Object source) {

	public String name() {
		return descriptor.name();
	}
}
