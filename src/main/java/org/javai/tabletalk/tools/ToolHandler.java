package org.javai.tabletalk.tools;

import java.util.Map;

/**
 * Executes a tool with already normalized arguments.
 */
@FunctionalInterface
public interface ToolHandler {

	String execute(Map<String, Object> arguments);
}
