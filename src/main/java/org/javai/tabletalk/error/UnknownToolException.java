package org.javai.tabletalk.error;

/**
 * A plan or an execute call named a tool that is not in the registry.
 */
public class UnknownToolException extends TableTalkException {

	private final String toolName;

	public UnknownToolException(String toolName) {
		super(ErrorKind.UNKNOWN_TOOL, "Unknown tool: " + toolName);
		this.toolName = toolName;
	}

	public String toolName() {
		return toolName;
	}
}
