package org.javai.tabletalk.error;

/**
 * A registered tool failed while running.
 */
public class ToolExecutionException extends TableTalkException {

	public ToolExecutionException(String message, Throwable cause) {
		super(ErrorKind.TOOL_EXECUTION, message, cause);
	}

	public ToolExecutionException(String message) {
		super(ErrorKind.TOOL_EXECUTION, message);
	}
}
