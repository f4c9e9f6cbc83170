package org.javai.tabletalk.error;

/**
 * No plan could be extracted from a model reply (or from the query itself).
 */
public class PlanParseException extends TableTalkException {

	public PlanParseException(String message) {
		super(ErrorKind.PARSE_ERROR, message);
	}

	public PlanParseException(String message, Throwable cause) {
		super(ErrorKind.PARSE_ERROR, message, cause);
	}
}
