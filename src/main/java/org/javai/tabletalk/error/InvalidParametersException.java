package org.javai.tabletalk.error;

/**
 * A plan is missing a required argument or carries one that cannot be converted or is not allowed.
 */
public class InvalidParametersException extends TableTalkException {

	public InvalidParametersException(String message) {
		super(ErrorKind.INVALID_PARAMETERS, message);
	}
}
