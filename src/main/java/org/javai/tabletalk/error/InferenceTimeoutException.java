package org.javai.tabletalk.error;

/**
 * The inference endpoint did not answer within the configured timeout, or could not be reached.
 */
public class InferenceTimeoutException extends TableTalkException {

	public InferenceTimeoutException(String message, Throwable cause) {
		super(ErrorKind.TIMEOUT, message, cause);
	}
}
