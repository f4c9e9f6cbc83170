package org.javai.tabletalk.error;

import java.util.Objects;

/**
 * Root of the resolution error taxonomy. Every failure carries an {@link ErrorKind} so the
 * orchestrator can decide between falling back and reporting.
 */
public class TableTalkException extends RuntimeException {

	private final ErrorKind kind;

	public TableTalkException(ErrorKind kind, String message) {
		super(message);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
	}

	public TableTalkException(ErrorKind kind, String message, Throwable cause) {
		super(message, cause);
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
	}

	public ErrorKind kind() {
		return kind;
	}

	/**
	 * Short user-facing text: the message followed by the suggestion for this kind.
	 */
	public String toUserMessage() {
		return getMessage() + "\nSuggestion: " + kind.suggestion();
	}
}
