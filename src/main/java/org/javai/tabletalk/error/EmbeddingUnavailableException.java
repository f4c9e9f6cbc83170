package org.javai.tabletalk.error;

/**
 * Semantic matching was requested but no embedding provider is usable. Callers degrade to
 * exact or substring matching.
 */
public class EmbeddingUnavailableException extends TableTalkException {

	public EmbeddingUnavailableException(String message) {
		super(ErrorKind.EMBEDDING_UNAVAILABLE, message);
	}

	public EmbeddingUnavailableException(String message, Throwable cause) {
		super(ErrorKind.EMBEDDING_UNAVAILABLE, message, cause);
	}
}
