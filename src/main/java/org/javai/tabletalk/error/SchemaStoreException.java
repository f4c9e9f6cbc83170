package org.javai.tabletalk.error;

/**
 * The schema store could not be read. Surfaces to the orchestrator as a tool execution failure.
 */
public class SchemaStoreException extends ToolExecutionException {

	public SchemaStoreException(String message, Throwable cause) {
		super(message, cause);
	}
}
