package org.javai.tabletalk.error;

/**
 * Kinds of failure a query resolution can run into, each paired with a short hint for the user.
 */
public enum ErrorKind {

	PARSE_ERROR("Try rephrasing the question, for example \"show me all files\"."),
	UNKNOWN_TOOL("Try rephrasing the question; type 'help' to see what can be asked."),
	INVALID_PARAMETERS("Name the file or column explicitly, for example \"schema of orders.csv\"."),
	TOOL_EXECUTION("Check that files have been scanned and the metadata database is readable."),
	TIMEOUT("Check the inference endpoint is reachable and the model is loaded."),
	EMBEDDING_UNAVAILABLE("Semantic matching is disabled; exact-match analyses still work.");

	private final String suggestion;

	ErrorKind(String suggestion) {
		this.suggestion = suggestion;
	}

	public String suggestion() {
		return suggestion;
	}
}
