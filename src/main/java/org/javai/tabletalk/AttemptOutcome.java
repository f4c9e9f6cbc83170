package org.javai.tabletalk;

import org.javai.tabletalk.error.ErrorKind;

/**
 * Outcome of one strategy attempt within a resolution.
 */
public enum AttemptOutcome {
	/**
	 * A plan was produced and its tool ran.
	 */
	SUCCESS,

	/**
	 * The strategy could not run, for example because its endpoint is down.
	 */
	SKIPPED,

	/**
	 * No plan could be extracted from the strategy's output.
	 */
	PARSE_FAILED,

	/**
	 * A plan was extracted but named an unknown tool or lacked required parameters.
	 */
	VALIDATION_FAILED,

	/**
	 * The inference endpoint did not answer in time.
	 */
	TIMEOUT,

	/**
	 * The planned tool failed to run.
	 */
	EXECUTION_FAILED;

	static AttemptOutcome of(ErrorKind kind) {
		return switch (kind) {
			case PARSE_ERROR -> PARSE_FAILED;
			case UNKNOWN_TOOL, INVALID_PARAMETERS -> VALIDATION_FAILED;
			case TIMEOUT -> TIMEOUT;
			case TOOL_EXECUTION, EMBEDDING_UNAVAILABLE -> EXECUTION_FAILED;
		};
	}
}
