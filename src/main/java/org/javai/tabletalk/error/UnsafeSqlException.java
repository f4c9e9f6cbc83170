package org.javai.tabletalk.error;

/**
 * A generated SQL statement was not a single read-only SELECT or WITH query over the schema table.
 * It is never executed.
 */
public class UnsafeSqlException extends PlanParseException {

	public UnsafeSqlException(String message) {
		super(message);
	}

	public UnsafeSqlException(String message, Throwable cause) {
		super(message, cause);
	}
}
