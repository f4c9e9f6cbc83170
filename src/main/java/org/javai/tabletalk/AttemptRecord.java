package org.javai.tabletalk;

import org.javai.tabletalk.resolve.StrategyKind;

/**
 * Record of a single strategy attempt.
 *
 * @param strategy          strategy that made the attempt
 * @param attemptWithinStrategy 1-based attempt number; above 1 only for re-planned executions
 * @param outcome           result of the attempt
 * @param durationMillis    time taken in milliseconds
 * @param errorDetails      failure message, {@code null} on success
 */
public record AttemptRecord(
		StrategyKind strategy,
		int attemptWithinStrategy,
		AttemptOutcome outcome,
		long durationMillis,
		String errorDetails
) {

	public AttemptRecord {
		if (strategy == null) {
			throw new IllegalArgumentException("strategy must not be null");
		}
		if (attemptWithinStrategy < 1) {
			throw new IllegalArgumentException("attemptWithinStrategy must be >= 1");
		}
		if (outcome == null) {
			throw new IllegalArgumentException("outcome must not be null");
		}
		if (durationMillis < 0) {
			throw new IllegalArgumentException("durationMillis must be >= 0");
		}
	}

	public boolean isSuccess() {
		return outcome == AttemptOutcome.SUCCESS;
	}
}
