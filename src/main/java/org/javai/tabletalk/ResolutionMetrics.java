package org.javai.tabletalk;

import java.util.List;
import org.javai.tabletalk.resolve.StrategyKind;

/**
 * Telemetry of one resolution: every attempt in order and the strategy that finally answered.
 *
 * @param successfulStrategy strategy whose plan ran, {@code null} if none did
 * @param attempts           every attempt, skipped strategies included
 */
public record ResolutionMetrics(StrategyKind successfulStrategy, List<AttemptRecord> attempts) {

	public ResolutionMetrics {
		attempts = attempts != null ? List.copyOf(attempts) : List.of();
	}

	public static ResolutionMetrics empty() {
		return new ResolutionMetrics(null, List.of());
	}

	public boolean succeeded() {
		return attempts.stream().anyMatch(AttemptRecord::isSuccess);
	}

	/**
	 * Attempts that actually ran, skipped strategies excluded.
	 */
	public int totalAttempts() {
		return (int) attempts.stream().filter(a -> a.outcome() != AttemptOutcome.SKIPPED).count();
	}

	public int strategiesAttempted() {
		return (int) attempts.stream()
				.filter(a -> a.outcome() != AttemptOutcome.SKIPPED)
				.map(AttemptRecord::strategy)
				.distinct()
				.count();
	}

	/**
	 * @return the last attempt, or {@code null} if none was made
	 */
	public AttemptRecord finalAttempt() {
		return attempts.isEmpty() ? null : attempts.get(attempts.size() - 1);
	}
}
