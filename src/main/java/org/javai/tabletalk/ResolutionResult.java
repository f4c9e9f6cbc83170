package org.javai.tabletalk;

import java.util.Objects;
import org.javai.tabletalk.resolve.ResolutionPlan;

/**
 * The answer to one question together with how it was reached.
 *
 * @param response text for the user
 * @param plan     plan whose tool produced the response, {@code null} when no tool ran successfully
 * @param metrics  attempt telemetry
 */
public record ResolutionResult(String response, ResolutionPlan plan, ResolutionMetrics metrics) {

	public ResolutionResult {
		Objects.requireNonNull(response, "response must not be null");
		metrics = metrics != null ? metrics : ResolutionMetrics.empty();
	}

	public boolean succeeded() {
		return plan != null && metrics.succeeded();
	}
}
