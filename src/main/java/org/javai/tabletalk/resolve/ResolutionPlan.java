package org.javai.tabletalk.resolve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A validated plan: one registered tool with normalized arguments.
 * <p>
 * Plans are only built by {@link PlanResolver}, so a plan in hand always names a registered tool
 * and carries every required parameter.
 *
 * @param intent     short description of what the plan does
 * @param toolName   registered tool to run
 * @param parameters normalized arguments
 * @param confidence strategy's confidence in [0, 1], {@code null} when the strategy has none
 * @param strategy   strategy that produced the plan
 * @param fallback   whether an earlier strategy failed before this plan was produced
 */
public record ResolutionPlan(
		String intent,
		String toolName,
		Map<String, Object> parameters,
		Double confidence,
		StrategyKind strategy,
		boolean fallback
) {

	public ResolutionPlan {
		if (toolName == null || toolName.isBlank()) {
			throw new IllegalArgumentException("toolName must not be blank");
		}
		Objects.requireNonNull(strategy, "strategy must not be null");
		if (confidence != null && (confidence < 0.0 || confidence > 1.0 || confidence.isNaN())) {
			throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
		}
		intent = intent != null ? intent : "";
		// values may not be null, but keep insertion order for readable logs
		parameters = parameters != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
				: Map.of();
	}

	public ResolutionPlan asFallback() {
		return fallback ? this : new ResolutionPlan(intent, toolName, parameters, confidence, strategy, true);
	}

	@Override
	public String toString() {
		return strategy + " -> " + toolName + parameters;
	}
}
