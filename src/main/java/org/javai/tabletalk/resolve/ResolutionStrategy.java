package org.javai.tabletalk.resolve;

/**
 * Turns a question into a single {@link ResolutionPlan}.
 * <p>
 * {@link #parse(QueryContext)} reports failure by throwing a
 * {@link org.javai.tabletalk.error.TableTalkException}; the orchestrator then moves on to the next
 * strategy in priority order.
 */
public interface ResolutionStrategy {

	StrategyKind kind();

	default int priority() {
		return kind().priority();
	}

	/**
	 * Whether the strategy can run at all, for example because its model endpoint answers.
	 */
	boolean isAvailable();

	ResolutionPlan parse(QueryContext context);

	/**
	 * How many times the orchestrator may ask for a new plan after the tool failed to execute.
	 */
	default int maxExecutionRetries() {
		return 0;
	}

	/**
	 * Produces a new plan after {@code failed} could not be executed. Only called while
	 * {@link #maxExecutionRetries()} allows it, one attempt at a time.
	 */
	default ResolutionPlan replan(QueryContext context, ResolutionPlan failed, String failure) {
		throw new UnsupportedOperationException(kind() + " does not re-plan");
	}
}
