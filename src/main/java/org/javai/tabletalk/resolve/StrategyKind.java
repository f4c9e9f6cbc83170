package org.javai.tabletalk.resolve;

import java.util.Arrays;
import java.util.Optional;

/**
 * The resolution strategy variants, with their default priority. Lower priorities are tried first.
 */
public enum StrategyKind {

	FUNCTION_CALLING("function_calling", 10),
	STRUCTURED_OUTPUT("structured_output", 20),
	SQL_GENERATION("sql_generation", 30),
	PATTERN_MATCHING("pattern_matching", 100);

	private final String tag;
	private final int priority;

	StrategyKind(String tag, int priority) {
		this.tag = tag;
		this.priority = priority;
	}

	public String tag() {
		return tag;
	}

	public int priority() {
		return priority;
	}

	/**
	 * Looks up a strategy by its tag; {@code auto} and unknown tags give empty.
	 */
	public static Optional<StrategyKind> fromTag(String tag) {
		if (tag == null) {
			return Optional.empty();
		}
		return Arrays.stream(values()).filter(kind -> kind.tag.equalsIgnoreCase(tag.trim())).findFirst();
	}

	@Override
	public String toString() {
		return tag;
	}
}
