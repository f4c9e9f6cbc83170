package org.javai.tabletalk;

import java.util.List;
import org.javai.tabletalk.resolve.StrategyKind;

/**
 * Snapshot of the resolver's configuration.
 *
 * @param activeStrategy    first strategy of the chain that is currently available
 * @param capabilities      names of the registered tools
 * @param strategies        the strategy chain in the order it is tried
 * @param semanticAvailable whether embedding-based analyses can run
 */
public record ResolverStatus(
		StrategyKind activeStrategy,
		List<String> capabilities,
		List<StrategyKind> strategies,
		boolean semanticAvailable
) {

	public ResolverStatus {
		capabilities = List.copyOf(capabilities);
		strategies = List.copyOf(strategies);
	}
}
