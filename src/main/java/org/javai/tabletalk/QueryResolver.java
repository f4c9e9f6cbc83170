package org.javai.tabletalk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import org.javai.tabletalk.error.ErrorKind;
import org.javai.tabletalk.error.TableTalkException;
import org.javai.tabletalk.resolve.QueryContext;
import org.javai.tabletalk.resolve.ResolutionPlan;
import org.javai.tabletalk.resolve.ResolutionStrategy;
import org.javai.tabletalk.resolve.StrategyKind;
import org.javai.tabletalk.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers a question by walking the strategy chain until one plan runs.
 * <p>
 * Strategies are tried in priority order, a configured preference first. A strategy that is
 * unavailable is skipped; one that fails to produce a valid plan, or whose plan fails to run, hands
 * over to the next. Pattern matching always closes the chain and never fails to plan, so every
 * question reaches a tool. Only a failure of that last tool is reported to the user, as a short
 * message with a suggestion.
 */
public class QueryResolver {

	private static final Logger logger = LoggerFactory.getLogger(QueryResolver.class);

	private final List<ResolutionStrategy> chain;
	private final ToolRegistry registry;
	private final ResponseSynthesizer synthesizer;
	private final BooleanSupplier semanticAvailable;

	/**
	 * @param strategies        the strategies; exactly one must be pattern matching
	 * @param preferred         strategy to try first, or {@code null} for priority order
	 * @param registry          tools the plans run against
	 * @param synthesizer       final rewrite of tool output
	 * @param semanticAvailable whether embedding-based analyses can run, for status reports
	 */
	public QueryResolver(List<ResolutionStrategy> strategies, StrategyKind preferred, ToolRegistry registry,
			ResponseSynthesizer synthesizer, BooleanSupplier semanticAvailable) {
		this.chain = orderChain(strategies, preferred);
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.synthesizer = synthesizer != null ? synthesizer : ResponseSynthesizer.PASS_THROUGH;
		this.semanticAvailable = semanticAvailable != null ? semanticAvailable : () -> false;
		logger.info("Strategy chain: {}", chain.stream().map(ResolutionStrategy::kind).toList());
	}

	private static List<ResolutionStrategy> orderChain(List<ResolutionStrategy> strategies, StrategyKind preferred) {
		List<ResolutionStrategy> terminal = strategies.stream()
				.filter(s -> s.kind() == StrategyKind.PATTERN_MATCHING)
				.toList();
		if (terminal.size() != 1) {
			throw new IllegalArgumentException("Exactly one pattern matching strategy is required, found " + terminal.size());
		}
		List<ResolutionStrategy> ordered = new ArrayList<>(strategies.stream()
				.filter(s -> s.kind() != StrategyKind.PATTERN_MATCHING)
				.sorted(Comparator.comparingInt(ResolutionStrategy::priority))
				.toList());
		if (preferred != null && preferred != StrategyKind.PATTERN_MATCHING) {
			ordered.stream().filter(s -> s.kind() == preferred).findFirst().ifPresent(s -> {
				ordered.remove(s);
				ordered.add(0, s);
			});
		}
		ordered.add(terminal.get(0));
		return List.copyOf(ordered);
	}

	public List<StrategyKind> chain() {
		return chain.stream().map(ResolutionStrategy::kind).toList();
	}

	/**
	 * Answers a question with text. Never throws for a failed resolution.
	 */
	public String resolveAndExecute(String query, List<String> availableFiles) {
		return resolve(query, availableFiles).response();
	}

	public ResolutionResult resolve(String query, List<String> availableFiles) {
		QueryContext context = new QueryContext(query, availableFiles);
		if (context.query().isEmpty()) {
			return new ResolutionResult(getHelpText(), null, ResolutionMetrics.empty());
		}
		List<AttemptRecord> attempts = new ArrayList<>();
		TableTalkException lastFailure = null;
		boolean fellBack = false;

		for (ResolutionStrategy strategy : chain) {
			if (!isAvailable(strategy)) {
				logger.debug("Strategy {} unavailable; skipping", strategy.kind());
				attempts.add(new AttemptRecord(strategy.kind(), 1, AttemptOutcome.SKIPPED, 0, null));
				continue;
			}
			long start = System.nanoTime();
			ResolutionPlan plan;
			try {
				plan = strategy.parse(context);
			}
			catch (TableTalkException e) {
				attempts.add(failure(strategy.kind(), 1, e.kind(), start, e.getMessage()));
				logger.warn("Strategy {} failed to plan ({}: {}); falling back", strategy.kind(), e.kind(), e.getMessage());
				lastFailure = e;
				fellBack = true;
				continue;
			}
			catch (RuntimeException e) {
				attempts.add(failure(strategy.kind(), 1, ErrorKind.PARSE_ERROR, start, e.toString()));
				logger.warn("Strategy {} failed unexpectedly; falling back", strategy.kind(), e);
				fellBack = true;
				continue;
			}
			if (fellBack) {
				plan = plan.asFallback();
			}

			int attempt = 1;
			while (true) {
				try {
					String output = registry.execute(plan.toolName(), plan.parameters());
					attempts.add(new AttemptRecord(strategy.kind(), attempt, AttemptOutcome.SUCCESS, elapsedMillis(start), null));
					logger.debug("Plan {} succeeded", plan);
					String response = synthesize(context.query(), plan, output);
					return new ResolutionResult(response, plan, new ResolutionMetrics(strategy.kind(), attempts));
				}
				catch (TableTalkException e) {
					attempts.add(failure(strategy.kind(), attempt, e.kind(), start, e.getMessage()));
					lastFailure = e;
					if (e.kind() != ErrorKind.TOOL_EXECUTION || attempt > strategy.maxExecutionRetries()) {
						logger.warn("Plan {} failed ({}: {}); falling back", plan, e.kind(), e.getMessage());
						break;
					}
					logger.warn("Plan {} failed ({}); re-planning, attempt {} of {}", plan, e.getMessage(),
							attempt + 1, strategy.maxExecutionRetries() + 1);
					start = System.nanoTime();
					attempt++;
					try {
						plan = strategy.replan(context, plan, e.getMessage()).asFallback();
					}
					catch (TableTalkException replanFailure) {
						attempts.add(failure(strategy.kind(), attempt, replanFailure.kind(), start, replanFailure.getMessage()));
						lastFailure = replanFailure;
						logger.warn("Strategy {} failed to re-plan ({}); falling back", strategy.kind(),
								replanFailure.getMessage());
						break;
					}
					catch (RuntimeException replanFailure) {
						attempts.add(failure(strategy.kind(), attempt, ErrorKind.PARSE_ERROR, start, replanFailure.toString()));
						logger.warn("Strategy {} failed unexpectedly while re-planning; falling back", strategy.kind(),
								replanFailure);
						break;
					}
				}
			}
			fellBack = true;
		}

		// only reached when the terminal strategy's tool itself failed
		String message = lastFailure != null
				? lastFailure.toUserMessage()
				: "The question could not be answered.\nSuggestion: " + ErrorKind.PARSE_ERROR.suggestion();
		return new ResolutionResult(message, null, new ResolutionMetrics(null, attempts));
	}

	public String getHelpText() {
		ResolverStatus status = getStatus();
		StringBuilder help = new StringBuilder("""
				Ask questions about your scanned data files, for example:
				  Files:         "show me all files", "describe orders.csv", "show all schemas"
				  Search:        "which files contain customer_id", "find columns named email"
				  Statistics:    "database summary", "stats for orders.csv"
				  Relationships: "find common columns", "which files have similar schemas", "compare orders.csv and customers.csv"
				  Quality:       "detect type mismatches", "find naming inconsistencies", "detect abbreviations", "check concept types"
				  Concepts:      "group columns by concept"
				""");
		if (status.capabilities().contains("execute_sql")) {
			help.append("  SQL:           questions are answered with generated SQL when SQL generation is enabled\n");
		}
		help.append("\nActive strategy: ").append(status.activeStrategy());
		help.append("\nSemantic matching: ").append(status.semanticAvailable() ? "available" : "unavailable");
		return help.toString();
	}

	public ResolverStatus getStatus() {
		StrategyKind active = chain.stream()
				.filter(this::isAvailable)
				.map(ResolutionStrategy::kind)
				.findFirst()
				.orElse(StrategyKind.PATTERN_MATCHING);
		return new ResolverStatus(active, registry.toolNames(), chain(), semanticAvailable.getAsBoolean());
	}

	private boolean isAvailable(ResolutionStrategy strategy) {
		try {
			return strategy.isAvailable();
		}
		catch (RuntimeException e) {
			logger.warn("Availability check of {} failed: {}", strategy.kind(), e.getMessage());
			return false;
		}
	}

	private String synthesize(String query, ResolutionPlan plan, String output) {
		try {
			return synthesizer.synthesize(query, plan, output);
		}
		catch (RuntimeException e) {
			logger.warn("Response synthesis failed; returning the tool output", e);
			return output;
		}
	}

	private static AttemptRecord failure(StrategyKind strategy, int attempt, ErrorKind kind, long start, String detail) {
		return new AttemptRecord(strategy, attempt, AttemptOutcome.of(kind), elapsedMillis(start), detail);
	}

	private static long elapsedMillis(long startNanos) {
		return Math.max(0, (System.nanoTime() - startNanos) / 1_000_000);
	}
}
