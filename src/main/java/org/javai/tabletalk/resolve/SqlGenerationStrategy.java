package org.javai.tabletalk.resolve;

import java.util.List;
import java.util.Map;
import org.javai.tabletalk.inference.ChatMessage;
import org.javai.tabletalk.inference.ChatReply;
import org.javai.tabletalk.inference.InferenceClient;
import org.javai.tabletalk.sql.ReadOnlySql;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Has the model write a read-only query over {@code schema_info} and plans it as {@code execute_sql}.
 * <p>
 * Anything but a single {@code SELECT} or {@code WITH} statement is rejected before a plan exists.
 * When the query fails to run, up to {@value #MAX_REGENERATIONS} simpler queries are requested, each
 * prompt showing the previous query and its error.
 */
public final class SqlGenerationStrategy implements ResolutionStrategy {

	private static final Logger logger = LoggerFactory.getLogger(SqlGenerationStrategy.class);

	static final String TOOL = "execute_sql";
	static final int MAX_REGENERATIONS = 2;

	private final InferenceClient client;
	private final PlanResolver planResolver;
	private final boolean enabled;

	/**
	 * @param enabled whether SQL generation was chosen in configuration
	 */
	public SqlGenerationStrategy(InferenceClient client, PlanResolver planResolver, boolean enabled) {
		this.client = client;
		this.planResolver = planResolver;
		this.enabled = enabled;
	}

	@Override
	public StrategyKind kind() {
		return StrategyKind.SQL_GENERATION;
	}

	@Override
	public boolean isAvailable() {
		return enabled && planResolver.registry().contains(TOOL);
	}

	@Override
	public ResolutionPlan parse(QueryContext context) {
		return generate(context, StrategyPrompts.sqlGeneration(), "Answer with SQL");
	}

	@Override
	public int maxExecutionRetries() {
		return MAX_REGENERATIONS;
	}

	@Override
	public ResolutionPlan replan(QueryContext context, ResolutionPlan failed, String failure) {
		String previous = String.valueOf(failed.parameters().get("sql"));
		logger.debug("Regenerating SQL after failure: {}", failure);
		return generate(context, StrategyPrompts.simplifiedSqlGeneration(previous, failure), "Answer with simplified SQL");
	}

	private ResolutionPlan generate(QueryContext context, String systemPrompt, String intent) {
		ChatReply reply = client.chat(List.of(ChatMessage.system(systemPrompt), ChatMessage.user(context.query())));
		ReadOnlySql sql = ReadOnlySql.fromSql(reply.content());
		logger.debug("Generated SQL: {}", sql.sql());
		return planResolver.resolve(TOOL, Map.of("sql", sql.sql()), context, kind(), intent, null);
	}
}
