package org.javai.tabletalk.resolve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import org.javai.tabletalk.error.PlanParseException;
import org.javai.tabletalk.inference.ChatMessage;
import org.javai.tabletalk.inference.ChatReply;
import org.javai.tabletalk.inference.InferenceClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks a plain chat model for a JSON object naming one tool, repairs the usual formatting slips and
 * validates the result.
 */
public final class StructuredOutputStrategy implements ResolutionStrategy {

	private static final Logger logger = LoggerFactory.getLogger(StructuredOutputStrategy.class);

	private final InferenceClient client;
	private final PlanResolver planResolver;
	private final ObjectMapper mapper = new ObjectMapper();

	public StructuredOutputStrategy(InferenceClient client, PlanResolver planResolver) {
		this.client = client;
		this.planResolver = planResolver;
	}

	@Override
	public StrategyKind kind() {
		return StrategyKind.STRUCTURED_OUTPUT;
	}

	@Override
	public boolean isAvailable() {
		return client.isReachable();
	}

	@Override
	public ResolutionPlan parse(QueryContext context) {
		String system = StrategyPrompts.structuredOutput(planResolver.registry().schemas(), context.availableFiles());
		ChatReply reply = client.chat(List.of(ChatMessage.system(system), ChatMessage.user(context.query())));
		logger.debug("Structured output reply:\n{}", reply.content());

		String json = JsonRepair.repair(reply.content())
				.orElseThrow(() -> new PlanParseException("Model reply contains no JSON object"));
		RawPlan raw;
		try {
			raw = RawPlan.fromJson(json, mapper);
		}
		catch (JsonProcessingException e) {
			throw new PlanParseException("Model reply is not a valid plan: " + e.getOriginalMessage(), e);
		}
		if (raw.tool() == null || raw.tool().isBlank()) {
			throw new PlanParseException("Model reply names no tool");
		}
		return planResolver.resolve(raw.tool().trim(), raw.parameters(), context, kind(), raw.intent(), raw.confidence());
	}
}
