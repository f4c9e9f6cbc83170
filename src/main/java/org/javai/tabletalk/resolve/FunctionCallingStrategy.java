package org.javai.tabletalk.resolve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.javai.tabletalk.error.PlanParseException;
import org.javai.tabletalk.inference.ChatMessage;
import org.javai.tabletalk.inference.ChatReply;
import org.javai.tabletalk.inference.InferenceClient;
import org.javai.tabletalk.inference.ModelCapabilities;
import org.javai.tabletalk.inference.ToolCallRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Advertises the registered tools to a function-calling model and takes its first tool call.
 */
public final class FunctionCallingStrategy implements ResolutionStrategy {

	private static final Logger logger = LoggerFactory.getLogger(FunctionCallingStrategy.class);
	private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {
	};

	private final InferenceClient client;
	private final PlanResolver planResolver;
	private final boolean forced;
	private final ObjectMapper mapper = new ObjectMapper();

	/**
	 * @param forced treat the model as function-calling capable whatever its identifier says
	 */
	public FunctionCallingStrategy(InferenceClient client, PlanResolver planResolver, boolean forced) {
		this.client = client;
		this.planResolver = planResolver;
		this.forced = forced;
	}

	@Override
	public StrategyKind kind() {
		return StrategyKind.FUNCTION_CALLING;
	}

	@Override
	public boolean isAvailable() {
		return forced || ModelCapabilities.supportsFunctionCalling(client.modelId());
	}

	@Override
	public ResolutionPlan parse(QueryContext context) {
		List<ChatMessage> messages = List.of(
				ChatMessage.system(StrategyPrompts.functionCalling(context.availableFiles())),
				ChatMessage.user(context.query()));
		ChatReply reply = client.chat(messages, planResolver.registry().schemas());
		if (!reply.hasToolCalls()) {
			throw new PlanParseException("Model answered without calling a tool");
		}
		ToolCallRequest call = reply.toolCalls().get(0);
		if (reply.toolCalls().size() > 1) {
			logger.debug("Model returned {} tool calls; using {}", reply.toolCalls().size(), call.name());
		}
		Map<String, Object> arguments = parseArguments(call);
		return planResolver.resolve(call.name(), arguments, context, kind(), null, null);
	}

	private Map<String, Object> parseArguments(ToolCallRequest call) {
		String json = JsonRepair.repair(call.argumentsJson())
				.orElseThrow(() -> new PlanParseException(
						"Arguments of tool call " + call.name() + " are not a JSON object: " + call.argumentsJson()));
		try {
			Map<String, Object> arguments = mapper.readValue(json, ARGUMENTS);
			return arguments != null ? arguments : Map.of();
		}
		catch (JsonProcessingException e) {
			throw new PlanParseException("Cannot read arguments of tool call " + call.name() + ": " + e.getOriginalMessage(), e);
		}
	}
}
