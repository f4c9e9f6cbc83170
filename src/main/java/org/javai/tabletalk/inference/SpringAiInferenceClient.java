package org.javai.tabletalk.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import org.javai.tabletalk.error.InferenceTimeoutException;
import org.javai.tabletalk.error.PlanParseException;
import org.javai.tabletalk.tools.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.web.client.ResourceAccessException;

/**
 * {@link InferenceClient} on a Spring AI {@link ChatClient}.
 * <p>
 * Tools are advertised with internal tool execution switched off, so the model's choice comes back
 * as tool calls on the reply instead of being run by Spring AI.
 */
public class SpringAiInferenceClient implements InferenceClient {

	private static final Logger logger = LoggerFactory.getLogger(SpringAiInferenceClient.class);

	private final ChatClient chatClient;
	private final String modelId;
	private final double temperature;
	private final BooleanSupplier reachability;

	public SpringAiInferenceClient(ChatClient chatClient, String modelId, double temperature, BooleanSupplier reachability) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		this.modelId = Objects.requireNonNull(modelId, "modelId must not be null");
		this.temperature = temperature;
		this.reachability = reachability != null ? reachability : () -> true;
	}

	@Override
	public String modelId() {
		return modelId;
	}

	@Override
	public boolean isReachable() {
		return reachability.getAsBoolean();
	}

	@Override
	public ChatReply chat(List<ChatMessage> messages, List<ToolDescriptor> tools) {
		List<ToolCallback> callbacks = tools.stream()
				.<ToolCallback>map(DescriptorToolCallback::new)
				.toList();
		ToolCallingChatOptions options = ToolCallingChatOptions.builder()
				.model(modelId)
				.temperature(temperature)
				.toolCallbacks(callbacks)
				.internalToolExecutionEnabled(false)
				.build();
		Prompt prompt = new Prompt(toSpringMessages(messages), options);

		ChatResponse response;
		try {
			response = chatClient.prompt(prompt).call().chatResponse();
		}
		catch (ResourceAccessException e) {
			throw new InferenceTimeoutException("Inference endpoint did not answer: " + e.getMessage(), e);
		}
		catch (RuntimeException e) {
			throw new PlanParseException("Inference call failed: " + e.getMessage(), e);
		}
		if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
			throw new PlanParseException("Inference endpoint returned no result");
		}
		AssistantMessage output = response.getResult().getOutput();
		List<ToolCallRequest> toolCalls = new ArrayList<>();
		for (AssistantMessage.ToolCall call : output.getToolCalls()) {
			toolCalls.add(new ToolCallRequest(call.name(), call.arguments()));
		}
		logger.debug("Model {} replied with {} tool call(s)", modelId, toolCalls.size());
		return new ChatReply(output.getText(), toolCalls);
	}

	private static List<Message> toSpringMessages(List<ChatMessage> messages) {
		List<Message> converted = new ArrayList<>(messages.size());
		for (ChatMessage message : messages) {
			converted.add(switch (message.role()) {
				case SYSTEM -> new SystemMessage(message.content());
				case USER -> new UserMessage(message.content());
				case ASSISTANT -> new AssistantMessage(message.content());
			});
		}
		return converted;
	}
}
