package org.javai.tabletalk.inference;

import java.util.List;
import org.javai.tabletalk.tools.ToolDescriptor;

/**
 * The chat endpoint the model-backed strategies talk to.
 * <p>
 * Calls block the caller for at most the configured timeout. A timeout or an unreachable endpoint
 * raises {@link org.javai.tabletalk.error.InferenceTimeoutException}; any other endpoint failure
 * raises {@link org.javai.tabletalk.error.PlanParseException}. Both send the orchestrator to the
 * next strategy.
 */
public interface InferenceClient {

	String modelId();

	/**
	 * Cheap probe of whether the endpoint answers at all.
	 */
	boolean isReachable();

	/**
	 * Sends a conversation, optionally advertising tools. Advertised tools are never executed by the
	 * client; the reply carries the model's chosen calls.
	 */
	ChatReply chat(List<ChatMessage> messages, List<ToolDescriptor> tools);

	default ChatReply chat(List<ChatMessage> messages) {
		return chat(messages, List.of());
	}
}
