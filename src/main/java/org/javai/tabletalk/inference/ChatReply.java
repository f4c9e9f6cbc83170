package org.javai.tabletalk.inference;

import java.util.List;

/**
 * A model reply: text content, tool calls, or both.
 */
public record ChatReply(String content, List<ToolCallRequest> toolCalls) {

	public ChatReply {
		content = content != null ? content : "";
		toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
	}

	public static ChatReply text(String content) {
		return new ChatReply(content, List.of());
	}

	public boolean hasToolCalls() {
		return !toolCalls.isEmpty();
	}
}
