package org.javai.tabletalk;

import java.util.List;
import org.javai.tabletalk.error.TableTalkException;
import org.javai.tabletalk.inference.ChatMessage;
import org.javai.tabletalk.inference.ChatReply;
import org.javai.tabletalk.inference.InferenceClient;
import org.javai.tabletalk.resolve.ResolutionPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Has the model restate tool output as a short answer to the question. Any failure, timeouts
 * included, returns the tool output unchanged.
 */
public final class ModelResponseSynthesizer implements ResponseSynthesizer {

	private static final Logger logger = LoggerFactory.getLogger(ModelResponseSynthesizer.class);

	private static final String SYSTEM_PROMPT = """
			You answer questions about data file schemas. Rewrite the analysis result below as a concise answer
			to the user's question. Keep every file name, column name and number exactly as given.
			Do not add facts that are not in the result.""";

	private final InferenceClient client;

	public ModelResponseSynthesizer(InferenceClient client) {
		this.client = client;
	}

	@Override
	public String synthesize(String query, ResolutionPlan plan, String toolOutput) {
		String user = "Question: " + query + "\n\nAnalysis result (" + plan.toolName() + "):\n" + toolOutput;
		try {
			ChatReply reply = client.chat(List.of(ChatMessage.system(SYSTEM_PROMPT), ChatMessage.user(user)));
			if (reply.content().isBlank()) {
				logger.debug("Empty synthesis reply; returning tool output");
				return toolOutput;
			}
			return reply.content().strip();
		}
		catch (TableTalkException e) {
			logger.warn("Response synthesis failed ({}); returning tool output", e.getMessage());
			return toolOutput;
		}
	}
}
