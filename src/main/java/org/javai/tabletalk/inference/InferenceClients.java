package org.javai.tabletalk.inference;

import java.net.http.HttpClient;
import java.time.Duration;
import org.javai.tabletalk.config.TableTalkConfig.InferenceSettings;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

/**
 * Wires an {@link InferenceClient} for an OpenAI-compatible endpoint such as a local Ollama server.
 */
public final class InferenceClients {

	private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

	private InferenceClients() {
	}

	/**
	 * Every HTTP call is bounded by the configured timeout and is not retried; falling back to the
	 * next strategy replaces retrying.
	 */
	public static InferenceClient openAiCompatible(InferenceSettings settings) {
		Duration timeout = settings.timeout();
		JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(
				HttpClient.newBuilder().connectTimeout(timeout).build());
		requestFactory.setReadTimeout(timeout);

		OpenAiApi openAiApi = OpenAiApi.builder()
				.baseUrl(settings.baseUrl())
				.apiKey(settings.apiKey())
				.restClientBuilder(RestClient.builder().requestFactory(requestFactory))
				.build();
		OpenAiChatModel chatModel = OpenAiChatModel.builder()
				.openAiApi(openAiApi)
				.defaultOptions(OpenAiChatOptions.builder()
						.model(settings.model())
						.temperature(settings.temperature())
						.build())
				.retryTemplate(RetryTemplate.builder().maxAttempts(1).build())
				.build();
		ChatClient chatClient = ChatClient.builder(chatModel).build();
		return new SpringAiInferenceClient(chatClient, settings.model(), settings.temperature(),
				new HttpReachabilityProbe(settings.baseUrl(), PROBE_TIMEOUT));
	}
}
