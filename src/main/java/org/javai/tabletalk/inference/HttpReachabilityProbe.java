package org.javai.tabletalk.inference;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks that an OpenAI-compatible endpoint answers {@code GET /v1/models}.
 */
public final class HttpReachabilityProbe implements BooleanSupplier {

	private static final Logger logger = LoggerFactory.getLogger(HttpReachabilityProbe.class);

	private final URI modelsUri;
	private final Duration timeout;
	private final HttpClient httpClient;

	public HttpReachabilityProbe(String baseUrl, Duration timeout) {
		String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.modelsUri = URI.create(base + "/v1/models");
		this.timeout = timeout;
		this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
	}

	@Override
	public boolean getAsBoolean() {
		HttpRequest request = HttpRequest.newBuilder(modelsUri).timeout(timeout).GET().build();
		try {
			HttpResponse<Void> response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
			return response.statusCode() < 500;
		}
		catch (IOException e) {
			logger.debug("Inference endpoint {} unreachable: {}", modelsUri, e.getMessage());
			return false;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}
}
