package com.williamcallahan.inference.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.inference.domain.ProviderConfig;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

/**
 * Calls any provider exposing the OpenAI chat completions API.
 *
 * <p>Images are sent as a {@code data:} URL content part. Each request authenticates with the credential at its
 * {@link InferenceRequest#credentialIndex()}. Upstream error responses become {@link ProviderCallException}s
 * carrying the HTTP status and any advertised retry delay.</p>
 */
public class OpenAiCompatibleInferenceClient implements InferenceClient {
    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleInferenceClient.class);

    private static final String COMPLETIONS_PATH = "/chat/completions";
    private static final int MAX_ERROR_BODY_CHARS = 500;

    private final String providerName;
    private final WebClient webClient;
    private final List<String> apiKeys;
    private final Duration requestTimeout;
    private final RateLimitHeaderParser headerParser;

    /**
     * Creates a client for one catalogue provider.
     *
     * @param provider provider with a base URL
     * @param apiKeys bearer credentials in rotation order; entries may be null or blank when a variable is unset
     * @param webClientBuilder shared builder, cloned per client
     * @param requestTimeout upper bound for one HTTP exchange
     * @param clock time source for HTTP-date retry headers
     */
    public OpenAiCompatibleInferenceClient(
            ProviderConfig provider,
            List<String> apiKeys,
            WebClient.Builder webClientBuilder,
            Duration requestTimeout,
            Clock clock) {
        Objects.requireNonNull(provider, "provider");
        if (!provider.hasEndpoint()) {
            throw new IllegalArgumentException("Provider " + provider.name() + " has no base URL");
        }
        this.providerName = provider.name();
        this.apiKeys = apiKeys == null ? List.of() : new ArrayList<>(apiKeys);
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.headerParser = new RateLimitHeaderParser(clock);
        this.webClient = webClientBuilder.clone().baseUrl(stripTrailingSlash(provider.baseUrl())).build();
    }

    @Override
    public String providerName() {
        return providerName;
    }

    @Override
    public String generate(InferenceRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.model() == null || request.model().isBlank()) {
            throw new IllegalArgumentException("InferenceRequest.model is required");
        }
        WebClient.RequestBodySpec spec = webClient.post()
                .uri(COMPLETIONS_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON);
        String apiKey = request.credentialIndex() < apiKeys.size() ? apiKeys.get(request.credentialIndex()) : null;
        if (apiKey != null && !apiKey.isBlank()) {
            spec = spec.header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }
        try {
            JsonNode response = spec.bodyValue(buildBody(request))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, this::toProviderFailure)
                    .bodyToMono(JsonNode.class)
                    .timeout(requestTimeout)
                    .block();
            return extractContent(response);
        } catch (WebClientRequestException transportFailure) {
            throw new ProviderCallException(providerName, ProviderCallException.NO_STATUS, null,
                    "Network error calling " + providerName + ": " + transportFailure.getMessage(), transportFailure);
        }
    }

    Map<String, Object> buildBody(InferenceRequest request) {
        Object content;
        if (request.hasImage()) {
            List<Map<String, Object>> parts = new ArrayList<>();
            parts.add(Map.of("type", "text", "text", request.prompt()));
            String dataUrl = "data:" + request.imageMimeType() + ";base64," + request.imageData();
            parts.add(Map.of("type", "image_url", "image_url", Map.of("url", dataUrl)));
            content = parts;
        } else {
            content = request.prompt();
        }
        return Map.of(
                "model", request.model(),
                "messages", List.of(Map.of("role", "user", "content", content)),
                "stream", false);
    }

    private Mono<? extends Throwable> toProviderFailure(ClientResponse response) {
        int status = response.statusCode().value();
        Long retryAfterSeconds = headerParser.retryAfterSeconds(response.headers().asHttpHeaders());
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    String excerpt = body.length() > MAX_ERROR_BODY_CHARS ? body.substring(0, MAX_ERROR_BODY_CHARS) : body;
                    log.debug("[{}] Upstream returned HTTP {} (retryAfterSeconds={})",
                            providerName, status, retryAfterSeconds);
                    return new ProviderCallException(
                            providerName, status, retryAfterSeconds, "HTTP " + status + " from " + providerName + ": " + excerpt);
                });
    }

    private String extractContent(JsonNode response) {
        JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
        if (content == null || content.isMissingNode() || content.isNull()) {
            throw new ProviderCallException(providerName, ProviderCallException.NO_STATUS, null,
                    "Provider " + providerName + " returned no completion content");
        }
        return content.asText();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
