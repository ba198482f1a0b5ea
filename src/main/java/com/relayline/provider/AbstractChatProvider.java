package com.relayline.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayline.config.RelaylineProperties;
import com.relayline.exception.ProviderAuthException;
import com.relayline.exception.ProviderConfigException;
import com.relayline.exception.ProviderException;
import com.relayline.exception.ProviderTimeoutException;
import com.relayline.exception.TransientProviderException;
import com.relayline.model.Message;
import com.relayline.model.ProviderResponse;
import com.relayline.model.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Abstract base class for chat providers with common functionality.
 *
 * <p>Subclasses supply the wire format ({@link #buildPayload}, {@link #send}, {@link #parseResponse});
 * this class owns the call timeout, error classification, bounded exponential-backoff retry of
 * transient failures, and the health probe.
 */
@Slf4j
public abstract class AbstractChatProvider implements ChatProvider {

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final RelaylineProperties properties;
    protected final RelaylineProperties.ProviderConfig config;

    private final ProviderId id;

    protected AbstractChatProvider(
            ProviderId id,
            WebClient webClient,
            ObjectMapper objectMapper,
            RelaylineProperties properties) {
        this.id = id;
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.config = properties.provider(id);
    }

    @Override
    public ProviderId getId() {
        return id;
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && config.hasApiKey();
    }

    @Override
    public Mono<ProviderResponse> chat(List<Message> messages, String model, ChatOptions options) {
        if (!isEnabled()) {
            return Mono.error(new ProviderConfigException(id, "provider is not enabled or has no API key"));
        }

        ChatOptions effective = options != null ? options : ChatOptions.defaults();
        String resolvedModel = model != null ? model : defaultModel();
        Duration timeout = effective.getTimeout() != null ? effective.getTimeout() : config.getTimeout();

        return Mono.defer(() -> {
            log.info("Forwarding request to {}: model={}", id, resolvedModel);
            long startNanos = System.nanoTime();

            Mono<JsonNode> attempt = Mono.defer(() -> send(buildPayload(messages, resolvedModel, effective), resolvedModel))
                    .switchIfEmpty(Mono.error(this::emptyBody))
                    .timeout(timeout)
                    .onErrorMap(error -> classify(error, timeout));

            return executeWithRetry(attempt)
                    .map(body -> parse(body, resolvedModel, elapsedMs(startNanos)));
        });
    }

    @Override
    public Mono<HealthCheckResult> healthCheck() {
        if (!isEnabled()) {
            return Mono.just(HealthCheckResult.unhealthy(0, "provider is not configured"));
        }

        RelaylineProperties.HealthConfig health = properties.getHealth();
        ChatOptions probeOptions = ChatOptions.builder()
                .maxTokens(health.getProbeMaxTokens())
                .build();

        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            return Mono.defer(() -> send(
                            buildPayload(List.of(Message.user(health.getProbePrompt())), defaultModel(), probeOptions),
                            defaultModel()))
                    .switchIfEmpty(Mono.error(this::emptyBody))
                    .timeout(health.getProbeTimeout())
                    .map(body -> HealthCheckResult.healthy(elapsedMs(startNanos)))
                    .onErrorResume(error -> Mono.just(HealthCheckResult.unhealthy(
                            elapsedMs(startNanos),
                            classify(error, health.getProbeTimeout()).getMessage())));
        });
    }

    /**
     * Execute request with retry logic. Only transient failures are retried; the last failure
     * is rethrown once attempts are exhausted.
     */
    protected <T> Mono<T> executeWithRetry(Mono<T> request) {
        int retries = Math.max(0, config.getMaxAttempts() - 1);
        return request
                .retryWhen(Retry.backoff(retries, config.getInitialBackoff())
                        .maxBackoff(config.getMaxBackoff())
                        .filter(this::isRetryable)
                        .doBeforeRetry(signal -> log.warn("Retrying {} after transient failure (retry {}/{}): {}",
                                id, signal.totalRetries() + 1, retries, signal.failure().getMessage()))
                        .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()))
                .doOnSuccess(response -> log.debug("Request succeeded for provider: {}", id))
                .doOnError(error -> log.warn("Request failed for provider {}: {}", id, error.getMessage()));
    }

    /**
     * Check if an error is retryable.
     */
    protected boolean isRetryable(Throwable throwable) {
        return throwable instanceof ProviderException providerException && providerException.isTransient();
    }

    /**
     * Map a raw transport error onto the provider error taxonomy.
     */
    protected ProviderException classify(Throwable error, Duration timeout) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }
        if (error instanceof TimeoutException) {
            return new ProviderTimeoutException(id, timeout, error);
        }
        if (error instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            String message = "API error " + status + ": " + truncate(responseException.getResponseBodyAsString(), 200);
            if (status == 401 || status == 403) {
                return new ProviderAuthException(id, status, "authentication failed - check API key", error);
            }
            if (status == 429 || status >= 500) {
                return new TransientProviderException(id, status, message, error);
            }
            return new ProviderException(id, status, message, error);
        }
        if (error instanceof WebClientRequestException) {
            return new TransientProviderException(id, "connection failure: " + error.getMessage(), error);
        }
        return new ProviderException(id, String.valueOf(error.getMessage()), error);
    }

    /**
     * Base URL from configuration, or the provider's public endpoint.
     */
    protected String baseUrl() {
        String configured = config.getBaseUrl();
        String url = configured != null && !configured.isBlank() ? configured : defaultBaseUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    protected double temperature(ChatOptions options) {
        return options.getTemperature() != null ? options.getTemperature() : config.getTemperature();
    }

    protected int maxTokens(ChatOptions options) {
        return options.getMaxTokens() != null ? options.getMaxTokens() : config.getMaxTokens();
    }

    protected ProviderResponse buildResponse(String content, String modelUsed, TokenUsage usage, long latencyMs) {
        if (content == null || content.isBlank()) {
            throw new ProviderException(id, "response contained no content");
        }
        return ProviderResponse.builder()
                .content(content)
                .modelUsed(modelUsed)
                .provider(id.getWireName())
                .tierUsed(getTier())
                .cached(false)
                .tokensUsed(usage != null ? usage : TokenUsage.zero())
                .latencyMs(latencyMs)
                .build();
    }

    protected static int intOrZero(JsonNode node) {
        return node != null && node.isNumber() ? node.asInt() : 0;
    }

    /**
     * Public API root used when no base URL is configured.
     */
    protected abstract String defaultBaseUrl();

    /**
     * Model used for probes and when the caller passes none.
     */
    protected abstract String defaultModel();

    /**
     * Convert provider-neutral messages to the provider's request body.
     */
    protected abstract JsonNode buildPayload(List<Message> messages, String model, ChatOptions options);

    /**
     * Send one request. Implementations must not retry or apply timeouts.
     */
    protected abstract Mono<JsonNode> send(JsonNode payload, String model);

    /**
     * Convert the provider's response body to the common shape.
     */
    protected abstract ProviderResponse parseResponse(JsonNode body, String model, long latencyMs);

    private ProviderResponse parse(JsonNode body, String model, long latencyMs) {
        try {
            return parseResponse(body, model, latencyMs);
        } catch (ProviderException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderException(id, "failed to parse response: " + e.getMessage(), e);
        }
    }

    private ProviderException emptyBody() {
        return new ProviderException(id, "empty response body");
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() <= max ? value : value.substring(0, max) + "...";
    }
}
