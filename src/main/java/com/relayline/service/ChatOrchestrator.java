package com.relayline.service;

import com.relayline.cache.RequestFingerprinter;
import com.relayline.cache.ResponseCache;
import com.relayline.config.RelaylineProperties;
import com.relayline.context.AppDataContext;
import com.relayline.context.AppDataContextProvider;
import com.relayline.exception.ProviderAuthException;
import com.relayline.exception.ProviderConfigException;
import com.relayline.exception.ProviderException;
import com.relayline.health.HealthMonitor;
import com.relayline.health.HealthRegistry;
import com.relayline.model.ChatRequest;
import com.relayline.model.Message;
import com.relayline.model.ProviderResponse;
import com.relayline.model.QueryType;
import com.relayline.model.TokenUsage;
import com.relayline.provider.ChatOptions;
import com.relayline.provider.ChatProvider;
import com.relayline.provider.ProviderId;
import com.relayline.provider.ProviderRegistry;
import com.relayline.ratelimit.RateLimitStatus;
import com.relayline.ratelimit.RateLimiter;
import com.relayline.routing.FallbackChain;
import com.relayline.routing.FallbackChainSelector;
import com.relayline.routing.QueryClassifier;
import com.relayline.usage.UsageEvent;
import com.relayline.usage.UsageLogger;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Routes one chat request to a provider and always produces exactly one response.
 *
 * <p>Flow: cache lookup, opportunistic health refresh, classification, chain selection, optional
 * app-data load, then providers tried strictly one after another until one succeeds. An exhausted chain
 * yields the query type's degradation text; any unexpected error yields the fixed apology. The whole
 * pipeline is bounded by the request deadline, and cancelling the subscription cancels the in-flight
 * provider call.
 */
@Slf4j
public class ChatOrchestrator {

    private final ProviderRegistry providerRegistry;
    private final HealthRegistry healthRegistry;
    private final HealthMonitor healthMonitor;
    private final FallbackChainSelector chainSelector;
    private final QueryClassifier classifier;
    private final RateLimiter rateLimiter;
    private final ResponseCache responseCache;
    private final RequestFingerprinter fingerprinter;
    private final UsageLogger usageLogger;
    private final AppDataContextProvider appDataProvider;
    private final PromptBuilder promptBuilder;
    private final ModelSelector modelSelector;
    private final ApplicationEventPublisher eventPublisher;
    private final Scheduler usageScheduler;
    private final Clock clock;

    private final Duration requestDeadline;
    private final Duration appDataTimeout;
    private final boolean attemptUnhealthyPreferred;

    @Builder
    public ChatOrchestrator(
            ProviderRegistry providerRegistry,
            HealthRegistry healthRegistry,
            HealthMonitor healthMonitor,
            FallbackChainSelector chainSelector,
            QueryClassifier classifier,
            RateLimiter rateLimiter,
            ResponseCache responseCache,
            RequestFingerprinter fingerprinter,
            UsageLogger usageLogger,
            AppDataContextProvider appDataProvider,
            PromptBuilder promptBuilder,
            ModelSelector modelSelector,
            ApplicationEventPublisher eventPublisher,
            Scheduler usageScheduler,
            Clock clock,
            RelaylineProperties properties) {
        this.providerRegistry = providerRegistry;
        this.healthRegistry = healthRegistry;
        this.healthMonitor = healthMonitor;
        this.chainSelector = chainSelector;
        this.classifier = classifier;
        this.rateLimiter = rateLimiter;
        this.responseCache = responseCache;
        this.fingerprinter = fingerprinter;
        this.usageLogger = usageLogger;
        this.appDataProvider = appDataProvider;
        this.promptBuilder = promptBuilder;
        this.modelSelector = modelSelector;
        this.eventPublisher = eventPublisher;
        this.usageScheduler = usageScheduler;
        this.clock = clock;
        this.requestDeadline = properties.getOrchestrator().getRequestDeadline();
        this.appDataTimeout = properties.getOrchestrator().getAppDataTimeout();
        this.attemptUnhealthyPreferred = properties.getRouting().isAttemptUnhealthyPreferred();
    }

    /**
     * Process a chat request. The returned Mono never signals an error.
     */
    public Mono<ProviderResponse> process(ChatRequest request) {
        return Mono.defer(() -> {
            RequestState state = new RequestState(newRequestId());
            log.info("[{}] Processing request for user {}", state.requestId, request.getUserId());

            return orchestrate(request, state)
                    .timeout(requestDeadline, Mono.fromSupplier(() -> {
                        log.warn("[{}] Request deadline of {} exceeded", state.requestId, requestDeadline);
                        return degrade(request, state);
                    }))
                    .onErrorResume(error -> {
                        log.error("[{}] Critical error during orchestration", state.requestId, error);
                        return Mono.just(FallbackResponses.critical(state.elapsedMs()));
                    });
        });
    }

    private Mono<ProviderResponse> orchestrate(ChatRequest request, RequestState state) {
        String fingerprint = fingerprinter.fingerprint(request);

        return Mono.fromCallable(() -> responseCache.get(fingerprint))
                .flatMap(hit -> hit.isPresent()
                        ? Mono.just(cacheHit(request, hit.get(), state))
                        : route(request, fingerprint, state));
    }

    private ProviderResponse cacheHit(ChatRequest request, ProviderResponse cached, RequestState state) {
        ProviderResponse response = cached.toBuilder()
                .cached(true)
                .latencyMs(state.elapsedMs())
                .build();
        log.info("[{}] Cache hit, provider={}", state.requestId, response.getProvider());
        logUsage(() -> usageLogger.logSuccess(usageEvent(request, state)
                .provider(response.getProvider())
                .modelUsed(response.getModelUsed())
                .tokensInput(response.getTokensUsed().getInput())
                .tokensOutput(response.getTokensUsed().getOutput())
                .latencyMs(response.getLatencyMs())
                .cached(true)
                .queryType(response.getQueryType())
                .tierUsed(response.getTierUsed())
                .fallbackUsed(false)
                .build()));
        return response;
    }

    private Mono<ProviderResponse> route(ChatRequest request, String fingerprint, RequestState state) {
        if (healthMonitor.refreshIfStale()) {
            log.debug("[{}] Triggered background health sweep", state.requestId);
        }

        QueryType queryType = classifier.classify(request.getMessage());
        state.queryType = queryType;

        FallbackChain chain = chainSelector.select(queryType, request.getPreferredProvider());
        log.info("[{}] query_type={} chain={}", state.requestId, queryType, chain.getProviders());

        return loadAppData(request, state)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(context -> {
                    List<Message> messages = promptBuilder.build(request, queryType, context.orElse(null));
                    return Flux.fromIterable(chain.getProviders())
                            .concatMap(id -> attempt(id, chain, messages, request, fingerprint, state))
                            .next()
                            .switchIfEmpty(Mono.fromSupplier(() -> degrade(request, state)));
                });
    }

    private Mono<AppDataContext> loadAppData(ChatRequest request, RequestState state) {
        if (!request.wantsAppData()) {
            return Mono.empty();
        }
        return Mono.defer(() -> appDataProvider.load(request.getUserId()))
                .timeout(appDataTimeout)
                .onErrorResume(error -> {
                    log.warn("[{}] App data context unavailable, continuing without it: {}",
                            state.requestId, error.toString());
                    return Mono.empty();
                });
    }

    /**
     * One chain entry. Completes empty when the provider is skipped or fails. A started call holds its
     * rate-limit slot even if it fails, since the upstream quota was spent either way.
     */
    private Mono<ProviderResponse> attempt(
            ProviderId id,
            FallbackChain chain,
            List<Message> messages,
            ChatRequest request,
            String fingerprint,
            RequestState state) {
        return Mono.defer(() -> {
            Optional<ChatProvider> provider = providerRegistry.get(id);
            if (provider.isEmpty()) {
                log.warn("[{}] Skipping {}: no adapter registered", state.requestId, id);
                return Mono.empty();
            }

            boolean forcePreferred = attemptUnhealthyPreferred
                    && chain.isPreferred(id)
                    && healthRegistry.isConfigured(id);
            if (!healthRegistry.isHealthy(id) && !forcePreferred) {
                log.info("[{}] Skipping {}: marked unhealthy", state.requestId, id);
                return Mono.empty();
            }

            RateLimiter.Permit permit = rateLimiter.tryAcquire(id);
            if (!permit.isGranted()) {
                RateLimitStatus limit = permit.getStatus();
                log.info("[{}] Skipping {}: rate limited ({} requests, {} tokens in window)",
                        state.requestId, id, limit.getRequests(), limit.getTokens());
                return Mono.empty();
            }

            String model = modelSelector.modelFor(id, state.queryType);
            long attemptStart = System.nanoTime();
            log.info("[{}] Trying provider {} (tier {}) with model {}", state.requestId, id, id.getTier(), model);

            return provider.get().chat(messages, model, ChatOptions.defaults())
                    .switchIfEmpty(Mono.error(() -> new ProviderException(id, "adapter completed without a response")))
                    .onErrorResume(error -> {
                        onFailure(id, model, error, request, state, (System.nanoTime() - attemptStart) / 1_000_000);
                        return Mono.empty();
                    })
                    .map(response -> onSuccess(id, permit, response, request, fingerprint, state));
        });
    }

    private ProviderResponse onSuccess(
            ProviderId id,
            RateLimiter.Permit permit,
            ProviderResponse response,
            ChatRequest request,
            String fingerprint,
            RequestState state) {
        TokenUsage tokens = response.getTokensUsed() != null ? response.getTokensUsed() : TokenUsage.zero();
        RateLimitStatus limit = rateLimiter.complete(permit, tokens.total());
        healthRegistry.recordSuccess(id, response.getLatencyMs());

        ProviderResponse result = response.toBuilder()
                .provider(id.getWireName())
                .queryType(state.queryType)
                .tierUsed(id.getTier())
                .cached(false)
                .tokensUsed(tokens)
                .webSearchEnabled(false)
                .fallbackUsed(state.fallbackUsed)
                .limitApproaching(limit.isApproaching())
                .build();

        logUsage(() -> usageLogger.logSuccess(usageEvent(request, state)
                .provider(id.getWireName())
                .modelUsed(result.getModelUsed())
                .tokensInput(tokens.getInput())
                .tokensOutput(tokens.getOutput())
                .latencyMs(result.getLatencyMs())
                .cached(false)
                .queryType(state.queryType)
                .tierUsed(id.getTier())
                .fallbackUsed(state.fallbackUsed)
                .build()));

        responseCache.put(fingerprint, result);

        log.info("[{}] Success with provider {} in {}ms", state.requestId, id, result.getLatencyMs());
        return result;
    }

    private void onFailure(
            ProviderId id, String model, Throwable error, ChatRequest request, RequestState state, long latencyMs) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();

        logUsage(() -> usageLogger.logFailure(usageEvent(request, state)
                .provider(id.getWireName())
                .modelUsed(model != null ? model : "unknown")
                .latencyMs(latencyMs)
                .queryType(state.queryType)
                .tierUsed(id.getTier())
                .fallbackUsed(state.fallbackUsed)
                .errorMessage(message)
                .build()));

        log.warn("[{}] Provider {} failed: {}", state.requestId, id, message);

        if (error instanceof ProviderAuthException authError) {
            healthRegistry.markUnhealthy(id, message);
            eventPublisher.publishEvent(new ProviderAuthFailureEvent(
                    state.requestId, id, authError.getStatus(), message, clock.instant()));
        } else if (error instanceof ProviderConfigException) {
            healthRegistry.markUnhealthy(id, message);
        } else {
            healthRegistry.recordFailure(id, message);
        }

        state.fallbackUsed = true;
    }

    private ProviderResponse degrade(ChatRequest request, RequestState state) {
        ProviderResponse response = FallbackResponses.degradation(state.queryType, state.fallbackUsed, state.elapsedMs());
        log.warn("[{}] All providers failed, returning graceful degradation", state.requestId);

        logUsage(() -> usageLogger.logFailure(usageEvent(request, state)
                .provider(ProviderResponse.SYSTEM_PROVIDER)
                .modelUsed(FallbackResponses.DEGRADATION_MODEL)
                .latencyMs(response.getLatencyMs())
                .queryType(response.getQueryType())
                .tierUsed(ProviderResponse.SYSTEM_TIER)
                .fallbackUsed(state.fallbackUsed)
                .errorMessage("All providers failed - graceful degradation")
                .build()));
        return response;
    }

    private UsageEvent.UsageEventBuilder usageEvent(ChatRequest request, RequestState state) {
        return UsageEvent.builder()
                .requestId(state.requestId)
                .userId(request.getUserId());
    }

    /**
     * Fire-and-forget; usage logging must never affect the response.
     */
    private void logUsage(Supplier<Mono<Void>> call) {
        Mono.defer(call)
                .subscribeOn(usageScheduler)
                .subscribe(
                        ignored -> { },
                        error -> log.warn("Usage logging failed: {}", error.toString()));
    }

    static String newRequestId() {
        return "req-" + System.currentTimeMillis() + "-"
                + Long.toString(ThreadLocalRandom.current().nextLong(36L * 36 * 36 * 36 * 36 * 36 * 36), 36);
    }

    /**
     * Per-request bookkeeping. Attempts run one at a time, so plain volatile fields suffice.
     */
    private static final class RequestState {

        private final String requestId;
        private final long startNanos = System.nanoTime();

        private volatile QueryType queryType = QueryType.GENERAL;
        private volatile boolean fallbackUsed;

        private RequestState(String requestId) {
            this.requestId = requestId;
        }

        private long elapsedMs() {
            return (System.nanoTime() - startNanos) / 1_000_000;
        }
    }
}
