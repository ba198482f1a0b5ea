package com.relayline.config;

import com.relayline.cache.RequestFingerprinter;
import com.relayline.cache.ResponseCache;
import com.relayline.context.AppDataContextProvider;
import com.relayline.context.HttpAppDataContextProvider;
import com.relayline.context.NoopAppDataContextProvider;
import com.relayline.health.HealthMonitor;
import com.relayline.health.HealthRegistry;
import com.relayline.provider.ProviderRegistry;
import com.relayline.ratelimit.RateLimiter;
import com.relayline.routing.FallbackChainSelector;
import com.relayline.routing.QueryClassifier;
import com.relayline.service.ChatOrchestrator;
import com.relayline.service.ModelSelector;
import com.relayline.service.PromptBuilder;
import com.relayline.usage.UsageLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Builds the orchestration engine. Every shared component is a single instance created here and
 * handed to its collaborators.
 */
@Slf4j
@Configuration
public class OrchestratorConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Scheduler for health sweeps and fire-and-forget usage logging.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler backgroundScheduler() {
        return Schedulers.newBoundedElastic(
                Schedulers.DEFAULT_BOUNDED_ELASTIC_SIZE,
                Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE,
                "relayline-background");
    }

    @Bean
    public HealthRegistry healthRegistry(ProviderRegistry providerRegistry, RelaylineProperties properties, Clock clock) {
        return new HealthRegistry(
                providerRegistry.enabledIds(),
                properties.getHealth().getFailureThreshold(),
                clock);
    }

    @Bean
    public FallbackChainSelector fallbackChainSelector(HealthRegistry healthRegistry, RelaylineProperties properties) {
        return new FallbackChainSelector(healthRegistry, properties.getRouting());
    }

    @Bean
    public HealthMonitor healthMonitor(
            ProviderRegistry providerRegistry,
            HealthRegistry healthRegistry,
            FallbackChainSelector fallbackChainSelector,
            RelaylineProperties properties,
            Clock clock,
            Scheduler backgroundScheduler) {
        return new HealthMonitor(
                providerRegistry, healthRegistry, fallbackChainSelector, properties.getHealth(), clock, backgroundScheduler);
    }

    @Bean
    public QueryClassifier queryClassifier(RelaylineProperties properties) {
        RelaylineProperties.ClassifierConfig classifier = properties.getClassifier();
        return new QueryClassifier(classifier.getTimeSensitiveKeywords(), classifier.getAppDataKeywords());
    }

    @Bean
    public RateLimiter rateLimiter(RelaylineProperties properties, Clock clock) {
        return new RateLimiter(properties, clock);
    }

    @Bean
    public PromptBuilder promptBuilder() {
        return new PromptBuilder();
    }

    @Bean
    public ModelSelector modelSelector(RelaylineProperties properties) {
        return new ModelSelector(properties);
    }

    @Bean
    public AppDataContextProvider appDataContextProvider(WebClient webClient, RelaylineProperties properties) {
        String baseUrl = properties.getAppData().getBaseUrl();
        if (baseUrl == null || baseUrl.isBlank()) {
            log.info("No app-data service configured; study context disabled");
            return new NoopAppDataContextProvider();
        }
        log.info("Loading study context from {}", baseUrl);
        return new HttpAppDataContextProvider(webClient, baseUrl);
    }

    @Bean
    public ChatOrchestrator chatOrchestrator(
            ProviderRegistry providerRegistry,
            HealthRegistry healthRegistry,
            HealthMonitor healthMonitor,
            FallbackChainSelector fallbackChainSelector,
            QueryClassifier queryClassifier,
            RateLimiter rateLimiter,
            ResponseCache responseCache,
            RequestFingerprinter requestFingerprinter,
            UsageLogger usageLogger,
            AppDataContextProvider appDataContextProvider,
            PromptBuilder promptBuilder,
            ModelSelector modelSelector,
            ApplicationEventPublisher eventPublisher,
            Scheduler backgroundScheduler,
            Clock clock,
            RelaylineProperties properties) {
        return ChatOrchestrator.builder()
                .providerRegistry(providerRegistry)
                .healthRegistry(healthRegistry)
                .healthMonitor(healthMonitor)
                .chainSelector(fallbackChainSelector)
                .classifier(queryClassifier)
                .rateLimiter(rateLimiter)
                .responseCache(responseCache)
                .fingerprinter(requestFingerprinter)
                .usageLogger(usageLogger)
                .appDataProvider(appDataContextProvider)
                .promptBuilder(promptBuilder)
                .modelSelector(modelSelector)
                .eventPublisher(eventPublisher)
                .usageScheduler(backgroundScheduler)
                .clock(clock)
                .properties(properties)
                .build();
    }
}
