package com.relayline.config;

import com.relayline.provider.ProviderId;
import com.relayline.routing.QueryClassifier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for Relayline.
 */
@Data
@Component
@ConfigurationProperties(prefix = "relayline")
public class RelaylineProperties {

    private Map<String, ProviderConfig> providers = new HashMap<>();
    private HealthConfig health = new HealthConfig();
    private RoutingConfig routing = new RoutingConfig();
    private ClassifierConfig classifier = new ClassifierConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private CacheConfig cache = new CacheConfig();
    private OrchestratorConfig orchestrator = new OrchestratorConfig();
    private AppDataConfig appData = new AppDataConfig();

    /**
     * Configuration for a provider, or an unconfigured placeholder when none is bound.
     */
    public ProviderConfig provider(ProviderId id) {
        ProviderConfig config = providers.get(id.getWireName());
        return config != null ? config : new ProviderConfig();
    }

    @Data
    public static class ProviderConfig {
        private boolean enabled = true;
        private String baseUrl;
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(25);
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofSeconds(10);
        private double temperature = 0.7;
        private int maxTokens = 2048;
        private int requestsPerWindow = 0; // 0 = unlimited
        private long tokensPerWindow = 0;  // 0 = unlimited

        /**
         * Query type name to model id, overriding the built-in model table.
         */
        private Map<String, String> models = new HashMap<>();

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class HealthConfig {
        private Duration interval = Duration.ofMinutes(5);
        private Duration probeTimeout = Duration.ofSeconds(5);
        private int probeMaxTokens = 5;
        private String probePrompt = "Hello";
        private int failureThreshold = 1;
    }

    @Data
    public static class RoutingConfig {
        private Map<String, List<String>> chains = defaultChains();
        private ChainRebuildMode rebuildMode = ChainRebuildMode.PRESERVE_QUERY_ORDER;
        private boolean attemptUnhealthyPreferred = false;

        private static Map<String, List<String>> defaultChains() {
            Map<String, List<String>> chains = new LinkedHashMap<>();
            chains.put("time_sensitive", List.of("gemini", "groq", "cerebras", "mistral", "openrouter", "cohere"));
            chains.put("app_data", List.of("groq", "cerebras", "mistral", "gemini", "openrouter", "cohere"));
            chains.put("general", List.of("groq", "openrouter", "cerebras", "mistral", "gemini", "cohere"));
            return chains;
        }
    }

    /**
     * Keyword sets for query classification; a keyword matches at the start of a word.
     */
    @Data
    public static class ClassifierConfig {
        private List<String> timeSensitiveKeywords = new ArrayList<>(QueryClassifier.DEFAULT_TIME_SENSITIVE_KEYWORDS);
        private List<String> appDataKeywords = new ArrayList<>(QueryClassifier.DEFAULT_APP_DATA_KEYWORDS);
    }

    /**
     * How fallback chains are rebuilt after a health sweep.
     */
    public enum ChainRebuildMode {
        /**
         * Keep each query type's configured order, dropping unhealthy providers.
         */
        PRESERVE_QUERY_ORDER,

        /**
         * Replace every chain with all healthy providers in ascending tier order.
         */
        TIER_ORDER
    }

    @Data
    public static class RateLimitConfig {
        private Duration window = Duration.ofMinutes(1);
        private double approachingRatio = 0.8;
    }

    @Data
    public static class CacheConfig {
        private boolean enabled = true;
        private String backend = "local"; // local | redis
        private Duration ttl = Duration.ofHours(1);
        private int maxSize = 10000;
    }

    @Data
    public static class OrchestratorConfig {
        private Duration requestDeadline = Duration.ofSeconds(90);
        private Duration appDataTimeout = Duration.ofSeconds(3);
    }

    @Data
    public static class AppDataConfig {
        private String baseUrl;
    }
}
