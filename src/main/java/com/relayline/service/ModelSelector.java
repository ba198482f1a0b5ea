package com.relayline.service;

import com.relayline.config.RelaylineProperties;
import com.relayline.model.QueryType;
import com.relayline.provider.ProviderId;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

/**
 * Picks the model for a provider and query type. Configured per-provider overrides win over the built-in table.
 */
@Slf4j
public class ModelSelector {

    private static final Map<QueryType, Map<ProviderId, String>> DEFAULT_MODELS = new EnumMap<>(QueryType.class);

    static {
        Map<ProviderId, String> timeSensitive = new EnumMap<>(ProviderId.class);
        timeSensitive.put(ProviderId.GROQ, "llama-3.3-70b-versatile");
        timeSensitive.put(ProviderId.GEMINI, "gemini-2.0-flash-lite");
        timeSensitive.put(ProviderId.CEREBRAS, "llama-3.3-70b");
        timeSensitive.put(ProviderId.COHERE, "command");
        timeSensitive.put(ProviderId.MISTRAL, "mistral-large-latest");
        timeSensitive.put(ProviderId.OPENROUTER, "openai/gpt-3.5-turbo");
        DEFAULT_MODELS.put(QueryType.TIME_SENSITIVE, timeSensitive);

        Map<ProviderId, String> appData = new EnumMap<>(ProviderId.class);
        appData.put(ProviderId.GROQ, "llama-3.3-70b-versatile");
        appData.put(ProviderId.GEMINI, "gemini-2.5-flash");
        appData.put(ProviderId.CEREBRAS, "llama-3.3-70b");
        appData.put(ProviderId.COHERE, "command");
        appData.put(ProviderId.MISTRAL, "mistral-medium-latest");
        appData.put(ProviderId.OPENROUTER, "openai/gpt-3.5-turbo");
        DEFAULT_MODELS.put(QueryType.APP_DATA, appData);

        Map<ProviderId, String> general = new EnumMap<>(ProviderId.class);
        general.put(ProviderId.GROQ, "llama-3.3-70b-versatile");
        general.put(ProviderId.GEMINI, "gemini-2.5-flash");
        general.put(ProviderId.CEREBRAS, "llama-3.1-8b");
        general.put(ProviderId.COHERE, "command-light");
        general.put(ProviderId.MISTRAL, "mistral-small-latest");
        general.put(ProviderId.OPENROUTER, "openai/gpt-3.5-turbo");
        DEFAULT_MODELS.put(QueryType.GENERAL, general);
    }

    private final Map<ProviderId, Map<QueryType, String>> overrides = new EnumMap<>(ProviderId.class);

    public ModelSelector(RelaylineProperties properties) {
        for (ProviderId id : ProviderId.values()) {
            Map<QueryType, String> providerOverrides = new EnumMap<>(QueryType.class);
            properties.provider(id).getModels().forEach((typeName, model) ->
                    QueryType.fromName(typeName).ifPresentOrElse(
                            type -> providerOverrides.put(type, model),
                            () -> log.warn("Ignoring model override for unknown query type '{}' on {}", typeName, id)));
            overrides.put(id, providerOverrides);
        }
    }

    /**
     * @return model id, or null to let the adapter use its default
     */
    public String modelFor(ProviderId provider, QueryType queryType) {
        String override = overrides.get(provider).get(queryType);
        if (override != null && !override.isBlank()) {
            return override;
        }
        return DEFAULT_MODELS.get(queryType).get(provider);
    }
}
