package com.relayline.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayline.config.RelaylineProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Groq chat completion provider (OpenAI-compatible endpoint).
 * Tier 1: fastest and first choice for general and app-data queries.
 */
@Component
public class GroqProvider extends OpenAiCompatibleProvider {

    public GroqProvider(WebClient webClient, ObjectMapper objectMapper, RelaylineProperties properties) {
        super(ProviderId.GROQ, webClient, objectMapper, properties);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.groq.com/openai/v1";
    }

    @Override
    protected String defaultModel() {
        return "llama-3.3-70b-versatile";
    }
}
