package com.relayline.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayline.config.RelaylineProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Cerebras inference provider.
 */
@Component
public class CerebrasProvider extends OpenAiCompatibleProvider {

    public CerebrasProvider(WebClient webClient, ObjectMapper objectMapper, RelaylineProperties properties) {
        super(ProviderId.CEREBRAS, webClient, objectMapper, properties);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.cerebras.ai/v1";
    }

    @Override
    protected String defaultModel() {
        return "llama3.1-8b";
    }
}
