package com.relayline.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayline.config.RelaylineProperties;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

@Component
public class MistralProvider extends OpenAiCompatibleProvider {

    public MistralProvider(WebClient webClient, ObjectMapper objectMapper, RelaylineProperties properties) {
        super(ProviderId.MISTRAL, webClient, objectMapper, properties);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.mistral.ai/v1";
    }

    @Override
    protected String defaultModel() {
        return "mistral-small-latest";
    }
}
