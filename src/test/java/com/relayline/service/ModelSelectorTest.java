package com.relayline.service;

import com.relayline.config.RelaylineProperties;
import com.relayline.model.QueryType;
import com.relayline.provider.ProviderId;
import com.relayline.testutil.TestProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelSelectorTest {

    @Test
    void builtInTableVariesByQueryType() {
        ModelSelector selector = new ModelSelector(TestProperties.allProvidersConfigured());

        assertEquals("gemini-2.0-flash-lite", selector.modelFor(ProviderId.GEMINI, QueryType.TIME_SENSITIVE));
        assertEquals("gemini-2.5-flash", selector.modelFor(ProviderId.GEMINI, QueryType.GENERAL));
        assertEquals("mistral-medium-latest", selector.modelFor(ProviderId.MISTRAL, QueryType.APP_DATA));
        assertEquals("command-light", selector.modelFor(ProviderId.COHERE, QueryType.GENERAL));
        assertEquals("llama-3.1-8b", selector.modelFor(ProviderId.CEREBRAS, QueryType.GENERAL));
    }

    @Test
    void configuredOverrideWins() {
        RelaylineProperties properties = TestProperties.allProvidersConfigured();
        properties.provider(ProviderId.GROQ).getModels().put("timesensitive", "llama-3.1-8b-instant");

        ModelSelector selector = new ModelSelector(properties);

        assertEquals("llama-3.1-8b-instant", selector.modelFor(ProviderId.GROQ, QueryType.TIME_SENSITIVE));
        assertEquals("llama-3.3-70b-versatile", selector.modelFor(ProviderId.GROQ, QueryType.GENERAL));
    }
}
