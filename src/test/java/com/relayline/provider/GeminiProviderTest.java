package com.relayline.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayline.config.JacksonConfiguration;
import com.relayline.config.RelaylineProperties;
import com.relayline.model.Message;
import com.relayline.model.ProviderResponse;
import com.relayline.testutil.StubHttpServer;
import com.relayline.testutil.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeminiProviderTest {

    private final ObjectMapper objectMapper = JacksonConfiguration.createObjectMapper();

    private StubHttpServer server;
    private GeminiProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        server = StubHttpServer.start();
        RelaylineProperties properties = TestProperties.allProvidersConfigured();
        properties.provider(ProviderId.GEMINI).setBaseUrl(server.baseUrl() + "/v1beta");
        provider = new GeminiProvider(WebClient.create(), objectMapper, properties);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void convertsMessagesAndParsesCandidates() throws Exception {
        server.enqueue(200, """
                {"candidates":[{"content":{"role":"model","parts":[{"text":"Inflation eased "},{"text":"to 3%."}]}}],
                 "usageMetadata":{"promptTokenCount":33,"candidatesTokenCount":9,"totalTokenCount":42},
                 "modelVersion":"gemini-2.0-flash-lite-001"}
                """);

        List<Message> messages = List.of(
                Message.system("Be concise."),
                Message.user("Earlier question"),
                Message.assistant("Earlier answer"),
                Message.user("Latest inflation news?"));

        ProviderResponse response = provider.chat(messages, "gemini-2.0-flash-lite", ChatOptions.defaults())
                .block(Duration.ofSeconds(5));

        assertNotNull(response);
        assertEquals("Inflation eased to 3%.", response.getContent());
        assertEquals("gemini-2.0-flash-lite-001", response.getModelUsed());
        assertEquals("gemini", response.getProvider());
        assertEquals(2, response.getTierUsed());
        assertEquals(33, response.getTokensUsed().getInput());
        assertEquals(9, response.getTokensUsed().getOutput());

        StubHttpServer.RecordedRequest request = server.lastRequest();
        assertEquals("/v1beta/models/gemini-2.0-flash-lite:generateContent", request.path());
        assertEquals("test-key-gemini", request.header("x-goog-api-key"));

        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("Be concise.", body.at("/systemInstruction/parts/0/text").asText());
        JsonNode contents = body.get("contents");
        assertEquals(3, contents.size());
        assertEquals("user", contents.get(0).get("role").asText());
        assertEquals("model", contents.get(1).get("role").asText());
        assertEquals("Latest inflation news?", contents.get(2).at("/parts/0/text").asText());
        assertEquals(2048, body.at("/generationConfig/maxOutputTokens").asInt());
    }

    @Test
    void blockedResponseWithoutTextFails() {
        server.enqueue(200, "{\"candidates\":[{\"finishReason\":\"SAFETY\"}]}");

        Throwable error = assertThrows(RuntimeException.class,
                () -> provider.chat(List.of(Message.user("hi")), null, ChatOptions.defaults()).block(Duration.ofSeconds(5)));

        assertTrue(error.getMessage().contains("no content"));
    }
}
