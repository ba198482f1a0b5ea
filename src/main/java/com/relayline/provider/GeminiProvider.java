package com.relayline.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.relayline.config.RelaylineProperties;
import com.relayline.model.Message;
import com.relayline.model.ProviderResponse;
import com.relayline.model.TokenUsage;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Google Gemini provider using the {@code generateContent} API.
 * Tier 2, first choice for time-sensitive queries.
 */
@Component
public class GeminiProvider extends AbstractChatProvider {

    public GeminiProvider(WebClient webClient, ObjectMapper objectMapper, RelaylineProperties properties) {
        super(ProviderId.GEMINI, webClient, objectMapper, properties);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://generativelanguage.googleapis.com/v1beta";
    }

    @Override
    protected String defaultModel() {
        return "gemini-2.5-flash";
    }

    /**
     * Convert messages to Gemini format: system text goes to {@code systemInstruction},
     * the assistant role is called {@code model}.
     */
    @Override
    protected JsonNode buildPayload(List<Message> messages, String model, ChatOptions options) {
        ObjectNode request = objectMapper.createObjectNode();

        StringBuilder systemText = new StringBuilder();
        ArrayNode contents = objectMapper.createArrayNode();
        for (Message msg : messages) {
            if (msg.isSystem()) {
                if (systemText.length() > 0) {
                    systemText.append("\n\n");
                }
                systemText.append(msg.getContent());
                continue;
            }

            ObjectNode content = objectMapper.createObjectNode();
            content.put("role", Message.ASSISTANT.equals(msg.getRole()) ? "model" : "user");
            ArrayNode parts = objectMapper.createArrayNode();
            parts.add(objectMapper.createObjectNode().put("text", msg.getContent()));
            content.set("parts", parts);
            contents.add(content);
        }
        request.set("contents", contents);

        if (systemText.length() > 0) {
            ObjectNode systemInstruction = objectMapper.createObjectNode();
            ArrayNode parts = objectMapper.createArrayNode();
            parts.add(objectMapper.createObjectNode().put("text", systemText.toString()));
            systemInstruction.set("parts", parts);
            request.set("systemInstruction", systemInstruction);
        }

        ObjectNode generationConfig = objectMapper.createObjectNode();
        generationConfig.put("temperature", temperature(options));
        generationConfig.put("maxOutputTokens", maxTokens(options));
        request.set("generationConfig", generationConfig);

        return request;
    }

    @Override
    protected Mono<JsonNode> send(JsonNode payload, String model) {
        return webClient.post()
                .uri(baseUrl() + "/models/" + model + ":generateContent")
                .header("x-goog-api-key", config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(payload.toString())
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    @Override
    protected ProviderResponse parseResponse(JsonNode body, String model, long latencyMs) {
        StringBuilder contentBuilder = new StringBuilder();
        JsonNode parts = body.path("candidates").path(0).path("content").path("parts");
        if (parts.isArray()) {
            for (JsonNode part : parts) {
                if (part.hasNonNull("text")) {
                    contentBuilder.append(part.get("text").asText());
                }
            }
        }

        TokenUsage usage = TokenUsage.zero();
        JsonNode usageNode = body.get("usageMetadata");
        if (usageNode != null) {
            usage = TokenUsage.builder()
                    .input(intOrZero(usageNode.get("promptTokenCount")))
                    .output(intOrZero(usageNode.get("candidatesTokenCount")))
                    .build();
        }

        String modelUsed = body.hasNonNull("modelVersion") ? body.get("modelVersion").asText() : model;
        return buildResponse(contentBuilder.toString(), modelUsed, usage, latencyMs);
    }
}
