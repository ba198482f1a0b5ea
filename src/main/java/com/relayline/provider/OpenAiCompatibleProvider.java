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
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Base for providers exposing the OpenAI {@code /chat/completions} contract
 * (Groq, Cerebras, Mistral, OpenRouter).
 */
public abstract class OpenAiCompatibleProvider extends AbstractChatProvider {

    protected OpenAiCompatibleProvider(
            ProviderId id,
            WebClient webClient,
            ObjectMapper objectMapper,
            RelaylineProperties properties) {
        super(id, webClient, objectMapper, properties);
    }

    @Override
    protected JsonNode buildPayload(List<Message> messages, String model, ChatOptions options) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model);

        ArrayNode messagesArray = objectMapper.createArrayNode();
        for (Message msg : messages) {
            messagesArray.add(objectMapper.createObjectNode()
                    .put("role", msg.getRole())
                    .put("content", msg.getContent()));
        }
        request.set("messages", messagesArray);

        request.put("temperature", temperature(options));
        request.put("max_tokens", maxTokens(options));
        request.put("stream", false);
        return request;
    }

    @Override
    protected Mono<JsonNode> send(JsonNode payload, String model) {
        return webClient.post()
                .uri(baseUrl() + "/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .headers(this::addHeaders)
                .bodyValue(payload.toString())
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    @Override
    protected ProviderResponse parseResponse(JsonNode body, String model, long latencyMs) {
        String content = body.path("choices").path(0).path("message").path("content").asText(null);

        TokenUsage usage = TokenUsage.zero();
        JsonNode usageNode = body.get("usage");
        if (usageNode != null) {
            usage = TokenUsage.builder()
                    .input(intOrZero(usageNode.get("prompt_tokens")))
                    .output(intOrZero(usageNode.get("completion_tokens")))
                    .build();
        }

        String modelUsed = body.hasNonNull("model") ? body.get("model").asText() : model;
        return buildResponse(content, modelUsed, usage, latencyMs);
    }

    /**
     * Hook for provider-specific request headers.
     */
    protected void addHeaders(HttpHeaders headers) {
    }
}
