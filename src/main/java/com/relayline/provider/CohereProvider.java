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

import java.util.ArrayList;
import java.util.List;

/**
 * Cohere chat provider (v1 {@code /chat}).
 * Cohere takes the latest user turn as {@code message}, earlier turns as {@code chat_history}
 * and the system prompt as {@code preamble}.
 */
@Component
public class CohereProvider extends AbstractChatProvider {

    public CohereProvider(WebClient webClient, ObjectMapper objectMapper, RelaylineProperties properties) {
        super(ProviderId.COHERE, webClient, objectMapper, properties);
    }

    @Override
    protected String defaultBaseUrl() {
        return "https://api.cohere.ai/v1";
    }

    @Override
    protected String defaultModel() {
        return "command-light";
    }

    @Override
    protected JsonNode buildPayload(List<Message> messages, String model, ChatOptions options) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model);

        StringBuilder preamble = new StringBuilder();
        List<Message> conversation = new ArrayList<>();
        for (Message msg : messages) {
            if (msg.isSystem()) {
                if (preamble.length() > 0) {
                    preamble.append("\n\n");
                }
                preamble.append(msg.getContent());
            } else {
                conversation.add(msg);
            }
        }

        // The last user turn is the message; everything before it is history
        int lastUser = -1;
        for (int i = conversation.size() - 1; i >= 0; i--) {
            if (Message.USER.equals(conversation.get(i).getRole())) {
                lastUser = i;
                break;
            }
        }

        ArrayNode history = objectMapper.createArrayNode();
        for (int i = 0; i < conversation.size(); i++) {
            if (i == lastUser) {
                continue;
            }
            Message msg = conversation.get(i);
            history.add(objectMapper.createObjectNode()
                    .put("role", Message.ASSISTANT.equals(msg.getRole()) ? "CHATBOT" : "USER")
                    .put("message", msg.getContent()));
        }

        request.put("message", lastUser >= 0 ? conversation.get(lastUser).getContent() : "");
        if (!history.isEmpty()) {
            request.set("chat_history", history);
        }
        if (preamble.length() > 0) {
            request.put("preamble", preamble.toString());
        }
        request.put("temperature", temperature(options));
        request.put("max_tokens", maxTokens(options));
        return request;
    }

    @Override
    protected Mono<JsonNode> send(JsonNode payload, String model) {
        return webClient.post()
                .uri(baseUrl() + "/chat")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(payload.toString())
                .retrieve()
                .bodyToMono(JsonNode.class);
    }

    @Override
    protected ProviderResponse parseResponse(JsonNode body, String model, long latencyMs) {
        String content = body.path("text").asText(null);

        JsonNode meta = body.path("meta");
        JsonNode counts = meta.has("billed_units") ? meta.get("billed_units") : meta.path("tokens");
        TokenUsage usage = TokenUsage.builder()
                .input(intOrZero(counts.get("input_tokens")))
                .output(intOrZero(counts.get("output_tokens")))
                .build();

        return buildResponse(content, model, usage, latencyMs);
    }
}
