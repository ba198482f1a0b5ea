package com.relayline.controller;

import com.relayline.model.ChatRequest;
import com.relayline.model.ProviderResponse;
import com.relayline.service.ChatOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Chat endpoint. Always answers 200 with a chat-shaped body once the request is valid;
 * provenance is exposed in headers.
 */
@Slf4j
@RestController
@RequestMapping("/v1")
public class ChatController {

    private final ChatOrchestrator orchestrator;

    public ChatController(ChatOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(value = "/chat", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ProviderResponse>> chat(@RequestBody ChatRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return Mono.error(new IllegalArgumentException("Message cannot be empty"));
        }

        log.info("Received chat request: user={}, conversation={}, chat_type={}, preferred={}",
                request.getUserId(), request.getConversationId(), request.getChatType(), request.getPreferredProvider());

        return orchestrator.process(request)
                .map(response -> {
                    HttpHeaders headers = new HttpHeaders();
                    headers.add("x-relayline-provider", response.getProvider());
                    headers.add("x-cache-hit", String.valueOf(response.isCached()));
                    headers.add("x-fallback-used", String.valueOf(response.isFallbackUsed()));

                    return ResponseEntity.ok()
                            .headers(headers)
                            .body(response);
                });
    }
}
