package com.relayline.controller;

import com.relayline.model.ChatRequest;
import com.relayline.model.ProviderResponse;
import com.relayline.model.QueryType;
import com.relayline.model.TokenUsage;
import com.relayline.service.ChatOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ChatControllerTest {

    private ChatOrchestrator orchestrator;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        orchestrator = mock(ChatOrchestrator.class);
        client = WebTestClient.bindToController(new ChatController(orchestrator))
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void answersWithProvenanceHeaders() {
        when(orchestrator.process(any(ChatRequest.class))).thenReturn(Mono.just(ProviderResponse.builder()
                .content("Entropy measures disorder.")
                .modelUsed("llama-3.3-70b-versatile")
                .provider("groq")
                .queryType(QueryType.GENERAL)
                .tierUsed(1)
                .tokensUsed(new TokenUsage(12, 6))
                .latencyMs(310)
                .fallbackUsed(true)
                .build()));

        client.post().uri("/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"user_id":"user-1","conversation_id":"conv-9","message":"What is entropy?",
                         "chat_type":"general","preferred_provider":"groq","include_app_data":false}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("x-relayline-provider", "groq")
                .expectHeader().valueEquals("x-cache-hit", "false")
                .expectHeader().valueEquals("x-fallback-used", "true")
                .expectBody()
                .jsonPath("$.content").isEqualTo("Entropy measures disorder.")
                .jsonPath("$.model_used").isEqualTo("llama-3.3-70b-versatile")
                .jsonPath("$.query_type").isEqualTo("general")
                .jsonPath("$.tier_used").isEqualTo(1)
                .jsonPath("$.tokens_used.input").isEqualTo(12)
                .jsonPath("$.tokens_used.output").isEqualTo(6)
                .jsonPath("$.fallback_used").isEqualTo(true);

        ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
        verify(orchestrator).process(captor.capture());
        ChatRequest request = captor.getValue();
        assertEquals("user-1", request.getUserId());
        assertEquals("conv-9", request.getConversationId());
        assertEquals("groq", request.getPreferredProvider());
        assertFalse(request.wantsAppData());
    }

    @Test
    void rejectsBlankMessage() {
        client.post().uri("/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"user_id\":\"user-1\",\"message\":\"   \"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400)
                .jsonPath("$.message").isEqualTo("Message cannot be empty");

        verifyNoInteractions(orchestrator);
    }

    @Test
    void rejectsMalformedBody() {
        client.post().uri("/v1/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"message\": ")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.message").isEqualTo("Malformed request body");

        verifyNoInteractions(orchestrator);
    }
}
