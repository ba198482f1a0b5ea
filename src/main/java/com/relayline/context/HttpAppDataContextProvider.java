package com.relayline.context;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Loads study context from the app-data service: {@code GET {base}/users/{userId}/study-context}.
 * A 404 means the user has no context yet and maps to empty.
 */
@Slf4j
public class HttpAppDataContextProvider implements AppDataContextProvider {

    private final WebClient webClient;
    private final String baseUrl;

    public HttpAppDataContextProvider(WebClient webClient, String baseUrl) {
        this.webClient = webClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public Mono<AppDataContext> load(String userId) {
        if (userId == null || userId.isBlank()) {
            return Mono.empty();
        }
        return webClient.get()
                .uri(baseUrl + "/users/{userId}/study-context", userId)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(AppDataContext.class)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                    log.debug("No app data context for user {}", userId);
                    return Mono.empty();
                });
    }
}
