package com.relayline.testutil;

import com.relayline.model.Message;
import com.relayline.model.ProviderResponse;
import com.relayline.model.TokenUsage;
import com.relayline.provider.ChatOptions;
import com.relayline.provider.ChatProvider;
import com.relayline.provider.HealthCheckResult;
import com.relayline.provider.ProviderId;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scriptable in-memory provider that records every call it receives.
 */
public class FakeChatProvider implements ChatProvider {

    private final ProviderId id;
    private final AtomicInteger chatCalls = new AtomicInteger();
    private final AtomicInteger healthChecks = new AtomicInteger();
    private final List<String> models = new CopyOnWriteArrayList<>();
    private final List<List<Message>> conversations = new CopyOnWriteArrayList<>();

    private volatile boolean enabled = true;
    private volatile Supplier<Mono<ProviderResponse>> chatBehavior;
    private volatile Supplier<Mono<HealthCheckResult>> healthBehavior = () -> Mono.just(HealthCheckResult.healthy(5));

    public FakeChatProvider(ProviderId id) {
        this.id = id;
        respondWith("answer from " + id.getWireName());
    }

    public FakeChatProvider respondWith(String content) {
        this.chatBehavior = () -> Mono.just(response(content));
        return this;
    }

    public FakeChatProvider failWith(Throwable error) {
        this.chatBehavior = () -> Mono.error(error);
        return this;
    }

    public FakeChatProvider chatWith(Supplier<Mono<ProviderResponse>> behavior) {
        this.chatBehavior = behavior;
        return this;
    }

    public FakeChatProvider healthCheckWith(Supplier<Mono<HealthCheckResult>> behavior) {
        this.healthBehavior = behavior;
        return this;
    }

    public FakeChatProvider probeUnhealthy(String error) {
        return healthCheckWith(() -> Mono.just(HealthCheckResult.unhealthy(5, error)));
    }

    public FakeChatProvider disabled() {
        this.enabled = false;
        return this;
    }

    @Override
    public ProviderId getId() {
        return id;
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Mono<ProviderResponse> chat(List<Message> messages, String model, ChatOptions options) {
        return Mono.defer(() -> {
            chatCalls.incrementAndGet();
            models.add(String.valueOf(model));
            conversations.add(List.copyOf(messages));
            return chatBehavior.get();
        });
    }

    @Override
    public Mono<HealthCheckResult> healthCheck() {
        healthChecks.incrementAndGet();
        return healthBehavior.get();
    }

    public int getChatCalls() {
        return chatCalls.get();
    }

    public int getHealthChecks() {
        return healthChecks.get();
    }

    public List<String> getModels() {
        return models;
    }

    public List<List<Message>> getConversations() {
        return conversations;
    }

    public void resetCounts() {
        chatCalls.set(0);
        healthChecks.set(0);
        models.clear();
        conversations.clear();
    }

    private ProviderResponse response(String content) {
        return ProviderResponse.builder()
                .content(content)
                .modelUsed(models.isEmpty() ? "fake-model" : models.get(models.size() - 1))
                .provider(id.getWireName())
                .tierUsed(id.getTier())
                .tokensUsed(new TokenUsage(10, 20))
                .latencyMs(42)
                .build();
    }
}
