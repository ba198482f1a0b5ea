package com.relayline.provider;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of supported LLM backends with their static tier.
 * Lower tiers are preferred.
 */
public enum ProviderId {

    GROQ("groq", 1),
    GEMINI("gemini", 2),
    CEREBRAS("cerebras", 3),
    COHERE("cohere", 4),
    MISTRAL("mistral", 5),
    OPENROUTER("openrouter", 6);

    private final String wireName;
    private final int tier;

    ProviderId(String wireName, int tier) {
        this.wireName = wireName;
        this.tier = tier;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public int getTier() {
        return tier;
    }

    public static Optional<ProviderId> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ProviderId id : values()) {
            if (id.wireName.equals(normalized)) {
                return Optional.of(id);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
