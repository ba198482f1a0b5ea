package com.relayline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Coarse intent classification driving chain selection, model choice and system prompt.
 */
public enum QueryType {

    TIME_SENSITIVE("time_sensitive"),

    APP_DATA("app_data"),

    GENERAL("general");

    private final String wireName;

    QueryType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Lenient lookup accepting {@code time_sensitive}, {@code time-sensitive} or {@code TIME_SENSITIVE}.
     */
    public static Optional<QueryType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = normalize(name);
        for (QueryType type : values()) {
            if (normalize(type.wireName).equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static QueryType fromJson(String name) {
        return fromName(name).orElse(GENERAL);
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
    }
}
