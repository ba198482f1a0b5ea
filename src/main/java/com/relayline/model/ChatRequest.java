package com.relayline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Inbound chat request from the chat-handling layer.
 * Immutable for the duration of one orchestration.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatRequest {

    public static final String CHAT_TYPE_GENERAL = "general";
    public static final String CHAT_TYPE_STUDY_ASSISTANT = "study_assistant";

    @JsonProperty("user_id")
    String userId;

    @JsonProperty("conversation_id")
    String conversationId;

    @JsonProperty("message")
    String message;

    @JsonProperty("chat_type")
    String chatType;

    /**
     * Provider name the caller wants tried first, e.g. {@code "groq"}.
     */
    @JsonProperty("preferred_provider")
    String preferredProvider;

    @JsonProperty("include_app_data")
    Boolean includeAppData;

    public boolean wantsAppData() {
        return Boolean.TRUE.equals(includeAppData);
    }
}
