package com.relayline.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relayline.model.ChatRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stable cache keys for chat requests.
 *
 * <p>The key covers the fields that change the answer: user, chat type, normalized message,
 * app-data flag and preferred provider. The conversation id is volatile and left out.
 * Messages are trimmed, lowercased and have whitespace runs collapsed before hashing.
 */
@Slf4j
@Component
public class RequestFingerprinter {

    private final ObjectMapper objectMapper;

    public RequestFingerprinter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Generate fingerprint for request.
     *
     * @param request inbound chat request
     * @return SHA-256 hash (64 hex chars), or null if the request cannot be canonicalized
     */
    public String fingerprint(ChatRequest request) {
        try {
            return DigestUtils.sha256Hex(canonicalize(request));
        } catch (JsonProcessingException e) {
            log.error("Error generating request fingerprint", e);
            return null;
        }
    }

    /**
     * Canonical JSON form with sorted keys and null fields removed.
     */
    public String canonicalize(ChatRequest request) throws JsonProcessingException {
        Map<String, Object> canonical = new TreeMap<>();
        putIfPresent(canonical, "user_id", request.getUserId());
        putIfPresent(canonical, "chat_type", normalizeName(request.getChatType()));
        putIfPresent(canonical, "message", normalizeMessage(request.getMessage()));
        putIfPresent(canonical, "preferred_provider", normalizeName(request.getPreferredProvider()));
        canonical.put("include_app_data", request.wantsAppData());
        return objectMapper.writeValueAsString(canonical);
    }

    static String normalizeMessage(String message) {
        if (message == null) {
            return null;
        }
        return message.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static String normalizeName(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
