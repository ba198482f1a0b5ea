package com.relayline.cache;

import com.relayline.config.JacksonConfiguration;
import com.relayline.model.ChatRequest;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestFingerprinterTest {

    private final RequestFingerprinter fingerprinter = new RequestFingerprinter(JacksonConfiguration.createObjectMapper());

    private static ChatRequest.ChatRequestBuilder base() {
        return ChatRequest.builder()
                .userId("user-1")
                .conversationId("conv-1")
                .chatType("general")
                .message("What is entropy?");
    }

    @Test
    void fingerprintIsSha256Hex() {
        String fingerprint = fingerprinter.fingerprint(base().build());

        assertNotNull(fingerprint);
        assertEquals(64, fingerprint.length());
        assertTrue(fingerprint.matches("[0-9a-f]+"));
    }

    @Test
    void whitespaceAndCaseDifferencesNormalizeAway() {
        String a = fingerprinter.fingerprint(base().build());
        String b = fingerprinter.fingerprint(base().message("  what   IS\tentropy? ").build());

        assertEquals(a, b);
    }

    @Test
    void conversationIdIsNotPartOfFingerprint() {
        assertEquals(
                fingerprinter.fingerprint(base().build()),
                fingerprinter.fingerprint(base().conversationId("conv-99").build()));
    }

    @Test
    void answerShapingFieldsChangeFingerprint() {
        String original = fingerprinter.fingerprint(base().build());

        assertNotEquals(original, fingerprinter.fingerprint(base().userId("user-2").build()));
        assertNotEquals(original, fingerprinter.fingerprint(base().chatType("study_assistant").build()));
        assertNotEquals(original, fingerprinter.fingerprint(base().includeAppData(true).build()));
        assertNotEquals(original, fingerprinter.fingerprint(base().preferredProvider("groq").build()));
        assertNotEquals(original, fingerprinter.fingerprint(base().message("What is enthalpy?").build()));
    }

    @Test
    void canonicalFormHasSortedKeys() throws Exception {
        String canonical = fingerprinter.canonicalize(base().build());

        assertEquals("{\"chat_type\":\"general\",\"include_app_data\":false,"
                + "\"message\":\"what is entropy?\",\"user_id\":\"user-1\"}", canonical);
    }
}
