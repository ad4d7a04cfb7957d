package com.kita.invoicing.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PayloadRedactor
 */
class PayloadRedactorTest {

    @Test
    @DisplayName("should mask nested certificate material")
    @SuppressWarnings("unchecked")
    void shouldRedactNested() {
        Map<String, Object> file = new HashMap<>();
        file.put("base64File", "MIIF...");
        file.put("fileType", 0);

        Map<String, Object> redacted = (Map<String, Object>) PayloadRedactor.redact(Map.of("taxFiles", List.of(file)));

        Map<String, Object> first = ((List<Map<String, Object>>) redacted.get("taxFiles")).get(0);
        assertEquals(PayloadRedactor.MASK, first.get("base64File"));
        assertEquals(0, first.get("fileType"));
    }

    @Test
    @DisplayName("should match short names exactly and long names as fragments")
    void shouldMatchNames() {
        assertTrue(PayloadRedactor.isSensitive("key"));
        assertTrue(PayloadRedactor.isSensitive("X-TENANT-KEY"));
        assertTrue(PayloadRedactor.isSensitive("certificatePassword"));
        assertFalse(PayloadRedactor.isSensitive("keyId"));
        assertFalse(PayloadRedactor.isSensitive("legal_name"));
        assertFalse(PayloadRedactor.isSensitive(null));
    }

    @Test
    @DisplayName("should mask credential headers only")
    void shouldRedactHeaders() {
        Map<String, String> headers = PayloadRedactor.redactHeaders(
            Map.of("X-API-KEY", "sk_test", "X-Request-ID", "kita-1"));

        assertEquals(PayloadRedactor.MASK, headers.get("X-API-KEY"));
        assertEquals("kita-1", headers.get("X-Request-ID"));
    }

    @Test
    @DisplayName("should return scalars unchanged")
    void shouldKeepScalars() {
        assertEquals("plain", PayloadRedactor.redact("plain"));
        assertNull(PayloadRedactor.redact(null));
    }
}
