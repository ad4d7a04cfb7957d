package com.kita.invoicing.client;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Masks credentials and certificate material in payloads before they are audited
 *
 * <p>Keys are compared case-insensitively. Short names ({@code key},
 * {@code cer}) must match exactly so that fields like {@code keyId} or
 * {@code fileType} survive; longer names also match as substrings
 * ({@code base64File}, {@code x-api-key}, {@code tenantKey}).
 */
public final class PayloadRedactor {

    public static final String MASK = "[REDACTED]";

    private static final Set<String> EXACT = Set.of("key", "cer", "pfx", "csd");

    private static final Set<String> CONTAINED = Set.of(
        "authorization", "api-key", "apikey", "tenant-key", "tenantkey", "password", "passphrase",
        "base64file", "certificate", "secret", "token"
    );

    private PayloadRedactor() {
    }

    public static boolean isSensitive(String name) {
        if (name == null) {
            return false;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (EXACT.contains(lower)) {
            return true;
        }
        for (String fragment : CONTAINED) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Copy of a JSON-like tree (maps, lists, scalars) with sensitive values masked
     *
     * @param value tree as produced by Jackson's {@code convertValue(x, Object.class)}
     * @return redacted copy; scalars are returned unchanged
     */
    @SuppressWarnings("unchecked")
    public static Object redact(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : ((Map<String, Object>) value).entrySet()) {
                copy.put(entry.getKey(), isSensitive(entry.getKey()) ? MASK : redact(entry.getValue()));
            }
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<Object>) value) {
                copy.add(redact(item));
            }
            return copy;
        }
        return value;
    }

    public static Map<String, String> redactHeaders(Map<String, String> headers) {
        Map<String, String> copy = new LinkedHashMap<>();
        headers.forEach((name, value) -> copy.put(name, isSensitive(name) ? MASK : value));
        return copy;
    }
}
