package com.kita.invoicing.provider;

import java.time.Instant;
import java.util.Objects;

/**
 * Organization-scoped credential used to issue documents
 */
public final class LiveCredential {

    private final String value;
    private final Instant issuedAt;

    public LiveCredential(String value, Instant issuedAt) {
        this.value = Objects.requireNonNull(value, "value");
        this.issuedAt = issuedAt;
    }

    public String getValue() { return value; }
    public Instant getIssuedAt() { return issuedAt; }

    @Override
    public String toString() {
        // secret omitted
        return "LiveCredential{issuedAt=" + issuedAt + '}';
    }
}
