package com.kita.invoicing.model;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Fiscal folio (UUID) assigned by the stamping authority
 */
public final class FiscalId {

    private final String value;

    private FiscalId(String value) {
        this.value = value;
    }

    /**
     * @param raw UUID string as returned by the provider
     * @return fiscal id in canonical upper-case form
     * @throws IllegalArgumentException if the value is not a UUID
     */
    public static FiscalId of(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Fiscal id must not be blank");
        }
        String trimmed = raw.trim();
        UUID.fromString(trimmed);
        return new FiscalId(trimmed.toUpperCase(Locale.ROOT));
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((FiscalId) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
