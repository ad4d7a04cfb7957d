package com.kita.invoicing.model;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Mexican taxpayer id (RFC)
 *
 * <p>Normalized with trim and upper-case. Twelve characters for companies,
 * thirteen for individuals.
 */
public final class TaxId {

    private static final Pattern RFC_PATTERN = Pattern.compile("^[A-ZÑ&]{3,4}\\d{6}[A-Z0-9]{3}$");

    /** Generic RFC for domestic recipients without one */
    public static final TaxId GENERIC_DOMESTIC = new TaxId("XAXX010101000");

    /** Generic RFC for foreign recipients */
    public static final TaxId GENERIC_FOREIGN = new TaxId("XEXX010101000");

    private final String value;

    private TaxId(String value) {
        this.value = value;
    }

    /**
     * Parse and normalize an RFC
     *
     * @param raw RFC as typed or extracted
     * @return tax id
     * @throws IllegalArgumentException if the value is not a well-formed RFC
     */
    public static TaxId of(String raw) {
        String normalized = normalize(raw);
        if (normalized == null || !RFC_PATTERN.matcher(normalized).matches()) {
            throw new IllegalArgumentException("Invalid RFC: " + raw);
        }
        return new TaxId(normalized);
    }

    /**
     * Trim and upper-case, or null for blank input
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim().toUpperCase(Locale.ROOT);
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static boolean isValid(String raw) {
        String normalized = normalize(raw);
        return normalized != null && RFC_PATTERN.matcher(normalized).matches();
    }

    public String getValue() {
        return value;
    }

    /**
     * Invoice series derived from this RFC: its first three characters
     */
    public String serie() {
        return value.substring(0, 3);
    }

    public boolean isCompany() {
        return value.length() == 12;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value.equals(((TaxId) o).value);
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
