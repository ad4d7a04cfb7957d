package com.kita.invoicing.model;

/**
 * Invoice lifecycle states
 */
public enum InvoiceStatus {
    DRAFT("draft"),
    STAMPED("stamped"),
    CANCELLED("cancelled"),
    ERROR("error");

    private final String value;

    InvoiceStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
