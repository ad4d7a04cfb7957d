package com.kita.invoicing.exception;

/**
 * Validation exception class
 *
 * <p>Messages are user-facing and safe to show to a tenant.
 */
public class ValidationException extends InvoicingException {
    private final String field;

    public ValidationException(String message) {
        this(message, "VALIDATION_ERROR", null);
    }

    public ValidationException(String message, String field) {
        this(message, "VALIDATION_ERROR", field);
    }
    
    public ValidationException(String message, String code, String field) {
        super(message, code);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
