package com.kita.invoicing.exception;

/**
 * Base invoicing exception class
 * 
 * This is an unchecked exception (RuntimeException) so that the orchestration
 * layer reads cleanly, while still carrying a machine-readable error code.
 */
public class InvoicingException extends RuntimeException {
    private final String code;
    private final Integer statusCode;

    public InvoicingException(String message) {
        this(message, null, null, null);
    }

    public InvoicingException(String message, String code) {
        this(message, code, null, null);
    }

    public InvoicingException(String message, String code, Integer statusCode) {
        this(message, code, statusCode, null);
    }

    public InvoicingException(String message, String code, Throwable cause) {
        this(message, code, null, cause);
    }

    public InvoicingException(String message, String code, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
