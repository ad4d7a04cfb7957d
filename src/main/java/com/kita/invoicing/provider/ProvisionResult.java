package com.kita.invoicing.provider;

/**
 * Outcome of uploading signing material to a provider
 */
public final class ProvisionResult {

    private final boolean success;
    private final String message;
    private final String rawResponse;

    private ProvisionResult(boolean success, String message, String rawResponse) {
        this.success = success;
        this.message = message;
        this.rawResponse = rawResponse;
    }

    public static ProvisionResult success(String rawResponse) {
        return new ProvisionResult(true, null, rawResponse);
    }

    public static ProvisionResult failure(String message, String rawResponse) {
        return new ProvisionResult(false, message, rawResponse);
    }

    public boolean isSuccess() { return success; }
    public String getMessage() { return message; }
    public String getRawResponse() { return rawResponse; }
}
