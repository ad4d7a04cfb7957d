package com.kita.invoicing.client;

/**
 * Successful provider response
 *
 * @param <T> decoded body type
 */
public class ProviderResponse<T> {

    private final T data;
    private final int status;
    private final String rawBody;
    private final long durationMillis;
    private final String requestId;

    public ProviderResponse(T data, int status, String rawBody, long durationMillis, String requestId) {
        this.data = data;
        this.status = status;
        this.rawBody = rawBody;
        this.durationMillis = durationMillis;
        this.requestId = requestId;
    }

    public T getData() {
        return data;
    }

    public int getStatus() {
        return status;
    }

    /**
     * Body as text, kept so callers can persist what the provider returned.
     * Null for binary downloads.
     */
    public String getRawBody() {
        return rawBody;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public String getRequestId() {
        return requestId;
    }
}
