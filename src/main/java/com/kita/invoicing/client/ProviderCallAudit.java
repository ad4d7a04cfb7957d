package com.kita.invoicing.client;

import java.time.Instant;
import java.util.Map;

/**
 * One attempt of one provider call, with credentials already masked
 */
public class ProviderCallAudit {

    private final Instant occurredAt;
    private final String requestId;
    private final String provider;
    private final String method;
    private final String url;
    private final Map<String, String> headers;
    private final Object requestBody;
    private final Integer status;
    private final Object responseBody;
    private final long durationMillis;
    private final int attempt;
    private final String error;

    private ProviderCallAudit(Builder builder) {
        this.occurredAt = builder.occurredAt;
        this.requestId = builder.requestId;
        this.provider = builder.provider;
        this.method = builder.method;
        this.url = builder.url;
        this.headers = builder.headers != null ? Map.copyOf(builder.headers) : Map.of();
        this.requestBody = builder.requestBody;
        this.status = builder.status;
        this.responseBody = builder.responseBody;
        this.durationMillis = builder.durationMillis;
        this.attempt = builder.attempt;
        this.error = builder.error;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getProvider() {
        return provider;
    }

    public String getMethod() {
        return method;
    }

    public String getUrl() {
        return url;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    public Object getRequestBody() {
        return requestBody;
    }

    /**
     * HTTP status, or null when no response was received
     */
    public Integer getStatus() {
        return status;
    }

    public Object getResponseBody() {
        return responseBody;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    /**
     * Zero-based attempt number within one logical call
     */
    public int getAttempt() {
        return attempt;
    }

    public String getError() {
        return error;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public static class Builder {
        private Instant occurredAt;
        private String requestId;
        private String provider;
        private String method;
        private String url;
        private Map<String, String> headers;
        private Object requestBody;
        private Integer status;
        private Object responseBody;
        private long durationMillis;
        private int attempt;
        private String error;

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder provider(String provider) {
            this.provider = provider;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder requestBody(Object requestBody) {
            this.requestBody = requestBody;
            return this;
        }

        public Builder status(Integer status) {
            this.status = status;
            return this;
        }

        public Builder responseBody(Object responseBody) {
            this.responseBody = responseBody;
            return this;
        }

        public Builder durationMillis(long durationMillis) {
            this.durationMillis = durationMillis;
            return this;
        }

        public Builder attempt(int attempt) {
            this.attempt = attempt;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public ProviderCallAudit build() {
            return new ProviderCallAudit(this);
        }
    }
}
