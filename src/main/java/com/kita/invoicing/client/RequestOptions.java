package com.kita.invoicing.client;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-call options for {@link ProviderHttpClient}
 *
 * <p>Headers set here replace the client's default headers of the same name,
 * which is how a live key replaces the account key for issuance.
 */
public class RequestOptions {

    private final Map<String, String> headers = new LinkedHashMap<>();
    private final Map<String, String> queryParameters = new LinkedHashMap<>();
    private Integer readTimeoutMillis;
    private boolean skipRetry;

    public static RequestOptions create() {
        return new RequestOptions();
    }

    public RequestOptions header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public RequestOptions param(String name, String value) {
        queryParameters.put(name, value);
        return this;
    }

    public RequestOptions timeout(int readTimeoutMillis) {
        this.readTimeoutMillis = readTimeoutMillis;
        return this;
    }

    /**
     * Send the request once. Required for calls that create fiscal documents.
     */
    public RequestOptions skipRetry(boolean skipRetry) {
        this.skipRetry = skipRetry;
        return this;
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    public Map<String, String> getQueryParameters() {
        return Collections.unmodifiableMap(queryParameters);
    }

    public Integer getReadTimeoutMillis() {
        return readTimeoutMillis;
    }

    public boolean isSkipRetry() {
        return skipRetry;
    }
}
