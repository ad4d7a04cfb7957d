package com.kita.invoicing.client;

import com.kita.invoicing.config.InvoicingConfig;
import com.kita.invoicing.exception.ProviderException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Set;

/**
 * Bounded exponential backoff for provider calls
 *
 * <p>Only failures that cannot have produced a fiscal document are retried:
 * timeouts, refused or reset connections, and the transient statuses in
 * {@link #TRANSIENT_STATUS_CODES}. Provider rejections never are. Issuance
 * requests opt out entirely with {@link RequestOptions#skipRetry(boolean)}.
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *     .maxAttempts(4)
 *     .baseDelay(500)
 *     .maxDelay(8000)
 *     .build();
 * }</pre>
 */
public class RetryPolicy {

    public static final Set<Integer> TRANSIENT_STATUS_CODES = Set.of(408, 429, 500, 502, 503, 504);

    private final int maxAttempts;
    private final long baseDelay;
    private final long maxDelay;
    private final Set<Integer> retryableStatusCodes;
    private final boolean retryOnConnectionFailure;
    private final boolean retryOnTimeout;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.baseDelay = builder.baseDelay;
        this.maxDelay = Math.max(builder.maxDelay, builder.baseDelay);
        this.retryableStatusCodes = builder.retryableStatusCodes;
        this.retryOnConnectionFailure = builder.retryOnConnectionFailure;
        this.retryOnTimeout = builder.retryOnTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Policy allowing {@code retryAttempts} retries after the first call,
     * starting at {@code retryDelay} milliseconds
     */
    public static RetryPolicy fromConfig(InvoicingConfig config) {
        return builder()
            .maxAttempts(config.getRetryAttempts() + 1)
            .baseDelay(config.getRetryDelay())
            .maxDelay(config.getRetryDelay() * 16L)
            .build();
    }

    public static RetryPolicy noRetry() {
        return builder().maxAttempts(1).build();
    }

    /**
     * Backoff before the retry that follows {@code attempt}
     *
     * @param attempt zero-based number of the attempt that just failed
     * @return {@code baseDelay * 2^attempt}, capped at {@code maxDelay}
     */
    public long calculateDelay(int attempt) {
        if (baseDelay == 0) {
            return 0;
        }
        int shift = Math.min(attempt, 30);
        long delay = baseDelay << shift;
        return delay < 0 || delay > maxDelay ? maxDelay : delay;
    }

    /**
     * Backoff that also respects a provider's {@code Retry-After}, still capped at {@code maxDelay}
     *
     * @param attempt zero-based number of the attempt that just failed
     * @param retryAfter requested wait, or null when the provider sent none
     * @return delay in milliseconds
     */
    public long delayBefore(int attempt, Duration retryAfter) {
        long backoff = calculateDelay(attempt);
        if (retryAfter == null) {
            return backoff;
        }
        return Math.min(Math.max(backoff, retryAfter.toMillis()), maxDelay);
    }

    public boolean isRetryableStatusCode(int statusCode) {
        return retryableStatusCodes.contains(statusCode);
    }

    public boolean isRetryable(Exception failure) {
        if (failure instanceof ProviderException) {
            ProviderException providerFailure = (ProviderException) failure;
            if (providerFailure.getErrorCode() == ProviderException.ProviderErrorCode.TIMEOUT) {
                return retryOnTimeout;
            }
            if (providerFailure.getErrorCode() == ProviderException.ProviderErrorCode.CONNECTION) {
                return retryOnConnectionFailure;
            }
            return providerFailure.isRetryable();
        }
        if (failure instanceof SocketTimeoutException) {
            return retryOnTimeout;
        }
        return failure instanceof IOException && retryOnConnectionFailure;
    }

    /**
     * @param attempt zero-based number of the attempt that just failed
     */
    public boolean shouldRetry(int attempt) {
        return attempt + 1 < maxAttempts;
    }

    /**
     * Parse a {@code Retry-After} header given in seconds. HTTP dates are ignored.
     *
     * @return the wait, or null when absent or not a number of seconds
     */
    public static Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(header.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getBaseDelay() {
        return baseDelay;
    }

    public long getMaxDelay() {
        return maxDelay;
    }

    public Set<Integer> getRetryableStatusCodes() {
        return retryableStatusCodes;
    }

    public static class Builder {
        private int maxAttempts = 4;
        private long baseDelay = 1000;
        private long maxDelay = 16000;
        private Set<Integer> retryableStatusCodes = TRANSIENT_STATUS_CODES;
        private boolean retryOnConnectionFailure = true;
        private boolean retryOnTimeout = true;

        /**
         * @param maxAttempts total calls including the first; 1 disables retries
         */
        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder baseDelay(long baseDelay) {
            this.baseDelay = requireNonNegative(baseDelay, "baseDelay");
            return this;
        }

        public Builder maxDelay(long maxDelay) {
            this.maxDelay = requireNonNegative(maxDelay, "maxDelay");
            return this;
        }

        public Builder retryableStatusCodes(Set<Integer> statusCodes) {
            this.retryableStatusCodes = Set.copyOf(statusCodes);
            return this;
        }

        public Builder retryOnConnectionFailure(boolean retry) {
            this.retryOnConnectionFailure = retry;
            return this;
        }

        public Builder retryOnTimeout(boolean retry) {
            this.retryOnTimeout = retry;
            return this;
        }

        public RetryPolicy build() {
            return new RetryPolicy(this);
        }

        private static long requireNonNegative(long value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be non-negative");
            }
            return value;
        }
    }
}
