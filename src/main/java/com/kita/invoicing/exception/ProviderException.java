package com.kita.invoicing.exception;

/**
 * Provider exception for failures talking to a stamping authority (PAC)
 *
 * <p>Covers transport failures as well as provider-side rejections. Carries
 * whether the failure is retryable and the raw provider response so callers
 * can persist it for diagnostics.
 */
public class ProviderException extends InvoicingException {

    /**
     * Provider error codes
     */
    public enum ProviderErrorCode {
        TIMEOUT("PAC01", "Request to the stamping provider timed out"),
        CONNECTION("PAC02", "Could not connect to the stamping provider"),
        CLIENT_ERROR("PAC03", "The stamping provider rejected the request"),
        SERVER_ERROR("PAC04", "The stamping provider failed to process the request"),
        MALFORMED_RESPONSE("PAC05", "The stamping provider returned an unexpected response"),
        CIRCUIT_OPEN("PAC06", "Circuit breaker is open"),
        REJECTED("PAC07", "The stamping provider reported an unsuccessful operation");

        private final String code;
        private final String defaultMessage;

        ProviderErrorCode(String code, String defaultMessage) {
            this.code = code;
            this.defaultMessage = defaultMessage;
        }

        public String getCode() {
            return code;
        }

        public String getDefaultMessage() {
            return defaultMessage;
        }
    }

    private final ProviderErrorCode errorCode;
    private final boolean retryable;
    private final String provider;
    private final String rawResponse;

    /**
     * Create a provider exception with full details
     *
     * @param message Error message
     * @param statusCode HTTP status code, if any
     * @param errorCode Provider error code
     * @param retryable Whether the error is retryable
     * @param provider Provider name, if known
     * @param rawResponse Raw response body, if any
     */
    public ProviderException(String message, Integer statusCode, ProviderErrorCode errorCode,
                             boolean retryable, String provider, String rawResponse) {
        this(message, statusCode, errorCode, retryable, provider, rawResponse, null);
    }

    public ProviderException(String message, Integer statusCode, ProviderErrorCode errorCode,
                             boolean retryable, String provider, String rawResponse, Throwable cause) {
        super(message, errorCode.getCode(), statusCode, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
        this.provider = provider;
        this.rawResponse = rawResponse;
    }

    public ProviderErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Check if this error is retryable
     */
    public boolean isRetryable() {
        return retryable;
    }

    public String getProvider() {
        return provider;
    }

    public String getRawResponse() {
        return rawResponse;
    }

    /**
     * Copy of this exception attributed to a provider
     */
    public ProviderException forProvider(String providerName) {
        if (provider != null) {
            return this;
        }
        return new ProviderException(getMessage(), getStatusCode(), errorCode, retryable,
            providerName, rawResponse, getCause());
    }

    /**
     * Create a timeout error
     *
     * @param cause underlying exception
     * @return ProviderException for timeout
     */
    public static ProviderException timeout(Throwable cause) {
        return new ProviderException(
            ProviderErrorCode.TIMEOUT.getDefaultMessage(),
            408,
            ProviderErrorCode.TIMEOUT,
            true,
            null,
            null,
            cause
        );
    }

    /**
     * Create a connection error
     *
     * @param cause underlying exception
     * @return ProviderException for connection failure
     */
    public static ProviderException connection(Throwable cause) {
        return new ProviderException(
            ProviderErrorCode.CONNECTION.getDefaultMessage() + ": " + cause.getMessage(),
            null,
            ProviderErrorCode.CONNECTION,
            true,
            null,
            null,
            cause
        );
    }

    /**
     * Create an error from an unsuccessful HTTP status
     *
     * @param statusCode HTTP status code
     * @param message message extracted from the provider body
     * @param rawResponse raw body
     * @param retryable whether the status is retryable
     * @return ProviderException for the status
     */
    public static ProviderException httpStatus(int statusCode, String message, String rawResponse, boolean retryable) {
        ProviderErrorCode code = statusCode >= 500 ? ProviderErrorCode.SERVER_ERROR : ProviderErrorCode.CLIENT_ERROR;
        return new ProviderException(
            message != null ? message : code.getDefaultMessage(),
            statusCode,
            code,
            retryable,
            null,
            rawResponse
        );
    }

    /**
     * Create a circuit breaker open error
     *
     * @param retryAfterSeconds Seconds until retry is allowed
     * @return ProviderException for circuit breaker open
     */
    public static ProviderException circuitOpen(int retryAfterSeconds) {
        return new ProviderException(
            String.format("Circuit breaker is open. Retry after %d seconds", retryAfterSeconds),
            503,
            ProviderErrorCode.CIRCUIT_OPEN,
            false,
            null,
            null
        );
    }

    /**
     * Create an error for a body that could not be interpreted
     *
     * @param detail what was missing or malformed
     * @param rawResponse raw body
     * @return ProviderException for malformed response
     */
    public static ProviderException malformed(String detail, String rawResponse) {
        return new ProviderException(
            ProviderErrorCode.MALFORMED_RESPONSE.getDefaultMessage() + ": " + detail,
            null,
            ProviderErrorCode.MALFORMED_RESPONSE,
            false,
            null,
            rawResponse
        );
    }

    /**
     * Create an error for an envelope reporting {@code succeeded=false}
     *
     * @param message provider message
     * @param rawResponse raw body
     * @return ProviderException for rejected operation
     */
    public static ProviderException rejected(String message, String rawResponse) {
        return new ProviderException(
            message != null ? message : ProviderErrorCode.REJECTED.getDefaultMessage(),
            null,
            ProviderErrorCode.REJECTED,
            false,
            null,
            rawResponse
        );
    }
}
