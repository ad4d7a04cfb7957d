package com.kita.invoicing.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kita.invoicing.config.InvoicingConfig;
import com.kita.invoicing.exception.InvoicingException;
import com.kita.invoicing.exception.ProviderException;
import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * OkHttp transport shared by the provider adapters
 *
 * <p>Every request passes the {@link DirectorySearchGuard}, carries an
 * {@code X-Request-ID}, and goes through the provider's {@link CircuitBreaker}.
 * Non-2xx responses become {@link ProviderException}s that keep the raw body.
 * Retryable failures are retried per {@link RetryPolicy}; local failures such
 * as guard rejections propagate immediately.
 *
 * <p>When auditing is enabled each attempt produces a {@link ProviderCallAudit}
 * with credentials and certificate material masked.
 */
public class ProviderHttpClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ProviderHttpClient.class);

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final int MAX_AUDITED_TEXT = 256;

    private final String providerName;
    private final String baseUrl;
    private final Map<String, String> defaultHeaders;
    private final boolean auditEnabled;
    private final RetryPolicy retryPolicy;
    private final CircuitBreaker circuitBreaker;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    private volatile Consumer<ProviderCallAudit> auditSink;

    /**
     * Client with retries from configuration and a default circuit breaker
     *
     * @param providerName provider name used in errors and logs
     * @param baseUrl provider base URL without trailing slash
     * @param defaultHeaders authentication headers sent with every request
     * @param config resolved invoicing configuration
     */
    public ProviderHttpClient(String providerName, String baseUrl, Map<String, String> defaultHeaders,
                              InvoicingConfig config) {
        this(providerName, baseUrl, defaultHeaders, config, RetryPolicy.fromConfig(config),
            new CircuitBreaker(providerName));
    }

    public ProviderHttpClient(String providerName, String baseUrl, Map<String, String> defaultHeaders,
                              InvoicingConfig config, RetryPolicy retryPolicy, CircuitBreaker circuitBreaker) {
        Objects.requireNonNull(config, "Config must not be null");
        this.providerName = Objects.requireNonNull(providerName, "Provider name must not be null");
        this.baseUrl = Objects.requireNonNull(baseUrl, "Base URL must not be null");
        this.defaultHeaders = defaultHeaders != null ? Map.copyOf(defaultHeaders) : Map.of();
        this.auditEnabled = config.isEnableAuditLog();
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "Retry policy must not be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "Circuit breaker must not be null");

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());

        Duration timeout = Duration.ofMillis(config.getTimeout());
        this.okHttpClient = new OkHttpClient.Builder()
            .connectTimeout(timeout)
            .readTimeout(timeout)
            .writeTimeout(timeout)
            .connectionPool(new ConnectionPool(10, 5, TimeUnit.MINUTES))
            .addInterceptor(new DirectorySearchGuard())
            .addInterceptor(this::applyDefaultHeaders)
            .retryOnConnectionFailure(false)
            .build();
    }

    public ProviderResponse<JsonNode> get(String path) {
        return get(path, null, JsonNode.class);
    }

    public ProviderResponse<JsonNode> get(String path, RequestOptions options) {
        return get(path, options, JsonNode.class);
    }

    /**
     * GET with a chosen body type
     *
     * @param responseType {@code JsonNode}, {@code String}, {@code byte[]} or a Jackson-mappable type
     */
    public <T> ProviderResponse<T> get(String path, RequestOptions options, Class<T> responseType) {
        return execute("GET", path, null, options, responseType);
    }

    public ProviderResponse<JsonNode> post(String path, Object body) {
        return post(path, body, null);
    }

    public ProviderResponse<JsonNode> post(String path, Object body, RequestOptions options) {
        return execute("POST", path, body, options, JsonNode.class);
    }

    public ProviderResponse<JsonNode> put(String path, Object body) {
        return put(path, body, null);
    }

    public ProviderResponse<JsonNode> put(String path, Object body, RequestOptions options) {
        return execute("PUT", path, body, options, JsonNode.class);
    }

    /**
     * Multipart PUT for certificate and key uploads
     */
    public ProviderResponse<JsonNode> putMultipart(String path, MultipartBody multipart, RequestOptions options) {
        return execute("PUT", path, multipart, options, JsonNode.class);
    }

    public ProviderResponse<JsonNode> delete(String path) {
        return delete(path, null, null);
    }

    public ProviderResponse<JsonNode> delete(String path, RequestOptions options) {
        return delete(path, null, options);
    }

    public ProviderResponse<JsonNode> delete(String path, Object body, RequestOptions options) {
        return execute("DELETE", path, body, options, JsonNode.class);
    }

    public void setAuditSink(Consumer<ProviderCallAudit> auditSink) {
        this.auditSink = auditSink;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    public String getProviderName() {
        return providerName;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    @Override
    public void close() {
        okHttpClient.dispatcher().executorService().shutdown();
        okHttpClient.connectionPool().evictAll();
    }

    private <T> ProviderResponse<T> execute(String method, String path, Object body, RequestOptions options,
                                            Class<T> responseType) {
        RequestOptions effective = options != null ? options : RequestOptions.create();
        circuitBreaker.acquirePermission();

        HttpUrl url = resolve(path, effective);
        RequestBody requestBody = toRequestBody(body);
        OkHttpClient client = effective.getReadTimeoutMillis() == null ? okHttpClient
            : okHttpClient.newBuilder().readTimeout(Duration.ofMillis(effective.getReadTimeoutMillis())).build();
        int attempts = effective.isSkipRetry() ? 1 : retryPolicy.getMaxAttempts();

        for (int attempt = 0; ; attempt++) {
            Request request = buildRequest(method, url, requestBody, effective);
            long started = System.currentTimeMillis();
            Exception failure;
            Duration retryAfter = null;
            Integer status = null;
            String rawBody = null;

            try (Response response = client.newCall(request).execute()) {
                status = response.code();
                retryAfter = RetryPolicy.parseRetryAfter(response.header("Retry-After"));
                byte[] bytes = readBytes(response);
                boolean binary = responseType == byte[].class && response.isSuccessful();
                rawBody = binary ? null : new String(bytes, StandardCharsets.UTF_8);

                if (!response.isSuccessful()) {
                    throw statusError(status, rawBody);
                }
                circuitBreaker.recordSuccess();
                T data = decode(bytes, rawBody, responseType);
                audit(request, body, attempt, started, status, rawBody, null);
                return new ProviderResponse<>(data, status, rawBody, System.currentTimeMillis() - started,
                    request.header("X-Request-ID"));
            } catch (ProviderException e) {
                if (e.getErrorCode() != ProviderException.ProviderErrorCode.MALFORMED_RESPONSE) {
                    circuitBreaker.recordFailure();
                }
                failure = e;
            } catch (InvoicingException e) {
                throw e;
            } catch (IOException e) {
                circuitBreaker.recordFailure();
                failure = e;
            }
            audit(request, body, attempt, started, status, rawBody, failure);

            if (attempt + 1 >= attempts || !retryPolicy.isRetryable(failure)) {
                throw toProviderException(failure);
            }
            long delay = retryPolicy.delayBefore(attempt, retryAfter);
            logger.warn("{} {} {} failed on attempt {}/{}, retrying in {}ms: {}",
                providerName, method, url.encodedPath(), attempt + 1, attempts, delay, failure.getMessage());
            pause(delay, failure);
        }
    }

    private HttpUrl resolve(String path, RequestOptions options) {
        HttpUrl parsed = HttpUrl.parse(baseUrl + path);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid provider URL: " + baseUrl + path);
        }
        HttpUrl.Builder builder = parsed.newBuilder();
        options.getQueryParameters().forEach(builder::addQueryParameter);
        return builder.build();
    }

    private Request buildRequest(String method, HttpUrl url, RequestBody body, RequestOptions options) {
        Request.Builder builder = new Request.Builder()
            .url(url)
            .header("X-Request-ID", newRequestId());
        options.getHeaders().forEach(builder::header);
        if ("GET".equals(method)) {
            return builder.get().build();
        }
        if ("DELETE".equals(method)) {
            return builder.delete(body).build();
        }
        return builder.method(method, body != null ? body : RequestBody.create("", JSON)).build();
    }

    private Response applyDefaultHeaders(Interceptor.Chain chain) throws IOException {
        Request request = chain.request();
        Request.Builder builder = request.newBuilder();
        if (request.header("Accept") == null) {
            builder.header("Accept", "application/json");
        }
        defaultHeaders.forEach((name, value) -> {
            if (request.header(name) == null) {
                builder.header(name, value);
            }
        });
        return chain.proceed(builder.build());
    }

    private static String newRequestId() {
        return "kita-" + Long.toHexString(System.currentTimeMillis()) + "-"
            + UUID.randomUUID().toString().substring(0, 8);
    }

    private static byte[] readBytes(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.bytes() : new byte[0];
    }

    private RequestBody toRequestBody(Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof RequestBody) {
            return (RequestBody) body;
        }
        try {
            return RequestBody.create(objectMapper.writeValueAsString(body), JSON);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body cannot be serialized to JSON", e);
        }
    }

    private <T> T decode(byte[] bytes, String text, Class<T> responseType) {
        if (responseType == byte[].class) {
            return responseType.cast(bytes);
        }
        if (responseType == String.class) {
            return responseType.cast(text);
        }
        if (bytes.length == 0) {
            return null;
        }
        try {
            if (responseType == JsonNode.class) {
                return responseType.cast(objectMapper.readTree(text));
            }
            return objectMapper.readValue(text, responseType);
        } catch (JsonProcessingException e) {
            throw ProviderException.malformed("response body is not valid JSON", text).forProvider(providerName);
        }
    }

    private ProviderException statusError(int status, String rawBody) {
        String message = messageFrom(rawBody);
        return ProviderException.httpStatus(status,
                message != null ? message : providerName + " returned HTTP " + status,
                rawBody, retryPolicy.isRetryableStatusCode(status))
            .forProvider(providerName);
    }

    /**
     * Human-readable message from a provider error body:
     * {@code message}, then {@code errors[0].message}, then {@code details}
     */
    private String messageFrom(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            return null;
        }
        try {
            JsonNode json = objectMapper.readTree(rawBody);
            if (json.hasNonNull("message") && !json.get("message").asText().isBlank()) {
                return json.get("message").asText();
            }
            JsonNode errors = json.path("errors");
            if (errors.isArray() && errors.size() > 0) {
                JsonNode first = errors.get(0);
                return first.hasNonNull("message") ? first.get("message").asText() : first.asText();
            }
            return json.hasNonNull("details") ? json.get("details").asText() : null;
        } catch (JsonProcessingException e) {
            logger.debug("Error body from {} is not JSON", providerName);
            return null;
        }
    }

    private ProviderException toProviderException(Exception failure) {
        if (failure instanceof ProviderException) {
            return ((ProviderException) failure).forProvider(providerName);
        }
        if (failure instanceof SocketTimeoutException) {
            return ProviderException.timeout(failure).forProvider(providerName);
        }
        return ProviderException.connection(failure).forProvider(providerName);
    }

    private void pause(long delayMillis, Exception failure) {
        if (delayMillis <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw toProviderException(failure);
        }
    }

    private void audit(Request request, Object body, int attempt, long started, Integer status, String rawBody,
                       Exception failure) {
        if (!auditEnabled) {
            return;
        }
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : request.headers().names()) {
            headers.put(name, request.header(name));
        }
        ProviderCallAudit entry = ProviderCallAudit.builder()
            .occurredAt(Instant.now())
            .requestId(request.header("X-Request-ID"))
            .provider(providerName)
            .method(request.method())
            .url(request.url().toString())
            .headers(PayloadRedactor.redactHeaders(headers))
            .requestBody(auditable(body))
            .status(status)
            .responseBody(auditable(rawBody))
            .durationMillis(System.currentTimeMillis() - started)
            .attempt(attempt)
            .error(failure != null ? failure.getMessage() : null)
            .build();

        Consumer<ProviderCallAudit> sink = auditSink;
        if (sink != null) {
            sink.accept(entry);
        } else {
            logger.debug("[{}] {} {} {} -> {} in {}ms", entry.getRequestId(), providerName, entry.getMethod(),
                entry.getUrl(), status, entry.getDurationMillis());
        }
    }

    private Object auditable(Object payload) {
        if (payload == null) {
            return null;
        }
        if (payload instanceof RequestBody) {
            return "[multipart]";
        }
        if (payload instanceof String) {
            String text = (String) payload;
            if (text.isEmpty()) {
                return null;
            }
            try {
                return PayloadRedactor.redact(objectMapper.readValue(text, Object.class));
            } catch (JsonProcessingException e) {
                return text.length() > MAX_AUDITED_TEXT ? text.substring(0, MAX_AUDITED_TEXT) + "..." : text;
            }
        }
        return PayloadRedactor.redact(objectMapper.convertValue(payload, Object.class));
    }
}
