package com.kita.invoicing.provider.fiscalapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kita.invoicing.client.CircuitBreaker;
import com.kita.invoicing.client.ProviderHttpClient;
import com.kita.invoicing.client.RetryPolicy;
import com.kita.invoicing.config.InvoicingConfig;
import com.kita.invoicing.config.ProviderType;
import com.kita.invoicing.crypto.DecryptedBundle;
import com.kita.invoicing.exception.ProviderException;
import com.kita.invoicing.model.FiscalId;
import com.kita.invoicing.model.PayerIdentity;
import com.kita.invoicing.model.ProviderOrganization;
import com.kita.invoicing.model.TenantProfile;
import com.kita.invoicing.provider.CancellationReceipt;
import com.kita.invoicing.provider.IssuedDocument;
import com.kita.invoicing.provider.LiveCredential;
import com.kita.invoicing.provider.OrgRef;
import com.kita.invoicing.provider.OrganizationResolver;
import com.kita.invoicing.provider.ProvisionResult;
import com.kita.invoicing.store.InMemoryOrganizationStore;
import com.kita.invoicing.tax.TaxDocument;
import com.kita.invoicing.tax.TaxDocumentBuilder;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FiscalApiAdapter
 */
class FiscalApiAdapterTest {

    private static final String UUID = "7F3C2B8E-1A2D-4C5E-9F60-0A1B2C3D4E5F";

    private MockWebServer server;
    private ProviderHttpClient client;
    private InMemoryOrganizationStore store;
    private FiscalApiAdapter adapter;
    private TenantProfile tenant;
    private final ObjectMapper mapper = new ObjectMapper();

    private InvoicingConfig config() {
        return InvoicingConfig.builder()
            .provider(ProviderType.FISCALAPI)
            .masterKeyId("k1")
            .masterKey("0123456789abcdef-master")
            .fiscalapiApiKey("sk_fiscal_test")
            .fiscalapiTenantKey("tenant-key-test")
            .timeout(5000)
            .build();
    }

    private MockResponse envelope(String data) {
        return new MockResponse()
            .setResponseCode(200)
            .addHeader("Content-Type", "application/json")
            .setBody("{\"succeeded\":true,\"message\":\"\",\"details\":\"\",\"data\":" + data + "}");
    }

    private MockResponse failedEnvelope(String message, String details) {
        return new MockResponse()
            .setResponseCode(200)
            .addHeader("Content-Type", "application/json")
            .setBody("{\"succeeded\":false,\"message\":\"" + message + "\",\"details\":\"" + details
                + "\",\"data\":null}");
    }

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        RetryPolicy retries = RetryPolicy.builder().maxAttempts(3).baseDelay(0).maxDelay(0).build();
        client = new ProviderHttpClient("fiscalapi", server.url("/fiscal").toString(),
            FiscalApiAdapter.authHeaders("sk_fiscal_test", "tenant-key-test"), config(), retries,
            new CircuitBreaker("fiscalapi"));
        store = new InMemoryOrganizationStore();
        adapter = new FiscalApiAdapter(client,
            new OrganizationResolver(ProviderType.FISCALAPI, store, 3600, 86400), store, "tenant-key-test");
        tenant = TenantProfile.builder()
            .tenantId("tenant-a")
            .taxId("EKU9003173C9")
            .legalName("ESCUELA KEMPER URGATE")
            .postalCode("42501")
            .email("facturas@example.com")
            .build();
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        server.shutdown();
    }

    private OrgRef mappedIssuer() {
        store.save(ProviderOrganization.of("tenant-a", ProviderType.FISCALAPI, "person_1"));
        return new OrgRef(ProviderType.FISCALAPI, "tenant-a", "person_1");
    }

    private TaxDocument document() {
        PayerIdentity payer = PayerIdentity.builder()
            .taxId("XAXX010101000")
            .legalName("PUBLICO EN GENERAL")
            .postalCode("42501")
            .build();
        return new TaxDocumentBuilder().build(tenant, payer, new BigDecimal("116.00"), new BigDecimal("0.16"), 3,
            "Colegiatura", "03", "MXN", LocalDateTime.of(2026, 3, 15, 12, 0));
    }

    @Nested
    @DisplayName("getOrCreateOrganization")
    class GetOrCreateOrganization {

        @Test
        @DisplayName("should create an issuer person with account headers")
        void shouldCreateIssuer() throws Exception {
            server.enqueue(envelope("{\"id\":\"person_1\"}"));

            OrgRef ref = adapter.getOrCreateOrganization(tenant);

            assertEquals("person_1", ref.getOrganizationId());
            RecordedRequest request = server.takeRequest();
            assertEquals("POST", request.getMethod());
            assertEquals("/fiscal/api/v4/people", request.getPath());
            assertEquals("sk_fiscal_test", request.getHeader("X-API-KEY"));
            assertEquals("tenant-key-test", request.getHeader("X-TENANT-KEY"));
            JsonNode body = mapper.readTree(request.getBody().readUtf8());
            assertEquals("EKU9003173C9", body.path("tin").asText());
            assertTrue(body.path("isIssuer").asBoolean());
            assertEquals("person_1", store.find("tenant-a", ProviderType.FISCALAPI).orElseThrow().getOrganizationId());
        }

        @Test
        @DisplayName("should not search the people directory by RFC")
        void shouldNeverSearchByTaxId() throws Exception {
            server.enqueue(envelope("{\"id\":\"person_1\"}"));

            adapter.getOrCreateOrganization(tenant);

            assertEquals(1, server.getRequestCount());
            RecordedRequest request = server.takeRequest();
            assertNull(request.getRequestUrl().queryParameter("tin"));
            assertNull(request.getRequestUrl().queryParameter("rfc"));
        }

        @Test
        @DisplayName("should surface an already-existing issuer that is not mapped to the tenant")
        void shouldSurfaceUnmappedConflict() {
            server.enqueue(new MockResponse()
                .setResponseCode(409)
                .addHeader("Content-Type", "application/json")
                .setBody("{\"message\":\"La persona ya existe\"}"));

            ProviderException error = assertThrows(ProviderException.class,
                () -> adapter.getOrCreateOrganization(tenant));

            assertEquals(409, error.getStatusCode());
            assertTrue(store.find("tenant-a", ProviderType.FISCALAPI).isEmpty());
        }

        @Test
        @DisplayName("should raise an unsuccessful envelope as rejected")
        void shouldRejectUnsuccessfulEnvelope() {
            server.enqueue(failedEnvelope("Validation failed", "postalCode is required"));

            ProviderException error = assertThrows(ProviderException.class,
                () -> adapter.getOrCreateOrganization(tenant));

            assertEquals(ProviderException.ProviderErrorCode.REJECTED, error.getErrorCode());
            assertEquals("Validation failed: postalCode is required", error.getMessage());
            assertFalse(error.isRetryable());
        }
    }

    @Nested
    @DisplayName("provisionSigningCredential")
    class ProvisionSigningCredential {

        private final byte[] certificate = {0x30, 0x01, 0x02};
        private final byte[] key = {0x30, 0x03, 0x04};

        private DecryptedBundle material() {
            return new DecryptedBundle(
                DecryptedBundle.Payload.binary(certificate),
                DecryptedBundle.Payload.binary(key),
                DecryptedBundle.Payload.text("12345678a".getBytes(StandardCharsets.UTF_8), "12345678a"));
        }

        @Test
        @DisplayName("should upload certificate and key as tax files")
        void shouldUploadTaxFiles() throws Exception {
            server.enqueue(envelope("{\"id\":\"file_1\"}"));
            server.enqueue(envelope("{\"id\":\"file_2\"}"));

            ProvisionResult result = adapter.provisionSigningCredential(mappedIssuer(), tenant, material());

            assertTrue(result.isSuccess());
            JsonNode cer = mapper.readTree(server.takeRequest().getBody().readUtf8());
            JsonNode keyFile = mapper.readTree(server.takeRequest().getBody().readUtf8());
            assertEquals("person_1", cer.path("personId").asText());
            assertEquals(0, cer.path("fileType").asInt());
            assertEquals(Base64.getEncoder().encodeToString(certificate), cer.path("base64File").asText());
            assertEquals(1, keyFile.path("fileType").asInt());
            assertEquals(Base64.getEncoder().encodeToString(key), keyFile.path("base64File").asText());
            assertEquals("12345678a", keyFile.path("password").asText());
        }

        @Test
        @DisplayName("should report a rejected key upload")
        void shouldReportRejectedKey() {
            server.enqueue(envelope("{\"id\":\"file_1\"}"));
            server.enqueue(failedEnvelope("Invalid password", ""));

            ProvisionResult result = adapter.provisionSigningCredential(mappedIssuer(), tenant, material());

            assertFalse(result.isSuccess());
            assertEquals("Invalid password", result.getMessage());
            assertTrue(result.getRawResponse().contains("\"succeeded\":false"));
        }
    }

    @Test
    @DisplayName("should use the account tenant key as live credential without calling the provider")
    void shouldUseTenantKey() {
        LiveCredential credential = adapter.getOrCreateLiveCredential(mappedIssuer());

        assertEquals("tenant-key-test", credential.getValue());
        assertEquals(0, server.getRequestCount());
    }

    @Nested
    @DisplayName("issueDocument")
    class IssueDocument {

        @Test
        @DisplayName("should stamp with the issuer id and decode artifacts")
        void shouldIssue() throws Exception {
            String xml = Base64.getEncoder().encodeToString("<cfdi:Comprobante/>".getBytes(StandardCharsets.UTF_8));
            server.enqueue(envelope("{\"id\":\"inv_1\",\"uuid\":\"7f3c2b8e-1a2d-4c5e-9f60-0a1b2c3d4e5f\",\"xml\":\"" + xml
                + "\"}"));

            IssuedDocument issued = adapter.issueDocument(mappedIssuer(),
                new LiveCredential("tenant-key-live", null), document());

            assertEquals(FiscalId.of(UUID), issued.getFiscalId());
            assertEquals("inv_1", issued.getDocumentId());
            assertEquals("<cfdi:Comprobante/>", new String(issued.getXml(), StandardCharsets.UTF_8));
            assertNull(issued.getPdf());

            RecordedRequest request = server.takeRequest();
            assertEquals("/fiscal/api/v4/invoices", request.getPath());
            assertEquals("tenant-key-live", request.getHeader("X-TENANT-KEY"));
            JsonNode body = mapper.readTree(request.getBody().readUtf8());
            assertEquals("person_1", body.path("issuerId").asText());
            assertEquals("EKU", body.path("series").asText());
            assertEquals("000003", body.path("number").asText());
            assertEquals("2026-03-15T12:00:00", body.path("date").asText());
        }

        @Test
        @DisplayName("should not retry a rejected stamp")
        void shouldNotRetryRejection() {
            server.enqueue(failedEnvelope("CFDI40147", "Invalid recipient"));

            ProviderException error = assertThrows(ProviderException.class,
                () -> adapter.issueDocument(mappedIssuer(), new LiveCredential("tenant-key-test", null), document()));

            assertEquals(ProviderException.ProviderErrorCode.REJECTED, error.getErrorCode());
            assertEquals(1, server.getRequestCount());
        }

        @Test
        @DisplayName("should reject a response without an envelope")
        void shouldRejectMissingEnvelope() {
            server.enqueue(new MockResponse()
                .setResponseCode(200)
                .addHeader("Content-Type", "application/json")
                .setBody("{\"uuid\":\"" + UUID + "\"}"));

            ProviderException error = assertThrows(ProviderException.class,
                () -> adapter.issueDocument(mappedIssuer(), new LiveCredential("tenant-key-test", null), document()));

            assertEquals(ProviderException.ProviderErrorCode.MALFORMED_RESPONSE, error.getErrorCode());
        }
    }

    @Test
    @DisplayName("should cancel by fiscal id with the reason in the body")
    void shouldCancel() throws Exception {
        server.enqueue(envelope("{\"status\":\"cancelled\",\"acknowledgement\":\"<Acuse/>\"}"));

        CancellationReceipt receipt = adapter.cancelDocument(mappedIssuer(),
            new LiveCredential("tenant-key-test", null), FiscalId.of(UUID), "03", "inv_1");

        assertEquals("cancelled", receipt.getStatus());
        assertEquals("<Acuse/>", receipt.getReceipt());
        assertEquals("inv_1", receipt.getDocumentId());
        RecordedRequest request = server.takeRequest();
        assertEquals("DELETE", request.getMethod());
        assertEquals("/fiscal/api/v4/invoices/" + UUID, request.getPath());
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertEquals(UUID, body.path("uuid").asText());
        assertEquals("03", body.path("reason").asText());
    }

    @Test
    @DisplayName("should report connection health")
    void shouldTestConnection() {
        server.enqueue(envelope("[]"));
        server.enqueue(failedEnvelope("Unauthorized", ""));

        assertTrue(adapter.testConnection());
        assertFalse(adapter.testConnection());
    }

    @Test
    @DisplayName("should detect already-exists errors in English and Spanish")
    void shouldDetectAlreadyExists() {
        assertTrue(FiscalApiAdapter.isAlreadyExists(ProviderException.rejected("Person already exists", null)));
        assertTrue(FiscalApiAdapter.isAlreadyExists(ProviderException.rejected("El RFC ya existe", null)));
        assertFalse(FiscalApiAdapter.isAlreadyExists(ProviderException.rejected("Invalid postal code", null)));
    }
}
