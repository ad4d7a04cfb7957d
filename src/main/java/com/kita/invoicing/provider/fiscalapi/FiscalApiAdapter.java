package com.kita.invoicing.provider.fiscalapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.kita.invoicing.client.ProviderHttpClient;
import com.kita.invoicing.client.ProviderResponse;
import com.kita.invoicing.client.RequestOptions;
import com.kita.invoicing.config.InvoicingConfig;
import com.kita.invoicing.config.ProviderType;
import com.kita.invoicing.crypto.DecryptedBundle;
import com.kita.invoicing.exception.ProviderException;
import com.kita.invoicing.model.FiscalId;
import com.kita.invoicing.model.TenantProfile;
import com.kita.invoicing.provider.CancellationReceipt;
import com.kita.invoicing.provider.IssuedDocument;
import com.kita.invoicing.provider.LiveCredential;
import com.kita.invoicing.provider.OrgRef;
import com.kita.invoicing.provider.OrganizationResolver;
import com.kita.invoicing.provider.ProviderAdapter;
import com.kita.invoicing.provider.ProvisionResult;
import com.kita.invoicing.store.OrganizationStore;
import com.kita.invoicing.tax.TaxDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * FiscalAPI v4 integration
 *
 * <p>The tenant's organization is an issuer person. Every response is an
 * envelope {@code {succeeded, message, details, data}}; an envelope with
 * {@code succeeded=false} is raised as a REJECTED {@link ProviderException}.
 */
public class FiscalApiAdapter implements ProviderAdapter {

    private static final Logger logger = LoggerFactory.getLogger(FiscalApiAdapter.class);

    private static final String API = "/api/v4";

    private final ProviderHttpClient client;
    private final OrganizationResolver resolver;
    private final OrganizationStore store;
    private final String tenantKey;

    public FiscalApiAdapter(InvoicingConfig config, OrganizationStore store) {
        this(new ProviderHttpClient(ProviderType.FISCALAPI.getValue(), config.getFiscalapiUrl(),
                authHeaders(config.getFiscalapiApiKey(), config.getFiscalapiTenantKey()), config),
            new OrganizationResolver(ProviderType.FISCALAPI, store,
                config.getOrganizationCacheTtl(), config.getCredentialCacheTtl()),
            store,
            config.getFiscalapiTenantKey());
    }

    public FiscalApiAdapter(ProviderHttpClient client, OrganizationResolver resolver, OrganizationStore store,
                            String tenantKey) {
        this.client = client;
        this.resolver = resolver;
        this.store = store;
        this.tenantKey = tenantKey;
    }

    static Map<String, String> authHeaders(String apiKey, String tenantKey) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("X-API-KEY", apiKey);
        headers.put("X-TENANT-KEY", tenantKey);
        return headers;
    }

    @Override
    public ProviderType providerType() {
        return ProviderType.FISCALAPI;
    }

    @Override
    public OrgRef getOrCreateOrganization(TenantProfile tenant) {
        return resolver.resolve(tenant, this::createIssuer);
    }

    private String createIssuer(TenantProfile tenant) {
        logger.info("Creating FiscalAPI issuer person for tenant {}", tenant.getTenantId());
        try {
            JsonNode data = unwrap(client.post(API + "/people", FiscalApiPayloadMapper.issuerPerson(tenant),
                RequestOptions.create().skipRetry(true)));
            String id = data.path("id").asText("");
            if (id.isEmpty()) {
                throw ProviderException.malformed("missing person id", data.toString())
                    .forProvider(client.getProviderName());
            }
            return id;
        } catch (ProviderException e) {
            if (!isAlreadyExists(e)) {
                throw e;
            }
            // a concurrent onboarding of the same tenant may have stored the mapping
            return store.find(tenant.getTenantId(), ProviderType.FISCALAPI)
                .map(mapping -> mapping.getOrganizationId())
                .orElseThrow(() -> e);
        }
    }

    @Override
    public ProvisionResult provisionSigningCredential(OrgRef organization, TenantProfile tenant,
                                                      DecryptedBundle material) {
        String personId = organization.getOrganizationId();
        String password = material.getPassphrase().getText();
        try {
            unwrap(client.post(API + "/tax-files", FiscalApiPayloadMapper.taxFile(personId, tenant,
                material.getCertificate().getRaw(), FiscalApiPayloadMapper.FILE_TYPE_CERTIFICATE, password)));
            logger.info("Certificate file uploaded for FiscalAPI person {}", personId);

            ProviderResponse<JsonNode> keyResponse = client.post(API + "/tax-files", FiscalApiPayloadMapper.taxFile(
                personId, tenant, material.getPrivateKey().getRaw(), FiscalApiPayloadMapper.FILE_TYPE_PRIVATE_KEY,
                password));
            unwrap(keyResponse);
            logger.info("Private key file uploaded for FiscalAPI person {}", personId);
            return ProvisionResult.success(keyResponse.getRawBody());
        } catch (ProviderException e) {
            logger.error("Certificate upload failed for FiscalAPI person {}: {}", personId, e.getMessage());
            return ProvisionResult.failure(e.getMessage(), e.getRawResponse());
        }
    }

    /**
     * The account tenant key, scoped to the issuer person on each request
     */
    @Override
    public LiveCredential getOrCreateLiveCredential(OrgRef organization) {
        return new LiveCredential(tenantKey, null);
    }

    @Override
    public IssuedDocument issueDocument(OrgRef organization, LiveCredential credential, TaxDocument document) {
        ProviderResponse<JsonNode> response = client.post(API + "/invoices",
            FiscalApiPayloadMapper.invoice(organization.getOrganizationId(), document),
            withCredential(credential).skipRetry(true));
        JsonNode data = unwrap(response);

        String uuid = data.path("uuid").asText("");
        FiscalId fiscalId;
        try {
            fiscalId = FiscalId.of(uuid);
        } catch (IllegalArgumentException e) {
            throw ProviderException.malformed("uuid is not a valid fiscal id", response.getRawBody())
                .forProvider(client.getProviderName());
        }
        logger.info("FiscalAPI stamped {} as {}", document.serieFolio(), fiscalId);

        return new IssuedDocument(fiscalId, data.path("id").asText(null),
            decodeArtifact(data, "xml"), decodeArtifact(data, "pdf"), response.getRawBody());
    }

    @Override
    public CancellationReceipt cancelDocument(OrgRef organization, LiveCredential credential, FiscalId fiscalId,
                                              String reasonCode, String knownDocumentId) {
        ProviderResponse<JsonNode> response = client.delete(API + "/invoices/" + fiscalId.getValue(),
            FiscalApiPayloadMapper.cancellation(fiscalId.getValue(), reasonCode), withCredential(credential));
        JsonNode data = unwrap(response);
        String status = data.path("status").asText("cancelled");
        String receipt = data.path("acknowledgement").asText(null);
        logger.info("FiscalAPI cancellation of {} returned status {}", fiscalId, status);
        return new CancellationReceipt(fiscalId, knownDocumentId, status, receipt, response.getRawBody());
    }

    @Override
    public boolean testConnection() {
        try {
            unwrap(client.get(API + "/people", RequestOptions.create().param("limit", "1")));
            logger.info("FiscalAPI connection test succeeded");
            return true;
        } catch (ProviderException e) {
            logger.error("FiscalAPI connection test failed: {}", e.getMessage());
            return false;
        }
    }

    private RequestOptions withCredential(LiveCredential credential) {
        return RequestOptions.create().header("X-TENANT-KEY", credential.getValue());
    }

    private byte[] decodeArtifact(JsonNode data, String field) {
        String encoded = data.path(field).asText("");
        if (encoded.isEmpty()) {
            return null;
        }
        try {
            return Base64.getMimeDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            logger.warn("FiscalAPI returned a {} artifact that is not base64", field);
            return null;
        }
    }

    /**
     * Data of a successful envelope
     *
     * @throws ProviderException REJECTED when {@code succeeded} is false, MALFORMED_RESPONSE without an envelope
     */
    JsonNode unwrap(ProviderResponse<JsonNode> response) {
        JsonNode body = response.getData();
        if (body == null || !body.has("succeeded")) {
            throw ProviderException.malformed("missing response envelope", response.getRawBody())
                .forProvider(client.getProviderName());
        }
        if (!body.path("succeeded").asBoolean(false)) {
            String message = body.path("message").asText("FiscalAPI reported an unsuccessful operation");
            String details = body.path("details").asText("");
            throw ProviderException.rejected(details.isEmpty() ? message : message + ": " + details,
                response.getRawBody()).forProvider(client.getProviderName());
        }
        return body.path("data");
    }

    static boolean isAlreadyExists(ProviderException e) {
        if (e.getStatusCode() != null && e.getStatusCode() == 409) {
            return true;
        }
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("already exists") || lower.contains("ya existe");
    }
}
