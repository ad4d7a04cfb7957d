package com.kita.invoicing.provider.facturapi;

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
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.RequestBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Facturapi integration
 *
 * <p>Organization management uses the account's user key; documents are
 * issued and cancelled with the organization's live key.
 */
public class FacturapiAdapter implements ProviderAdapter {

    private static final Logger logger = LoggerFactory.getLogger(FacturapiAdapter.class);

    static final String LIVE_KEY_PREFIX = "sk_live_";

    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

    private final ProviderHttpClient client;
    private final OrganizationResolver resolver;
    private final OrganizationStore store;

    public FacturapiAdapter(InvoicingConfig config, OrganizationStore store) {
        this(new ProviderHttpClient(ProviderType.FACTURAPI.getValue(), config.getFacturapiUrl(),
                Map.of("Authorization", "Bearer " + config.getFacturapiUserKey()), config),
            new OrganizationResolver(ProviderType.FACTURAPI, store,
                config.getOrganizationCacheTtl(), config.getCredentialCacheTtl()),
            store);
    }

    public FacturapiAdapter(ProviderHttpClient client, OrganizationResolver resolver, OrganizationStore store) {
        this.client = client;
        this.resolver = resolver;
        this.store = store;
    }

    @Override
    public ProviderType providerType() {
        return ProviderType.FACTURAPI;
    }

    @Override
    public OrgRef getOrCreateOrganization(TenantProfile tenant) {
        return resolver.resolve(tenant, this::createOrganization);
    }

    private String createOrganization(TenantProfile tenant) {
        logger.info("Creating Facturapi organization for tenant {}", tenant.getTenantId());
        ProviderResponse<JsonNode> response = client.post("/organizations",
            FacturapiPayloadMapper.organization(tenant), RequestOptions.create().skipRetry(true));
        return requiredText(response, "id");
    }

    @Override
    public ProvisionResult provisionSigningCredential(OrgRef organization, TenantProfile tenant,
                                                      DecryptedBundle material) {
        String orgId = organization.getOrganizationId();
        try {
            client.put("/organizations/" + orgId + "/legal", FacturapiPayloadMapper.legal(tenant));
            logger.info("Legal data updated for Facturapi organization {}", orgId);
        } catch (ProviderException e) {
            // certificate upload still proceeds; Facturapi reports missing legal data on issuance
            logger.error("Legal data update failed for Facturapi organization {}: {}", orgId, e.getMessage());
        }

        MultipartBody multipart = new MultipartBody.Builder()
            .setType(MultipartBody.FORM)
            .addFormDataPart("cer", "certificate.cer",
                RequestBody.create(material.getCertificate().getRaw(), OCTET_STREAM))
            .addFormDataPart("key", "privatekey.key",
                RequestBody.create(material.getPrivateKey().getRaw(), OCTET_STREAM))
            .addFormDataPart("password", material.getPassphrase().getText())
            .build();

        try {
            ProviderResponse<JsonNode> response = client.putMultipart("/organizations/" + orgId + "/certificate",
                multipart, RequestOptions.create());
            logger.info("Certificate uploaded to Facturapi organization {}", orgId);
            return ProvisionResult.success(response.getRawBody());
        } catch (ProviderException e) {
            logger.error("Certificate upload failed for Facturapi organization {}: {}", orgId, e.getMessage());
            return ProvisionResult.failure(e.getMessage(), e.getRawResponse());
        }
    }

    @Override
    public LiveCredential getOrCreateLiveCredential(OrgRef organization) {
        return resolver.resolveCredential(organization, () -> issueLiveKey(organization, true));
    }

    private String issueLiveKey(OrgRef organization, boolean retryOnConflict) {
        String orgId = organization.getOrganizationId();
        try {
            ProviderResponse<JsonNode> response = client.put("/organizations/" + orgId + "/apikeys/live", null,
                RequestOptions.create().skipRetry(true));
            JsonNode data = response.getData();
            String key = data == null ? null : data.isTextual() ? data.asText() : data.path("key").asText(null);
            if (key == null || !key.startsWith(LIVE_KEY_PREFIX)) {
                throw ProviderException.malformed("live key has an unexpected format", null)
                    .forProvider(client.getProviderName());
            }
            logger.info("Live key issued for Facturapi organization {}", orgId);
            return key;
        } catch (ProviderException e) {
            if (!retryOnConflict || !isAlreadyExists(e)) {
                throw e;
            }
            Optional<String> stored = store.find(organization.getTenantId(), ProviderType.FACTURAPI)
                .filter(mapping -> mapping.getOrganizationId().equals(orgId) && mapping.hasLiveCredential())
                .map(mapping -> mapping.getLiveCredential());
            if (stored.isPresent()) {
                logger.info("Live key for Facturapi organization {} issued concurrently; using stored key", orgId);
                return stored.get();
            }
            logger.info("Live key for Facturapi organization {} already exists; re-issuing", orgId);
            return issueLiveKey(organization, false);
        }
    }

    @Override
    public IssuedDocument issueDocument(OrgRef organization, LiveCredential credential, TaxDocument document) {
        RequestOptions stamping = liveKey(credential).skipRetry(true);
        ProviderResponse<JsonNode> response = client.post("/invoices", FacturapiPayloadMapper.invoice(document),
            stamping);

        String documentId = requiredText(response, "id");
        FiscalId fiscalId = parseFiscalId(response);
        logger.info("Facturapi stamped {} as {} (id {})", document.serieFolio(), fiscalId, documentId);

        // downloads are idempotent and keep their retries
        RequestOptions auth = liveKey(credential);
        byte[] xml = download(documentId, "xml", auth);
        byte[] pdf = download(documentId, "pdf", auth);
        return new IssuedDocument(fiscalId, documentId, xml, pdf, response.getRawBody());
    }

    /**
     * Artifact of a stamped invoice, null when the download fails
     */
    private byte[] download(String documentId, String format, RequestOptions auth) {
        try {
            return client.get("/invoices/" + documentId + "/" + format, auth, byte[].class).getData();
        } catch (ProviderException e) {
            logger.warn("Could not download {} of Facturapi invoice {}: {}", format, documentId, e.getMessage());
            return null;
        }
    }

    @Override
    public CancellationReceipt cancelDocument(OrgRef organization, LiveCredential credential, FiscalId fiscalId,
                                              String reasonCode, String knownDocumentId) {
        String documentId = knownDocumentId != null ? knownDocumentId : findDocumentId(fiscalId, credential);
        ProviderResponse<JsonNode> response = client.delete("/invoices/" + documentId,
            liveKey(credential).param("motive", reasonCode));
        JsonNode data = response.getData();
        String status = data != null ? data.path("status").asText(null) : null;
        String receipt = data != null ? data.path("cancellation_receipt").asText(null) : null;
        logger.info("Facturapi cancellation of {} returned status {}", fiscalId, status);
        return new CancellationReceipt(fiscalId, documentId, status, receipt, response.getRawBody());
    }

    private String findDocumentId(FiscalId fiscalId, LiveCredential credential) {
        ProviderResponse<JsonNode> response = client.get("/invoices",
            liveKey(credential).param("q", "uuid:" + fiscalId.getValue()).param("limit", "1"));
        JsonNode first = response.getData() != null ? response.getData().path("data").path(0) : null;
        if (first == null || first.isMissingNode() || first.path("id").asText("").isEmpty()) {
            throw ProviderException.httpStatus(404, "Invoice not found at Facturapi: " + fiscalId,
                response.getRawBody(), false).forProvider(client.getProviderName());
        }
        return first.path("id").asText();
    }

    @Override
    public boolean testConnection() {
        try {
            client.get("/organizations", RequestOptions.create().param("limit", "1"));
            logger.info("Facturapi connection test succeeded");
            return true;
        } catch (ProviderException e) {
            logger.error("Facturapi connection test failed: {}", e.getMessage());
            return false;
        }
    }

    private RequestOptions liveKey(LiveCredential credential) {
        return RequestOptions.create().header("Authorization", "Bearer " + credential.getValue());
    }

    private FiscalId parseFiscalId(ProviderResponse<JsonNode> response) {
        String uuid = requiredText(response, "uuid");
        try {
            return FiscalId.of(uuid);
        } catch (IllegalArgumentException e) {
            throw ProviderException.malformed("uuid is not a valid fiscal id", response.getRawBody())
                .forProvider(client.getProviderName());
        }
    }

    private String requiredText(ProviderResponse<JsonNode> response, String field) {
        JsonNode data = response.getData();
        String value = data != null ? data.path(field).asText(null) : null;
        if (value == null || value.isEmpty()) {
            throw ProviderException.malformed("missing field '" + field + "'", response.getRawBody())
                .forProvider(client.getProviderName());
        }
        return value;
    }

    static boolean isAlreadyExists(ProviderException e) {
        if (e.getStatusCode() != null && e.getStatusCode() == 409) {
            return true;
        }
        String message = e.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT).contains("already exists");
    }

    ProviderHttpClient getClient() {
        return client;
    }
}
