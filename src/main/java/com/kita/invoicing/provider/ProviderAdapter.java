package com.kita.invoicing.provider;

import com.kita.invoicing.config.ProviderType;
import com.kita.invoicing.crypto.DecryptedBundle;
import com.kita.invoicing.model.FiscalId;
import com.kita.invoicing.model.TenantProfile;
import com.kita.invoicing.tax.TaxDocument;

/**
 * Protocol every stamping provider (PAC) integration implements
 *
 * <p>Organizations are resolved strictly by tenant id. An implementation must
 * never look an organization up in the provider's directory by tax id: two
 * tenants can claim the same RFC, and the first one to do so would otherwise
 * be able to sign with the other's certificate.
 */
public interface ProviderAdapter {

    ProviderType providerType();

    /**
     * Organization of a tenant, created at the provider on first use
     *
     * @param tenant tenant profile
     * @return organization reference
     * @throws com.kita.invoicing.exception.ProviderException if the provider call fails
     */
    OrgRef getOrCreateOrganization(TenantProfile tenant);

    /**
     * Send legal metadata and then the signing certificate to the provider
     *
     * @param organization tenant's organization
     * @param tenant tenant profile
     * @param material decrypted certificate, key and passphrase
     * @return provisioning outcome
     */
    ProvisionResult provisionSigningCredential(OrgRef organization, TenantProfile tenant, DecryptedBundle material);

    /**
     * Credential allowed to issue documents for an organization
     *
     * @param organization tenant's organization
     * @return live credential
     */
    LiveCredential getOrCreateLiveCredential(OrgRef organization);

    /**
     * Stamp a document
     *
     * @param organization issuing organization
     * @param credential live credential of the organization
     * @param document document to stamp
     * @return stamped document with artifacts
     */
    IssuedDocument issueDocument(OrgRef organization, LiveCredential credential, TaxDocument document);

    /**
     * Cancel a stamped document
     *
     * @param organization issuing organization
     * @param credential live credential of the organization
     * @param fiscalId fiscal id of the document
     * @param reasonCode SAT cancellation reason
     * @param knownDocumentId provider document id when stored locally, may be null
     * @return cancellation receipt
     */
    CancellationReceipt cancelDocument(OrgRef organization, LiveCredential credential, FiscalId fiscalId,
                                       String reasonCode, String knownDocumentId);

    /**
     * Health check against the provider
     *
     * @return true if the provider answered with the configured credentials
     */
    boolean testConnection();
}
