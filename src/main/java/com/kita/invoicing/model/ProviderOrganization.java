package com.kita.invoicing.model;

import com.kita.invoicing.config.ProviderType;

import java.time.Instant;
import java.util.Objects;

/**
 * Mapping of a tenant to its organization at one provider
 *
 * <p>The only source of truth for which provider organization belongs to a
 * tenant.
 */
public final class ProviderOrganization {

    private final String tenantId;
    private final ProviderType provider;
    private final String organizationId;
    private final String liveCredential;
    private final Instant createdAt;
    private final Instant credentialIssuedAt;

    public ProviderOrganization(String tenantId, ProviderType provider, String organizationId,
                                String liveCredential, Instant createdAt, Instant credentialIssuedAt) {
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.provider = Objects.requireNonNull(provider, "provider");
        this.organizationId = Objects.requireNonNull(organizationId, "organizationId");
        this.liveCredential = liveCredential;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.credentialIssuedAt = credentialIssuedAt;
    }

    public static ProviderOrganization of(String tenantId, ProviderType provider, String organizationId) {
        return new ProviderOrganization(tenantId, provider, organizationId, null, Instant.now(), null);
    }

    public String getTenantId() {
        return tenantId;
    }

    public ProviderType getProvider() {
        return provider;
    }

    public String getOrganizationId() {
        return organizationId;
    }

    public String getLiveCredential() {
        return liveCredential;
    }

    public boolean hasLiveCredential() {
        return liveCredential != null && !liveCredential.isEmpty();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getCredentialIssuedAt() {
        return credentialIssuedAt;
    }

    public ProviderOrganization withLiveCredential(String credential, Instant issuedAt) {
        return new ProviderOrganization(tenantId, provider, organizationId, credential, createdAt, issuedAt);
    }

    @Override
    public String toString() {
        return "ProviderOrganization{tenantId='" + tenantId + "', provider=" + provider +
               ", organizationId='" + organizationId + "'}";
    }
}
