package com.kita.invoicing.provider;

import com.kita.invoicing.config.ProviderType;

import java.util.Objects;

/**
 * Reference to a tenant's organization (or issuer person) at a provider
 */
public final class OrgRef {

    private final ProviderType provider;
    private final String tenantId;
    private final String organizationId;

    public OrgRef(ProviderType provider, String tenantId, String organizationId) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.tenantId = Objects.requireNonNull(tenantId, "tenantId");
        this.organizationId = Objects.requireNonNull(organizationId, "organizationId");
    }

    public ProviderType getProvider() { return provider; }
    public String getTenantId() { return tenantId; }
    public String getOrganizationId() { return organizationId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrgRef other = (OrgRef) o;
        return provider == other.provider
            && tenantId.equals(other.tenantId)
            && organizationId.equals(other.organizationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, tenantId, organizationId);
    }

    @Override
    public String toString() {
        return provider.getValue() + ":" + organizationId + " (tenant " + tenantId + ")";
    }
}
