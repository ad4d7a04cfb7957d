package com.kita.invoicing.store;

import com.kita.invoicing.config.ProviderType;
import com.kita.invoicing.model.ProviderOrganization;

import java.util.Optional;

/**
 * Tenant to provider organization mappings
 *
 * <p>Lookups are by tenant id only. There is no lookup by tax id.
 */
public interface OrganizationStore {

    Optional<ProviderOrganization> find(String tenantId, ProviderType provider);

    /**
     * Insert or replace the mapping of a tenant
     *
     * @throws com.kita.invoicing.exception.SecurityInvariantException if the organization
     *         is already mapped to another tenant
     */
    ProviderOrganization save(ProviderOrganization organization);

    /**
     * Tenant owning an organization at a provider
     */
    Optional<String> findTenantByOrganization(ProviderType provider, String organizationId);
}
