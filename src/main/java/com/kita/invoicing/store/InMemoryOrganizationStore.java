package com.kita.invoicing.store;

import com.kita.invoicing.config.ProviderType;
import com.kita.invoicing.exception.SecurityInvariantException;
import com.kita.invoicing.model.ProviderOrganization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Thread-safe in-memory organization store
 */
public class InMemoryOrganizationStore implements OrganizationStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryOrganizationStore.class);

    private final Map<String, ProviderOrganization> byTenant = new HashMap<>();
    private final Map<String, String> tenantByOrganization = new HashMap<>();

    @Override
    public synchronized Optional<ProviderOrganization> find(String tenantId, ProviderType provider) {
        return Optional.ofNullable(byTenant.get(key(provider, tenantId)));
    }

    @Override
    public synchronized ProviderOrganization save(ProviderOrganization organization) {
        String orgKey = key(organization.getProvider(), organization.getOrganizationId());
        String owner = tenantByOrganization.get(orgKey);
        if (owner != null && !owner.equals(organization.getTenantId())) {
            logger.error("Refusing to map {} organization {} to tenant {}: owned by tenant {}",
                organization.getProvider(), organization.getOrganizationId(), organization.getTenantId(), owner);
            throw new SecurityInvariantException("Provider organization is already bound to another tenant");
        }
        ProviderOrganization previous = byTenant.put(key(organization.getProvider(), organization.getTenantId()),
            organization);
        if (previous != null && !previous.getOrganizationId().equals(organization.getOrganizationId())) {
            tenantByOrganization.remove(key(previous.getProvider(), previous.getOrganizationId()));
        }
        tenantByOrganization.put(orgKey, organization.getTenantId());
        return organization;
    }

    @Override
    public synchronized Optional<String> findTenantByOrganization(ProviderType provider, String organizationId) {
        return Optional.ofNullable(tenantByOrganization.get(key(provider, organizationId)));
    }

    private static String key(ProviderType provider, String id) {
        return provider.name() + ":" + id;
    }
}
