package com.kita.invoicing.orchestration;

import com.kita.invoicing.model.TenantProfile;

import java.util.Optional;

/**
 * Registered tenants
 */
public interface TenantDirectory {

    Optional<TenantProfile> find(String tenantId);
}
