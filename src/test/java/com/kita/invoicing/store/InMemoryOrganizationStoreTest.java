package com.kita.invoicing.store;

import com.kita.invoicing.config.ProviderType;
import com.kita.invoicing.exception.SecurityInvariantException;
import com.kita.invoicing.model.ProviderOrganization;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InMemoryOrganizationStore
 */
class InMemoryOrganizationStoreTest {

    private InMemoryOrganizationStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryOrganizationStore();
    }

    @Test
    @DisplayName("should map a tenant to its organization per provider")
    void shouldSaveAndFind() {
        store.save(ProviderOrganization.of("tenant-a", ProviderType.FACTURAPI, "org_1"));

        assertEquals("org_1", store.find("tenant-a", ProviderType.FACTURAPI).orElseThrow().getOrganizationId());
        assertTrue(store.find("tenant-a", ProviderType.FISCALAPI).isEmpty());
        assertEquals("tenant-a", store.findTenantByOrganization(ProviderType.FACTURAPI, "org_1").orElseThrow());
    }

    @Test
    @DisplayName("should refuse to bind an organization already owned by another tenant")
    void shouldRefuseHijack() {
        store.save(ProviderOrganization.of("tenant-a", ProviderType.FACTURAPI, "org_1"));

        assertThrows(SecurityInvariantException.class,
            () -> store.save(ProviderOrganization.of("tenant-b", ProviderType.FACTURAPI, "org_1")));
        assertTrue(store.find("tenant-b", ProviderType.FACTURAPI).isEmpty());
    }

    @Test
    @DisplayName("should allow the same organization id under another provider")
    void shouldScopeByProvider() {
        store.save(ProviderOrganization.of("tenant-a", ProviderType.FACTURAPI, "org_1"));

        assertDoesNotThrow(() -> store.save(ProviderOrganization.of("tenant-b", ProviderType.FISCALAPI, "org_1")));
    }

    @Test
    @DisplayName("should free the previous organization when a tenant is remapped")
    void shouldFreePreviousOrganization() {
        store.save(ProviderOrganization.of("tenant-a", ProviderType.FACTURAPI, "org_1"));
        store.save(ProviderOrganization.of("tenant-a", ProviderType.FACTURAPI, "org_2"));

        assertTrue(store.findTenantByOrganization(ProviderType.FACTURAPI, "org_1").isEmpty());
        assertDoesNotThrow(() -> store.save(ProviderOrganization.of("tenant-b", ProviderType.FACTURAPI, "org_1")));
    }

    @Test
    @DisplayName("should keep the mapping when only the live credential changes")
    void shouldUpdateCredential() {
        ProviderOrganization organization = store.save(
            ProviderOrganization.of("tenant-a", ProviderType.FACTURAPI, "org_1"));

        store.save(organization.withLiveCredential("sk_live_1", Instant.parse("2026-03-15T18:00:00Z")));

        ProviderOrganization stored = store.find("tenant-a", ProviderType.FACTURAPI).orElseThrow();
        assertEquals("sk_live_1", stored.getLiveCredential());
        assertEquals("tenant-a", store.findTenantByOrganization(ProviderType.FACTURAPI, "org_1").orElseThrow());
    }
}
