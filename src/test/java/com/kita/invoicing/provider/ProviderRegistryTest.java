package com.kita.invoicing.provider;

import com.kita.invoicing.config.ProviderType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ProviderRegistry
 */
@ExtendWith(MockitoExtension.class)
class ProviderRegistryTest {

    @Mock
    private ProviderAdapter facturapi;

    @Mock
    private ProviderAdapter fiscalapi;

    @BeforeEach
    void setUp() {
        when(facturapi.providerType()).thenReturn(ProviderType.FACTURAPI);
    }

    @Test
    @DisplayName("should return the configured default adapter")
    void shouldReturnDefault() {
        when(fiscalapi.providerType()).thenReturn(ProviderType.FISCALAPI);
        ProviderRegistry registry = new ProviderRegistry(ProviderType.FISCALAPI, Arrays.asList(facturapi, fiscalapi));

        assertSame(fiscalapi, registry.getDefault());
        assertSame(facturapi, registry.get(ProviderType.FACTURAPI));
        assertEquals(2, registry.availableProviders().size());
    }

    @Test
    @DisplayName("should fail fast on duplicate registration")
    void shouldRejectDuplicate() {
        when(fiscalapi.providerType()).thenReturn(ProviderType.FACTURAPI);
        ProviderRegistry registry = new ProviderRegistry(ProviderType.FACTURAPI).register(facturapi);

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> registry.register(fiscalapi));

        assertTrue(error.getMessage().contains("Duplicate provider adapter"));
        assertSame(facturapi, registry.getDefault());
    }

    @Test
    @DisplayName("should fail when the requested provider is not registered")
    void shouldFailForMissingProvider() {
        ProviderRegistry registry = new ProviderRegistry(ProviderType.FISCALAPI).register(facturapi);

        assertThrows(IllegalStateException.class, registry::getDefault);
        assertEquals(ProviderType.FISCALAPI, registry.getDefaultProvider());
    }
}
