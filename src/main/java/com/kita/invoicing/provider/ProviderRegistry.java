package com.kita.invoicing.provider;

import com.kita.invoicing.config.InvoicingConfig;
import com.kita.invoicing.config.ProviderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Provider adapters keyed by {@link ProviderType}
 *
 * <p>The configured provider is the default. Registering two adapters for
 * the same provider fails fast.
 */
public class ProviderRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<ProviderType, ProviderAdapter> adapters = new EnumMap<>(ProviderType.class);
    private final ProviderType defaultProvider;

    public ProviderRegistry(InvoicingConfig config) {
        this(config.getProvider());
    }

    public ProviderRegistry(ProviderType defaultProvider) {
        this.defaultProvider = defaultProvider;
    }

    public ProviderRegistry(ProviderType defaultProvider, List<ProviderAdapter> adapters) {
        this(defaultProvider);
        for (ProviderAdapter adapter : adapters) {
            register(adapter);
        }
    }

    /**
     * Register an adapter
     *
     * @throws IllegalStateException if an adapter is already registered for the provider
     */
    public synchronized ProviderRegistry register(ProviderAdapter adapter) {
        ProviderAdapter existing = adapters.putIfAbsent(adapter.providerType(), adapter);
        if (existing != null) {
            throw new IllegalStateException("Duplicate provider adapter for " + adapter.providerType()
                + ": registered by both " + existing.getClass().getName()
                + " and " + adapter.getClass().getName());
        }
        logger.debug("Registered {} adapter {}", adapter.providerType(), adapter.getClass().getSimpleName());
        return this;
    }

    /**
     * Adapter of the configured provider
     *
     * @throws IllegalStateException if none is registered
     */
    public synchronized ProviderAdapter getDefault() {
        return get(defaultProvider);
    }

    public synchronized ProviderAdapter get(ProviderType provider) {
        ProviderAdapter adapter = adapters.get(provider);
        if (adapter == null) {
            throw new IllegalStateException("No adapter registered for provider " + provider);
        }
        return adapter;
    }

    public synchronized List<ProviderType> availableProviders() {
        return List.copyOf(adapters.keySet());
    }

    public ProviderType getDefaultProvider() {
        return defaultProvider;
    }
}
