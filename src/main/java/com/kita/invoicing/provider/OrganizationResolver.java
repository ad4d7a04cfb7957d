package com.kita.invoicing.provider;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.kita.invoicing.config.ProviderType;
import com.kita.invoicing.exception.InvoicingException;
import com.kita.invoicing.exception.SecurityInvariantException;
import com.kita.invoicing.model.ProviderOrganization;
import com.kita.invoicing.model.TenantProfile;
import com.kita.invoicing.store.OrganizationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Resolves a tenant's organization and live credential at one provider
 *
 * <p>Order: TTL cache, then {@link OrganizationStore} keyed by tenant id,
 * then creation at the provider. The cache is populated only from the store
 * or from a creation this resolver performed.
 */
public class OrganizationResolver {

    private static final Logger logger = LoggerFactory.getLogger(OrganizationResolver.class);

    private final ProviderType provider;
    private final OrganizationStore store;
    private final Clock clock;
    private final Cache<String, OrgRef> organizations;
    private final Cache<String, LiveCredential> credentials;

    public OrganizationResolver(ProviderType provider, OrganizationStore store,
                                int organizationTtlSeconds, int credentialTtlSeconds) {
        this(provider, store, organizationTtlSeconds, credentialTtlSeconds, Clock.systemUTC());
    }

    public OrganizationResolver(ProviderType provider, OrganizationStore store,
                                int organizationTtlSeconds, int credentialTtlSeconds, Clock clock) {
        this.provider = provider;
        this.store = store;
        this.clock = clock;
        this.organizations = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofSeconds(organizationTtlSeconds))
            .maximumSize(1000)
            .build();
        this.credentials = Caffeine.newBuilder()
            .expireAfterWrite(Duration.ofSeconds(credentialTtlSeconds))
            .maximumSize(1000)
            .build();
    }

    /**
     * Organization of a tenant
     *
     * @param tenant tenant profile
     * @param creator creates the organization at the provider and returns its id
     * @return organization reference
     */
    public OrgRef resolve(TenantProfile tenant, Function<TenantProfile, String> creator) {
        String tenantId = tenant.getTenantId();
        return organizations.get(tenantId, key -> {
            Optional<ProviderOrganization> stored = store.find(key, provider);
            if (stored.isPresent()) {
                logger.debug("{} organization for tenant {} loaded from store", provider.getValue(), key);
                return toRef(stored.get());
            }
            String organizationId = creator.apply(tenant);
            if (organizationId == null || organizationId.isBlank()) {
                throw new InvoicingException("Provider returned no organization id", "ORGANIZATION_CREATE_FAILED");
            }
            ProviderOrganization saved = store.save(
                new ProviderOrganization(key, provider, organizationId, null, clock.instant(), null));
            logger.info("Created {} organization {} for tenant {}", provider.getValue(), organizationId, key);
            return toRef(saved);
        });
    }

    /**
     * Live credential of an organization
     *
     * <p>Order: credential persisted with the mapping, then TTL cache, then
     * {@code issuer}. An issued credential is persisted and cached.
     *
     * @param organization organization reference
     * @param issuer obtains a credential from the provider
     * @return live credential
     */
    public LiveCredential resolveCredential(OrgRef organization, Supplier<String> issuer) {
        ProviderOrganization mapping = ownedMapping(organization);
        if (mapping.hasLiveCredential()) {
            return new LiveCredential(mapping.getLiveCredential(), mapping.getCredentialIssuedAt());
        }
        return credentials.get(organization.getOrganizationId(), key -> {
            String value = issuer.get();
            LiveCredential credential = new LiveCredential(value, clock.instant());
            store.save(ownedMapping(organization).withLiveCredential(value, credential.getIssuedAt()));
            logger.info("Live credential stored for {} organization {}", provider.getValue(), key);
            return credential;
        });
    }

    /**
     * Drop cached entries of a tenant
     */
    public void evict(String tenantId) {
        OrgRef ref = organizations.getIfPresent(tenantId);
        organizations.invalidate(tenantId);
        if (ref != null) {
            credentials.invalidate(ref.getOrganizationId());
        }
    }

    public ProviderType getProvider() {
        return provider;
    }

    private ProviderOrganization ownedMapping(OrgRef organization) {
        ProviderOrganization mapping = store.find(organization.getTenantId(), provider)
            .orElseThrow(() -> new SecurityInvariantException(
                "No organization mapping for tenant " + organization.getTenantId()));
        if (!mapping.getOrganizationId().equals(organization.getOrganizationId())) {
            logger.error("Organization {} is not mapped to tenant {}",
                organization.getOrganizationId(), organization.getTenantId());
            throw new SecurityInvariantException("Organization is not bound to the requesting tenant");
        }
        return mapping;
    }

    private OrgRef toRef(ProviderOrganization organization) {
        return new OrgRef(organization.getProvider(), organization.getTenantId(), organization.getOrganizationId());
    }
}
