package com.kita.invoicing.config;

import java.util.List;
import java.util.Objects;

/**
 * Invoicing configuration class
 * Defines all configuration options for certificate custody and PAC access
 * Use the Builder pattern to construct instances
 */
public class InvoicingConfig {

    // Provider selection
    private final ProviderType provider;

    // Master secrets for envelope encryption
    private final String masterKeyId;
    private final String masterKey;
    private final String nextMasterKeyId;
    private final String nextMasterKey;
    private final String retiredMasterKeyId;
    private final String retiredMasterKey;

    // Facturapi credentials
    private final String facturapiUrl;
    private final String facturapiUserKey;

    // FiscalAPI credentials
    private final String fiscalapiUrl;
    private final String fiscalapiApiKey;
    private final String fiscalapiTenantKey;

    // Transport
    private final int timeout;
    private final int retryAttempts;
    private final int retryDelay;

    // Validation
    private final double nameMatchThreshold;
    private final List<String> trustedIssuers;

    // Caching
    private final int organizationCacheTtl;
    private final int credentialCacheTtl;

    private final boolean enableAuditLog;

    private InvoicingConfig(Builder builder) {
        this.provider = builder.provider;
        this.masterKeyId = builder.masterKeyId;
        this.masterKey = builder.masterKey;
        this.nextMasterKeyId = builder.nextMasterKeyId;
        this.nextMasterKey = builder.nextMasterKey;
        this.retiredMasterKeyId = builder.retiredMasterKeyId;
        this.retiredMasterKey = builder.retiredMasterKey;
        this.facturapiUrl = resolveUrl(builder.facturapiUrl, ProviderType.FACTURAPI);
        this.facturapiUserKey = builder.facturapiUserKey;
        this.fiscalapiUrl = resolveUrl(builder.fiscalapiUrl, ProviderType.FISCALAPI);
        this.fiscalapiApiKey = builder.fiscalapiApiKey;
        this.fiscalapiTenantKey = builder.fiscalapiTenantKey;
        this.timeout = builder.timeout;
        this.retryAttempts = builder.retryAttempts;
        this.retryDelay = builder.retryDelay;
        this.nameMatchThreshold = builder.nameMatchThreshold;
        this.trustedIssuers = builder.trustedIssuers != null
            ? List.copyOf(builder.trustedIssuers)
            : InvoicingConfigConstants.DEFAULT_TRUSTED_ISSUERS;
        this.organizationCacheTtl = builder.organizationCacheTtl;
        this.credentialCacheTtl = builder.credentialCacheTtl;
        this.enableAuditLog = builder.enableAuditLog;
    }

    private String resolveUrl(String customUrl, ProviderType type) {
        if (customUrl != null && !customUrl.isEmpty()) {
            return customUrl.endsWith("/") ? customUrl.substring(0, customUrl.length() - 1) : customUrl;
        }
        return InvoicingConfigConstants.getBaseUrl(type);
    }

    // Getters

    public ProviderType getProvider() {
        return provider;
    }

    public String getMasterKeyId() {
        return masterKeyId;
    }

    public String getMasterKey() {
        return masterKey;
    }

    public String getNextMasterKeyId() {
        return nextMasterKeyId;
    }

    public String getNextMasterKey() {
        return nextMasterKey;
    }

    /**
     * Key id of a secret kept only to unwrap records written before a rotation
     */
    public String getRetiredMasterKeyId() {
        return retiredMasterKeyId;
    }

    public String getRetiredMasterKey() {
        return retiredMasterKey;
    }

    public String getFacturapiUrl() {
        return facturapiUrl;
    }

    public String getFacturapiUserKey() {
        return facturapiUserKey;
    }

    public String getFiscalapiUrl() {
        return fiscalapiUrl;
    }

    public String getFiscalapiApiKey() {
        return fiscalapiApiKey;
    }

    public String getFiscalapiTenantKey() {
        return fiscalapiTenantKey;
    }

    public int getTimeout() {
        return timeout;
    }

    public int getRetryAttempts() {
        return retryAttempts;
    }

    public int getRetryDelay() {
        return retryDelay;
    }

    public double getNameMatchThreshold() {
        return nameMatchThreshold;
    }

    public List<String> getTrustedIssuers() {
        return trustedIssuers;
    }

    public int getOrganizationCacheTtl() {
        return organizationCacheTtl;
    }

    public int getCredentialCacheTtl() {
        return credentialCacheTtl;
    }

    public boolean isEnableAuditLog() {
        return enableAuditLog;
    }

    /**
     * Create a new Builder instance
     *
     * @return a new Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a Builder initialized with this config's values
     *
     * @return a new Builder with current values
     */
    public Builder toBuilder() {
        return new Builder()
            .provider(this.provider)
            .masterKeyId(this.masterKeyId)
            .masterKey(this.masterKey)
            .nextMasterKeyId(this.nextMasterKeyId)
            .nextMasterKey(this.nextMasterKey)
            .retiredMasterKeyId(this.retiredMasterKeyId)
            .retiredMasterKey(this.retiredMasterKey)
            .facturapiUrl(this.facturapiUrl)
            .facturapiUserKey(this.facturapiUserKey)
            .fiscalapiUrl(this.fiscalapiUrl)
            .fiscalapiApiKey(this.fiscalapiApiKey)
            .fiscalapiTenantKey(this.fiscalapiTenantKey)
            .timeout(this.timeout)
            .retryAttempts(this.retryAttempts)
            .retryDelay(this.retryDelay)
            .nameMatchThreshold(this.nameMatchThreshold)
            .trustedIssuers(this.trustedIssuers)
            .organizationCacheTtl(this.organizationCacheTtl)
            .credentialCacheTtl(this.credentialCacheTtl)
            .enableAuditLog(this.enableAuditLog);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InvoicingConfig that = (InvoicingConfig) o;
        return timeout == that.timeout &&
               retryAttempts == that.retryAttempts &&
               retryDelay == that.retryDelay &&
               Double.compare(nameMatchThreshold, that.nameMatchThreshold) == 0 &&
               organizationCacheTtl == that.organizationCacheTtl &&
               credentialCacheTtl == that.credentialCacheTtl &&
               enableAuditLog == that.enableAuditLog &&
               provider == that.provider &&
               Objects.equals(masterKeyId, that.masterKeyId) &&
               Objects.equals(masterKey, that.masterKey) &&
               Objects.equals(nextMasterKeyId, that.nextMasterKeyId) &&
               Objects.equals(nextMasterKey, that.nextMasterKey) &&
               Objects.equals(retiredMasterKeyId, that.retiredMasterKeyId) &&
               Objects.equals(retiredMasterKey, that.retiredMasterKey) &&
               Objects.equals(facturapiUrl, that.facturapiUrl) &&
               Objects.equals(facturapiUserKey, that.facturapiUserKey) &&
               Objects.equals(fiscalapiUrl, that.fiscalapiUrl) &&
               Objects.equals(fiscalapiApiKey, that.fiscalapiApiKey) &&
               Objects.equals(fiscalapiTenantKey, that.fiscalapiTenantKey) &&
               Objects.equals(trustedIssuers, that.trustedIssuers);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, masterKeyId, masterKey, nextMasterKeyId, nextMasterKey,
            retiredMasterKeyId, retiredMasterKey,
            facturapiUrl, facturapiUserKey, fiscalapiUrl, fiscalapiApiKey, fiscalapiTenantKey,
            timeout, retryAttempts, retryDelay, nameMatchThreshold, trustedIssuers,
            organizationCacheTtl, credentialCacheTtl, enableAuditLog);
    }

    @Override
    public String toString() {
        // secrets omitted
        return "InvoicingConfig{" +
               "provider=" + provider +
               ", masterKeyId='" + masterKeyId + '\'' +
               ", nextMasterKeyId='" + nextMasterKeyId + '\'' +
               ", retiredMasterKeyId='" + retiredMasterKeyId + '\'' +
               ", facturapiUrl='" + facturapiUrl + '\'' +
               ", fiscalapiUrl='" + fiscalapiUrl + '\'' +
               ", timeout=" + timeout +
               ", retryAttempts=" + retryAttempts +
               ", nameMatchThreshold=" + nameMatchThreshold +
               ", enableAuditLog=" + enableAuditLog +
               '}';
    }

    /**
     * Builder for InvoicingConfig
     */
    public static class Builder {
        private ProviderType provider = InvoicingConfigConstants.DEFAULT_PROVIDER;
        private String masterKeyId;
        private String masterKey;
        private String nextMasterKeyId;
        private String nextMasterKey;
        private String retiredMasterKeyId;
        private String retiredMasterKey;
        private String facturapiUrl;
        private String facturapiUserKey;
        private String fiscalapiUrl;
        private String fiscalapiApiKey;
        private String fiscalapiTenantKey;
        private int timeout = InvoicingConfigConstants.DEFAULT_TIMEOUT;
        private int retryAttempts = InvoicingConfigConstants.DEFAULT_RETRY_ATTEMPTS;
        private int retryDelay = InvoicingConfigConstants.DEFAULT_RETRY_DELAY;
        private double nameMatchThreshold = InvoicingConfigConstants.DEFAULT_NAME_MATCH_THRESHOLD;
        private List<String> trustedIssuers;
        private int organizationCacheTtl = InvoicingConfigConstants.DEFAULT_ORGANIZATION_CACHE_TTL;
        private int credentialCacheTtl = InvoicingConfigConstants.DEFAULT_CREDENTIAL_CACHE_TTL;
        private boolean enableAuditLog = InvoicingConfigConstants.DEFAULT_ENABLE_AUDIT_LOG;

        public Builder provider(ProviderType provider) {
            this.provider = provider;
            return this;
        }

        public Builder masterKeyId(String masterKeyId) {
            this.masterKeyId = masterKeyId;
            return this;
        }

        public Builder masterKey(String masterKey) {
            this.masterKey = masterKey;
            return this;
        }

        public Builder nextMasterKeyId(String nextMasterKeyId) {
            this.nextMasterKeyId = nextMasterKeyId;
            return this;
        }

        public Builder nextMasterKey(String nextMasterKey) {
            this.nextMasterKey = nextMasterKey;
            return this;
        }

        public Builder retiredMasterKeyId(String retiredMasterKeyId) {
            this.retiredMasterKeyId = retiredMasterKeyId;
            return this;
        }

        public Builder retiredMasterKey(String retiredMasterKey) {
            this.retiredMasterKey = retiredMasterKey;
            return this;
        }

        public Builder facturapiUrl(String facturapiUrl) {
            this.facturapiUrl = facturapiUrl;
            return this;
        }

        public Builder facturapiUserKey(String facturapiUserKey) {
            this.facturapiUserKey = facturapiUserKey;
            return this;
        }

        public Builder fiscalapiUrl(String fiscalapiUrl) {
            this.fiscalapiUrl = fiscalapiUrl;
            return this;
        }

        public Builder fiscalapiApiKey(String fiscalapiApiKey) {
            this.fiscalapiApiKey = fiscalapiApiKey;
            return this;
        }

        public Builder fiscalapiTenantKey(String fiscalapiTenantKey) {
            this.fiscalapiTenantKey = fiscalapiTenantKey;
            return this;
        }

        public Builder timeout(int timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder retryAttempts(int retryAttempts) {
            this.retryAttempts = retryAttempts;
            return this;
        }

        public Builder retryDelay(int retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        public Builder nameMatchThreshold(double nameMatchThreshold) {
            this.nameMatchThreshold = nameMatchThreshold;
            return this;
        }

        public Builder trustedIssuers(List<String> trustedIssuers) {
            this.trustedIssuers = trustedIssuers;
            return this;
        }

        public Builder organizationCacheTtl(int organizationCacheTtl) {
            this.organizationCacheTtl = organizationCacheTtl;
            return this;
        }

        public Builder credentialCacheTtl(int credentialCacheTtl) {
            this.credentialCacheTtl = credentialCacheTtl;
            return this;
        }

        public Builder enableAuditLog(boolean enableAuditLog) {
            this.enableAuditLog = enableAuditLog;
            return this;
        }

        /**
         * Build and validate the InvoicingConfig
         *
         * @return the validated InvoicingConfig
         * @throws ConfigValidationException if validation fails
         */
        public InvoicingConfig build() {
            InvoicingConfig config = new InvoicingConfig(this);
            ConfigValidator validator = new ConfigValidator();
            validator.validateOrThrow(config);
            return config;
        }

        /**
         * Build without validation
         *
         * @return the InvoicingConfig (unvalidated)
         */
        public InvoicingConfig buildUnchecked() {
            return new InvoicingConfig(this);
        }
    }
}
