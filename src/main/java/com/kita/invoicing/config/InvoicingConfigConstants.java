package com.kita.invoicing.config;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Invoicing configuration constants and defaults
 */
public final class InvoicingConfigConstants {
    
    private InvoicingConfigConstants() {
        // Utility class
    }
    
    // Provider base URLs
    public static final String FACTURAPI_URL = "https://www.facturapi.io/v2";
    public static final String FISCALAPI_URL = "https://live.fiscalapi.com";
    
    // Default values
    public static final ProviderType DEFAULT_PROVIDER = ProviderType.FACTURAPI;
    public static final int DEFAULT_TIMEOUT = 30000;
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final int DEFAULT_RETRY_DELAY = 1000;
    public static final double DEFAULT_NAME_MATCH_THRESHOLD = 0.85;
    public static final int DEFAULT_ORGANIZATION_CACHE_TTL = 3600;
    public static final int DEFAULT_CREDENTIAL_CACHE_TTL = 3600;
    public static final boolean DEFAULT_ENABLE_AUDIT_LOG = true;
    
    /** SAT issuer name fragments accepted as trusted */
    public static final List<String> DEFAULT_TRUSTED_ISSUERS = List.of(
        "AC AUTORIDAD CERTIFICADORA DEL SERVICIO DE ADMINISTRACION TRIBUTARIA",
        "AUTORIDAD CERTIFICADORA DEL SERVICIO DE ADMINISTRACION TRIBUTARIA",
        "AC SAT",
        "SAT970701NN3",
        "SERVICIO DE ADMINISTRACION TRIBUTARIA"
    );
    
    // Validation limits
    public static final int MIN_TIMEOUT = 1000;
    public static final int MAX_TIMEOUT = 300000;
    public static final int MIN_RETRY_ATTEMPTS = 0;
    public static final int MAX_RETRY_ATTEMPTS = 10;
    public static final int MAX_RETRY_DELAY = 60000;
    public static final int MIN_MASTER_KEY_LENGTH = 16;
    
    // Environment variable names
    public static final String ENV_PROVIDER = "KITA_PAC_PROVIDER";
    public static final String ENV_MASTER_KEY_ID = "KITA_MASTER_KEY_ID";
    public static final String ENV_MASTER_KEY = "KITA_MASTER_KEY";
    public static final String ENV_NEXT_MASTER_KEY_ID = "KITA_NEXT_MASTER_KEY_ID";
    public static final String ENV_NEXT_MASTER_KEY = "KITA_NEXT_MASTER_KEY";
    public static final String ENV_RETIRED_MASTER_KEY_ID = "KITA_RETIRED_MASTER_KEY_ID";
    public static final String ENV_RETIRED_MASTER_KEY = "KITA_RETIRED_MASTER_KEY";
    public static final String ENV_FACTURAPI_URL = "KITA_FACTURAPI_URL";
    public static final String ENV_FACTURAPI_USER_KEY = "KITA_FACTURAPI_USER_KEY";
    public static final String ENV_FISCALAPI_URL = "KITA_FISCALAPI_URL";
    public static final String ENV_FISCALAPI_API_KEY = "KITA_FISCALAPI_API_KEY";
    public static final String ENV_FISCALAPI_TENANT_KEY = "KITA_FISCALAPI_TENANT_KEY";
    public static final String ENV_TIMEOUT = "KITA_PAC_TIMEOUT";
    public static final String ENV_RETRY_ATTEMPTS = "KITA_PAC_RETRY_ATTEMPTS";
    public static final String ENV_RETRY_DELAY = "KITA_PAC_RETRY_DELAY";
    public static final String ENV_NAME_MATCH_THRESHOLD = "KITA_NAME_MATCH_THRESHOLD";
    public static final String ENV_ENABLE_AUDIT_LOG = "KITA_ENABLE_AUDIT_LOG";
    
    /**
     * Environment variable to config field mapping
     */
    public static final Map<String, String> ENV_VAR_MAPPING;
    
    static {
        Map<String, String> map = new HashMap<>();
        map.put(ENV_PROVIDER, "provider");
        map.put(ENV_MASTER_KEY_ID, "masterKeyId");
        map.put(ENV_MASTER_KEY, "masterKey");
        map.put(ENV_NEXT_MASTER_KEY_ID, "nextMasterKeyId");
        map.put(ENV_NEXT_MASTER_KEY, "nextMasterKey");
        map.put(ENV_RETIRED_MASTER_KEY_ID, "retiredMasterKeyId");
        map.put(ENV_RETIRED_MASTER_KEY, "retiredMasterKey");
        map.put(ENV_FACTURAPI_URL, "facturapiUrl");
        map.put(ENV_FACTURAPI_USER_KEY, "facturapiUserKey");
        map.put(ENV_FISCALAPI_URL, "fiscalapiUrl");
        map.put(ENV_FISCALAPI_API_KEY, "fiscalapiApiKey");
        map.put(ENV_FISCALAPI_TENANT_KEY, "fiscalapiTenantKey");
        map.put(ENV_TIMEOUT, "timeout");
        map.put(ENV_RETRY_ATTEMPTS, "retryAttempts");
        map.put(ENV_RETRY_DELAY, "retryDelay");
        map.put(ENV_NAME_MATCH_THRESHOLD, "nameMatchThreshold");
        map.put(ENV_ENABLE_AUDIT_LOG, "enableAuditLog");
        ENV_VAR_MAPPING = Collections.unmodifiableMap(map);
    }
    
    /**
     * Provider base URLs
     */
    public static final Map<ProviderType, String> PROVIDER_BASE_URLS;
    
    static {
        Map<ProviderType, String> map = new HashMap<>();
        map.put(ProviderType.FACTURAPI, FACTURAPI_URL);
        map.put(ProviderType.FISCALAPI, FISCALAPI_URL);
        PROVIDER_BASE_URLS = Collections.unmodifiableMap(map);
    }
    
    /**
     * Get the default base URL for a provider
     * 
     * @param provider the provider
     * @return the base URL
     */
    public static String getBaseUrl(ProviderType provider) {
        return PROVIDER_BASE_URLS.getOrDefault(provider, FACTURAPI_URL);
    }
}
