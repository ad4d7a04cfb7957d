package com.kita.invoicing.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.kita.invoicing.exception.InvoicingException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Invoicing configuration loader
 * Loads configuration from a JSON file, environment variables and
 * programmatic overrides, and merges them in that order of priority
 */
public class ConfigLoader {

    private final ObjectMapper objectMapper;
    private final Function<String, String> environment;

    public ConfigLoader() {
        this(System::getenv);
    }

    /**
     * Create a loader reading variables through the given lookup
     *
     * @param environment environment variable lookup
     */
    public ConfigLoader(Function<String, String> environment) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.environment = environment;
    }

    /**
     * Load configuration from a JSON file
     *
     * @param path path to JSON configuration file
     * @return configuration map
     * @throws InvoicingException if file not found or invalid JSON
     */
    public Map<String, Object> fromFile(String path) throws InvoicingException {
        Path filePath = Paths.get(path).toAbsolutePath();

        if (!Files.exists(filePath)) {
            throw new InvoicingException("Configuration file not found: " + filePath, "CONFIG_FILE_NOT_FOUND");
        }

        try {
            return objectMapper.readValue(filePath.toFile(), new TypeReference<Map<String, Object>>() {});
        } catch (IOException e) {
            throw new InvoicingException("Invalid JSON in configuration file: " + filePath, "CONFIG_PARSE_ERROR", e);
        }
    }

    /**
     * Load configuration from environment variables
     *
     * @return configuration map
     */
    public Map<String, Object> fromEnvironment() {
        Map<String, Object> config = new HashMap<>();

        for (Map.Entry<String, String> entry : InvoicingConfigConstants.ENV_VAR_MAPPING.entrySet()) {
            String value = environment.apply(entry.getKey());

            if (value != null && !value.isEmpty()) {
                config.put(entry.getValue(), parseEnvValue(entry.getValue(), value));
            }
        }

        return config;
    }

    /**
     * Merge multiple configuration sources
     * Priority: later sources override earlier sources
     *
     * @param sources configuration maps in order of increasing priority
     * @return merged configuration
     */
    @SafeVarargs
    public final Map<String, Object> merge(Map<String, Object>... sources) {
        Map<String, Object> merged = new HashMap<>();

        for (Map<String, Object> source : sources) {
            for (Map.Entry<String, Object> entry : source.entrySet()) {
                if (entry.getValue() != null) {
                    merged.put(entry.getKey(), entry.getValue());
                }
            }
        }

        return merged;
    }

    /**
     * Resolve configuration map to InvoicingConfig object
     *
     * @param configMap configuration map
     * @return resolved and validated InvoicingConfig
     */
    public InvoicingConfig resolve(Map<String, Object> configMap) {
        InvoicingConfig.Builder builder = InvoicingConfig.builder();

        if (configMap.containsKey("provider")) {
            Object provider = configMap.get("provider");
            if (provider instanceof ProviderType) {
                builder.provider((ProviderType) provider);
            } else {
                builder.provider(ProviderType.fromString(String.valueOf(provider)));
            }
        }
        if (configMap.containsKey("masterKeyId")) {
            builder.masterKeyId(String.valueOf(configMap.get("masterKeyId")));
        }
        if (configMap.containsKey("masterKey")) {
            builder.masterKey(String.valueOf(configMap.get("masterKey")));
        }
        if (configMap.containsKey("nextMasterKeyId")) {
            builder.nextMasterKeyId(String.valueOf(configMap.get("nextMasterKeyId")));
        }
        if (configMap.containsKey("nextMasterKey")) {
            builder.nextMasterKey(String.valueOf(configMap.get("nextMasterKey")));
        }
        if (configMap.containsKey("retiredMasterKeyId")) {
            builder.retiredMasterKeyId(String.valueOf(configMap.get("retiredMasterKeyId")));
        }
        if (configMap.containsKey("retiredMasterKey")) {
            builder.retiredMasterKey(String.valueOf(configMap.get("retiredMasterKey")));
        }
        if (configMap.containsKey("facturapiUrl")) {
            builder.facturapiUrl(String.valueOf(configMap.get("facturapiUrl")));
        }
        if (configMap.containsKey("facturapiUserKey")) {
            builder.facturapiUserKey(String.valueOf(configMap.get("facturapiUserKey")));
        }
        if (configMap.containsKey("fiscalapiUrl")) {
            builder.fiscalapiUrl(String.valueOf(configMap.get("fiscalapiUrl")));
        }
        if (configMap.containsKey("fiscalapiApiKey")) {
            builder.fiscalapiApiKey(String.valueOf(configMap.get("fiscalapiApiKey")));
        }
        if (configMap.containsKey("fiscalapiTenantKey")) {
            builder.fiscalapiTenantKey(String.valueOf(configMap.get("fiscalapiTenantKey")));
        }
        if (configMap.containsKey("timeout")) {
            builder.timeout(toInt(configMap.get("timeout"), InvoicingConfigConstants.DEFAULT_TIMEOUT));
        }
        if (configMap.containsKey("retryAttempts")) {
            builder.retryAttempts(toInt(configMap.get("retryAttempts"), InvoicingConfigConstants.DEFAULT_RETRY_ATTEMPTS));
        }
        if (configMap.containsKey("retryDelay")) {
            builder.retryDelay(toInt(configMap.get("retryDelay"), InvoicingConfigConstants.DEFAULT_RETRY_DELAY));
        }
        if (configMap.containsKey("nameMatchThreshold")) {
            builder.nameMatchThreshold(toDouble(configMap.get("nameMatchThreshold"),
                InvoicingConfigConstants.DEFAULT_NAME_MATCH_THRESHOLD));
        }
        if (configMap.containsKey("trustedIssuers")) {
            builder.trustedIssuers(toStringList(configMap.get("trustedIssuers")));
        }
        if (configMap.containsKey("organizationCacheTtl")) {
            builder.organizationCacheTtl(toInt(configMap.get("organizationCacheTtl"),
                InvoicingConfigConstants.DEFAULT_ORGANIZATION_CACHE_TTL));
        }
        if (configMap.containsKey("credentialCacheTtl")) {
            builder.credentialCacheTtl(toInt(configMap.get("credentialCacheTtl"),
                InvoicingConfigConstants.DEFAULT_CREDENTIAL_CACHE_TTL));
        }
        if (configMap.containsKey("enableAuditLog")) {
            builder.enableAuditLog(toBoolean(configMap.get("enableAuditLog"),
                InvoicingConfigConstants.DEFAULT_ENABLE_AUDIT_LOG));
        }

        return builder.build();
    }

    /**
     * Load, merge, and resolve configuration from multiple sources
     *
     * @param filePath path to JSON configuration file (optional, null to skip)
     * @param loadEnv whether to load from environment variables
     * @param programmaticConfig programmatic configuration (optional, null to skip)
     * @return resolved InvoicingConfig
     */
    public InvoicingConfig load(String filePath, boolean loadEnv, Map<String, Object> programmaticConfig) {
        Map<String, Object> fileConfig = filePath != null ? fromFile(filePath) : new HashMap<>();
        Map<String, Object> envConfig = loadEnv ? fromEnvironment() : new HashMap<>();
        Map<String, Object> progConfig = programmaticConfig != null ? programmaticConfig : new HashMap<>();

        return resolve(merge(fileConfig, envConfig, progConfig));
    }

    /**
     * Load configuration from file with environment overrides
     *
     * @param filePath path to JSON configuration file
     * @return resolved InvoicingConfig
     */
    public InvoicingConfig loadFromFile(String filePath) {
        return load(filePath, true, null);
    }

    /**
     * Create a configuration template file
     *
     * @param path path to write template
     * @throws InvoicingException if writing fails
     */
    public void createTemplate(String path) throws InvoicingException {
        Map<String, Object> template = new LinkedHashMap<>();
        template.put("provider", "facturapi");
        template.put("masterKeyId", "k1");
        template.put("masterKey", "CHANGE_ME_TO_A_LONG_RANDOM_SECRET");
        template.put("nextMasterKeyId", "");
        template.put("nextMasterKey", "");
        template.put("retiredMasterKeyId", "");
        template.put("retiredMasterKey", "");
        template.put("facturapiUrl", InvoicingConfigConstants.FACTURAPI_URL);
        template.put("facturapiUserKey", "YOUR_FACTURAPI_USER_KEY");
        template.put("fiscalapiUrl", InvoicingConfigConstants.FISCALAPI_URL);
        template.put("fiscalapiApiKey", "");
        template.put("fiscalapiTenantKey", "");
        template.put("timeout", InvoicingConfigConstants.DEFAULT_TIMEOUT);
        template.put("retryAttempts", InvoicingConfigConstants.DEFAULT_RETRY_ATTEMPTS);
        template.put("retryDelay", InvoicingConfigConstants.DEFAULT_RETRY_DELAY);
        template.put("nameMatchThreshold", InvoicingConfigConstants.DEFAULT_NAME_MATCH_THRESHOLD);
        template.put("trustedIssuers", InvoicingConfigConstants.DEFAULT_TRUSTED_ISSUERS);
        template.put("organizationCacheTtl", InvoicingConfigConstants.DEFAULT_ORGANIZATION_CACHE_TTL);
        template.put("credentialCacheTtl", InvoicingConfigConstants.DEFAULT_CREDENTIAL_CACHE_TTL);
        template.put("enableAuditLog", InvoicingConfigConstants.DEFAULT_ENABLE_AUDIT_LOG);

        Path filePath = Paths.get(path).toAbsolutePath();
        try {
            Files.createDirectories(filePath.getParent());
            objectMapper.writeValue(filePath.toFile(), template);
        } catch (IOException e) {
            throw new InvoicingException("Failed to create configuration template: " + e.getMessage(),
                "CONFIG_WRITE_ERROR", e);
        }
    }

    private Object parseEnvValue(String key, String value) {
        if ("enableAuditLog".equals(key)) {
            return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
        }

        if ("timeout".equals(key) || "retryAttempts".equals(key) || "retryDelay".equals(key)) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                return value;
            }
        }

        if ("nameMatchThreshold".equals(key)) {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                return value;
            }
        }

        if ("provider".equals(key)) {
            try {
                return ProviderType.fromString(value);
            } catch (IllegalArgumentException e) {
                return value;
            }
        }

        return value;
    }

    private int toInt(Object value, int defaultValue) {
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(String.valueOf(value));
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private double toDouble(Object value, double defaultValue) {
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).doubleValue();
        try {
            return Double.parseDouble(String.valueOf(value));
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private boolean toBoolean(Object value, boolean defaultValue) {
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        String str = String.valueOf(value);
        return "true".equalsIgnoreCase(str) || "1".equals(str) || "yes".equalsIgnoreCase(str);
    }

    private List<String> toStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null) {
                    result.add(String.valueOf(item).trim());
                }
            }
        } else if (value != null) {
            Arrays.stream(String.valueOf(value).split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(result::add);
        }
        return result;
    }
}
