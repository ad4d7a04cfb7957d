package com.kita.invoicing.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Invoicing configuration validator
 * Checks required secrets, URL formats and numeric ranges
 */
public class ConfigValidator {

    private static final Pattern URL_PATTERN = Pattern.compile("^https?://.*$");
    private static final Pattern KEY_ID_PATTERN = Pattern.compile("^[A-Za-z0-9._-]{1,64}$");

    /**
     * Validation error detail
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        private final Object value;

        public ValidationError(String field, String message) {
            this(field, message, null);
        }

        public ValidationError(String field, String message, Object value) {
            this.field = field;
            this.message = message;
            this.value = value;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }
        public Object getValue() { return value; }

        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    /**
     * Validation result
     */
    public static class ValidationResult {
        private final boolean valid;
        private final List<ValidationError> errors;

        public ValidationResult(boolean valid, List<ValidationError> errors) {
            this.valid = valid;
            this.errors = Collections.unmodifiableList(errors);
        }

        public boolean isValid() { return valid; }
        public List<ValidationError> getErrors() { return errors; }
    }

    /**
     * Validate the configuration
     *
     * @param config the configuration to validate
     * @return the validation result
     */
    public ValidationResult validate(InvoicingConfig config) {
        List<ValidationError> errors = new ArrayList<>();

        validateMasterKeys(config, errors);
        validateProviderCredentials(config, errors);
        validateFormats(config, errors);
        validateRanges(config, errors);

        return new ValidationResult(errors.isEmpty(), errors);
    }

    /**
     * Validate and throw exception if invalid
     *
     * @param config the configuration to validate
     * @throws ConfigValidationException if validation fails
     */
    public void validateOrThrow(InvoicingConfig config) {
        ValidationResult result = validate(config);
        if (!result.isValid()) {
            StringBuilder sb = new StringBuilder("Configuration validation failed: ");
            List<ValidationError> errors = result.getErrors();
            for (int i = 0; i < errors.size(); i++) {
                if (i > 0) sb.append("; ");
                sb.append(errors.get(i));
            }
            throw new ConfigValidationException(sb.toString());
        }
    }

    private void validateMasterKeys(InvoicingConfig config, List<ValidationError> errors) {
        if (isNullOrEmpty(config.getMasterKeyId())) {
            errors.add(new ValidationError("masterKeyId", "masterKeyId is required"));
        } else if (!KEY_ID_PATTERN.matcher(config.getMasterKeyId()).matches()) {
            errors.add(new ValidationError("masterKeyId",
                "masterKeyId may only contain letters, digits, '.', '_' and '-'", config.getMasterKeyId()));
        }

        if (isNullOrEmpty(config.getMasterKey())) {
            errors.add(new ValidationError("masterKey", "masterKey is required"));
        } else if (config.getMasterKey().length() < InvoicingConfigConstants.MIN_MASTER_KEY_LENGTH) {
            errors.add(new ValidationError("masterKey",
                "masterKey must be at least " + InvoicingConfigConstants.MIN_MASTER_KEY_LENGTH + " characters",
                "[REDACTED]"));
        }

        boolean hasNextId = !isNullOrEmpty(config.getNextMasterKeyId());
        boolean hasNextKey = !isNullOrEmpty(config.getNextMasterKey());
        if (hasNextId != hasNextKey) {
            errors.add(new ValidationError("nextMasterKey",
                "nextMasterKeyId and nextMasterKey must be configured together"));
        }
        if (hasNextId && hasNextKey && config.getNextMasterKeyId().equals(config.getMasterKeyId())) {
            errors.add(new ValidationError("nextMasterKeyId",
                "nextMasterKeyId must differ from masterKeyId", config.getNextMasterKeyId()));
        }

        boolean hasRetiredId = !isNullOrEmpty(config.getRetiredMasterKeyId());
        boolean hasRetiredKey = !isNullOrEmpty(config.getRetiredMasterKey());
        if (hasRetiredId != hasRetiredKey) {
            errors.add(new ValidationError("retiredMasterKey",
                "retiredMasterKeyId and retiredMasterKey must be configured together"));
        }
        if (hasRetiredId && (config.getRetiredMasterKeyId().equals(config.getMasterKeyId())
                || config.getRetiredMasterKeyId().equals(config.getNextMasterKeyId()))) {
            errors.add(new ValidationError("retiredMasterKeyId",
                "retiredMasterKeyId must differ from masterKeyId and nextMasterKeyId", config.getRetiredMasterKeyId()));
        }
    }

    private void validateProviderCredentials(InvoicingConfig config, List<ValidationError> errors) {
        if (config.getProvider() == null) {
            errors.add(new ValidationError("provider", "provider is required"));
            return;
        }

        switch (config.getProvider()) {
            case FACTURAPI:
                if (isNullOrEmpty(config.getFacturapiUserKey())) {
                    errors.add(new ValidationError("facturapiUserKey",
                        "facturapiUserKey is required when provider is facturapi"));
                }
                break;
            case FISCALAPI:
                if (isNullOrEmpty(config.getFiscalapiApiKey())) {
                    errors.add(new ValidationError("fiscalapiApiKey",
                        "fiscalapiApiKey is required when provider is fiscalapi"));
                }
                if (isNullOrEmpty(config.getFiscalapiTenantKey())) {
                    errors.add(new ValidationError("fiscalapiTenantKey",
                        "fiscalapiTenantKey is required when provider is fiscalapi"));
                }
                break;
            default:
                break;
        }
    }

    private void validateFormats(InvoicingConfig config, List<ValidationError> errors) {
        String facturapiUrl = config.getFacturapiUrl();
        if (facturapiUrl != null && !URL_PATTERN.matcher(facturapiUrl).matches()) {
            errors.add(new ValidationError("facturapiUrl", "facturapiUrl must be a valid HTTP/HTTPS URL", facturapiUrl));
        }

        String fiscalapiUrl = config.getFiscalapiUrl();
        if (fiscalapiUrl != null && !URL_PATTERN.matcher(fiscalapiUrl).matches()) {
            errors.add(new ValidationError("fiscalapiUrl", "fiscalapiUrl must be a valid HTTP/HTTPS URL", fiscalapiUrl));
        }

        if (config.getTrustedIssuers().isEmpty()) {
            errors.add(new ValidationError("trustedIssuers", "at least one trusted issuer is required"));
        }
    }

    private void validateRanges(InvoicingConfig config, List<ValidationError> errors) {
        int timeout = config.getTimeout();
        if (timeout <= 0) {
            errors.add(new ValidationError("timeout", "timeout must be a positive number (milliseconds)", timeout));
        } else if (timeout < InvoicingConfigConstants.MIN_TIMEOUT) {
            errors.add(new ValidationError("timeout",
                "timeout should be at least " + InvoicingConfigConstants.MIN_TIMEOUT + "ms for reliable operation", timeout));
        } else if (timeout > InvoicingConfigConstants.MAX_TIMEOUT) {
            errors.add(new ValidationError("timeout",
                "timeout should not exceed " + InvoicingConfigConstants.MAX_TIMEOUT + "ms (5 minutes)", timeout));
        }

        int retryAttempts = config.getRetryAttempts();
        if (retryAttempts < InvoicingConfigConstants.MIN_RETRY_ATTEMPTS) {
            errors.add(new ValidationError("retryAttempts", "retryAttempts must be a non-negative integer", retryAttempts));
        } else if (retryAttempts > InvoicingConfigConstants.MAX_RETRY_ATTEMPTS) {
            errors.add(new ValidationError("retryAttempts",
                "retryAttempts should not exceed " + InvoicingConfigConstants.MAX_RETRY_ATTEMPTS, retryAttempts));
        }

        int retryDelay = config.getRetryDelay();
        if (retryDelay < 0) {
            errors.add(new ValidationError("retryDelay", "retryDelay must be a non-negative number (milliseconds)", retryDelay));
        } else if (retryDelay > InvoicingConfigConstants.MAX_RETRY_DELAY) {
            errors.add(new ValidationError("retryDelay",
                "retryDelay should not exceed " + InvoicingConfigConstants.MAX_RETRY_DELAY + "ms (1 minute)", retryDelay));
        }

        double threshold = config.getNameMatchThreshold();
        if (threshold <= 0.0 || threshold > 1.0) {
            errors.add(new ValidationError("nameMatchThreshold",
                "nameMatchThreshold must be greater than 0 and at most 1", threshold));
        }

        if (config.getOrganizationCacheTtl() <= 0) {
            errors.add(new ValidationError("organizationCacheTtl",
                "organizationCacheTtl must be a positive number (seconds)", config.getOrganizationCacheTtl()));
        }
        if (config.getCredentialCacheTtl() <= 0) {
            errors.add(new ValidationError("credentialCacheTtl",
                "credentialCacheTtl must be a positive number (seconds)", config.getCredentialCacheTtl()));
        }
    }

    private boolean isNullOrEmpty(String value) {
        return value == null || value.trim().isEmpty();
    }
}
