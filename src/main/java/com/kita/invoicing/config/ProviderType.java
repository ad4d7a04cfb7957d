package com.kita.invoicing.config;

/**
 * Supported stamping providers (PACs)
 */
public enum ProviderType {
    FACTURAPI("facturapi"),
    FISCALAPI("fiscalapi");
    
    private final String value;
    
    ProviderType(String value) {
        this.value = value;
    }
    
    public String getValue() {
        return value;
    }
    
    public static ProviderType fromString(String value) {
        if (value == null) {
            return InvoicingConfigConstants.DEFAULT_PROVIDER;
        }
        
        for (ProviderType type : ProviderType.values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + value);
    }
}
