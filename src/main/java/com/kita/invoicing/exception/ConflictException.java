package com.kita.invoicing.exception;

/**
 * Raised when a write would violate a uniqueness or ownership rule.
 */
public class ConflictException extends InvoicingException {
    
    public enum ConflictCode {
        DUPLICATE_SERIAL("CONFLICT01"),
        TAX_ID_BOUND_TO_OTHER_TENANT("CONFLICT02"),
        DUPLICATE_FOLIO("CONFLICT03"),
        PAYMENT_ALREADY_INVOICED("CONFLICT04");
        
        private final String code;
        
        ConflictCode(String code) {
            this.code = code;
        }
        
        public String getCode() {
            return code;
        }
    }
    
    private final ConflictCode conflictCode;
    
    public ConflictException(ConflictCode conflictCode, String message) {
        super(message, conflictCode.getCode(), 409);
        this.conflictCode = conflictCode;
    }
    
    public ConflictCode getConflictCode() {
        return conflictCode;
    }
    
    public static ConflictException duplicateSerial(String serialNumber) {
        return new ConflictException(ConflictCode.DUPLICATE_SERIAL,
            "A certificate with serial number " + serialNumber + " is already registered");
    }
    
    public static ConflictException taxIdBoundToOtherTenant(String taxId) {
        return new ConflictException(ConflictCode.TAX_ID_BOUND_TO_OTHER_TENANT,
            "Tax id " + taxId + " is already registered by another account");
    }
    
    public static ConflictException duplicateFolio(String serieFolio) {
        return new ConflictException(ConflictCode.DUPLICATE_FOLIO,
            "Invoice " + serieFolio + " already exists");
    }
    
    public static ConflictException paymentAlreadyInvoiced(String paymentId, String serieFolio) {
        return new ConflictException(ConflictCode.PAYMENT_ALREADY_INVOICED,
            "Payment " + paymentId + " is already invoiced as " + serieFolio);
    }
}
