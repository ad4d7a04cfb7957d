package com.kita.invoicing.exception;

/**
 * Raised when an uploaded CSD certificate or private key is rejected.
 * 
 * <p>The message is always user-safe; the underlying library failure, if any,
 * is kept only as the cause.
 */
public class CertificateValidationException extends ValidationException {
    
    /**
     * Certificate rejection reasons
     */
    public enum CertificateErrorCode {
        FORMAT("CSD01", "The certificate file could not be read. Upload the .cer file issued by SAT."),
        WRONG_PASSWORD("CSD02", "The private key password is incorrect."),
        UNSUPPORTED_KEY_FORMAT("CSD03", "The private key format is not supported. Upload the .key file issued by SAT."),
        CORRUPT_KEY("CSD04", "The private key file is corrupt or is not a private key."),
        KEY_MISMATCH("CSD05", "The private key does not belong to this certificate."),
        TAX_ID_MISMATCH("CSD06", "The certificate tax id does not match the company tax id."),
        NAME_MISMATCH("CSD07", "The certificate legal name does not match the registered legal name."),
        UNTRUSTED_ISSUER("CSD08", "The certificate was not issued by SAT."),
        EXPIRED("CSD09", "The certificate has expired."),
        NOT_YET_VALID("CSD10", "The certificate is not valid yet.");
        
        private final String code;
        private final String defaultMessage;
        
        CertificateErrorCode(String code, String defaultMessage) {
            this.code = code;
            this.defaultMessage = defaultMessage;
        }
        
        public String getCode() {
            return code;
        }
        
        public String getDefaultMessage() {
            return defaultMessage;
        }
    }
    
    private final CertificateErrorCode errorCode;
    
    public CertificateValidationException(CertificateErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage(), null);
    }
    
    public CertificateValidationException(CertificateErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }
    
    public CertificateValidationException(CertificateErrorCode errorCode, String message, Throwable cause) {
        super(message, errorCode.getCode(), "certificate");
        this.errorCode = errorCode;
        if (cause != null) {
            initCause(cause);
        }
    }
    
    public CertificateErrorCode getErrorCode() {
        return errorCode;
    }
}
