package com.kita.invoicing.exception;

/**
 * Raised when stored certificate material cannot be decrypted.
 *
 * <p>A wrong master secret and corrupted ciphertext are indistinguishable
 * under authenticated encryption, so both surface as this one error.
 */
public class DecryptionException extends InvoicingException {
    
    private static final String CODE = "DECRYPTION_ERROR";
    
    public DecryptionException(String message) {
        super(message, CODE);
    }
    
    public DecryptionException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
