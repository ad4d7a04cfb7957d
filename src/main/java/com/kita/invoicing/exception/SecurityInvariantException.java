package com.kita.invoicing.exception;

/**
 * Raised when a code path would let one tenant reach another tenant's
 * provider organization, for example by resolving an organization through a
 * directory search on a tax id.
 */
public class SecurityInvariantException extends InvoicingException {
    
    private static final String CODE = "SECURITY_INVARIANT";
    
    public SecurityInvariantException(String message) {
        super(message, CODE);
    }
}
