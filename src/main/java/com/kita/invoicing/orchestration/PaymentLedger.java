package com.kita.invoicing.orchestration;

/**
 * Payments that invoices are issued for
 */
public interface PaymentLedger {

    /**
     * Link a payment to the invoice issued for it
     */
    void markInvoiced(String paymentId, String invoiceId);
}
