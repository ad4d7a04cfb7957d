package com.kita.invoicing.orchestration;

import com.kita.invoicing.model.CertificateRecord;
import com.kita.invoicing.model.InvoiceRecord;

/**
 * Delivers stamped invoices to their recipients and certificate notices to tenants
 */
public interface NotificationDispatcher {

    /**
     * @param invoice stamped invoice with its artifacts
     * @param email recipient address
     */
    void invoiceIssued(InvoiceRecord invoice, String email);

    /**
     * Warn a tenant that its active signing certificate expires soon
     *
     * @param certificate expiring certificate
     * @param email tenant contact address
     */
    void certificateExpiring(CertificateRecord certificate, String email);
}
