package com.kita.invoicing.orchestration;

import com.kita.invoicing.model.FiscalId;

import java.time.Instant;

/**
 * A document stamped at the provider whose local bookkeeping did not complete
 *
 * <p>{@link #getInvoiceId()} is set when the invoice record itself was stored
 * and only a later step, such as linking the payment, failed.
 */
public final class ReconciliationEntry {

    private final String tenantId;
    private final String paymentId;
    private final String serieFolio;
    private final String invoiceId;
    private final FiscalId fiscalId;
    private final String providerDocumentId;
    private final String rawResponse;
    private final String failure;
    private final Instant recordedAt;

    public ReconciliationEntry(String tenantId, String paymentId, String serieFolio, String invoiceId,
                               FiscalId fiscalId, String providerDocumentId, String rawResponse, String failure,
                               Instant recordedAt) {
        this.tenantId = tenantId;
        this.paymentId = paymentId;
        this.serieFolio = serieFolio;
        this.invoiceId = invoiceId;
        this.fiscalId = fiscalId;
        this.providerDocumentId = providerDocumentId;
        this.rawResponse = rawResponse;
        this.failure = failure;
        this.recordedAt = recordedAt;
    }

    public String getTenantId() { return tenantId; }
    public String getPaymentId() { return paymentId; }
    public String getSerieFolio() { return serieFolio; }
    public String getInvoiceId() { return invoiceId; }
    public boolean isRecordStored() { return invoiceId != null; }
    public FiscalId getFiscalId() { return fiscalId; }
    public String getProviderDocumentId() { return providerDocumentId; }
    public String getRawResponse() { return rawResponse; }
    public String getFailure() { return failure; }
    public Instant getRecordedAt() { return recordedAt; }

    @Override
    public String toString() {
        return "ReconciliationEntry{tenantId='" + tenantId + "', serieFolio='" + serieFolio +
               "', stored=" + isRecordStored() + ", fiscalId=" + fiscalId + ", failure='" + failure + "'}";
    }
}
