package com.kita.invoicing.provider;

import com.kita.invoicing.model.FiscalId;

/**
 * Provider acknowledgement of a cancellation
 */
public final class CancellationReceipt {

    private final FiscalId fiscalId;
    private final String documentId;
    private final String status;
    private final String receipt;
    private final String rawResponse;

    public CancellationReceipt(FiscalId fiscalId, String documentId, String status, String receipt,
                               String rawResponse) {
        this.fiscalId = fiscalId;
        this.documentId = documentId;
        this.status = status;
        this.receipt = receipt;
        this.rawResponse = rawResponse;
    }

    public FiscalId getFiscalId() { return fiscalId; }
    public String getDocumentId() { return documentId; }

    /**
     * Provider status text, e.g. "canceled" or "pending"
     */
    public String getStatus() { return status; }

    /**
     * SAT acknowledgement (acuse), when the provider returns one
     */
    public String getReceipt() { return receipt; }
    public String getRawResponse() { return rawResponse; }
}
