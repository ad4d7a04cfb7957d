package com.kita.invoicing.model;

import java.util.Objects;

/**
 * Request to cancel a stamped invoice
 *
 * <p>Reason codes follow SAT: 01 with related document, 02 without, 03 not
 * carried out, 04 nominative operation in global invoice.
 */
public final class CancelRequest {

    public static final String DEFAULT_REASON = "02";

    private final FiscalId fiscalId;
    private final String reasonCode;

    public CancelRequest(FiscalId fiscalId, String reasonCode) {
        this.fiscalId = Objects.requireNonNull(fiscalId, "fiscalId");
        this.reasonCode = reasonCode != null ? reasonCode : DEFAULT_REASON;
    }

    public CancelRequest(FiscalId fiscalId) {
        this(fiscalId, DEFAULT_REASON);
    }

    public FiscalId getFiscalId() {
        return fiscalId;
    }

    public String getReasonCode() {
        return reasonCode;
    }
}
