package com.kita.invoicing.provider;

import com.kita.invoicing.model.FiscalId;

import java.util.Objects;

/**
 * Stamped document returned by a provider
 */
public final class IssuedDocument {

    private final FiscalId fiscalId;
    private final String documentId;
    private final byte[] xml;
    private final byte[] pdf;
    private final String rawResponse;

    public IssuedDocument(FiscalId fiscalId, String documentId, byte[] xml, byte[] pdf, String rawResponse) {
        this.fiscalId = Objects.requireNonNull(fiscalId, "fiscalId");
        this.documentId = documentId;
        this.xml = xml != null ? xml.clone() : null;
        this.pdf = pdf != null ? pdf.clone() : null;
        this.rawResponse = rawResponse;
    }

    public FiscalId getFiscalId() { return fiscalId; }

    /**
     * Provider's own document id, used later for downloads and cancellation
     */
    public String getDocumentId() { return documentId; }
    public byte[] getXml() { return xml != null ? xml.clone() : null; }
    public byte[] getPdf() { return pdf != null ? pdf.clone() : null; }
    public String getRawResponse() { return rawResponse; }
}
