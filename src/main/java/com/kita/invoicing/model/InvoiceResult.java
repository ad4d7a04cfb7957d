package com.kita.invoicing.model;

/**
 * Outcome of a successful issuance
 */
public final class InvoiceResult {

    private final String invoiceId;
    private final FiscalId fiscalId;
    private final String serieFolio;
    private final byte[] xml;
    private final byte[] pdf;

    public InvoiceResult(String invoiceId, FiscalId fiscalId, String serieFolio, byte[] xml, byte[] pdf) {
        this.invoiceId = invoiceId;
        this.fiscalId = fiscalId;
        this.serieFolio = serieFolio;
        this.xml = xml != null ? xml.clone() : null;
        this.pdf = pdf != null ? pdf.clone() : null;
    }

    public static InvoiceResult from(InvoiceRecord record) {
        return new InvoiceResult(record.getId(), record.getFiscalId(), record.serieFolio(),
            record.getXml(), record.getPdf());
    }

    public String getInvoiceId() { return invoiceId; }
    public FiscalId getFiscalId() { return fiscalId; }
    public String getSerieFolio() { return serieFolio; }
    public byte[] getXml() { return xml != null ? xml.clone() : null; }
    public byte[] getPdf() { return pdf != null ? pdf.clone() : null; }

    @Override
    public String toString() {
        return "InvoiceResult{invoiceId='" + invoiceId + "', fiscalId=" + fiscalId + ", serieFolio='" + serieFolio + "'}";
    }
}
