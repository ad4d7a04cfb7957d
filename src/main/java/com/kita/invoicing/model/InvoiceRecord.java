package com.kita.invoicing.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Issued (or attempted) invoice of a tenant
 *
 * <p>Unique per tenant, serie and folio. Immutable; transitions return a new
 * snapshot.
 */
public final class InvoiceRecord {

    private final String id;
    private final String tenantId;
    private final String paymentId;
    private final String serie;
    private final String folio;
    private final FiscalId fiscalId;
    private final String providerDocumentId;
    private final String recipientTaxId;
    private final String recipientName;
    private final String recipientEmail;
    private final BigDecimal subtotal;
    private final BigDecimal tax;
    private final BigDecimal total;
    private final String currency;
    private final InvoiceStatus status;
    private final byte[] xml;
    private final byte[] pdf;
    private final String providerResponse;
    private final Instant stampedAt;
    private final Instant cancelledAt;
    private final String cancellationReason;
    private final Instant createdAt;

    private InvoiceRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId is required");
        this.paymentId = builder.paymentId;
        this.serie = Objects.requireNonNull(builder.serie, "serie is required");
        this.folio = Objects.requireNonNull(builder.folio, "folio is required");
        this.fiscalId = builder.fiscalId;
        this.providerDocumentId = builder.providerDocumentId;
        this.recipientTaxId = builder.recipientTaxId;
        this.recipientName = builder.recipientName;
        this.recipientEmail = builder.recipientEmail;
        this.subtotal = builder.subtotal;
        this.tax = builder.tax;
        this.total = builder.total;
        this.currency = builder.currency != null ? builder.currency : "MXN";
        this.status = builder.status != null ? builder.status : InvoiceStatus.DRAFT;
        this.xml = builder.xml;
        this.pdf = builder.pdf;
        this.providerResponse = builder.providerResponse;
        this.stampedAt = builder.stampedAt;
        this.cancelledAt = builder.cancelledAt;
        this.cancellationReason = builder.cancellationReason;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
    }

    public String getId() { return id; }
    public String getTenantId() { return tenantId; }
    public String getPaymentId() { return paymentId; }
    public String getSerie() { return serie; }
    public String getFolio() { return folio; }
    public FiscalId getFiscalId() { return fiscalId; }
    public String getProviderDocumentId() { return providerDocumentId; }
    public String getRecipientTaxId() { return recipientTaxId; }
    public String getRecipientName() { return recipientName; }
    public String getRecipientEmail() { return recipientEmail; }
    public BigDecimal getSubtotal() { return subtotal; }
    public BigDecimal getTax() { return tax; }
    public BigDecimal getTotal() { return total; }
    public String getCurrency() { return currency; }
    public InvoiceStatus getStatus() { return status; }
    public byte[] getXml() { return xml != null ? xml.clone() : null; }
    public byte[] getPdf() { return pdf != null ? pdf.clone() : null; }
    public String getProviderResponse() { return providerResponse; }
    public Instant getStampedAt() { return stampedAt; }
    public Instant getCancelledAt() { return cancelledAt; }
    public String getCancellationReason() { return cancellationReason; }
    public Instant getCreatedAt() { return createdAt; }

    /**
     * Folio number as an integer
     */
    public int folioNumber() {
        return Integer.parseInt(folio);
    }

    /**
     * SERIE-FOLIO
     */
    public String serieFolio() {
        return serie + "-" + folio;
    }

    public InvoiceRecord cancel(Instant at, String reason) {
        return toBuilder().status(InvoiceStatus.CANCELLED).cancelledAt(at).cancellationReason(reason).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .tenantId(tenantId)
            .paymentId(paymentId)
            .serie(serie)
            .folio(folio)
            .fiscalId(fiscalId)
            .providerDocumentId(providerDocumentId)
            .recipientTaxId(recipientTaxId)
            .recipientName(recipientName)
            .recipientEmail(recipientEmail)
            .subtotal(subtotal)
            .tax(tax)
            .total(total)
            .currency(currency)
            .status(status)
            .xml(xml)
            .pdf(pdf)
            .providerResponse(providerResponse)
            .stampedAt(stampedAt)
            .cancelledAt(cancelledAt)
            .cancellationReason(cancellationReason)
            .createdAt(createdAt);
    }

    @Override
    public String toString() {
        return "InvoiceRecord{" +
               "id='" + id + '\'' +
               ", tenantId='" + tenantId + '\'' +
               ", serieFolio='" + serieFolio() + '\'' +
               ", fiscalId=" + fiscalId +
               ", status=" + status +
               ", total=" + total +
               '}';
    }

    public static class Builder {
        private String id;
        private String tenantId;
        private String paymentId;
        private String serie;
        private String folio;
        private FiscalId fiscalId;
        private String providerDocumentId;
        private String recipientTaxId;
        private String recipientName;
        private String recipientEmail;
        private BigDecimal subtotal;
        private BigDecimal tax;
        private BigDecimal total;
        private String currency;
        private InvoiceStatus status;
        private byte[] xml;
        private byte[] pdf;
        private String providerResponse;
        private Instant stampedAt;
        private Instant cancelledAt;
        private String cancellationReason;
        private Instant createdAt;

        public Builder id(String id) { this.id = id; return this; }
        public Builder tenantId(String tenantId) { this.tenantId = tenantId; return this; }
        public Builder paymentId(String paymentId) { this.paymentId = paymentId; return this; }
        public Builder serie(String serie) { this.serie = serie; return this; }
        public Builder folio(String folio) { this.folio = folio; return this; }
        public Builder fiscalId(FiscalId fiscalId) { this.fiscalId = fiscalId; return this; }
        public Builder providerDocumentId(String providerDocumentId) { this.providerDocumentId = providerDocumentId; return this; }
        public Builder recipientTaxId(String recipientTaxId) { this.recipientTaxId = recipientTaxId; return this; }
        public Builder recipientName(String recipientName) { this.recipientName = recipientName; return this; }
        public Builder recipientEmail(String recipientEmail) { this.recipientEmail = recipientEmail; return this; }
        public Builder subtotal(BigDecimal subtotal) { this.subtotal = subtotal; return this; }
        public Builder tax(BigDecimal tax) { this.tax = tax; return this; }
        public Builder total(BigDecimal total) { this.total = total; return this; }
        public Builder currency(String currency) { this.currency = currency; return this; }
        public Builder status(InvoiceStatus status) { this.status = status; return this; }
        public Builder xml(byte[] xml) { this.xml = xml != null ? xml.clone() : null; return this; }
        public Builder pdf(byte[] pdf) { this.pdf = pdf != null ? pdf.clone() : null; return this; }
        public Builder providerResponse(String providerResponse) { this.providerResponse = providerResponse; return this; }
        public Builder stampedAt(Instant stampedAt) { this.stampedAt = stampedAt; return this; }
        public Builder cancelledAt(Instant cancelledAt) { this.cancelledAt = cancelledAt; return this; }
        public Builder cancellationReason(String cancellationReason) { this.cancellationReason = cancellationReason; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }

        public InvoiceRecord build() {
            return new InvoiceRecord(this);
        }
    }
}
