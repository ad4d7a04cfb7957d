package com.kita.invoicing.tax;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * CFDI 4.0 income document ready for stamping
 *
 * <p>Amounts are at two decimals and {@code subtotal + tax == total}.
 */
public final class TaxDocument {

    public static final String VERSION = "4.0";
    public static final String TYPE_INCOME = "I";
    public static final String PAYMENT_METHOD_SINGLE = "PUE";
    public static final String EXPORT_NOT_APPLICABLE = "01";

    private final String version;
    private final String serie;
    private final String folio;
    private final LocalDateTime issuedAt;
    private final Party issuer;
    private final Party recipient;
    private final List<Concept> concepts;
    private final List<TaxTransfer> transfers;
    private final BigDecimal subtotal;
    private final BigDecimal tax;
    private final BigDecimal total;
    private final String currency;
    private final String paymentMethod;
    private final String paymentForm;
    private final String exportCode;
    private final String documentType;
    private final String placeOfIssue;
    private final String recipientEmail;

    private TaxDocument(Builder builder) {
        this.version = VERSION;
        this.serie = Objects.requireNonNull(builder.serie, "serie is required");
        this.folio = Objects.requireNonNull(builder.folio, "folio is required");
        this.issuedAt = Objects.requireNonNull(builder.issuedAt, "issuedAt is required");
        this.issuer = Objects.requireNonNull(builder.issuer, "issuer is required");
        this.recipient = Objects.requireNonNull(builder.recipient, "recipient is required");
        this.concepts = List.copyOf(builder.concepts);
        this.transfers = List.copyOf(builder.transfers);
        this.subtotal = builder.subtotal;
        this.tax = builder.tax;
        this.total = builder.total;
        this.currency = builder.currency;
        this.paymentMethod = PAYMENT_METHOD_SINGLE;
        this.paymentForm = builder.paymentForm;
        this.exportCode = EXPORT_NOT_APPLICABLE;
        this.documentType = TYPE_INCOME;
        this.placeOfIssue = issuer.getPostalCode();
        this.recipientEmail = builder.recipientEmail;
        if (subtotal.add(tax).compareTo(total) != 0) {
            throw new IllegalStateException("subtotal + tax must equal total");
        }
    }

    public String getVersion() { return version; }
    public String getSerie() { return serie; }
    public String getFolio() { return folio; }
    public LocalDateTime getIssuedAt() { return issuedAt; }
    public Party getIssuer() { return issuer; }
    public Party getRecipient() { return recipient; }
    public List<Concept> getConcepts() { return concepts; }

    /**
     * Document-level transferred taxes
     */
    public List<TaxTransfer> getTransfers() { return transfers; }
    public BigDecimal getSubtotal() { return subtotal; }
    public BigDecimal getTax() { return tax; }
    public BigDecimal getTotal() { return total; }
    public String getCurrency() { return currency; }
    public String getPaymentMethod() { return paymentMethod; }
    public String getPaymentForm() { return paymentForm; }
    public String getExportCode() { return exportCode; }
    public String getDocumentType() { return documentType; }
    public String getPlaceOfIssue() { return placeOfIssue; }
    public String getCfdiUse() { return recipient.getCfdiUse(); }

    /**
     * Where the stamped document is sent; not part of the XML
     */
    public String getRecipientEmail() { return recipientEmail; }

    public String serieFolio() {
        return serie + "-" + folio;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TaxDocument{" + serieFolio() + ", issuer=" + issuer.getTaxId() +
               ", recipient=" + recipient.getTaxId() + ", total=" + total + " " + currency + '}';
    }

    public static class Builder {
        private String serie;
        private String folio;
        private LocalDateTime issuedAt;
        private Party issuer;
        private Party recipient;
        private List<Concept> concepts = List.of();
        private List<TaxTransfer> transfers = List.of();
        private BigDecimal subtotal;
        private BigDecimal tax;
        private BigDecimal total;
        private String currency = "MXN";
        private String paymentForm;
        private String recipientEmail;

        public Builder serie(String serie) { this.serie = serie; return this; }
        public Builder folio(String folio) { this.folio = folio; return this; }
        public Builder issuedAt(LocalDateTime issuedAt) { this.issuedAt = issuedAt; return this; }
        public Builder issuer(Party issuer) { this.issuer = issuer; return this; }
        public Builder recipient(Party recipient) { this.recipient = recipient; return this; }
        public Builder concepts(List<Concept> concepts) { this.concepts = concepts; return this; }
        public Builder transfers(List<TaxTransfer> transfers) { this.transfers = transfers; return this; }
        public Builder subtotal(BigDecimal subtotal) { this.subtotal = subtotal; return this; }
        public Builder tax(BigDecimal tax) { this.tax = tax; return this; }
        public Builder total(BigDecimal total) { this.total = total; return this; }
        public Builder currency(String currency) { this.currency = currency; return this; }
        public Builder paymentForm(String paymentForm) { this.paymentForm = paymentForm; return this; }
        public Builder recipientEmail(String recipientEmail) { this.recipientEmail = recipientEmail; return this; }

        public TaxDocument build() {
            return new TaxDocument(this);
        }
    }
}
