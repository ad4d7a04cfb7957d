package com.kita.invoicing.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Request to invoice one payment
 */
public final class InvoiceRequest {

    public static final BigDecimal DEFAULT_TAX_RATE = new BigDecimal("0.16");
    public static final String DEFAULT_PAYMENT_FORM = "03";

    private final String tenantId;
    private final String paymentId;
    private final PayerIdentity payer;
    private final BigDecimal amount;
    private final String currency;
    private final BigDecimal taxRate;
    private final String description;
    private final String paymentForm;

    private InvoiceRequest(Builder builder) {
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId is required");
        this.paymentId = Objects.requireNonNull(builder.paymentId, "paymentId is required");
        this.payer = Objects.requireNonNull(builder.payer, "payer is required");
        this.amount = Objects.requireNonNull(builder.amount, "amount is required");
        this.currency = builder.currency != null ? builder.currency : "MXN";
        this.taxRate = builder.taxRate != null ? builder.taxRate : DEFAULT_TAX_RATE;
        this.description = builder.description != null ? builder.description : "Pago";
        this.paymentForm = builder.paymentForm != null ? builder.paymentForm : DEFAULT_PAYMENT_FORM;
    }

    public String getTenantId() { return tenantId; }
    public String getPaymentId() { return paymentId; }
    public PayerIdentity getPayer() { return payer; }

    /**
     * Tax-inclusive total of the payment
     */
    public BigDecimal getAmount() { return amount; }
    public String getCurrency() { return currency; }
    public BigDecimal getTaxRate() { return taxRate; }
    public String getDescription() { return description; }

    /**
     * SAT payment form code, e.g. 03 for bank transfer
     */
    public String getPaymentForm() { return paymentForm; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String tenantId;
        private String paymentId;
        private PayerIdentity payer;
        private BigDecimal amount;
        private String currency;
        private BigDecimal taxRate;
        private String description;
        private String paymentForm;

        public Builder tenantId(String tenantId) { this.tenantId = tenantId; return this; }
        public Builder paymentId(String paymentId) { this.paymentId = paymentId; return this; }
        public Builder payer(PayerIdentity payer) { this.payer = payer; return this; }
        public Builder amount(BigDecimal amount) { this.amount = amount; return this; }
        public Builder amount(String amount) { this.amount = new BigDecimal(amount); return this; }
        public Builder currency(String currency) { this.currency = currency; return this; }
        public Builder taxRate(BigDecimal taxRate) { this.taxRate = taxRate; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder paymentForm(String paymentForm) { this.paymentForm = paymentForm; return this; }

        public InvoiceRequest build() {
            return new InvoiceRequest(this);
        }
    }
}
