package com.kita.invoicing.model;

import java.util.Objects;

/**
 * Fiscal data of the invoice recipient
 */
public final class PayerIdentity {

    public static final String DEFAULT_CFDI_USE = "G03";

    private final TaxId taxId;
    private final String legalName;
    private final String postalCode;
    private final String fiscalRegime;
    private final String cfdiUse;
    private final String email;

    private PayerIdentity(Builder builder) {
        this.taxId = Objects.requireNonNull(builder.taxId, "taxId is required");
        this.legalName = Objects.requireNonNull(builder.legalName, "legalName is required");
        this.postalCode = Objects.requireNonNull(builder.postalCode, "postalCode is required");
        this.fiscalRegime = builder.fiscalRegime != null ? builder.fiscalRegime : TenantProfile.DEFAULT_FISCAL_REGIME;
        this.cfdiUse = builder.cfdiUse != null ? builder.cfdiUse : DEFAULT_CFDI_USE;
        this.email = builder.email;
    }

    public TaxId getTaxId() {
        return taxId;
    }

    public String getLegalName() {
        return legalName;
    }

    public String getPostalCode() {
        return postalCode;
    }

    public String getFiscalRegime() {
        return fiscalRegime;
    }

    public String getCfdiUse() {
        return cfdiUse;
    }

    public String getEmail() {
        return email;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private TaxId taxId;
        private String legalName;
        private String postalCode;
        private String fiscalRegime;
        private String cfdiUse;
        private String email;

        public Builder taxId(TaxId taxId) {
            this.taxId = taxId;
            return this;
        }

        public Builder taxId(String taxId) {
            this.taxId = TaxId.of(taxId);
            return this;
        }

        public Builder legalName(String legalName) {
            this.legalName = legalName;
            return this;
        }

        public Builder postalCode(String postalCode) {
            this.postalCode = postalCode;
            return this;
        }

        public Builder fiscalRegime(String fiscalRegime) {
            this.fiscalRegime = fiscalRegime;
            return this;
        }

        public Builder cfdiUse(String cfdiUse) {
            this.cfdiUse = cfdiUse;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public PayerIdentity build() {
            return new PayerIdentity(this);
        }
    }
}
