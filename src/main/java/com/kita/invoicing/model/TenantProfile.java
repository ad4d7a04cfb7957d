package com.kita.invoicing.model;

import java.util.Objects;

/**
 * Legal identity of a tenant, as registered on the platform
 */
public final class TenantProfile {

    public static final String DEFAULT_FISCAL_REGIME = "601";

    private final String tenantId;
    private final TaxId taxId;
    private final String legalName;
    private final String fiscalRegime;
    private final String postalCode;
    private final String email;
    private final String phone;
    private final Address address;

    private TenantProfile(Builder builder) {
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId is required");
        this.taxId = Objects.requireNonNull(builder.taxId, "taxId is required");
        this.legalName = Objects.requireNonNull(builder.legalName, "legalName is required");
        this.fiscalRegime = builder.fiscalRegime != null ? builder.fiscalRegime : DEFAULT_FISCAL_REGIME;
        this.postalCode = Objects.requireNonNull(builder.postalCode, "postalCode is required");
        this.email = builder.email;
        this.phone = builder.phone;
        this.address = builder.address != null ? builder.address : Address.builder().zip(builder.postalCode).build();
    }

    public String getTenantId() {
        return tenantId;
    }

    public TaxId getTaxId() {
        return taxId;
    }

    public String getLegalName() {
        return legalName;
    }

    /**
     * SAT fiscal regime code, e.g. 601 or 612
     */
    public String getFiscalRegime() {
        return fiscalRegime;
    }

    public String getPostalCode() {
        return postalCode;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public Address getAddress() {
        return address;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TenantProfile{tenantId='" + tenantId + "', taxId=" + taxId + ", legalName='" + legalName + "'}";
    }

    public static class Builder {
        private String tenantId;
        private TaxId taxId;
        private String legalName;
        private String fiscalRegime;
        private String postalCode;
        private String email;
        private String phone;
        private Address address;

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

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

        public Builder fiscalRegime(String fiscalRegime) {
            this.fiscalRegime = fiscalRegime;
            return this;
        }

        public Builder postalCode(String postalCode) {
            this.postalCode = postalCode;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Builder address(Address address) {
            this.address = address;
            return this;
        }

        public TenantProfile build() {
            return new TenantProfile(this);
        }
    }

    /**
     * Fiscal address
     */
    public static final class Address {
        private final String street;
        private final String exterior;
        private final String interior;
        private final String neighborhood;
        private final String city;
        private final String municipality;
        private final String zip;
        private final String state;

        private Address(Builder builder) {
            this.street = builder.street;
            this.exterior = builder.exterior;
            this.interior = builder.interior;
            this.neighborhood = builder.neighborhood;
            this.city = builder.city;
            this.municipality = builder.municipality;
            this.zip = builder.zip;
            this.state = builder.state;
        }

        public static Builder builder() {
            return new Builder();
        }

        public String getStreet() { return street; }
        public String getExterior() { return exterior; }
        public String getInterior() { return interior; }
        public String getNeighborhood() { return neighborhood; }
        public String getCity() { return city; }
        public String getMunicipality() { return municipality; }
        public String getZip() { return zip; }
        public String getState() { return state; }

        public static class Builder {
            private String street;
            private String exterior;
            private String interior;
            private String neighborhood;
            private String city;
            private String municipality;
            private String zip;
            private String state;

            public Builder street(String street) { this.street = street; return this; }
            public Builder exterior(String exterior) { this.exterior = exterior; return this; }
            public Builder interior(String interior) { this.interior = interior; return this; }
            public Builder neighborhood(String neighborhood) { this.neighborhood = neighborhood; return this; }
            public Builder city(String city) { this.city = city; return this; }
            public Builder municipality(String municipality) { this.municipality = municipality; return this; }
            public Builder zip(String zip) { this.zip = zip; return this; }
            public Builder state(String state) { this.state = state; return this; }

            public Address build() {
                return new Address(this);
            }
        }
    }
}
