package com.kita.invoicing.model;

import com.kita.invoicing.crypto.EncryptedBundle;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Stored signing certificate (CSD) of a tenant
 *
 * <p>Instances are immutable; state transitions return a new snapshot.
 */
public final class CertificateRecord {

    private final String id;
    private final String tenantId;
    private final String serialNumber;
    private final String subjectName;
    private final String issuerName;
    private final String issuerOrganization;
    private final String taxId;
    private final Instant validFrom;
    private final Instant validTo;
    private final EncryptedBundle encryption;
    private final boolean active;
    private final boolean validated;
    private final boolean uploaded;
    private final String providerResponse;
    private final String providerError;
    private final Instant lastUsed;
    private final long usageCount;
    private final Instant createdAt;

    private CertificateRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId is required");
        this.serialNumber = Objects.requireNonNull(builder.serialNumber, "serialNumber is required");
        this.subjectName = builder.subjectName;
        this.issuerName = builder.issuerName;
        this.issuerOrganization = builder.issuerOrganization;
        this.taxId = builder.taxId;
        this.validFrom = Objects.requireNonNull(builder.validFrom, "validFrom is required");
        this.validTo = Objects.requireNonNull(builder.validTo, "validTo is required");
        this.encryption = Objects.requireNonNull(builder.encryption, "encryption is required");
        this.active = builder.active;
        this.validated = builder.validated;
        this.uploaded = builder.uploaded;
        this.providerResponse = builder.providerResponse;
        this.providerError = builder.providerError;
        this.lastUsed = builder.lastUsed;
        this.usageCount = builder.usageCount;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        if (!validFrom.isBefore(validTo)) {
            throw new IllegalArgumentException("validFrom must be before validTo");
        }
    }

    public String getId() { return id; }
    public String getTenantId() { return tenantId; }
    public String getSerialNumber() { return serialNumber; }
    public String getSubjectName() { return subjectName; }
    public String getIssuerName() { return issuerName; }
    public String getIssuerOrganization() { return issuerOrganization; }

    /**
     * Tax id extracted from the certificate, null if it carried none
     */
    public String getTaxId() { return taxId; }
    public Instant getValidFrom() { return validFrom; }
    public Instant getValidTo() { return validTo; }
    public EncryptedBundle getEncryption() { return encryption; }
    public String getKeyId() { return encryption.getKeyId(); }
    public boolean isActive() { return active; }
    public boolean isValidated() { return validated; }
    public boolean isUploaded() { return uploaded; }
    public String getProviderResponse() { return providerResponse; }
    public String getProviderError() { return providerError; }
    public Instant getLastUsed() { return lastUsed; }
    public long getUsageCount() { return usageCount; }
    public Instant getCreatedAt() { return createdAt; }

    /**
     * Active, validated and not yet expired
     */
    public boolean isUsable(Instant now) {
        return active && validated && validTo.isAfter(now);
    }

    public boolean expiresWithin(int days, Instant now) {
        return validTo.isAfter(now) && !validTo.isAfter(now.plus(Duration.ofDays(days)));
    }

    public CertificateRecord markUsed(Instant now) {
        return toBuilder().lastUsed(now).usageCount(usageCount + 1).build();
    }

    public CertificateRecord markUploaded(String response) {
        return toBuilder().uploaded(true).providerResponse(response).providerError(null).build();
    }

    public CertificateRecord markUploadFailed(String error) {
        return toBuilder().uploaded(false).providerError(error).build();
    }

    public CertificateRecord deactivate() {
        return toBuilder().active(false).build();
    }

    public CertificateRecord withEncryption(EncryptedBundle bundle) {
        return toBuilder().encryption(bundle).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .tenantId(tenantId)
            .serialNumber(serialNumber)
            .subjectName(subjectName)
            .issuerName(issuerName)
            .issuerOrganization(issuerOrganization)
            .taxId(taxId)
            .validFrom(validFrom)
            .validTo(validTo)
            .encryption(encryption)
            .active(active)
            .validated(validated)
            .uploaded(uploaded)
            .providerResponse(providerResponse)
            .providerError(providerError)
            .lastUsed(lastUsed)
            .usageCount(usageCount)
            .createdAt(createdAt);
    }

    @Override
    public String toString() {
        return "CertificateRecord{" +
               "id='" + id + '\'' +
               ", tenantId='" + tenantId + '\'' +
               ", serialNumber='" + serialNumber + '\'' +
               ", taxId='" + taxId + '\'' +
               ", validTo=" + validTo +
               ", active=" + active +
               ", uploaded=" + uploaded +
               '}';
    }

    public static class Builder {
        private String id;
        private String tenantId;
        private String serialNumber;
        private String subjectName;
        private String issuerName;
        private String issuerOrganization;
        private String taxId;
        private Instant validFrom;
        private Instant validTo;
        private EncryptedBundle encryption;
        private boolean active = true;
        private boolean validated;
        private boolean uploaded;
        private String providerResponse;
        private String providerError;
        private Instant lastUsed;
        private long usageCount;
        private Instant createdAt;

        public Builder id(String id) { this.id = id; return this; }
        public Builder tenantId(String tenantId) { this.tenantId = tenantId; return this; }
        public Builder serialNumber(String serialNumber) { this.serialNumber = serialNumber; return this; }
        public Builder subjectName(String subjectName) { this.subjectName = subjectName; return this; }
        public Builder issuerName(String issuerName) { this.issuerName = issuerName; return this; }
        public Builder issuerOrganization(String issuerOrganization) { this.issuerOrganization = issuerOrganization; return this; }
        public Builder taxId(String taxId) { this.taxId = taxId; return this; }
        public Builder validFrom(Instant validFrom) { this.validFrom = validFrom; return this; }
        public Builder validTo(Instant validTo) { this.validTo = validTo; return this; }
        public Builder encryption(EncryptedBundle encryption) { this.encryption = encryption; return this; }
        public Builder active(boolean active) { this.active = active; return this; }
        public Builder validated(boolean validated) { this.validated = validated; return this; }
        public Builder uploaded(boolean uploaded) { this.uploaded = uploaded; return this; }
        public Builder providerResponse(String providerResponse) { this.providerResponse = providerResponse; return this; }
        public Builder providerError(String providerError) { this.providerError = providerError; return this; }
        public Builder lastUsed(Instant lastUsed) { this.lastUsed = lastUsed; return this; }
        public Builder usageCount(long usageCount) { this.usageCount = usageCount; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }

        public CertificateRecord build() {
            return new CertificateRecord(this);
        }
    }
}
