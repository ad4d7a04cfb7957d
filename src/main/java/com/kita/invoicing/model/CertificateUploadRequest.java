package com.kita.invoicing.model;

import java.util.Objects;

/**
 * Certificate onboarding input
 */
public final class CertificateUploadRequest {

    private final String tenantId;
    private final byte[] certificateBytes;
    private final byte[] privateKeyBytes;
    private final String passphrase;
    private final String expectedTaxId;
    private final String expectedLegalName;

    private CertificateUploadRequest(Builder builder) {
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId is required");
        this.certificateBytes = Objects.requireNonNull(builder.certificateBytes, "certificateBytes is required");
        this.privateKeyBytes = Objects.requireNonNull(builder.privateKeyBytes, "privateKeyBytes is required");
        this.passphrase = builder.passphrase != null ? builder.passphrase : "";
        this.expectedTaxId = builder.expectedTaxId;
        this.expectedLegalName = builder.expectedLegalName;
    }

    public String getTenantId() {
        return tenantId;
    }

    public byte[] getCertificateBytes() {
        return certificateBytes.clone();
    }

    public byte[] getPrivateKeyBytes() {
        return privateKeyBytes.clone();
    }

    public String getPassphrase() {
        return passphrase;
    }

    public String getExpectedTaxId() {
        return expectedTaxId;
    }

    public String getExpectedLegalName() {
        return expectedLegalName;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "CertificateUploadRequest{tenantId='" + tenantId + "', expectedTaxId='" + expectedTaxId + "'}";
    }

    public static class Builder {
        private String tenantId;
        private byte[] certificateBytes;
        private byte[] privateKeyBytes;
        private String passphrase;
        private String expectedTaxId;
        private String expectedLegalName;

        public Builder tenantId(String tenantId) { this.tenantId = tenantId; return this; }
        public Builder certificateBytes(byte[] certificateBytes) { this.certificateBytes = certificateBytes.clone(); return this; }
        public Builder privateKeyBytes(byte[] privateKeyBytes) { this.privateKeyBytes = privateKeyBytes.clone(); return this; }
        public Builder passphrase(String passphrase) { this.passphrase = passphrase; return this; }
        public Builder expectedTaxId(String expectedTaxId) { this.expectedTaxId = expectedTaxId; return this; }
        public Builder expectedLegalName(String expectedLegalName) { this.expectedLegalName = expectedLegalName; return this; }

        public CertificateUploadRequest build() {
            return new CertificateUploadRequest(this);
        }
    }
}
