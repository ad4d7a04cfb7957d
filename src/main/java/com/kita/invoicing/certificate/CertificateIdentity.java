package com.kita.invoicing.certificate;

import java.time.Instant;

/**
 * Identity fields read from an X.509 certificate
 */
public final class CertificateIdentity {

    private final String serialNumber;
    private final String subjectName;
    private final String issuerName;
    private final String issuerOrganization;
    private final String taxId;
    private final Instant validFrom;
    private final Instant validTo;

    public CertificateIdentity(String serialNumber, String subjectName, String issuerName,
                               String issuerOrganization, String taxId, Instant validFrom, Instant validTo) {
        this.serialNumber = serialNumber;
        this.subjectName = subjectName;
        this.issuerName = issuerName;
        this.issuerOrganization = issuerOrganization;
        this.taxId = taxId;
        this.validFrom = validFrom;
        this.validTo = validTo;
    }

    /**
     * Serial number in upper-case hex
     */
    public String getSerialNumber() {
        return serialNumber;
    }

    /**
     * Subject common name, the taxpayer's legal name on SAT certificates
     */
    public String getSubjectName() {
        return subjectName;
    }

    public String getIssuerName() {
        return issuerName;
    }

    public String getIssuerOrganization() {
        return issuerOrganization;
    }

    /**
     * RFC carried by the certificate, or null
     */
    public String getTaxId() {
        return taxId;
    }

    public Instant getValidFrom() {
        return validFrom;
    }

    public Instant getValidTo() {
        return validTo;
    }

    /**
     * Issuer CN and O joined by a space, as matched against trusted issuers
     */
    public String issuerDescription() {
        StringBuilder sb = new StringBuilder();
        if (issuerName != null) {
            sb.append(issuerName);
        }
        if (issuerOrganization != null) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(issuerOrganization);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "CertificateIdentity{serialNumber='" + serialNumber + "', subjectName='" + subjectName +
               "', taxId='" + taxId + "', validTo=" + validTo + '}';
    }
}
