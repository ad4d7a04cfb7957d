package com.kita.invoicing.certificate;

import java.security.cert.X509Certificate;

/**
 * A certificate and private key pair that passed every validation check,
 * together with the original uploaded bytes
 */
public final class ValidatedCertificate {

    private final CertificateIdentity identity;
    private final X509Certificate certificate;
    private final byte[] certificateBytes;
    private final byte[] privateKeyBytes;
    private final String passphrase;

    public ValidatedCertificate(CertificateIdentity identity, X509Certificate certificate,
                                byte[] certificateBytes, byte[] privateKeyBytes, String passphrase) {
        this.identity = identity;
        this.certificate = certificate;
        this.certificateBytes = certificateBytes.clone();
        this.privateKeyBytes = privateKeyBytes.clone();
        this.passphrase = passphrase;
    }

    public CertificateIdentity getIdentity() {
        return identity;
    }

    public X509Certificate getCertificate() {
        return certificate;
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

    @Override
    public String toString() {
        return "ValidatedCertificate{" + identity + '}';
    }
}
