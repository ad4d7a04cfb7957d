package com.kita.invoicing.support;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import javax.crypto.Cipher;
import javax.crypto.EncryptedPrivateKeyInfo;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.PBEParameterSpec;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.AlgorithmParameters;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Date;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Generates SAT-style signing certificates and private keys for tests
 */
public final class TestCertificates {

    public static final String TAX_ID = "EKU9003173C9";
    public static final String LEGAL_NAME = "ESCUELA KEMPER URGATE SA DE CV";
    public static final String PASSWORD = "12345678a";
    public static final String SAT_ISSUER_CN = "AC UAT";
    public static final String SAT_ISSUER_ORG = "SERVICIO DE ADMINISTRACION TRIBUTARIA";

    private static final AtomicLong SERIAL_SEQUENCE = new AtomicLong(3416);
    private static final Object KEY_LOCK = new Object();
    private static KeyPair sharedKeyPair;

    private TestCertificates() {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Shared 2048-bit RSA key pair, generated once per test run
     */
    public static KeyPair sharedKeyPair() {
        synchronized (KEY_LOCK) {
            if (sharedKeyPair == null) {
                sharedKeyPair = newKeyPair();
            }
            return sharedKeyPair;
        }
    }

    public static KeyPair newKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
            generator.initialize(2048, new SecureRandom());
            return generator.generateKeyPair();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to generate RSA key pair", e);
        }
    }

    /**
     * Encrypts a private key as PKCS#8 DER, the way SAT ships its .key files
     */
    public static byte[] encryptPrivateKey(KeyPair keyPair, String password) {
        try {
            byte[] salt = new byte[8];
            new SecureRandom().nextBytes(salt);
            int iterationCount = 2048;

            PBEKeySpec pbeKeySpec = new PBEKeySpec(password.toCharArray());
            SecretKeyFactory keyFactory = SecretKeyFactory.getInstance("PBEWithSHA1AndDESede");
            SecretKey pbeKey = keyFactory.generateSecret(pbeKeySpec);

            PBEParameterSpec pbeParamSpec = new PBEParameterSpec(salt, iterationCount);
            Cipher cipher = Cipher.getInstance("PBEWithSHA1AndDESede");
            cipher.init(Cipher.ENCRYPT_MODE, pbeKey, pbeParamSpec);
            byte[] encrypted = cipher.doFinal(keyPair.getPrivate().getEncoded());

            AlgorithmParameters algParams = AlgorithmParameters.getInstance("PBEWithSHA1AndDESede");
            algParams.init(pbeParamSpec);

            return new EncryptedPrivateKeyInfo(algParams, encrypted).getEncoded();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to encrypt private key", e);
        }
    }

    /**
     * Converts a PKCS#8 RSA key into its PKCS#1 RSAPrivateKey structure
     */
    public static byte[] toPkcs1(KeyPair keyPair) {
        try {
            return PrivateKeyInfo.getInstance(keyPair.getPrivate().getEncoded())
                    .parsePrivateKey().toASN1Primitive().getEncoded();
        } catch (Exception e) {
            throw new IllegalStateException("Failed to convert key to PKCS#1", e);
        }
    }

    public static byte[] pem(String type, byte[] der) {
        String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                .encodeToString(der);
        String armored = "-----BEGIN " + type + "-----\n" + body + "\n-----END " + type + "-----\n";
        return armored.getBytes(StandardCharsets.US_ASCII);
    }

    /**
     * Certificate plus its key material in the encodings callers upload
     */
    public static final class Material {
        private final X509Certificate certificate;
        private final KeyPair keyPair;
        private final String password;

        private Material(X509Certificate certificate, KeyPair keyPair, String password) {
            this.certificate = certificate;
            this.keyPair = keyPair;
            this.password = password;
        }

        public X509Certificate getCertificate() {
            return certificate;
        }

        public KeyPair getKeyPair() {
            return keyPair;
        }

        public String getPassword() {
            return password;
        }

        public String getSerialHex() {
            return certificate.getSerialNumber().toString(16).toUpperCase();
        }

        public byte[] certificateDer() {
            try {
                return certificate.getEncoded();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to encode certificate", e);
            }
        }

        public byte[] certificatePem() {
            return pem("CERTIFICATE", certificateDer());
        }

        public byte[] encryptedKeyDer() {
            return encryptPrivateKey(keyPair, password);
        }

        public byte[] unencryptedKeyDer() {
            return keyPair.getPrivate().getEncoded();
        }
    }

    public static final class Builder {
        private String taxId = TAX_ID;
        private String legalName = LEGAL_NAME;
        private String issuerCn = SAT_ISSUER_CN;
        private String issuerOrg = SAT_ISSUER_ORG;
        private String password = PASSWORD;
        private Instant validFrom;
        private Instant validTo;
        private KeyPair keyPair;
        private BigInteger serial;

        public Builder taxId(String taxId) {
            this.taxId = taxId;
            return this;
        }

        public Builder legalName(String legalName) {
            this.legalName = legalName;
            return this;
        }

        public Builder issuer(String commonName, String organization) {
            this.issuerCn = commonName;
            this.issuerOrg = organization;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder validity(Instant validFrom, Instant validTo) {
            this.validFrom = validFrom;
            this.validTo = validTo;
            return this;
        }

        public Builder keyPair(KeyPair keyPair) {
            this.keyPair = keyPair;
            return this;
        }

        public Builder serial(BigInteger serial) {
            this.serial = serial;
            return this;
        }

        public Material build() {
            Instant now = Instant.now();
            Instant from = validFrom != null ? validFrom : now.minus(Duration.ofDays(30));
            Instant to = validTo != null ? validTo : now.plus(Duration.ofDays(4 * 365));
            KeyPair pair = keyPair != null ? keyPair : sharedKeyPair();
            BigInteger serialNumber = serial != null ? serial
                    : new BigInteger("3000100000050000" + String.format("%04d", SERIAL_SEQUENCE.incrementAndGet() % 10000), 16);

            X500NameBuilder subjectBuilder = new X500NameBuilder(BCStyle.INSTANCE)
                    .addRDN(BCStyle.CN, legalName)
                    .addRDN(BCStyle.O, legalName);
            if (taxId != null) {
                subjectBuilder.addRDN(BCStyle.SERIALNUMBER, taxId + " / VADA800927DJ3");
            }
            X500Name subject = subjectBuilder.build();
            X500Name issuer = new X500NameBuilder(BCStyle.INSTANCE)
                    .addRDN(BCStyle.CN, issuerCn)
                    .addRDN(BCStyle.O, issuerOrg)
                    .build();

            try {
                JcaX509v3CertificateBuilder certBuilder = new JcaX509v3CertificateBuilder(
                        issuer, serialNumber, Date.from(from), Date.from(to), subject, pair.getPublic());
                ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA").build(pair.getPrivate());
                X509CertificateHolder holder = certBuilder.build(signer);
                X509Certificate certificate = new JcaX509CertificateConverter().getCertificate(holder);
                return new Material(certificate, pair, password);
            } catch (Exception e) {
                throw new IllegalStateException("Failed to build test certificate", e);
            }
        }
    }
}
