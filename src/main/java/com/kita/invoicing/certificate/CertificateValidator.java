package com.kita.invoicing.certificate;

import com.kita.invoicing.config.InvoicingConfig;
import com.kita.invoicing.config.InvoicingConfigConstants;
import com.kita.invoicing.exception.CertificateValidationException;
import com.kita.invoicing.exception.CertificateValidationException.CertificateErrorCode;
import com.kita.invoicing.identity.IdentityMatcher;
import com.kita.invoicing.model.TaxId;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validates SAT signing certificates (CSD) before they are stored
 *
 * <p>Checks, in order: private key decryption, key/certificate pairing, tax id,
 * legal name, issuer trust and validity window. The first failing check is
 * raised as a {@link CertificateValidationException} with a user-safe message.
 */
public class CertificateValidator {

    private static final Logger logger = LoggerFactory.getLogger(CertificateValidator.class);

    private static final DateTimeFormatter EXPIRY_FORMAT =
        DateTimeFormatter.ofPattern("dd/MM/yyyy").withZone(ZoneOffset.UTC);

    private static final Pattern BASE64_BODY = Pattern.compile("^[A-Za-z0-9+/=\\s]+$");

    private static final ASN1ObjectIdentifier[] TAX_ID_ATTRIBUTES = {
        BCStyle.SERIALNUMBER,      // 2.5.4.5
        BCStyle.UNIQUE_IDENTIFIER  // 2.5.4.45
    };

    private final IdentityMatcher identityMatcher;
    private final PrivateKeyLoader privateKeyLoader;
    private final List<String> trustedIssuers;
    private final Clock clock;

    public CertificateValidator(InvoicingConfig config) {
        this(new IdentityMatcher(config.getNameMatchThreshold()), new PrivateKeyLoader(),
            config.getTrustedIssuers(), Clock.systemUTC());
    }

    public CertificateValidator(IdentityMatcher identityMatcher, PrivateKeyLoader privateKeyLoader,
                                List<String> trustedIssuers, Clock clock) {
        this.identityMatcher = identityMatcher;
        this.privateKeyLoader = privateKeyLoader;
        this.trustedIssuers = trustedIssuers != null
            ? List.copyOf(trustedIssuers)
            : InvoicingConfigConstants.DEFAULT_TRUSTED_ISSUERS;
        this.clock = clock;
    }

    /**
     * Parse a certificate from PEM, bare base64 or DER
     *
     * @param certificateBytes uploaded .cer contents
     * @return X.509 certificate
     * @throws CertificateValidationException with FORMAT if the bytes are not a certificate
     */
    public X509Certificate load(byte[] certificateBytes) {
        if (certificateBytes == null || certificateBytes.length == 0) {
            throw new CertificateValidationException(CertificateErrorCode.FORMAT);
        }
        try {
            byte[] data = normalizeCertificateData(certificateBytes);
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(data));
        } catch (CertificateException | IllegalArgumentException e) {
            logger.info("Certificate upload could not be parsed: {}", e.getClass().getSimpleName());
            throw new CertificateValidationException(CertificateErrorCode.FORMAT,
                CertificateErrorCode.FORMAT.getDefaultMessage(), e);
        }
    }

    /**
     * Wrap bare base64 in PEM armor; leave PEM and DER untouched
     */
    private byte[] normalizeCertificateData(byte[] bytes) {
        if (bytes[0] == 0x30) {
            return bytes;
        }
        String text = new String(bytes, StandardCharsets.US_ASCII).trim();
        if (text.contains("-----BEGIN")) {
            return text.getBytes(StandardCharsets.US_ASCII);
        }
        if (BASE64_BODY.matcher(text).matches()) {
            return Base64.getMimeDecoder().decode(text);
        }
        return bytes;
    }

    /**
     * Read identity fields from a certificate
     *
     * @param certificate parsed certificate
     * @return identity
     */
    public CertificateIdentity extractIdentity(X509Certificate certificate) {
        X500Name subject = X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded());
        X500Name issuer = X500Name.getInstance(certificate.getIssuerX500Principal().getEncoded());

        return new CertificateIdentity(
            certificate.getSerialNumber().toString(16).toUpperCase(Locale.ROOT),
            firstValue(subject, BCStyle.CN),
            firstValue(issuer, BCStyle.CN),
            firstValue(issuer, BCStyle.O),
            extractTaxId(subject),
            certificate.getNotBefore().toInstant(),
            certificate.getNotAfter().toInstant()
        );
    }

    /**
     * SAT certificates carry "RFC / CURP" in the serialNumber or
     * x500UniqueIdentifier attribute; the first well-formed RFC token wins.
     */
    private String extractTaxId(X500Name subject) {
        for (ASN1ObjectIdentifier attribute : TAX_ID_ATTRIBUTES) {
            String value = firstValue(subject, attribute);
            if (value == null) {
                continue;
            }
            String candidate = value.split("/")[0].trim();
            if (!candidate.isEmpty()) {
                candidate = candidate.split("\\s+")[0];
            }
            if (TaxId.isValid(candidate)) {
                return TaxId.normalize(candidate);
            }
        }
        return null;
    }

    private String firstValue(X500Name name, ASN1ObjectIdentifier attribute) {
        RDN[] rdns = name.getRDNs(attribute);
        if (rdns.length == 0 || rdns[0].getFirst() == null) {
            return null;
        }
        return IETFUtils.valueToString(rdns[0].getFirst().getValue()).trim();
    }

    /**
     * Run every check on an uploaded certificate and key
     *
     * @param certificateBytes uploaded .cer contents
     * @param privateKeyBytes uploaded .key contents
     * @param passphrase key passphrase
     * @param expectedTaxId tenant's registered RFC, may be null
     * @param expectedLegalName tenant's registered legal name, may be null
     * @return validated certificate with its original bytes
     * @throws CertificateValidationException on the first failed check
     */
    public ValidatedCertificate validate(byte[] certificateBytes, byte[] privateKeyBytes, String passphrase,
                                         String expectedTaxId, String expectedLegalName) {
        X509Certificate certificate = load(certificateBytes);
        CertificateIdentity identity = extractIdentity(certificate);

        PrivateKey privateKey = privateKeyLoader.load(privateKeyBytes, passphrase);
        verifyKeyPair(privateKey, certificate.getPublicKey());

        verifyTaxId(identity, expectedTaxId);
        verifyLegalName(identity, expectedLegalName);
        verifyIssuer(identity);
        verifyValidity(identity);

        logger.info("Certificate {} validated for RFC {}", identity.getSerialNumber(), identity.getTaxId());
        return new ValidatedCertificate(identity, certificate, certificateBytes, privateKeyBytes, passphrase);
    }

    /**
     * Sign-and-verify challenge proving the key belongs to the certificate
     */
    void verifyKeyPair(PrivateKey privateKey, PublicKey publicKey) {
        String algorithm = "EC".equals(privateKey.getAlgorithm()) ? "SHA256withECDSA" : "SHA256withRSA";
        byte[] challenge = new byte[32];
        new SecureRandom().nextBytes(challenge);
        try {
            Signature signer = Signature.getInstance(algorithm);
            signer.initSign(privateKey);
            signer.update(challenge);
            byte[] signature = signer.sign();

            Signature verifier = Signature.getInstance(algorithm);
            verifier.initVerify(publicKey);
            verifier.update(challenge);
            if (!verifier.verify(signature)) {
                throw new CertificateValidationException(CertificateErrorCode.KEY_MISMATCH);
            }
        } catch (GeneralSecurityException e) {
            throw new CertificateValidationException(CertificateErrorCode.KEY_MISMATCH,
                CertificateErrorCode.KEY_MISMATCH.getDefaultMessage(), e);
        }
    }

    private void verifyTaxId(CertificateIdentity identity, String expectedTaxId) {
        String expected = TaxId.normalize(expectedTaxId);
        String actual = TaxId.normalize(identity.getTaxId());
        if (actual == null) {
            logger.warn("Certificate {} carries no RFC; skipping tax id check", identity.getSerialNumber());
            return;
        }
        if (expected != null && !expected.equals(actual)) {
            throw new CertificateValidationException(CertificateErrorCode.TAX_ID_MISMATCH,
                String.format("The certificate RFC (%s) does not match the company RFC (%s).", actual, expected));
        }
    }

    private void verifyLegalName(CertificateIdentity identity, String expectedLegalName) {
        if (expectedLegalName == null || expectedLegalName.isBlank() || identity.getSubjectName() == null) {
            return;
        }
        double score = identityMatcher.similarity(identity.getSubjectName(), expectedLegalName);
        if (score < identityMatcher.getThreshold()) {
            logger.info("Legal name similarity {} below threshold {}", score, identityMatcher.getThreshold());
            throw new CertificateValidationException(CertificateErrorCode.NAME_MISMATCH,
                String.format("The certificate name (%s) does not match the registered legal name (%s).",
                    identity.getSubjectName(), expectedLegalName));
        }
    }

    private void verifyIssuer(CertificateIdentity identity) {
        String issuer = identity.issuerDescription().toUpperCase(Locale.ROOT);
        for (String fragment : trustedIssuers) {
            if (issuer.contains(fragment.toUpperCase(Locale.ROOT))) {
                return;
            }
        }
        logger.info("Untrusted certificate issuer: {}", identity.issuerDescription());
        throw new CertificateValidationException(CertificateErrorCode.UNTRUSTED_ISSUER);
    }

    private void verifyValidity(CertificateIdentity identity) {
        Instant now = clock.instant();
        if (!identity.getValidTo().isAfter(now)) {
            throw new CertificateValidationException(CertificateErrorCode.EXPIRED,
                "The certificate expired on " + EXPIRY_FORMAT.format(identity.getValidTo()) + ".");
        }
        if (identity.getValidFrom().isAfter(now)) {
            throw new CertificateValidationException(CertificateErrorCode.NOT_YET_VALID,
                "The certificate is not valid until " + EXPIRY_FORMAT.format(identity.getValidFrom()) + ".");
        }
    }

    /**
     * Issuer fragments accepted as trusted
     */
    public List<String> getTrustedIssuers() {
        return new ArrayList<>(trustedIssuers);
    }
}
