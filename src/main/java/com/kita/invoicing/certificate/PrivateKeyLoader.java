package com.kita.invoicing.certificate;

import com.kita.invoicing.exception.CertificateValidationException;
import com.kita.invoicing.exception.CertificateValidationException.CertificateErrorCode;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.asn1.DERNull;
import org.bouncycastle.asn1.pkcs.EncryptedPrivateKeyInfo;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.pkcs.RSAPrivateKey;
import org.bouncycastle.asn1.x509.AlgorithmIdentifier;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JceOpenSSLPKCS8DecryptorProviderBuilder;
import org.bouncycastle.openssl.jcajce.JcePEMDecryptorProviderBuilder;
import org.bouncycastle.operator.InputDecryptorProvider;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.Provider;
import java.util.Locale;

/**
 * Loads SAT private keys (.key files)
 *
 * <p>Accepts DER or PEM, PKCS#8 encrypted or unencrypted, and traditional
 * OpenSSL PEM key pairs. The password-protected form is tried first; an
 * unencrypted structure is accepted whatever passphrase was supplied.
 * Every failure is raised as a {@link CertificateValidationException} through
 * {@link #translateKeyLoadFailure(Stage, Exception)}.
 */
public class PrivateKeyLoader {

    private static final Logger logger = LoggerFactory.getLogger(PrivateKeyLoader.class);

    private static final Provider BC = new BouncyCastleProvider();

    /**
     * Point at which key loading failed
     */
    public enum Stage {
        /** Reading the ASN.1 or PEM structure */
        PARSE,
        /** Decrypting with the passphrase */
        DECRYPT,
        /** Turning key info into a JCA key */
        CONVERT
    }

    /**
     * Load a private key
     *
     * @param keyBytes contents of the .key file
     * @param passphrase key passphrase, may be empty for unencrypted keys
     * @return private key
     * @throws CertificateValidationException with WRONG_PASSWORD, UNSUPPORTED_KEY_FORMAT or CORRUPT_KEY
     */
    public PrivateKey load(byte[] keyBytes, String passphrase) {
        if (keyBytes == null || keyBytes.length == 0) {
            throw new CertificateValidationException(CertificateErrorCode.CORRUPT_KEY);
        }
        char[] password = passphrase != null ? passphrase.toCharArray() : new char[0];

        Object structure;
        try {
            structure = isPem(keyBytes) ? readPem(keyBytes) : readDer(keyBytes);
        } catch (CertificateValidationException e) {
            throw e;
        } catch (Exception e) {
            throw translateKeyLoadFailure(Stage.PARSE, e);
        }

        PrivateKeyInfo keyInfo;
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        if (structure instanceof PKCS8EncryptedPrivateKeyInfo) {
            keyInfo = decrypt((PKCS8EncryptedPrivateKeyInfo) structure, password);
        } else if (structure instanceof PEMEncryptedKeyPair) {
            keyInfo = decrypt((PEMEncryptedKeyPair) structure, password);
        } else if (structure instanceof PEMKeyPair) {
            keyInfo = ((PEMKeyPair) structure).getPrivateKeyInfo();
        } else {
            keyInfo = (PrivateKeyInfo) structure;
        }

        try {
            return converter.getPrivateKey(keyInfo);
        } catch (Exception e) {
            throw translateKeyLoadFailure(Stage.CONVERT, e);
        }
    }

    private PrivateKeyInfo decrypt(PKCS8EncryptedPrivateKeyInfo encrypted, char[] password) {
        if (password.length == 0) {
            throw new CertificateValidationException(CertificateErrorCode.WRONG_PASSWORD);
        }
        try {
            InputDecryptorProvider decryptor = new JceOpenSSLPKCS8DecryptorProviderBuilder()
                .setProvider(BC)
                .build(password);
            return encrypted.decryptPrivateKeyInfo(decryptor);
        } catch (Exception e) {
            throw translateKeyLoadFailure(Stage.DECRYPT, e);
        }
    }

    private PrivateKeyInfo decrypt(PEMEncryptedKeyPair encrypted, char[] password) {
        if (password.length == 0) {
            throw new CertificateValidationException(CertificateErrorCode.WRONG_PASSWORD);
        }
        try {
            PEMKeyPair pair = encrypted.decryptKeyPair(new JcePEMDecryptorProviderBuilder()
                .setProvider(BC)
                .build(password));
            return pair.getPrivateKeyInfo();
        } catch (Exception e) {
            throw translateKeyLoadFailure(Stage.DECRYPT, e);
        }
    }

    private boolean isPem(byte[] bytes) {
        String head = new String(bytes, 0, Math.min(bytes.length, 4096), StandardCharsets.US_ASCII);
        return head.contains("-----BEGIN");
    }

    private Object readPem(byte[] bytes) throws IOException {
        try (PEMParser parser = new PEMParser(new StringReader(new String(bytes, StandardCharsets.US_ASCII)))) {
            Object entry = parser.readObject();
            if (entry == null) {
                throw new IOException("could not deserialize key data: no PEM object found");
            }
            if (entry instanceof PKCS8EncryptedPrivateKeyInfo
                    || entry instanceof PrivateKeyInfo
                    || entry instanceof PEMKeyPair
                    || entry instanceof PEMEncryptedKeyPair) {
                return entry;
            }
            logger.debug("Unexpected PEM object {} in private key upload", entry.getClass().getSimpleName());
            throw new CertificateValidationException(CertificateErrorCode.UNSUPPORTED_KEY_FORMAT);
        }
    }

    private Object readDer(byte[] bytes) throws IOException {
        ASN1Primitive primitive = ASN1Primitive.fromByteArray(bytes);
        if (!(primitive instanceof ASN1Sequence)) {
            throw new IOException("could not deserialize key data: not an ASN.1 sequence");
        }
        ASN1Sequence sequence = (ASN1Sequence) primitive;
        if (sequence.size() == 0) {
            throw new IOException("could not deserialize key data: empty sequence");
        }
        ASN1Encodable first = sequence.getObjectAt(0);
        if (first instanceof ASN1Sequence) {
            return new PKCS8EncryptedPrivateKeyInfo(EncryptedPrivateKeyInfo.getInstance(sequence));
        }
        if (first instanceof ASN1Integer) {
            if (sequence.size() >= 9) {
                // PKCS#1 RSAPrivateKey
                RSAPrivateKey rsa = RSAPrivateKey.getInstance(sequence);
                return new PrivateKeyInfo(
                    new AlgorithmIdentifier(PKCSObjectIdentifiers.rsaEncryption, DERNull.INSTANCE), rsa);
            }
            return PrivateKeyInfo.getInstance(sequence);
        }
        throw new CertificateValidationException(CertificateErrorCode.UNSUPPORTED_KEY_FORMAT);
    }

    /**
     * Map a key loading failure to a user-safe rejection
     *
     * @param stage where loading failed
     * @param e underlying failure
     * @return exception to throw
     */
    CertificateValidationException translateKeyLoadFailure(Stage stage, Exception e) {
        String message = messageChain(e);
        CertificateErrorCode code;

        if (stage == Stage.DECRYPT || message.contains("bad decrypt") || message.contains("incorrect")
                || message.contains("pad block corrupted")) {
            code = CertificateErrorCode.WRONG_PASSWORD;
        } else if (e instanceof NoSuchAlgorithmException || message.contains("unsupported")
                || message.contains("unknown algorithm") || message.contains("no such algorithm")
                || message.contains("not supported") || stage == Stage.CONVERT) {
            code = CertificateErrorCode.UNSUPPORTED_KEY_FORMAT;
        } else {
            code = CertificateErrorCode.CORRUPT_KEY;
        }

        logger.info("Private key rejected at {} stage: {} ({})", stage, code, e.getClass().getSimpleName());
        return new CertificateValidationException(code, code.getDefaultMessage(), e);
    }

    private String messageChain(Throwable e) {
        StringBuilder sb = new StringBuilder();
        Throwable current = e;
        int depth = 0;
        while (current != null && depth < 5) {
            if (current.getMessage() != null) {
                sb.append(current.getMessage()).append(' ');
            }
            current = current.getCause();
            depth++;
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
