package com.kita.invoicing.crypto;

import com.kita.invoicing.exception.DecryptionException;
import com.kita.invoicing.model.CertificateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Envelope encryption for certificate material at rest
 *
 * <p>Each record gets a fresh random 256-bit data key (DEK). The certificate,
 * private key and passphrase are encrypted under the DEK with AES-256-GCM.
 * The DEK itself is wrapped with AES-256-GCM under a key-encryption key (KEK)
 * derived from the current master secret with PBKDF2-HMAC-SHA256.
 *
 * <p>Ciphertext layout for every field is base64 of
 * {@code nonce(12) || ciphertext || tag(16)}.
 */
public class EnvelopeEncryptionService {

    private static final Logger logger = LoggerFactory.getLogger(EnvelopeEncryptionService.class);

    /** Salt for KEK derivation, shared by every stored record */
    static final byte[] KEK_SALT = "kita_salt_2024".getBytes(StandardCharsets.UTF_8);

    /** PBKDF2 iterations */
    static final int KEK_ITERATIONS = 100000;

    /** AES key length in bytes */
    private static final int KEY_LENGTH = 32;

    /** GCM nonce length in bytes */
    private static final int NONCE_LENGTH = 12;

    /** GCM authentication tag length in bits */
    private static final int GCM_TAG_LENGTH = 128;

    private static final String GENERIC_FAILURE = "Stored certificate material could not be decrypted";

    private final MasterKeyRing keyRing;
    private final SecureRandom secureRandom;
    private final Map<String, DerivedKek> kekCache = new ConcurrentHashMap<>();

    public EnvelopeEncryptionService(MasterKeyRing keyRing) {
        this(keyRing, new SecureRandom());
    }

    EnvelopeEncryptionService(MasterKeyRing keyRing, SecureRandom secureRandom) {
        this.keyRing = keyRing;
        this.secureRandom = secureRandom;
    }

    /**
     * Encrypt a certificate, its private key and passphrase under a fresh data key
     *
     * @param certificateBytes certificate file contents
     * @param privateKeyBytes private key file contents
     * @param passphrase private key passphrase
     * @return bundle wrapped under the current master secret
     */
    public EncryptedBundle encrypt(byte[] certificateBytes, byte[] privateKeyBytes, String passphrase) {
        byte[] dek = new byte[KEY_LENGTH];
        secureRandom.nextBytes(dek);
        try {
            SecretKey dataKey = new SecretKeySpec(dek, "AES");
            String keyId = keyRing.getCurrentKeyId();
            SecretKey kek = kekFor(keyId, keyRing.currentSecret());

            String certificate = seal(dataKey, certificateBytes);
            String privateKey = seal(dataKey, privateKeyBytes);
            String pass = seal(dataKey, (passphrase != null ? passphrase : "").getBytes(StandardCharsets.UTF_8));
            String wrapped = seal(kek, dek);

            return new EncryptedBundle(certificate, privateKey, pass, wrapped, keyId);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption is unavailable", e);
        } finally {
            Arrays.fill(dek, (byte) 0);
        }
    }

    /**
     * Decrypt a stored record
     *
     * @param record certificate record
     * @return plaintext material
     * @throws DecryptionException on any failure
     */
    public DecryptedBundle decrypt(CertificateRecord record) {
        return decrypt(record.getEncryption());
    }

    /**
     * Decrypt a bundle with the master secret named by its key id
     *
     * @param bundle encrypted bundle
     * @return plaintext material
     * @throws DecryptionException on any failure
     */
    public DecryptedBundle decrypt(EncryptedBundle bundle) {
        byte[] dek = unwrap(bundle);
        try {
            SecretKey dataKey = new SecretKeySpec(dek, "AES");
            return new DecryptedBundle(
                toPayload(open(dataKey, bundle.getCertificateCiphertext())),
                toPayload(open(dataKey, bundle.getPrivateKeyCiphertext())),
                toPayload(open(dataKey, bundle.getPassphraseCiphertext()))
            );
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            logger.warn("Payload decryption failed for key id {}", bundle.getKeyId());
            throw new DecryptionException(GENERIC_FAILURE, e);
        } finally {
            Arrays.fill(dek, (byte) 0);
        }
    }

    public MasterKeyRing getKeyRing() {
        return keyRing;
    }

    /**
     * Whether the bundle's data key is wrapped under a non-current secret
     */
    public boolean needsRewrap(EncryptedBundle bundle) {
        return !keyRing.isCurrent(bundle.getKeyId());
    }

    public boolean needsRewrap(CertificateRecord record) {
        return needsRewrap(record.getEncryption());
    }

    /**
     * Re-wrap the data key under the current master secret
     *
     * <p>Payload ciphertexts are returned unchanged.
     *
     * @param bundle bundle wrapped under any known secret
     * @return bundle wrapped under the current secret
     * @throws DecryptionException if the old wrapping cannot be opened
     */
    public EncryptedBundle rewrap(EncryptedBundle bundle) {
        if (!needsRewrap(bundle)) {
            return bundle;
        }
        byte[] dek = unwrap(bundle);
        try {
            String keyId = keyRing.getCurrentKeyId();
            String wrapped = seal(kekFor(keyId, keyRing.currentSecret()), dek);
            logger.info("Rewrapped data key from {} to {}", bundle.getKeyId(), keyId);
            return bundle.withWrappedKey(wrapped, keyId);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption is unavailable", e);
        } finally {
            Arrays.fill(dek, (byte) 0);
        }
    }

    private byte[] unwrap(EncryptedBundle bundle) {
        String secret = keyRing.secretFor(bundle.getKeyId())
            .orElseThrow(() -> {
                logger.warn("No master secret configured for key id {}", bundle.getKeyId());
                return new DecryptionException(GENERIC_FAILURE);
            });
        try {
            byte[] dek = open(kekFor(bundle.getKeyId(), secret), bundle.getWrappedKey());
            if (dek.length != KEY_LENGTH) {
                throw new DecryptionException(GENERIC_FAILURE);
            }
            return dek;
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            logger.warn("Data key unwrap failed for key id {}", bundle.getKeyId());
            throw new DecryptionException(GENERIC_FAILURE, e);
        }
    }

    /**
     * Derived key for a key id, derived again when the id's secret changed
     */
    private SecretKey kekFor(String keyId, String secret) {
        DerivedKek cached = kekCache.get(keyId);
        if (cached != null && cached.secret.equals(secret)) {
            return cached.key;
        }
        DerivedKek derived = new DerivedKek(secret, deriveKek(secret));
        kekCache.put(keyId, derived);
        return derived.key;
    }

    private SecretKey deriveKek(String secret) {
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
            PBEKeySpec spec = new PBEKeySpec(secret.toCharArray(), KEK_SALT, KEK_ITERATIONS, KEY_LENGTH * 8);
            try {
                return new SecretKeySpec(factory.generateSecret(spec).getEncoded(), "AES");
            } finally {
                spec.clearPassword();
            }
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("PBKDF2WithHmacSHA256 is unavailable", e);
        }
    }

    private String seal(SecretKey key, byte[] plaintext) throws GeneralSecurityException {
        byte[] nonce = new byte[NONCE_LENGTH];
        secureRandom.nextBytes(nonce);

        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, nonce));
        byte[] ciphertext = cipher.doFinal(plaintext);

        byte[] out = new byte[NONCE_LENGTH + ciphertext.length];
        System.arraycopy(nonce, 0, out, 0, NONCE_LENGTH);
        System.arraycopy(ciphertext, 0, out, NONCE_LENGTH, ciphertext.length);
        return Base64.getEncoder().encodeToString(out);
    }

    private byte[] open(SecretKey key, String encoded) throws GeneralSecurityException {
        byte[] data = Base64.getDecoder().decode(encoded);
        if (data.length < NONCE_LENGTH + GCM_TAG_LENGTH / 8) {
            throw new IllegalArgumentException("ciphertext too short");
        }
        Cipher cipher = Cipher.getInstance("AES/GCM/NoPadding");
        cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH, data, 0, NONCE_LENGTH));
        return cipher.doFinal(data, NONCE_LENGTH, data.length - NONCE_LENGTH);
    }

    private DecryptedBundle.Payload toPayload(byte[] raw) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = decoder.decode(ByteBuffer.wrap(raw)).toString();
            return DecryptedBundle.Payload.text(raw, text);
        } catch (CharacterCodingException e) {
            return DecryptedBundle.Payload.binary(raw);
        }
    }

    private static final class DerivedKek {
        private final String secret;
        private final SecretKey key;

        private DerivedKek(String secret, SecretKey key) {
            this.secret = secret;
            this.key = key;
        }
    }
}
