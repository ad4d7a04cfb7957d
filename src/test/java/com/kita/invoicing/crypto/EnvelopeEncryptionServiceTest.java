package com.kita.invoicing.crypto;

import com.kita.invoicing.exception.DecryptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for EnvelopeEncryptionService
 */
class EnvelopeEncryptionServiceTest {

    private static final String SECRET_1 = "first-master-secret-0123456789";
    private static final String SECRET_2 = "second-master-secret-9876543210";

    private static final byte[] CERTIFICATE = "-----BEGIN CERTIFICATE-----\nMIIF\n-----END CERTIFICATE-----"
        .getBytes(StandardCharsets.UTF_8);
    private static final byte[] DER_KEY = {0x30, (byte) 0x82, 0x04, (byte) 0xC3, (byte) 0xFF, 0x00, 0x28};

    private MasterKeyRing ring;
    private EnvelopeEncryptionService service;

    @BeforeEach
    void setUp() {
        ring = new MasterKeyRing("k1", SECRET_1, "k2", SECRET_2);
        service = new EnvelopeEncryptionService(ring);
    }

    private String tamper(String base64) {
        byte[] data = Base64.getDecoder().decode(base64);
        data[data.length - 1] ^= 0x01;
        return Base64.getEncoder().encodeToString(data);
    }

    @Nested
    @DisplayName("encrypt and decrypt")
    class EncryptDecrypt {

        @Test
        @DisplayName("should recover text and binary payloads")
        void shouldRecoverPayloads() {
            EncryptedBundle bundle = service.encrypt(CERTIFICATE, DER_KEY, "12345678a");

            DecryptedBundle decrypted = service.decrypt(bundle);

            assertFalse(decrypted.getCertificate().isBinary());
            assertEquals(new String(CERTIFICATE, StandardCharsets.UTF_8), decrypted.getCertificate().getText());
            assertTrue(decrypted.getPrivateKey().isBinary());
            assertArrayEquals(DER_KEY, decrypted.getPrivateKey().getRaw());
            assertEquals("12345678a", decrypted.getPassphrase().getText());
            assertEquals(Base64.getEncoder().encodeToString(DER_KEY), decrypted.getPrivateKey().toBase64());
        }

        @Test
        @DisplayName("should wrap under the current key id")
        void shouldUseCurrentKeyId() {
            EncryptedBundle bundle = service.encrypt(CERTIFICATE, DER_KEY, "pass");

            assertEquals("k1", bundle.getKeyId());
            assertFalse(service.needsRewrap(bundle));
        }

        @Test
        @DisplayName("should produce different ciphertexts for the same input")
        void shouldUseFreshDataKeys() {
            EncryptedBundle first = service.encrypt(CERTIFICATE, DER_KEY, "pass");
            EncryptedBundle second = service.encrypt(CERTIFICATE, DER_KEY, "pass");

            assertNotEquals(first.getCertificateCiphertext(), second.getCertificateCiphertext());
            assertNotEquals(first.getWrappedKey(), second.getWrappedKey());
        }

        @Test
        @DisplayName("should not expose plaintext in toString")
        void shouldRedactToString() {
            DecryptedBundle decrypted = service.decrypt(service.encrypt(CERTIFICATE, DER_KEY, "12345678a"));

            assertFalse(decrypted.toString().contains("12345678a"));
        }
    }

    @Nested
    @DisplayName("decryption failures")
    class Failures {

        @Test
        @DisplayName("should reject a tampered payload")
        void shouldRejectTamperedPayload() {
            EncryptedBundle bundle = service.encrypt(CERTIFICATE, DER_KEY, "pass");
            EncryptedBundle tampered = new EncryptedBundle(bundle.getCertificateCiphertext(),
                tamper(bundle.getPrivateKeyCiphertext()), bundle.getPassphraseCiphertext(),
                bundle.getWrappedKey(), bundle.getKeyId());

            DecryptionException error = assertThrows(DecryptionException.class, () -> service.decrypt(tampered));
            assertEquals("DECRYPTION_ERROR", error.getCode());
        }

        @Test
        @DisplayName("should reject a tampered wrapped key")
        void shouldRejectTamperedWrappedKey() {
            EncryptedBundle bundle = service.encrypt(CERTIFICATE, DER_KEY, "pass");
            EncryptedBundle tampered = bundle.withWrappedKey(tamper(bundle.getWrappedKey()), bundle.getKeyId());

            assertThrows(DecryptionException.class, () -> service.decrypt(tampered));
        }

        @Test
        @DisplayName("should fail with a different master secret")
        void shouldFailWithWrongSecret() {
            EncryptedBundle bundle = service.encrypt(CERTIFICATE, DER_KEY, "pass");
            EnvelopeEncryptionService other = new EnvelopeEncryptionService(
                new MasterKeyRing("k1", "an-unrelated-secret-000000"));

            DecryptionException error = assertThrows(DecryptionException.class, () -> other.decrypt(bundle));
            assertFalse(error.getMessage().contains(SECRET_1));
        }

        @Test
        @DisplayName("should fail for an unknown key id")
        void shouldFailForUnknownKeyId() {
            EncryptedBundle bundle = service.encrypt(CERTIFICATE, DER_KEY, "pass");
            EncryptedBundle relabeled = bundle.withWrappedKey(bundle.getWrappedKey(), "k9");

            assertThrows(DecryptionException.class, () -> service.decrypt(relabeled));
        }
    }

    @Nested
    @DisplayName("rotation")
    class Rotation {

        @Test
        @DisplayName("should rewrap only the data key after rotation")
        void shouldRewrapAfterRotation() {
            EncryptedBundle bundle = service.encrypt(CERTIFICATE, DER_KEY, "pass");

            ring.rotate();
            assertTrue(service.needsRewrap(bundle));
            EncryptedBundle rewrapped = service.rewrap(bundle);

            assertEquals("k2", rewrapped.getKeyId());
            assertEquals(bundle.getCertificateCiphertext(), rewrapped.getCertificateCiphertext());
            assertEquals(bundle.getPrivateKeyCiphertext(), rewrapped.getPrivateKeyCiphertext());
            assertEquals(bundle.getPassphraseCiphertext(), rewrapped.getPassphraseCiphertext());
            assertNotEquals(bundle.getWrappedKey(), rewrapped.getWrappedKey());
            assertFalse(service.needsRewrap(rewrapped));
            assertArrayEquals(DER_KEY, service.decrypt(rewrapped).getPrivateKey().getRaw());
        }

        @Test
        @DisplayName("should still decrypt bundles wrapped by the retired key")
        void shouldDecryptRetiredKeyBundles() {
            EncryptedBundle bundle = service.encrypt(CERTIFICATE, DER_KEY, "pass");

            ring.rotate();

            assertEquals("pass", service.decrypt(bundle).getPassphrase().getText());
        }

        @Test
        @DisplayName("should return current bundles unchanged")
        void shouldKeepCurrentBundles() {
            EncryptedBundle bundle = service.encrypt(CERTIFICATE, DER_KEY, "pass");

            assertSame(bundle, service.rewrap(bundle));
        }

        @Test
        @DisplayName("should decrypt bundles wrapped by the next key before rotation")
        void shouldDecryptNextKeyBundles() {
            EnvelopeEncryptionService writer = new EnvelopeEncryptionService(new MasterKeyRing("k2", SECRET_2));
            EncryptedBundle bundle = writer.encrypt(CERTIFICATE, DER_KEY, "pass");

            assertEquals("pass", service.decrypt(bundle).getPassphrase().getText());
        }

        @Test
        @DisplayName("should decrypt after a restart with the old key configured as retired")
        void shouldDecryptWithConfiguredRetiredKey() {
            EncryptedBundle bundle = service.encrypt(CERTIFICATE, DER_KEY, "pass");
            ring.rotate();

            MasterKeyRing restartedRing = new MasterKeyRing("k2", SECRET_2).addRetired("k1", SECRET_1);
            EnvelopeEncryptionService restarted = new EnvelopeEncryptionService(restartedRing);

            assertTrue(restarted.needsRewrap(bundle));
            assertEquals("pass", restarted.decrypt(bundle).getPassphrase().getText());
            assertEquals("k2", restarted.rewrap(bundle).getKeyId());
        }

        @Test
        @DisplayName("should derive a new wrapping key when a key id's secret changes")
        void shouldNotReuseKeyForChangedSecret() {
            // equal String.hashCode, different secrets
            String original = "AaAaAaAaAaAaAaAaAa";
            String replacement = "BBBBBBBBBBBBBBBBBB";
            assertEquals(original.hashCode(), replacement.hashCode());
            MasterKeyRing keys = new MasterKeyRing("k1", original, "k2", SECRET_2);
            EnvelopeEncryptionService encryption = new EnvelopeEncryptionService(keys);
            EncryptedBundle bundle = encryption.encrypt(CERTIFICATE, DER_KEY, "pass");

            keys.rotate();
            keys.addRetired("k1", replacement);

            assertThrows(DecryptionException.class, () -> encryption.decrypt(bundle));
        }
    }
}
