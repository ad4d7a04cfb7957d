package com.kita.invoicing.crypto;

import com.kita.invoicing.config.InvoicingConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MasterKeyRing
 */
class MasterKeyRingTest {

    @Test
    @DisplayName("should build from configuration")
    void shouldBuildFromConfig() {
        InvoicingConfig config = InvoicingConfig.builder()
            .masterKeyId("k1")
            .masterKey("0123456789abcdef-master")
            .nextMasterKeyId("k2")
            .nextMasterKey("fedcba9876543210-master")
            .facturapiUserKey("sk_user_test")
            .build();

        MasterKeyRing ring = MasterKeyRing.fromConfig(config);

        assertEquals("k1", ring.getCurrentKeyId());
        assertEquals(Optional.of("k2"), ring.getNextKeyId());
        assertTrue(ring.isCurrent("k1"));
    }

    @Test
    @DisplayName("should ignore an empty next key id")
    void shouldIgnoreEmptyNextKey() {
        MasterKeyRing ring = new MasterKeyRing("k1", "secret-0123456789", "", "");

        assertTrue(ring.getNextKeyId().isEmpty());
    }

    @Test
    @DisplayName("should reject a next key id equal to the current one")
    void shouldRejectSameIds() {
        assertThrows(IllegalArgumentException.class,
            () -> new MasterKeyRing("k1", "secret-0123456789", "k1", "other-secret-0123"));
    }

    @Test
    @DisplayName("should promote next key and keep the old key readable")
    void shouldRotate() {
        MasterKeyRing ring = new MasterKeyRing("k1", "secret-one-0123456", "k2", "secret-two-0123456");

        ring.rotate();

        assertEquals("k2", ring.getCurrentKeyId());
        assertTrue(ring.getNextKeyId().isEmpty());
        assertEquals(Optional.of("secret-one-0123456"), ring.secretFor("k1"));
        assertEquals("secret-two-0123456", ring.currentSecret());
    }

    @Test
    @DisplayName("should read a retired key from configuration")
    void shouldBuildRetiredFromConfig() {
        InvoicingConfig config = InvoicingConfig.builder()
            .masterKeyId("k2")
            .masterKey("fedcba9876543210-master")
            .retiredMasterKeyId("k1")
            .retiredMasterKey("0123456789abcdef-master")
            .facturapiUserKey("sk_user_test")
            .build();

        MasterKeyRing ring = MasterKeyRing.fromConfig(config);

        assertEquals("k2", ring.getCurrentKeyId());
        assertTrue(ring.isRetired("k1"));
        assertFalse(ring.isCurrent("k1"));
        assertEquals(Optional.of("0123456789abcdef-master"), ring.secretFor("k1"));
    }

    @Test
    @DisplayName("should keep every retired key across several rotations")
    void shouldKeepAllRetiredKeys() {
        MasterKeyRing ring = new MasterKeyRing("k1", "secret-one-0123456", "k2", "secret-two-0123456");
        ring.rotate();
        MasterKeyRing later = new MasterKeyRing("k3", "secret-three-01234").addRetired("k1", "secret-one-0123456")
            .addRetired("k2", "secret-two-0123456");

        assertTrue(ring.isRetired("k1"));
        assertEquals(Optional.of("secret-one-0123456"), later.secretFor("k1"));
        assertEquals(Optional.of("secret-two-0123456"), later.secretFor("k2"));
        assertTrue(later.secretFor("k4").isEmpty());
    }

    @Test
    @DisplayName("should refuse to retire a key that is still current or next")
    void shouldRejectRetiringLiveKey() {
        MasterKeyRing ring = new MasterKeyRing("k1", "secret-one-0123456", "k2", "secret-two-0123456");

        assertThrows(IllegalArgumentException.class, () -> ring.addRetired("k1", "secret-one-0123456"));
        assertThrows(IllegalArgumentException.class, () -> ring.addRetired("k2", "secret-two-0123456"));
    }

    @Test
    @DisplayName("should refuse to rotate without a next key")
    void shouldRefuseRotationWithoutNext() {
        MasterKeyRing ring = new MasterKeyRing("k1", "secret-0123456789");

        assertThrows(IllegalStateException.class, ring::rotate);
    }
}
