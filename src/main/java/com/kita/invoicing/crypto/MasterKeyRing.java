package com.kita.invoicing.crypto;

import com.kita.invoicing.config.InvoicingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Versioned master secrets used to wrap per-record data keys
 *
 * <p>The ring has a {@code current} slot, which wraps every new data key,
 * and an optional {@code next} slot. Both slots can unwrap. {@link #rotate()}
 * promotes {@code next} to {@code current}; the old current secret moves
 * to the retired secrets, which can only unwrap. Retired secrets survive a
 * restart only when configured, so rewrap stored records after rotating.
 */
public class MasterKeyRing {

    private static final Logger logger = LoggerFactory.getLogger(MasterKeyRing.class);

    private volatile Slot current;
    private volatile Slot next;
    private final Map<String, Slot> retired = new LinkedHashMap<>();

    public MasterKeyRing(String currentKeyId, String currentSecret) {
        this(currentKeyId, currentSecret, null, null);
    }

    public MasterKeyRing(String currentKeyId, String currentSecret, String nextKeyId, String nextSecret) {
        this.current = new Slot(currentKeyId, currentSecret);
        if (nextKeyId != null && !nextKeyId.isEmpty()) {
            if (nextKeyId.equals(currentKeyId)) {
                throw new IllegalArgumentException("next key id must differ from current key id");
            }
            this.next = new Slot(nextKeyId, nextSecret);
        }
    }

    /**
     * Build the ring from configuration
     *
     * @param config resolved configuration
     * @return key ring
     */
    public static MasterKeyRing fromConfig(InvoicingConfig config) {
        MasterKeyRing ring = new MasterKeyRing(config.getMasterKeyId(), config.getMasterKey(),
            config.getNextMasterKeyId(), config.getNextMasterKey());
        String retiredKeyId = config.getRetiredMasterKeyId();
        if (retiredKeyId != null && !retiredKeyId.isEmpty()) {
            ring.addRetired(retiredKeyId, config.getRetiredMasterKey());
        }
        return ring;
    }

    /**
     * Keep an older secret available for unwrapping only
     *
     * @throws IllegalArgumentException if the key id is already current or next
     */
    public synchronized MasterKeyRing addRetired(String keyId, String secret) {
        Slot slot = new Slot(keyId, secret);
        Slot upcoming = next;
        if (current.keyId.equals(keyId) || (upcoming != null && upcoming.keyId.equals(keyId))) {
            throw new IllegalArgumentException("Retired key id " + keyId + " is still in use");
        }
        retired.put(keyId, slot);
        return this;
    }

    public synchronized boolean isRetired(String keyId) {
        return retired.containsKey(keyId);
    }

    public String getCurrentKeyId() {
        return current.keyId;
    }

    public Optional<String> getNextKeyId() {
        Slot slot = next;
        return slot != null ? Optional.of(slot.keyId) : Optional.empty();
    }

    String currentSecret() {
        return current.secret;
    }

    /**
     * Secret for a key id in any slot
     */
    synchronized Optional<String> secretFor(String keyId) {
        Slot[] slots = {current, next};
        for (Slot slot : slots) {
            if (slot != null && slot.keyId.equals(keyId)) {
                return Optional.of(slot.secret);
            }
        }
        Slot old = retired.get(keyId);
        return old != null ? Optional.of(old.secret) : Optional.empty();
    }

    public boolean isCurrent(String keyId) {
        return current.keyId.equals(keyId);
    }

    /**
     * Promote the next secret to current
     *
     * @throws IllegalStateException if no next secret is configured
     */
    public synchronized void rotate() {
        if (next == null) {
            throw new IllegalStateException("No next master key configured");
        }
        Slot previous = current;
        retired.put(previous.keyId, previous);
        current = next;
        next = null;
        logger.info("Master key rotated: {} -> {}", previous.keyId, current.keyId);
    }

    private static final class Slot {
        private final String keyId;
        private final String secret;

        private Slot(String keyId, String secret) {
            this.keyId = Objects.requireNonNull(keyId, "keyId");
            this.secret = Objects.requireNonNull(secret, "secret");
            if (keyId.isEmpty() || secret.isEmpty()) {
                throw new IllegalArgumentException("Master key id and secret must not be empty");
            }
        }
    }
}
