package com.kita.invoicing.crypto;

import java.util.Arrays;
import java.util.Base64;

/**
 * Plaintext certificate material recovered from an {@link EncryptedBundle}
 *
 * <p>Never log instances of this class.
 */
public final class DecryptedBundle {

    private final Payload certificate;
    private final Payload privateKey;
    private final Payload passphrase;

    public DecryptedBundle(Payload certificate, Payload privateKey, Payload passphrase) {
        this.certificate = certificate;
        this.privateKey = privateKey;
        this.passphrase = passphrase;
    }

    public Payload getCertificate() {
        return certificate;
    }

    public Payload getPrivateKey() {
        return privateKey;
    }

    public Payload getPassphrase() {
        return passphrase;
    }

    @Override
    public String toString() {
        return "DecryptedBundle[REDACTED]";
    }

    /**
     * One decrypted field
     *
     * <p>{@link #getText()} is the strict UTF-8 decoding of the bytes, or their
     * base64 encoding when the bytes are not valid UTF-8 ({@link #isBinary()}).
     */
    public static final class Payload {
        private final byte[] raw;
        private final String text;
        private final boolean binary;

        private Payload(byte[] raw, String text, boolean binary) {
            this.raw = raw;
            this.text = text;
            this.binary = binary;
        }

        public static Payload text(byte[] raw, String text) {
            return new Payload(raw.clone(), text, false);
        }

        public static Payload binary(byte[] raw) {
            return new Payload(raw.clone(), Base64.getEncoder().encodeToString(raw), true);
        }

        public byte[] getRaw() {
            return raw.clone();
        }

        public String getText() {
            return text;
        }

        public boolean isBinary() {
            return binary;
        }

        /**
         * Base64 of the raw bytes, as providers expect for file uploads
         */
        public String toBase64() {
            return Base64.getEncoder().encodeToString(raw);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            return Arrays.equals(raw, ((Payload) o).raw);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(raw);
        }

        @Override
        public String toString() {
            return "Payload[REDACTED]";
        }
    }
}
