package com.kita.invoicing.crypto;

import java.util.Objects;

/**
 * Ciphertexts of one certificate record plus the wrapped data key
 *
 * <p>Every ciphertext is base64 of {@code nonce || ciphertext || tag}.
 */
public final class EncryptedBundle {

    private final String certificateCiphertext;
    private final String privateKeyCiphertext;
    private final String passphraseCiphertext;
    private final String wrappedKey;
    private final String keyId;

    public EncryptedBundle(String certificateCiphertext, String privateKeyCiphertext,
                           String passphraseCiphertext, String wrappedKey, String keyId) {
        this.certificateCiphertext = Objects.requireNonNull(certificateCiphertext, "certificateCiphertext");
        this.privateKeyCiphertext = Objects.requireNonNull(privateKeyCiphertext, "privateKeyCiphertext");
        this.passphraseCiphertext = Objects.requireNonNull(passphraseCiphertext, "passphraseCiphertext");
        this.wrappedKey = Objects.requireNonNull(wrappedKey, "wrappedKey");
        this.keyId = Objects.requireNonNull(keyId, "keyId");
    }

    public String getCertificateCiphertext() {
        return certificateCiphertext;
    }

    public String getPrivateKeyCiphertext() {
        return privateKeyCiphertext;
    }

    public String getPassphraseCiphertext() {
        return passphraseCiphertext;
    }

    public String getWrappedKey() {
        return wrappedKey;
    }

    /**
     * Version of the master secret that wrapped the data key
     */
    public String getKeyId() {
        return keyId;
    }

    /**
     * Same payload ciphertexts with a different wrapped data key
     */
    public EncryptedBundle withWrappedKey(String newWrappedKey, String newKeyId) {
        return new EncryptedBundle(certificateCiphertext, privateKeyCiphertext, passphraseCiphertext,
            newWrappedKey, newKeyId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EncryptedBundle that = (EncryptedBundle) o;
        return certificateCiphertext.equals(that.certificateCiphertext) &&
               privateKeyCiphertext.equals(that.privateKeyCiphertext) &&
               passphraseCiphertext.equals(that.passphraseCiphertext) &&
               wrappedKey.equals(that.wrappedKey) &&
               keyId.equals(that.keyId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(certificateCiphertext, privateKeyCiphertext, passphraseCiphertext, wrappedKey, keyId);
    }

    @Override
    public String toString() {
        return "EncryptedBundle{keyId='" + keyId + "'}";
    }
}
