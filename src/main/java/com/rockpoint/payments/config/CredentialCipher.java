package com.rockpoint.payments.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM for config values flagged as encrypted. Ciphertext is stored as
 * {@code ENC(base64(iv || ciphertext+tag))} so plain values written while no key
 * was configured are still readable.
 */
@Slf4j
@Component
public class CredentialCipher {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final String PREFIX = "ENC(";
    private static final String SUFFIX = ")";

    private final SecureRandom secureRandom = new SecureRandom();
    private final SecretKey key;

    public CredentialCipher(@Value("${payments.config.encryption-key:}") String base64Key) {
        if (base64Key == null || base64Key.isBlank()) {
            log.warn("payments.config.encryption-key is not set; encrypted config values will be stored as plain text");
            this.key = null;
        } else {
            byte[] raw = Base64.getDecoder().decode(base64Key.trim());
            if (raw.length != 32) {
                throw new IllegalStateException("payments.config.encryption-key must be a base64 encoded 256-bit key");
            }
            this.key = new SecretKeySpec(raw, "AES");
        }
    }

    public boolean isEnabled() {
        return key != null;
    }

    public String encrypt(String plaintext) {
        if (plaintext == null || key == null) {
            return plaintext;
        }
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] ciphertext = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            ByteBuffer buffer = ByteBuffer.allocate(iv.length + ciphertext.length);
            buffer.put(iv).put(ciphertext);
            return PREFIX + Base64.getEncoder().encodeToString(buffer.array()) + SUFFIX;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt config value", e);
        }
    }

    public String decrypt(String stored) {
        if (!isCiphertext(stored)) {
            return stored;
        }
        if (key == null) {
            throw new IllegalStateException("Encrypted config value found but no encryption key is configured");
        }
        try {
            byte[] data = Base64.getDecoder().decode(stored.substring(PREFIX.length(), stored.length() - SUFFIX.length()));
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BITS, data, 0, IV_LENGTH));
            byte[] plaintext = cipher.doFinal(data, IV_LENGTH, data.length - IV_LENGTH);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to decrypt config value", e);
        }
    }

    public static boolean isCiphertext(String value) {
        return value != null && value.startsWith(PREFIX) && value.endsWith(SUFFIX);
    }
}
