package tokenwarden.core.service.crypto;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import tokenwarden.core.exception.DecryptionFailureException;
import tokenwarden.core.exception.DecryptionFailureException.Reason;
import tokenwarden.core.exception.EncryptionFailureException;

/**
 * Encryption service for OAuth token material at rest.
 *
 * <p>Uses AES-256-GCM with a fresh IV per operation, so encrypting the same
 * plaintext twice yields different ciphertext. The key is loaded once and never
 * changes for the life of the process.
 *
 * <p>Ciphertext layout before Base64 encoding:
 * {@code [keyId length:1][keyId][iv:12][ciphertext + tag]}. The key ID lets
 * decryption tell a wrong key apart from corrupted data.
 *
 * <h2>Configuration</h2>
 * <pre>
 * tokenwarden.encryption.key=${TOKEN_ENCRYPTION_KEY}  # Base64-encoded 256-bit key
 * tokenwarden.encryption.key-id=v1
 * </pre>
 */
@ApplicationScoped
public class TokenEncryptionService {

    private static final Logger LOG = Logger.getLogger(TokenEncryptionService.class);

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int KEY_LENGTH = 32;
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;
    private static final int MAX_KEY_ID_LENGTH = 255;

    private final SecretKey secretKey;
    private final String keyId;
    private final byte[] keyIdBytes;
    private final SecureRandom secureRandom;

    /**
     * CDI constructor.
     *
     * @param encryptionKey base64-encoded 256-bit key
     * @param keyId         identifier written into every ciphertext
     */
    @Inject
    public TokenEncryptionService(
            @ConfigProperty(name = "tokenwarden.encryption.key") String encryptionKey,
            @ConfigProperty(name = "tokenwarden.encryption.key-id", defaultValue = "v1") String keyId) {
        if (encryptionKey == null || encryptionKey.isBlank()) {
            throw new IllegalArgumentException("tokenwarden.encryption.key must be set");
        }
        if (keyId == null || keyId.isEmpty()) {
            throw new IllegalArgumentException("tokenwarden.encryption.key-id must not be empty");
        }

        final byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(encryptionKey.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Encryption key is not valid Base64", e);
        }
        if (keyBytes.length != KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "Encryption key must be 256 bits (32 bytes). Got: " + keyBytes.length + " bytes");
        }

        this.keyIdBytes = keyId.getBytes(StandardCharsets.UTF_8);
        if (keyIdBytes.length > MAX_KEY_ID_LENGTH) {
            throw new IllegalArgumentException("Encryption key ID must be at most 255 bytes");
        }
        this.secretKey = new SecretKeySpec(keyBytes, "AES");
        this.keyId = keyId;
        this.secureRandom = new SecureRandom();
        LOG.infof("Token encryption initialized with key ID: %s", keyId);
    }

    /**
     * Encrypt arbitrary bytes.
     *
     * @param plaintext bytes to encrypt, may be empty
     * @return Base64-encoded ciphertext
     * @throws EncryptionFailureException if the cipher fails
     */
    public String encrypt(byte[] plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        try {
            final byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);

            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            final byte[] ciphertext = cipher.doFinal(plaintext);

            final ByteBuffer buffer = ByteBuffer.allocate(1 + keyIdBytes.length + IV_LENGTH + ciphertext.length);
            buffer.put((byte) keyIdBytes.length);
            buffer.put(keyIdBytes);
            buffer.put(iv);
            buffer.put(ciphertext);

            return Base64.getEncoder().encodeToString(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new EncryptionFailureException("Failed to encrypt token material", e);
        }
    }

    /**
     * Decrypt ciphertext produced by {@link #encrypt(byte[])}.
     *
     * @param encryptedData Base64-encoded ciphertext
     * @return the original bytes
     * @throws DecryptionFailureException with {@link Reason#KEY_MISMATCH} if the data was
     *     written under another key ID, {@link Reason#MALFORMED} if it is corrupt or tampered
     */
    public byte[] decrypt(String encryptedData) {
        if (encryptedData == null || encryptedData.isEmpty()) {
            throw new DecryptionFailureException(Reason.MALFORMED, "Ciphertext is empty");
        }

        final byte[] data;
        try {
            data = Base64.getDecoder().decode(encryptedData);
        } catch (IllegalArgumentException e) {
            throw new DecryptionFailureException(Reason.MALFORMED, "Ciphertext is not valid Base64", e);
        }

        final ByteBuffer buffer = ByteBuffer.wrap(data);
        final byte[] iv = new byte[IV_LENGTH];
        final byte[] ciphertext;
        try {
            final int keyIdLength = buffer.get() & 0xFF;
            final byte[] dataKeyId = new byte[keyIdLength];
            buffer.get(dataKeyId);
            final String dataKeyIdValue = new String(dataKeyId, StandardCharsets.UTF_8);
            if (!keyId.equals(dataKeyIdValue)) {
                LOG.warnf("Key ID mismatch: expected %s, got %s", keyId, dataKeyIdValue);
                throw new DecryptionFailureException(
                        Reason.KEY_MISMATCH, "Ciphertext was encrypted with key ID " + dataKeyIdValue);
            }
            buffer.get(iv);
            ciphertext = new byte[buffer.remaining()];
            buffer.get(ciphertext);
        } catch (BufferUnderflowException e) {
            throw new DecryptionFailureException(Reason.MALFORMED, "Ciphertext is truncated", e);
        }

        try {
            final Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return cipher.doFinal(ciphertext);
        } catch (AEADBadTagException e) {
            throw new DecryptionFailureException(Reason.MALFORMED, "Ciphertext failed authentication", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionFailureException(Reason.MALFORMED, "Failed to decrypt token material", e);
        }
    }

    /**
     * Encrypt a UTF-8 string.
     */
    public String encryptString(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Decrypt to a UTF-8 string.
     */
    public String decryptString(String encryptedData) {
        return new String(decrypt(encryptedData), StandardCharsets.UTF_8);
    }

    /**
     * Encrypt if present, keep null otherwise. Used for optional tokens.
     */
    public String encryptOptional(String plaintext) {
        return plaintext == null || plaintext.isEmpty() ? null : encryptString(plaintext);
    }

    public String getKeyId() {
        return keyId;
    }
}
