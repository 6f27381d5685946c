package org.abstractica.cryptex.impl.crypto;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

/**
 * AES-256-CBC with explicit PKCS#7 padding.
 *
 * <p>Wire format, base-64 encoded:</p>
 * <pre>
 * [iv: 16 bytes][ciphertext: n * 16 bytes]
 * </pre>
 *
 * <p>Padding is applied and checked here rather than by the provider so that
 * every malformed input maps to the same {@link CryptoException.Reason#DECRYPTION_FAILED}.
 * Integrity is not provided by this class; {@link ConversationKey} adds the MAC.</p>
 */
public final class SymmetricCipher
{
    public static final int KEY_LENGTH = 32;
    public static final int BLOCK_SIZE = 16;

    private static final String TRANSFORMATION = "AES/CBC/NoPadding";
    private static final SecureRandom RANDOM = new SecureRandom();

    private SymmetricCipher() {}

    /**
     * Encrypts under a fresh random IV.
     *
     * @param plaintext bytes to encrypt, may be empty
     * @param key       32-byte AES key
     * @return base-64 of iv followed by ciphertext
     */
    public static String encrypt(byte[] plaintext, byte[] key)
    {
        Objects.requireNonNull(plaintext, "plaintext");
        checkKey(key);

        byte[] iv = new byte[BLOCK_SIZE];
        RANDOM.nextBytes(iv);

        try
        {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new IvParameterSpec(iv));
            byte[] encrypted = cipher.doFinal(pad(plaintext));

            byte[] out = new byte[BLOCK_SIZE + encrypted.length];
            System.arraycopy(iv, 0, out, 0, BLOCK_SIZE);
            System.arraycopy(encrypted, 0, out, BLOCK_SIZE, encrypted.length);
            return Base64.getEncoder().encodeToString(out);
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException("AES encryption failed", e);
        }
    }

    /**
     * Decrypts text produced by {@link #encrypt(byte[], byte[])}.
     *
     * @param cipherText base-64 of iv followed by ciphertext
     * @param key        32-byte AES key
     * @return the plaintext
     * @throws CryptoException with {@link CryptoException.Reason#DECRYPTION_FAILED} on any malformed input
     */
    public static byte[] decrypt(String cipherText, byte[] key) throws CryptoException
    {
        Objects.requireNonNull(cipherText, "cipherText");
        checkKey(key);

        byte[] raw;
        try
        {
            raw = Base64.getDecoder().decode(cipherText);
        }
        catch (IllegalArgumentException e)
        {
            throw new CryptoException(CryptoException.Reason.DECRYPTION_FAILED, "Ciphertext is not valid base-64", e);
        }

        if (raw.length < 2 * BLOCK_SIZE)
        {
            throw new CryptoException(CryptoException.Reason.DECRYPTION_FAILED,
                    "Ciphertext too short: " + raw.length + " bytes");
        }
        if (raw.length % BLOCK_SIZE != 0)
        {
            throw new CryptoException(CryptoException.Reason.DECRYPTION_FAILED,
                    "Ciphertext not block aligned: " + raw.length + " bytes");
        }

        byte[] padded;
        try
        {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"),
                    new IvParameterSpec(raw, 0, BLOCK_SIZE));
            padded = cipher.doFinal(raw, BLOCK_SIZE, raw.length - BLOCK_SIZE);
        }
        catch (GeneralSecurityException e)
        {
            throw new CryptoException(CryptoException.Reason.DECRYPTION_FAILED, "AES decryption failed", e);
        }

        return unpad(padded);
    }

    // ========== PKCS#7 ==========

    static byte[] pad(byte[] data)
    {
        int padLength = BLOCK_SIZE - (data.length % BLOCK_SIZE);
        byte[] padded = Arrays.copyOf(data, data.length + padLength);
        Arrays.fill(padded, data.length, padded.length, (byte) padLength);
        return padded;
    }

    static byte[] unpad(byte[] padded) throws CryptoException
    {
        if (padded.length == 0 || padded.length % BLOCK_SIZE != 0)
        {
            throw new CryptoException(CryptoException.Reason.DECRYPTION_FAILED, "Invalid padded length");
        }

        int padLength = padded[padded.length - 1] & 0xFF;
        if (padLength < 1 || padLength > BLOCK_SIZE)
        {
            throw new CryptoException(CryptoException.Reason.DECRYPTION_FAILED, "Invalid padding");
        }
        for (int i = padded.length - padLength; i < padded.length; i++)
        {
            if ((padded[i] & 0xFF) != padLength)
            {
                throw new CryptoException(CryptoException.Reason.DECRYPTION_FAILED, "Invalid padding");
            }
        }

        return Arrays.copyOf(padded, padded.length - padLength);
    }

    private static void checkKey(byte[] key)
    {
        Objects.requireNonNull(key, "key");
        if (key.length != KEY_LENGTH)
        {
            throw new IllegalArgumentException("AES key must be " + KEY_LENGTH + " bytes: " + key.length);
        }
    }
}
