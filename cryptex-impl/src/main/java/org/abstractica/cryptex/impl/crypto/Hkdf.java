package org.abstractica.cryptex.impl.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Objects;

/**
 * HKDF-SHA256 (RFC 5869) and the conversation key schedule built on it.
 *
 * <p>A conversation master secret is extracted once with an all-zero salt and
 * expanded under two labels, one for the AES key and one for the HMAC key.</p>
 */
public final class Hkdf
{
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final int HASH_LENGTH = 32;

    static final byte[] CIPHER_LABEL = "cryptex-conversation-cipher".getBytes(StandardCharsets.US_ASCII);
    static final byte[] MAC_LABEL = "cryptex-conversation-mac".getBytes(StandardCharsets.US_ASCII);

    /**
     * The two keys protecting one conversation direction.
     *
     * @param cipherKey AES-256 key
     * @param macKey    HMAC-SHA256 key
     */
    public record ConversationKeys(byte[] cipherKey, byte[] macKey) {}

    private Hkdf() {}

    // ========== Conversation Keys ==========

    /**
     * Splits a conversation master secret into its cipher and MAC keys.
     *
     * @param master the shared master secret
     * @return the derived keys
     */
    public static ConversationKeys conversationKeys(byte[] master)
    {
        Objects.requireNonNull(master, "master");
        try
        {
            byte[] prk = extract(null, master);
            return new ConversationKeys(
                    expand(prk, CIPHER_LABEL, SymmetricCipher.KEY_LENGTH),
                    expand(prk, MAC_LABEL, MessageAuthenticator.TAG_LENGTH));
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException(HMAC_ALGORITHM + " not available", e);
        }
    }

    // ========== Generic HKDF ==========

    /**
     * Derives key material with extract-then-expand.
     *
     * @param inputKeyMaterial the input key material
     * @param salt             salt, or null/empty for the all-zero salt
     * @param info             context label binding the output to its use
     * @param outputLength     bytes wanted, at most 255 hash blocks
     * @return derived key material
     */
    public static byte[] derive(byte[] inputKeyMaterial, byte[] salt, byte[] info, int outputLength)
    {
        Objects.requireNonNull(inputKeyMaterial, "inputKeyMaterial");
        Objects.requireNonNull(info, "info");
        if (outputLength <= 0 || outputLength > 255 * HASH_LENGTH)
        {
            throw new IllegalArgumentException("Output length must be 1-" + 255 * HASH_LENGTH + ": " + outputLength);
        }

        try
        {
            return expand(extract(salt, inputKeyMaterial), info, outputLength);
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException(HMAC_ALGORITHM + " not available", e);
        }
    }

    private static byte[] extract(byte[] salt, byte[] inputKeyMaterial) throws GeneralSecurityException
    {
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        byte[] key = (salt == null || salt.length == 0) ? new byte[HASH_LENGTH] : salt;
        mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
        return mac.doFinal(inputKeyMaterial);
    }

    // T(i) = HMAC(prk, T(i-1) | info | i), output = T(1) | T(2) | ...
    private static byte[] expand(byte[] prk, byte[] info, int length) throws GeneralSecurityException
    {
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(new SecretKeySpec(prk, HMAC_ALGORITHM));

        byte[] okm = new byte[length];
        byte[] previous = new byte[0];
        for (int i = 1, written = 0; written < length; i++)
        {
            mac.update(previous);
            mac.update(info);
            mac.update((byte) i);
            previous = mac.doFinal();
            int n = Math.min(previous.length, length - written);
            System.arraycopy(previous, 0, okm, written, n);
            written += n;
        }
        return okm;
    }
}
