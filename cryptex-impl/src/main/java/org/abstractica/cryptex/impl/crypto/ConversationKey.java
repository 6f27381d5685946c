package org.abstractica.cryptex.impl.crypto;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Symmetric key state for one conversation direction.
 *
 * <p>A random 32-byte master secret is expanded with {@link Hkdf} into an AES key
 * and an independent HMAC key. Messages are encrypted then MACed; opening checks
 * the MAC before any decryption happens.</p>
 */
public final class ConversationKey
{
    public static final int MASTER_LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();
    private static final SecureRandom RANDOM = new SecureRandom();

    private final byte[] master;
    private final byte[] cipherKey;
    private final byte[] macKey;

    private ConversationKey(byte[] master)
    {
        this.master = master.clone();
        Hkdf.ConversationKeys keys = Hkdf.conversationKeys(master);
        this.cipherKey = keys.cipherKey();
        this.macKey = keys.macKey();
    }

    /**
     * Creates a key from a fresh random master secret.
     *
     * @return the new key
     */
    public static ConversationKey generate()
    {
        byte[] master = new byte[MASTER_LENGTH];
        RANDOM.nextBytes(master);
        return new ConversationKey(master);
    }

    /**
     * Rebuilds a key from a received master secret.
     *
     * @param master the master secret
     * @return the key
     * @throws CryptoException with {@link CryptoException.Reason#UNWRAP_FAILED} if the master has the wrong length
     */
    public static ConversationKey fromMaster(byte[] master) throws CryptoException
    {
        Objects.requireNonNull(master, "master");
        if (master.length != MASTER_LENGTH)
        {
            throw new CryptoException(CryptoException.Reason.UNWRAP_FAILED,
                    "Session key must be " + MASTER_LENGTH + " bytes: " + master.length);
        }
        return new ConversationKey(master);
    }

    /**
     * Returns a copy of the master secret, for wrapping to the recipient.
     *
     * @return the master secret
     */
    public byte[] master()
    {
        return master.clone();
    }

    public SealedMessage seal(String plaintext)
    {
        Objects.requireNonNull(plaintext, "plaintext");

        String cipherText = SymmetricCipher.encrypt(plaintext.getBytes(StandardCharsets.UTF_8), cipherKey);
        byte[] tag = MessageAuthenticator.tag(cipherText.getBytes(StandardCharsets.US_ASCII), macKey);
        return new SealedMessage(cipherText, HEX.formatHex(tag));
    }

    /**
     * Verifies and decrypts a sealed message.
     *
     * @param sealed the message
     * @return the plaintext
     * @throws CryptoException {@link CryptoException.Reason#AUTHENTICATION_FAILED} if the tag does not match,
     *                         {@link CryptoException.Reason#DECRYPTION_FAILED} if the verified ciphertext is malformed
     */
    public String open(SealedMessage sealed) throws CryptoException
    {
        Objects.requireNonNull(sealed, "sealed");

        byte[] tag;
        try
        {
            tag = HEX.parseHex(sealed.tag());
        }
        catch (IllegalArgumentException e)
        {
            throw new CryptoException(CryptoException.Reason.AUTHENTICATION_FAILED, "Tag is not valid hex", e);
        }

        byte[] cipherBytes = sealed.cipherText().getBytes(StandardCharsets.US_ASCII);
        if (!MessageAuthenticator.verify(cipherBytes, tag, macKey))
        {
            throw new CryptoException(CryptoException.Reason.AUTHENTICATION_FAILED, "Message authentication failed");
        }

        byte[] plain = SymmetricCipher.decrypt(sealed.cipherText(), cipherKey);
        return new String(plain, StandardCharsets.UTF_8);
    }
}
