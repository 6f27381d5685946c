package org.abstractica.cryptex.impl.crypto;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Objects;

/**
 * HMAC-SHA256 tags.
 */
public final class MessageAuthenticator
{
    public static final int TAG_LENGTH = 32;

    private static final String ALGORITHM = "HmacSHA256";

    private MessageAuthenticator() {}

    public static byte[] tag(byte[] message, byte[] key)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(key, "key");

        try
        {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            return mac.doFinal(message);
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException("HMAC computation failed", e);
        }
    }

    /**
     * Checks a tag in constant time.
     *
     * @param message the message
     * @param tag     the tag received with it
     * @param key     the MAC key
     * @return true if the tag matches
     */
    public static boolean verify(byte[] message, byte[] tag, byte[] key)
    {
        Objects.requireNonNull(tag, "tag");
        return MessageDigest.isEqual(tag(message, key), tag);
    }
}
