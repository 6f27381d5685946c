package org.abstractica.cryptex.impl.crypto;

import java.util.Objects;

/**
 * An encrypted payload with its authentication tag, as carried on the wire.
 *
 * @param cipherText base-64 of iv followed by AES ciphertext
 * @param tag        lowercase hex HMAC-SHA256 over the cipherText characters
 */
public record SealedMessage(String cipherText, String tag)
{
    public SealedMessage
    {
        Objects.requireNonNull(cipherText, "cipherText");
        Objects.requireNonNull(tag, "tag");
    }
}
