package org.abstractica.cryptex.impl.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.Objects;

/**
 * RSA key generation and PEM encoding of public keys.
 *
 * <p>Public keys travel as PEM text: a base-64 X.509 SubjectPublicKeyInfo wrapped
 * at 64 columns between {@code BEGIN/END PUBLIC KEY} armour lines.</p>
 */
public final class RsaKeys
{
    public static final int DEFAULT_KEY_SIZE = 2048;
    public static final int MIN_KEY_SIZE = 1024;

    private static final String ALGORITHM = "RSA";
    private static final String PEM_HEADER = "-----BEGIN PUBLIC KEY-----";
    private static final String PEM_FOOTER = "-----END PUBLIC KEY-----";
    private static final int PEM_LINE_LENGTH = 64;

    private RsaKeys() {}

    /**
     * Generates a fresh RSA key pair.
     *
     * @param bits modulus size in bits
     * @return the key pair
     * @throws IllegalStateException if no RSA provider is available
     */
    public static KeyPair generateKeyPair(int bits)
    {
        if (bits < MIN_KEY_SIZE)
        {
            throw new IllegalArgumentException("RSA key size must be at least " + MIN_KEY_SIZE + ": " + bits);
        }
        try
        {
            KeyPairGenerator generator = KeyPairGenerator.getInstance(ALGORITHM);
            generator.initialize(bits, new SecureRandom());
            return generator.generateKeyPair();
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException("Failed to generate RSA key pair", e);
        }
    }

    /**
     * Encodes a public key as PEM text.
     *
     * @param publicKey the key
     * @return PEM text terminated by a newline
     */
    public static String exportPublicKey(PublicKey publicKey)
    {
        Objects.requireNonNull(publicKey, "publicKey");

        String body = Base64.getEncoder().encodeToString(publicKey.getEncoded());
        StringBuilder pem = new StringBuilder(body.length() + 64);
        pem.append(PEM_HEADER).append('\n');
        for (int i = 0; i < body.length(); i += PEM_LINE_LENGTH)
        {
            pem.append(body, i, Math.min(body.length(), i + PEM_LINE_LENGTH)).append('\n');
        }
        pem.append(PEM_FOOTER).append('\n');
        return pem.toString();
    }

    /**
     * Parses PEM text produced by {@link #exportPublicKey(PublicKey)} or any
     * standard tool emitting an X.509 RSA public key.
     *
     * @param pem PEM text
     * @return the public key
     * @throws CryptoException with {@link CryptoException.Reason#MALFORMED_KEY} if the text is not a valid key
     */
    public static PublicKey importPublicKey(String pem) throws CryptoException
    {
        if (pem == null)
        {
            throw new CryptoException(CryptoException.Reason.MALFORMED_KEY, "Public key is missing");
        }

        String trimmed = pem.trim();
        if (!trimmed.startsWith(PEM_HEADER) || !trimmed.endsWith(PEM_FOOTER))
        {
            throw new CryptoException(CryptoException.Reason.MALFORMED_KEY, "Public key is not PEM encoded");
        }

        String body = trimmed.substring(PEM_HEADER.length(), trimmed.length() - PEM_FOOTER.length())
                .replaceAll("\\s", "");
        try
        {
            byte[] der = Base64.getDecoder().decode(body.getBytes(StandardCharsets.US_ASCII));
            KeyFactory factory = KeyFactory.getInstance(ALGORITHM);
            return factory.generatePublic(new X509EncodedKeySpec(der));
        }
        catch (IllegalArgumentException | GeneralSecurityException e)
        {
            throw new CryptoException(CryptoException.Reason.MALFORMED_KEY, "Invalid public key: " + e.getMessage(), e);
        }
    }
}
