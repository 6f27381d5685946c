package org.abstractica.cryptex.impl.crypto;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Objects;

/**
 * SHA256withRSA signatures.
 *
 * <p>A sender signs every session key it distributes; the recipient verifies the
 * signature against the sender's public key from the directory before accepting it.</p>
 */
public final class Signer
{
    private static final String ALGORITHM = "SHA256withRSA";

    private Signer() {}

    /**
     * Signs data with a private key.
     *
     * @param data       the data to sign
     * @param privateKey the signer's private key
     * @return the signature
     */
    public static byte[] sign(byte[] data, PrivateKey privateKey)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(privateKey, "privateKey");

        try
        {
            Signature signature = Signature.getInstance(ALGORITHM);
            signature.initSign(privateKey);
            signature.update(data);
            return signature.sign();
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException("Signing failed", e);
        }
    }

    /**
     * Verifies a signature.
     *
     * @param data      the signed data
     * @param signature the signature to verify
     * @param publicKey the signer's public key
     * @return true if the signature is valid; false for any tampered or malformed input
     */
    public static boolean verify(byte[] data, byte[] signature, PublicKey publicKey)
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(publicKey, "publicKey");

        try
        {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initVerify(publicKey);
            sig.update(data);
            return sig.verify(signature);
        }
        catch (GeneralSecurityException e)
        {
            return false;
        }
    }
}
