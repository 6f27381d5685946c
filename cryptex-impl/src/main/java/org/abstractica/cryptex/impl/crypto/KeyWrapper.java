package org.abstractica.cryptex.impl.crypto;

import javax.crypto.Cipher;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.MGF1ParameterSpec;
import java.util.Objects;

/**
 * Wraps symmetric key material for a single recipient with RSA-OAEP.
 *
 * <p>OAEP uses SHA-256 for both the label hash and MGF1.</p>
 */
public final class KeyWrapper
{
    private static final String TRANSFORMATION = "RSA/ECB/OAEPPadding";
    private static final OAEPParameterSpec OAEP_SHA256 = new OAEPParameterSpec(
            "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

    private KeyWrapper() {}

    /**
     * Encrypts key material so only the holder of the matching private key can read it.
     *
     * @param key       the key material
     * @param publicKey the recipient's public key, or null if none is known
     * @return the wrapped key
     * @throws CryptoException {@link CryptoException.Reason#NO_KEY_FOR_PEER} if the public key is null,
     *                         {@link CryptoException.Reason#MALFORMED_KEY} if it cannot be used
     */
    public static byte[] wrap(byte[] key, PublicKey publicKey) throws CryptoException
    {
        Objects.requireNonNull(key, "key");
        if (publicKey == null)
        {
            throw new CryptoException(CryptoException.Reason.NO_KEY_FOR_PEER, "No public key for recipient");
        }

        try
        {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, publicKey, OAEP_SHA256);
            return cipher.doFinal(key);
        }
        catch (InvalidKeyException e)
        {
            throw new CryptoException(CryptoException.Reason.MALFORMED_KEY, "Recipient key unusable for OAEP", e);
        }
        catch (GeneralSecurityException e)
        {
            throw new IllegalStateException("RSA-OAEP not available", e);
        }
    }

    /**
     * Recovers key material wrapped for this process.
     *
     * @param wrapped    the wrapped key
     * @param privateKey own private key
     * @return the key material
     * @throws CryptoException {@link CryptoException.Reason#UNWRAP_FAILED} if the key was not wrapped
     *                         for this private key or was tampered with
     */
    public static byte[] unwrap(byte[] wrapped, PrivateKey privateKey) throws CryptoException
    {
        Objects.requireNonNull(wrapped, "wrapped");
        Objects.requireNonNull(privateKey, "privateKey");

        try
        {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, privateKey, OAEP_SHA256);
            return cipher.doFinal(wrapped);
        }
        catch (GeneralSecurityException e)
        {
            throw new CryptoException(CryptoException.Reason.UNWRAP_FAILED, "Could not unwrap key", e);
        }
    }
}
