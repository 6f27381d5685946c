package org.abstractica.cryptex.impl.crypto;

import java.util.Objects;

/**
 * Thrown when a cryptographic operation fails on untrusted input.
 *
 * <p>Callers drop the affected message; they never retry with weaker guarantees.</p>
 */
public class CryptoException extends Exception
{
    /**
     * Why an operation failed.
     */
    public enum Reason
    {
        MALFORMED_KEY,
        DECRYPTION_FAILED,
        NO_KEY_FOR_PEER,
        UNWRAP_FAILED,
        AUTHENTICATION_FAILED
    }

    private final Reason reason;

    public CryptoException(Reason reason, String message)
    {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public CryptoException(Reason reason, String message, Throwable cause)
    {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason getReason()
    {
        return reason;
    }
}
