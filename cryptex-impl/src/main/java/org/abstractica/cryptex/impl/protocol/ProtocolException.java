package org.abstractica.cryptex.impl.protocol;

import java.util.Objects;

/**
 * Thrown when bytes received from the network do not form a valid envelope.
 *
 * <p>Only {@link Reason#FRAME_TOO_LARGE} ends the connection; every other reason
 * drops the offending envelope.</p>
 */
public class ProtocolException extends Exception
{
    public enum Reason
    {
        UNKNOWN_TYPE,
        UNEXPECTED_TYPE,
        WRONG_FIELD_COUNT,
        MALFORMED,
        FRAME_TOO_LARGE
    }

    private final Reason reason;

    public ProtocolException(Reason reason, String message)
    {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public ProtocolException(Reason reason, String message, Throwable cause)
    {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason getReason()
    {
        return reason;
    }

    /**
     * Returns whether the connection can continue after this error.
     *
     * @return false if the stream is no longer usable
     */
    public boolean isRecoverable()
    {
        return reason != Reason.FRAME_TOO_LARGE;
    }
}
