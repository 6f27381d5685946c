package org.abstractica.cryptex;

import java.util.Objects;

/**
 * Thrown when a peer cannot connect to or authenticate with the relay.
 */
public class ConnectionFailedException extends Exception
{
    private final DisconnectReason reason;

    public ConnectionFailedException(DisconnectReason reason)
    {
        super(Objects.requireNonNull(reason, "reason").describe());
        this.reason = reason;
    }

    public ConnectionFailedException(DisconnectReason reason, Throwable cause)
    {
        super(Objects.requireNonNull(reason, "reason").describe(), cause);
        this.reason = reason;
    }

    /**
     * Returns why the connection failed.
     *
     * @return the reason
     */
    public DisconnectReason getReason()
    {
        return reason;
    }
}
