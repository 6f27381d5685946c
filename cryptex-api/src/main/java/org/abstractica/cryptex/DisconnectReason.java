package org.abstractica.cryptex;

import java.io.IOException;

/**
 * Reason a peer session ended or failed to start.
 */
public sealed interface DisconnectReason
{
    /**
     * Returns a human-readable description.
     *
     * @return the description
     */
    String describe();

    /**
     * Network-level error occurred.
     *
     * @param cause the underlying I/O exception
     */
    record NetworkError(IOException cause) implements DisconnectReason
    {
        @Override
        public String describe()
        {
            return "Network error: " + cause.getMessage();
        }
    }

    /**
     * The relay refused the authentication.
     *
     * @param reason  the rejection code
     * @param message the relay's explanation
     */
    record Rejected(RejectReason reason, String message) implements DisconnectReason
    {
        @Override
        public String describe()
        {
            return "Rejected (" + reason + "): " + message;
        }
    }

    /**
     * The relay did not answer in time.
     */
    record Timeout() implements DisconnectReason
    {
        @Override
        public String describe()
        {
            return "Timed out waiting for the relay";
        }
    }

    /**
     * The relay violated the protocol.
     *
     * @param details description of the violation
     */
    record ProtocolError(String details) implements DisconnectReason
    {
        @Override
        public String describe()
        {
            return "Protocol error: " + details;
        }
    }

    /**
     * The relay closed the stream, or announced its shutdown.
     *
     * @param message reason given by the relay, may be empty
     */
    record ServerShutdown(String message) implements DisconnectReason
    {
        @Override
        public String describe()
        {
            return message.isEmpty() ? "Server closed the connection" : "Server shutdown: " + message;
        }
    }

    /**
     * The local application disconnected.
     */
    record ClosedByClient() implements DisconnectReason
    {
        @Override
        public String describe()
        {
            return "Disconnected";
        }
    }
}
