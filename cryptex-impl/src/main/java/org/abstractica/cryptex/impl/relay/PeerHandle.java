package org.abstractica.cryptex.impl.relay;

import org.abstractica.cryptex.impl.protocol.Envelope;

import java.io.IOException;

/**
 * The relay's outbound side of one peer connection.
 *
 * <p>Implementations must allow {@link #send(Envelope)} from any thread.</p>
 */
public interface PeerHandle
{
    /**
     * Delivers an envelope to the peer.
     *
     * @param envelope the envelope
     * @throws IOException if the peer can no longer be reached
     */
    void send(Envelope envelope) throws IOException;

    /**
     * Closes the connection. Idempotent.
     */
    void close();

    /**
     * Returns the peer's network address, for logging and audit.
     *
     * @return printable address
     */
    String getRemoteAddress();
}
