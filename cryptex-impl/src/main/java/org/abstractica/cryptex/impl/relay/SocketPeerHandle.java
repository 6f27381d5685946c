package org.abstractica.cryptex.impl.relay;

import org.abstractica.cryptex.impl.protocol.Envelope;
import org.abstractica.cryptex.impl.transport.FramedConnection;

import java.io.IOException;
import java.util.Objects;

/**
 * Peer handle backed by a framed TCP connection.
 */
class SocketPeerHandle implements PeerHandle
{
    private final FramedConnection connection;

    SocketPeerHandle(FramedConnection connection)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    @Override
    public void send(Envelope envelope) throws IOException
    {
        connection.send(envelope);
    }

    @Override
    public void close()
    {
        connection.close();
    }

    @Override
    public String getRemoteAddress()
    {
        return connection.getRemoteAddress();
    }

    @Override
    public String toString()
    {
        return "SocketPeerHandle[" + connection.getRemoteAddress() + "]";
    }
}
