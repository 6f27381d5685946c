package org.abstractica.cryptex.impl.relay;

import org.abstractica.cryptex.AuditSink;
import org.abstractica.cryptex.RejectReason;
import org.abstractica.cryptex.impl.protocol.Envelope;
import org.abstractica.cryptex.impl.protocol.ProtocolConstants;
import org.abstractica.cryptex.impl.protocol.ProtocolException;
import org.abstractica.cryptex.impl.transport.FramedConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Serves one accepted connection on its own worker thread.
 *
 * <p>Reads the AUTH envelope under the authentication timeout, hands it to the
 * router, then feeds every further envelope to the router until the peer
 * disconnects or the connection fails.</p>
 */
class ConnectionHandler implements Runnable
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionHandler.class);

    private final FramedConnection connection;
    private final PeerHandle handle;
    private final RelayRouter router;
    private final AuditSink audit;
    private final Duration authTimeout;

    ConnectionHandler(FramedConnection connection, RelayRouter router, AuditSink audit, Duration authTimeout)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.handle = new SocketPeerHandle(connection);
        this.router = Objects.requireNonNull(router, "router");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.authTimeout = Objects.requireNonNull(authTimeout, "authTimeout");
    }

    @Override
    public void run()
    {
        String identity = null;
        try
        {
            Optional<String> authenticated = authenticate();
            if (authenticated.isEmpty())
            {
                return;
            }
            identity = authenticated.get();

            String sender = identity;
            connection.onMalformed(e -> router.malformed(sender, e.getMessage()));
            connection.setReadTimeout(Duration.ZERO);
            serve(identity);
        }
        catch (ProtocolException e)
        {
            LOG.warn("Closing connection from {}: {}", connection.getRemoteAddress(), e.getMessage());
            if (identity != null)
            {
                router.malformed(identity, e.getMessage());
            }
        }
        catch (IOException e)
        {
            if (!connection.isClosed())
            {
                LOG.debug("Connection from {} failed: {}", connection.getRemoteAddress(), e.getMessage());
            }
        }
        catch (RuntimeException e)
        {
            LOG.error("Unexpected error serving {}", connection.getRemoteAddress(), e);
        }
        finally
        {
            if (identity != null)
            {
                router.disconnect(identity, handle);
            }
            connection.close();
        }
    }

    private Optional<String> authenticate() throws IOException
    {
        connection.setReadTimeout(authTimeout);

        Optional<Envelope> first;
        try
        {
            first = connection.receiveStrict();
        }
        catch (SocketTimeoutException e)
        {
            LOG.info("No authentication from {} within {}", connection.getRemoteAddress(), authTimeout);
            audit.authFailure(ProtocolConstants.UNKNOWN_IDENTITY, connection.getRemoteAddress(), "Authentication timeout");
            return Optional.empty();
        }
        catch (ProtocolException e)
        {
            LOG.debug("Malformed authentication from {}: {}", connection.getRemoteAddress(), e.getMessage());
            router.reject(handle, ProtocolConstants.UNKNOWN_IDENTITY, RejectReason.MALFORMED_AUTH, "Invalid authentication");
            return Optional.empty();
        }

        if (first.isEmpty())
        {
            LOG.debug("{} closed before authenticating", connection.getRemoteAddress());
            return Optional.empty();
        }
        return router.authenticate(handle, first.get());
    }

    private void serve(String identity) throws IOException, ProtocolException
    {
        while (true)
        {
            Optional<Envelope> next = connection.receive();
            if (next.isEmpty())
            {
                LOG.debug("{} closed the connection", identity);
                return;
            }
            if (!router.route(identity, next.get()))
            {
                return;
            }
        }
    }
}
