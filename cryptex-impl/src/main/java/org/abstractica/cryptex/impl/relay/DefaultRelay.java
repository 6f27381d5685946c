package org.abstractica.cryptex.impl.relay;

import org.abstractica.cryptex.AuditSink;
import org.abstractica.cryptex.Relay;
import org.abstractica.cryptex.RelayStats;
import org.abstractica.cryptex.impl.protocol.Direction;
import org.abstractica.cryptex.impl.transport.FramedConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP relay server.
 *
 * <p>One thread accepts connections; each accepted connection is served by a
 * {@link ConnectionHandler} on a cached pool of daemon worker threads. All
 * protocol decisions are delegated to the {@link RelayRouter}.</p>
 */
public class DefaultRelay implements Relay
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultRelay.class);
    private static final long SHUTDOWN_WAIT_MS = 2000;

    private final InetSocketAddress bindAddress;
    private final int backlog;
    private final Duration authTimeout;
    private final int maxEnvelopeSize;
    private final AuditSink audit;

    private final SessionDirectory directory;
    private final DefaultRelayStats stats;
    private final RelayRouter router;
    private final Set<FramedConnection> connections = ConcurrentHashMap.newKeySet();

    private ServerSocket serverSocket;
    private InetSocketAddress localAddress;
    private ExecutorService workers;
    private Thread acceptThread;
    private volatile boolean running;
    private volatile boolean accepting;

    /**
     * Creates a relay. Nothing is bound until {@link #start()}.
     *
     * @param bindAddress     address and port to listen on (port 0 for ephemeral)
     * @param backlog         listen backlog
     * @param maxSessions     maximum concurrent sessions (0 for unlimited)
     * @param authTimeout     how long a new connection may take to authenticate
     * @param maxEnvelopeSize largest envelope accepted from a peer
     * @param audit           receiver of security events
     */
    public DefaultRelay(
            InetSocketAddress bindAddress,
            int backlog,
            int maxSessions,
            Duration authTimeout,
            int maxEnvelopeSize,
            AuditSink audit)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.backlog = backlog;
        this.authTimeout = Objects.requireNonNull(authTimeout, "authTimeout");
        this.maxEnvelopeSize = maxEnvelopeSize;
        this.audit = Objects.requireNonNull(audit, "audit");

        this.directory = new SessionDirectory();
        this.stats = new DefaultRelayStats(directory);
        this.router = new RelayRouter(directory, audit, stats, maxSessions);
    }

    // ========== Relay Interface ==========

    @Override
    public synchronized void start()
    {
        if (running)
        {
            throw new IllegalStateException("Relay already started");
        }

        LOG.info("Starting relay on {}", bindAddress);

        ServerSocket socket = null;
        try
        {
            socket = new ServerSocket();
            socket.setReuseAddress(true);
            socket.bind(bindAddress, backlog);
        }
        catch (IOException e)
        {
            LOG.error("Failed to bind relay to {}: {}", bindAddress, e.getMessage());
            closeQuietly(socket);
            throw new UncheckedIOException("Failed to bind " + bindAddress, e);
        }

        serverSocket = socket;
        localAddress = (InetSocketAddress) socket.getLocalSocketAddress();
        workers = Executors.newCachedThreadPool(new WorkerThreadFactory());
        running = true;
        accepting = true;

        acceptThread = new Thread(this::acceptLoop, "cryptex-relay-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();

        LOG.info("Relay listening on {}", localAddress);
        audit.serverEvent("Relay started on " + localAddress);
    }

    @Override
    public synchronized void stop()
    {
        if (!accepting)
        {
            return;
        }
        LOG.info("Stopping relay (no new connections)");
        accepting = false;
        closeQuietly(serverSocket);
    }

    @Override
    public synchronized void close()
    {
        if (!running)
        {
            return;
        }

        LOG.info("Closing relay");
        stop();
        running = false;

        router.shutdown("Server shutting down");
        for (FramedConnection connection : connections)
        {
            connection.close();
        }

        workers.shutdownNow();
        try
        {
            acceptThread.join(SHUTDOWN_WAIT_MS);
            if (!workers.awaitTermination(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS))
            {
                LOG.warn("Relay workers did not terminate within {} ms", SHUTDOWN_WAIT_MS);
            }
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
        }

        audit.serverEvent("Relay stopped");
        LOG.info("Relay closed ({})", stats);
    }

    @Override
    public InetSocketAddress getLocalAddress()
    {
        return localAddress;
    }

    @Override
    public List<String> getOnlineIdentities()
    {
        return directory.identities();
    }

    @Override
    public RelayStats getStats()
    {
        return stats;
    }

    // ========== Accept Loop ==========

    private void acceptLoop()
    {
        LOG.debug("Accept loop started");
        while (accepting)
        {
            Socket socket;
            try
            {
                socket = serverSocket.accept();
            }
            catch (IOException e)
            {
                if (accepting)
                {
                    LOG.warn("Accept failed: {}", e.getMessage());
                    continue;
                }
                break;
            }
            handle(socket);
        }
        LOG.debug("Accept loop stopped");
    }

    private void handle(Socket socket)
    {
        stats.recordAccepted();
        FramedConnection connection;
        try
        {
            socket.setTcpNoDelay(true);
            connection = new FramedConnection(socket, Direction.UPSTREAM, maxEnvelopeSize);
        }
        catch (IOException e)
        {
            LOG.warn("Could not set up connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
            closeQuietly(socket);
            return;
        }

        LOG.debug("Accepted connection from {}", connection.getRemoteAddress());
        ConnectionHandler handler = new ConnectionHandler(connection, router, audit, authTimeout);
        connections.add(connection);
        try
        {
            workers.execute(() ->
            {
                try
                {
                    handler.run();
                }
                finally
                {
                    connections.remove(connection);
                }
            });
        }
        catch (RejectedExecutionException e)
        {
            LOG.debug("Relay shutting down, dropping connection from {}", connection.getRemoteAddress());
            connections.remove(connection);
            connection.close();
        }
    }

    private static void closeQuietly(AutoCloseable closeable)
    {
        if (closeable == null)
        {
            return;
        }
        try
        {
            closeable.close();
        }
        catch (Exception e)
        {
            LOG.debug("Error closing {}: {}", closeable, e.getMessage());
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory
    {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable)
        {
            Thread thread = new Thread(runnable, "cryptex-relay-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
