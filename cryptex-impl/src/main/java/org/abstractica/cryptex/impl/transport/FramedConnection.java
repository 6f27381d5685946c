package org.abstractica.cryptex.impl.transport;

import org.abstractica.cryptex.impl.protocol.Direction;
import org.abstractica.cryptex.impl.protocol.Envelope;
import org.abstractica.cryptex.impl.protocol.EnvelopeCodec;
import org.abstractica.cryptex.impl.protocol.ProtocolConstants;
import org.abstractica.cryptex.impl.protocol.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Envelope-level view of a TCP socket.
 *
 * <p>Writes are serialized by a per-connection lock, so any thread may send.
 * Reads are meant for a single receiving thread. Undecodable envelopes are
 * logged, reported to the malformed handler and skipped.</p>
 */
public class FramedConnection implements AutoCloseable
{
    private static final Logger LOG = LoggerFactory.getLogger(FramedConnection.class);

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final Direction inbound;
    private final StreamFramer framer;
    private final String remoteAddress;
    private final ReentrantLock writeLock = new ReentrantLock();
    private final Deque<byte[]> pending = new ArrayDeque<>();
    private final byte[] readBuffer = new byte[ProtocolConstants.READ_BUFFER_SIZE];
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile Consumer<ProtocolException> malformedHandler = e -> {};

    /**
     * Wraps a connected socket.
     *
     * @param socket          the socket
     * @param inbound         direction of envelopes read from this socket
     * @param maxEnvelopeSize largest envelope accepted from the peer
     * @throws IOException if the socket streams cannot be opened
     */
    public FramedConnection(Socket socket, Direction inbound, int maxEnvelopeSize) throws IOException
    {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.inbound = Objects.requireNonNull(inbound, "inbound");
        this.framer = new StreamFramer(maxEnvelopeSize);
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
        this.remoteAddress = String.valueOf(socket.getRemoteSocketAddress());
    }

    /**
     * Sets a callback for envelopes that were received but could not be decoded.
     *
     * @param handler the callback
     */
    public void onMalformed(Consumer<ProtocolException> handler)
    {
        this.malformedHandler = Objects.requireNonNull(handler, "handler");
    }

    // ========== Sending ==========

    /**
     * Writes one envelope followed by the delimiter and flushes.
     *
     * @param envelope the envelope
     * @throws IOException if the write fails or the connection is closed
     */
    public void send(Envelope envelope) throws IOException
    {
        byte[] framed = StreamFramer.frame(EnvelopeCodec.encode(envelope));

        writeLock.lock();
        try
        {
            if (closed.get())
            {
                throw new SocketException("Connection closed");
            }
            out.write(framed);
            out.flush();
        }
        finally
        {
            writeLock.unlock();
        }
    }

    // ========== Receiving ==========

    /**
     * Blocks until the next valid envelope arrives.
     *
     * @return the envelope, or empty at end of stream
     * @throws IOException       on transport failure, including read timeouts
     * @throws ProtocolException if the peer exceeds the maximum envelope size
     */
    public Optional<Envelope> receive() throws IOException, ProtocolException
    {
        return next(true);
    }

    /**
     * Blocks until the next envelope arrives, failing instead of skipping if it cannot be decoded.
     *
     * @return the envelope, or empty at end of stream
     * @throws IOException       on transport failure, including read timeouts
     * @throws ProtocolException if the next envelope is malformed or too large
     */
    public Optional<Envelope> receiveStrict() throws IOException, ProtocolException
    {
        return next(false);
    }

    private Optional<Envelope> next(boolean skipMalformed) throws IOException, ProtocolException
    {
        while (true)
        {
            while (!pending.isEmpty())
            {
                byte[] span = pending.poll();
                try
                {
                    return Optional.of(EnvelopeCodec.decode(span, inbound));
                }
                catch (ProtocolException e)
                {
                    if (!skipMalformed)
                    {
                        throw e;
                    }
                    LOG.warn("Dropping malformed envelope from {}: {}", remoteAddress, e.getMessage());
                    notifyMalformed(e);
                }
            }

            int read = in.read(readBuffer);
            if (read < 0)
            {
                return Optional.empty();
            }
            pending.addAll(framer.feed(readBuffer, 0, read));
        }
    }

    /**
     * Sets how long {@link #receive()} may block before failing with a timeout.
     *
     * @param timeout the timeout, or {@link Duration#ZERO} for none
     * @throws SocketException if the socket rejects the setting
     */
    public void setReadTimeout(Duration timeout) throws SocketException
    {
        socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, timeout.toMillis()));
    }

    // ========== Lifecycle ==========

    public String getRemoteAddress()
    {
        return remoteAddress;
    }

    public boolean isClosed()
    {
        return closed.get();
    }

    /**
     * Closes the socket. Idempotent; a blocked {@link #receive()} fails or sees end of stream.
     */
    @Override
    public void close()
    {
        if (!closed.compareAndSet(false, true))
        {
            return;
        }
        try
        {
            socket.close();
        }
        catch (IOException e)
        {
            LOG.debug("Error closing connection to {}: {}", remoteAddress, e.getMessage());
        }
    }

    private void notifyMalformed(ProtocolException e)
    {
        try
        {
            malformedHandler.accept(e);
        }
        catch (Exception ex)
        {
            LOG.error("Malformed envelope handler error", ex);
        }
    }
}
