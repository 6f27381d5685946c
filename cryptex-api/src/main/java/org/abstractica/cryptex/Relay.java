package org.abstractica.cryptex;

import java.net.InetSocketAddress;
import java.util.List;

/**
 * A relay that authenticates peers and forwards their encrypted envelopes.
 *
 * <p>The relay keeps the directory of connected identities and their public
 * keys, distributes those keys to every peer and forwards message payloads
 * without being able to read them.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Relay relay = relayFactory.builder()
 *     .port(5555)
 *     .auditSink(auditSink)
 *     .build();
 *
 * relay.start();
 * }</pre>
 */
public interface Relay extends AutoCloseable
{
    /**
     * Binds the listening socket and starts accepting connections.
     *
     * <p>This method returns once the socket is bound; connections are
     * served on background threads.</p>
     *
     * @throws java.io.UncheckedIOException if the socket cannot be bound
     */
    void start();

    /**
     * Stops accepting new connections.
     *
     * <p>Connected peers stay online until {@link #close()}.</p>
     */
    void stop();

    /**
     * Disconnects every peer and releases the listening socket.
     */
    @Override
    void close();

    /**
     * Returns the address the relay is listening on.
     *
     * @return the bound address, or null if not started
     */
    InetSocketAddress getLocalAddress();

    /**
     * Returns the identities currently online, in registration order.
     *
     * @return unmodifiable list of identities
     */
    List<String> getOnlineIdentities();

    /**
     * Returns relay statistics.
     *
     * @return current statistics snapshot
     */
    RelayStats getStats();
}
