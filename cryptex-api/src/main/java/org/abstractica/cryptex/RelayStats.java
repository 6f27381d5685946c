package org.abstractica.cryptex;

/**
 * Relay statistics for monitoring.
 *
 * <p>Values are pollable counters; the application decides where to push them.</p>
 */
public interface RelayStats
{
    /**
     * Returns the number of authenticated peers.
     *
     * @return online peer count
     */
    int getOnlinePeers();

    /**
     * Returns the number of TCP connections accepted since start.
     *
     * @return accepted connection count
     */
    long getAcceptedConnections();

    /**
     * Returns the number of authentication attempts that were rejected.
     *
     * @return rejected authentication count
     */
    long getRejectedAuthentications();

    /**
     * Returns the number of envelopes forwarded to at least one peer.
     *
     * @return routed envelope count
     */
    long getRoutedEnvelopes();

    /**
     * Returns the number of envelopes dropped (malformed, unknown type or
     * addressed to an identity that is not online).
     *
     * @return dropped envelope count
     */
    long getDroppedEnvelopes();
}
