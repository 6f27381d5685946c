package org.abstractica.cryptex.impl.relay;

import org.abstractica.cryptex.RelayStats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Live counters of a relay.
 */
public class DefaultRelayStats implements RelayStats
{
    private final SessionDirectory directory;
    private final AtomicLong acceptedConnections = new AtomicLong(0);
    private final AtomicLong rejectedAuthentications = new AtomicLong(0);
    private final AtomicLong routedEnvelopes = new AtomicLong(0);
    private final AtomicLong droppedEnvelopes = new AtomicLong(0);

    /**
     * Creates stats for a directory.
     *
     * @param directory the directory whose size is reported as online peers
     */
    public DefaultRelayStats(SessionDirectory directory)
    {
        this.directory = directory;
    }

    @Override
    public int getOnlinePeers()
    {
        return directory.size();
    }

    @Override
    public long getAcceptedConnections()
    {
        return acceptedConnections.get();
    }

    @Override
    public long getRejectedAuthentications()
    {
        return rejectedAuthentications.get();
    }

    @Override
    public long getRoutedEnvelopes()
    {
        return routedEnvelopes.get();
    }

    @Override
    public long getDroppedEnvelopes()
    {
        return droppedEnvelopes.get();
    }

    // ========== Recording ==========

    void recordAccepted()
    {
        acceptedConnections.incrementAndGet();
    }

    void recordRejected()
    {
        rejectedAuthentications.incrementAndGet();
    }

    void recordRouted()
    {
        routedEnvelopes.incrementAndGet();
    }

    void recordDropped()
    {
        droppedEnvelopes.incrementAndGet();
    }

    @Override
    public String toString()
    {
        return String.format("RelayStats[online=%d, accepted=%d, rejected=%d, routed=%d, dropped=%d]",
                getOnlinePeers(), getAcceptedConnections(), getRejectedAuthentications(),
                getRoutedEnvelopes(), getDroppedEnvelopes());
    }
}
