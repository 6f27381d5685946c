package org.abstractica.cryptex;

/**
 * Consumer of security audit events emitted by the relay.
 *
 * <p>Implementations must be thread-safe; events are emitted from every
 * connection thread. They must not block for long, since some events are
 * emitted while the relay holds its directory lock.</p>
 */
public interface AuditSink
{
    /**
     * Sink that discards every event.
     */
    AuditSink NONE = new AuditSink()
    {
        @Override
        public void authSuccess(String identity, String address) {}

        @Override
        public void authFailure(String identity, String address, String reason) {}

        @Override
        public void keyExchange(String from, String to) {}

        @Override
        public void messageRouted(String sender, String recipient) {}

        @Override
        public void suspicious(String identity, String activity) {}
    };

    /**
     * A peer authenticated.
     *
     * @param identity the registered identity
     * @param address  the peer's remote address
     */
    void authSuccess(String identity, String address);

    /**
     * An authentication attempt was rejected.
     *
     * @param identity the claimed identity, or {@code UNKNOWN} if none could be read
     * @param address  the peer's remote address
     * @param reason   why it was rejected
     */
    void authFailure(String identity, String address, String reason);

    /**
     * Key material of one peer was delivered to another.
     *
     * @param from owner of the key
     * @param to   peer receiving it
     */
    void keyExchange(String from, String to);

    /**
     * An encrypted payload was forwarded.
     *
     * @param sender    the authenticated sender
     * @param recipient the recipient identity, or {@code ALL} for a broadcast
     */
    void messageRouted(String sender, String recipient);

    /**
     * A peer did something the protocol does not allow.
     *
     * @param identity the peer
     * @param activity what happened
     */
    void suspicious(String identity, String activity);

    /**
     * A peer connected or disconnected.
     *
     * @param identity the peer
     * @param address  the peer's remote address
     * @param action   {@code CONNECTED} or {@code DISCONNECTED}
     */
    default void connection(String identity, String address, String action) {}

    /**
     * A relay lifecycle event.
     *
     * @param event description of the event
     */
    default void serverEvent(String event) {}
}
