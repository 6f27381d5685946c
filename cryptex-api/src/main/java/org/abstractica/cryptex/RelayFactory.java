package org.abstractica.cryptex;

import java.time.Duration;

/**
 * Factory for creating Relay instances.
 *
 * <p>Use the builder to configure the relay before creation:</p>
 * <pre>{@code
 * RelayFactory factory = new DefaultRelayFactory();
 * Relay relay = factory.builder()
 *     .bindAddress("0.0.0.0")
 *     .port(5555)
 *     .maxSessions(50)
 *     .build();
 * }</pre>
 */
public interface RelayFactory
{
    /**
     * Default TCP port of the relay.
     */
    int DEFAULT_PORT = 5555;

    /**
     * Creates a new relay builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a Relay.
     */
    interface Builder
    {
        /**
         * Sets the host or address to bind to.
         *
         * <p>Optional. Defaults to all interfaces.</p>
         *
         * @param host the bind host
         * @return this builder
         */
        Builder bindAddress(String host);

        /**
         * Sets the port to listen on.
         *
         * <p>Optional. Defaults to {@link #DEFAULT_PORT}. Zero picks an
         * ephemeral port.</p>
         *
         * @param port the port number
         * @return this builder
         */
        Builder port(int port);

        /**
         * Sets the listen backlog of the server socket.
         *
         * <p>Optional. Defaults to 10.</p>
         *
         * @param backlog pending connection queue length
         * @return this builder
         */
        Builder backlog(int backlog);

        /**
         * Sets the maximum number of authenticated peers.
         *
         * <p>Optional. Defaults to unlimited (0).</p>
         *
         * @param maxSessions maximum online peers
         * @return this builder
         */
        Builder maxSessions(int maxSessions);

        /**
         * Sets how long a new connection may take to authenticate.
         *
         * <p>Optional. Defaults to 30 seconds.</p>
         *
         * @param timeout the authentication timeout
         * @return this builder
         */
        Builder authTimeout(Duration timeout);

        /**
         * Sets the largest envelope the relay will buffer from a peer.
         *
         * <p>Optional. Defaults to 1 MiB.</p>
         *
         * @param bytes maximum envelope size in bytes
         * @return this builder
         */
        Builder maxEnvelopeSize(int bytes);

        /**
         * Sets the sink receiving security audit events.
         *
         * <p>Optional. Defaults to a sink writing to the {@code cryptex.audit} logger.</p>
         *
         * @param auditSink the audit sink
         * @return this builder
         */
        Builder auditSink(AuditSink auditSink);

        /**
         * Builds the relay.
         *
         * @return the configured relay (not yet started)
         */
        Relay build();
    }
}
