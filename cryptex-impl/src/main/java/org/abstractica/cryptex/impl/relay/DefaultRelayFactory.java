package org.abstractica.cryptex.impl.relay;

import org.abstractica.cryptex.AuditSink;
import org.abstractica.cryptex.Relay;
import org.abstractica.cryptex.RelayFactory;
import org.abstractica.cryptex.impl.audit.LoggingAuditSink;
import org.abstractica.cryptex.impl.protocol.ProtocolConstants;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of RelayFactory.
 *
 * <p>Creates DefaultRelay instances using a builder pattern. Unless another sink
 * is configured, audit events go to the {@code cryptex.audit} logger.</p>
 */
public class DefaultRelayFactory implements RelayFactory
{
    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private String bindAddress = ProtocolConstants.DEFAULT_BIND_ADDRESS;
        private int port = ProtocolConstants.DEFAULT_PORT;
        private int backlog = ProtocolConstants.DEFAULT_BACKLOG;
        private int maxSessions = 0; // 0 = unlimited
        private Duration authTimeout = ProtocolConstants.DEFAULT_AUTH_TIMEOUT;
        private int maxEnvelopeSize = ProtocolConstants.DEFAULT_MAX_ENVELOPE_SIZE;
        private AuditSink auditSink;

        @Override
        public Builder bindAddress(String host)
        {
            this.bindAddress = Objects.requireNonNull(host, "host");
            return this;
        }

        @Override
        public Builder port(int port)
        {
            if (port < 0 || port > 65535)
            {
                throw new IllegalArgumentException("Port must be 0-65535: " + port);
            }
            this.port = port;
            return this;
        }

        @Override
        public Builder backlog(int backlog)
        {
            if (backlog <= 0)
            {
                throw new IllegalArgumentException("backlog must be positive: " + backlog);
            }
            this.backlog = backlog;
            return this;
        }

        @Override
        public Builder maxSessions(int maxSessions)
        {
            if (maxSessions < 0)
            {
                throw new IllegalArgumentException("maxSessions must be >= 0: " + maxSessions);
            }
            this.maxSessions = maxSessions;
            return this;
        }

        @Override
        public Builder authTimeout(Duration timeout)
        {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative() || timeout.isZero())
            {
                throw new IllegalArgumentException("Authentication timeout must be positive");
            }
            this.authTimeout = timeout;
            return this;
        }

        @Override
        public Builder maxEnvelopeSize(int bytes)
        {
            if (bytes <= 0)
            {
                throw new IllegalArgumentException("maxEnvelopeSize must be positive: " + bytes);
            }
            this.maxEnvelopeSize = bytes;
            return this;
        }

        @Override
        public Builder auditSink(AuditSink auditSink)
        {
            this.auditSink = Objects.requireNonNull(auditSink, "auditSink");
            return this;
        }

        @Override
        public Relay build()
        {
            AuditSink sink = auditSink != null ? auditSink : new LoggingAuditSink();
            return new DefaultRelay(
                    new InetSocketAddress(bindAddress, port),
                    backlog,
                    maxSessions,
                    authTimeout,
                    maxEnvelopeSize,
                    sink
            );
        }
    }
}
