package org.abstractica.cryptex.impl.client;

import org.abstractica.cryptex.ChatClient;
import org.abstractica.cryptex.ChatClientFactory;
import org.abstractica.cryptex.handlers.ChatListener;
import org.abstractica.cryptex.impl.crypto.RsaKeys;
import org.abstractica.cryptex.impl.protocol.ProtocolConstants;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default implementation of ChatClientFactory.
 */
public class DefaultChatClientFactory implements ChatClientFactory
{
    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private String host = "localhost";
        private int port = ProtocolConstants.DEFAULT_PORT;
        private String identity;
        private int rsaKeySize = RsaKeys.DEFAULT_KEY_SIZE;
        private Duration connectTimeout = ProtocolConstants.DEFAULT_CONNECT_TIMEOUT;
        private Duration authTimeout = ProtocolConstants.DEFAULT_AUTH_TIMEOUT;
        private int maxEnvelopeSize = ProtocolConstants.DEFAULT_MAX_ENVELOPE_SIZE;
        private final List<ChatListener> listeners = new ArrayList<>();

        @Override
        public Builder serverAddress(String host, int port)
        {
            this.host = Objects.requireNonNull(host, "host");
            if (port < 1 || port > 65535)
            {
                throw new IllegalArgumentException("Port must be 1-65535: " + port);
            }
            this.port = port;
            return this;
        }

        @Override
        public Builder identity(String identity)
        {
            this.identity = Objects.requireNonNull(identity, "identity");
            return this;
        }

        @Override
        public Builder rsaKeySize(int bits)
        {
            if (bits < RsaKeys.MIN_KEY_SIZE)
            {
                throw new IllegalArgumentException("RSA key size must be at least " + RsaKeys.MIN_KEY_SIZE + ": " + bits);
            }
            this.rsaKeySize = bits;
            return this;
        }

        @Override
        public Builder connectTimeout(Duration timeout)
        {
            this.connectTimeout = positive(timeout, "Connect timeout");
            return this;
        }

        @Override
        public Builder authTimeout(Duration timeout)
        {
            this.authTimeout = positive(timeout, "Authentication timeout");
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
        public Builder listener(ChatListener listener)
        {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        @Override
        public ChatClient build()
        {
            if (identity == null)
            {
                throw new IllegalStateException("Identity must be specified");
            }
            return new DefaultChatClient(
                    host,
                    port,
                    identity,
                    rsaKeySize,
                    connectTimeout,
                    authTimeout,
                    maxEnvelopeSize,
                    listeners
            );
        }

        private static Duration positive(Duration timeout, String name)
        {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative() || timeout.isZero())
            {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return timeout;
        }
    }
}
