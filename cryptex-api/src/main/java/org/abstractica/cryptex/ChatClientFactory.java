package org.abstractica.cryptex;

import org.abstractica.cryptex.handlers.ChatListener;

import java.time.Duration;

/**
 * Factory for creating ChatClient instances.
 *
 * <pre>{@code
 * ChatClient client = new DefaultChatClientFactory().builder()
 *     .serverAddress("localhost", 5555)
 *     .identity("Alice")
 *     .build();
 * }</pre>
 */
public interface ChatClientFactory
{
    /**
     * Creates a new client builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a ChatClient.
     */
    interface Builder
    {
        /**
         * Sets the relay address.
         *
         * <p>Optional. Defaults to {@code localhost:5555}.</p>
         *
         * @param host the relay host
         * @param port the relay port
         * @return this builder
         */
        Builder serverAddress(String host, int port);

        /**
         * Sets the identity to authenticate as.
         *
         * @param identity display name, see {@link Identities}
         * @return this builder
         */
        Builder identity(String identity);

        /**
         * Sets the RSA modulus size of the generated key pair.
         *
         * <p>Optional. Defaults to 2048 bits.</p>
         *
         * @param bits modulus size in bits
         * @return this builder
         */
        Builder rsaKeySize(int bits);

        /**
         * Sets the TCP connect timeout.
         *
         * <p>Optional. Defaults to 10 seconds.</p>
         *
         * @param timeout the connect timeout
         * @return this builder
         */
        Builder connectTimeout(Duration timeout);

        /**
         * Sets how long to wait for the relay's authentication reply.
         *
         * <p>Optional. Defaults to 30 seconds.</p>
         *
         * @param timeout the authentication timeout
         * @return this builder
         */
        Builder authTimeout(Duration timeout);

        /**
         * Sets the largest envelope the client will buffer.
         *
         * <p>Optional. Defaults to 1 MiB.</p>
         *
         * @param bytes maximum envelope size in bytes
         * @return this builder
         */
        Builder maxEnvelopeSize(int bytes);

        /**
         * Adds a listener. May be called more than once.
         *
         * @param listener the listener
         * @return this builder
         */
        Builder listener(ChatListener listener);

        /**
         * Builds the client.
         *
         * @return the configured client (not yet connected)
         * @throws IllegalStateException if the identity is missing
         */
        ChatClient build();
    }
}
