package org.abstractica.cryptex;

import org.abstractica.cryptex.handlers.ChatListener;

import java.util.List;
import java.util.Optional;

/**
 * A peer connected to a relay under one identity.
 *
 * <p>The client owns an RSA key pair generated for its lifetime, keeps the
 * public keys the relay distributes, and negotiates a symmetric key per
 * conversation before sending encrypted payloads. A dropped connection is
 * final: create a new client (and thus a new key pair) to reconnect.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ChatClient client = clientFactory.builder()
 *     .serverAddress("192.168.1.10", 5555)
 *     .identity("Alice")
 *     .listener(listener)
 *     .build();
 *
 * client.connect();
 * client.send("Bob", "hello");
 * client.broadcast("hi all");
 * }</pre>
 */
public interface ChatClient extends AutoCloseable
{
    /**
     * Recipient name that addresses every other online peer.
     */
    String EVERYONE = "ALL";

    /**
     * Connects and authenticates.
     *
     * <p>Blocks until the relay accepts or rejects the identity. On success
     * the client is {@link SessionState#ACTIVE} and the receive loop runs on a
     * background thread.</p>
     *
     * @throws ConnectionFailedException if the connection or authentication fails
     * @throws IllegalStateException     if connect was already called
     */
    void connect() throws ConnectionFailedException;

    /**
     * Sends an encrypted message to one peer, or to everyone when the
     * recipient is {@link #EVERYONE}.
     *
     * @param recipient the recipient identity
     * @param text      the plaintext
     * @return true if the envelope was handed to the transport, false if no
     *         key is known for the recipient or the write failed
     * @throws IllegalStateException if the client is not active
     */
    boolean send(String recipient, String text);

    /**
     * Sends an encrypted message to every other online peer.
     *
     * @param text the plaintext
     * @return true if the envelope was handed to the transport
     * @throws IllegalStateException if the client is not active
     */
    boolean broadcast(String text);

    /**
     * Disconnects from the relay. The client cannot be reused.
     */
    void disconnect();

    /**
     * Equivalent to {@link #disconnect()}.
     */
    @Override
    void close();

    /**
     * Registers a listener for messages and session events.
     *
     * <p>Listeners are called from the receive thread.</p>
     *
     * @param listener the listener to add
     */
    void addListener(ChatListener listener);

    /**
     * Returns this client's identity.
     *
     * @return the identity
     */
    String getIdentity();

    /**
     * Returns the current session state.
     *
     * @return the state
     */
    SessionState getState();

    /**
     * Returns the identities the relay last reported as online.
     *
     * @return unmodifiable list of identities (including this client)
     */
    List<String> getOnlineIdentities();

    /**
     * Returns why the session ended.
     *
     * @return the reason, or empty while the session has not ended
     */
    Optional<DisconnectReason> getDisconnectReason();
}
