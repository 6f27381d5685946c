package org.abstractica.cryptex.handlers;

import java.util.List;

/**
 * Receives decrypted messages and session events from a chat client.
 *
 * <p>All methods are called from the client's receive thread (or from the
 * thread calling {@code connect}/{@code disconnect} for connection state).
 * Implementations that drive a UI must hand the values over to their own
 * rendering thread and must not block. Exceptions thrown by a listener are
 * logged and otherwise ignored; they never end the session.</p>
 *
 * <p>Every method has an empty default so listeners implement only what they need.</p>
 */
public interface ChatListener
{
    /**
     * A message was received and decrypted.
     *
     * @param sender    the authenticated sender identity
     * @param text      the plaintext
     * @param broadcast true if the sender addressed everyone
     */
    default void onMessage(String sender, String text, boolean broadcast) {}

    /**
     * The set of online identities changed.
     *
     * @param identities online identities, including this client
     */
    default void onDirectoryChanged(List<String> identities) {}

    /**
     * The connection was established or lost.
     *
     * @param connected true once authenticated, false when the session ends
     * @param reason    human-readable detail
     */
    default void onConnectionState(boolean connected, String reason) {}

    /**
     * A recoverable problem occurred, such as a message that could not be decrypted.
     *
     * @param message human-readable description
     */
    default void onError(String message) {}
}
