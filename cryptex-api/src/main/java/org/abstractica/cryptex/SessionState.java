package org.abstractica.cryptex;

/**
 * Lifecycle state of a peer session.
 *
 * <p>Transitions only move forward:
 * {@code DISCONNECTED -> AUTHENTICATING -> AUTHENTICATED -> ACTIVE -> CLOSED}.
 * A failure at any point moves directly to {@code CLOSED}.</p>
 */
public enum SessionState
{
    /**
     * Created but not yet connected.
     */
    DISCONNECTED,

    /**
     * Socket open, AUTH sent, waiting for the relay's answer.
     */
    AUTHENTICATING,

    /**
     * The relay accepted the identity; the receive loop is not running yet.
     */
    AUTHENTICATED,

    /**
     * Receive loop running; messages may be sent.
     */
    ACTIVE,

    /**
     * Terminal state.
     */
    CLOSED
}
