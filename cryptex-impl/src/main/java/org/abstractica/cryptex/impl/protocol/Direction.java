package org.abstractica.cryptex.impl.protocol;

/**
 * Which way an envelope travels. Each envelope type has its own field layout per direction.
 */
public enum Direction
{
    /** Peer to relay. */
    UPSTREAM,

    /** Relay to peer. */
    DOWNSTREAM
}
