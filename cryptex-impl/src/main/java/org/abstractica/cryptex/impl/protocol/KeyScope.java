package org.abstractica.cryptex.impl.protocol;

import java.util.Optional;

/**
 * What a distributed session key protects.
 */
public enum KeyScope
{
    /** Messages from the sender to this one recipient. */
    DIRECT,

    /** Broadcasts from the sender, received by everyone. */
    BROADCAST;

    public static Optional<KeyScope> fromWire(String value)
    {
        for (KeyScope scope : values())
        {
            if (scope.name().equals(value))
            {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }
}
