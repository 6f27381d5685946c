package org.abstractica.cryptex.impl.relay;

import java.util.Objects;

/**
 * One authenticated peer as known to the relay.
 *
 * @param identity      the peer's unique identity
 * @param handle        the connection to the peer
 * @param publicKeyPem  the peer's RSA public key, as it sent it
 * @param remoteAddress the peer's network address
 */
public record DirectoryEntry(
        String identity,
        PeerHandle handle,
        String publicKeyPem,
        String remoteAddress
)
{
    public DirectoryEntry
    {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(publicKeyPem, "publicKeyPem");
        Objects.requireNonNull(remoteAddress, "remoteAddress");
    }
}
