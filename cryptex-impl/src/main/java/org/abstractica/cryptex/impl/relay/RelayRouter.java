package org.abstractica.cryptex.impl.relay;

import org.abstractica.cryptex.AuditSink;
import org.abstractica.cryptex.Identities;
import org.abstractica.cryptex.RejectReason;
import org.abstractica.cryptex.impl.crypto.CryptoException;
import org.abstractica.cryptex.impl.crypto.RsaKeys;
import org.abstractica.cryptex.impl.protocol.Envelope;
import org.abstractica.cryptex.impl.protocol.EnvelopeType;
import org.abstractica.cryptex.impl.protocol.KeyScope;
import org.abstractica.cryptex.impl.protocol.ProtocolConstants;
import org.abstractica.cryptex.impl.protocol.UserListCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Authentication, directory maintenance and envelope dispatch of the relay.
 *
 * <p>The router works on {@link PeerHandle}s only and never touches sockets, so
 * it can be driven directly by tests. Payload fields are forwarded untouched;
 * the router never holds a key that could open them.</p>
 *
 * <p>Every directory change and the fan-out that announces it run under the
 * directory lock, so peers observe registrations and removals in one order.
 * A target whose send fails during a fan-out is removed and closed, the fan-out
 * continues with the rest, and a fresh USER_LIST follows.</p>
 */
public class RelayRouter
{
    private static final Logger LOG = LoggerFactory.getLogger(RelayRouter.class);

    private final SessionDirectory directory;
    private final AuditSink audit;
    private final DefaultRelayStats stats;
    private final int maxSessions;

    /**
     * Creates a router.
     *
     * @param directory   the directory to maintain
     * @param audit       receiver of security events
     * @param stats       counters to update
     * @param maxSessions maximum concurrent sessions (0 for unlimited)
     */
    public RelayRouter(SessionDirectory directory, AuditSink audit, DefaultRelayStats stats, int maxSessions)
    {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.audit = Objects.requireNonNull(audit, "audit");
        this.stats = Objects.requireNonNull(stats, "stats");
        if (maxSessions < 0)
        {
            throw new IllegalArgumentException("maxSessions must be >= 0: " + maxSessions);
        }
        this.maxSessions = maxSessions;
    }

    // ========== Authentication ==========

    /**
     * Handles the first envelope of a connection.
     *
     * <p>On success the peer is registered, acknowledged and announced; on
     * failure it receives AUTH_REJECTED and its handle is closed.</p>
     *
     * @param handle   the new connection
     * @param envelope the first envelope it sent
     * @return the registered identity, or empty if rejected
     */
    public Optional<String> authenticate(PeerHandle handle, Envelope envelope)
    {
        Objects.requireNonNull(handle, "handle");
        Objects.requireNonNull(envelope, "envelope");

        if (envelope.type() != EnvelopeType.AUTH || envelope.fields().size() != 2)
        {
            reject(handle, ProtocolConstants.UNKNOWN_IDENTITY, RejectReason.MALFORMED_AUTH,
                    "Invalid authentication");
            return Optional.empty();
        }

        String identity = envelope.field(0);
        String publicKeyPem = envelope.field(1);

        Optional<String> invalid = Identities.validate(identity);
        if (invalid.isPresent())
        {
            reject(handle, identity, RejectReason.INVALID_IDENTITY, invalid.get());
            return Optional.empty();
        }

        try
        {
            RsaKeys.importPublicKey(publicKeyPem);
        }
        catch (CryptoException e)
        {
            reject(handle, identity, RejectReason.MALFORMED_KEY, "Invalid public key");
            return Optional.empty();
        }

        DirectoryEntry entry = new DirectoryEntry(identity, handle, publicKeyPem, handle.getRemoteAddress());
        boolean registered = directory.exclusive(() -> register(entry));
        return registered ? Optional.of(identity) : Optional.empty();
    }

    /**
     * Rejects an authentication attempt: audits it, sends AUTH_REJECTED and closes the handle.
     *
     * @param handle          the connection
     * @param claimedIdentity the identity it claimed, or {@code UNKNOWN}
     * @param reason          why it is rejected
     * @param message         text sent to the peer
     */
    public void reject(PeerHandle handle, String claimedIdentity, RejectReason reason, String message)
    {
        LOG.info("Rejecting {} from {}: {} ({})", claimedIdentity, handle.getRemoteAddress(), reason, message);
        stats.recordRejected();
        audit.authFailure(claimedIdentity, handle.getRemoteAddress(), message);
        try
        {
            handle.send(Envelope.authRejected(reason, message));
        }
        catch (IOException e)
        {
            LOG.debug("Could not deliver rejection to {}: {}", handle.getRemoteAddress(), e.getMessage());
        }
        handle.close();
    }

    private boolean register(DirectoryEntry entry)
    {
        String identity = entry.identity();
        PeerHandle handle = entry.handle();

        if (maxSessions > 0 && directory.size() >= maxSessions)
        {
            reject(handle, identity, RejectReason.SERVER_FULL, "Server is full");
            return false;
        }
        if (!directory.tryRegister(entry))
        {
            reject(handle, identity, RejectReason.IDENTITY_TAKEN, "Username '" + identity + "' already taken");
            return false;
        }

        try
        {
            handle.send(Envelope.authAccepted());
        }
        catch (IOException e)
        {
            LOG.warn("Lost {} before acknowledging authentication: {}", identity, e.getMessage());
            directory.remove(identity, handle);
            handle.close();
            return false;
        }

        LOG.info("{} authenticated from {}", identity, entry.remoteAddress());
        audit.authSuccess(identity, entry.remoteAddress());
        audit.connection(identity, entry.remoteAddress(), "CONNECTED");

        FanOut fanOut = new FanOut();
        fanOut.toAll(userListEnvelope());

        for (Map.Entry<String, String> other : directory.publicKeysExcluding(identity).entrySet())
        {
            if (fanOut.deliver(entry, Envelope.keyExchange(other.getKey(), other.getValue())))
            {
                audit.keyExchange(other.getKey(), identity);
            }
        }

        Envelope announcement = Envelope.keyExchange(identity, entry.publicKeyPem());
        for (DirectoryEntry other : directory.snapshot())
        {
            if (other.handle() != handle && fanOut.deliver(other, announcement))
            {
                audit.keyExchange(identity, other.identity());
            }
        }

        fanOut.finish();
        return directory.find(identity).map(e -> e.handle() == handle).orElse(false);
    }

    // ========== Routing ==========

    /**
     * Dispatches an envelope from an authenticated peer.
     *
     * @param sender   the sender's authenticated identity
     * @param envelope the envelope it sent
     * @return false if the sender asked to disconnect
     */
    public boolean route(String sender, Envelope envelope)
    {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(envelope, "envelope");

        switch (envelope.type())
        {
            case MESSAGE:
                routeDirect(sender, envelope, envelope.field(0));
                return true;
            case SESSION_KEY:
                if (KeyScope.fromWire(envelope.field(1)).isEmpty())
                {
                    suspicious(sender, "Session key with unknown scope");
                    return true;
                }
                routeDirect(sender, envelope, envelope.field(0));
                return true;
            case BROADCAST:
                routeBroadcast(sender, envelope);
                return true;
            case DISCONNECT:
                LOG.debug("{} requested disconnect", sender);
                return false;
            default:
                suspicious(sender, "Unexpected " + envelope.type() + " after authentication");
                return true;
        }
    }

    /**
     * Records an envelope that could not be decoded.
     *
     * @param sender  the sender's identity
     * @param details what was wrong
     */
    public void malformed(String sender, String details)
    {
        suspicious(sender, "Malformed envelope: " + details);
    }

    private void routeDirect(String sender, Envelope envelope, String recipient)
    {
        if (recipient.equals(sender))
        {
            suspicious(sender, envelope.type() + " addressed to self");
            return;
        }

        Envelope forwarded = Envelope.forwarded(sender, envelope);
        directory.exclusive(() ->
        {
            Optional<DirectoryEntry> target = directory.find(recipient);
            if (target.isEmpty())
            {
                LOG.debug("Dropping {} from {} to offline {}", envelope.type(), sender, recipient);
                stats.recordDropped();
                return;
            }

            FanOut fanOut = new FanOut();
            if (fanOut.deliver(target.get(), forwarded))
            {
                stats.recordRouted();
                if (envelope.type() == EnvelopeType.SESSION_KEY)
                {
                    audit.keyExchange(sender, recipient);
                }
                else
                {
                    audit.messageRouted(sender, recipient);
                }
            }
            else
            {
                stats.recordDropped();
            }
            fanOut.finish();
        });
    }

    private void routeBroadcast(String sender, Envelope envelope)
    {
        Envelope forwarded = Envelope.forwarded(sender, envelope);
        directory.exclusive(() ->
        {
            FanOut fanOut = new FanOut();
            for (DirectoryEntry entry : directory.snapshot())
            {
                if (!entry.identity().equals(sender))
                {
                    fanOut.deliver(entry, forwarded);
                }
            }
            stats.recordRouted();
            audit.messageRouted(sender, ProtocolConstants.EVERYONE);
            fanOut.finish();
        });
    }

    private void suspicious(String identity, String activity)
    {
        LOG.warn("Suspicious activity from {}: {}", identity, activity);
        stats.recordDropped();
        audit.suspicious(identity, activity);
    }

    // ========== Teardown ==========

    /**
     * Removes a peer whose connection ended and announces the new directory.
     *
     * <p>Nothing happens if the identity is no longer bound to this handle.</p>
     *
     * @param identity the peer's identity
     * @param handle   the connection that ended
     */
    public void disconnect(String identity, PeerHandle handle)
    {
        directory.exclusive(() ->
        {
            if (!directory.remove(identity, handle))
            {
                return;
            }
            LOG.info("{} disconnected", identity);
            audit.connection(identity, handle.getRemoteAddress(), "DISCONNECTED");
            FanOut fanOut = new FanOut();
            fanOut.toAll(userListEnvelope());
            fanOut.finish();
        });
        handle.close();
    }

    /**
     * Tells every peer the relay is going away and closes all connections.
     *
     * @param reason text sent in the DISCONNECT envelope
     */
    public void shutdown(String reason)
    {
        List<DirectoryEntry> removed = directory.exclusive(() ->
        {
            List<DirectoryEntry> entries = directory.clear();
            Envelope goodbye = Envelope.disconnect(reason);
            for (DirectoryEntry entry : entries)
            {
                try
                {
                    entry.handle().send(goodbye);
                }
                catch (IOException e)
                {
                    LOG.debug("Could not notify {} of shutdown: {}", entry.identity(), e.getMessage());
                }
            }
            return entries;
        });

        for (DirectoryEntry entry : removed)
        {
            entry.handle().close();
        }
        LOG.info("Disconnected {} peers: {}", removed.size(), reason);
    }

    private Envelope userListEnvelope()
    {
        return Envelope.userList(UserListCodec.encode(directory.identities()));
    }

    // ========== Fan-out ==========

    /**
     * Delivery to several peers within one locked section.
     *
     * <p>Must be used while holding the directory lock.</p>
     */
    private class FanOut
    {
        private final Set<PeerHandle> failed = Collections.newSetFromMap(new IdentityHashMap<>());

        boolean deliver(DirectoryEntry target, Envelope envelope)
        {
            if (failed.contains(target.handle()))
            {
                return false;
            }
            try
            {
                target.handle().send(envelope);
                return true;
            }
            catch (IOException e)
            {
                LOG.warn("Send to {} failed, removing: {}", target.identity(), e.getMessage());
                failed.add(target.handle());
                if (directory.remove(target.identity(), target.handle()))
                {
                    audit.connection(target.identity(), target.remoteAddress(), "DISCONNECTED");
                }
                target.handle().close();
                return false;
            }
        }

        void toAll(Envelope envelope)
        {
            for (DirectoryEntry entry : directory.snapshot())
            {
                deliver(entry, envelope);
            }
        }

        /**
         * Announces the directory again until an announcement completes without losing anyone.
         */
        void finish()
        {
            while (!failed.isEmpty())
            {
                LOG.debug("Re-announcing directory after losing {} peers", failed.size());
                failed.clear();
                toAll(userListEnvelope());
            }
        }
    }
}
