package org.abstractica.cryptex.impl.client;

import org.abstractica.cryptex.impl.crypto.ConversationKey;
import org.abstractica.cryptex.impl.crypto.CryptoException;
import org.abstractica.cryptex.impl.crypto.RsaKeys;
import org.abstractica.cryptex.impl.protocol.KeyScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.PublicKey;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A client's knowledge about its peers: their public keys and the conversation
 * keys shared with them.
 *
 * <p>Outbound keys are chosen by this client, one per recipient plus one for its
 * broadcasts. Inbound keys were chosen by a peer and are looked up by
 * (sender, scope). When a peer's public key changes, or the peer leaves the
 * directory, every key shared with it is forgotten.</p>
 *
 * <p>All methods are synchronized; the receive thread and senders share one instance.</p>
 */
public class PeerKeyring
{
    private static final Logger LOG = LoggerFactory.getLogger(PeerKeyring.class);

    private final Map<String, String> publicKeyPems = new LinkedHashMap<>();
    private final Map<String, PublicKey> publicKeys = new HashMap<>();
    private final Map<String, ConversationKey> outbound = new HashMap<>();
    private final Set<String> broadcastKeyHolders = new HashSet<>();
    private final Map<InboundKey, ConversationKey> inbound = new HashMap<>();
    private ConversationKey broadcastKey;

    // ========== Public Keys ==========

    /**
     * Records a peer's public key.
     *
     * @param identity the peer
     * @param pem      its public key
     * @return true if the key is new or differs from the one known before
     * @throws CryptoException with {@link CryptoException.Reason#MALFORMED_KEY} if the PEM does not parse
     */
    public synchronized boolean updatePublicKey(String identity, String pem) throws CryptoException
    {
        String known = publicKeyPems.get(identity);
        if (pem.equals(known))
        {
            return false;
        }

        PublicKey key = RsaKeys.importPublicKey(pem);
        if (known != null)
        {
            LOG.info("Public key of {} changed, resetting conversation keys", identity);
            forgetConversation(identity);
        }
        publicKeyPems.put(identity, pem);
        publicKeys.put(identity, key);
        return true;
    }

    public synchronized Optional<PublicKey> publicKey(String identity)
    {
        return Optional.ofNullable(publicKeys.get(identity));
    }

    /**
     * Returns the peers whose public key is known.
     *
     * @return identities in the order their keys arrived
     */
    public synchronized List<String> knownPeers()
    {
        return new ArrayList<>(publicKeyPems.keySet());
    }

    /**
     * Forgets every peer not in the given collection.
     *
     * @param online the identities currently online
     */
    public synchronized void retainOnly(Collection<String> online)
    {
        for (String identity : knownPeers())
        {
            if (!online.contains(identity))
            {
                LOG.debug("Forgetting keys of {}", identity);
                publicKeyPems.remove(identity);
                publicKeys.remove(identity);
                forgetConversation(identity);
            }
        }
        outbound.keySet().retainAll(online);
        broadcastKeyHolders.retainAll(online);
        inbound.keySet().removeIf(k -> !online.contains(k.sender()));
    }

    // ========== Outbound Keys ==========

    public synchronized Optional<ConversationKey> outbound(String recipient)
    {
        return Optional.ofNullable(outbound.get(recipient));
    }

    /**
     * Remembers the key sent to a recipient, unless the recipient's public key
     * changed or was forgotten while the key was being sent.
     *
     * @param recipient  the peer
     * @param key        the conversation key
     * @param wrappedFor the public key the conversation key was wrapped with
     * @return true if the key was stored
     */
    public synchronized boolean storeOutbound(String recipient, ConversationKey key, PublicKey wrappedFor)
    {
        if (!isCurrent(recipient, wrappedFor))
        {
            LOG.debug("Not keeping session key for {}: public key no longer current", recipient);
            return false;
        }
        outbound.put(recipient, key);
        return true;
    }

    /**
     * Returns the key protecting this client's broadcasts, creating it on first use.
     *
     * @return the broadcast key
     */
    public synchronized ConversationKey broadcastKey()
    {
        if (broadcastKey == null)
        {
            broadcastKey = ConversationKey.generate();
        }
        return broadcastKey;
    }

    /**
     * Returns the known peers that have not yet received the broadcast key.
     *
     * @return identities lacking the broadcast key
     */
    public synchronized List<String> peersLackingBroadcastKey()
    {
        List<String> lacking = new ArrayList<>();
        for (String identity : publicKeyPems.keySet())
        {
            if (!broadcastKeyHolders.contains(identity))
            {
                lacking.add(identity);
            }
        }
        return lacking;
    }

    /**
     * Records that the broadcast key reached a recipient, under the same
     * currency rule as {@link #storeOutbound}.
     *
     * @param recipient  the peer
     * @param wrappedFor the public key the broadcast key was wrapped with
     * @return true if recorded
     */
    public synchronized boolean markBroadcastKeySent(String recipient, PublicKey wrappedFor)
    {
        if (!isCurrent(recipient, wrappedFor))
        {
            return false;
        }
        broadcastKeyHolders.add(recipient);
        return true;
    }

    // ========== Inbound Keys ==========

    public synchronized void storeInbound(String sender, KeyScope scope, ConversationKey key)
    {
        inbound.put(new InboundKey(sender, scope), key);
    }

    public synchronized Optional<ConversationKey> inbound(String sender, KeyScope scope)
    {
        return Optional.ofNullable(inbound.get(new InboundKey(sender, scope)));
    }

    private boolean isCurrent(String identity, PublicKey key)
    {
        return key != null && key.equals(publicKeys.get(identity));
    }

    private void forgetConversation(String identity)
    {
        outbound.remove(identity);
        broadcastKeyHolders.remove(identity);
        for (KeyScope scope : KeyScope.values())
        {
            inbound.remove(new InboundKey(identity, scope));
        }
    }

    private record InboundKey(String sender, KeyScope scope) {}
}
