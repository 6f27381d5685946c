package org.abstractica.cryptex.impl.client;

import org.abstractica.cryptex.impl.crypto.ConversationKey;
import org.abstractica.cryptex.impl.crypto.CryptoException;
import org.abstractica.cryptex.impl.crypto.RsaKeys;
import org.abstractica.cryptex.impl.protocol.KeyScope;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.security.PublicKey;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeerKeyringTest
{
    private static String bobPem;
    private static String bobRotatedPem;
    private static String carolPem;

    private PeerKeyring keyring;

    @BeforeAll
    static void generateKeys()
    {
        bobPem = RsaKeys.exportPublicKey(RsaKeys.generateKeyPair(1024).getPublic());
        bobRotatedPem = RsaKeys.exportPublicKey(RsaKeys.generateKeyPair(1024).getPublic());
        carolPem = RsaKeys.exportPublicKey(RsaKeys.generateKeyPair(1024).getPublic());
    }

    @BeforeEach
    void setUp()
    {
        keyring = new PeerKeyring();
    }

    @Test
    void updatePublicKey_reportsOnlyNewOrChangedKeys() throws CryptoException
    {
        assertTrue(keyring.updatePublicKey("bob", bobPem));
        assertFalse(keyring.updatePublicKey("bob", bobPem));
        assertTrue(keyring.updatePublicKey("bob", bobRotatedPem));
        assertTrue(keyring.publicKey("bob").isPresent());
    }

    @Test
    void updatePublicKey_rejectsGarbageAndKeepsPreviousKey() throws CryptoException
    {
        keyring.updatePublicKey("bob", bobPem);

        CryptoException e = assertThrows(CryptoException.class, () -> keyring.updatePublicKey("bob", "nope"));

        assertEquals(CryptoException.Reason.MALFORMED_KEY, e.getReason());
        assertEquals(RsaKeys.importPublicKey(bobPem), keyring.publicKey("bob").orElseThrow());
    }

    @Test
    void changedKey_forgetsConversationState() throws CryptoException
    {
        keyring.updatePublicKey("bob", bobPem);
        PublicKey bobKey = keyring.publicKey("bob").orElseThrow();
        assertTrue(keyring.storeOutbound("bob", ConversationKey.generate(), bobKey));
        keyring.storeInbound("bob", KeyScope.DIRECT, ConversationKey.generate());
        keyring.storeInbound("bob", KeyScope.BROADCAST, ConversationKey.generate());
        assertTrue(keyring.markBroadcastKeySent("bob", bobKey));

        keyring.updatePublicKey("bob", bobRotatedPem);

        assertTrue(keyring.outbound("bob").isEmpty());
        assertTrue(keyring.inbound("bob", KeyScope.DIRECT).isEmpty());
        assertTrue(keyring.inbound("bob", KeyScope.BROADCAST).isEmpty());
        assertEquals(List.of("bob"), keyring.peersLackingBroadcastKey());
    }

    @Test
    void retainOnly_prunesDepartedPeers() throws CryptoException
    {
        keyring.updatePublicKey("bob", bobPem);
        keyring.updatePublicKey("carol", carolPem);
        keyring.storeInbound("carol", KeyScope.DIRECT, ConversationKey.generate());

        keyring.retainOnly(List.of("alice", "bob"));

        assertEquals(List.of("bob"), keyring.knownPeers());
        assertTrue(keyring.publicKey("carol").isEmpty());
        assertTrue(keyring.inbound("carol", KeyScope.DIRECT).isEmpty());
    }

    @Test
    void inboundKeys_areSeparatedByScope() throws CryptoException
    {
        ConversationKey direct = ConversationKey.generate();
        ConversationKey broadcast = ConversationKey.generate();

        keyring.storeInbound("bob", KeyScope.DIRECT, direct);
        keyring.storeInbound("bob", KeyScope.BROADCAST, broadcast);

        assertSame(direct, keyring.inbound("bob", KeyScope.DIRECT).orElseThrow());
        assertSame(broadcast, keyring.inbound("bob", KeyScope.BROADCAST).orElseThrow());
        assertTrue(keyring.inbound("carol", KeyScope.DIRECT).isEmpty());
    }

    @Test
    void broadcastKey_isCreatedOnceAndTrackedPerPeer() throws CryptoException
    {
        keyring.updatePublicKey("bob", bobPem);
        keyring.updatePublicKey("carol", carolPem);

        ConversationKey first = keyring.broadcastKey();
        assertSame(first, keyring.broadcastKey());
        assertEquals(List.of("bob", "carol"), keyring.peersLackingBroadcastKey());

        keyring.markBroadcastKeySent("bob", keyring.publicKey("bob").orElseThrow());

        assertEquals(List.of("carol"), keyring.peersLackingBroadcastKey());
    }

    @Test
    void keySentWhilePeerLeft_isNotReusedAfterReconnect() throws CryptoException
    {
        // Arrange: a send wraps for bob's key, then bob drops out before it is recorded
        keyring.updatePublicKey("bob", bobPem);
        PublicKey wrappedFor = keyring.publicKey("bob").orElseThrow();
        keyring.retainOnly(List.of("alice"));

        // Act
        assertFalse(keyring.storeOutbound("bob", ConversationKey.generate(), wrappedFor));
        assertFalse(keyring.markBroadcastKeySent("bob", wrappedFor));
        keyring.updatePublicKey("bob", bobRotatedPem);

        // Assert
        assertTrue(keyring.outbound("bob").isEmpty());
        assertEquals(List.of("bob"), keyring.peersLackingBroadcastKey());
    }

    @Test
    void keyWrappedForReplacedPublicKey_isNotStored() throws CryptoException
    {
        keyring.updatePublicKey("bob", bobPem);
        PublicKey oldKey = keyring.publicKey("bob").orElseThrow();
        keyring.updatePublicKey("bob", bobRotatedPem);

        assertFalse(keyring.storeOutbound("bob", ConversationKey.generate(), oldKey));
        assertFalse(keyring.markBroadcastKeySent("bob", oldKey));

        assertTrue(keyring.outbound("bob").isEmpty());
        assertEquals(List.of("bob"), keyring.peersLackingBroadcastKey());
    }
}
