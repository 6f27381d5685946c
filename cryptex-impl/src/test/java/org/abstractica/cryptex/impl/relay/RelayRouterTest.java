package org.abstractica.cryptex.impl.relay;

import org.abstractica.cryptex.AuditSink;
import org.abstractica.cryptex.RejectReason;
import org.abstractica.cryptex.impl.crypto.RsaKeys;
import org.abstractica.cryptex.impl.protocol.Envelope;
import org.abstractica.cryptex.impl.protocol.EnvelopeType;
import org.abstractica.cryptex.impl.protocol.KeyScope;
import org.abstractica.cryptex.impl.protocol.ProtocolException;
import org.abstractica.cryptex.impl.protocol.UserListCodec;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for authentication, routing and fan-out, driven through recording peer handles.
 */
class RelayRouterTest
{
    private static String alicePem;
    private static String bobPem;
    private static String carolPem;

    private SessionDirectory directory;
    private DefaultRelayStats stats;
    private RecordingAuditSink audit;
    private RelayRouter router;

    @BeforeAll
    static void generateKeys()
    {
        alicePem = RsaKeys.exportPublicKey(RsaKeys.generateKeyPair(1024).getPublic());
        bobPem = RsaKeys.exportPublicKey(RsaKeys.generateKeyPair(1024).getPublic());
        carolPem = RsaKeys.exportPublicKey(RsaKeys.generateKeyPair(1024).getPublic());
    }

    @BeforeEach
    void setUp()
    {
        directory = new SessionDirectory();
        stats = new DefaultRelayStats(directory);
        audit = new RecordingAuditSink();
        router = new RelayRouter(directory, audit, stats, 0);
    }

    // ========== Authentication ==========

    @Test
    void authenticate_acknowledgesAndAnnounces() throws ProtocolException
    {
        RecordingPeerHandle alice = handle("alice");

        Optional<String> identity = router.authenticate(alice, Envelope.auth("alice", alicePem));

        assertEquals(Optional.of("alice"), identity);
        List<Envelope> sent = alice.sent();
        assertEquals(EnvelopeType.AUTH_ACCEPTED, sent.get(0).type());
        assertEquals(EnvelopeType.USER_LIST, sent.get(1).type());
        assertEquals(List.of("alice"), UserListCodec.decode(sent.get(1).field(0)));
        assertTrue(alice.sent(EnvelopeType.KEY_EXCHANGE).isEmpty());
        assertTrue(audit.events.contains("authSuccess:alice"));
    }

    @Test
    void authenticate_exchangesKeysBothWaysExactlyOnce() throws ProtocolException
    {
        RecordingPeerHandle alice = handle("alice");
        RecordingPeerHandle bob = handle("bob");
        router.authenticate(alice, Envelope.auth("alice", alicePem));
        alice.clear();

        router.authenticate(bob, Envelope.auth("bob", bobPem));

        List<Envelope> bobKeys = bob.sent(EnvelopeType.KEY_EXCHANGE);
        assertEquals(1, bobKeys.size());
        assertEquals(List.of("alice", alicePem), bobKeys.get(0).fields());

        List<Envelope> aliceKeys = alice.sent(EnvelopeType.KEY_EXCHANGE);
        assertEquals(1, aliceKeys.size());
        assertEquals("bob", aliceKeys.get(0).field(0));

        assertEquals(List.of("alice", "bob"), UserListCodec.decode(alice.sent(EnvelopeType.USER_LIST).get(0).field(0)));
        assertEquals(List.of("alice", "bob"), UserListCodec.decode(bob.sent(EnvelopeType.USER_LIST).get(0).field(0)));
        assertTrue(audit.events.contains("keyExchange:alice->bob"));
        assertTrue(audit.events.contains("keyExchange:bob->alice"));
    }

    @Test
    void authenticate_rejectsNonAuthFirstEnvelope()
    {
        RecordingPeerHandle peer = handle("peer");

        assertTrue(router.authenticate(peer, Envelope.broadcast("c", "t")).isEmpty());

        assertRejected(peer, RejectReason.MALFORMED_AUTH);
        assertTrue(audit.events.contains("authFailure:UNKNOWN"));
    }

    @Test
    void authenticate_rejectsInvalidIdentity()
    {
        RecordingPeerHandle peer = handle("peer");

        assertTrue(router.authenticate(peer, Envelope.auth("no spaces", alicePem)).isEmpty());
        assertRejected(peer, RejectReason.INVALID_IDENTITY);

        RecordingPeerHandle all = handle("all");
        assertTrue(router.authenticate(all, Envelope.auth("ALL", alicePem)).isEmpty());
        assertRejected(all, RejectReason.INVALID_IDENTITY);
    }

    @Test
    void authenticate_rejectsUnparsableKey()
    {
        RecordingPeerHandle peer = handle("peer");

        assertTrue(router.authenticate(peer, Envelope.auth("alice", "garbage")).isEmpty());

        assertRejected(peer, RejectReason.MALFORMED_KEY);
        assertEquals(0, directory.size());
    }

    @Test
    void authenticate_duplicateIdentityRejectedWithoutEvicting()
    {
        RecordingPeerHandle first = handle("first");
        RecordingPeerHandle second = handle("second");
        router.authenticate(first, Envelope.auth("alice", alicePem));

        assertTrue(router.authenticate(second, Envelope.auth("alice", bobPem)).isEmpty());

        assertRejected(second, RejectReason.IDENTITY_TAKEN);
        assertSame(first, directory.find("alice").orElseThrow().handle());
        assertFalse(first.isClosed());
        assertEquals(1, stats.getRejectedAuthentications());
    }

    @Test
    void authenticate_enforcesCapacity()
    {
        router = new RelayRouter(directory, audit, stats, 1);
        router.authenticate(handle("a"), Envelope.auth("alice", alicePem));
        RecordingPeerHandle bob = handle("b");

        assertTrue(router.authenticate(bob, Envelope.auth("bob", bobPem)).isEmpty());

        assertRejected(bob, RejectReason.SERVER_FULL);
    }

    // ========== Routing ==========

    @Test
    void route_messageReachesOnlyRecipientWithSenderStamped()
    {
        RecordingPeerHandle alice = register("alice", alicePem);
        RecordingPeerHandle bob = register("bob", bobPem);
        RecordingPeerHandle carol = register("carol", carolPem);
        clearAll(alice, bob, carol);

        assertTrue(router.route("alice", Envelope.messageTo("bob", "Y2lwaGVy", "tag")));

        assertEquals(List.of(Envelope.of(EnvelopeType.MESSAGE, "alice", "Y2lwaGVy", "tag")), bob.sent());
        assertTrue(alice.sent().isEmpty());
        assertTrue(carol.sent().isEmpty());
        assertEquals(1, stats.getRoutedEnvelopes());
        assertTrue(audit.events.contains("messageRouted:alice->bob"));
    }

    @Test
    void route_broadcastSkipsSender()
    {
        RecordingPeerHandle alice = register("alice", alicePem);
        RecordingPeerHandle bob = register("bob", bobPem);
        RecordingPeerHandle carol = register("carol", carolPem);
        clearAll(alice, bob, carol);

        router.route("alice", Envelope.broadcast("c2VjcmV0", "tag"));

        Envelope expected = Envelope.of(EnvelopeType.BROADCAST, "alice", "c2VjcmV0", "tag");
        assertEquals(List.of(expected), bob.sent());
        assertEquals(List.of(expected), carol.sent());
        assertTrue(alice.sent().isEmpty());
        assertTrue(audit.events.contains("messageRouted:alice->ALL"));
    }

    @Test
    void route_sessionKeyForwardedUntouched()
    {
        RecordingPeerHandle alice = register("alice", alicePem);
        RecordingPeerHandle bob = register("bob", bobPem);
        clearAll(alice, bob);

        router.route("alice", Envelope.sessionKeyTo("bob", KeyScope.BROADCAST, "d3JhcHBlZA==", "c2ln"));

        assertEquals(List.of("alice", "BROADCAST", "d3JhcHBlZA==", "c2ln"), bob.last().fields());
    }

    @Test
    void route_messageToOfflineRecipientIsDroppedSilently()
    {
        RecordingPeerHandle alice = register("alice", alicePem);
        alice.clear();

        assertTrue(router.route("alice", Envelope.messageTo("bob", "c", "t")));

        assertTrue(alice.sent().isEmpty());
        assertEquals(1, stats.getDroppedEnvelopes());
        assertEquals(0, stats.getRoutedEnvelopes());
    }

    @Test
    void route_unexpectedTypeIsSuspicious()
    {
        RecordingPeerHandle alice = register("alice", alicePem);
        alice.clear();

        assertTrue(router.route("alice", Envelope.auth("mallory", alicePem)));
        assertTrue(router.route("alice", Envelope.sessionKeyTo("alice", KeyScope.DIRECT, "w", "s")));

        assertTrue(alice.sent().isEmpty());
        assertEquals(2, audit.events.stream().filter(e -> e.startsWith("suspicious:alice")).count());
        assertEquals(List.of("alice"), directory.identities());
    }

    @Test
    void route_disconnectEndsSession()
    {
        register("alice", alicePem);

        assertFalse(router.route("alice", Envelope.disconnect()));
    }

    // ========== Failure Handling ==========

    @Test
    void fanOut_failedTargetRemovedAndOthersStillServed()
    {
        RecordingPeerHandle alice = register("alice", alicePem);
        RecordingPeerHandle bob = register("bob", bobPem);
        RecordingPeerHandle carol = register("carol", carolPem);
        clearAll(alice, bob, carol);
        bob.failSends();

        router.route("alice", Envelope.broadcast("c", "t"));

        assertTrue(bob.isClosed());
        assertEquals(List.of("alice", "carol"), directory.identities());
        assertEquals(EnvelopeType.BROADCAST, carol.sent().get(0).type());

        Envelope list = carol.last();
        assertEquals(EnvelopeType.USER_LIST, list.type());
        assertEquals("[\"alice\",\"carol\"]", list.field(0));
        assertEquals(EnvelopeType.USER_LIST, alice.last().type());
    }

    @Test
    void disconnect_announcesRemainingPeers()
    {
        RecordingPeerHandle alice = register("alice", alicePem);
        RecordingPeerHandle bob = register("bob", bobPem);
        clearAll(alice, bob);

        router.disconnect("bob", bob);

        assertTrue(bob.isClosed());
        assertEquals("[\"alice\"]", alice.last().field(0));
        assertTrue(audit.events.contains("connection:bob:DISCONNECTED"));
    }

    @Test
    void disconnect_staleHandleDoesNotRemoveNewerSession()
    {
        RecordingPeerHandle old = register("alice", alicePem);
        router.disconnect("alice", old);
        RecordingPeerHandle fresh = register("alice", alicePem);
        fresh.clear();

        router.disconnect("alice", old);

        assertEquals(List.of("alice"), directory.identities());
        assertTrue(fresh.sent().isEmpty());
    }

    @Test
    void shutdown_notifiesAndClosesEveryone()
    {
        RecordingPeerHandle alice = register("alice", alicePem);
        RecordingPeerHandle bob = register("bob", bobPem);

        router.shutdown("Server shutting down");

        assertEquals(Envelope.disconnect("Server shutting down"), alice.last());
        assertEquals(Envelope.disconnect("Server shutting down"), bob.last());
        assertTrue(alice.isClosed());
        assertTrue(bob.isClosed());
        assertEquals(0, directory.size());
    }

    // ========== Helpers ==========

    private RecordingPeerHandle register(String identity, String pem)
    {
        RecordingPeerHandle handle = handle(identity);
        assertTrue(router.authenticate(handle, Envelope.auth(identity, pem)).isPresent());
        return handle;
    }

    private static RecordingPeerHandle handle(String name)
    {
        return new RecordingPeerHandle("10.0.0.1:" + Math.abs(name.hashCode() % 60000));
    }

    private static void clearAll(RecordingPeerHandle... handles)
    {
        for (RecordingPeerHandle handle : handles)
        {
            handle.clear();
        }
    }

    private static void assertRejected(RecordingPeerHandle handle, RejectReason reason)
    {
        Envelope last = handle.last();
        assertEquals(EnvelopeType.AUTH_REJECTED, last.type());
        assertEquals(Integer.toString(reason.getCode()), last.field(0));
        assertTrue(handle.isClosed());
    }

    private static class RecordingAuditSink implements AuditSink
    {
        final List<String> events = new CopyOnWriteArrayList<>();

        @Override
        public void authSuccess(String identity, String address)
        {
            events.add("authSuccess:" + identity);
        }

        @Override
        public void authFailure(String identity, String address, String reason)
        {
            events.add("authFailure:" + identity);
        }

        @Override
        public void keyExchange(String from, String to)
        {
            events.add("keyExchange:" + from + "->" + to);
        }

        @Override
        public void messageRouted(String sender, String recipient)
        {
            events.add("messageRouted:" + sender + "->" + recipient);
        }

        @Override
        public void suspicious(String identity, String activity)
        {
            events.add("suspicious:" + identity);
        }

        @Override
        public void connection(String identity, String address, String action)
        {
            events.add("connection:" + identity + ":" + action);
        }
    }
}
