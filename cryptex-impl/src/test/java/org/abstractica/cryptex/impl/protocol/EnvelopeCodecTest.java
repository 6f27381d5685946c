package org.abstractica.cryptex.impl.protocol;

import org.abstractica.cryptex.RejectReason;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EnvelopeCodecTest
{
    // ========== Encoding ==========

    @Test
    void encode_joinsTagAndFields()
    {
        Envelope envelope = Envelope.messageTo("bob", "Y2lwaGVy", "abcd");

        assertEquals("MESSAGE||bob||Y2lwaGVy||abcd", text(EnvelopeCodec.encode(envelope)));
    }

    @Test
    void encode_fieldlessTypeIsBareTag()
    {
        assertEquals("SUCCESS", text(EnvelopeCodec.encode(Envelope.authAccepted())));
        assertEquals("DISCONNECT", text(EnvelopeCodec.encode(Envelope.disconnect())));
    }

    @Test
    void encode_rejectionCarriesNumericCode()
    {
        Envelope envelope = Envelope.authRejected(RejectReason.IDENTITY_TAKEN, "Username 'bob' already taken");

        assertEquals("ERROR||3||Username 'bob' already taken", text(EnvelopeCodec.encode(envelope)));
    }

    @Test
    void envelope_refusesSeparatorInNonFinalField()
    {
        assertThrows(IllegalArgumentException.class, () -> Envelope.messageTo("b||ob", "x", "y"));
    }

    @Test
    void envelope_refusesInnerFieldTouchingSeparator()
    {
        assertThrows(IllegalArgumentException.class, () -> Envelope.of(EnvelopeType.BROADCAST, "a|", "b"));
        assertThrows(IllegalArgumentException.class, () -> Envelope.of(EnvelopeType.BROADCAST, "|a", "b"));
        assertThrows(IllegalArgumentException.class, () -> Envelope.messageTo("bob", "x|", "y"));
    }

    @Test
    void envelope_lastFieldMayTouchSeparator() throws ProtocolException
    {
        Envelope envelope = Envelope.disconnect("|bye|");

        assertEquals("DISCONNECT|||bye|", text(EnvelopeCodec.encode(envelope)));
        assertEquals(envelope, EnvelopeCodec.decode(EnvelopeCodec.encode(envelope), Direction.DOWNSTREAM));
    }

    @Test
    void envelope_refusesDelimiterInAnyField()
    {
        assertThrows(IllegalArgumentException.class,
                () -> Envelope.userList("[\"a\"]" + ProtocolConstants.DELIMITER));
    }

    // ========== Decoding ==========

    @Test
    void decode_upstreamAuth() throws ProtocolException
    {
        String pem = "-----BEGIN PUBLIC KEY-----\nMIIB\n-----END PUBLIC KEY-----\n";

        Envelope envelope = EnvelopeCodec.decode(bytes("AUTH||alice||" + pem), Direction.UPSTREAM);

        assertEquals(EnvelopeType.AUTH, envelope.type());
        assertEquals(List.of("alice", pem), envelope.fields());
    }

    @Test
    void decode_lastFieldKeptVerbatim() throws ProtocolException
    {
        Envelope envelope = EnvelopeCodec.decode(bytes("DISCONNECT||going || away"), Direction.DOWNSTREAM);

        assertEquals("going || away", envelope.field(0));
    }

    @Test
    void decode_broadcastShapeDependsOnDirection() throws ProtocolException
    {
        Envelope up = EnvelopeCodec.decode(bytes("BROADCAST||c2VjcmV0||aa"), Direction.UPSTREAM);
        Envelope down = EnvelopeCodec.decode(bytes("BROADCAST||alice||c2VjcmV0||aa"), Direction.DOWNSTREAM);

        assertEquals(2, up.fields().size());
        assertEquals(List.of("alice", "c2VjcmV0", "aa"), down.fields());
    }

    @Test
    void decode_unknownTag()
    {
        assertReason(ProtocolException.Reason.UNKNOWN_TYPE, "HELLO||x", Direction.UPSTREAM);
        assertReason(ProtocolException.Reason.UNKNOWN_TYPE, "auth||bob||key", Direction.UPSTREAM);
    }

    @Test
    void decode_typeInWrongDirection()
    {
        assertReason(ProtocolException.Reason.UNEXPECTED_TYPE, "USER_LIST||[]", Direction.UPSTREAM);
        assertReason(ProtocolException.Reason.UNEXPECTED_TYPE, "AUTH||bob||key", Direction.DOWNSTREAM);
    }

    @Test
    void decode_wrongFieldCount()
    {
        assertReason(ProtocolException.Reason.WRONG_FIELD_COUNT, "AUTH||bob", Direction.UPSTREAM);
        assertReason(ProtocolException.Reason.WRONG_FIELD_COUNT, "AUTH", Direction.UPSTREAM);
        assertReason(ProtocolException.Reason.WRONG_FIELD_COUNT, "SUCCESS||extra", Direction.DOWNSTREAM);
        assertReason(ProtocolException.Reason.WRONG_FIELD_COUNT, "MESSAGE||bob||onlycipher", Direction.UPSTREAM);
    }

    @Test
    void decode_rejectsInvalidUtf8AndEmpty()
    {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> EnvelopeCodec.decode(new byte[]{(byte) 0xC3, (byte) 0x28}, Direction.UPSTREAM));
        assertEquals(ProtocolException.Reason.MALFORMED, e.getReason());

        assertReason(ProtocolException.Reason.MALFORMED, "", Direction.UPSTREAM);
    }

    @Test
    void decode_invertsEncodeForEveryDownstreamFactory() throws ProtocolException
    {
        List<Envelope> envelopes = List.of(
                Envelope.authAccepted(),
                Envelope.authRejected(RejectReason.SERVER_FULL, "Server is full"),
                Envelope.userList("[\"alice\",\"bob\"]"),
                Envelope.keyExchange("alice", "-----BEGIN PUBLIC KEY-----\nAB\n-----END PUBLIC KEY-----\n"),
                Envelope.disconnect("bye"));

        for (Envelope envelope : envelopes)
        {
            assertEquals(envelope, EnvelopeCodec.decode(EnvelopeCodec.encode(envelope), Direction.DOWNSTREAM));
        }
    }

    // ========== Forwarding ==========

    @Test
    void forwarded_replacesAddressWithSender()
    {
        Envelope message = Envelope.forwarded("alice", Envelope.messageTo("bob", "c", "t"));
        Envelope key = Envelope.forwarded("alice", Envelope.sessionKeyTo("bob", KeyScope.DIRECT, "w", "s"));
        Envelope broadcast = Envelope.forwarded("alice", Envelope.broadcast("c", "t"));

        assertEquals(List.of("alice", "c", "t"), message.fields());
        assertEquals(List.of("alice", "DIRECT", "w", "s"), key.fields());
        assertEquals(List.of("alice", "c", "t"), broadcast.fields());
        assertEquals(EnvelopeType.BROADCAST, broadcast.type());
    }

    @Test
    void forwarded_refusesNonConversationTypes()
    {
        assertThrows(IllegalArgumentException.class, () -> Envelope.forwarded("alice", Envelope.disconnect()));
    }

    // ========== User List ==========

    @Test
    void userList_encodesJsonArray() throws ProtocolException
    {
        String json = UserListCodec.encode(List.of("alice", "bob"));

        assertEquals("[\"alice\",\"bob\"]", json);
        assertEquals(List.of("alice", "bob"), UserListCodec.decode(json));
        assertEquals(List.of(), UserListCodec.decode("[]"));
    }

    @Test
    void userList_rejectsNonArrays()
    {
        assertThrows(ProtocolException.class, () -> UserListCodec.decode("{\"alice\":1}"));
        assertThrows(ProtocolException.class, () -> UserListCodec.decode("[\"alice\""));
        assertThrows(ProtocolException.class, () -> UserListCodec.decode("[null]"));
        assertThrows(ProtocolException.class, () -> UserListCodec.decode("null"));
    }

    private static void assertReason(ProtocolException.Reason reason, String wire, Direction direction)
    {
        ProtocolException e = assertThrows(ProtocolException.class, () -> EnvelopeCodec.decode(bytes(wire), direction));
        assertEquals(reason, e.getReason(), wire);
    }

    private static byte[] bytes(String s)
    {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    private static String text(byte[] b)
    {
        return new String(b, StandardCharsets.UTF_8);
    }
}
