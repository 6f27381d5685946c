package org.abstractica.cryptex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentitiesTest
{
    // ========== Identities ==========

    @Test
    void validate_acceptsLettersDigitsUnderscores()
    {
        assertTrue(Identities.isValid("alice"));
        assertTrue(Identities.isValid("Bob_42"));
        assertTrue(Identities.isValid("abc"));
        assertTrue(Identities.isValid("a234567890123456789_"));
    }

    @Test
    void validate_rejectsEmptyAndNull()
    {
        assertEquals("Identity cannot be empty", Identities.validate("").orElseThrow());
        assertEquals("Identity cannot be empty", Identities.validate(null).orElseThrow());
    }

    @Test
    void validate_enforcesLengthBounds()
    {
        assertTrue(Identities.validate("ab").orElseThrow().contains("at least 3"));
        assertTrue(Identities.validate("a2345678901234567890x").orElseThrow().contains("exceed 20"));
    }

    @Test
    void validate_rejectsOtherCharacters()
    {
        assertFalse(Identities.isValid("bob smith"));
        assertFalse(Identities.isValid("bob||x"));
        assertFalse(Identities.isValid("bøb"));
        assertFalse(Identities.isValid("bob-1"));
    }

    @Test
    void validate_rejectsBroadcastAddress()
    {
        assertFalse(Identities.isValid("ALL"));
        assertFalse(Identities.isValid("all"));
        assertTrue(Identities.validate("All").orElseThrow().contains("reserved"));
    }

    // ========== RejectReason ==========

    @Test
    void rejectReason_roundTripsCodes()
    {
        for (RejectReason reason : RejectReason.values())
        {
            assertEquals(reason, RejectReason.fromCode(reason.getCode()));
        }
    }

    @Test
    void rejectReason_unknownCodeThrows()
    {
        assertThrows(IllegalArgumentException.class, () -> RejectReason.fromCode(0x7F));
    }

    // ========== DisconnectReason ==========

    @Test
    void disconnectReason_describesServerClose()
    {
        assertEquals("Server closed the connection", new DisconnectReason.ServerShutdown("").describe());
        assertTrue(new DisconnectReason.ServerShutdown("maintenance").describe().contains("maintenance"));
    }

    @Test
    void connectionFailedException_carriesReason()
    {
        DisconnectReason reason = new DisconnectReason.Rejected(RejectReason.IDENTITY_TAKEN, "taken");
        ConnectionFailedException e = new ConnectionFailedException(reason);

        assertSame(reason, e.getReason());
        assertEquals(reason.describe(), e.getMessage());
    }
}
