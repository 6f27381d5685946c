package org.abstractica.cryptex.impl.protocol;

import org.abstractica.cryptex.RejectReason;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One protocol message: a type and its ordered string fields.
 *
 * <p>Wire format (UTF-8, terminated by {@link ProtocolConstants#DELIMITER} on the stream):</p>
 * <pre>
 * TAG||field1||field2||...||fieldN
 * </pre>
 *
 * <p>Only the last field may contain the separator, or start or end with a
 * separator character; no field may contain the delimiter.</p>
 *
 * @param type   the envelope type
 * @param fields the payload fields, in wire order
 */
public record Envelope(EnvelopeType type, List<String> fields)
{
    public Envelope
    {
        Objects.requireNonNull(type, "type");
        fields = List.copyOf(fields);

        for (int i = 0; i < fields.size(); i++)
        {
            String field = fields.get(i);
            if (field.contains(ProtocolConstants.DELIMITER))
            {
                throw new IllegalArgumentException("Field " + i + " of " + type + " contains the envelope delimiter");
            }
            if (i < fields.size() - 1 && !isSafeInnerField(field))
            {
                throw new IllegalArgumentException("Field " + i + " of " + type + " would not split back unambiguously");
            }
        }
    }

    // "a|" followed by "b" would encode as a|||b and split back as "a", "|b"
    private static boolean isSafeInnerField(String field)
    {
        char pipe = ProtocolConstants.SEPARATOR.charAt(0);
        return !field.contains(ProtocolConstants.SEPARATOR)
                && (field.isEmpty() || (field.charAt(0) != pipe && field.charAt(field.length() - 1) != pipe));
    }

    public static Envelope of(EnvelopeType type, String... fields)
    {
        return new Envelope(type, Arrays.asList(fields));
    }

    /**
     * Returns a field by position.
     *
     * @param index zero-based field index
     * @return the field value
     */
    public String field(int index)
    {
        return fields.get(index);
    }

    // ========== Upstream ==========

    public static Envelope auth(String identity, String publicKeyPem)
    {
        return of(EnvelopeType.AUTH, identity, publicKeyPem);
    }

    public static Envelope sessionKeyTo(String recipient, KeyScope scope, String wrappedKey, String signature)
    {
        return of(EnvelopeType.SESSION_KEY, recipient, scope.name(), wrappedKey, signature);
    }

    public static Envelope messageTo(String recipient, String cipherText, String tag)
    {
        return of(EnvelopeType.MESSAGE, recipient, cipherText, tag);
    }

    public static Envelope broadcast(String cipherText, String tag)
    {
        return of(EnvelopeType.BROADCAST, cipherText, tag);
    }

    public static Envelope disconnect()
    {
        return of(EnvelopeType.DISCONNECT);
    }

    // ========== Downstream ==========

    public static Envelope authAccepted()
    {
        return of(EnvelopeType.AUTH_ACCEPTED);
    }

    public static Envelope authRejected(RejectReason reason, String message)
    {
        return of(EnvelopeType.AUTH_REJECTED, Integer.toString(reason.getCode()), message);
    }

    public static Envelope userList(String json)
    {
        return of(EnvelopeType.USER_LIST, json);
    }

    public static Envelope keyExchange(String identity, String publicKeyPem)
    {
        return of(EnvelopeType.KEY_EXCHANGE, identity, publicKeyPem);
    }

    public static Envelope disconnect(String reason)
    {
        return of(EnvelopeType.DISCONNECT, reason);
    }

    /**
     * Rewrites an upstream conversation envelope for delivery: the addressing field
     * is replaced by the authenticated sender and every payload field is kept as is.
     *
     * @param sender   the authenticated sender identity
     * @param upstream a SESSION_KEY, MESSAGE or BROADCAST envelope as received from the sender
     * @return the downstream envelope
     */
    public static Envelope forwarded(String sender, Envelope upstream)
    {
        List<String> in = upstream.fields();
        switch (upstream.type())
        {
            case SESSION_KEY:
            case MESSAGE:
                String[] replaced = in.toArray(new String[0]);
                replaced[0] = sender;
                return of(upstream.type(), replaced);
            case BROADCAST:
                return of(EnvelopeType.BROADCAST, sender, in.get(0), in.get(1));
            default:
                throw new IllegalArgumentException("Cannot forward " + upstream.type());
        }
    }

    @Override
    public String toString()
    {
        return "Envelope[" + type + ", " + fields.size() + " fields]";
    }
}
