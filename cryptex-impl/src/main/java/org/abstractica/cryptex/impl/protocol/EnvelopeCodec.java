package org.abstractica.cryptex.impl.protocol;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Converts envelopes to and from their UTF-8 wire text.
 *
 * <p>Encoding never appends the stream delimiter; that is the framer's job.
 * Decoding is direction aware because several types carry a different field
 * layout upstream and downstream.</p>
 */
public final class EnvelopeCodec
{
    private static final Pattern SEPARATOR_PATTERN = Pattern.compile(Pattern.quote(ProtocolConstants.SEPARATOR));

    private EnvelopeCodec() {}

    public static byte[] encode(Envelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");

        StringBuilder sb = new StringBuilder(envelope.type().getTag());
        for (String field : envelope.fields())
        {
            sb.append(ProtocolConstants.SEPARATOR).append(field);
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Decodes one envelope.
     *
     * @param data      the envelope bytes, without delimiter
     * @param direction the direction the bytes travelled
     * @return the envelope
     * @throws ProtocolException if the bytes are not a valid envelope for that direction
     */
    public static Envelope decode(byte[] data, Direction direction) throws ProtocolException
    {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(direction, "direction");

        String text = toText(data);
        if (text.isEmpty())
        {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED, "Empty envelope");
        }

        int sep = text.indexOf(ProtocolConstants.SEPARATOR);
        String tag = sep < 0 ? text : text.substring(0, sep);

        EnvelopeType type = EnvelopeType.fromTag(tag)
                .orElseThrow(() -> new ProtocolException(ProtocolException.Reason.UNKNOWN_TYPE,
                        "Unknown envelope type: " + abbreviate(tag)));

        if (!type.isValid(direction))
        {
            throw new ProtocolException(ProtocolException.Reason.UNEXPECTED_TYPE,
                    type + " is not valid " + direction);
        }

        int expected = type.fieldCount(direction);
        List<String> fields;
        if (sep < 0)
        {
            fields = List.of();
        }
        else
        {
            if (expected == 0)
            {
                throw new ProtocolException(ProtocolException.Reason.WRONG_FIELD_COUNT,
                        type + " takes no fields");
            }
            String rest = text.substring(sep + ProtocolConstants.SEPARATOR.length());
            fields = Arrays.asList(SEPARATOR_PATTERN.split(rest, expected));
        }

        if (fields.size() != expected)
        {
            throw new ProtocolException(ProtocolException.Reason.WRONG_FIELD_COUNT,
                    type + " " + direction + " expects " + expected + " fields, got " + fields.size());
        }

        try
        {
            return new Envelope(type, fields);
        }
        catch (IllegalArgumentException e)
        {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED, e.getMessage(), e);
        }
    }

    private static String toText(byte[] data) throws ProtocolException
    {
        try
        {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
        }
        catch (CharacterCodingException e)
        {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED, "Envelope is not valid UTF-8", e);
        }
    }

    private static String abbreviate(String s)
    {
        return s.length() <= 32 ? s : s.substring(0, 32) + "...";
    }
}
