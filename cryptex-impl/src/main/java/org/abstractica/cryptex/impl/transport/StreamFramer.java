package org.abstractica.cryptex.impl.transport;

import org.abstractica.cryptex.impl.protocol.ProtocolConstants;
import org.abstractica.cryptex.impl.protocol.ProtocolException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Reassembles delimiter-terminated envelopes from an arbitrarily chunked byte stream.
 *
 * <p>Bytes are appended to a growable accumulator. Every complete span is returned
 * in arrival order with surrounding whitespace trimmed; empty spans are skipped and
 * the incomplete tail stays buffered for the next call.</p>
 *
 * <p>Not thread-safe; each connection owns one framer on its reading thread.</p>
 */
public final class StreamFramer
{
    private static final byte[] DELIMITER = ProtocolConstants.DELIMITER_BYTES;
    private static final int INITIAL_CAPACITY = ProtocolConstants.READ_BUFFER_SIZE;

    private final int maxEnvelopeSize;
    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int length;
    private int scanFrom;

    /**
     * Creates a framer.
     *
     * @param maxEnvelopeSize largest allowed envelope in bytes
     */
    public StreamFramer(int maxEnvelopeSize)
    {
        if (maxEnvelopeSize <= 0)
        {
            throw new IllegalArgumentException("maxEnvelopeSize must be positive: " + maxEnvelopeSize);
        }
        this.maxEnvelopeSize = maxEnvelopeSize;
    }

    /**
     * Feeds received bytes and returns every envelope they complete.
     *
     * @param data   source array
     * @param offset start of the received bytes
     * @param count  number of received bytes
     * @return complete envelope spans without delimiter, possibly empty
     * @throws ProtocolException with {@link ProtocolException.Reason#FRAME_TOO_LARGE} if the
     *                           buffered partial envelope exceeds the maximum size
     */
    public List<byte[]> feed(byte[] data, int offset, int count) throws ProtocolException
    {
        Objects.checkFromIndexSize(offset, count, data.length);
        append(data, offset, count);

        List<byte[]> spans = new ArrayList<>();
        int start = 0;
        int match;
        while ((match = indexOfDelimiter(Math.max(start, scanFrom))) >= 0)
        {
            byte[] span = trimmed(start, match);
            if (span.length > 0)
            {
                spans.add(span);
            }
            start = match + DELIMITER.length;
            scanFrom = start;
        }

        compact(start);

        // a delimiter may straddle the next chunk
        scanFrom = Math.max(0, length - DELIMITER.length + 1);

        if (length > maxEnvelopeSize)
        {
            throw new ProtocolException(ProtocolException.Reason.FRAME_TOO_LARGE,
                    "Envelope exceeds " + maxEnvelopeSize + " bytes");
        }
        return spans;
    }

    /**
     * Returns the number of bytes waiting for a delimiter.
     *
     * @return buffered byte count
     */
    public int buffered()
    {
        return length;
    }

    /**
     * Appends the delimiter to an encoded envelope.
     *
     * @param encoded encoded envelope bytes
     * @return bytes ready to write to the stream
     */
    public static byte[] frame(byte[] encoded)
    {
        byte[] framed = Arrays.copyOf(encoded, encoded.length + DELIMITER.length);
        System.arraycopy(DELIMITER, 0, framed, encoded.length, DELIMITER.length);
        return framed;
    }

    // ========== Buffer Management ==========

    private void append(byte[] data, int offset, int count)
    {
        if (length + count > buffer.length)
        {
            buffer = Arrays.copyOf(buffer, Math.max(buffer.length * 2, length + count));
        }
        System.arraycopy(data, offset, buffer, length, count);
        length += count;
    }

    private void compact(int consumed)
    {
        if (consumed == 0)
        {
            return;
        }
        System.arraycopy(buffer, consumed, buffer, 0, length - consumed);
        length -= consumed;
        if (length == 0 && buffer.length > INITIAL_CAPACITY)
        {
            buffer = new byte[INITIAL_CAPACITY];
        }
    }

    private int indexOfDelimiter(int from)
    {
        outer:
        for (int i = from; i <= length - DELIMITER.length; i++)
        {
            for (int j = 0; j < DELIMITER.length; j++)
            {
                if (buffer[i + j] != DELIMITER[j])
                {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }

    private byte[] trimmed(int from, int to)
    {
        while (from < to && isWhitespace(buffer[from]))
        {
            from++;
        }
        while (to > from && isWhitespace(buffer[to - 1]))
        {
            to--;
        }
        return Arrays.copyOfRange(buffer, from, to);
    }

    private static boolean isWhitespace(byte b)
    {
        return b == ' ' || b == '\t' || b == '\n' || b == '\r' || b == 0x0B || b == '\f';
    }
}
