package org.abstractica.cryptex.impl.protocol;

import java.util.Optional;

/**
 * Envelope types as defined in the wire protocol.
 *
 * <p>Each type declares how many fields it carries in each direction;
 * {@code -1} marks a direction in which the type is never sent.</p>
 */
public enum EnvelopeType
{
    // Authentication
    AUTH("AUTH", 2, -1),
    AUTH_ACCEPTED("SUCCESS", -1, 0),
    AUTH_REJECTED("ERROR", -1, 2),

    // Directory
    USER_LIST("USER_LIST", -1, 1),
    KEY_EXCHANGE("KEY_EXCHANGE", -1, 2),

    // Conversation
    SESSION_KEY("SESSION_KEY", 4, 4),
    MESSAGE("MESSAGE", 3, 3),
    BROADCAST("BROADCAST", 2, 3),

    // Teardown
    DISCONNECT("DISCONNECT", 0, 1);

    private final String tag;
    private final int upstreamFields;
    private final int downstreamFields;

    EnvelopeType(String tag, int upstreamFields, int downstreamFields)
    {
        this.tag = tag;
        this.upstreamFields = upstreamFields;
        this.downstreamFields = downstreamFields;
    }

    /**
     * Returns the token that starts this envelope on the wire.
     *
     * @return the wire tag
     */
    public String getTag()
    {
        return tag;
    }

    public boolean isValid(Direction direction)
    {
        return fieldsFor(direction) >= 0;
    }

    /**
     * Returns the number of fields this type carries in a direction.
     *
     * @param direction the direction
     * @return the field count
     * @throws IllegalArgumentException if the type is not sent in that direction
     */
    public int fieldCount(Direction direction)
    {
        int count = fieldsFor(direction);
        if (count < 0)
        {
            throw new IllegalArgumentException(this + " is not valid " + direction);
        }
        return count;
    }

    /**
     * Looks up a type by its wire tag.
     *
     * @param tag the wire tag
     * @return the type, or empty if unknown
     */
    public static Optional<EnvelopeType> fromTag(String tag)
    {
        for (EnvelopeType type : values())
        {
            if (type.tag.equals(tag))
            {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private int fieldsFor(Direction direction)
    {
        return direction == Direction.UPSTREAM ? upstreamFields : downstreamFields;
    }
}
