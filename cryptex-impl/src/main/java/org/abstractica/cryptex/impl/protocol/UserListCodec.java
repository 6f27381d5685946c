package org.abstractica.cryptex.impl.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Objects;

/**
 * JSON payload of the USER_LIST envelope: a flat array of identity strings.
 */
public final class UserListCodec
{
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> IDENTITY_LIST = new TypeReference<>() {};

    private UserListCodec() {}

    public static String encode(List<String> identities)
    {
        Objects.requireNonNull(identities, "identities");
        try
        {
            return MAPPER.writeValueAsString(identities);
        }
        catch (JsonProcessingException e)
        {
            throw new IllegalStateException("Cannot serialize identity list", e);
        }
    }

    /**
     * Parses a USER_LIST payload.
     *
     * @param json the payload
     * @return the identities in relay order
     * @throws ProtocolException with {@link ProtocolException.Reason#MALFORMED} if the payload is not a string array
     */
    public static List<String> decode(String json) throws ProtocolException
    {
        Objects.requireNonNull(json, "json");
        List<String> identities;
        try
        {
            identities = MAPPER.readValue(json, IDENTITY_LIST);
        }
        catch (JsonProcessingException e)
        {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED,
                    "Invalid user list: " + e.getOriginalMessage(), e);
        }

        if (identities == null || identities.contains(null))
        {
            throw new ProtocolException(ProtocolException.Reason.MALFORMED, "User list contains null");
        }
        return List.copyOf(identities);
    }
}
