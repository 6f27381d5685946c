package org.abstractica.cryptex;

/**
 * Reasons the relay refuses an authentication attempt.
 */
public enum RejectReason
{
    MALFORMED_AUTH(0x01),
    INVALID_IDENTITY(0x02),
    IDENTITY_TAKEN(0x03),
    MALFORMED_KEY(0x04),
    SERVER_FULL(0x05);

    private final int code;

    RejectReason(int code)
    {
        this.code = code;
    }

    public int getCode()
    {
        return code;
    }

    public static RejectReason fromCode(int code)
    {
        for (RejectReason reason : values())
        {
            if (reason.code == code)
            {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown reject reason code: 0x" + Integer.toHexString(code));
    }
}
