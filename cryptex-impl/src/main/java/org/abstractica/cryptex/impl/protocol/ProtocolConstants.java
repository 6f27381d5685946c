package org.abstractica.cryptex.impl.protocol;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Wire tokens and default settings shared by the relay and the client.
 */
public final class ProtocolConstants
{
    // ========== Wire ==========

    public static final String SEPARATOR = "||";
    public static final String DELIMITER = "\n###MSG###\n";
    public static final byte[] DELIMITER_BYTES = DELIMITER.getBytes(StandardCharsets.UTF_8);

    /** Recipient name that addresses every other peer. */
    public static final String EVERYONE = "ALL";

    /** Identity reported in audit events when none could be read. */
    public static final String UNKNOWN_IDENTITY = "UNKNOWN";

    // ========== Defaults ==========

    public static final String DEFAULT_BIND_ADDRESS = "0.0.0.0";
    public static final int DEFAULT_PORT = 5555;
    public static final int DEFAULT_BACKLOG = 10;
    public static final int DEFAULT_MAX_ENVELOPE_SIZE = 1024 * 1024;
    public static final Duration DEFAULT_AUTH_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final int READ_BUFFER_SIZE = 4096;

    private ProtocolConstants() {}
}
