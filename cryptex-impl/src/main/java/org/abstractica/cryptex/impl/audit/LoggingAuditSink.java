package org.abstractica.cryptex.impl.audit;

import org.abstractica.cryptex.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit events as single pipe-separated lines to the {@code cryptex.audit} logger.
 *
 * <p>Route that logger to its own appender to get a separate audit trail.
 * Suspicious activity is logged at ERROR, failed authentications at WARN and
 * everything else at INFO.</p>
 */
public class LoggingAuditSink implements AuditSink
{
    public static final String LOGGER_NAME = "cryptex.audit";

    private final Logger log;

    public LoggingAuditSink()
    {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    /**
     * Creates a sink writing to a specific logger.
     *
     * @param log the target logger
     */
    public LoggingAuditSink(Logger log)
    {
        this.log = log;
    }

    @Override
    public void authSuccess(String identity, String address)
    {
        log.info("AUTH_SUCCESS | User: {} | IP: {}", identity, address);
    }

    @Override
    public void authFailure(String identity, String address, String reason)
    {
        log.warn("AUTH_FAILED | User: {} | IP: {} | Reason: {}", identity, address, reason);
    }

    @Override
    public void keyExchange(String from, String to)
    {
        log.info("KEY_EXCHANGE | {} -> {}", from, to);
    }

    @Override
    public void messageRouted(String sender, String recipient)
    {
        log.info("MESSAGE_SENT | From: {} | To: {} | Encrypted: Yes", sender, recipient);
    }

    @Override
    public void suspicious(String identity, String activity)
    {
        log.error("SUSPICIOUS_ACTIVITY | User: {} | Activity: {}", identity, activity);
    }

    @Override
    public void connection(String identity, String address, String action)
    {
        log.info("{} | User: {} | IP: {}", action, identity, address);
    }

    @Override
    public void serverEvent(String event)
    {
        log.info("SERVER_EVENT | {}", event);
    }
}
