package dev.idbroker.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple helper for logging broker traffic in a consistent format so that daemon and session
 * logs look identical. Payloads can carry credentials, so everything is logged at debug level and
 * request bodies are truncated.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private Wire() {
    }

    public static void rx(String connectionId, Envelope envelope) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RX conn={} op={} ver={} corr={} json={}",
                connectionId,
                envelope.operation().wireName(),
                envelope.protocolVersion(),
                envelope.correlationId(),
                truncate(envelope.requestJson(), 200));
        }
    }

    public static void tx(String connectionId, Envelope envelope, int responseBytes) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("TX conn={} op={} corr={} bytes={}",
                connectionId,
                envelope.operation().wireName(),
                envelope.correlationId(),
                responseBytes);
        }
    }

    public static void relay(String target, Envelope envelope) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RELAY to={} op={} ver={} corr={}",
                target,
                envelope.operation().wireName(),
                envelope.protocolVersion(),
                envelope.correlationId());
        }
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
