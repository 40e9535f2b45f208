package dev.idbroker.transport;

import java.util.Objects;

/**
 * One logical broker request. The request body is kept as a raw JSON string so that it passes
 * through every hop without being reparsed; only the broker implementation interprets it.
 *
 * @param operation the active variant
 * @param protocolVersion caller protocol version, opaque to the relay
 * @param correlationId caller supplied id used for tracing only
 * @param requestJson opaque request body
 */
public record Envelope(
    Operation operation,
    String protocolVersion,
    String correlationId,
    String requestJson
) {

    public Envelope {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(protocolVersion, "protocolVersion");
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(requestJson, "requestJson");
    }
}
