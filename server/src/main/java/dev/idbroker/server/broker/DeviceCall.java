package dev.idbroker.server.broker;

/**
 * One call to the Device Capability Broker.
 *
 * @param sessionId opaque, caller supplied session handle
 * @param operation requested capability
 * @param requestJson opaque request body
 */
public record DeviceCall(String sessionId, DeviceOperation operation, String requestJson) {
}
