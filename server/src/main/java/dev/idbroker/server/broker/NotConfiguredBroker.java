package dev.idbroker.server.broker;

/**
 * Fallback used when the application context provides no broker implementation. Every operation
 * is answered with {@code not_supported}, which keeps the daemon's transports testable on hosts
 * without an identity backend.
 */
public final class NotConfiguredBroker implements IdentityBroker, DeviceBroker {
}
