package dev.idbroker.transport.bus;

import org.freedesktop.dbus.exceptions.DBusException;

/**
 * Opens private connections to a message bus.
 */
@FunctionalInterface
public interface BusConnector {

    BusEndpoint connect(BusType type) throws DBusException;
}
