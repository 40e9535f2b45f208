package dev.idbroker.transport.bus;

import org.freedesktop.dbus.connections.impl.DBusConnectionBuilder;
import org.freedesktop.dbus.exceptions.DBusException;

/**
 * {@link BusConnector} backed by dbus-java. Every connection is private so that closing it never
 * affects another caller.
 */
public final class DbusConnector implements BusConnector {

    @Override
    public BusEndpoint connect(BusType type) throws DBusException {
        DBusConnectionBuilder builder = switch (type) {
            case SYSTEM -> DBusConnectionBuilder.forSystemBus();
            case SESSION -> DBusConnectionBuilder.forSessionBus();
        };
        return new DbusEndpoint(builder.withShared(false).build());
    }
}
