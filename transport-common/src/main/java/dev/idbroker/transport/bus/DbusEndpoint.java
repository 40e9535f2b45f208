package dev.idbroker.transport.bus;

import java.io.IOException;
import java.util.Optional;
import org.freedesktop.dbus.DBusCallInfo;
import org.freedesktop.dbus.connections.AbstractConnection;
import org.freedesktop.dbus.connections.impl.DBusConnection;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.interfaces.DBus;
import org.freedesktop.dbus.interfaces.DBusInterface;

final class DbusEndpoint implements BusEndpoint {

    private static final String DAEMON_NAME = "org.freedesktop.DBus";
    private static final String DAEMON_PATH = "/org/freedesktop/DBus";

    private final DBusConnection connection;

    DbusEndpoint(DBusConnection connection) {
        this.connection = connection;
    }

    @Override
    public void requestName(String busName) throws DBusException {
        connection.requestBusName(busName);
    }

    @Override
    public void exportObject(String objectPath, DBusInterface object) throws DBusException {
        connection.exportObject(objectPath, object);
    }

    @Override
    public <I extends DBusInterface> I remoteObject(String busName, String objectPath, Class<I> type)
        throws DBusException {
        return connection.getRemoteObject(busName, objectPath, type);
    }

    @Override
    public long unixUserOf(String sender) throws DBusException {
        DBus daemon = connection.getRemoteObject(DAEMON_NAME, DAEMON_PATH, DBus.class);
        return daemon.GetConnectionUnixUser(sender).longValue();
    }

    @Override
    public void close() throws IOException {
        connection.close();
    }

    /**
     * Sender of the method call dbus-java is dispatching on the current thread, if any.
     */
    static Optional<String> currentSender() {
        DBusCallInfo info = AbstractConnection.getCallInfo();
        if (info == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(info.getSource());
    }
}
