package dev.idbroker.transport.bus;

import java.io.Closeable;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.interfaces.DBusInterface;

/**
 * One open bus connection, reduced to the calls the brokers need.
 */
public interface BusEndpoint extends Closeable {

    /**
     * Claim a well-known name.
     * @throws DBusException when the name is already owned or the request fails
     */
    void requestName(String busName) throws DBusException;

    void exportObject(String objectPath, DBusInterface object) throws DBusException;

    <I extends DBusInterface> I remoteObject(String busName, String objectPath, Class<I> type) throws DBusException;

    /**
     * Ask the bus daemon for the numeric uid of the process owning {@code sender}.
     */
    long unixUserOf(String sender) throws DBusException;
}
