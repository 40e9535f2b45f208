package dev.idbroker.server.bus;

import dev.idbroker.transport.bus.BusEndpoint;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.exceptions.DBusExecutionException;
import org.freedesktop.dbus.interfaces.DBusInterface;

/**
 * In-memory system bus: names can be marked as owned by another process and senders mapped to
 * uids.
 */
public class FakeBusEndpoint implements BusEndpoint {

    public final Set<String> ownedElsewhere = new HashSet<>();
    public final List<String> claimedNames = new ArrayList<>();
    public final Map<String, DBusInterface> exported = new HashMap<>();
    public final Map<String, Long> uids = new HashMap<>();
    public boolean daemonFails;
    public int uidLookups;

    @Override
    public void requestName(String busName) throws DBusException {
        if (ownedElsewhere.contains(busName)) {
            throw new DBusException("Failed to register bus name");
        }
        claimedNames.add(busName);
    }

    @Override
    public void exportObject(String objectPath, DBusInterface object) {
        exported.put(objectPath, object);
    }

    @Override
    public <I extends DBusInterface> I remoteObject(String busName, String objectPath, Class<I> type)
        throws DBusException {
        throw new DBusException("No remote objects on a fake bus");
    }

    @Override
    public long unixUserOf(String sender) throws DBusException {
        uidLookups++;
        if (daemonFails) {
            throw new DBusExecutionException("org.freedesktop.DBus.Error.NameHasNoOwner");
        }
        Long uid = uids.get(sender);
        if (uid == null) {
            throw new DBusException("Unknown sender " + sender);
        }
        return uid;
    }

    @Override
    public void close() {
    }
}
