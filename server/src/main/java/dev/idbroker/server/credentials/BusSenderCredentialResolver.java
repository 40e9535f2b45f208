package dev.idbroker.server.credentials;

import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.FailureCode;
import dev.idbroker.transport.bus.BusEndpoint;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.exceptions.DBusExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the uid owning a bus sender by asking the bus daemon. The bus attaches the sender to
 * every message, so this runs once per call.
 */
public class BusSenderCredentialResolver implements CredentialResolver<String> {

    private static final Logger LOGGER = LoggerFactory.getLogger(BusSenderCredentialResolver.class);

    private final BusEndpoint bus;

    public BusSenderCredentialResolver(BusEndpoint bus) {
        this.bus = bus;
    }

    @Override
    public long resolve(String sender) throws BrokerException {
        if (sender == null || sender.isBlank()) {
            throw BrokerException.declined("Caller has no bus identity");
        }
        try {
            return bus.unixUserOf(sender);
        } catch (DBusException | DBusExecutionException e) {
            LOGGER.warn("Unable to resolve uid of bus sender {}", sender, e);
            throw new BrokerException(FailureCode.DECLINED, "Unable to verify caller identity of " + sender, e);
        }
    }
}
