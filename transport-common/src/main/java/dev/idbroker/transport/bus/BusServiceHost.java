package dev.idbroker.transport.bus;

import dev.idbroker.transport.ShutdownSignal;
import java.io.Closeable;
import java.io.IOException;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.interfaces.DBusInterface;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hosts broker services on one bus connection: claims each well-known name, exports the service at
 * its object path and then blocks the calling thread until shutdown. Failing to claim a name is
 * fatal for startup.
 */
public class BusServiceHost implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BusServiceHost.class);

    private final BusConnector connector;
    private final BusType busType;

    private BusEndpoint endpoint;

    public BusServiceHost(BusConnector connector, BusType busType) {
        this.connector = connector;
        this.busType = busType;
    }

    /**
     * Open the bus connection if it is not open yet.
     * @return the shared endpoint used for every registered service
     * @throws IllegalStateException when the bus cannot be reached
     */
    public synchronized BusEndpoint open() {
        if (endpoint == null) {
            try {
                endpoint = connector.connect(busType);
            } catch (DBusException e) {
                throw new IllegalStateException("Unable to connect to the " + busType.name().toLowerCase() + " bus", e);
            }
        }
        return endpoint;
    }

    /**
     * Claim {@code busName} and export {@code service} at {@code objectPath}.
     * @throws IllegalStateException when the name is already owned or the export fails
     */
    public synchronized void register(String busName, String objectPath, DBusInterface service) {
        BusEndpoint bus = open();
        try {
            bus.requestName(busName);
        } catch (DBusException e) {
            throw new IllegalStateException("Unable to claim bus name " + busName
                + " on the " + busType.name().toLowerCase() + " bus (already owned?)", e);
        }
        try {
            bus.exportObject(objectPath, service);
        } catch (DBusException e) {
            throw new IllegalStateException("Unable to export " + busName + " at " + objectPath, e);
        }
        LOGGER.info("Serving {} at {} on the {} bus", busName, objectPath, busType.name().toLowerCase());
    }

    /**
     * Block until the shutdown signal fires. Calls are dispatched by the bus library meanwhile.
     */
    public void serve(ShutdownSignal shutdownSignal) throws InterruptedException {
        shutdownSignal.await();
        LOGGER.info("Stopped serving on the {} bus", busType.name().toLowerCase());
    }

    @Override
    public synchronized void close() {
        if (endpoint == null) {
            return;
        }
        try {
            endpoint.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing {} bus connection", busType.name().toLowerCase(), e);
        }
        endpoint = null;
    }
}
