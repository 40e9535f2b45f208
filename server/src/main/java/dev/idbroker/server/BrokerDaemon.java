package dev.idbroker.server;

import dev.idbroker.server.broker.BrokerDispatcher;
import dev.idbroker.server.broker.DeviceDispatcher;
import dev.idbroker.server.bus.DeviceBrokerFacade;
import dev.idbroker.server.bus.SystemBrokerFacade;
import dev.idbroker.server.config.BusProperties;
import dev.idbroker.server.credentials.BusSenderCredentialResolver;
import dev.idbroker.server.transport.SocketBrokerListener;
import dev.idbroker.transport.ShutdownSignal;
import dev.idbroker.transport.bus.BusEndpoint;
import dev.idbroker.transport.bus.BusServiceHost;
import dev.idbroker.transport.bus.CallerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup sequence of the privileged daemon. Every bus name is claimed before the stream socket
 * starts accepting, so a second daemon instance fails before it touches the socket path.
 */
public class BrokerDaemon {

    private static final Logger LOGGER = LoggerFactory.getLogger(BrokerDaemon.class);

    private final BusProperties busProperties;
    private final BusServiceHost systemBus;
    private final SocketBrokerListener listener;
    private final BrokerDispatcher dispatcher;
    private final DeviceDispatcher deviceDispatcher;
    private final CallerContext callerContext;
    private final ShutdownSignal shutdownSignal;

    public BrokerDaemon(BusProperties busProperties, BusServiceHost systemBus, SocketBrokerListener listener,
        BrokerDispatcher dispatcher, DeviceDispatcher deviceDispatcher, CallerContext callerContext,
        ShutdownSignal shutdownSignal) {
        this.busProperties = busProperties;
        this.systemBus = systemBus;
        this.listener = listener;
        this.dispatcher = dispatcher;
        this.deviceDispatcher = deviceDispatcher;
        this.callerContext = callerContext;
        this.shutdownSignal = shutdownSignal;
    }

    /**
     * Register the bus services, start the socket listener and block until shutdown.
     * @throws IllegalStateException when a bus name is already owned or the socket cannot be bound
     */
    public void run() throws InterruptedException {
        if (busProperties.isEnabled()) {
            registerBusServices();
        } else {
            LOGGER.info("System bus services disabled");
        }
        listener.start(shutdownSignal);
        LOGGER.info("Identity broker daemon ready");
        if (busProperties.isEnabled()) {
            systemBus.serve(shutdownSignal);
        } else {
            shutdownSignal.await();
        }
        LOGGER.info("Identity broker daemon stopping");
    }

    private void registerBusServices() {
        BusEndpoint bus = systemBus.open();
        SystemBrokerFacade systemBroker = new SystemBrokerFacade(busProperties.getSystemBrokerPath(), dispatcher,
            new BusSenderCredentialResolver(bus), callerContext);
        systemBus.register(busProperties.getSystemBrokerName(), busProperties.getSystemBrokerPath(), systemBroker);
        if (busProperties.isDeviceBrokerEnabled()) {
            DeviceBrokerFacade deviceBroker = new DeviceBrokerFacade(busProperties.getDeviceBrokerPath(),
                deviceDispatcher);
            systemBus.register(busProperties.getDeviceBrokerName(), busProperties.getDeviceBrokerPath(),
                deviceBroker);
        }
    }
}
