package dev.idbroker.session;

import dev.idbroker.session.bus.SessionBrokerFacade;
import dev.idbroker.session.config.SessionBusProperties;
import dev.idbroker.transport.ShutdownSignal;
import dev.idbroker.transport.bus.BusServiceHost;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Claims the Session Broker name on the session bus and serves it until shutdown.
 */
public class SessionBrokerService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionBrokerService.class);

    private final SessionBusProperties properties;
    private final BusServiceHost sessionBus;
    private final SessionBrokerFacade facade;
    private final ShutdownSignal shutdownSignal;

    public SessionBrokerService(SessionBusProperties properties, BusServiceHost sessionBus,
        SessionBrokerFacade facade, ShutdownSignal shutdownSignal) {
        this.properties = properties;
        this.sessionBus = sessionBus;
        this.facade = facade;
        this.shutdownSignal = shutdownSignal;
    }

    /**
     * @throws IllegalStateException when the session bus is unreachable or the name is already owned
     */
    public void run() throws InterruptedException {
        sessionBus.register(properties.getName(), properties.getPath(), facade);
        LOGGER.info("Session broker ready");
        sessionBus.serve(shutdownSignal);
    }
}
