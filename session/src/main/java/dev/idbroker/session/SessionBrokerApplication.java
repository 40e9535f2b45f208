package dev.idbroker.session;

import dev.idbroker.session.bus.SessionBrokerFacade;
import dev.idbroker.session.config.RelayProperties;
import dev.idbroker.session.config.SessionBusProperties;
import dev.idbroker.session.relay.BrokerRelay;
import dev.idbroker.session.relay.BusBrokerRelay;
import dev.idbroker.session.relay.SocketBrokerRelay;
import dev.idbroker.transport.ShutdownSignal;
import dev.idbroker.transport.bus.BusConnector;
import dev.idbroker.transport.bus.BusServiceHost;
import dev.idbroker.transport.bus.BusType;
import dev.idbroker.transport.bus.DbusConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties({RelayProperties.class, SessionBusProperties.class})
public class SessionBrokerApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionBrokerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SessionBrokerApplication.class, args);
    }

    @Bean(destroyMethod = "fire")
    ShutdownSignal shutdownSignal() {
        return new ShutdownSignal();
    }

    @Bean
    BusConnector busConnector() {
        return new DbusConnector();
    }

    @Bean
    BrokerRelay brokerRelay(RelayProperties relayProperties, BusConnector busConnector) {
        LOGGER.info("Relaying to the System Broker over {}", relayProperties.getMode().name().toLowerCase());
        return switch (relayProperties.getMode()) {
            case BUS -> new BusBrokerRelay(busConnector, relayProperties.getSystemBrokerName(),
                relayProperties.getSystemBrokerPath(), relayProperties.getTimeout());
            case SOCKET -> new SocketBrokerRelay(relayProperties.getSocketPath(), relayProperties.getTimeout(),
                relayProperties.getChunkSize());
        };
    }

    @Bean(destroyMethod = "close")
    BusServiceHost sessionBus(BusConnector busConnector) {
        return new BusServiceHost(busConnector, BusType.SESSION);
    }

    @Bean
    SessionBrokerFacade sessionBrokerFacade(SessionBusProperties properties, BrokerRelay brokerRelay) {
        return new SessionBrokerFacade(properties.getPath(), brokerRelay);
    }

    @Bean
    SessionBrokerService sessionBrokerService(SessionBusProperties properties, BusServiceHost sessionBus,
        SessionBrokerFacade facade, ShutdownSignal shutdownSignal) {
        return new SessionBrokerService(properties, sessionBus, facade, shutdownSignal);
    }

    @Bean
    ApplicationRunner sessionBrokerRunner(SessionBrokerService service) {
        return args -> service.run();
    }
}
