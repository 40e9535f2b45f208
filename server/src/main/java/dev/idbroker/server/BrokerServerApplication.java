package dev.idbroker.server;

import dev.idbroker.server.broker.BrokerDispatcher;
import dev.idbroker.server.broker.DeviceBroker;
import dev.idbroker.server.broker.DeviceDispatcher;
import dev.idbroker.server.broker.IdentityBroker;
import dev.idbroker.server.broker.NotConfiguredBroker;
import dev.idbroker.server.config.BusProperties;
import dev.idbroker.server.config.SocketProperties;
import dev.idbroker.server.credentials.LibC;
import dev.idbroker.server.credentials.PeerCredentialResolver;
import dev.idbroker.server.transport.SocketBrokerListener;
import dev.idbroker.transport.ShutdownSignal;
import dev.idbroker.transport.bus.BusConnector;
import dev.idbroker.transport.bus.BusServiceHost;
import dev.idbroker.transport.bus.BusType;
import dev.idbroker.transport.bus.CallerContext;
import dev.idbroker.transport.bus.DbusConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties({SocketProperties.class, BusProperties.class})
public class BrokerServerApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(BrokerServerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(BrokerServerApplication.class, args);
    }

    @Bean(destroyMethod = "fire")
    ShutdownSignal shutdownSignal() {
        return new ShutdownSignal();
    }

    @Bean
    BrokerDispatcher brokerDispatcher(ObjectProvider<IdentityBroker> identityBroker) {
        return new BrokerDispatcher(identityBroker.getIfAvailable(() -> {
            LOGGER.warn("No IdentityBroker configured, every broker call will be answered with not_supported");
            return new NotConfiguredBroker();
        }));
    }

    @Bean
    DeviceDispatcher deviceDispatcher(ObjectProvider<DeviceBroker> deviceBroker) {
        return new DeviceDispatcher(deviceBroker.getIfAvailable(() -> {
            LOGGER.warn("No DeviceBroker configured, every device call will be answered with not_supported");
            return new NotConfiguredBroker();
        }));
    }

    @Bean
    BusConnector busConnector() {
        return new DbusConnector();
    }

    @Bean(destroyMethod = "close")
    BusServiceHost systemBus(BusConnector busConnector) {
        return new BusServiceHost(busConnector, BusType.SYSTEM);
    }

    @Bean(destroyMethod = "stop")
    SocketBrokerListener socketBrokerListener(SocketProperties socketProperties, BrokerDispatcher brokerDispatcher) {
        return new SocketBrokerListener(socketProperties, brokerDispatcher,
            new PeerCredentialResolver(LibC.INSTANCE), LibC.INSTANCE);
    }

    @Bean
    BrokerDaemon brokerDaemon(BusProperties busProperties, BusServiceHost systemBus, SocketBrokerListener listener,
        BrokerDispatcher brokerDispatcher, DeviceDispatcher deviceDispatcher, ShutdownSignal shutdownSignal) {
        return new BrokerDaemon(busProperties, systemBus, listener, brokerDispatcher, deviceDispatcher,
            CallerContext.dbus(), shutdownSignal);
    }

    @Bean
    ApplicationRunner brokerDaemonRunner(BrokerDaemon brokerDaemon) {
        return args -> brokerDaemon.run();
    }
}
