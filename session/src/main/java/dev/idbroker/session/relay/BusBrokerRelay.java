package dev.idbroker.session.relay;

import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.Envelope;
import dev.idbroker.transport.FailureCode;
import dev.idbroker.transport.Wire;
import dev.idbroker.transport.bus.BusConnector;
import dev.idbroker.transport.bus.BusEndpoint;
import dev.idbroker.transport.bus.BusType;
import dev.idbroker.transport.bus.SystemBrokerBus;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import org.freedesktop.dbus.exceptions.DBusException;
import org.freedesktop.dbus.exceptions.DBusExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays each request to the System Broker over its own private system bus connection. The whole
 * round trip, connection setup included, is bounded by the configured timeout.
 */
public class BusBrokerRelay implements BrokerRelay, Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(BusBrokerRelay.class);

    private final BusConnector connector;
    private final String brokerName;
    private final String brokerPath;
    private final Duration timeout;
    private final ExecutorService callExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "bus-relay-call");
        t.setDaemon(true);
        return t;
    });

    public BusBrokerRelay(BusConnector connector, String brokerName, String brokerPath, Duration timeout) {
        this.connector = connector;
        this.brokerName = brokerName;
        this.brokerPath = brokerPath;
        this.timeout = timeout;
    }

    @Override
    public String forward(Envelope request) throws BrokerException {
        Wire.relay(brokerName, request);
        AtomicReference<BusEndpoint> connection = new AtomicReference<>();
        Future<String> call;
        try {
            call = callExecutor.submit(() -> invoke(request, connection));
        } catch (RejectedExecutionException e) {
            throw BrokerException.failed("Relay is shut down", e);
        }
        try {
            return call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            release(connection.getAndSet(null));
            call.cancel(true);
            LOGGER.warn("{} corr={} timed out after {}", request.operation().wireName(), request.correlationId(),
                timeout);
            throw new BrokerException(FailureCode.TIMEOUT,
                request.operation().wireName() + " timed out after " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            release(connection.getAndSet(null));
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new BrokerException(FailureCode.FAILED, "Interrupted while waiting for the System Broker", e);
        } catch (ExecutionException e) {
            throw translate(request, e.getCause());
        }
    }

    private String invoke(Envelope request, AtomicReference<BusEndpoint> connection) throws DBusException {
        BusEndpoint bus = connector.connect(BusType.SYSTEM);
        connection.set(bus);
        try {
            SystemBrokerBus broker = bus.remoteObject(brokerName, brokerPath, SystemBrokerBus.class);
            return SystemBrokerCalls.invoke(broker, request);
        } finally {
            release(connection.getAndSet(null));
        }
    }

    private BrokerException translate(Envelope request, Throwable cause) {
        String operation = request.operation().wireName();
        if (cause instanceof DBusExecutionException busError) {
            FailureCode code = FailureCode.fromErrorName(busError.getType());
            LOGGER.debug("{} corr={} answered with {} ({})", operation, request.correlationId(), busError.getType(),
                code.code());
            return new BrokerException(code, busError.getMessage(), busError);
        }
        if (cause instanceof DBusException) {
            LOGGER.warn("Unable to reach the System Broker {} for {}: {}", brokerName, operation,
                cause.getMessage());
            return BrokerException.failed("Unable to reach the System Broker", cause);
        }
        LOGGER.error("{} corr={} failed unexpectedly", operation, request.correlationId(), cause);
        return BrokerException.failed(operation + " failed", cause);
    }

    private static void release(BusEndpoint bus) {
        if (bus == null) {
            return;
        }
        try {
            bus.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing relay bus connection", e);
        }
    }

    @Override
    public void close() {
        callExecutor.shutdown();
    }
}
