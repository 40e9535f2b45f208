package dev.idbroker.session.bus;

import dev.idbroker.session.relay.BrokerRelay;
import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.Envelope;
import dev.idbroker.transport.FailureCode;
import dev.idbroker.transport.Operation;
import dev.idbroker.transport.bus.BrokerBusError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Session bus front of the broker. Does no work of its own: every call is handed to the relay and
 * relay failures come back as bus errors carrying the same failure code.
 */
public class SessionBrokerFacade implements SessionBrokerBus {

    private static final Logger LOGGER = LoggerFactory.getLogger(SessionBrokerFacade.class);

    private final String objectPath;
    private final BrokerRelay relay;

    public SessionBrokerFacade(String objectPath, BrokerRelay relay) {
        this.objectPath = objectPath;
        this.relay = relay;
    }

    @Override
    public String getObjectPath() {
        return objectPath;
    }

    @Override
    public String acquireTokenInteractively(String protocolVersion, String correlationId, String requestJson) {
        return forward(Operation.ACQUIRE_TOKEN_INTERACTIVELY, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String acquireTokenSilently(String protocolVersion, String correlationId, String requestJson) {
        return forward(Operation.ACQUIRE_TOKEN_SILENTLY, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String getAccounts(String protocolVersion, String correlationId, String requestJson) {
        return forward(Operation.GET_ACCOUNTS, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String removeAccount(String protocolVersion, String correlationId, String requestJson) {
        return forward(Operation.REMOVE_ACCOUNT, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String acquirePrtSsoCookie(String protocolVersion, String correlationId, String requestJson) {
        return forward(Operation.ACQUIRE_PRT_SSO_COOKIE, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String generateSignedHttpRequest(String protocolVersion, String correlationId, String requestJson) {
        return forward(Operation.GENERATE_SIGNED_HTTP_REQUEST, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String cancelInteractiveFlow(String protocolVersion, String correlationId, String requestJson) {
        return forward(Operation.CANCEL_INTERACTIVE_FLOW, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String getLinuxBrokerVersion(String protocolVersion, String correlationId, String requestJson) {
        return forward(Operation.GET_LINUX_BROKER_VERSION, protocolVersion, correlationId, requestJson);
    }

    private String forward(Operation operation, String protocolVersion, String correlationId, String requestJson) {
        try {
            return relay.forward(new Envelope(operation, protocolVersion, correlationId, requestJson));
        } catch (BrokerException e) {
            LOGGER.debug("{} corr={} failed ({}): {}", operation.wireName(), correlationId, e.code().code(),
                e.getMessage());
            throw BrokerBusError.from(e);
        } catch (RuntimeException e) {
            LOGGER.error("{} corr={} raised an unexpected error", operation.wireName(), correlationId, e);
            throw new BrokerBusError(FailureCode.FAILED, operation.wireName() + " failed");
        }
    }
}
