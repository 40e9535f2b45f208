package dev.idbroker.server.bus;

import dev.idbroker.server.broker.BrokerDispatcher;
import dev.idbroker.server.credentials.CredentialResolver;
import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.Envelope;
import dev.idbroker.transport.FailureCode;
import dev.idbroker.transport.Operation;
import dev.idbroker.transport.Wire;
import dev.idbroker.transport.bus.BrokerBusError;
import dev.idbroker.transport.bus.CallerContext;
import dev.idbroker.transport.bus.SystemBrokerBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports the System Broker on the system bus. The uid of the sender is looked up on every call
 * before the identity broker sees the request; a call whose sender cannot be resolved is declined.
 */
public class SystemBrokerFacade implements SystemBrokerBus {

    private static final Logger LOGGER = LoggerFactory.getLogger(SystemBrokerFacade.class);

    private final String objectPath;
    private final BrokerDispatcher dispatcher;
    private final CredentialResolver<String> credentials;
    private final CallerContext callerContext;

    public SystemBrokerFacade(String objectPath, BrokerDispatcher dispatcher,
        CredentialResolver<String> credentials, CallerContext callerContext) {
        this.objectPath = objectPath;
        this.dispatcher = dispatcher;
        this.credentials = credentials;
        this.callerContext = callerContext;
    }

    @Override
    public String getObjectPath() {
        return objectPath;
    }

    @Override
    public String acquireTokenInteractively(String protocolVersion, String correlationId, String requestJson) {
        return call(Operation.ACQUIRE_TOKEN_INTERACTIVELY, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String acquireTokenSilently(String protocolVersion, String correlationId, String requestJson) {
        return call(Operation.ACQUIRE_TOKEN_SILENTLY, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String getAccounts(String protocolVersion, String correlationId, String requestJson) {
        return call(Operation.GET_ACCOUNTS, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String removeAccount(String protocolVersion, String correlationId, String requestJson) {
        return call(Operation.REMOVE_ACCOUNT, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String acquirePrtSsoCookie(String protocolVersion, String correlationId, String requestJson) {
        return call(Operation.ACQUIRE_PRT_SSO_COOKIE, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String generateSignedHttpRequest(String protocolVersion, String correlationId, String requestJson) {
        return call(Operation.GENERATE_SIGNED_HTTP_REQUEST, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String cancelInteractiveFlow(String protocolVersion, String correlationId, String requestJson) {
        return call(Operation.CANCEL_INTERACTIVE_FLOW, protocolVersion, correlationId, requestJson);
    }

    @Override
    public String getLinuxBrokerVersion(String protocolVersion, String correlationId, String requestJson) {
        return call(Operation.GET_LINUX_BROKER_VERSION, protocolVersion, correlationId, requestJson);
    }

    private String call(Operation operation, String protocolVersion, String correlationId, String requestJson) {
        Envelope request = new Envelope(operation, protocolVersion, correlationId, requestJson);
        String sender = callerContext.currentSender().orElse(null);
        Wire.rx(sender, request);
        try {
            long uid = credentials.resolve(sender);
            return dispatcher.dispatch(request, uid);
        } catch (BrokerException e) {
            LOGGER.debug("{} corr={} from {} failed ({}): {}", operation.wireName(), correlationId, sender,
                e.code().code(), e.getMessage());
            throw BrokerBusError.from(e);
        } catch (RuntimeException e) {
            LOGGER.error("{} corr={} from {} raised an unexpected error", operation.wireName(), correlationId,
                sender, e);
            throw new BrokerBusError(FailureCode.FAILED, operation.wireName() + " failed");
        }
    }
}
