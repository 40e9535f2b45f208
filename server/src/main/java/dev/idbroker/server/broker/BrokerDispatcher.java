package dev.idbroker.server.broker;

import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.Envelope;
import dev.idbroker.transport.FailureCode;

/**
 * Routes a decoded {@link Envelope} to the {@link IdentityBroker}, together with the uid of the
 * caller as established by the transport it arrived on. Shared by the stream socket and the
 * system bus facade.
 */
public class BrokerDispatcher {

    private final IdentityBroker broker;

    public BrokerDispatcher(IdentityBroker broker) {
        this.broker = broker;
    }

    public String dispatch(Envelope request, long uid) throws BrokerException {
        String protocolVersion = request.protocolVersion();
        String correlationId = request.correlationId();
        String requestJson = request.requestJson();
        String result = switch (request.operation()) {
            case ACQUIRE_TOKEN_INTERACTIVELY ->
                broker.acquireTokenInteractively(protocolVersion, correlationId, requestJson, uid);
            case ACQUIRE_TOKEN_SILENTLY ->
                broker.acquireTokenSilently(protocolVersion, correlationId, requestJson, uid);
            case GET_ACCOUNTS -> broker.getAccounts(protocolVersion, correlationId, requestJson, uid);
            case REMOVE_ACCOUNT -> broker.removeAccount(protocolVersion, correlationId, requestJson, uid);
            case ACQUIRE_PRT_SSO_COOKIE ->
                broker.acquirePrtSsoCookie(protocolVersion, correlationId, requestJson, uid);
            case GENERATE_SIGNED_HTTP_REQUEST ->
                broker.generateSignedHttpRequest(protocolVersion, correlationId, requestJson, uid);
            case CANCEL_INTERACTIVE_FLOW ->
                broker.cancelInteractiveFlow(protocolVersion, correlationId, requestJson, uid);
            case GET_LINUX_BROKER_VERSION ->
                broker.getLinuxBrokerVersion(protocolVersion, correlationId, requestJson, uid);
        };
        if (result == null) {
            throw new BrokerException(FailureCode.FAILED, request.operation().wireName() + " returned no result");
        }
        return result;
    }
}
