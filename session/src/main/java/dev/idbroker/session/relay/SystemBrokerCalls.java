package dev.idbroker.session.relay;

import dev.idbroker.transport.Envelope;
import dev.idbroker.transport.bus.SystemBrokerBus;

final class SystemBrokerCalls {

    private SystemBrokerCalls() {
    }

    static String invoke(SystemBrokerBus broker, Envelope request) {
        String protocolVersion = request.protocolVersion();
        String correlationId = request.correlationId();
        String requestJson = request.requestJson();
        return switch (request.operation()) {
            case ACQUIRE_TOKEN_INTERACTIVELY ->
                broker.acquireTokenInteractively(protocolVersion, correlationId, requestJson);
            case ACQUIRE_TOKEN_SILENTLY -> broker.acquireTokenSilently(protocolVersion, correlationId, requestJson);
            case GET_ACCOUNTS -> broker.getAccounts(protocolVersion, correlationId, requestJson);
            case REMOVE_ACCOUNT -> broker.removeAccount(protocolVersion, correlationId, requestJson);
            case ACQUIRE_PRT_SSO_COOKIE -> broker.acquirePrtSsoCookie(protocolVersion, correlationId, requestJson);
            case GENERATE_SIGNED_HTTP_REQUEST ->
                broker.generateSignedHttpRequest(protocolVersion, correlationId, requestJson);
            case CANCEL_INTERACTIVE_FLOW -> broker.cancelInteractiveFlow(protocolVersion, correlationId, requestJson);
            case GET_LINUX_BROKER_VERSION ->
                broker.getLinuxBrokerVersion(protocolVersion, correlationId, requestJson);
        };
    }
}
