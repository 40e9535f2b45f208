package dev.idbroker.server.broker;

import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.FailureCode;

/**
 * Pluggable identity broker behind the System Broker and the stream socket. Every method receives
 * the opaque request fields unchanged plus the uid of the verified caller, and returns the opaque
 * result string.
 *
 * <p>A single instance is shared by every connection handler and bus worker, so implementations
 * must be thread-safe. Operations that are not overridden are answered with
 * {@link FailureCode#NOT_SUPPORTED}.
 */
public interface IdentityBroker {

    /**
     * Interactive token acquisition; the implementation may prompt the user.
     */
    default String acquireTokenInteractively(String protocolVersion, String correlationId, String requestJson, long uid)
        throws BrokerException {
        throw unsupported("acquireTokenInteractively");
    }

    /**
     * Token acquisition from cached credentials without user interaction.
     */
    default String acquireTokenSilently(String protocolVersion, String correlationId, String requestJson, long uid)
        throws BrokerException {
        throw unsupported("acquireTokenSilently");
    }

    /**
     * Accounts known for the calling user.
     */
    default String getAccounts(String protocolVersion, String correlationId, String requestJson, long uid)
        throws BrokerException {
        throw unsupported("getAccounts");
    }

    /**
     * Remove an account of the calling user.
     */
    default String removeAccount(String protocolVersion, String correlationId, String requestJson, long uid)
        throws BrokerException {
        throw unsupported("removeAccount");
    }

    /**
     * SSO cookie derived from the user's primary refresh token.
     */
    default String acquirePrtSsoCookie(String protocolVersion, String correlationId, String requestJson, long uid)
        throws BrokerException {
        throw unsupported("acquirePrtSsoCookie");
    }

    /**
     * Sign an HTTP request on behalf of the calling user.
     */
    default String generateSignedHttpRequest(String protocolVersion, String correlationId, String requestJson, long uid)
        throws BrokerException {
        throw unsupported("generateSignedHttpRequest");
    }

    /**
     * Abort a pending interactive flow.
     */
    default String cancelInteractiveFlow(String protocolVersion, String correlationId, String requestJson, long uid)
        throws BrokerException {
        throw unsupported("cancelInteractiveFlow");
    }

    /**
     * Version information of the broker implementation.
     */
    default String getLinuxBrokerVersion(String protocolVersion, String correlationId, String requestJson, long uid)
        throws BrokerException {
        throw unsupported("getLinuxBrokerVersion");
    }

    private static BrokerException unsupported(String operation) {
        return new BrokerException(FailureCode.NOT_SUPPORTED, operation + " is not supported by this broker");
    }
}
