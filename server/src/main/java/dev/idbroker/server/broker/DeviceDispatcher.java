package dev.idbroker.server.broker;

import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.FailureCode;

/**
 * Routes a {@link DeviceCall} to the matching {@link DeviceBroker} method.
 */
public class DeviceDispatcher {

    private final DeviceBroker broker;

    public DeviceDispatcher(DeviceBroker broker) {
        this.broker = broker;
    }

    public String dispatch(DeviceCall call) throws BrokerException {
        String sessionId = call.sessionId();
        String requestJson = call.requestJson();
        String result = switch (call.operation()) {
            case SIGN -> broker.sign(sessionId, requestJson);
            case GENERATE_KEY_PAIR -> broker.generateKeyPair(sessionId, requestJson);
            case LOAD_KEY_PAIR -> broker.loadKeyPair(sessionId, requestJson);
            case PERSIST_KEY -> broker.persistKey(sessionId, requestJson);
            case GENERATE_DERIVED_KEY -> broker.generateDerivedKey(sessionId, requestJson);
            case DELETE_KEY -> broker.deleteKey(sessionId, requestJson);
            case DECRYPT -> broker.decrypt(sessionId, requestJson);
            case GENERATE_PKCS10_CERT_SIGNING_REQUEST -> broker.generatePKCS10CertSigningRequest(sessionId, requestJson);
            case ASYMMETRIC_KEY_EXISTS -> broker.asymmetricKeyExists(sessionId, requestJson);
            case ASYMMETRIC_KEY_WITH_THUMBPRINT_EXISTS -> broker.asymmetricKeyWithThumbprintExists(sessionId, requestJson);
            case GET_ASYMMETRIC_KEY_THUMBPRINT -> broker.getAsymmetricKeyThumbprint(sessionId, requestJson);
            case GENERATE_ASYMMETRIC_KEY -> broker.generateAsymmetricKey(sessionId, requestJson);
            case GET_ASYMMETRIC_KEY_CREATION_DATE -> broker.getAsymmetricKeyCreationDate(sessionId, requestJson);
            case CLEAR_ASYMMETRIC_KEY -> broker.clearAsymmetricKey(sessionId, requestJson);
            case GET_REQUEST_CONFIRMATION -> broker.getRequestConfirmation(sessionId, requestJson);
            case MINT_SIGNED_ACCESS_TOKEN -> broker.mintSignedAccessToken(sessionId, requestJson);
            case MINT_SIGNED_HTTP_REQUEST -> broker.mintSignedHttpRequest(sessionId, requestJson);
            case MAKE_HTTP_REQUEST_WITH_CLIENT_TLS -> broker.makeHttpRequestWithClientTls(sessionId, requestJson);
        };
        if (result == null) {
            throw new BrokerException(FailureCode.FAILED,
                call.operation().wireName() + " returned no result");
        }
        return result;
    }
}
