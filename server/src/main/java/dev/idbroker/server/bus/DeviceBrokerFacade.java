package dev.idbroker.server.bus;

import dev.idbroker.server.broker.DeviceCall;
import dev.idbroker.server.broker.DeviceDispatcher;
import dev.idbroker.server.broker.DeviceOperation;
import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.FailureCode;
import dev.idbroker.transport.bus.BrokerBusError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exports the {@link DeviceBrokerBus} members. The session id is passed through as given; the
 * device broker decides whether the caller may use it.
 */
public class DeviceBrokerFacade implements DeviceBrokerBus {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeviceBrokerFacade.class);

    private final String objectPath;
    private final DeviceDispatcher dispatcher;

    public DeviceBrokerFacade(String objectPath, DeviceDispatcher dispatcher) {
        this.objectPath = objectPath;
        this.dispatcher = dispatcher;
    }

    @Override
    public String getObjectPath() {
        return objectPath;
    }

    @Override
    public String sign(String sessionId, String requestJson) {
        return call(DeviceOperation.SIGN, sessionId, requestJson);
    }

    @Override
    public String generateKeyPair(String sessionId, String requestJson) {
        return call(DeviceOperation.GENERATE_KEY_PAIR, sessionId, requestJson);
    }

    @Override
    public String loadKeyPair(String sessionId, String requestJson) {
        return call(DeviceOperation.LOAD_KEY_PAIR, sessionId, requestJson);
    }

    @Override
    public String persistKey(String sessionId, String requestJson) {
        return call(DeviceOperation.PERSIST_KEY, sessionId, requestJson);
    }

    @Override
    public String generateDerivedKey(String sessionId, String requestJson) {
        return call(DeviceOperation.GENERATE_DERIVED_KEY, sessionId, requestJson);
    }

    @Override
    public String deleteKey(String sessionId, String requestJson) {
        return call(DeviceOperation.DELETE_KEY, sessionId, requestJson);
    }

    @Override
    public String decrypt(String sessionId, String requestJson) {
        return call(DeviceOperation.DECRYPT, sessionId, requestJson);
    }

    @Override
    public String generatePKCS10CertSigningRequest(String sessionId, String requestJson) {
        return call(DeviceOperation.GENERATE_PKCS10_CERT_SIGNING_REQUEST, sessionId, requestJson);
    }

    @Override
    public String asymmetricKeyExists(String sessionId, String requestJson) {
        return call(DeviceOperation.ASYMMETRIC_KEY_EXISTS, sessionId, requestJson);
    }

    @Override
    public String asymmetricKeyWithThumbprintExists(String sessionId, String requestJson) {
        return call(DeviceOperation.ASYMMETRIC_KEY_WITH_THUMBPRINT_EXISTS, sessionId, requestJson);
    }

    @Override
    public String getAsymmetricKeyThumbprint(String sessionId, String requestJson) {
        return call(DeviceOperation.GET_ASYMMETRIC_KEY_THUMBPRINT, sessionId, requestJson);
    }

    @Override
    public String generateAsymmetricKey(String sessionId, String requestJson) {
        return call(DeviceOperation.GENERATE_ASYMMETRIC_KEY, sessionId, requestJson);
    }

    @Override
    public String getAsymmetricKeyCreationDate(String sessionId, String requestJson) {
        return call(DeviceOperation.GET_ASYMMETRIC_KEY_CREATION_DATE, sessionId, requestJson);
    }

    @Override
    public String clearAsymmetricKey(String sessionId, String requestJson) {
        return call(DeviceOperation.CLEAR_ASYMMETRIC_KEY, sessionId, requestJson);
    }

    @Override
    public String getRequestConfirmation(String sessionId, String requestJson) {
        return call(DeviceOperation.GET_REQUEST_CONFIRMATION, sessionId, requestJson);
    }

    @Override
    public String mintSignedAccessToken(String sessionId, String requestJson) {
        return call(DeviceOperation.MINT_SIGNED_ACCESS_TOKEN, sessionId, requestJson);
    }

    @Override
    public String mintSignedHttpRequest(String sessionId, String requestJson) {
        return call(DeviceOperation.MINT_SIGNED_HTTP_REQUEST, sessionId, requestJson);
    }

    @Override
    public String makeHttpRequestWithClientTls(String sessionId, String requestJson) {
        return call(DeviceOperation.MAKE_HTTP_REQUEST_WITH_CLIENT_TLS, sessionId, requestJson);
    }

    private String call(DeviceOperation operation, String sessionId, String requestJson) {
        try {
            return dispatcher.dispatch(new DeviceCall(sessionId, operation, requestJson));
        } catch (BrokerException e) {
            LOGGER.debug("{} failed ({}): {}", operation.wireName(), e.code().code(), e.getMessage());
            throw BrokerBusError.from(e);
        } catch (RuntimeException e) {
            LOGGER.error("{} raised an unexpected error", operation.wireName(), e);
            throw new BrokerBusError(FailureCode.FAILED, operation.wireName() + " failed");
        }
    }
}
