package dev.idbroker.server.broker;

import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.FailureCode;

/**
 * Pluggable key-management backend of the Device Capability Broker. The caller-supplied session id
 * is passed through untouched; deciding whether the caller may use that session is up to the
 * implementation. Must be thread-safe.
 */
public interface DeviceBroker {

    default String sign(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("sign");
    }

    default String generateKeyPair(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("generateKeyPair");
    }

    default String loadKeyPair(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("loadKeyPair");
    }

    default String persistKey(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("persistKey");
    }

    default String generateDerivedKey(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("generateDerivedKey");
    }

    default String deleteKey(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("deleteKey");
    }

    default String decrypt(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("decrypt");
    }

    default String generatePKCS10CertSigningRequest(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("generatePKCS10CertSigningRequest");
    }

    default String asymmetricKeyExists(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("asymmetricKeyExists");
    }

    default String asymmetricKeyWithThumbprintExists(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("asymmetricKeyWithThumbprintExists");
    }

    default String getAsymmetricKeyThumbprint(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("getAsymmetricKeyThumbprint");
    }

    default String generateAsymmetricKey(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("generateAsymmetricKey");
    }

    default String getAsymmetricKeyCreationDate(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("getAsymmetricKeyCreationDate");
    }

    default String clearAsymmetricKey(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("clearAsymmetricKey");
    }

    default String getRequestConfirmation(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("getRequestConfirmation");
    }

    default String mintSignedAccessToken(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("mintSignedAccessToken");
    }

    default String mintSignedHttpRequest(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("mintSignedHttpRequest");
    }

    default String makeHttpRequestWithClientTls(String sessionId, String requestJson) throws BrokerException {
        throw unsupported("makeHttpRequestWithClientTls");
    }

    private static BrokerException unsupported(String operation) {
        return new BrokerException(FailureCode.NOT_SUPPORTED, operation + " is not supported by this device broker");
    }
}
