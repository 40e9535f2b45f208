package dev.idbroker.server.bus;

import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;

/**
 * Bus interface of the Device Capability Broker. Every member takes an opaque session id and a
 * JSON request and returns a JSON response.
 */
@DBusInterfaceName("com.microsoft.identity.DeviceBroker1")
public interface DeviceBrokerBus extends DBusInterface {

    String sign(String sessionId, String requestJson);

    String generateKeyPair(String sessionId, String requestJson);

    String loadKeyPair(String sessionId, String requestJson);

    String persistKey(String sessionId, String requestJson);

    String generateDerivedKey(String sessionId, String requestJson);

    String deleteKey(String sessionId, String requestJson);

    String decrypt(String sessionId, String requestJson);

    String generatePKCS10CertSigningRequest(String sessionId, String requestJson);

    String asymmetricKeyExists(String sessionId, String requestJson);

    String asymmetricKeyWithThumbprintExists(String sessionId, String requestJson);

    String getAsymmetricKeyThumbprint(String sessionId, String requestJson);

    String generateAsymmetricKey(String sessionId, String requestJson);

    String getAsymmetricKeyCreationDate(String sessionId, String requestJson);

    String clearAsymmetricKey(String sessionId, String requestJson);

    String getRequestConfirmation(String sessionId, String requestJson);

    String mintSignedAccessToken(String sessionId, String requestJson);

    String mintSignedHttpRequest(String sessionId, String requestJson);

    String makeHttpRequestWithClientTls(String sessionId, String requestJson);
}
