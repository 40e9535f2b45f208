package dev.idbroker.session.bus;

import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;

/**
 * Bus interface of the per-user Session Broker. Same members and signatures as the System Broker.
 */
@DBusInterfaceName("com.microsoft.identity.Broker1")
public interface SessionBrokerBus extends DBusInterface {

    String acquireTokenInteractively(String protocolVersion, String correlationId, String requestJson);

    String acquireTokenSilently(String protocolVersion, String correlationId, String requestJson);

    String getAccounts(String protocolVersion, String correlationId, String requestJson);

    String removeAccount(String protocolVersion, String correlationId, String requestJson);

    String acquirePrtSsoCookie(String protocolVersion, String correlationId, String requestJson);

    String generateSignedHttpRequest(String protocolVersion, String correlationId, String requestJson);

    String cancelInteractiveFlow(String protocolVersion, String correlationId, String requestJson);

    String getLinuxBrokerVersion(String protocolVersion, String correlationId, String requestJson);
}
