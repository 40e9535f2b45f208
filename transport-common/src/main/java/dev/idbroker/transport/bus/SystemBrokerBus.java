package dev.idbroker.transport.bus;

import org.freedesktop.dbus.annotations.DBusInterfaceName;
import org.freedesktop.dbus.interfaces.DBusInterface;

/**
 * Bus interface of the privileged System Broker. Exported by the daemon on the system bus and
 * called by the session relay.
 */
@DBusInterfaceName("org.samba.himmelblau")
public interface SystemBrokerBus extends DBusInterface {

    String acquireTokenInteractively(String protocolVersion, String correlationId, String requestJson);

    String acquireTokenSilently(String protocolVersion, String correlationId, String requestJson);

    String getAccounts(String protocolVersion, String correlationId, String requestJson);

    String removeAccount(String protocolVersion, String correlationId, String requestJson);

    String acquirePrtSsoCookie(String protocolVersion, String correlationId, String requestJson);

    String generateSignedHttpRequest(String protocolVersion, String correlationId, String requestJson);

    String cancelInteractiveFlow(String protocolVersion, String correlationId, String requestJson);

    String getLinuxBrokerVersion(String protocolVersion, String correlationId, String requestJson);
}
