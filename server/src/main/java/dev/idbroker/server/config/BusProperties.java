package dev.idbroker.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "broker.bus")
public class BusProperties {

    /**
     * Serve the System and Device Capability brokers on the system bus. When disabled only the
     * stream socket is offered.
     */
    private boolean enabled = true;

    private String systemBrokerName = "org.samba.himmelblau";

    private String systemBrokerPath = "/org/samba/himmelblau";

    private boolean deviceBrokerEnabled = true;

    private String deviceBrokerName = "com.microsoft.identity.DeviceBroker1";

    private String deviceBrokerPath = "/com/microsoft/identity/devicebroker1";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSystemBrokerName() {
        return systemBrokerName;
    }

    public void setSystemBrokerName(String systemBrokerName) {
        this.systemBrokerName = systemBrokerName;
    }

    public String getSystemBrokerPath() {
        return systemBrokerPath;
    }

    public void setSystemBrokerPath(String systemBrokerPath) {
        this.systemBrokerPath = systemBrokerPath;
    }

    public boolean isDeviceBrokerEnabled() {
        return deviceBrokerEnabled;
    }

    public void setDeviceBrokerEnabled(boolean deviceBrokerEnabled) {
        this.deviceBrokerEnabled = deviceBrokerEnabled;
    }

    public String getDeviceBrokerName() {
        return deviceBrokerName;
    }

    public void setDeviceBrokerName(String deviceBrokerName) {
        this.deviceBrokerName = deviceBrokerName;
    }

    public String getDeviceBrokerPath() {
        return deviceBrokerPath;
    }

    public void setDeviceBrokerPath(String deviceBrokerPath) {
        this.deviceBrokerPath = deviceBrokerPath;
    }
}
