package dev.idbroker.session.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "broker.session")
public class SessionBusProperties {

    /**
     * Well-known name claimed on the session bus.
     */
    private String name = "com.microsoft.identity.broker1";

    private String path = "/com/microsoft/identity/broker1";

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }
}
