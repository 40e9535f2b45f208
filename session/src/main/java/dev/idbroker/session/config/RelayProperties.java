package dev.idbroker.session.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "broker.relay")
public class RelayProperties {

    public enum Mode {
        /** Call the System Broker over the system bus. */
        BUS,
        /** Write to the daemon's stream socket. */
        SOCKET
    }

    private Mode mode = Mode.BUS;

    /**
     * Stream socket of the privileged daemon, used in {@link Mode#SOCKET}.
     */
    private Path socketPath = Paths.get("/var/run/himmelblaud/broker_sock");

    /**
     * Upper bound for one relayed call.
     */
    private Duration timeout = Duration.ofSeconds(5);

    /**
     * Size of a single socket read. A read shorter than this ends the response.
     */
    private int chunkSize = 1024;

    private String systemBrokerName = "org.samba.himmelblau";

    private String systemBrokerPath = "/org/samba/himmelblau";

    public Mode getMode() {
        return mode;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public Path getSocketPath() {
        return socketPath;
    }

    public void setSocketPath(String socketPath) {
        this.socketPath = Paths.get(socketPath).toAbsolutePath().normalize();
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
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
}
