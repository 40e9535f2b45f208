package dev.idbroker.server.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "broker.socket")
public class SocketProperties {

    /**
     * Filesystem path of the broker stream socket.
     */
    private Path path = Paths.get("/var/run/himmelblaud/broker_sock");

    /**
     * Remove a leftover socket file at {@link #path} before binding.
     */
    private boolean replaceStale = true;

    /**
     * Size of a single socket read.
     */
    private int readBufferSize = 4096;

    /**
     * Largest undecoded request a connection may buffer before it is closed.
     */
    private int maxRequestSize = 1024 * 1024;

    /**
     * How long shutdown waits for in-flight connections before giving up on them.
     */
    private Duration drainTimeout = Duration.ofSeconds(5);

    public Path getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = Paths.get(path).toAbsolutePath().normalize();
    }

    public boolean isReplaceStale() {
        return replaceStale;
    }

    public void setReplaceStale(boolean replaceStale) {
        this.replaceStale = replaceStale;
    }

    public int getReadBufferSize() {
        return readBufferSize;
    }

    public void setReadBufferSize(int readBufferSize) {
        this.readBufferSize = readBufferSize;
    }

    public int getMaxRequestSize() {
        return maxRequestSize;
    }

    public void setMaxRequestSize(int maxRequestSize) {
        this.maxRequestSize = maxRequestSize;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }
}
