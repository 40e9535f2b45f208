package dev.idbroker.session.relay;

import static org.junit.jupiter.api.Assertions.*;

import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.Envelope;
import dev.idbroker.transport.FailureCode;
import dev.idbroker.transport.Operation;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(value = 20, unit = TimeUnit.SECONDS)
class SocketBrokerRelayTest {

    private static final Envelope SILENT = new Envelope(Operation.ACQUIRE_TOKEN_SILENTLY, "0.1", "corr-123",
        "{\"scope\":\"x\"}");

    @TempDir
    Path tempDir;

    private Path socketPath;

    @BeforeEach
    void setUp() {
        socketPath = tempDir.resolve("broker_sock");
    }

    @Test
    void returnsShortResponseUnmodified() throws Exception {
        try (ScriptedDaemon daemon = new ScriptedDaemon(socketPath, (channel, self) -> {
            ScriptedDaemon.write(channel, "{\"token\":\"abc\"}");
            self.awaitRelease();
        })) {
            SocketBrokerRelay relay = new SocketBrokerRelay(socketPath, Duration.ofSeconds(5), 1024);

            assertEquals("{\"token\":\"abc\"}", relay.forward(SILENT));
            assertEquals(SILENT, daemon.received());
        }
    }

    @Test
    void readsResponseSpanningSeveralChunks() throws Exception {
        String response = "{\"token\":\"0123456789abcdef\"}";
        try (ScriptedDaemon daemon = new ScriptedDaemon(socketPath, (channel, self) -> {
            ScriptedDaemon.write(channel, response);
            self.awaitRelease();
        })) {
            SocketBrokerRelay relay = new SocketBrokerRelay(socketPath, Duration.ofSeconds(5), 8);

            assertEquals(response, relay.forward(SILENT));
        }
    }

    @Test
    void silentPeerTimesOutNoEarlierThanTimeout() throws Exception {
        Duration timeout = Duration.ofMillis(300);
        try (ScriptedDaemon daemon = new ScriptedDaemon(socketPath, (channel, self) -> self.awaitRelease())) {
            SocketBrokerRelay relay = new SocketBrokerRelay(socketPath, timeout, 1024);

            long started = System.nanoTime();
            BrokerException error = assertThrows(BrokerException.class, () -> relay.forward(SILENT));
            long elapsed = System.nanoTime() - started;

            assertEquals(FailureCode.TIMEOUT, error.code());
            assertTrue(elapsed >= timeout.toNanos(), "gave up after " + elapsed + " ns");
        }
    }

    @Test
    void exactChunkMultipleWaitsForMoreData() throws Exception {
        try (ScriptedDaemon daemon = new ScriptedDaemon(socketPath, (channel, self) -> {
            ScriptedDaemon.write(channel, "12345678");
            self.awaitRelease();
        })) {
            SocketBrokerRelay relay = new SocketBrokerRelay(socketPath, Duration.ofMillis(300), 8);

            BrokerException error = assertThrows(BrokerException.class, () -> relay.forward(SILENT));
            assertEquals(FailureCode.TIMEOUT, error.code());
        }
    }

    @Test
    void endOfStreamAfterDataCompletesResponse() throws Exception {
        try (ScriptedDaemon daemon = new ScriptedDaemon(socketPath,
            (channel, self) -> ScriptedDaemon.write(channel, "12345678"))) {
            SocketBrokerRelay relay = new SocketBrokerRelay(socketPath, Duration.ofSeconds(5), 8);

            assertEquals("12345678", relay.forward(SILENT));
        }
    }

    @Test
    void closeWithoutResponseFails() throws Exception {
        try (ScriptedDaemon daemon = new ScriptedDaemon(socketPath, (channel, self) -> {
        })) {
            SocketBrokerRelay relay = new SocketBrokerRelay(socketPath, Duration.ofSeconds(5), 1024);

            BrokerException error = assertThrows(BrokerException.class, () -> relay.forward(SILENT));
            assertEquals(FailureCode.FAILED, error.code());
        }
    }

    @Test
    void peerThatNeverReadsTimesOutDuringWrite() throws Exception {
        String largeRequest = "\"" + "x".repeat(4 * 1024 * 1024) + "\"";
        Envelope request = new Envelope(Operation.GENERATE_SIGNED_HTTP_REQUEST, "0.1", "corr-big", largeRequest);
        Duration timeout = Duration.ofMillis(500);
        try (ServerSocketChannel neverAccepting = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
            neverAccepting.bind(UnixDomainSocketAddress.of(socketPath));
            SocketBrokerRelay relay = new SocketBrokerRelay(socketPath, timeout, 1024);

            long started = System.nanoTime();
            BrokerException error = assertThrows(BrokerException.class, () -> relay.forward(request));
            long elapsed = System.nanoTime() - started;

            assertEquals(FailureCode.TIMEOUT, error.code());
            assertTrue(elapsed >= timeout.toNanos(), "gave up after " + elapsed + " ns");
            assertTrue(elapsed < Duration.ofSeconds(5).toNanos(), "still blocked after " + elapsed + " ns");
        }
    }

    @Test
    void missingSocketFails() {
        SocketBrokerRelay relay = new SocketBrokerRelay(socketPath, Duration.ofSeconds(5), 1024);

        BrokerException error = assertThrows(BrokerException.class, () -> relay.forward(SILENT));
        assertEquals(FailureCode.FAILED, error.code());
    }

    @Test
    void rejectsNonPositiveChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new SocketBrokerRelay(socketPath, Duration.ofSeconds(1), 0));
    }
}
