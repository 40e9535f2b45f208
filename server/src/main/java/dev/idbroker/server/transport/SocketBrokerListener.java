package dev.idbroker.server.transport;

import dev.idbroker.server.broker.BrokerDispatcher;
import dev.idbroker.server.config.SocketProperties;
import dev.idbroker.server.credentials.CredentialResolver;
import dev.idbroker.server.credentials.LibC;
import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.Envelope;
import dev.idbroker.transport.EnvelopeCodec;
import dev.idbroker.transport.InboundBuffer;
import dev.idbroker.transport.ShutdownSignal;
import dev.idbroker.transport.Wire;
import java.io.Closeable;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stream-socket front end of the privileged broker. Binds a world-connectable UNIX socket, resolves
 * the peer uid of every accepted connection once and serves each connection on its own thread.
 *
 * <p>A connection that buffers more than the configured maximum without completing a request is
 * closed. Authorization rests on the peer uid, not on the socket file mode. On shutdown the listener
 * stops accepting; connections already being served are left to finish.
 */
public class SocketBrokerListener implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SocketBrokerListener.class);

    private final Path socketPath;
    private final boolean replaceStale;
    private final int readBufferSize;
    private final int maxRequestSize;
    private final Duration drainTimeout;
    private final BrokerDispatcher dispatcher;
    private final CredentialResolver<SocketChannel> credentials;
    private final LibC libc;
    private final EnvelopeCodec codec = new EnvelopeCodec();
    private final ExecutorService clientExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "broker-socket-client");
        t.setDaemon(true);
        return t;
    });
    private final Set<ClientConnection> connections = ConcurrentHashMap.newKeySet();
    private final AtomicInteger connectionCounter = new AtomicInteger();

    private ServerSocketChannel serverChannel;
    private Thread acceptThread;
    private volatile boolean running;

    public SocketBrokerListener(SocketProperties properties, BrokerDispatcher dispatcher,
        CredentialResolver<SocketChannel> credentials, LibC libc) {
        if (properties.getReadBufferSize() <= 0) {
            throw new IllegalArgumentException("broker.socket.read-buffer-size must be positive, got "
                + properties.getReadBufferSize());
        }
        if (properties.getMaxRequestSize() <= 0) {
            throw new IllegalArgumentException("broker.socket.max-request-size must be positive, got "
                + properties.getMaxRequestSize());
        }
        this.socketPath = properties.getPath();
        this.replaceStale = properties.isReplaceStale();
        this.readBufferSize = properties.getReadBufferSize();
        this.maxRequestSize = properties.getMaxRequestSize();
        this.drainTimeout = properties.getDrainTimeout();
        this.dispatcher = dispatcher;
        this.credentials = credentials;
        this.libc = libc;
    }

    /**
     * Bind the socket and start accepting until {@code shutdownSignal} fires.
     * @throws IllegalStateException when the socket cannot be bound
     */
    public synchronized void start(ShutdownSignal shutdownSignal) {
        if (running) {
            return;
        }
        bind();
        running = true;
        acceptThread = new Thread(this::acceptLoop, "broker-socket-accept");
        acceptThread.setDaemon(true);
        acceptThread.start();
        shutdownSignal.subscribe(this::stop);
        LOGGER.info("Broker socket listening on {}", socketPath);
    }

    private void bind() {
        try {
            if (replaceStale && Files.deleteIfExists(socketPath)) {
                LOGGER.info("Removed stale broker socket {}", socketPath);
            }
            serverChannel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            try (UmaskScope ignored = UmaskScope.apply(libc, 0)) {
                serverChannel.bind(UnixDomainSocketAddress.of(socketPath));
            }
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Failed to bind UNIX socket at {}", socketPath);
            closeServerChannel();
            throw new IllegalStateException("Failed to bind broker socket at " + socketPath, e);
        }
    }

    private void acceptLoop() {
        while (running) {
            SocketChannel channel;
            try {
                channel = serverChannel.accept();
            } catch (ClosedChannelException e) {
                break;
            } catch (IOException e) {
                if (running) {
                    LOGGER.error("Error accepting connection", e);
                }
                continue;
            }
            long uid;
            try {
                uid = credentials.resolve(channel);
            } catch (BrokerException e) {
                LOGGER.warn("Rejecting connection: {}", e.getMessage());
                closeQuietly(channel);
                continue;
            }
            ClientConnection connection = new ClientConnection(channel, uid, "conn-" + connectionCounter.incrementAndGet());
            connections.add(connection);
            try {
                clientExecutor.submit(connection::serve);
            } catch (RejectedExecutionException e) {
                LOGGER.warn("Client executor rejected connection {}", connection.connectionId);
                connections.remove(connection);
                closeQuietly(channel);
            }
        }
    }

    public boolean isRunning() {
        return running;
    }

    public Path socketPath() {
        return socketPath;
    }

    /**
     * States of the connections currently being served.
     */
    List<ConnectionState> connectionStates() {
        return connections.stream().map(connection -> connection.state).collect(Collectors.toList());
    }

    /**
     * Stop accepting and remove the socket file. Running connections are not interrupted; they get
     * up to the drain timeout to finish.
     */
    public void stop() {
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
        }
        closeServerChannel();
        if (acceptThread != null && acceptThread != Thread.currentThread()) {
            try {
                acceptThread.join(Duration.ofSeconds(1).toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            LOGGER.warn("Error removing broker socket {}", socketPath, e);
        }
        clientExecutor.shutdown();
        try {
            if (!clientExecutor.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("{} connection(s) still open after {}", connections.size(), drainTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOGGER.info("Broker socket stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private void closeServerChannel() {
        if (serverChannel == null) {
            return;
        }
        try {
            serverChannel.close();
        } catch (IOException e) {
            LOGGER.warn("Error closing server socket", e);
        }
    }

    private static void closeQuietly(SocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            LOGGER.debug("Error closing rejected connection", e);
        }
    }

    enum ConnectionState {
        READING, DISPATCHING, WRITING, CLOSED
    }

    /**
     * One accepted connection. The caller uid is fixed for its whole lifetime and requests are
     * served strictly one after another.
     */
    private final class ClientConnection {

        private final SocketChannel channel;
        private final long uid;
        private final String connectionId;

        private volatile ConnectionState state = ConnectionState.READING;

        ClientConnection(SocketChannel channel, long uid, String connectionId) {
            this.channel = channel;
            this.uid = uid;
            this.connectionId = connectionId;
            LOGGER.debug("Accepted connection {} uid={}", connectionId, uid);
        }

        void serve() {
            ByteBuffer chunk = ByteBuffer.allocate(readBufferSize);
            InboundBuffer inbound = new InboundBuffer();
            try (SocketChannel ch = channel) {
                while (true) {
                    state = ConnectionState.READING;
                    chunk.clear();
                    if (ch.read(chunk) == -1) {
                        if (!inbound.isEmpty()) {
                            LOGGER.warn("Connection {} closed with {} undecoded byte(s)", connectionId, inbound.length());
                        }
                        break;
                    }
                    chunk.flip();
                    inbound.append(chunk);
                    Optional<Envelope> request = codec.decode(inbound);
                    if (request.isEmpty()) {
                        if (inbound.length() > maxRequestSize) {
                            LOGGER.warn("Connection {} buffered {} undecoded byte(s), over the {} byte limit",
                                connectionId, inbound.length(), maxRequestSize);
                            break;
                        }
                        continue;
                    }
                    Envelope envelope = request.get();
                    Wire.rx(connectionId, envelope);

                    state = ConnectionState.DISPATCHING;
                    String result;
                    try {
                        result = dispatcher.dispatch(envelope, uid);
                    } catch (BrokerException e) {
                        LOGGER.warn("{} corr={} on {} failed ({}): {}", envelope.operation().wireName(),
                            envelope.correlationId(), connectionId, e.code().code(), e.getMessage());
                        break;
                    } catch (RuntimeException e) {
                        LOGGER.error("{} corr={} on {} raised an unexpected error", envelope.operation().wireName(),
                            envelope.correlationId(), connectionId, e);
                        break;
                    }

                    state = ConnectionState.WRITING;
                    ByteBuffer response = ByteBuffer.wrap(codec.encodeResponse(result));
                    while (response.hasRemaining()) {
                        ch.write(response);
                    }
                    Wire.tx(connectionId, envelope, response.limit());
                }
            } catch (IOException e) {
                LOGGER.error("Connection error {} while {}", connectionId, state, e);
            } finally {
                LOGGER.debug("Connection {} closed while {}", connectionId, state);
                state = ConnectionState.CLOSED;
                connections.remove(this);
            }
        }
    }
}
