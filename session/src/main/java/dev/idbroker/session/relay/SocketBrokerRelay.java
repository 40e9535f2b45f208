package dev.idbroker.session.relay;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.Envelope;
import dev.idbroker.transport.EnvelopeCodec;
import dev.idbroker.transport.FailureCode;
import dev.idbroker.transport.Wire;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relays each request over a fresh connection to the daemon's stream socket. Connecting, writing
 * the request and reading the response all count against one deadline.
 *
 * <p>The response has no framing. It is read in fixed-size chunks: a chunk shorter than the chunk
 * size, or end of stream after some data, ends the response. A response whose length is an exact
 * multiple of the chunk size therefore only completes when the daemon closes the connection or the
 * timeout expires.
 */
public class SocketBrokerRelay implements BrokerRelay {

    private static final Logger LOGGER = LoggerFactory.getLogger(SocketBrokerRelay.class);

    private final Path socketPath;
    private final Duration timeout;
    private final int chunkSize;
    private final EnvelopeCodec codec = new EnvelopeCodec();

    public SocketBrokerRelay(Path socketPath, Duration timeout, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        this.socketPath = socketPath;
        this.timeout = timeout;
        this.chunkSize = chunkSize;
    }

    @Override
    public String forward(Envelope request) throws BrokerException {
        Wire.relay(socketPath.toString(), request);
        byte[] payload;
        try {
            payload = codec.encode(request);
        } catch (JsonProcessingException e) {
            throw BrokerException.failed("Unable to encode " + request.operation().wireName(), e);
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        try (SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
             Selector selector = Selector.open()) {
            channel.configureBlocking(false);
            SelectionKey key = channel.register(selector, 0);
            connect(channel, key, deadline, request);
            write(channel, key, payload, deadline, request);
            byte[] response = read(channel, key, deadline, request);
            return codec.decodeResponse(response, response.length);
        } catch (IOException e) {
            LOGGER.warn("Relay connection to {} failed", socketPath, e);
            throw BrokerException.failed("Unable to use broker socket " + socketPath, e);
        }
    }

    private void connect(SocketChannel channel, SelectionKey key, long deadline, Envelope request)
        throws BrokerException {
        try {
            if (channel.connect(UnixDomainSocketAddress.of(socketPath))) {
                return;
            }
            while (!channel.finishConnect()) {
                awaitReady(key, SelectionKey.OP_CONNECT, deadline, request);
            }
        } catch (IOException e) {
            LOGGER.warn("Unable to connect to broker socket {}: {}", socketPath, e.getMessage());
            throw BrokerException.failed("Unable to connect to broker socket " + socketPath, e);
        }
    }

    private void write(SocketChannel channel, SelectionKey key, byte[] payload, long deadline, Envelope request)
        throws BrokerException {
        ByteBuffer buffer = ByteBuffer.wrap(payload);
        try {
            while (buffer.hasRemaining()) {
                if (channel.write(buffer) == 0) {
                    awaitReady(key, SelectionKey.OP_WRITE, deadline, request);
                }
            }
        } catch (IOException e) {
            LOGGER.warn("Unable to write to broker socket {}: {}", socketPath, e.getMessage());
            throw BrokerException.failed("Unable to write to broker socket " + socketPath, e);
        }
    }

    private byte[] read(SocketChannel channel, SelectionKey key, long deadline, Envelope request)
        throws BrokerException {
        ByteArrayOutputStream response = new ByteArrayOutputStream();
        ByteBuffer chunk = ByteBuffer.allocate(chunkSize);
        try {
            while (true) {
                awaitReady(key, SelectionKey.OP_READ, deadline, request);
                chunk.clear();
                int read = channel.read(chunk);
                if (read == -1) {
                    if (response.size() > 0) {
                        return response.toByteArray();
                    }
                    throw new BrokerException(FailureCode.FAILED,
                        "Broker closed the connection without a response to " + request.operation().wireName());
                }
                if (read == 0) {
                    continue;
                }
                response.write(chunk.array(), 0, read);
                if (read < chunkSize) {
                    return response.toByteArray();
                }
            }
        } catch (IOException e) {
            LOGGER.warn("Error reading from broker socket {}: {}", socketPath, e.getMessage());
            throw BrokerException.failed("Unable to read from broker socket " + socketPath, e);
        }
    }

    /**
     * Wait until the channel is ready for {@code ops}.
     * @throws BrokerException with {@code timeout} once the deadline has passed
     */
    private void awaitReady(SelectionKey key, int ops, long deadline, Envelope request)
        throws IOException, BrokerException {
        key.interestOps(ops);
        Selector selector = key.selector();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw timedOut(request);
            }
            long waitMillis = Math.max(1, TimeUnit.NANOSECONDS.toMillis(remaining + 999_999));
            if (selector.select(waitMillis) > 0) {
                selector.selectedKeys().clear();
                return;
            }
        }
    }

    private BrokerException timedOut(Envelope request) {
        LOGGER.warn("{} corr={} timed out after {}", request.operation().wireName(), request.correlationId(), timeout);
        return new BrokerException(FailureCode.TIMEOUT,
            request.operation().wireName() + " timed out after " + timeout.toMillis() + " ms");
    }
}
