package dev.idbroker.transport;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Growable accumulation buffer for bytes received on one connection. Not thread-safe; each
 * connection handler owns its own instance.
 */
public final class InboundBuffer {

    private static final int INITIAL_CAPACITY = 1024;

    private byte[] data = new byte[INITIAL_CAPACITY];
    private int length;

    public void append(ByteBuffer source) {
        int incoming = source.remaining();
        ensureCapacity(length + incoming);
        source.get(data, length, incoming);
        length += incoming;
    }

    public void append(byte[] bytes, int offset, int count) {
        ensureCapacity(length + count);
        System.arraycopy(bytes, offset, data, length, count);
        length += count;
    }

    byte[] array() {
        return data;
    }

    public int length() {
        return length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public void clear() {
        length = 0;
    }

    private void ensureCapacity(int required) {
        if (required > data.length) {
            data = Arrays.copyOf(data, Math.max(required, data.length * 2));
        }
    }
}
