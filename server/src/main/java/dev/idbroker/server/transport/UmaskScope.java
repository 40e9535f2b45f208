package dev.idbroker.server.transport;

import dev.idbroker.server.credentials.LibC;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Temporarily replaces the process file creation mask and restores it on close. The mask is
 * process-global, so scopes are serialized and may not be nested on the same thread.
 */
final class UmaskScope implements AutoCloseable {

    private static final ReentrantLock LOCK = new ReentrantLock();

    private final LibC libc;
    private final int previous;

    private UmaskScope(LibC libc, int previous) {
        this.libc = libc;
        this.previous = previous;
    }

    static UmaskScope apply(LibC libc, int mask) {
        if (LOCK.isHeldByCurrentThread()) {
            throw new IllegalStateException("umask scope is not reentrant");
        }
        LOCK.lock();
        try {
            return new UmaskScope(libc, libc.umask(mask));
        } catch (RuntimeException e) {
            LOCK.unlock();
            throw e;
        }
    }

    @Override
    public void close() {
        try {
            libc.umask(previous);
        } finally {
            LOCK.unlock();
        }
    }
}
