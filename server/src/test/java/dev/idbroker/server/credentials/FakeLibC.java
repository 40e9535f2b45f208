package dev.idbroker.server.credentials;

import java.util.ArrayList;
import java.util.List;
import jnr.ffi.Pointer;
import jnr.ffi.byref.PointerByReference;

/**
 * Records umask changes and knows no passwd entries. Passwd lookups answer with the scripted
 * errno values first, then report "not found".
 */
public class FakeLibC implements LibC {

    private final List<Integer> umaskCalls = new ArrayList<>();
    private final List<Long> lookupBufferSizes = new ArrayList<>();
    private final List<Integer> lookupErrors = new ArrayList<>();
    private int currentMask;

    public FakeLibC(int initialMask) {
        this.currentMask = initialMask;
    }

    @Override
    public synchronized int umask(int mask) {
        umaskCalls.add(mask);
        int previous = currentMask;
        currentMask = mask;
        return previous;
    }

    @Override
    public synchronized int getpwnam_r(String name, Pointer pwd, Pointer buf, long buflen,
        PointerByReference result) {
        lookupBufferSizes.add(buflen);
        return lookupErrors.isEmpty() ? 0 : lookupErrors.remove(0);
    }

    public synchronized FakeLibC failLookupWith(int... errors) {
        for (int error : errors) {
            lookupErrors.add(error);
        }
        return this;
    }

    public synchronized List<Long> lookupBufferSizes() {
        return List.copyOf(lookupBufferSizes);
    }

    public synchronized List<Integer> umaskCalls() {
        return List.copyOf(umaskCalls);
    }

    public synchronized int currentMask() {
        return currentMask;
    }
}
