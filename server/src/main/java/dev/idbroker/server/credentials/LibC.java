package dev.idbroker.server.credentials;

import jnr.ffi.LibraryLoader;
import jnr.ffi.Pointer;
import jnr.ffi.byref.PointerByReference;
import jnr.ffi.types.size_t;

/**
 * JNR-FFI bindings for the few libc calls the daemon needs.
 */
public interface LibC {

    LibC INSTANCE = loadInstance();

    int ERANGE = 34;

    private static LibC loadInstance() {
        return LibraryLoader.create(LibC.class).load("c");
    }

    /**
     * Sets the process file creation mask.
     *
     * @return the previous mask
     */
    int umask(int mask);

    /**
     * Reentrant passwd lookup by user name. {@code result} is left pointing at {@code pwd} when an
     * entry exists and at {@code NULL} otherwise.
     *
     * @return 0 on success (found or not), otherwise an errno value such as {@link #ERANGE}
     */
    int getpwnam_r(String name, Pointer pwd, Pointer buf, @size_t long buflen, PointerByReference result);
}
