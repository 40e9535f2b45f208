package dev.idbroker.transport.bus;

import java.util.Optional;

/**
 * Supplies the unique bus name of the sender of the call being handled on the current thread.
 */
@FunctionalInterface
public interface CallerContext {

    Optional<String> currentSender();

    static CallerContext dbus() {
        return DbusEndpoint::currentSender;
    }
}
