package dev.idbroker.transport.bus;

import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.FailureCode;
import org.freedesktop.dbus.exceptions.DBusExecutionException;

/**
 * Error reply sent back over the bus when a call is declined or fails. The bus error name is
 * taken from the {@link FailureCode}; the message is passed through unchanged.
 */
public class BrokerBusError extends DBusExecutionException {

    private static final long serialVersionUID = 1L;

    public BrokerBusError(FailureCode code, String message) {
        super(message);
        setType(code.errorName());
    }

    public static BrokerBusError from(BrokerException exception) {
        return new BrokerBusError(exception.code(), exception.getMessage());
    }

    public FailureCode code() {
        return FailureCode.fromErrorName(getType());
    }
}
