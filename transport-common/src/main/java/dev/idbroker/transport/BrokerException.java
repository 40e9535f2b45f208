package dev.idbroker.transport;

import java.util.Objects;

/**
 * A declined or failed broker call. Implementations, credential resolvers and relays all report
 * per-call problems through this type; facades translate it into a bus error.
 */
public class BrokerException extends Exception {

    private static final long serialVersionUID = 1L;

    private final FailureCode code;

    public BrokerException(FailureCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public BrokerException(FailureCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public FailureCode code() {
        return code;
    }

    public static BrokerException declined(String message) {
        return new BrokerException(FailureCode.DECLINED, message);
    }

    public static BrokerException failed(String message, Throwable cause) {
        return new BrokerException(FailureCode.FAILED, message, cause);
    }
}
