package dev.idbroker.transport;

import java.util.Arrays;

/**
 * Short failure codes shared by every hop, each paired with the bus error name used when the
 * failure crosses a bus boundary.
 */
public enum FailureCode {

    DECLINED("declined", "org.freedesktop.DBus.Error.AccessDenied"),
    FAILED("failed", "org.freedesktop.DBus.Error.Failed"),
    TIMEOUT("timeout", "org.freedesktop.DBus.Error.Timeout"),
    NOT_SUPPORTED("not_supported", "org.freedesktop.DBus.Error.NotSupported");

    private static final String NO_REPLY = "NoReply";

    private final String code;
    private final String errorName;

    FailureCode(String code, String errorName) {
        this.code = code;
        this.errorName = errorName;
    }

    public String code() {
        return code;
    }

    public String errorName() {
        return errorName;
    }

    /**
     * Map a bus error name back to a failure code. Only the last name segment is compared, so
     * both {@code org.freedesktop.DBus.Error.AccessDenied} and the bus library's
     * {@code org.freedesktop.dbus.errors.AccessDenied} match. Names outside the vocabulary
     * collapse to {@link #FAILED}.
     */
    public static FailureCode fromErrorName(String errorName) {
        if (errorName == null) {
            return FAILED;
        }
        String simpleName = simpleName(errorName);
        if (NO_REPLY.equals(simpleName)) {
            return TIMEOUT;
        }
        return Arrays.stream(values())
            .filter(candidate -> simpleName(candidate.errorName).equals(simpleName))
            .findFirst()
            .orElse(FAILED);
    }

    private static String simpleName(String errorName) {
        int separator = Math.max(errorName.lastIndexOf('.'), errorName.lastIndexOf('$'));
        return errorName.substring(separator + 1);
    }
}
