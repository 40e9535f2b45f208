package dev.idbroker.transport;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Operations exposed by the system and session brokers. The wire name is used both as the JSON
 * key on the stream socket and as the bus member name.
 */
public enum Operation {

    ACQUIRE_TOKEN_INTERACTIVELY("acquireTokenInteractively"),
    ACQUIRE_TOKEN_SILENTLY("acquireTokenSilently"),
    GET_ACCOUNTS("getAccounts"),
    REMOVE_ACCOUNT("removeAccount"),
    ACQUIRE_PRT_SSO_COOKIE("acquirePrtSsoCookie"),
    GENERATE_SIGNED_HTTP_REQUEST("generateSignedHttpRequest"),
    CANCEL_INTERACTIVE_FLOW("cancelInteractiveFlow"),
    GET_LINUX_BROKER_VERSION("getLinuxBrokerVersion");

    private static final Map<String, Operation> BY_WIRE_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(Operation::wireName, Function.identity()));

    private final String wireName;

    Operation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Operation> fromWireName(String wireName) {
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }
}
