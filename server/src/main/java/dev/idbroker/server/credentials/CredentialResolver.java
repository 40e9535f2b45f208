package dev.idbroker.server.credentials;

import dev.idbroker.transport.BrokerException;

/**
 * Maps the transport-specific identity of a caller to its numeric OS user id.
 *
 * @param <T> what the transport knows about the caller
 */
@FunctionalInterface
public interface CredentialResolver<T> {

    /**
     * @return the caller's uid
     * @throws BrokerException with {@code declined} when the identity cannot be established; a
     * missing identity never resolves to a default uid
     */
    long resolve(T source) throws BrokerException;
}
