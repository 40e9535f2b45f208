package dev.idbroker.session.relay;

import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.Envelope;

/**
 * Forwards one request to the privileged System Broker and returns its result.
 */
@FunctionalInterface
public interface BrokerRelay {

    /**
     * @throws BrokerException {@code timeout} when no answer arrives in time, {@code failed} when
     * the broker cannot be reached, or the failure reported by the broker itself
     */
    String forward(Envelope request) throws BrokerException;
}
