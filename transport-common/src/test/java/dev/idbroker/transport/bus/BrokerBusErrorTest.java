package dev.idbroker.transport.bus;

import static org.junit.jupiter.api.Assertions.*;

import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.FailureCode;
import org.junit.jupiter.api.Test;

class BrokerBusErrorTest {

    @Test
    void carriesFailureCodeAsBusErrorName() {
        BrokerBusError error = BrokerBusError.from(BrokerException.declined("uid 1000 may not do that"));

        assertEquals("org.freedesktop.DBus.Error.AccessDenied", error.getType());
        assertEquals("uid 1000 may not do that", error.getMessage());
        assertEquals(FailureCode.DECLINED, error.code());
    }

    @Test
    void timeoutKeepsItsCode() {
        BrokerBusError error = new BrokerBusError(FailureCode.TIMEOUT, "slow");

        assertEquals(FailureCode.TIMEOUT, FailureCode.fromErrorName(error.getType()));
    }
}
