package dev.idbroker.server.bus;

import static org.junit.jupiter.api.Assertions.*;

import dev.idbroker.server.broker.BrokerDispatcher;
import dev.idbroker.server.broker.IdentityBroker;
import dev.idbroker.server.credentials.BusSenderCredentialResolver;
import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.FailureCode;
import dev.idbroker.transport.bus.BrokerBusError;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SystemBrokerFacadeTest {

    private final List<Long> uids = new ArrayList<>();
    private FakeBusEndpoint bus;
    private String sender;
    private SystemBrokerFacade facade;

    @BeforeEach
    void setUp() {
        bus = new FakeBusEndpoint();
        bus.uids.put(":1.7", 1000L);
        bus.uids.put(":1.8", 1001L);
        IdentityBroker broker = new IdentityBroker() {
            @Override
            public String acquireTokenSilently(String pv, String cid, String json, long uid) {
                uids.add(uid);
                return "{\"token\":\"abc\"}";
            }

            @Override
            public String removeAccount(String pv, String cid, String json, long uid) throws BrokerException {
                throw BrokerException.declined("not your account");
            }

            @Override
            public String getAccounts(String pv, String cid, String json, long uid) {
                throw new IllegalStateException("store unavailable");
            }
        };
        facade = new SystemBrokerFacade("/org/samba/himmelblau", new BrokerDispatcher(broker),
            new BusSenderCredentialResolver(bus), () -> Optional.ofNullable(sender));
    }

    @Test
    void resolvesSenderUidOnEveryCall() {
        sender = ":1.7";
        assertEquals("{\"token\":\"abc\"}", facade.acquireTokenSilently("0.1", "c1", "{}"));
        sender = ":1.8";
        assertEquals("{\"token\":\"abc\"}", facade.acquireTokenSilently("0.1", "c2", "{}"));

        assertEquals(List.of(1000L, 1001L), uids);
        assertEquals(2, bus.uidLookups);
    }

    @Test
    void unknownSenderIsDeclinedBeforeDispatch() {
        sender = ":1.99";

        BrokerBusError error = assertThrows(BrokerBusError.class,
            () -> facade.acquireTokenSilently("0.1", "c", "{}"));

        assertEquals(FailureCode.DECLINED, error.code());
        assertTrue(uids.isEmpty());
    }

    @Test
    void missingSenderIsDeclined() {
        sender = null;

        BrokerBusError error = assertThrows(BrokerBusError.class,
            () -> facade.acquireTokenSilently("0.1", "c", "{}"));

        assertEquals(FailureCode.DECLINED, error.code());
        assertEquals(0, bus.uidLookups);
    }

    @Test
    void brokerFailuresBecomeTypedBusErrors() {
        sender = ":1.7";

        BrokerBusError declined = assertThrows(BrokerBusError.class, () -> facade.removeAccount("0.1", "c", "{}"));
        assertEquals("org.freedesktop.DBus.Error.AccessDenied", declined.getType());
        assertEquals("not your account", declined.getMessage());

        BrokerBusError crashed = assertThrows(BrokerBusError.class, () -> facade.getAccounts("0.1", "c", "{}"));
        assertEquals(FailureCode.FAILED, crashed.code());

        BrokerBusError unsupported = assertThrows(BrokerBusError.class,
            () -> facade.getLinuxBrokerVersion("0.1", "c", "{}"));
        assertEquals(FailureCode.NOT_SUPPORTED, unsupported.code());
    }

    @Test
    void reportsExportPath() {
        assertEquals("/org/samba/himmelblau", facade.getObjectPath());
    }
}
