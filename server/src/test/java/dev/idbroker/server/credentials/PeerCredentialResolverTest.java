package dev.idbroker.server.credentials;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.security.auth.module.UnixSystem;
import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.FailureCode;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

class PeerCredentialResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void numericNameWithoutPasswdEntryIsTheUid() throws Exception {
        PeerCredentialResolver resolver = new PeerCredentialResolver(new FakeLibC(0022));

        assertEquals(1234L, resolver.uidForName("1234"));
        assertEquals(4294967294L, resolver.uidForName("4294967294"));
    }

    @Test
    void unknownUserIsDeclined() {
        PeerCredentialResolver resolver = new PeerCredentialResolver(new FakeLibC(0022));

        BrokerException error = assertThrows(BrokerException.class, () -> resolver.uidForName("mallory"));
        assertEquals(FailureCode.DECLINED, error.code());
    }

    @Test
    void emptyUserIsDeclined() {
        PeerCredentialResolver resolver = new PeerCredentialResolver(new FakeLibC(0022));

        assertThrows(BrokerException.class, () -> resolver.uidForName(""));
        assertThrows(BrokerException.class, () -> resolver.uidForName(null));
    }

    @Test
    void lookupRetriesWithLargerBufferOnRange() throws Exception {
        FakeLibC libc = new FakeLibC(0022).failLookupWith(LibC.ERANGE, LibC.ERANGE);
        PeerCredentialResolver resolver = new PeerCredentialResolver(libc);

        assertEquals(1000L, resolver.uidForName("1000"));
        assertEquals(List.of(1024L, 2048L, 4096L), libc.lookupBufferSizes());
    }

    @Test
    void lookupErrorIsDeclined() {
        FakeLibC libc = new FakeLibC(0022).failLookupWith(5);
        PeerCredentialResolver resolver = new PeerCredentialResolver(libc);

        BrokerException error = assertThrows(BrokerException.class, () -> resolver.uidForName("1000"));
        assertEquals(FailureCode.DECLINED, error.code());
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    void concurrentLookupsEachSeeTheirOwnEntry() throws Exception {
        PeerCredentialResolver resolver = new PeerCredentialResolver(LibC.INSTANCE);
        long selfUid = new UnixSystem().getUid();
        String self = Long.toString(selfUid);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Long>> results = new ArrayList<>();
            for (int i = 0; i < 400; i++) {
                String name = i % 2 == 0 ? "root" : self;
                results.add(pool.submit(() -> resolver.uidForName(name)));
            }
            for (int i = 0; i < results.size(); i++) {
                long expected = i % 2 == 0 ? 0L : selfUid;
                assertEquals(expected, results.get(i).get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    void resolvesUidOfConnectedPeer() throws Exception {
        Path socketPath = tempDir.resolve("peer_sock");
        PeerCredentialResolver resolver = new PeerCredentialResolver(LibC.INSTANCE);

        try (ServerSocketChannel server = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
            server.bind(UnixDomainSocketAddress.of(socketPath));
            try (SocketChannel client = SocketChannel.open(StandardProtocolFamily.UNIX)) {
                client.connect(UnixDomainSocketAddress.of(socketPath));
                try (SocketChannel accepted = server.accept()) {
                    assertEquals(new UnixSystem().getUid(), resolver.resolve(accepted));
                }
            }
        }
    }
}
