package dev.idbroker.server.transport;

import static org.junit.jupiter.api.Assertions.*;

import dev.idbroker.server.credentials.FakeLibC;
import java.util.List;
import org.junit.jupiter.api.Test;

class UmaskScopeTest {

    @Test
    void restoresPreviousMaskOnClose() {
        FakeLibC libc = new FakeLibC(0077);

        try (UmaskScope ignored = UmaskScope.apply(libc, 0)) {
            assertEquals(0, libc.currentMask());
        }

        assertEquals(0077, libc.currentMask());
        assertEquals(List.of(0, 0077), libc.umaskCalls());
    }

    @Test
    void restoresMaskWhenBodyFails() {
        FakeLibC libc = new FakeLibC(0022);

        assertThrows(IllegalStateException.class, () -> {
            try (UmaskScope ignored = UmaskScope.apply(libc, 0)) {
                throw new IllegalStateException("bind failed");
            }
        });

        assertEquals(0022, libc.currentMask());
    }

    @Test
    void cannotBeNested() {
        FakeLibC libc = new FakeLibC(0022);

        try (UmaskScope ignored = UmaskScope.apply(libc, 0)) {
            assertThrows(IllegalStateException.class, () -> UmaskScope.apply(libc, 0077));
        }

        assertEquals(0022, libc.currentMask());
    }
}
