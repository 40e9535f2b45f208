package dev.idbroker.server.credentials;

import dev.idbroker.transport.BrokerException;
import dev.idbroker.transport.FailureCode;
import java.io.IOException;
import java.nio.channels.SocketChannel;
import java.util.OptionalLong;
import jdk.net.ExtendedSocketOptions;
import jdk.net.UnixDomainPrincipal;
import jnr.ffi.Memory;
import jnr.ffi.Pointer;
import jnr.ffi.Runtime;
import jnr.ffi.byref.PointerByReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the uid of the process on the other end of an accepted UNIX socket from the
 * kernel-supplied peer credentials ({@code SO_PEERCRED}).
 *
 * <p>The JDK reports the peer as a user principal whose name the kernel uid was mapped to (or the
 * decimal uid when no passwd entry exists). The name is mapped back to the numeric uid through
 * the reentrant {@code getpwnam_r} into buffers owned by the call, so lookups may run on any
 * thread.
 */
public class PeerCredentialResolver implements CredentialResolver<SocketChannel> {

    private static final Logger LOGGER = LoggerFactory.getLogger(PeerCredentialResolver.class);

    private static final int PASSWD_SIZE = 128;
    private static final int INITIAL_BUFFER = 1024;
    private static final int MAX_BUFFER = 1 << 20;

    private final LibC libc;

    public PeerCredentialResolver(LibC libc) {
        this.libc = libc;
    }

    @Override
    public long resolve(SocketChannel channel) throws BrokerException {
        UnixDomainPrincipal principal;
        try {
            principal = channel.getOption(ExtendedSocketOptions.SO_PEERCRED);
        } catch (IOException | UnsupportedOperationException e) {
            LOGGER.error("Unable to verify peer credentials", e);
            throw new BrokerException(FailureCode.DECLINED,
                "Unable to verify peer credentials", e);
        }
        if (principal == null || principal.user() == null) {
            throw BrokerException.declined("Peer credentials are not available");
        }
        return uidForName(principal.user().getName());
    }

    long uidForName(String userName) throws BrokerException {
        if (userName == null || userName.isEmpty()) {
            throw BrokerException.declined("Peer has no user identity");
        }
        OptionalLong uid = lookupUid(userName);
        if (uid.isPresent()) {
            return uid.getAsLong();
        }
        if (userName.chars().allMatch(Character::isDigit)) {
            try {
                return Long.parseLong(userName);
            } catch (NumberFormatException e) {
                throw BrokerException.declined("Peer uid out of range: " + userName);
            }
        }
        throw BrokerException.declined("Unknown peer user " + userName);
    }

    private OptionalLong lookupUid(String userName) throws BrokerException {
        Runtime runtime = Runtime.getSystemRuntime();
        Pointer passwd = Memory.allocateDirect(runtime, PASSWD_SIZE);
        for (int bufferSize = INITIAL_BUFFER; bufferSize <= MAX_BUFFER; bufferSize *= 2) {
            Pointer buffer = Memory.allocateDirect(runtime, bufferSize);
            PointerByReference result = new PointerByReference();
            int error = libc.getpwnam_r(userName, passwd, buffer, bufferSize, result);
            if (error == LibC.ERANGE) {
                continue;
            }
            if (error != 0) {
                throw BrokerException.declined("passwd lookup for " + userName + " failed with errno " + error);
            }
            if (result.getValue() == null) {
                return OptionalLong.empty();
            }
            // struct passwd { char *pw_name; char *pw_passwd; uid_t pw_uid; ... }
            long uidOffset = 2L * runtime.addressSize();
            return OptionalLong.of(Integer.toUnsignedLong(passwd.getInt(uidOffset)));
        }
        throw BrokerException.declined("passwd entry for " + userName + " is too large");
    }
}
