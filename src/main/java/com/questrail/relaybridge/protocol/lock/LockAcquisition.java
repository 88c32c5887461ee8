package com.questrail.relaybridge.protocol.lock;

import java.nio.file.Path;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Outcome of {@link LockGuard#acquire()}.
 *
 * @param acquired whether this process now owns the lock
 * @param lockPath the lock file
 * @param ownerPid pid recorded in the lock file, when known
 */
public record LockAcquisition(
        boolean acquired,
        Path lockPath,
        OptionalLong ownerPid
) {
    public LockAcquisition {
        Objects.requireNonNull(lockPath, "lockPath");
        Objects.requireNonNull(ownerPid, "ownerPid");
    }

    static LockAcquisition acquired(Path lockPath, long selfPid) {
        return new LockAcquisition(true, lockPath, OptionalLong.of(selfPid));
    }

    static LockAcquisition heldBy(Path lockPath, OptionalLong ownerPid) {
        return new LockAcquisition(false, lockPath, ownerPid);
    }
}
