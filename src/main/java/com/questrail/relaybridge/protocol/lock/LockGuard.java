package com.questrail.relaybridge.protocol.lock;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.relaybridge.protocol.codec.Jsons;
import com.questrail.relaybridge.protocol.internal.time.SystemWallClock;
import com.questrail.relaybridge.protocol.internal.time.WallClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * LockGuard
 * =============================================================================
 * Cross-process mutex ensuring at most one relay broker per bind host:port.
 *
 * <h2>Lock file</h2>
 * {@code <dir>/relay-bridge-<sanitised host>-<port>.lock.json} holding a
 * {@link LockRecord}. Characters outside {@code [A-Za-z0-9_.-]} in the host
 * become {@code _}.
 *
 * <h2>Acquire</h2>
 * <pre>
 *   create exclusively                    → acquired
 *   exists, owner alive                   → not acquired (owner pid)
 *   exists, owner dead or record garbled  → delete, create once more
 *   second create collides                → not acquired (new owner pid)
 * </pre>
 *
 * <h2>Release</h2>
 * Only the instance that created the file removes it, and only while the file
 * still names this process. A record rewritten by a later owner is left alone.
 *
 * <p>I/O errors other than "already exists" propagate as
 * {@link UncheckedIOException}.</p>
 */
public final class LockGuard
{
    private static final Logger log = LoggerFactory.getLogger(LockGuard.class);

    private final String host;
    private final int port;
    private final Path lockPath;
    private final long selfPid;
    private final ProcessLiveness liveness;
    private final WallClock wallClock;
    private final ObjectMapper mapper = Jsons.mapper();

    private boolean ownsLock;

    /**
     * Lock in the system temp directory for the current process.
     */
    public LockGuard(String host, int port)
    {
        this(host, port, Paths.get(System.getProperty("java.io.tmpdir")),
                ProcessHandle.current().pid(), ProcessLiveness.system(), SystemWallClock.INSTANCE);
    }

    public LockGuard(String host,
                     int port,
                     Path directory,
                     long selfPid,
                     ProcessLiveness liveness,
                     WallClock wallClock)
    {
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
        this.selfPid = selfPid;
        this.liveness = Objects.requireNonNull(liveness, "liveness");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.lockPath = Objects.requireNonNull(directory, "directory").resolve(fileName(host, port));
    }

    public static String fileName(String host, int port)
    {
        return "relay-bridge-" + host.replaceAll("[^a-zA-Z0-9_.-]", "_") + "-" + port + ".lock.json";
    }

    public Path lockPath()
    {
        return lockPath;
    }

    public synchronized boolean ownsLock()
    {
        return ownsLock;
    }

    public synchronized LockAcquisition acquire()
    {
        if (ownsLock) {
            return LockAcquisition.acquired(lockPath, selfPid);
        }

        if (tryCreate()) {
            return LockAcquisition.acquired(lockPath, selfPid);
        }

        OptionalLong existing = readOwnerPid();
        if (existing.isPresent() && liveness.isAlive(existing.getAsLong())) {
            log.info("Relay lock {} held by live process {}", lockPath, existing.getAsLong());
            return LockAcquisition.heldBy(lockPath, existing);
        }

        log.warn("Reclaiming stale relay lock {} (owner {})", lockPath,
                existing.isPresent() ? String.valueOf(existing.getAsLong()) : "unreadable");
        try {
            Files.deleteIfExists(lockPath);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to remove stale lock " + lockPath, e);
        }

        if (tryCreate()) {
            return LockAcquisition.acquired(lockPath, selfPid);
        }
        return LockAcquisition.heldBy(lockPath, readOwnerPid());
    }

    public synchronized void release()
    {
        if (!ownsLock) {
            return;
        }
        ownsLock = false;

        OptionalLong owner = readOwnerPid();
        if (owner.isEmpty() || owner.getAsLong() != selfPid) {
            log.warn("Relay lock {} no longer names pid {}; leaving it in place", lockPath, selfPid);
            return;
        }
        try {
            Files.deleteIfExists(lockPath);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to release lock " + lockPath, e);
        }
    }

    private boolean tryCreate()
    {
        LockRecord record = new LockRecord(selfPid, host, port, wallClock.now().toString());
        byte[] bytes = Jsons.toPrettyJson(record).getBytes(StandardCharsets.UTF_8);
        try {
            Files.write(lockPath, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        }
        catch (FileAlreadyExistsException e) {
            return false;
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to create lock " + lockPath, e);
        }
        ownsLock = true;
        log.debug("Acquired relay lock {}", lockPath);
        return true;
    }

    /**
     * Owner pid from the lock file; empty when the file is missing or its
     * content is not a lock record.
     */
    private OptionalLong readOwnerPid()
    {
        final byte[] bytes;
        try {
            bytes = Files.readAllBytes(lockPath);
        }
        catch (NoSuchFileException e) {
            return OptionalLong.empty();
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to read lock " + lockPath, e);
        }

        try {
            LockRecord record = mapper.readValue(bytes, LockRecord.class);
            return record.pid() > 0 ? OptionalLong.of(record.pid()) : OptionalLong.empty();
        }
        catch (IOException e) {
            log.debug("Lock {} does not hold a readable record: {}", lockPath, e.getMessage());
            return OptionalLong.empty();
        }
    }
}
