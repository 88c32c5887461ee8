package com.questrail.relaybridge.protocol.lock;

/**
 * Answers whether a process id names a running process.
 */
@FunctionalInterface
public interface ProcessLiveness
{
    boolean isAlive(long pid);

    /**
     * Probe backed by {@link ProcessHandle}. A pid the OS does not know is dead.
     */
    static ProcessLiveness system()
    {
        return pid -> ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }
}
