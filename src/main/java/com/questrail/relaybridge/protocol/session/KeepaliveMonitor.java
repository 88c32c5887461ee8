package com.questrail.relaybridge.protocol.session;

import com.questrail.relaybridge.protocol.internal.time.Cancellable;
import com.questrail.relaybridge.protocol.internal.time.MonotonicClock;
import com.questrail.relaybridge.protocol.internal.time.MonotonicScheduler;
import com.questrail.relaybridge.protocol.transport.RelaySocket;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * KeepaliveMonitor
 * =============================================================================
 * Liveness check for one open relay socket.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Every {@code pingInterval}: send a WebSocket ping.</li>
 *   <li>A rolling deadline of {@code timeout} is pushed forward by
 *       {@link #touch()} (any inbound pong or text).</li>
 *   <li>When the deadline passes, {@code onExpired} runs once and the monitor
 *       stops. The session responds by terminating the socket.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * {@link #start()}, {@link #touch()} and {@link #stop()} are called on the
 * session executor. Timer callbacks hop onto the same executor, so no state
 * here is shared across threads.
 */
final class KeepaliveMonitor
{
    private final RelaySocket socket;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Executor sessionExecutor;
    private final Duration pingInterval;
    private final Duration timeout;
    private final Runnable onPing;
    private final Runnable onExpired;

    private boolean running;
    private Cancellable pingTimer;
    private Cancellable deadlineTimer;

    // A timer may fire after being re-armed; only the latest arming counts.
    private long deadlineGeneration;

    KeepaliveMonitor(RelaySocket socket,
                     MonotonicScheduler scheduler,
                     MonotonicClock clock,
                     Executor sessionExecutor,
                     Duration pingInterval,
                     Duration timeout,
                     Runnable onPing,
                     Runnable onExpired)
    {
        this.socket = Objects.requireNonNull(socket, "socket");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        this.pingInterval = Objects.requireNonNull(pingInterval, "pingInterval");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.onPing = Objects.requireNonNull(onPing, "onPing");
        this.onExpired = Objects.requireNonNull(onExpired, "onExpired");
    }

    void start()
    {
        if (running) {
            return;
        }
        running = true;
        armDeadline();
        armPing();
    }

    /**
     * Inbound traffic observed; push the deadline forward.
     */
    void touch()
    {
        if (running) {
            armDeadline();
        }
    }

    void stop()
    {
        running = false;
        cancel(pingTimer);
        cancel(deadlineTimer);
        pingTimer = null;
        deadlineTimer = null;
    }

    boolean isRunning()
    {
        return running;
    }

    private void armDeadline()
    {
        cancel(deadlineTimer);
        long generation = ++deadlineGeneration;
        deadlineTimer = scheduler.scheduleAfter(timeout, clock,
                () -> sessionExecutor.execute(() -> onDeadline(generation)));
    }

    private void armPing()
    {
        pingTimer = scheduler.scheduleAfter(pingInterval, clock,
                () -> sessionExecutor.execute(this::onPingDue));
    }

    private void onPingDue()
    {
        if (!running) {
            return;
        }
        if (socket.isOpen()) {
            socket.ping();
            onPing.run();
        }
        armPing();
    }

    private void onDeadline(long generation)
    {
        if (!running || generation != deadlineGeneration) {
            return;
        }
        stop();
        onExpired.run();
    }

    private static void cancel(Cancellable timer)
    {
        if (timer != null) {
            timer.cancel();
        }
    }
}
