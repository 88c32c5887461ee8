package com.questrail.relaybridge.protocol.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.questrail.relaybridge.protocol.codec.RelayDecodeException;
import com.questrail.relaybridge.protocol.codec.RelayEnvelopeCodec;
import com.questrail.relaybridge.protocol.config.RelaySessionPolicy;
import com.questrail.relaybridge.protocol.internal.time.Cancellable;
import com.questrail.relaybridge.protocol.internal.time.MonotonicClock;
import com.questrail.relaybridge.protocol.internal.time.MonotonicScheduler;
import com.questrail.relaybridge.protocol.internal.time.WallClock;
import com.questrail.relaybridge.protocol.model.ControlEnvelope;
import com.questrail.relaybridge.protocol.model.RelayEnvelope;
import com.questrail.relaybridge.protocol.model.RequestEnvelope;
import com.questrail.relaybridge.protocol.model.ResponseEnvelope;
import com.questrail.relaybridge.protocol.observability.RelayErrorEvent;
import com.questrail.relaybridge.protocol.observability.RelayObservabilitySink;
import com.questrail.relaybridge.protocol.observability.RelaySessionEvent;
import com.questrail.relaybridge.protocol.session.RelaySessionException.Kind;
import com.questrail.relaybridge.protocol.transport.RelayConnector;
import com.questrail.relaybridge.protocol.transport.RelaySocket;
import com.questrail.relaybridge.protocol.transport.RelaySocketListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * CallerSession
 * =============================================================================
 * Client half of the relay protocol: joins a channel as a caller, writes
 * requests and correlates the executor's responses by id.
 *
 * <h2>Execution model</h2>
 * Every public operation, socket callback and timer callback is hopped onto
 * {@code sessionExecutor}. With a single-threaded executor (production) the
 * pending table and the active connection handle need no locks. Status fields
 * are volatile so {@link #status()} may be called from any thread.
 *
 * <h2>Connection handles</h2>
 * Each {@link #connect(URI, String)} creates a new {@link ConnectionHandle}
 * and supersedes the previous one. Callbacks capture their handle and do
 * nothing once it is no longer the active one, so a late close or message
 * from an old socket can never disturb the current connection.
 *
 * <h2>Failure semantics</h2>
 * <ul>
 *   <li>Admission failures ({@code NOT_CONNECTED}, {@code EXECUTOR_ABSENT},
 *       {@code TOO_MANY_PENDING}, {@code DUPLICATE_REQUEST_ID}) happen before
 *       anything is written.</li>
 *   <li>Teardown (socket close, executor disconnect, relay error, session close)
 *       rejects every pending request at once.</li>
 *   <li>No automatic retries. A request that may have reached the executor is
 *       never re-sent.</li>
 * </ul>
 */
public final class CallerSession implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(CallerSession.class);

    private final RelayConnector connector;
    private final Executor sessionExecutor;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final RelaySessionPolicy policy;
    private final RelayEnvelopeCodec codec;
    private final RelayObservabilitySink sink;

    private final PendingRequestTable pending = new PendingRequestTable();
    private final DebugEventLog debugLog;

    // Confined to sessionExecutor.
    private ConnectionHandle active;

    private volatile boolean closed;
    private volatile boolean connectedToRelay;
    private volatile boolean executorPresent;
    private volatile String channelId;
    private volatile URI relayAddress;
    private volatile String sessionTag;
    private volatile long connectAttempt;

    public CallerSession(RelayConnector connector,
                         Executor sessionExecutor,
                         MonotonicScheduler scheduler,
                         MonotonicClock clock,
                         WallClock wallClock,
                         RelaySessionPolicy policy,
                         RelayEnvelopeCodec codec,
                         RelayObservabilitySink sink)
    {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.debugLog = new DebugEventLog(policy.debugEventCapacity(), wallClock);
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Join {@code channelId} on the relay at {@code relayAddress} as a caller.
     *
     * <p>Completes when the channel reports an executor within the connect
     * window. Any previous connection is superseded and its pending requests
     * are rejected with {@link Kind#DISCONNECTED}.</p>
     */
    public CompletableFuture<Void> connect(URI relayAddress, String channelId)
    {
        Objects.requireNonNull(relayAddress, "relayAddress");

        CompletableFuture<Void> ready = new CompletableFuture<>();
        if (channelId == null || channelId.isBlank()) {
            ready.completeExceptionally(new RelaySessionException(Kind.INVALID_REQUEST, "Channel ID required"));
            return ready;
        }
        sessionExecutor.execute(() -> doConnect(relayAddress, channelId.trim(), ready));
        return ready;
    }

    /**
     * Send a request using the policy's default timeout.
     */
    public CompletableFuture<JsonNode> send(RequestEnvelope request)
    {
        return send(request, policy.requestTimeout());
    }

    /**
     * Send a request and await the executor's correlated response.
     *
     * <p>A request without an id is assigned a random UUID. The future
     * completes with the response's {@code result} (JSON null when absent),
     * or exceptionally with a {@link RelaySessionException}.</p>
     */
    public CompletableFuture<JsonNode> send(RequestEnvelope request, Duration timeout)
    {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }

        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        sessionExecutor.execute(() -> doSend(request, timeout, result));
        return result;
    }

    /**
     * Best-effort write with no response tracking. Skipped silently when not
     * connected or when the channel has no executor.
     */
    public void notify(RequestEnvelope request)
    {
        Objects.requireNonNull(request, "request");
        sessionExecutor.execute(() -> doNotify(request));
    }

    public SessionStatus status()
    {
        return new SessionStatus(
                connectedToRelay,
                executorPresent,
                channelId,
                relayAddress,
                pending.size(),
                sessionTag,
                connectAttempt);
    }

    public int pendingRequestCount()
    {
        return pending.size();
    }

    /**
     * {@code true} while a request with {@code requestId} awaits its response.
     */
    public boolean isPending(String requestId)
    {
        return pending.contains(requestId);
    }

    /**
     * Most recent diagnostic events, oldest first.
     */
    public List<SessionDebugEvent> debugEvents()
    {
        return debugLog.snapshot();
    }

    /**
     * Tear the session down: reject every pending request with
     * {@link Kind#SESSION_CLOSED}, stop keepalive and close the socket.
     * Further operations fail with {@code SESSION_CLOSED}.
     */
    @Override
    public void close()
    {
        if (closed) {
            return;
        }
        closed = true;
        sessionExecutor.execute(this::doClose);
    }

    // -------------------------------------------------------------------------
    // Connect
    // -------------------------------------------------------------------------

    private void doConnect(URI address, String channel, CompletableFuture<Void> ready)
    {
        if (closed) {
            ready.completeExceptionally(new RelaySessionException(Kind.SESSION_CLOSED, "Session is closed"));
            return;
        }

        ConnectionHandle previous = active;
        if (previous != null) {
            active = null;
            previous.dispose();
            previous.failReady(new RelaySessionException(Kind.DISCONNECTED,
                    "Connect to channel " + previous.channelId + " superseded by a new connect"));
            rejectAll(Kind.DISCONNECTED,
                    "Connection to channel " + previous.channelId + " replaced by a new connect");
            if (previous.socket != null) {
                previous.socket.close();
            }
        }

        connectedToRelay = false;
        executorPresent = false;
        sessionTag = null;
        channelId = channel;
        relayAddress = address;
        long attempt = ++connectAttempt;

        ConnectionHandle handle = new ConnectionHandle(attempt, channel, ready, clock.nowNanos());
        active = handle;

        URI target = RelayUris.forCaller(address, channel);
        emit(handle, RelaySessionEvent.Kind.CONNECTING, target.toString());
        debug("connect_start", handle.tag() + " url=" + target);

        handle.connectTimer = scheduler.scheduleAfter(policy.connectTimeout(), clock,
                () -> sessionExecutor.execute(() -> onConnectWindowExpired(handle)));

        try {
            handle.socket = connector.open(target, new HandleListener(handle));
        }
        catch (RuntimeException e) {
            active = null;
            handle.dispose();
            sink.onError(new RelayErrorEvent(wallClock.now(), "Failed to open relay socket to " + target, e));
            handle.failReady(new RelaySessionException(Kind.DISCONNECTED,
                    "Failed to open relay socket to " + target + ": " + e.getMessage(), e));
        }
    }

    private void onConnectWindowExpired(ConnectionHandle handle)
    {
        if (active != handle || handle.ready.isDone()) {
            return;
        }
        long elapsedMs = clock.millisSince(handle.startedNanos);
        emit(handle, RelaySessionEvent.Kind.EXECUTOR_ABSENT, "connect window expired after " + elapsedMs + "ms");
        debug("connect_timeout", handle.tag() + " elapsedMs=" + elapsedMs);
        handle.failReady(new RelaySessionException(Kind.CONNECT_TIMEOUT,
                "No executor joined channel " + handle.channelId + " within " + elapsedMs + "ms"));
    }

    // -------------------------------------------------------------------------
    // Send
    // -------------------------------------------------------------------------

    private void doSend(RequestEnvelope request, Duration timeout, CompletableFuture<JsonNode> result)
    {
        RelaySessionException rejection = admissionFailure();
        if (rejection != null) {
            result.completeExceptionally(rejection);
            return;
        }

        ConnectionHandle handle = active;
        String id = request.hasId() ? request.id() : UUID.randomUUID().toString();
        if (pending.contains(id)) {
            result.completeExceptionally(new RelaySessionException(Kind.DUPLICATE_REQUEST_ID,
                    "Request " + id + " is already pending on channel " + handle.channelId));
            return;
        }

        final String text;
        try {
            text = codec.encode(request.withId(id));
        }
        catch (RuntimeException e) {
            result.completeExceptionally(new RelaySessionException(Kind.INVALID_REQUEST,
                    "Request " + id + " could not be encoded", e));
            return;
        }

        PendingRequestTable.Entry entry = pending.register(id, handle.channelId, result, clock.nowNanos());
        entry.armDeadline(scheduler.scheduleAfter(timeout, clock,
                () -> sessionExecutor.execute(() -> onRequestDeadline(entry, timeout))));

        handle.socket.send(text).whenComplete((ignored, error) -> {
            if (error != null) {
                sessionExecutor.execute(() -> onWriteFailed(entry, error));
            }
        });
    }

    private void doNotify(RequestEnvelope request)
    {
        if (admissionFailure() != null) {
            log.debug("Skipping notification '{}': not connected to an executor", request.type());
            return;
        }
        active.socket.send(codec.encode(request)).whenComplete((ignored, error) -> {
            if (error != null) {
                log.debug("Notification '{}' was not written", request.type(), error);
            }
        });
    }

    private RelaySessionException admissionFailure()
    {
        if (closed) {
            return new RelaySessionException(Kind.SESSION_CLOSED, "Session is closed");
        }
        ConnectionHandle handle = active;
        if (handle == null || handle.socket == null || !handle.socket.isOpen() || !connectedToRelay) {
            return new RelaySessionException(Kind.NOT_CONNECTED, "Not connected to relay");
        }
        if (!executorPresent) {
            return new RelaySessionException(Kind.EXECUTOR_ABSENT,
                    "No executor connected to channel " + handle.channelId);
        }
        if (pending.size() >= policy.maxPendingRequests()) {
            return new RelaySessionException(Kind.TOO_MANY_PENDING,
                    "Too many pending requests (" + pending.size() + ") on channel " + handle.channelId);
        }
        return null;
    }

    private void onRequestDeadline(PendingRequestTable.Entry entry, Duration timeout)
    {
        if (!pending.remove(entry)) {
            return;
        }
        long ms = timeout.toMillis();
        String seconds = BigDecimal.valueOf(ms, 3).stripTrailingZeros().toPlainString();
        String message = "Request " + entry.id() + " timed out after " + ms + "ms (" + seconds + "s) on channel " + entry.channelId();

        emitCurrent(RelaySessionEvent.Kind.REQUEST_TIMED_OUT, message);
        entry.future().completeExceptionally(new RelaySessionException(Kind.TIMED_OUT, message));
    }

    private void onWriteFailed(PendingRequestTable.Entry entry, Throwable error)
    {
        if (!pending.remove(entry)) {
            return;
        }
        entry.future().completeExceptionally(new RelaySessionException(Kind.WRITE_FAILED,
                "Failed to write request " + entry.id() + " to channel " + entry.channelId(), error));
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    private void onText(ConnectionHandle handle, String text)
    {
        if (handle.keepalive != null) {
            handle.keepalive.touch();
        }

        final RelayEnvelope envelope;
        try {
            envelope = codec.decode(text);
        }
        catch (RelayDecodeException e) {
            log.debug("Dropping undecodable relay message on {}: {}", handle.tag(), e.getMessage());
            debug("decode_error", handle.tag() + " " + e.getMessage());
            return;
        }

        if (envelope instanceof ControlEnvelope control) {
            onControl(handle, control);
        }
        else if (envelope instanceof ResponseEnvelope response) {
            onResponse(handle, response);
        }
        else if (envelope instanceof RequestEnvelope request) {
            log.debug("Ignoring executor-originated request '{}' on {}", request.type(), handle.tag());
        }
    }

    private void onControl(ConnectionHandle handle, ControlEnvelope control)
    {
        debug("system_event", handle.tag() + " event=" + control.event().wireName()
                + " present=" + (control.executorPresent() == null ? "-" : control.executorPresent()));

        switch (control.event()) {
            case CONNECTED -> {
                sessionTag = control.sessionTag().orElse(null);
                if (Boolean.TRUE.equals(control.executorPresent())) {
                    markExecutorPresent(handle);
                }
                else if (Boolean.FALSE.equals(control.executorPresent())) {
                    executorPresent = false;
                    emit(handle, RelaySessionEvent.Kind.EXECUTOR_ABSENT, "waiting for executor");
                }
            }
            case EXECUTOR_CONNECTED -> {
                sessionTag = control.sessionTag().orElse(null);
                markExecutorPresent(handle);
            }
            case EXECUTOR_DISCONNECTED -> {
                if (isStale(handle, control)) {
                    return;
                }
                executorPresent = false;
                sessionTag = null;
                emit(handle, RelaySessionEvent.Kind.EXECUTOR_ABSENT, "executor disconnected");
                rejectAll(Kind.EXECUTOR_DISCONNECTED, "Executor disconnected from channel " + handle.channelId);
            }
            case ERROR -> {
                if (isStale(handle, control)) {
                    return;
                }
                String error = control.error() == null ? "Relay server error" : control.error();
                emit(handle, RelaySessionEvent.Kind.RELAY_ERROR, error);
                if (!executorPresent) {
                    handle.failReady(new RelaySessionException(Kind.RELAY_ERROR, error));
                }
                rejectAll(Kind.RELAY_ERROR, error);
            }
        }
    }

    private void onResponse(ConnectionHandle handle, ResponseEnvelope response)
    {
        if (isStale(handle, response)) {
            return;
        }
        if (response.id() == null) {
            log.debug("Dropping response without id on {}", handle.tag());
            return;
        }

        PendingRequestTable.Entry entry = pending.remove(response.id());
        if (entry == null) {
            log.debug("Dropping response for unknown request {} on {}", response.id(), handle.tag());
            return;
        }

        if (response.isError()) {
            entry.future().completeExceptionally(new RelaySessionException(Kind.REMOTE_ERROR, response.error()));
        }
        else {
            entry.future().complete(response.result() == null ? NullNode.getInstance() : response.result());
        }
    }

    private boolean isStale(ConnectionHandle handle, RelayEnvelope envelope)
    {
        if (SessionTagFilter.accepts(sessionTag, envelope.sessionTag())) {
            return false;
        }
        String detail = "recorded=" + sessionTag + " incoming=" + envelope.sessionTag().orElse("");
        emit(handle, RelaySessionEvent.Kind.STALE_ENVELOPE_DROPPED, detail);
        debug("stale_session_drop", handle.tag() + " " + detail);
        return true;
    }

    private void markExecutorPresent(ConnectionHandle handle)
    {
        executorPresent = true;
        emit(handle, RelaySessionEvent.Kind.EXECUTOR_PRESENT, sessionTag == null ? "" : "session=" + sessionTag);
        handle.completeReady();
    }

    // -------------------------------------------------------------------------
    // Socket lifecycle
    // -------------------------------------------------------------------------

    private void onOpen(ConnectionHandle handle)
    {
        connectedToRelay = true;
        emit(handle, RelaySessionEvent.Kind.SOCKET_OPEN, "channel=" + handle.channelId);
        debug("socket_open", handle.tag() + " channel=" + handle.channelId);

        handle.keepalive = new KeepaliveMonitor(
                handle.socket,
                scheduler,
                clock,
                sessionExecutor,
                policy.pingInterval(),
                policy.keepaliveTimeout(),
                () -> debug("keepalive_ping", handle.tag()),
                () -> onKeepaliveExpired(handle));
        handle.keepalive.start();
    }

    private void onPong(ConnectionHandle handle)
    {
        debug("keepalive_pong", handle.tag());
        if (handle.keepalive != null) {
            handle.keepalive.touch();
        }
    }

    private void onKeepaliveExpired(ConnectionHandle handle)
    {
        if (active != handle) {
            return;
        }
        emit(handle, RelaySessionEvent.Kind.KEEPALIVE_TIMEOUT,
                "no traffic for " + policy.keepaliveTimeout().toMillis() + "ms");
        debug("keepalive_timeout", handle.tag());
        handle.socket.terminate();
    }

    private void onClose(ConnectionHandle handle, int code, String reason)
    {
        active = null;
        handle.dispose();
        connectedToRelay = false;
        executorPresent = false;

        String detail = "code=" + code + (reason == null || reason.isEmpty() ? "" : " reason=" + reason);
        emit(handle, RelaySessionEvent.Kind.SOCKET_CLOSED, detail);
        debug("socket_close", handle.tag() + " " + detail);

        handle.failReady(new RelaySessionException(Kind.DISCONNECTED,
                "Disconnected from relay before an executor joined channel " + handle.channelId + " (" + detail + ")"));
        rejectAll(Kind.DISCONNECTED, "Disconnected from relay on channel " + handle.channelId + " (" + detail + ")");
    }

    private void onError(ConnectionHandle handle, Throwable cause)
    {
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        emit(handle, RelaySessionEvent.Kind.SOCKET_ERROR, message);
        debug("socket_error", handle.tag() + " err=" + message);
        handle.failReady(new RelaySessionException(Kind.DISCONNECTED,
                "Relay socket error on channel " + handle.channelId + ": " + message, cause));
    }

    private void doClose()
    {
        ConnectionHandle handle = active;
        active = null;
        connectedToRelay = false;
        executorPresent = false;

        if (handle != null) {
            handle.dispose();
            handle.failReady(new RelaySessionException(Kind.SESSION_CLOSED, "Session closed"));
            if (handle.socket != null) {
                handle.socket.close();
            }
            emit(handle, RelaySessionEvent.Kind.SESSION_CLOSED, "");
        }
        rejectAll(Kind.SESSION_CLOSED, "Session closed");
        debug("session_closed", "");
    }

    private void rejectAll(Kind kind, String message)
    {
        for (PendingRequestTable.Entry entry : pending.drain()) {
            entry.future().completeExceptionally(new RelaySessionException(kind, message));
        }
    }

    // -------------------------------------------------------------------------
    // Observability
    // -------------------------------------------------------------------------

    private void emit(ConnectionHandle handle, RelaySessionEvent.Kind kind, String detail)
    {
        sink.onSessionEvent(new RelaySessionEvent(wallClock.now(), handle.channelId, handle.attempt, kind, detail));
    }

    private void emitCurrent(RelaySessionEvent.Kind kind, String detail)
    {
        sink.onSessionEvent(new RelaySessionEvent(wallClock.now(), channelId, connectAttempt, kind, detail));
    }

    private void debug(String event, String detail)
    {
        debugLog.record(event, detail);
    }

    // -------------------------------------------------------------------------
    // Connection handle
    // -------------------------------------------------------------------------

    /**
     * State owned by one {@code connect} call. Confined to the session executor.
     */
    private static final class ConnectionHandle
    {
        final long attempt;
        final String channelId;
        final CompletableFuture<Void> ready;
        final long startedNanos;

        RelaySocket socket;
        Cancellable connectTimer;
        KeepaliveMonitor keepalive;

        ConnectionHandle(long attempt, String channelId, CompletableFuture<Void> ready, long startedNanos)
        {
            this.attempt = attempt;
            this.channelId = channelId;
            this.ready = ready;
            this.startedNanos = startedNanos;
        }

        String tag()
        {
            return "connect#" + attempt;
        }

        void completeReady()
        {
            cancelConnectTimer();
            ready.complete(null);
        }

        void failReady(RelaySessionException error)
        {
            cancelConnectTimer();
            ready.completeExceptionally(error);
        }

        void dispose()
        {
            cancelConnectTimer();
            if (keepalive != null) {
                keepalive.stop();
            }
        }

        private void cancelConnectTimer()
        {
            if (connectTimer != null) {
                connectTimer.cancel();
                connectTimer = null;
            }
        }
    }

    /**
     * Hops socket callbacks onto the session executor and drops any that
     * belong to a superseded handle.
     */
    private final class HandleListener implements RelaySocketListener
    {
        private final ConnectionHandle handle;

        HandleListener(ConnectionHandle handle)
        {
            this.handle = handle;
        }

        @Override
        public void onOpen()
        {
            whenActive(() -> CallerSession.this.onOpen(handle));
        }

        @Override
        public void onText(String text)
        {
            whenActive(() -> CallerSession.this.onText(handle, text));
        }

        /**
         * Envelopes are JSON whichever frame type carried them.
         */
        @Override
        public void onBinary(byte[] payload)
        {
            String text = new String(payload, StandardCharsets.UTF_8);
            whenActive(() -> CallerSession.this.onText(handle, text));
        }

        @Override
        public void onPong()
        {
            whenActive(() -> CallerSession.this.onPong(handle));
        }

        @Override
        public void onClose(int code, String reason)
        {
            whenActive(() -> CallerSession.this.onClose(handle, code, reason));
        }

        @Override
        public void onError(Throwable cause)
        {
            whenActive(() -> CallerSession.this.onError(handle, cause));
        }

        private void whenActive(Runnable action)
        {
            sessionExecutor.execute(() -> {
                if (active == handle) {
                    action.run();
                }
            });
        }
    }
}
