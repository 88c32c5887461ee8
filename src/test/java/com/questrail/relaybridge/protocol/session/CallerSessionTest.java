package com.questrail.relaybridge.protocol.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.relaybridge.protocol.codec.Jsons;
import com.questrail.relaybridge.protocol.codec.RelayEnvelopeCodec;
import com.questrail.relaybridge.protocol.config.RelaySessionPolicy;
import com.questrail.relaybridge.protocol.model.RequestEnvelope;
import com.questrail.relaybridge.protocol.observability.RecordingObservabilitySink;
import com.questrail.relaybridge.protocol.observability.RelaySessionEvent;
import com.questrail.relaybridge.protocol.session.RelaySessionException.Kind;
import com.questrail.relaybridge.protocol.time.DeterministicScheduler;
import com.questrail.relaybridge.protocol.time.FixedWallClock;
import com.questrail.relaybridge.protocol.time.ManualMonotonicClock;
import com.questrail.relaybridge.protocol.transport.FakeRelayConnector;
import com.questrail.relaybridge.protocol.transport.FakeRelayConnector.FakeRelaySocket;
import com.questrail.relaybridge.protocol.transport.RelayConnector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CallerSessionTest
 * -----------------------------------------------------------------------------
 * Drives a {@link CallerSession} through a fake connector with a direct
 * executor and a deterministic scheduler, so every callback and timer runs
 * synchronously on the test thread.
 */
class CallerSessionTest {

    private static final URI RELAY = URI.create("ws://127.0.0.1:8888/");

    private static final String WELCOME_PRESENT =
            "{\"kind\":\"system\",\"event\":\"connected\",\"channel\":\"ROOM\",\"figmaExecutorPresent\":true}";
    private static final String WELCOME_ABSENT =
            "{\"kind\":\"system\",\"event\":\"connected\",\"channel\":\"ROOM\",\"figmaExecutorPresent\":false}";

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeRelayConnector connector;
    private RecordingObservabilitySink sink;
    private CallerSession session;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        connector = new FakeRelayConnector();
        sink = new RecordingObservabilitySink();
        session = newSession(policy().build());
    }

    private static RelaySessionPolicy.Builder policy() {
        return RelaySessionPolicy.builder()
                .withConnectTimeout(Duration.ofMillis(1000))
                .withRequestTimeout(Duration.ofSeconds(5))
                .withPingInterval(Duration.ofMillis(1000))
                .withKeepaliveTimeout(Duration.ofMillis(2500));
    }

    private CallerSession newSession(RelaySessionPolicy policy) {
        return newSession(connector, policy);
    }

    private CallerSession newSession(RelayConnector relayConnector, RelaySessionPolicy policy) {
        return new CallerSession(
                relayConnector,
                Runnable::run,
                scheduler,
                clock,
                new FixedWallClock(),
                policy,
                new RelayEnvelopeCodec(),
                sink);
    }

    /**
     * Connect to channel ROOM and let the relay report an executor.
     */
    private FakeRelaySocket connectWithExecutor(CallerSession target) {
        CompletableFuture<Void> ready = target.connect(RELAY, "ROOM");
        FakeRelaySocket socket = connector.last();
        socket.fireOpen();
        socket.fireText(WELCOME_PRESENT);
        assertTrue(ready.isDone() && !ready.isCompletedExceptionally());
        return socket;
    }

    private static RelaySessionException failure(CompletableFuture<?> future) {
        assertTrue(future.isCompletedExceptionally(), "expected an exceptional completion");
        Throwable error = future.handle((value, e) -> e).join();
        return assertInstanceOf(RelaySessionException.class, error);
    }

    private static JsonNode json(String text) throws Exception {
        return Jsons.mapper().readTree(text);
    }

    private static String response(String id, String resultJson) {
        return "{\"id\":\"" + id + "\",\"result\":" + resultJson + "}";
    }

    // -------------------------------------------------------------------------
    // Connect
    // -------------------------------------------------------------------------

    @Test
    void connectResolvesWhenWelcomeReportsExecutor() {
        FakeRelaySocket socket = connectWithExecutor(session);

        assertEquals("ws://127.0.0.1:8888/?type=caller&channel=ROOM", socket.uri().toString());

        SessionStatus status = session.status();
        assertTrue(status.connectedToRelay());
        assertTrue(status.executorPresent());
        assertEquals("ROOM", status.channelId());
        assertEquals(RELAY, status.relayAddress());
        assertEquals(1, status.connectAttempt());
        assertTrue(sink.sessionEventKinds().contains(RelaySessionEvent.Kind.EXECUTOR_PRESENT));
    }

    @Test
    void connectWaitsForExecutorConnectedAfterAbsentWelcome() {
        CompletableFuture<Void> ready = session.connect(RELAY, "ROOM");
        FakeRelaySocket socket = connector.last();
        socket.fireOpen();
        socket.fireText(WELCOME_ABSENT);

        assertFalse(ready.isDone());
        assertFalse(session.status().executorPresent());

        socket.fireText("{\"kind\":\"system\",\"event\":\"executor_connected\",\"channel\":\"ROOM\",\"sessionId\":\"s1\"}");

        assertTrue(ready.isDone());
        assertFalse(ready.isCompletedExceptionally());
        assertEquals("s1", session.status().sessionTag());
    }

    /**
     * The connect window bounds how long the caller waits for an executor,
     * not just for the socket to open.
     */
    @Test
    void connectTimesOutWhenNoExecutorJoins() {
        CompletableFuture<Void> ready = session.connect(RELAY, "ROOM");
        FakeRelaySocket socket = connector.last();
        socket.fireOpen();
        socket.fireText(WELCOME_ABSENT);

        scheduler.advanceMillis(999);
        assertFalse(ready.isDone());

        scheduler.advanceMillis(1);
        RelaySessionException error = failure(ready);
        assertEquals(Kind.CONNECT_TIMEOUT, error.kind());
        assertTrue(error.getMessage().contains("ROOM"), error.getMessage());
        assertTrue(error.getMessage().contains("1000ms"), error.getMessage());
    }

    @Test
    void blankChannelIsRejectedImmediately() {
        RelaySessionException error = failure(session.connect(RELAY, "  "));

        assertEquals(Kind.INVALID_REQUEST, error.kind());
        assertEquals("Channel ID required", error.getMessage());
        assertTrue(connector.sockets().isEmpty());
    }

    @Test
    void openFailureFailsConnect() {
        RelayConnector broken = (uri, listener) -> {
            throw new IllegalStateException("no route");
        };
        CallerSession isolated = newSession(broken, policy().build());

        RelaySessionException error = failure(isolated.connect(RELAY, "ROOM"));

        assertEquals(Kind.DISCONNECTED, error.kind());
        assertTrue(error.getMessage().contains("no route"));
        assertFalse(isolated.status().connectedToRelay());
    }

    @Test
    void socketErrorBeforeExecutorFailsConnect() {
        CompletableFuture<Void> ready = session.connect(RELAY, "ROOM");
        FakeRelaySocket socket = connector.last();

        socket.fireError(new IOException("Connection refused"));

        RelaySessionException error = failure(ready);
        assertEquals(Kind.DISCONNECTED, error.kind());
        assertTrue(error.getMessage().contains("Connection refused"));
    }

    @Test
    void reconnectSupersedesPreviousConnection() {
        FakeRelaySocket first = connectWithExecutor(session);
        CompletableFuture<JsonNode> inFlight = session.send(RequestEnvelope.of("r1", "ping", null));

        CompletableFuture<Void> second = session.connect(RELAY, "OTHER");

        assertEquals(Kind.DISCONNECTED, failure(inFlight).kind());
        assertTrue(first.wasClosed());
        assertEquals(2, session.status().connectAttempt());
        assertEquals("OTHER", session.status().channelId());

        FakeRelaySocket next = connector.last();
        assertNotSame(first, next);
        assertTrue(next.uri().toString().endsWith("channel=OTHER"));

        // Late callbacks from the superseded socket must not touch the new connection.
        next.fireOpen();
        first.fireClose(1000, "");
        first.fireText(WELCOME_PRESENT);
        assertTrue(session.status().connectedToRelay());
        assertFalse(second.isDone());
    }

    @Test
    void reconnectFailsPendingConnect() {
        CompletableFuture<Void> first = session.connect(RELAY, "ROOM");
        session.connect(RELAY, "ROOM");

        assertEquals(Kind.DISCONNECTED, failure(first).kind());
    }

    // -------------------------------------------------------------------------
    // Send / correlate
    // -------------------------------------------------------------------------

    @Test
    void sendResolvesWithCorrelatedResult() throws Exception {
        FakeRelaySocket socket = connectWithExecutor(session);

        CompletableFuture<JsonNode> result = session.send(
                RequestEnvelope.of("r1", "get_document", Jsons.mapper().createObjectNode().put("depth", 2)));

        JsonNode written = json(socket.lastSent());
        assertEquals("r1", written.get("id").asText());
        assertEquals("get_document", written.get("type").asText());
        assertEquals(2, written.get("payload").get("depth").asInt());
        assertTrue(session.isPending("r1"));

        socket.fireText(response("r1", "{\"name\":\"Page 1\"}"));

        assertEquals("Page 1", result.join().get("name").asText());
        assertEquals(0, session.pendingRequestCount());
        assertEquals(2, scheduler.activeTaskCount(), "only the keepalive timers remain");
    }

    @Test
    void duplicateResponseIsIgnored() {
        FakeRelaySocket socket = connectWithExecutor(session);
        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));

        socket.fireText(response("r1", "1"));
        socket.fireText(response("r1", "2"));

        assertEquals(1, result.join().asInt());
    }

    @Test
    void responseWithoutResultCompletesWithJsonNull() {
        FakeRelaySocket socket = connectWithExecutor(session);
        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));

        socket.fireText("{\"id\":\"r1\",\"result\":null}");

        assertTrue(result.join().isNull());
    }

    @Test
    void requestWithoutIdIsAssignedOne() throws Exception {
        FakeRelaySocket socket = connectWithExecutor(session);

        session.send(RequestEnvelope.of(null, "ping", null));

        String id = json(socket.lastSent()).get("id").asText();
        assertFalse(id.isBlank());
        assertTrue(session.isPending(id));
    }

    @Test
    void remoteErrorFailsRequest() {
        FakeRelaySocket socket = connectWithExecutor(session);
        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));

        socket.fireText("{\"id\":\"r1\",\"error\":{\"message\":\"Node not found\"}}");

        RelaySessionException error = failure(result);
        assertEquals(Kind.REMOTE_ERROR, error.kind());
        assertEquals("Node not found", error.getMessage());
    }

    /**
     * A timed-out request is removed from the table before its future fails,
     * and the message carries the configured timeout.
     */
    @Test
    void requestTimesOutWithConfiguredTimeoutInMessage() {
        FakeRelaySocket socket = connectWithExecutor(session);
        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r2", "ping", null), Duration.ofMillis(50));

        scheduler.advanceMillis(49);
        assertFalse(result.isDone());

        scheduler.advanceMillis(1);
        RelaySessionException error = failure(result);
        assertEquals(Kind.TIMED_OUT, error.kind());
        assertTrue(error.getMessage().contains("50ms"), error.getMessage());
        assertTrue(error.getMessage().contains("0.05s"), error.getMessage());
        assertTrue(error.getMessage().endsWith("on channel ROOM"), error.getMessage());
        assertFalse(session.isPending("r2"));
        assertTrue(sink.sessionEventKinds().contains(RelaySessionEvent.Kind.REQUEST_TIMED_OUT));

        // The executor's late answer is dropped.
        socket.fireText(response("r2", "true"));
        assertEquals(Kind.TIMED_OUT, failure(result).kind());
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        connectWithExecutor(session);

        assertThrows(IllegalArgumentException.class,
                () -> session.send(RequestEnvelope.of("r1", "ping", null), Duration.ZERO));
    }

    // -------------------------------------------------------------------------
    // Admission
    // -------------------------------------------------------------------------

    @Test
    void sendBeforeConnectFailsNotConnected() {
        RelaySessionException error = failure(session.send(RequestEnvelope.of("r1", "ping", null)));

        assertEquals(Kind.NOT_CONNECTED, error.kind());
        assertEquals("Not connected to relay", error.getMessage());
    }

    @Test
    void sendWithoutExecutorFailsAndWritesNothing() {
        session.connect(RELAY, "ROOM");
        FakeRelaySocket socket = connector.last();
        socket.fireOpen();
        socket.fireText(WELCOME_ABSENT);

        RelaySessionException error = failure(session.send(RequestEnvelope.of("r1", "ping", null)));

        assertEquals(Kind.EXECUTOR_ABSENT, error.kind());
        assertTrue(socket.sent().isEmpty());
    }

    @Test
    void pendingLimitAppliesBackpressure() {
        CallerSession limited = newSession(policy().withMaxPendingRequests(2).build());
        FakeRelaySocket socket = connectWithExecutor(limited);

        limited.send(RequestEnvelope.of("a", "ping", null));
        limited.send(RequestEnvelope.of("b", "ping", null));
        CompletableFuture<JsonNode> third = limited.send(RequestEnvelope.of("c", "ping", null));

        assertEquals(Kind.TOO_MANY_PENDING, failure(third).kind());
        assertEquals(2, socket.sent().size());

        socket.fireText(response("a", "true"));
        CompletableFuture<JsonNode> retry = limited.send(RequestEnvelope.of("c", "ping", null));
        assertFalse(retry.isDone());
        assertTrue(limited.isPending("c"));
    }

    @Test
    void duplicatePendingIdIsRejected() {
        FakeRelaySocket socket = connectWithExecutor(session);
        CompletableFuture<JsonNode> first = session.send(RequestEnvelope.of("r1", "ping", null));

        CompletableFuture<JsonNode> second = session.send(RequestEnvelope.of("r1", "ping", null));

        assertEquals(Kind.DUPLICATE_REQUEST_ID, failure(second).kind());
        assertFalse(first.isDone());
        assertEquals(1, socket.sent().size());
    }

    @Test
    void writeFailureRejectsRequest() {
        FakeRelaySocket socket = connectWithExecutor(session);
        socket.failWritesWith(new IllegalStateException("channel closed"));

        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));

        RelaySessionException error = failure(result);
        assertEquals(Kind.WRITE_FAILED, error.kind());
        assertEquals("Failed to write request r1 to channel ROOM", error.getMessage());
        assertEquals(0, session.pendingRequestCount());
    }

    // -------------------------------------------------------------------------
    // Session tags and control events
    // -------------------------------------------------------------------------

    @Test
    void responseFromStaleExecutorSessionIsDropped() {
        CompletableFuture<Void> ready = session.connect(RELAY, "ROOM");
        FakeRelaySocket socket = connector.last();
        socket.fireOpen();
        socket.fireText("{\"kind\":\"system\",\"event\":\"connected\",\"channel\":\"ROOM\","
                + "\"figmaExecutorPresent\":true,\"sessionId\":\"s1\"}");
        assertTrue(ready.isDone());

        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));

        socket.fireText("{\"id\":\"r1\",\"result\":\"old\",\"sessionId\":\"s0\"}");
        assertFalse(result.isDone());
        assertTrue(sink.sessionEventKinds().contains(RelaySessionEvent.Kind.STALE_ENVELOPE_DROPPED));
        assertTrue(session.debugEvents().stream().anyMatch(e -> e.event().equals("stale_session_drop")));

        socket.fireText("{\"id\":\"r1\",\"result\":\"new\",\"sessionId\":\"s1\"}");
        assertEquals("new", result.join().asText());
    }

    @Test
    void executorDisconnectRejectsPending() {
        FakeRelaySocket socket = connectWithExecutor(session);
        CompletableFuture<JsonNode> a = session.send(RequestEnvelope.of("a", "ping", null));
        CompletableFuture<JsonNode> b = session.send(RequestEnvelope.of("b", "ping", null));

        socket.fireText("{\"kind\":\"system\",\"event\":\"executor_disconnected\",\"channel\":\"ROOM\"}");

        assertEquals(Kind.EXECUTOR_DISCONNECTED, failure(a).kind());
        assertEquals(Kind.EXECUTOR_DISCONNECTED, failure(b).kind());
        assertFalse(session.status().executorPresent());
        assertTrue(session.status().connectedToRelay());

        assertEquals(Kind.EXECUTOR_ABSENT, failure(session.send(RequestEnvelope.of("c", "ping", null))).kind());
    }

    @Test
    void staleExecutorDisconnectIsIgnored() {
        CompletableFuture<Void> ready = session.connect(RELAY, "ROOM");
        FakeRelaySocket socket = connector.last();
        socket.fireOpen();
        socket.fireText("{\"kind\":\"system\",\"event\":\"executor_connected\",\"channel\":\"ROOM\",\"sessionId\":\"new\"}");
        assertTrue(ready.isDone());
        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));

        socket.fireText("{\"kind\":\"system\",\"event\":\"executor_disconnected\",\"channel\":\"ROOM\",\"sessionId\":\"old\"}");

        assertFalse(result.isDone());
        assertTrue(session.status().executorPresent());
    }

    /**
     * An executor that announces no tag replaces the recorded one, so its
     * replies are not filtered against its predecessor's tag.
     */
    @Test
    void untaggedReplacementExecutorClearsRecordedTag() {
        CompletableFuture<Void> ready = session.connect(RELAY, "ROOM");
        FakeRelaySocket socket = connector.last();
        socket.fireOpen();
        socket.fireText("{\"kind\":\"system\",\"event\":\"connected\",\"channel\":\"ROOM\","
                + "\"figmaExecutorPresent\":true,\"sessionId\":\"A\"}");
        assertTrue(ready.isDone());
        assertEquals("A", session.status().sessionTag());

        socket.fireText("{\"kind\":\"system\",\"event\":\"executor_disconnected\",\"channel\":\"ROOM\",\"sessionId\":\"A\"}");
        assertNull(session.status().sessionTag());

        socket.fireText("{\"kind\":\"system\",\"event\":\"executor_connected\",\"channel\":\"ROOM\"}");
        assertTrue(session.status().executorPresent());
        assertNull(session.status().sessionTag());

        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));
        socket.fireText("{\"id\":\"r1\",\"result\":\"fresh\",\"sessionId\":\"B\"}");

        assertEquals("fresh", result.join().asText());
        assertFalse(session.isPending("r1"));
    }

    @Test
    void executorConnectedWithoutTagOverwritesPreviousTag() {
        CompletableFuture<Void> ready = session.connect(RELAY, "ROOM");
        FakeRelaySocket socket = connector.last();
        socket.fireOpen();
        socket.fireText("{\"kind\":\"system\",\"event\":\"executor_connected\",\"channel\":\"ROOM\",\"sessionId\":\"A\"}");
        assertTrue(ready.isDone());

        socket.fireText("{\"kind\":\"system\",\"event\":\"executor_connected\",\"channel\":\"ROOM\"}");

        assertNull(session.status().sessionTag());
    }

    @Test
    void binaryResponseIsCorrelatedLikeText() {
        FakeRelaySocket socket = connectWithExecutor(session);
        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));

        socket.fireBinary(response("r1", "{\"ok\":true}").getBytes(StandardCharsets.UTF_8));

        assertTrue(result.join().get("ok").asBoolean());
    }

    @Test
    void relayErrorRejectsPending() {
        FakeRelaySocket socket = connectWithExecutor(session);
        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));

        socket.fireText("{\"kind\":\"system\",\"event\":\"error\",\"channel\":\"ROOM\",\"error\":\"Executor not connected\"}");

        RelaySessionException error = failure(result);
        assertEquals(Kind.RELAY_ERROR, error.kind());
        assertEquals("Executor not connected", error.getMessage());
    }

    @Test
    void undecodableTextIsDropped() {
        FakeRelaySocket socket = connectWithExecutor(session);
        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));

        socket.fireText("not json");
        socket.fireText("{\"kind\":\"system\",\"event\":\"reboot\"}");

        assertFalse(result.isDone());
        assertEquals(2, session.debugEvents().stream().filter(e -> e.event().equals("decode_error")).count());
    }

    // -------------------------------------------------------------------------
    // Socket lifecycle
    // -------------------------------------------------------------------------

    @Test
    void socketCloseRejectsPending() {
        FakeRelaySocket socket = connectWithExecutor(session);
        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));

        socket.fireClose(1006, "");

        RelaySessionException error = failure(result);
        assertEquals(Kind.DISCONNECTED, error.kind());
        assertTrue(error.getMessage().contains("code=1006"));
        assertFalse(session.status().connectedToRelay());
        assertFalse(session.status().executorPresent());
        assertTrue(sink.sessionEventKinds().contains(RelaySessionEvent.Kind.SOCKET_CLOSED));
    }

    @Test
    void keepalivePingsAndInboundTrafficPostponesDeadline() {
        FakeRelaySocket socket = connectWithExecutor(session);

        scheduler.advanceMillis(1000);
        scheduler.advanceMillis(1000);
        assertEquals(2, socket.pings());

        socket.firePong();
        scheduler.advanceMillis(1000);
        scheduler.advanceMillis(1000);
        assertFalse(socket.wasTerminated());
        assertEquals(4, socket.pings());

        socket.fireText(response("nobody", "1"));
        scheduler.advanceMillis(1000);
        scheduler.advanceMillis(1000);
        assertFalse(socket.wasTerminated());
        assertTrue(session.debugEvents().stream().anyMatch(e -> e.event().equals("keepalive_pong")));
    }

    /**
     * Silence for the keepalive timeout terminates the socket; the resulting
     * close rejects whatever was in flight.
     */
    @Test
    void silenceTerminatesSocket() {
        FakeRelaySocket socket = connectWithExecutor(session);
        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));

        scheduler.advanceMillis(2499);
        assertFalse(socket.wasTerminated());

        scheduler.advanceMillis(1);
        assertTrue(socket.wasTerminated());
        assertTrue(sink.sessionEventKinds().contains(RelaySessionEvent.Kind.KEEPALIVE_TIMEOUT));

        socket.fireClose(1006, "");
        assertEquals(Kind.DISCONNECTED, failure(result).kind());
    }

    // -------------------------------------------------------------------------
    // Notify / close
    // -------------------------------------------------------------------------

    @Test
    void notifyWritesWithoutTracking() throws Exception {
        FakeRelaySocket socket = connectWithExecutor(session);

        session.notify(RequestEnvelope.of("n1", "selection_changed", null));

        assertEquals("selection_changed", json(socket.lastSent()).get("type").asText());
        assertEquals(0, session.pendingRequestCount());
    }

    @Test
    void notifyIsSkippedWhenNotConnected() {
        assertDoesNotThrow(() -> session.notify(RequestEnvelope.of("n1", "selection_changed", null)));
    }

    @Test
    void closeRejectsPendingAndRefusesFurtherWork() {
        FakeRelaySocket socket = connectWithExecutor(session);
        CompletableFuture<JsonNode> result = session.send(RequestEnvelope.of("r1", "ping", null));

        session.close();

        assertEquals(Kind.SESSION_CLOSED, failure(result).kind());
        assertTrue(socket.wasClosed());
        assertFalse(session.status().connectedToRelay());
        assertEquals(0, scheduler.activeTaskCount());

        assertEquals(Kind.SESSION_CLOSED, failure(session.send(RequestEnvelope.of("r2", "ping", null))).kind());
        assertEquals(Kind.SESSION_CLOSED, failure(session.connect(RELAY, "ROOM")).kind());
    }
}
