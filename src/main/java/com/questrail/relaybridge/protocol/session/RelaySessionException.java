package com.questrail.relaybridge.protocol.session;

import java.util.Objects;

/**
 * Failure of a caller-session operation. Every future returned by
 * {@link CallerSession} completes exceptionally with this type.
 *
 * <p>The {@link Kind} lets callers distinguish failures that happened before
 * a request left the process (admission) from those that may have reached
 * the executor (liveness, timeout, remote).</p>
 */
public final class RelaySessionException extends RuntimeException
{
    public enum Kind
    {
        // Admission: the request was never written.
        NOT_CONNECTED,
        EXECUTOR_ABSENT,
        TOO_MANY_PENDING,
        DUPLICATE_REQUEST_ID,
        INVALID_REQUEST,

        // Liveness
        CONNECT_TIMEOUT,
        DISCONNECTED,
        EXECUTOR_DISCONNECTED,
        SESSION_CLOSED,
        WRITE_FAILED,

        // Routing
        RELAY_ERROR,

        TIMED_OUT,

        // The executor answered with an error.
        REMOTE_ERROR
    }

    private final Kind kind;

    public RelaySessionException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public RelaySessionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind kind() {
        return kind;
    }
}
