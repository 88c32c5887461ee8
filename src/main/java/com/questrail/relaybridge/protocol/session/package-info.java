/**
 * Caller-side relay session.
 *
 * <p>{@link com.questrail.relaybridge.protocol.session.CallerSession} joins a
 * channel as a caller and correlates request/response pairs by id over a
 * {@link com.questrail.relaybridge.protocol.transport.RelayConnector}.
 * Supporting types handle keepalive, the pending-request table, stale
 * executor filtering and diagnostics.</p>
 */
package com.questrail.relaybridge.protocol.session;
