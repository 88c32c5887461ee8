/**
 * Relay Transport Ports
 * =============================================================================
 *
 * Framework-agnostic boundary between the relay core (broker and caller
 * session) and a concrete WebSocket implementation.
 *
 * <h2>Why these ports exist</h2>
 * Production uses Netty ({@code transport.netty}); tests substitute in-memory
 * fakes. Netty types never leak above this package. Everything above sees
 * only:
 * <ul>
 *   <li>complete text messages as {@code String}</li>
 *   <li>lifecycle notifications (open, close with code, error)</li>
 *   <li>keepalive pings and pongs</li>
 * </ul>
 *
 * <h2>Constraints (binding)</h2>
 * Implementations perform I/O only: no envelope decoding, no channel
 * bookkeeping, no timers or retries.
 */
package com.questrail.relaybridge.protocol.transport;
