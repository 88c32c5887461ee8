/**
 * Netty WebSocket adapters for the relay transport ports.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code EventLoopGroup}, {@code ByteBuf},
 * frame classes) MUST NOT escape this package. Everything leaving it is a
 * {@code String}, a close code, or a {@code Throwable}.
 *
 * <ul>
 *   <li>{@link com.questrail.relaybridge.protocol.transport.netty.NettyRelayServer}
 *       hosts a {@code ChannelBroker} behind a WebSocket endpoint plus the
 *       {@code <path>/status} HTTP endpoint.</li>
 *   <li>{@link com.questrail.relaybridge.protocol.transport.netty.NettyRelayConnector}
 *       opens outbound sockets for caller sessions.</li>
 * </ul>
 */
package com.questrail.relaybridge.protocol.transport.netty;
