/**
 * Wavemeter Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty UDP, Netty TCP, or a
 * test double) and the command server / telemetry publisher.
 *
 * <h2>Why these ports exist</h2>
 * We use Netty in production (event loop model, mature UDP and TCP support,
 * line framing codecs) <strong>without</strong> allowing Netty types to leak
 * into the coordinator core.
 *
 * <p>Everything above the transport adapters sees only:</p>
 * <ul>
 *   <li>Raw datagram payloads as {@code byte[]}</li>
 *   <li>Complete request lines as {@code String}</li>
 *   <li>Remote endpoints as standard {@link java.net.SocketAddress}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no command or telemetry interpretation)</li>
 *   <li>Never run request handling on the transport event loop when it may block</li>
 *   <li>Never touch the wavemeter driver or the shared state store</li>
 * </ul>
 */
package com.questrail.wavemeter.transport;
