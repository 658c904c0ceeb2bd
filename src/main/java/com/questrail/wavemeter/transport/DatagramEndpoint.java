package com.questrail.wavemeter.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Optional;

/**
 * DatagramEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a datagram-based transport (UDP-style).
 *
 * <p>Used by the telemetry publisher: outbound heartbeat and frequency lines,
 * inbound subscription requests. Delivery is best-effort; the endpoint never
 * retries.</p>
 *
 * <p>Implementations may be backed by Netty or a test harness.</p>
 */
public interface DatagramEndpoint
{
    /**
     * Start the endpoint and begin receiving datagrams.
     *
     * <p>On successful activation, the endpoint MUST notify its listener via
     * {@link DatagramEndpointListener#onTransportUp()} exactly once per transition.</p>
     */
    void start();

    /**
     * Stop the endpoint and release all transport resources.
     *
     * <p>On shutdown (graceful or error-induced), the endpoint MUST notify its
     * listener via {@link DatagramEndpointListener#onTransportDown(Throwable)} at
     * most once per transition.</p>
     */
    void stop();

    /**
     * Send a datagram to the specified remote endpoint.
     *
     * <p>Fire-and-forget: a datagram sent before the endpoint is up, or one the
     * network refuses, is dropped.</p>
     *
     * @param remote remote destination
     * @param payload datagram payload
     */
    void send(SocketAddress remote, byte[] payload);

    /**
     * Register the listener that receives inbound datagrams and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(DatagramEndpointListener listener);

    /**
     * The bound local address, once the endpoint is up.
     */
    Optional<InetSocketAddress> localAddress();
}
