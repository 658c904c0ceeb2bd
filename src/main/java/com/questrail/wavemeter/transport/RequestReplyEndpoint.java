package com.questrail.wavemeter.transport;

import java.net.InetSocketAddress;
import java.util.Optional;

/**
 * RequestReplyEndpoint
 * -----------------------------------------------------------------------------
 * Port for a stream transport that carries one request line and one reply
 * line per exchange (the command channel).
 *
 * <p>The endpoint frames and delivers complete request lines to its
 * {@link RequestReplyListener}; the listener answers through the supplied
 * {@link ReplyChannel}, from any thread and at any later time.</p>
 */
public interface RequestReplyEndpoint
{
    /**
     * Bind and begin accepting connections. Notifies
     * {@link RequestReplyListener#onTransportUp()} once bound.
     */
    void start();

    /**
     * Close every connection and release transport resources.
     */
    void stop();

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(RequestReplyListener listener);

    /**
     * The bound local address, once the endpoint is up.
     */
    Optional<InetSocketAddress> localAddress();
}
