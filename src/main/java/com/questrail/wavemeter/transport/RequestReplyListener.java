package com.questrail.wavemeter.transport;

import java.net.SocketAddress;

/**
 * Callback sink for {@link RequestReplyEndpoint}.
 *
 * <p>{@link #onRequest(SocketAddress, String, ReplyChannel)} is invoked on the
 * transport's I/O thread. Implementations must hand the work off and return
 * immediately.</p>
 */
public interface RequestReplyListener
{
    void onTransportUp();

    /**
     * @param cause may be {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * @param remote  the requesting peer
     * @param request one complete request line, without its terminator
     * @param reply   where the single reply line goes
     */
    void onRequest(SocketAddress remote, String request, ReplyChannel reply);
}
