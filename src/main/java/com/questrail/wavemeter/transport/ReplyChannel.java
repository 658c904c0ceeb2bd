package com.questrail.wavemeter.transport;

/**
 * Sends the reply to one request. Safe to call from any thread.
 */
@FunctionalInterface
public interface ReplyChannel
{
    /**
     * @param reply one reply line, without its terminator
     */
    void reply(String reply);
}
