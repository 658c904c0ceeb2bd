package com.questrail.wavemeter.api;

/**
 * Producer of a write request.
 *
 * <p>The origin only decides whether a pending marker is placed for the
 * written value. It never changes how the device owner applies the write.</p>
 */
public enum WriteOrigin
{
    /**
     * A local observer (display) requested the change. A pending marker
     * suppresses the stale read-back on the display until confirmation.
     */
    LOCAL,

    /**
     * The remote command server requested the change. No pending marker.
     */
    REMOTE
}
