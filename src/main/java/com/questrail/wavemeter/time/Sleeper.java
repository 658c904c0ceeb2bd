package com.questrail.wavemeter.time;

import java.time.Duration;

/**
 * Blocking pause used by the convergence wait of the command server.
 *
 * <p>Only command worker threads sleep. The device owner never does.</p>
 */
@FunctionalInterface
public interface Sleeper
{
    /**
     * Pause the calling thread.
     *
     * @throws InterruptedException if the thread is interrupted while paused
     */
    void sleep(Duration duration) throws InterruptedException;
}
