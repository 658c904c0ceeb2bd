package com.questrail.wavemeter.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational decision: poll cadence, status-poll gating,
 * pending-marker expiry and the convergence-wait deadline.
 *
 * <p>Wall-clock time ({@link WallClock}) is permitted only for observability
 * timestamps and the saved-settings header.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
