package com.questrail.wavemeter.observability;

import java.time.Duration;
import java.time.Instant;

/**
 * Timing and outcome of one device owner cycle.
 *
 * @param cycleDuration  wall time of the whole cycle, measured on the monotonic clock
 * @param driverDuration time spent inside driver calls
 */
public record PollCycleEvent(
    Instant timestamp,
    long cycle,
    Duration cycleDuration,
    Duration driverDuration,
    int writesApplied,
    boolean statusPolled,
    int driverErrors,
    long revision
) {
}
