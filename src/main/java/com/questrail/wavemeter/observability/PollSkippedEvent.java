package com.questrail.wavemeter.observability;

import java.time.Instant;

/**
 * A poll tick skipped by the re-entrancy guard.
 *
 * @param skippedTotal number of ticks skipped since the owner started
 */
public record PollSkippedEvent(
    Instant timestamp,
    long skippedTotal
) {
}
