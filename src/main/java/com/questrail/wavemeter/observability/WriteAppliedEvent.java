package com.questrail.wavemeter.observability;

import com.questrail.wavemeter.api.WriteOrigin;

import java.time.Instant;

/**
 * A write that reached the driver, with the value read back afterwards.
 */
public record WriteAppliedEvent(
    Instant timestamp,
    String target,
    double requested,
    double readBack,
    WriteOrigin origin
) {
}
