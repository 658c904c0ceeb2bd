package com.questrail.wavemeter.observability;

import com.questrail.wavemeter.api.WriteOrigin;

import java.time.Instant;

/**
 * A queued write the owner refused to apply.
 */
public record WriteRejectedEvent(
    Instant timestamp,
    String target,
    double value,
    WriteOrigin origin,
    String reason
) {
}
