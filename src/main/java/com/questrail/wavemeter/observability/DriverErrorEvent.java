package com.questrail.wavemeter.observability;

import java.time.Instant;

/**
 * Record representing a failed driver call.
 */
public record DriverErrorEvent(
    Instant timestamp,
    String operation,
    String message,
    Throwable cause
) {
}
