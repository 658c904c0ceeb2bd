package com.questrail.wavemeter.queue;

import java.util.Objects;

/**
 * Completes the future of a write request that never reached the driver.
 */
public class WriteRejectedException extends RuntimeException
{
    private final EnqueueResult reason;

    public WriteRejectedException(EnqueueResult reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public EnqueueResult reason() {
        return reason;
    }
}
