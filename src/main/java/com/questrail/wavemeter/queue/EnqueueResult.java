package com.questrail.wavemeter.queue;

/**
 * Outcome of {@link WriteRequestQueue#offer(WriteRequest)}.
 */
public enum EnqueueResult
{
    ACCEPTED,
    REJECTED_OUT_OF_RANGE,
    REJECTED_QUEUE_FULL;

    public boolean accepted() {
        return this == ACCEPTED;
    }
}
