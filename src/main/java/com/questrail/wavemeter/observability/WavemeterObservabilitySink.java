package com.questrail.wavemeter.observability;

/**
 * Main interface for receiving device-owner observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on the device owner thread. Implementations must return
 * quickly and must not call back into the owner or the driver.</p>
 */
public interface WavemeterObservabilitySink {
    /**
     * Called after every completed owner cycle.
     * @param event timing and outcome of the cycle
     */
    void onPollCycle(PollCycleEvent event);

    /**
     * Called when a poll tick arrived while a cycle was still in flight and was skipped.
     * @param event the skipped tick
     */
    void onPollSkipped(PollSkippedEvent event);

    /**
     * Called after a write was applied, read back and stored.
     * @param event the applied write
     */
    void onWriteApplied(WriteAppliedEvent event);

    /**
     * Called when the owner dropped a queued write instead of applying it.
     * @param event the dropped write
     */
    void onWriteRejected(WriteRejectedEvent event);

    /**
     * Called when a driver call failed.
     * @param event the failure
     */
    void onDriverError(DriverErrorEvent event);
}
