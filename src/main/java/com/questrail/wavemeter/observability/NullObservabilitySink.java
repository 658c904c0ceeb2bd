package com.questrail.wavemeter.observability;

/**
 * No-op implementation of WavemeterObservabilitySink.
 */
public final class NullObservabilitySink implements WavemeterObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onPollCycle(PollCycleEvent event) {}

    @Override
    public void onPollSkipped(PollSkippedEvent event) {}

    @Override
    public void onWriteApplied(WriteAppliedEvent event) {}

    @Override
    public void onWriteRejected(WriteRejectedEvent event) {}

    @Override
    public void onDriverError(DriverErrorEvent event) {}
}
