package com.questrail.wavemeter.observability;

import java.util.List;
import java.util.Objects;

/**
 * Fans every event out to several sinks, in order.
 */
public final class CompositeObservabilitySink implements WavemeterObservabilitySink {
    private final List<WavemeterObservabilitySink> sinks;

    public CompositeObservabilitySink(List<WavemeterObservabilitySink> sinks) {
        Objects.requireNonNull(sinks, "sinks");
        this.sinks = List.copyOf(sinks);
    }

    public static WavemeterObservabilitySink of(WavemeterObservabilitySink... sinks) {
        return new CompositeObservabilitySink(List.of(sinks));
    }

    @Override
    public void onPollCycle(PollCycleEvent event) {
        sinks.forEach(s -> s.onPollCycle(event));
    }

    @Override
    public void onPollSkipped(PollSkippedEvent event) {
        sinks.forEach(s -> s.onPollSkipped(event));
    }

    @Override
    public void onWriteApplied(WriteAppliedEvent event) {
        sinks.forEach(s -> s.onWriteApplied(event));
    }

    @Override
    public void onWriteRejected(WriteRejectedEvent event) {
        sinks.forEach(s -> s.onWriteRejected(event));
    }

    @Override
    public void onDriverError(DriverErrorEvent event) {
        sinks.forEach(s -> s.onDriverError(event));
    }
}
