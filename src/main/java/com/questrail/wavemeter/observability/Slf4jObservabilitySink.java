package com.questrail.wavemeter.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of WavemeterObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jObservabilitySink implements WavemeterObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jObservabilitySink.class);

    @Override
    public void onPollCycle(PollCycleEvent event) {
        if (log.isTraceEnabled()) {
            log.trace("Owner cycle {}: {} ms (driver {} ms), writes={}, status={}, errors={}, revision={}",
                event.cycle(),
                event.cycleDuration().toMillis(),
                event.driverDuration().toMillis(),
                event.writesApplied(),
                event.statusPolled(),
                event.driverErrors(),
                event.revision());
        }
    }

    @Override
    public void onPollSkipped(PollSkippedEvent event) {
        log.debug("Poll tick skipped: previous cycle still running ({} skipped so far)", event.skippedTotal());
    }

    @Override
    public void onWriteApplied(WriteAppliedEvent event) {
        log.info("{} write {}: requested {} read back {}",
            event.origin(), event.target(), event.requested(), event.readBack());
    }

    @Override
    public void onWriteRejected(WriteRejectedEvent event) {
        log.warn("{} write {} = {} dropped: {}",
            event.origin(), event.target(), event.value(), event.reason());
    }

    @Override
    public void onDriverError(DriverErrorEvent event) {
        log.error("Driver call {} failed: {}", event.operation(), event.message(), event.cause());
    }
}
