package com.questrail.wavemeter.observer;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.api.WriteOrigin;
import com.questrail.wavemeter.queue.EnqueueResult;
import com.questrail.wavemeter.queue.WriteRequest;
import com.questrail.wavemeter.queue.WriteRequestQueue;
import com.questrail.wavemeter.time.Cancellable;
import com.questrail.wavemeter.time.MonotonicClock;
import com.questrail.wavemeter.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CoalescingWriteProducer
 * =============================================================================
 * Local write producer that collapses bursts of writes to the same target.
 *
 * <p>A spin box dragged by the user can emit dozens of values per second;
 * only the last one within {@code window} reaches the write queue. Each
 * submission immediately marks the target pending so the display shows the
 * requested value at once.</p>
 *
 * <ul>
 *   <li>Out-of-range values are rejected synchronously and never marked</li>
 *   <li>The first submission to an idle producer arms one flush
 *       {@code window} later; later submissions in the window replace the
 *       value for their target and keep their first-arrival order</li>
 *   <li>A zero window enqueues immediately</li>
 * </ul>
 */
public final class CoalescingWriteProducer
{
    private static final Logger log = LoggerFactory.getLogger(CoalescingWriteProducer.class);

    private final WriteRequestQueue queue;
    private final PendingMarkerRegistry pendingMarkers;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Duration window;

    private final Object lock = new Object();
    private final Map<PendingKey, Double> latest = new LinkedHashMap<>();
    private Cancellable armedFlush;

    public CoalescingWriteProducer(WriteRequestQueue queue,
                                   PendingMarkerRegistry pendingMarkers,
                                   MonotonicClock clock,
                                   MonotonicScheduler scheduler,
                                   Duration window)
    {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.pendingMarkers = Objects.requireNonNull(pendingMarkers, "pendingMarkers");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.window = Objects.requireNonNull(window, "window");
        if (window.isNegative()) {
            throw new IllegalArgumentException("window must be non-negative");
        }
    }

    /**
     * Submits a local write.
     *
     * @param channel target channel, {@code null} for instrument-wide quantities
     * @return {@link EnqueueResult#REJECTED_OUT_OF_RANGE} for invalid values,
     *         otherwise {@link EnqueueResult#ACCEPTED} (or the queue's verdict
     *         when the window is zero)
     */
    public EnqueueResult submit(ChannelId channel, Quantity quantity, double value) {
        WriteRequest candidate = request(channel, quantity, value);
        Optional<String> rejection = queue.rangePolicy().check(candidate);
        if (rejection.isPresent()) {
            log.warn("Rejected local write {} = {}: {}", candidate.target(), value, rejection.get());
            return EnqueueResult.REJECTED_OUT_OF_RANGE;
        }

        pendingMarkers.mark(channel, quantity, value);

        if (window.isZero()) {
            return queue.offer(candidate);
        }

        synchronized (lock) {
            latest.put(new PendingKey(channel, quantity), value);
            if (armedFlush == null) {
                armedFlush = scheduler.scheduleAfter(window, clock, this::flush);
            }
        }
        return EnqueueResult.ACCEPTED;
    }

    /**
     * Enqueues every coalesced write now. Normally called by the armed flush.
     *
     * @return number of requests the queue accepted
     */
    public int flush() {
        List<WriteRequest> batch = new ArrayList<>();
        synchronized (lock) {
            armedFlush = null;
            latest.forEach((key, value) -> batch.add(request(key.channel(), key.quantity(), value)));
            latest.clear();
        }
        int accepted = 0;
        for (WriteRequest r : batch) {
            if (queue.offer(r).accepted()) {
                accepted++;
            }
        }
        return accepted;
    }

    public int pendingCount() {
        synchronized (lock) {
            return latest.size();
        }
    }

    private WriteRequest request(ChannelId channel, Quantity quantity, double value) {
        long now = clock.nowNanos();
        return quantity.scope() == Quantity.Scope.GLOBAL
                ? WriteRequest.forInstrument(quantity, value, WriteOrigin.LOCAL, now)
                : WriteRequest.forChannel(channel, quantity, value, WriteOrigin.LOCAL, now);
    }
}
