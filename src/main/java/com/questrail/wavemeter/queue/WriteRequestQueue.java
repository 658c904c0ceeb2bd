package com.questrail.wavemeter.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * WriteRequestQueue
 * =============================================================================
 * Bounded FIFO carrying write intents from any number of producers (command
 * workers, local observers, settings restore) to the single device owner.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #offer(WriteRequest)} never blocks</li>
 *   <li>Out-of-range requests are rejected before they are queued</li>
 *   <li>On overflow the newest request is rejected and a WARN is logged; queued
 *       requests are never dropped</li>
 *   <li>{@link #drain()} never blocks and returns requests in arrival order</li>
 * </ul>
 *
 * <p>Rejected requests have their completion future failed with
 * {@link WriteRejectedException} so that any waiter is released.</p>
 */
public final class WriteRequestQueue
{
    private static final Logger log = LoggerFactory.getLogger(WriteRequestQueue.class);

    public static final int DEFAULT_CAPACITY = 1024;

    private final BlockingQueue<WriteRequest> queue;
    private final WriteRangePolicy rangePolicy;
    private final int capacity;

    public WriteRequestQueue(int capacity, WriteRangePolicy rangePolicy) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.rangePolicy = Objects.requireNonNull(rangePolicy, "rangePolicy");
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    public EnqueueResult offer(WriteRequest request) {
        Objects.requireNonNull(request, "request");

        Optional<String> rejection = rangePolicy.check(request);
        if (rejection.isPresent()) {
            log.warn("Rejected {} write {} = {}: {}",
                    request.origin(), request.target(), request.value(), rejection.get());
            request.completion().completeExceptionally(
                    new WriteRejectedException(EnqueueResult.REJECTED_OUT_OF_RANGE, rejection.get()));
            return EnqueueResult.REJECTED_OUT_OF_RANGE;
        }

        if (!queue.offer(request)) {
            log.warn("Write queue full ({} pending); rejected {} write {} = {}",
                    capacity, request.origin(), request.target(), request.value());
            request.completion().completeExceptionally(
                    new WriteRejectedException(EnqueueResult.REJECTED_QUEUE_FULL, "write queue is full"));
            return EnqueueResult.REJECTED_QUEUE_FULL;
        }
        return EnqueueResult.ACCEPTED;
    }

    /**
     * Removes and returns every queued request in FIFO order.
     */
    public List<WriteRequest> drain() {
        List<WriteRequest> out = new ArrayList<>();
        queue.drainTo(out);
        return out;
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }

    public WriteRangePolicy rangePolicy() {
        return rangePolicy;
    }
}
