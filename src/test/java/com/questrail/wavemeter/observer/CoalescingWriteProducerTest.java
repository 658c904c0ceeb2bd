package com.questrail.wavemeter.observer;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.api.WriteOrigin;
import com.questrail.wavemeter.queue.EnqueueResult;
import com.questrail.wavemeter.queue.WriteRangePolicy;
import com.questrail.wavemeter.queue.WriteRequest;
import com.questrail.wavemeter.queue.WriteRequestQueue;
import com.questrail.wavemeter.time.DeterministicScheduler;
import com.questrail.wavemeter.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoalescingWriteProducerTest {

    private static final ChannelId CH1 = ChannelId.of(1);
    private static final ChannelId CH2 = ChannelId.of(2);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private WriteRequestQueue queue;
    private PendingMarkerRegistry markers;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        queue = new WriteRequestQueue(16, new WriteRangePolicy(1.0, 2));
        markers = new PendingMarkerRegistry(clock, Duration.ofSeconds(1));
    }

    private CoalescingWriteProducer producer(Duration window) {
        return new CoalescingWriteProducer(queue, markers, clock, scheduler, window);
    }

    @Test
    void burstCollapsesToLatestValuePerTarget() {
        CoalescingWriteProducer producer = producer(Duration.ofMillis(50));

        producer.submit(CH1, Quantity.SETPOINT, 350.0);
        producer.submit(CH2, Quantity.PID_P, 0.5);
        producer.submit(CH1, Quantity.SETPOINT, 350.1);
        producer.submit(CH1, Quantity.SETPOINT, 350.2);

        assertEquals(2, producer.pendingCount());
        assertEquals(0, queue.size());
        assertEquals(350.2, markers.active(CH1, Quantity.SETPOINT).orElseThrow().value());

        scheduler.advanceAndRun(50, 10);

        List<WriteRequest> drained = queue.drain();
        assertEquals(2, drained.size());
        assertEquals(Quantity.SETPOINT, drained.get(0).quantity());
        assertEquals(350.2, drained.get(0).value());
        assertEquals(WriteOrigin.LOCAL, drained.get(0).origin());
        assertEquals(Quantity.PID_P, drained.get(1).quantity());
        assertEquals(0, producer.pendingCount());
    }

    @Test
    void outOfRangeValuesAreRejectedWithoutMarking() {
        CoalescingWriteProducer producer = producer(Duration.ofMillis(50));

        assertEquals(EnqueueResult.REJECTED_OUT_OF_RANGE, producer.submit(CH1, Quantity.SETPOINT, 0.5));
        assertEquals(EnqueueResult.REJECTED_OUT_OF_RANGE, producer.submit(CH1, Quantity.LOCK_ENABLED, 2.0));

        assertTrue(markers.activeMarkers().isEmpty());
        assertEquals(0, producer.pendingCount());
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void zeroWindowEnqueuesImmediately() {
        CoalescingWriteProducer producer = producer(Duration.ZERO);

        assertEquals(EnqueueResult.ACCEPTED, producer.submit(null, Quantity.DEVIATION_MODE, 1.0));

        WriteRequest only = queue.drain().get(0);
        assertNull(only.channel());
        assertEquals(Quantity.DEVIATION_MODE, only.quantity());
        assertTrue(markers.active(null, Quantity.DEVIATION_MODE).isPresent());
    }

    @Test
    void newBurstAfterFlushArmsAnotherFlush() {
        CoalescingWriteProducer producer = producer(Duration.ofMillis(50));

        producer.submit(CH1, Quantity.SETPOINT, 350.0);
        scheduler.advanceAndRun(50, 10);
        producer.submit(CH1, Quantity.SETPOINT, 351.0);
        scheduler.advanceAndRun(50, 10);

        List<WriteRequest> drained = queue.drain();
        assertEquals(List.of(350.0, 351.0), drained.stream().map(WriteRequest::value).toList());
    }
}
