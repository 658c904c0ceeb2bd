package com.questrail.wavemeter.observer;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.queue.WriteRangePolicy;
import com.questrail.wavemeter.queue.WriteRequestQueue;
import com.questrail.wavemeter.state.SharedStateStore;
import com.questrail.wavemeter.state.SignalLevels;
import com.questrail.wavemeter.state.WavemeterSnapshot;
import com.questrail.wavemeter.time.DeterministicScheduler;
import com.questrail.wavemeter.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LocalObserverTest
 * -----------------------------------------------------------------------------
 * Display refresh cadences and the pending overlay.
 */
class LocalObserverTest {

    private static final ChannelId CH1 = ChannelId.of(1);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private SharedStateStore store;
    private PendingMarkerRegistry markers;
    private WriteRequestQueue queue;
    private final List<DisplayView.Refresh> refreshes = new ArrayList<>();
    private final List<DisplayState> rendered = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        store = new SharedStateStore(WavemeterSnapshot.initial(ChannelId.range(2)));
        markers = new PendingMarkerRegistry(clock, Duration.ofSeconds(1));
        queue = new WriteRequestQueue(16, new WriteRangePolicy(1.0, 2));
    }

    private LocalObserver observer(DisplayView view) {
        CoalescingWriteProducer producer =
                new CoalescingWriteProducer(queue, markers, clock, scheduler, Duration.ZERO);
        return new LocalObserver(store, markers, producer, view, clock, scheduler,
                Duration.ofMillis(50), Duration.ofMillis(1000));
    }

    private LocalObserver recordingObserver() {
        return observer((state, refresh) -> {
            rendered.add(state);
            refreshes.add(refresh);
        });
    }

    @Test
    void refreshesMeasurementsFastAndStatusSlow() {
        LocalObserver observer = recordingObserver();
        observer.start();

        scheduler.advanceAndRun(1000, 10);

        assertEquals(20, refreshes.stream().filter(r -> r == DisplayView.Refresh.MEASUREMENTS).count());
        assertEquals(1, refreshes.stream().filter(r -> r == DisplayView.Refresh.STATUS).count());

        observer.stop();
        refreshes.clear();
        scheduler.advanceAndRun(1000, 10);
        assertTrue(refreshes.isEmpty());
    }

    @Test
    void measurementRefreshCarriesSignalLevels() {
        SignalLevels levels = new SignalLevels(12.0, 3.0, 2400.0, 1100.0);
        store.update(s -> s.withChannel(CH1, c -> c.withSignal(levels)));
        LocalObserver observer = recordingObserver();
        observer.start();

        scheduler.advanceAndRun(50, 10);

        assertEquals(levels, rendered.get(rendered.size() - 1).signal(CH1));
        observer.stop();
    }

    @Test
    void pendingValueIsShownUntilConfirmed() {
        store.update(s -> s.withChannel(CH1, c -> c.withSetpoint(349.0)));
        LocalObserver observer = recordingObserver();

        observer.requestWrite(CH1, Quantity.SETPOINT, 350.5);

        DisplayState state = observer.displayState();
        assertTrue(state.isPending(CH1, Quantity.SETPOINT));
        assertEquals(350.5, state.value(CH1, Quantity.SETPOINT));
        assertEquals(349.0, state.confirmed().channel(CH1).setpoint());
        assertEquals(1, queue.size());

        store.update(s -> s.withChannel(CH1, c -> c.withSetpoint(350.5)));
        markers.clearIfMatches(CH1, Quantity.SETPOINT, 350.5);

        assertFalse(observer.displayState().isPending(CH1, Quantity.SETPOINT));
        assertEquals(350.5, observer.displayState().value(CH1, Quantity.SETPOINT));
    }

    @Test
    void expiredPendingValueFallsBackToConfirmed() {
        store.update(s -> s.withChannel(CH1, c -> c.withSetpoint(349.0)));
        LocalObserver observer = recordingObserver();

        observer.requestWrite(CH1, Quantity.SETPOINT, 350.5);
        clock.advanceMillis(1000);

        assertEquals(349.0, observer.displayState().value(CH1, Quantity.SETPOINT));
    }

    @Test
    void instrumentWideWritesIgnoreTheChannel() {
        LocalObserver observer = recordingObserver();

        observer.requestWrite(CH1, Quantity.DEVIATION_MODE, 1.0);

        assertTrue(observer.displayState().isPending(null, Quantity.DEVIATION_MODE));
        assertNull(queue.drain().get(0).channel());
    }

    @Test
    void failingViewDoesNotStopTheCadence() {
        int[] calls = new int[1];
        LocalObserver observer = observer((state, refresh) -> {
            calls[0]++;
            throw new IllegalStateException("render failed");
        });
        observer.start();

        scheduler.advanceAndRun(200, 10);

        assertEquals(4, calls[0]);
    }
}
