package com.questrail.wavemeter.observer;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.queue.EnqueueResult;
import com.questrail.wavemeter.state.SharedStateStore;
import com.questrail.wavemeter.time.FixedRateTicker;
import com.questrail.wavemeter.time.MonotonicClock;
import com.questrail.wavemeter.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * LocalObserver
 * =============================================================================
 * Pull-based model behind a local display.
 *
 * <p>Reads the shared snapshot on two cadences (measurements fast, status
 * slow), overlays pending markers and hands a {@link DisplayState} to the
 * {@link DisplayView}. User edits go through a {@link CoalescingWriteProducer}.
 * The observer never calls the driver and is never called by the owner.</p>
 */
public final class LocalObserver
{
    private static final Logger log = LoggerFactory.getLogger(LocalObserver.class);

    private final SharedStateStore store;
    private final PendingMarkerRegistry pendingMarkers;
    private final CoalescingWriteProducer producer;
    private final DisplayView view;
    private final FixedRateTicker fastTicker;
    private final FixedRateTicker slowTicker;

    public LocalObserver(SharedStateStore store,
                         PendingMarkerRegistry pendingMarkers,
                         CoalescingWriteProducer producer,
                         DisplayView view,
                         MonotonicClock clock,
                         MonotonicScheduler scheduler,
                         Duration fastPeriod,
                         Duration slowPeriod)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.pendingMarkers = Objects.requireNonNull(pendingMarkers, "pendingMarkers");
        this.producer = Objects.requireNonNull(producer, "producer");
        this.view = Objects.requireNonNull(view, "view");
        this.fastTicker = new FixedRateTicker(scheduler, clock, fastPeriod, () -> refresh(DisplayView.Refresh.MEASUREMENTS));
        this.slowTicker = new FixedRateTicker(scheduler, clock, slowPeriod, () -> refresh(DisplayView.Refresh.STATUS));
    }

    public void start() {
        fastTicker.start();
        slowTicker.start();
    }

    public void stop() {
        fastTicker.stop();
        slowTicker.stop();
    }

    /**
     * Current display state: confirmed snapshot plus active pending markers.
     */
    public DisplayState displayState() {
        return new DisplayState(store.read(), pendingMarkers.activeMarkers());
    }

    /**
     * Requests a write from the local display.
     *
     * @param channel {@code null} for instrument-wide quantities
     */
    public EnqueueResult requestWrite(ChannelId channel, Quantity quantity, double value) {
        return producer.submit(quantity.scope() == Quantity.Scope.GLOBAL ? null : channel, quantity, value);
    }

    void refresh(DisplayView.Refresh refresh) {
        try {
            view.render(displayState(), refresh);
        } catch (RuntimeException e) {
            // A broken view must not stop the ticker.
            log.warn("Display view failed during {} refresh", refresh, e);
        }
    }
}
