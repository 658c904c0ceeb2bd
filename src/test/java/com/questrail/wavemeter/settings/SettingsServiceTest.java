package com.questrail.wavemeter.settings;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.api.WriteOrigin;
import com.questrail.wavemeter.observer.PendingMarkerRegistry;
import com.questrail.wavemeter.queue.EnqueueResult;
import com.questrail.wavemeter.queue.WriteRangePolicy;
import com.questrail.wavemeter.queue.WriteRequest;
import com.questrail.wavemeter.queue.WriteRequestQueue;
import com.questrail.wavemeter.state.QuantityValues;
import com.questrail.wavemeter.state.SharedStateStore;
import com.questrail.wavemeter.state.WavemeterSnapshot;
import com.questrail.wavemeter.time.ManualMonotonicClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SettingsServiceTest {

    private static final ChannelId CH1 = ChannelId.of(1);
    private static final ChannelId CH2 = ChannelId.of(2);
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private SharedStateStore store;
    private WriteRequestQueue queue;
    private PendingMarkerRegistry markers;
    private SettingsService service;

    @BeforeEach
    void setUp() {
        ManualMonotonicClock clock = new ManualMonotonicClock();
        store = new SharedStateStore(WavemeterSnapshot.initial(ChannelId.range(2)));
        queue = new WriteRequestQueue(16, new WriteRangePolicy(1.0, 2));
        markers = new PendingMarkerRegistry(clock, Duration.ofSeconds(1));
        service = new SettingsService(store, queue, markers, clock, () -> NOW);
    }

    private void set(ChannelId channel, Quantity quantity, double value) {
        store.update(s -> QuantityValues.apply(s, channel, quantity, value));
    }

    @Test
    void currentSettingsCaptureEveryPersistedQuantity() {
        set(CH1, Quantity.SETPOINT, 350.0);
        set(CH2, Quantity.BOUNDS_MAX, 2.5);

        SettingsRecord current = service.currentSettings();

        assertEquals(NOW, current.savedAt());
        assertEquals(List.of(CH1, CH2), List.copyOf(current.channels().keySet()));
        long persisted = Arrays.stream(Quantity.values()).filter(Quantity::persisted).count();
        assertEquals(persisted, current.channels().get(CH1).values().size());
        assertEquals(350.0, current.channels().get(CH1).get(Quantity.SETPOINT).orElseThrow());
        assertEquals(2.5, current.channels().get(CH2).get(Quantity.BOUNDS_MAX).orElseThrow());
        assertFalse(current.channels().get(CH1).get(Quantity.FREQUENCY).isPresent());
    }

    @Test
    void compareHonoursToleranceAndIntegerRounding() {
        set(CH1, Quantity.SETPOINT, 350.0);
        set(CH1, Quantity.PID_P, 0.2);

        SettingsRecord saved = new SettingsRecord(NOW, Map.of(
                CH1, new ChannelSettings(Map.of(
                        Quantity.SETPOINT, 350.0 + 5e-10,
                        Quantity.PID_P, 0.3,
                        Quantity.DEVIATION_POLARITY, 0.4)),
                ChannelId.of(5), new ChannelSettings(Map.of(Quantity.PID_P, 9.0))));

        List<SettingDifference> diffs = service.compare(saved);

        assertEquals(List.of(new SettingDifference(CH1, Quantity.PID_P, 0.2, 0.3)), diffs);
    }

    @Test
    void summaryGroupsByChannel() {
        List<SettingDifference> diffs = List.of(
                new SettingDifference(CH2, Quantity.SETPOINT, 350.1, 350.2),
                new SettingDifference(CH1, Quantity.PID_P, 0.5, 0.25),
                new SettingDifference(CH2, Quantity.DEVIATION_POLARITY, 1.0, 0.0));

        String summary = SettingsService.formatDiffSummary(diffs, Map.of(CH2, "Laser B"));

        assertEquals("\n--- Ch 1 (Port 1) ---\n"
                + "  P: current=0.5  saved=0.25\n"
                + "\n--- Laser B (Port 2) ---\n"
                + "  Setpoint: current=350.1  saved=350.2\n"
                + "  Polarity: current=1  saved=0", summary);
    }

    @Test
    void summaryOfNoDifferences() {
        assertEquals(SettingsService.NO_DIFFERENCES, SettingsService.formatDiffSummary(List.of()));
    }

    @Test
    void valuesAreFormattedToNineSignificantDigits() {
        assertEquals("348.66641", SettingsService.formatValue(Quantity.SETPOINT, 348.66641));
        assertEquals("348.666412", SettingsService.formatValue(Quantity.SETPOINT, 348.6664123456));
        assertEquals("2", SettingsService.formatValue(Quantity.DEVIATION_CHANNEL, 2.0));
    }

    @Test
    void restoreEnqueuesLocalWritesAndMarksThemPending() {
        SettingsRecord saved = new SettingsRecord(NOW, Map.of(
                CH1, new ChannelSettings(Map.of(Quantity.SETPOINT, 351.0, Quantity.PID_P, 0.3)),
                CH2, new ChannelSettings(Map.of(Quantity.SETPOINT, 0.5)),
                ChannelId.of(5), new ChannelSettings(Map.of(Quantity.PID_P, 9.0))));

        List<RestoreOutcome> outcomes = service.restore(saved);

        assertEquals(3, outcomes.size());
        assertEquals(EnqueueResult.ACCEPTED, outcomes.get(0).result());
        assertEquals(EnqueueResult.ACCEPTED, outcomes.get(1).result());
        assertEquals(EnqueueResult.REJECTED_OUT_OF_RANGE, outcomes.get(2).result());
        assertTrue(outcomes.get(2).completion().isCompletedExceptionally());

        List<WriteRequest> queued = queue.drain();
        assertEquals(2, queued.size());
        assertTrue(queued.stream().allMatch(r -> r.origin() == WriteOrigin.LOCAL && CH1.equals(r.channel())));

        assertEquals(351.0, markers.active(CH1, Quantity.SETPOINT).orElseThrow().value());
        assertTrue(markers.active(CH2, Quantity.SETPOINT).isEmpty());
    }
}
