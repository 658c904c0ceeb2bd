package com.questrail.wavemeter.settings;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.api.WriteOrigin;
import com.questrail.wavemeter.observer.PendingMarkerRegistry;
import com.questrail.wavemeter.queue.EnqueueResult;
import com.questrail.wavemeter.queue.WriteRequest;
import com.questrail.wavemeter.queue.WriteRequestQueue;
import com.questrail.wavemeter.state.QuantityValues;
import com.questrail.wavemeter.state.SharedStateStore;
import com.questrail.wavemeter.state.WavemeterSnapshot;
import com.questrail.wavemeter.time.MonotonicClock;
import com.questrail.wavemeter.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * SettingsService
 * =============================================================================
 * Save, compare and restore of the persisted per-channel settings.
 *
 * <p>Current values come from the shared snapshot, never from the driver:
 * only the device owner talks to the instrument. A restore therefore goes
 * through the write queue like any other local edit and is applied by the
 * owner on its next cycle.</p>
 */
public final class SettingsService
{
    private static final Logger log = LoggerFactory.getLogger(SettingsService.class);

    public static final double COMPARE_TOLERANCE = 1.0e-9;

    static final String NO_DIFFERENCES =
            "No differences found between saved config and current WLM state.";

    private final SharedStateStore store;
    private final WriteRequestQueue queue;
    private final PendingMarkerRegistry pendingMarkers;
    private final MonotonicClock clock;
    private final WallClock wallClock;

    public SettingsService(SharedStateStore store,
                           WriteRequestQueue queue,
                           PendingMarkerRegistry pendingMarkers,
                           MonotonicClock clock,
                           WallClock wallClock) {
        this.store = Objects.requireNonNull(store, "store");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.pendingMarkers = Objects.requireNonNull(pendingMarkers, "pendingMarkers");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Captures the persisted settings of every channel in the current snapshot.
     */
    public SettingsRecord currentSettings() {
        WavemeterSnapshot snapshot = store.read();
        Map<ChannelId, ChannelSettings> channels = new TreeMap<>();
        for (ChannelId channel : snapshot.channels().keySet()) {
            Map<Quantity, Double> values = new EnumMap<>(Quantity.class);
            for (Quantity q : Quantity.values()) {
                if (q.persisted()) {
                    values.put(q, QuantityValues.read(snapshot, channel, q));
                }
            }
            channels.put(channel, new ChannelSettings(values));
        }
        return new SettingsRecord(wallClock.now(), channels);
    }

    /**
     * Lists the settings whose current value differs from {@code saved}.
     * Channels or settings missing on either side are not compared.
     */
    public List<SettingDifference> compare(SettingsRecord saved) {
        Objects.requireNonNull(saved, "saved");
        SettingsRecord current = currentSettings();
        List<SettingDifference> diffs = new ArrayList<>();

        current.channels().forEach((channel, live) -> {
            ChannelSettings stored = saved.channels().get(channel);
            if (stored == null) {
                return;
            }
            live.values().forEach((q, liveValue) ->
                    stored.get(q).ifPresent(savedValue -> {
                        if (differs(q, liveValue, savedValue)) {
                            diffs.add(new SettingDifference(channel, q, liveValue, savedValue));
                        }
                    }));
        });
        return diffs;
    }

    private static boolean differs(Quantity quantity, double live, double saved) {
        if (quantity.kind() == Quantity.Kind.DOUBLE) {
            return Math.abs(live - saved) > COMPARE_TOLERANCE;
        }
        return Math.round(live) != Math.round(saved);
    }

    public static String formatDiffSummary(List<SettingDifference> diffs) {
        return formatDiffSummary(diffs, Map.of());
    }

    /**
     * Renders differences grouped by channel, for display to an operator.
     *
     * @param channelNames optional display names; channels without one are
     *                     shown as {@code Ch n}
     */
    public static String formatDiffSummary(List<SettingDifference> diffs, Map<ChannelId, String> channelNames) {
        if (diffs.isEmpty()) {
            return NO_DIFFERENCES;
        }

        Map<ChannelId, List<SettingDifference>> byChannel = new TreeMap<>();
        for (SettingDifference d : diffs) {
            byChannel.computeIfAbsent(d.channel(), c -> new ArrayList<>()).add(d);
        }

        List<String> lines = new ArrayList<>();
        byChannel.forEach((channel, channelDiffs) -> {
            String name = channelNames.getOrDefault(channel, "Ch " + channel.value());
            lines.add("\n--- " + name + " (Port " + channel.value() + ") ---");
            for (SettingDifference d : channelDiffs) {
                lines.add("  " + d.quantity().wireName()
                        + ": current=" + formatValue(d.quantity(), d.current())
                        + "  saved=" + formatValue(d.quantity(), d.saved()));
            }
        });
        return String.join("\n", lines);
    }

    static String formatValue(Quantity quantity, double value) {
        if (quantity.kind() != Quantity.Kind.DOUBLE) {
            return Long.toString(Math.round(value));
        }
        if (!Double.isFinite(value)) {
            return Double.toString(value);
        }
        // Nine significant digits, without trailing zeros.
        return new BigDecimal(value)
                .round(new MathContext(9))
                .stripTrailingZeros()
                .toPlainString();
    }

    /**
     * Enqueues a LOCAL write for every saved setting of every channel that
     * exists in the current snapshot.
     */
    public List<RestoreOutcome> restore(SettingsRecord saved) {
        Objects.requireNonNull(saved, "saved");
        WavemeterSnapshot snapshot = store.read();
        List<RestoreOutcome> outcomes = new ArrayList<>();

        saved.channels().forEach((channel, settings) -> {
            if (!snapshot.hasChannel(channel)) {
                log.warn("Skipping restore of channel {}: not configured", channel.value());
                return;
            }
            settings.values().forEach((q, value) -> outcomes.add(restoreOne(channel, q, value)));
        });

        long accepted = outcomes.stream().filter(o -> o.result().accepted()).count();
        log.info("Restore enqueued {} of {} settings", accepted, outcomes.size());
        return outcomes;
    }

    private RestoreOutcome restoreOne(ChannelId channel, Quantity quantity, double value) {
        WriteRequest request = WriteRequest.forChannel(channel, quantity, value, WriteOrigin.LOCAL, clock.nowNanos());
        EnqueueResult result = queue.offer(request);
        if (result.accepted()) {
            pendingMarkers.mark(channel, quantity, value);
        } else {
            log.error("Failed to restore {} on channel {}: {}", quantity.wireName(), channel.value(), result);
        }
        return new RestoreOutcome(channel, quantity, value, result, request.completion());
    }
}
