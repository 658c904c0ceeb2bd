package com.questrail.wavemeter.observer;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.state.QuantityValues;
import com.questrail.wavemeter.state.SignalLevels;
import com.questrail.wavemeter.state.WavemeterSnapshot;

import java.util.Map;
import java.util.Objects;

/**
 * What a local display shows: the confirmed snapshot with every active pending
 * marker laid over it.
 *
 * <p>{@link #value(ChannelId, Quantity)} prefers the pending value, so a user
 * sees what they typed until the device confirms it or the marker expires.
 * {@link #confirmed()} stays available for widgets that must show the device
 * value only.</p>
 */
public record DisplayState(WavemeterSnapshot confirmed, Map<PendingKey, PendingMarker> pending) {
    public DisplayState {
        Objects.requireNonNull(confirmed, "confirmed");
        pending = Map.copyOf(Objects.requireNonNull(pending, "pending"));
    }

    /**
     * @param channel {@code null} for instrument-wide quantities
     */
    public double value(ChannelId channel, Quantity quantity) {
        ChannelId key = quantity.scope() == Quantity.Scope.GLOBAL ? null : channel;
        PendingMarker marker = pending.get(new PendingKey(key, quantity));
        return marker != null ? marker.value() : QuantityValues.read(confirmed, key, quantity);
    }

    /**
     * CCD exposure and amplitude of the channel; never overlaid, nothing writes them.
     */
    public SignalLevels signal(ChannelId channel) {
        return confirmed.channel(channel).signal();
    }

    public boolean isPending(ChannelId channel, Quantity quantity) {
        ChannelId key = quantity.scope() == Quantity.Scope.GLOBAL ? null : channel;
        return pending.containsKey(new PendingKey(key, quantity));
    }
}
