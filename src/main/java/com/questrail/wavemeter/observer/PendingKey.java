package com.questrail.wavemeter.observer;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;

import java.util.Objects;

/**
 * Identifies one writable target: a channel quantity, or an instrument-wide
 * quantity when {@code channel} is {@code null}.
 */
public record PendingKey(ChannelId channel, Quantity quantity) {
    public PendingKey {
        Objects.requireNonNull(quantity, "quantity");
    }
}
