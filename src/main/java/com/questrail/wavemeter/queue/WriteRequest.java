package com.questrail.wavemeter.queue;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.api.WriteOrigin;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * WriteRequest
 * -----------------------------------------------------------------------------
 * One intent to change a device quantity, consumed exactly once by the device
 * owner loop.
 *
 * <p>{@code channel} is required for {@link Quantity.Scope#CHANNEL} quantities
 * and must be {@code null} for {@link Quantity.Scope#GLOBAL} ones.</p>
 *
 * <p>{@code completion} is completed by the owner with an {@link AppliedWrite}
 * after the store has been updated, or exceptionally when the write was
 * dropped or the driver call failed. Producers that do not care simply ignore
 * it.</p>
 */
public record WriteRequest(
        ChannelId channel,
        Quantity quantity,
        double value,
        WriteOrigin origin,
        long enqueuedAtNanos,
        CompletableFuture<AppliedWrite> completion
) {
    public WriteRequest {
        Objects.requireNonNull(quantity, "quantity");
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(completion, "completion");
        if (quantity.scope() == Quantity.Scope.CHANNEL) {
            Objects.requireNonNull(channel, "channel is required for " + quantity);
        } else if (channel != null) {
            throw new IllegalArgumentException(quantity + " is instrument-wide and takes no channel");
        }
    }

    public static WriteRequest forChannel(ChannelId channel, Quantity quantity, double value,
                                          WriteOrigin origin, long nowNanos) {
        return new WriteRequest(channel, quantity, value, origin, nowNanos, new CompletableFuture<>());
    }

    public static WriteRequest forInstrument(Quantity quantity, double value, WriteOrigin origin, long nowNanos) {
        return new WriteRequest(null, quantity, value, origin, nowNanos, new CompletableFuture<>());
    }

    /**
     * Short human-readable target, e.g. {@code ch3 Setpoint} or {@code DeviationMode}.
     */
    public String target() {
        return channel == null ? quantity.wireName() : "ch" + channel.value() + " " + quantity.wireName();
    }
}
