package com.questrail.wavemeter.observer;

import java.util.Objects;

/**
 * "The user requested {@code value} at {@code createdAtNanos}" for one target.
 *
 * <p>Display-only. The command server never sees pending values.</p>
 */
public record PendingMarker(PendingKey key, double value, long createdAtNanos) {
    public PendingMarker {
        Objects.requireNonNull(key, "key");
    }
}
