package com.questrail.wavemeter.observer;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.time.MonotonicClock;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * PendingMarkerRegistry
 * =============================================================================
 * Per-target record of local writes that have not been confirmed yet.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #mark(ChannelId, Quantity, double)} - a local producer requested a value</li>
 *   <li>{@link #clearIfMatches(ChannelId, Quantity, double)} - the device owner
 *       read back a value within {@value #MATCH_TOLERANCE} of the requested one</li>
 *   <li>expiry - a marker older than {@code expiry} is no longer reported and is
 *       purged on the next lookup</li>
 * </ul>
 *
 * <p>Safe for concurrent use: local producers mark, the owner clears, observers
 * read.</p>
 */
public final class PendingMarkerRegistry
{
    public static final double MATCH_TOLERANCE = 1.0e-9;

    private final MonotonicClock clock;
    private final long expiryNanos;
    private final ConcurrentHashMap<PendingKey, PendingMarker> markers = new ConcurrentHashMap<>();

    public PendingMarkerRegistry(MonotonicClock clock, Duration expiry) {
        this.clock = Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(expiry, "expiry");
        if (expiry.isNegative() || expiry.isZero()) {
            throw new IllegalArgumentException("expiry must be > 0");
        }
        this.expiryNanos = expiry.toNanos();
    }

    public PendingMarker mark(ChannelId channel, Quantity quantity, double value) {
        PendingKey key = new PendingKey(channel, quantity);
        PendingMarker marker = new PendingMarker(key, value, clock.nowNanos());
        markers.put(key, marker);
        return marker;
    }

    /**
     * Removes the marker when {@code readBack} confirms it.
     *
     * @return {@code true} if a marker was cleared
     */
    public boolean clearIfMatches(ChannelId channel, Quantity quantity, double readBack) {
        PendingKey key = new PendingKey(channel, quantity);
        PendingMarker current = markers.get(key);
        if (current == null || Math.abs(current.value() - readBack) > MATCH_TOLERANCE) {
            return false;
        }
        return markers.remove(key, current);
    }

    public Optional<PendingMarker> active(ChannelId channel, Quantity quantity) {
        PendingKey key = new PendingKey(channel, quantity);
        PendingMarker marker = markers.get(key);
        if (marker == null) {
            return Optional.empty();
        }
        if (expired(marker, clock.nowNanos())) {
            markers.remove(key, marker);
            return Optional.empty();
        }
        return Optional.of(marker);
    }

    /**
     * Returns every unexpired marker and purges expired ones.
     */
    public Map<PendingKey, PendingMarker> activeMarkers() {
        long now = clock.nowNanos();
        Map<PendingKey, PendingMarker> out = new HashMap<>();
        markers.forEach((key, marker) -> {
            if (expired(marker, now)) {
                markers.remove(key, marker);
            } else {
                out.put(key, marker);
            }
        });
        return out;
    }

    private boolean expired(PendingMarker marker, long now) {
        return now - marker.createdAtNanos() >= expiryNanos;
    }
}
