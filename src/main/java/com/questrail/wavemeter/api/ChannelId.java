package com.questrail.wavemeter.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Strongly typed wavemeter channel (switcher port) number.
 *
 * <h2>Why this type exists</h2>
 * <p>
 * Channel numbers travel through every layer: the command protocol, the
 * telemetry lines, the shared snapshot and the driver. Treating them as raw
 * {@code int} values would allow accidental mixing with PID setting codes,
 * quantity values or array indexes.
 * </p>
 *
 * <h2>Constraints</h2>
 * <ul>
 *   <li>Valid channels are {@code 1}–{@code 8} (inclusive)</li>
 *   <li>A deployment may use fewer channels; see {@link #range(int)}</li>
 * </ul>
 */
public final class ChannelId implements Comparable<ChannelId>
{
    /**
     * Lowest channel number.
     */
    public static final int MIN_VALUE = 1;

    /**
     * Highest channel number supported by the switcher.
     */
    public static final int MAX_VALUE = 8;

    private final int value;

    private ChannelId(int value) {
        this.value = value;
    }

    /**
     * @throws IllegalArgumentException if the value is outside {@code 1}–{@code 8}
     */
    public static ChannelId of(int value) {
        if (value < MIN_VALUE || value > MAX_VALUE) {
            throw new IllegalArgumentException(
                    "Wavemeter channel must be in range "
                            + MIN_VALUE + "–" + MAX_VALUE
                            + " (was " + value + ")"
            );
        }
        return new ChannelId(value);
    }

    /**
     * Returns channels {@code 1..count} in ascending order.
     */
    public static List<ChannelId> range(int count) {
        if (count < MIN_VALUE || count > MAX_VALUE) {
            throw new IllegalArgumentException("channel count must be in range 1–8 (was " + count + ")");
        }
        List<ChannelId> channels = new ArrayList<>(count);
        for (int i = MIN_VALUE; i <= count; i++) {
            channels.add(new ChannelId(i));
        }
        return Collections.unmodifiableList(channels);
    }

    public int value() {
        return value;
    }

    @Override
    public int compareTo(ChannelId o) {
        return Integer.compare(value, o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelId that)) return false;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return "ChannelId[" + value + "]";
    }
}
