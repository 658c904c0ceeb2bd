package com.questrail.wavemeter.settings;

import com.questrail.wavemeter.api.Quantity;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Saved settings of one channel: a value per persisted {@link Quantity}.
 *
 * <p>A quantity may be absent when it could not be read at save time or was
 * missing from the loaded file.</p>
 */
public final class ChannelSettings
{
    private final Map<Quantity, Double> values;

    public ChannelSettings(Map<Quantity, Double> values) {
        Objects.requireNonNull(values, "values");
        EnumMap<Quantity, Double> copy = new EnumMap<>(Quantity.class);
        values.forEach((q, v) -> {
            if (!q.persisted()) {
                throw new IllegalArgumentException(q + " is not a persisted setting");
            }
            copy.put(q, Objects.requireNonNull(v, q.wireName()));
        });
        this.values = Collections.unmodifiableMap(copy);
    }

    public Optional<Double> get(Quantity quantity) {
        return Optional.ofNullable(values.get(quantity));
    }

    /**
     * Values in {@link Quantity} declaration order.
     */
    public Map<Quantity, Double> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelSettings that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ChannelSettings" + values;
    }
}
