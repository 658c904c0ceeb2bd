package com.questrail.wavemeter.owner;

import com.questrail.wavemeter.driver.FrequencyReading;
import com.questrail.wavemeter.state.ChannelState;

import java.util.Objects;

/**
 * FrequencyNormalizer
 * -----------------------------------------------------------------------------
 * Folds one classified frequency reading into a channel's state.
 *
 * <ul>
 *   <li>{@link FrequencyReading.Sample} - store the value, bump the change
 *       count, recompute the lock-quality flag</li>
 *   <li>{@link FrequencyReading.NoNewSample} - keep value, count and lock flag</li>
 *   <li>{@link FrequencyReading.Invalid} - keep the last good value, mark the
 *       reading invalid, clear the lock flag</li>
 * </ul>
 *
 * <p>A channel counts as locked when it is armed, deviation mode is on, and the
 * new sample lies strictly within {@code toleranceTerahertz} of the setpoint.</p>
 */
public final class FrequencyNormalizer
{
    private final double toleranceTerahertz;

    public FrequencyNormalizer(double toleranceTerahertz) {
        if (!(toleranceTerahertz > 0.0)) {
            throw new IllegalArgumentException("toleranceTerahertz must be > 0");
        }
        this.toleranceTerahertz = toleranceTerahertz;
    }

    public ChannelState apply(ChannelState state, FrequencyReading reading, boolean deviationMode) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(reading, "reading");

        if (reading instanceof FrequencyReading.Sample sample) {
            boolean locked = state.lockEnabled()
                    && deviationMode
                    && Math.abs(sample.terahertz() - state.setpoint()) < toleranceTerahertz;
            return state.withFreshSample(sample.terahertz(), locked);
        }
        if (reading instanceof FrequencyReading.Invalid) {
            return state.withInvalidSample();
        }
        return state.withNoNewSample();
    }
}
