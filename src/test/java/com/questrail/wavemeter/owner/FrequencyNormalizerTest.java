package com.questrail.wavemeter.owner;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.driver.FrequencyReading;
import com.questrail.wavemeter.driver.WavemeterErrorCode;
import com.questrail.wavemeter.state.ChannelState;
import com.questrail.wavemeter.state.FrequencyStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyNormalizerTest {

    private final FrequencyNormalizer normalizer = new FrequencyNormalizer(5.0e-6);

    private static ChannelState armedAt(double setpoint) {
        return ChannelState.initial(ChannelId.of(3)).withSetpoint(setpoint).withLockEnabled(true);
    }

    @Test
    void sampleIsStoredAndCounted() {
        ChannelState next = normalizer.apply(ChannelState.initial(ChannelId.of(3)),
                new FrequencyReading.Sample(348.7), false);

        assertEquals(348.7, next.displayedFrequency());
        assertEquals(1, next.frequencyChangeCount());
        assertEquals(FrequencyStatus.FRESH, next.frequencyStatus());
        assertFalse(next.locked());
    }

    @Test
    void noNewSampleBeforeAnySampleKeepsZeroAndNoneStatus() {
        ChannelState next = normalizer.apply(ChannelState.initial(ChannelId.of(3)),
                FrequencyReading.noNewSample(), true);

        assertEquals(0.0, next.displayedFrequency());
        assertEquals(0, next.frequencyChangeCount());
        assertEquals(FrequencyStatus.NONE, next.frequencyStatus());
    }

    @Test
    void noNewSampleKeepsLockFlag() {
        ChannelState locked = normalizer.apply(armedAt(348.66641), new FrequencyReading.Sample(348.666411), true);
        assertTrue(locked.locked());

        ChannelState next = normalizer.apply(locked, FrequencyReading.noNewSample(), true);

        assertTrue(next.locked());
        assertEquals(locked.frequencyChangeCount(), next.frequencyChangeCount());
        assertEquals(FrequencyStatus.UNCHANGED, next.frequencyStatus());
    }

    @Test
    void lockRequiresDeviationMode() {
        ChannelState next = normalizer.apply(armedAt(348.66641), new FrequencyReading.Sample(348.66641), false);
        assertFalse(next.locked());
    }

    @Test
    void lockToleranceIsStrict() {
        ChannelState inside = normalizer.apply(armedAt(350.0), new FrequencyReading.Sample(350.000004), true);
        ChannelState outside = normalizer.apply(armedAt(350.0), new FrequencyReading.Sample(350.000006), true);

        assertTrue(inside.locked());
        assertFalse(outside.locked());
    }

    @Test
    void invalidReadingDropsLockButKeepsValue() {
        ChannelState locked = normalizer.apply(armedAt(350.0), new FrequencyReading.Sample(350.0), true);

        ChannelState next = normalizer.apply(locked,
                new FrequencyReading.Invalid(WavemeterErrorCode.LOW_SIGNAL, -3.0), true);

        assertEquals(350.0, next.displayedFrequency());
        assertEquals(FrequencyStatus.INVALID, next.frequencyStatus());
        assertFalse(next.locked());
        assertEquals(1, next.frequencyChangeCount());
    }
}
