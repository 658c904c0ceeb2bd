package com.questrail.wavemeter.queue;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.api.WriteOrigin;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WriteRangePolicyTest {

    private final WriteRangePolicy policy = new WriteRangePolicy(1.0, 4);

    private static WriteRequest write(int channel, Quantity q, double v) {
        return WriteRequest.forChannel(ChannelId.of(channel), q, v, WriteOrigin.REMOTE, 0L);
    }

    @Test
    void setpointMustBeAboveMinimum() {
        assertTrue(policy.check(write(1, Quantity.SETPOINT, 348.66641)).isEmpty());
        assertTrue(policy.check(write(1, Quantity.SETPOINT, 1.0)).isPresent());
        assertTrue(policy.check(write(1, Quantity.SETPOINT, -5.0)).isPresent());
    }

    @Test
    void nonFiniteValuesAreRejected() {
        assertTrue(policy.check(write(1, Quantity.PID_P, Double.NaN)).isPresent());
        assertTrue(policy.check(write(1, Quantity.BOUNDS_MAX, Double.POSITIVE_INFINITY)).isPresent());
    }

    @Test
    void booleanQuantitiesAcceptOnlyZeroOrOne() {
        assertTrue(policy.check(write(1, Quantity.LOCK_ENABLED, 1.0)).isEmpty());
        assertTrue(policy.check(write(1, Quantity.LOCK_ENABLED, 0.0)).isEmpty());
        assertTrue(policy.check(write(1, Quantity.LOCK_ENABLED, 2.0)).isPresent());
    }

    @Test
    void integerQuantitiesRejectFractions() {
        assertTrue(policy.check(write(1, Quantity.DEVIATION_POLARITY, -1.0)).isEmpty());
        assertTrue(policy.check(write(1, Quantity.DEVIATION_POLARITY, 0.5)).isPresent());
    }

    @Test
    void deviationChannelMustBeAConfiguredChannelOrZero() {
        assertTrue(policy.check(write(2, Quantity.DEVIATION_CHANNEL, 0.0)).isEmpty());
        assertTrue(policy.check(write(2, Quantity.DEVIATION_CHANNEL, 4.0)).isEmpty());
        assertTrue(policy.check(write(2, Quantity.DEVIATION_CHANNEL, 5.0)).isPresent());
    }

    @Test
    void channelsBeyondConfiguredCountAreRejected() {
        assertTrue(policy.check(write(6, Quantity.PID_P, 1.0)).isPresent());
    }

    @Test
    void readOnlyQuantitiesAreRejected() {
        assertTrue(policy.check(write(1, Quantity.FREQUENCY, 350.0)).isPresent());
        assertTrue(policy.check(WriteRequest.forInstrument(Quantity.TEMPERATURE, 20.0, WriteOrigin.REMOTE, 0L)).isPresent());
        assertTrue(policy.check(WriteRequest.forInstrument(Quantity.DEVIATION_MODE, 1.0, WriteOrigin.REMOTE, 0L)).isEmpty());
    }
}
