package com.questrail.wavemeter.queue;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;

import java.util.Objects;
import java.util.Optional;

/**
 * WriteRangePolicy
 * -----------------------------------------------------------------------------
 * Sane-range check applied to every write, once at enqueue time and again by
 * the device owner immediately before the driver call.
 *
 * <ul>
 *   <li>the quantity must be writable</li>
 *   <li>the value must be finite</li>
 *   <li>boolean quantities accept only {@code 0} or {@code 1}</li>
 *   <li>integer quantities accept only integral values</li>
 *   <li>a setpoint must exceed {@code minimumSetpointTerahertz}</li>
 *   <li>a deviation channel must be {@code 0} (off) or a configured channel</li>
 * </ul>
 */
public final class WriteRangePolicy
{
    private final double minimumSetpointTerahertz;
    private final int channelCount;

    public WriteRangePolicy(double minimumSetpointTerahertz, int channelCount) {
        if (!Double.isFinite(minimumSetpointTerahertz) || minimumSetpointTerahertz < 0.0) {
            throw new IllegalArgumentException("minimumSetpointTerahertz must be finite and >= 0");
        }
        if (channelCount < ChannelId.MIN_VALUE || channelCount > ChannelId.MAX_VALUE) {
            throw new IllegalArgumentException("channelCount must be in range 1–8");
        }
        this.minimumSetpointTerahertz = minimumSetpointTerahertz;
        this.channelCount = channelCount;
    }

    public double minimumSetpointTerahertz() {
        return minimumSetpointTerahertz;
    }

    /**
     * @return a rejection reason, or empty when the request is acceptable
     */
    public Optional<String> check(WriteRequest request) {
        Objects.requireNonNull(request, "request");
        Quantity q = request.quantity();
        double v = request.value();

        if (!q.writable()) {
            return Optional.of(q.wireName() + " is read-only");
        }
        if (request.channel() != null && request.channel().value() > channelCount) {
            return Optional.of("channel " + request.channel().value() + " is not configured");
        }
        if (!Double.isFinite(v)) {
            return Optional.of(q.wireName() + " value must be finite (was " + v + ")");
        }
        switch (q.kind()) {
            case BOOLEAN -> {
                if (v != 0.0 && v != 1.0) {
                    return Optional.of(q.wireName() + " accepts only 0 or 1 (was " + v + ")");
                }
            }
            case INTEGER -> {
                if (v != Math.rint(v)) {
                    return Optional.of(q.wireName() + " must be an integer (was " + v + ")");
                }
            }
            case DOUBLE -> {
            }
        }
        if (q == Quantity.SETPOINT && !(v > minimumSetpointTerahertz)) {
            return Optional.of("setpoint " + v + " THz is not above the minimum of "
                    + minimumSetpointTerahertz + " THz");
        }
        if (q == Quantity.DEVIATION_CHANNEL && (v < 0 || v > channelCount)) {
            return Optional.of("deviation channel must be 0.." + channelCount + " (was " + v + ")");
        }
        return Optional.empty();
    }
}
