package com.questrail.wavemeter.driver;

import java.util.Objects;

/**
 * FrequencyReading
 * =============================================================================
 * Tri-state result of a frequency read.
 *
 * <ul>
 *   <li>{@link Sample} - a new measurement in THz</li>
 *   <li>{@link NoNewSample} - the instrument has nothing new; not an error</li>
 *   <li>{@link Invalid} - a hard error sentinel</li>
 * </ul>
 *
 * <p>Raw vendor doubles are classified exactly once, here, so that no other
 * layer ever treats a sentinel as a frequency.</p>
 */
public sealed interface FrequencyReading
        permits FrequencyReading.Sample, FrequencyReading.NoNewSample, FrequencyReading.Invalid
{
    record Sample(double terahertz) implements FrequencyReading {
        public Sample {
            if (!(terahertz > 0.0) || Double.isInfinite(terahertz)) {
                throw new IllegalArgumentException("frequency sample must be a positive finite value (was " + terahertz + ")");
            }
        }
    }

    enum NoNewSample implements FrequencyReading {
        INSTANCE
    }

    record Invalid(WavemeterErrorCode error, double raw) implements FrequencyReading {
        public Invalid {
            Objects.requireNonNull(error, "error");
        }
    }

    static FrequencyReading noNewSample() {
        return NoNewSample.INSTANCE;
    }

    /**
     * Classifies a raw return value of the vendor frequency call.
     */
    static FrequencyReading classify(double raw) {
        if (raw > 0.0 && !Double.isInfinite(raw)) {
            return new Sample(raw);
        }
        if (Double.isNaN(raw) || Double.isInfinite(raw)) {
            return new Invalid(WavemeterErrorCode.UNKNOWN, raw);
        }
        if (raw == WavemeterErrorCode.NOTHING_CHANGED) {
            return NoNewSample.INSTANCE;
        }
        int code = (int) raw;
        WavemeterErrorCode error = (code == raw)
                ? WavemeterErrorCode.fromCode(code).orElse(WavemeterErrorCode.UNKNOWN)
                : WavemeterErrorCode.UNKNOWN;
        return new Invalid(error, raw);
    }
}
