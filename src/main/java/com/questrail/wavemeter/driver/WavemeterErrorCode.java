package com.questrail.wavemeter.driver;

import java.util.Arrays;
import java.util.Optional;

/**
 * Sentinel values the vendor driver returns in place of a frequency.
 *
 * <p>All sentinels are non-positive; any positive return value is a
 * measurement in THz. {@code -7} ("nothing changed") is deliberately absent:
 * it is not an error and is classified as {@link FrequencyReading.NoNewSample}.</p>
 */
public enum WavemeterErrorCode
{
    NO_VALUE(0),
    NO_SIGNAL(-1),
    BAD_SIGNAL(-2),
    LOW_SIGNAL(-3),
    BIG_SIGNAL(-4),
    WLM_MISSING(-5),
    NOT_AVAILABLE(-6),
    NO_PULSE(-8),
    CHANNEL_NOT_AVAILABLE(-10),
    DIV_0(-13),
    OUT_OF_RANGE(-14),
    UNIT_NOT_AVAILABLE(-15),
    UNKNOWN(Integer.MIN_VALUE);

    /**
     * Raw value meaning "no new sample since the last call".
     */
    public static final int NOTHING_CHANGED = -7;

    private final int code;

    WavemeterErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<WavemeterErrorCode> fromCode(int code) {
        return Arrays.stream(values()).filter(e -> e != UNKNOWN && e.code == code).findFirst();
    }
}
