package com.questrail.wavemeter.driver;

/**
 * Settings reachable through the vendor PID setting accessor pair.
 *
 * <p>Integer-valued settings are carried as integral doubles.</p>
 */
public enum PidSettingKey
{
    P(false),
    I(false),
    D(false),
    T(false),
    DT(false),
    SENSITIVITY_FACTOR(false),
    POLARITY(true),
    SENSITIVITY_DIMENSION(true),
    SENSITIVITY_EXPONENT(true),
    UNIT(true),
    DEVIATION_CHANNEL(true),
    USE_TA(true),
    CONST_DT(true),
    AUTO_CLEAR_HISTORY(true),
    CLEAR_HISTORY_ON_RANGE_EXCEED(true);

    private final boolean integerValued;

    PidSettingKey(boolean integerValued) {
        this.integerValued = integerValued;
    }

    public boolean integerValued() {
        return integerValued;
    }
}
