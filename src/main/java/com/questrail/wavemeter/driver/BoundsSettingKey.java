package com.questrail.wavemeter.driver;

/**
 * Settings reachable through the vendor laser-control setting accessor pair.
 */
public enum BoundsSettingKey
{
    BOUNDS_MIN,
    BOUNDS_MAX,
    REFERENCE_AT,
    /** {@code 1} = reference auto-centered between the bounds, {@code 0} = explicit reference. */
    REFERENCE_MID
}
