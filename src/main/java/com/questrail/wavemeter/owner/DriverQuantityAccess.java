package com.questrail.wavemeter.owner;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.driver.BoundsSettingKey;
import com.questrail.wavemeter.driver.PidSettingKey;
import com.questrail.wavemeter.driver.SwitcherFlags;
import com.questrail.wavemeter.driver.WavemeterDriver;

import java.util.Objects;

import static com.questrail.wavemeter.api.Quantity.decodeBoolean;
import static com.questrail.wavemeter.api.Quantity.encode;

/**
 * DriverQuantityAccess
 * -----------------------------------------------------------------------------
 * Translates quantity-level reads and writes into driver calls.
 *
 * <ul>
 *   <li>{@link Quantity#LOCK_ENABLED} is the deviation-channel PID register:
 *       writing {@code true} points it at the channel itself, {@code false}
 *       writes {@code 0}; reading compares it with the channel number</li>
 *   <li>{@link Quantity#SWITCHER_USE} and {@link Quantity#SWITCHER_SHOW} share
 *       one driver call; a write keeps the other flag as read just before</li>
 * </ul>
 *
 * <p>Owner thread only.</p>
 */
final class DriverQuantityAccess
{
    private final WavemeterDriver driver;

    DriverQuantityAccess(WavemeterDriver driver) {
        this.driver = Objects.requireNonNull(driver, "driver");
    }

    double read(ChannelId channel, Quantity quantity) {
        return switch (quantity) {
            case CONTROL_VOLTAGE -> driver.readDeviationSignal(channel);
            case SETPOINT -> driver.readChannelSetpoint(channel);
            case LOCK_ENABLED -> encode(
                    (int) driver.readPidSetting(channel, PidSettingKey.DEVIATION_CHANNEL) == channel.value());
            case SWITCHER_USE -> encode(driver.readSwitcher(channel).use());
            case SWITCHER_SHOW -> encode(driver.readSwitcher(channel).show());
            case TEMPERATURE -> driver.readTemperature();
            case PRESSURE -> driver.readPressure();
            case AUTOCALIBRATION -> encode(driver.readAutocalibration());
            case DEVIATION_MODE -> encode(driver.readDeviationMode());
            case BOUNDS_MIN, BOUNDS_MAX, BOUNDS_REF_AT, BOUNDS_REF_MID ->
                    driver.readBoundsSetting(channel, boundsKey(quantity));
            case FREQUENCY, LOCKED ->
                    throw new IllegalArgumentException(quantity + " is read through the frequency poll");
            default -> driver.readPidSetting(channel, pidKey(quantity));
        };
    }

    void write(ChannelId channel, Quantity quantity, double value) {
        switch (quantity) {
            case CONTROL_VOLTAGE -> driver.writeDeviationSignal(channel, value);
            case SETPOINT -> driver.writeChannelSetpoint(channel, value);
            case LOCK_ENABLED -> driver.writePidSetting(channel, PidSettingKey.DEVIATION_CHANNEL,
                    decodeBoolean(value) ? channel.value() : 0);
            case SWITCHER_USE -> {
                SwitcherFlags current = driver.readSwitcher(channel);
                driver.writeSwitcher(channel, new SwitcherFlags(decodeBoolean(value), current.show()));
            }
            case SWITCHER_SHOW -> {
                SwitcherFlags current = driver.readSwitcher(channel);
                driver.writeSwitcher(channel, new SwitcherFlags(current.use(), decodeBoolean(value)));
            }
            case AUTOCALIBRATION -> driver.writeAutocalibration(decodeBoolean(value));
            case DEVIATION_MODE -> driver.writeDeviationMode(decodeBoolean(value));
            case BOUNDS_MIN, BOUNDS_MAX, BOUNDS_REF_AT, BOUNDS_REF_MID ->
                    driver.writeBoundsSetting(channel, boundsKey(quantity), value);
            case FREQUENCY, LOCKED, TEMPERATURE, PRESSURE ->
                    throw new IllegalArgumentException(quantity + " is read-only");
            default -> driver.writePidSetting(channel, pidKey(quantity), value);
        }
    }

    /**
     * Driver operation name used in error reports.
     */
    static String operationName(Quantity quantity, boolean write) {
        String verb = write ? "write" : "read";
        return switch (quantity) {
            case CONTROL_VOLTAGE -> verb + "DeviationSignal";
            case SETPOINT -> verb + "ChannelSetpoint";
            case SWITCHER_USE, SWITCHER_SHOW -> verb + "Switcher";
            case TEMPERATURE -> "readTemperature";
            case PRESSURE -> "readPressure";
            case AUTOCALIBRATION -> verb + "Autocalibration";
            case DEVIATION_MODE -> verb + "DeviationMode";
            case BOUNDS_MIN, BOUNDS_MAX, BOUNDS_REF_AT, BOUNDS_REF_MID -> verb + "BoundsSetting(" + quantity.wireName() + ")";
            case FREQUENCY, LOCKED -> "readChannelFrequency";
            default -> verb + "PidSetting(" + quantity.wireName() + ")";
        };
    }

    static PidSettingKey pidKey(Quantity quantity) {
        return switch (quantity) {
            case PID_P -> PidSettingKey.P;
            case PID_I -> PidSettingKey.I;
            case PID_D -> PidSettingKey.D;
            case PID_T -> PidSettingKey.T;
            case PID_DT -> PidSettingKey.DT;
            case PID_USE_TA -> PidSettingKey.USE_TA;
            case PID_CONST_DT -> PidSettingKey.CONST_DT;
            case PID_AUTO_CLEAR_HISTORY -> PidSettingKey.AUTO_CLEAR_HISTORY;
            case PID_CLEAR_HISTORY_ON_RANGE_EXCEED -> PidSettingKey.CLEAR_HISTORY_ON_RANGE_EXCEED;
            case DEVIATION_POLARITY -> PidSettingKey.POLARITY;
            case DEVIATION_SENSITIVITY_FACTOR -> PidSettingKey.SENSITIVITY_FACTOR;
            case DEVIATION_SENSITIVITY_DIMENSION -> PidSettingKey.SENSITIVITY_DIMENSION;
            case DEVIATION_SENSITIVITY_EXPONENT -> PidSettingKey.SENSITIVITY_EXPONENT;
            case DEVIATION_UNIT -> PidSettingKey.UNIT;
            case DEVIATION_CHANNEL -> PidSettingKey.DEVIATION_CHANNEL;
            default -> throw new IllegalArgumentException(quantity + " is not a PID setting");
        };
    }

    static BoundsSettingKey boundsKey(Quantity quantity) {
        return switch (quantity) {
            case BOUNDS_MIN -> BoundsSettingKey.BOUNDS_MIN;
            case BOUNDS_MAX -> BoundsSettingKey.BOUNDS_MAX;
            case BOUNDS_REF_AT -> BoundsSettingKey.REFERENCE_AT;
            case BOUNDS_REF_MID -> BoundsSettingKey.REFERENCE_MID;
            default -> throw new IllegalArgumentException(quantity + " is not a bounds setting");
        };
    }
}
