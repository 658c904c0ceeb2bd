package com.questrail.wavemeter.driver;

import com.questrail.wavemeter.api.ChannelId;

/**
 * WavemeterDriver
 * =============================================================================
 * Port onto the vendor wavemeter library.
 *
 * <h2>Threading</h2>
 * Implementations are NOT thread-safe and NOT reentrant. Once the device owner
 * loop has started, every call must be made from the owner thread; wrap the
 * driver in an {@link ExclusiveDriverHandle} to enforce this.
 *
 * <h2>Failures</h2>
 * Any call may throw {@link DriverCallException}. Frequency sentinels are not
 * failures; they are reported through {@link FrequencyReading}.
 *
 * <p>Boolean and integer settings are carried as {@code double} values in the
 * same way the vendor library does.</p>
 */
public interface WavemeterDriver
{
    // ---- measurement --------------------------------------------------------

    FrequencyReading readChannelFrequency(ChannelId channel);

    /**
     * Regulator output (deviation signal) of the channel, in mV.
     */
    double readDeviationSignal(ChannelId channel);

    void writeDeviationSignal(ChannelId channel, double millivolts);

    /**
     * Exposure time of each CCD array for the channel, in ms.
     */
    CcdPair readExposure(ChannelId channel);

    /**
     * Peak amplitude of each CCD array for the channel.
     */
    CcdPair readAmplitude(ChannelId channel);

    // ---- regulation ---------------------------------------------------------

    /**
     * Setpoint of the channel, in THz.
     */
    double readChannelSetpoint(ChannelId channel);

    void writeChannelSetpoint(ChannelId channel, double terahertz);

    double readPidSetting(ChannelId channel, PidSettingKey key);

    void writePidSetting(ChannelId channel, PidSettingKey key, double value);

    double readBoundsSetting(ChannelId channel, BoundsSettingKey key);

    void writeBoundsSetting(ChannelId channel, BoundsSettingKey key, double value);

    // ---- switcher -----------------------------------------------------------

    SwitcherFlags readSwitcher(ChannelId channel);

    void writeSwitcher(ChannelId channel, SwitcherFlags flags);

    // ---- instrument ---------------------------------------------------------

    double readTemperature();

    double readPressure();

    boolean readAutocalibration();

    void writeAutocalibration(boolean enabled);

    boolean readDeviationMode();

    void writeDeviationMode(boolean enabled);
}
