package com.questrail.wavemeter.state;

import com.questrail.wavemeter.api.ChannelId;

import java.util.Objects;

/**
 * ChannelState
 * -----------------------------------------------------------------------------
 * Immutable latest-known state of one wavemeter channel.
 *
 * <h2>Frequency fields</h2>
 * <ul>
 *   <li>{@code frequency} is the last good sample in THz; it is retained
 *       across "no new sample" and error polls so displays and telemetry
 *       stay continuous</li>
 *   <li>{@code sampled} is {@code false} until the first good sample</li>
 *   <li>{@code frequencyStatus} classifies the most recent poll</li>
 *   <li>{@code frequencyChangeCount} increments only when a genuinely new
 *       sample was stored</li>
 * </ul>
 *
 * <h2>Lock fields</h2>
 * {@code lockEnabled} is the armed state of the regulator for this channel.
 * {@code locked} is the lock-quality (convergence) flag: the latest new
 * sample was within tolerance of the setpoint while regulation was active.
 *
 * <p>{@code signal} carries the CCD exposure and amplitude read by the fast
 * poll alongside the frequency.</p>
 */
public record ChannelState(
        ChannelId channel,
        double frequency,
        boolean sampled,
        FrequencyStatus frequencyStatus,
        long frequencyChangeCount,
        double controlVoltage,
        double setpoint,
        boolean lockEnabled,
        boolean locked,
        boolean switcherUse,
        boolean switcherShow,
        PidSettings pid,
        DeviationSettings deviation,
        BoundsSettings bounds,
        SignalLevels signal
) {
    public ChannelState {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(frequencyStatus, "frequencyStatus");
        Objects.requireNonNull(pid, "pid");
        Objects.requireNonNull(deviation, "deviation");
        Objects.requireNonNull(bounds, "bounds");
        Objects.requireNonNull(signal, "signal");
    }

    public static ChannelState initial(ChannelId channel) {
        return new ChannelState(channel, 0.0, false, FrequencyStatus.NONE, 0L, 0.0, 0.0,
                false, false, false, false,
                PidSettings.defaults(), DeviationSettings.defaults(), BoundsSettings.defaults(),
                SignalLevels.unknown());
    }

    /**
     * Stores a new frequency sample and the lock-quality flag computed for it.
     */
    public ChannelState withFreshSample(double terahertz, boolean lockedNow) {
        return new ChannelState(channel, terahertz, true, FrequencyStatus.FRESH, frequencyChangeCount + 1,
                controlVoltage, setpoint, lockEnabled, lockedNow, switcherUse, switcherShow, pid, deviation, bounds, signal);
    }

    /**
     * Records a poll without a new sample. Value, change count and lock flag stay as they are.
     */
    public ChannelState withNoNewSample() {
        FrequencyStatus status = sampled ? FrequencyStatus.UNCHANGED : FrequencyStatus.NONE;
        return withFrequencyStatus(status);
    }

    /**
     * Records an invalid poll. The last good value remains displayed; lock quality is lost.
     */
    public ChannelState withInvalidSample() {
        return new ChannelState(channel, frequency, sampled, FrequencyStatus.INVALID, frequencyChangeCount,
                controlVoltage, setpoint, lockEnabled, false, switcherUse, switcherShow, pid, deviation, bounds, signal);
    }

    private ChannelState withFrequencyStatus(FrequencyStatus status) {
        return new ChannelState(channel, frequency, sampled, status, frequencyChangeCount,
                controlVoltage, setpoint, lockEnabled, locked, switcherUse, switcherShow, pid, deviation, bounds, signal);
    }

    public ChannelState withControlVoltage(double v) {
        return new ChannelState(channel, frequency, sampled, frequencyStatus, frequencyChangeCount,
                v, setpoint, lockEnabled, locked, switcherUse, switcherShow, pid, deviation, bounds, signal);
    }

    public ChannelState withSetpoint(double v) {
        return new ChannelState(channel, frequency, sampled, frequencyStatus, frequencyChangeCount,
                controlVoltage, v, lockEnabled, locked, switcherUse, switcherShow, pid, deviation, bounds, signal);
    }

    public ChannelState withLockEnabled(boolean v) {
        // Disarming drops lock quality immediately; arming waits for the next sample.
        boolean lockedNow = v && locked;
        return new ChannelState(channel, frequency, sampled, frequencyStatus, frequencyChangeCount,
                controlVoltage, setpoint, v, lockedNow, switcherUse, switcherShow, pid, deviation, bounds, signal);
    }

    public ChannelState withSwitcherUse(boolean v) {
        return new ChannelState(channel, frequency, sampled, frequencyStatus, frequencyChangeCount,
                controlVoltage, setpoint, lockEnabled, locked, v, switcherShow, pid, deviation, bounds, signal);
    }

    public ChannelState withSwitcherShow(boolean v) {
        return new ChannelState(channel, frequency, sampled, frequencyStatus, frequencyChangeCount,
                controlVoltage, setpoint, lockEnabled, locked, switcherUse, v, pid, deviation, bounds, signal);
    }

    public ChannelState withPid(PidSettings v) {
        return new ChannelState(channel, frequency, sampled, frequencyStatus, frequencyChangeCount,
                controlVoltage, setpoint, lockEnabled, locked, switcherUse, switcherShow, v, deviation, bounds, signal);
    }

    public ChannelState withDeviation(DeviationSettings v) {
        return new ChannelState(channel, frequency, sampled, frequencyStatus, frequencyChangeCount,
                controlVoltage, setpoint, lockEnabled, locked, switcherUse, switcherShow, pid, v, bounds, signal);
    }

    public ChannelState withBounds(BoundsSettings v) {
        return new ChannelState(channel, frequency, sampled, frequencyStatus, frequencyChangeCount,
                controlVoltage, setpoint, lockEnabled, locked, switcherUse, switcherShow, pid, deviation, v, signal);
    }

    public ChannelState withSignal(SignalLevels v) {
        return new ChannelState(channel, frequency, sampled, frequencyStatus, frequencyChangeCount,
                controlVoltage, setpoint, lockEnabled, locked, switcherUse, switcherShow, pid, deviation, bounds, v);
    }

    /**
     * The frequency shown to observers: the last good sample, or {@code 0.0} before any.
     */
    public double displayedFrequency() {
        return sampled ? frequency : 0.0;
    }
}
