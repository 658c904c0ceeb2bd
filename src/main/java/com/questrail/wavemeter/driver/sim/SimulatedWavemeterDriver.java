package com.questrail.wavemeter.driver.sim;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.driver.BoundsSettingKey;
import com.questrail.wavemeter.driver.CcdPair;
import com.questrail.wavemeter.driver.FrequencyReading;
import com.questrail.wavemeter.driver.PidSettingKey;
import com.questrail.wavemeter.driver.SwitcherFlags;
import com.questrail.wavemeter.driver.WavemeterDriver;
import com.questrail.wavemeter.driver.WavemeterErrorCode;
import com.questrail.wavemeter.time.MonotonicClock;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;

/**
 * SimulatedWavemeterDriver
 * =============================================================================
 * In-process stand-in for the vendor library, used by {@code WavemeterServerMain}
 * when no hardware binding is installed.
 *
 * <h2>Model</h2>
 * <ul>
 *   <li>Each channel carries a laser frequency that random-walks around its
 *       free-running value</li>
 *   <li>While deviation mode is on and the channel's deviation channel points
 *       at itself, the frequency relaxes toward the setpoint each sample</li>
 *   <li>A new sample becomes available every {@code exposure}; reads in
 *       between return the "nothing changed" sentinel</li>
 *   <li>Channels with {@code use} off report {@link WavemeterErrorCode#NO_SIGNAL}
 *       and zero amplitude</li>
 * </ul>
 *
 * <p>Not thread-safe, exactly like the library it stands in for.</p>
 */
public final class SimulatedWavemeterDriver implements WavemeterDriver
{
    private static final double RELAXATION = 0.5;
    private static final double JITTER_THZ = 1.0e-6;
    private static final int PEAK_AMPLITUDE = 2400;

    private final MonotonicClock clock;
    private final long exposureNanos;
    private final Random random;
    private final Map<ChannelId, SimChannel> channels = new TreeMap<>();

    private boolean autocalibration;
    private boolean deviationMode;

    public SimulatedWavemeterDriver(MonotonicClock clock, List<ChannelId> channelIds, long exposureNanos, long seed) {
        this.clock = Objects.requireNonNull(clock, "clock");
        if (exposureNanos <= 0) {
            throw new IllegalArgumentException("exposureNanos must be > 0");
        }
        this.exposureNanos = exposureNanos;
        this.random = new Random(seed);
        for (ChannelId id : channelIds) {
            double freeRunning = 300.0 + 10.0 * id.value() + random.nextDouble();
            channels.put(id, new SimChannel(freeRunning));
        }
    }

    private SimChannel channel(ChannelId id) {
        SimChannel c = channels.get(Objects.requireNonNull(id, "channel"));
        if (c == null) {
            return new SimChannel(0.0).unavailable();
        }
        return c;
    }

    @Override
    public FrequencyReading readChannelFrequency(ChannelId id) {
        SimChannel c = channel(id);
        if (c.missing) {
            return FrequencyReading.classify(WavemeterErrorCode.CHANNEL_NOT_AVAILABLE.code());
        }
        if (!c.use) {
            return FrequencyReading.classify(WavemeterErrorCode.NO_SIGNAL.code());
        }
        long now = clock.nowNanos();
        if (c.lastSampleNanos != Long.MIN_VALUE && now - c.lastSampleNanos < exposureNanos) {
            return FrequencyReading.classify(WavemeterErrorCode.NOTHING_CHANGED);
        }
        c.lastSampleNanos = now;

        boolean regulating = deviationMode && c.deviationChannel == id.value() && c.setpoint > 0.0;
        double target = regulating ? c.setpoint : c.freeRunning;
        c.frequency += (target - c.frequency) * RELAXATION;
        if (!regulating || Math.abs(target - c.frequency) > JITTER_THZ) {
            c.frequency += (random.nextDouble() - 0.5) * JITTER_THZ;
        }
        c.deviationSignal = regulating ? (c.setpoint - c.frequency) * 1.0e6 : c.deviationSignal;
        return FrequencyReading.classify(c.frequency);
    }

    @Override
    public double readDeviationSignal(ChannelId id) {
        return channel(id).deviationSignal;
    }

    @Override
    public void writeDeviationSignal(ChannelId id, double millivolts) {
        channel(id).deviationSignal = millivolts;
    }

    @Override
    public CcdPair readExposure(ChannelId id) {
        double millis = exposureNanos / 1.0e6;
        return new CcdPair(millis, millis);
    }

    @Override
    public CcdPair readAmplitude(ChannelId id) {
        SimChannel c = channel(id);
        if (c.missing || !c.use) {
            return new CcdPair(0.0, 0.0);
        }
        return new CcdPair(PEAK_AMPLITUDE + random.nextInt(50), PEAK_AMPLITUDE / 2 + random.nextInt(50));
    }

    @Override
    public double readChannelSetpoint(ChannelId id) {
        return channel(id).setpoint;
    }

    @Override
    public void writeChannelSetpoint(ChannelId id, double terahertz) {
        // The instrument keeps nine decimals.
        channel(id).setpoint = Math.round(terahertz * 1.0e9) / 1.0e9;
    }

    @Override
    public double readPidSetting(ChannelId id, PidSettingKey key) {
        SimChannel c = channel(id);
        if (key == PidSettingKey.DEVIATION_CHANNEL) {
            return c.deviationChannel;
        }
        return c.pid.getOrDefault(key, 0.0);
    }

    @Override
    public void writePidSetting(ChannelId id, PidSettingKey key, double value) {
        SimChannel c = channel(id);
        double stored = key.integerValued() ? Math.rint(value) : value;
        if (key == PidSettingKey.DEVIATION_CHANNEL) {
            c.deviationChannel = (int) stored;
        } else {
            c.pid.put(key, stored);
        }
    }

    @Override
    public double readBoundsSetting(ChannelId id, BoundsSettingKey key) {
        return channel(id).bounds.getOrDefault(key, key == BoundsSettingKey.REFERENCE_MID ? 1.0 : 0.0);
    }

    @Override
    public void writeBoundsSetting(ChannelId id, BoundsSettingKey key, double value) {
        channel(id).bounds.put(key, key == BoundsSettingKey.REFERENCE_MID ? Math.rint(value) : value);
    }

    @Override
    public SwitcherFlags readSwitcher(ChannelId id) {
        SimChannel c = channel(id);
        return new SwitcherFlags(c.use, c.show);
    }

    @Override
    public void writeSwitcher(ChannelId id, SwitcherFlags flags) {
        SimChannel c = channel(id);
        c.use = flags.use();
        c.show = flags.show();
    }

    @Override
    public double readTemperature() {
        return 24.0 + (random.nextDouble() - 0.5) * 0.01;
    }

    @Override
    public double readPressure() {
        return 1013.0 + (random.nextDouble() - 0.5) * 0.1;
    }

    @Override
    public boolean readAutocalibration() {
        return autocalibration;
    }

    @Override
    public void writeAutocalibration(boolean enabled) {
        this.autocalibration = enabled;
    }

    @Override
    public boolean readDeviationMode() {
        return deviationMode;
    }

    @Override
    public void writeDeviationMode(boolean enabled) {
        this.deviationMode = enabled;
    }

    private static final class SimChannel {
        final double freeRunning;
        final Map<PidSettingKey, Double> pid = new EnumMap<>(PidSettingKey.class);
        final Map<BoundsSettingKey, Double> bounds = new EnumMap<>(BoundsSettingKey.class);

        double frequency;
        double setpoint;
        double deviationSignal;
        int deviationChannel;
        boolean use = true;
        boolean show = true;
        boolean missing;
        long lastSampleNanos = Long.MIN_VALUE;

        SimChannel(double freeRunning) {
            this.freeRunning = freeRunning;
            this.frequency = freeRunning;
        }

        SimChannel unavailable() {
            this.missing = true;
            return this;
        }
    }
}
