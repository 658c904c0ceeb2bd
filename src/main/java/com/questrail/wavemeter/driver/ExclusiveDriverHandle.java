package com.questrail.wavemeter.driver;

import com.questrail.wavemeter.api.ChannelId;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * ExclusiveDriverHandle
 * =============================================================================
 * {@link WavemeterDriver} decorator that confines all calls to one thread.
 *
 * <p>The handle binds to the first thread that calls it (normally the device
 * owner thread on its first cycle) or to an explicitly bound thread. Any call
 * from a different thread afterwards fails fast with
 * {@link IllegalStateException} without reaching the driver.</p>
 *
 * <p>This replaces a lock around the driver: the vendor library is
 * non-reentrant, so serializing callers would still allow interleaving across
 * threads it does not tolerate.</p>
 */
public final class ExclusiveDriverHandle implements WavemeterDriver
{
    private final WavemeterDriver delegate;
    private final AtomicReference<Thread> owner = new AtomicReference<>();

    public ExclusiveDriverHandle(WavemeterDriver delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /**
     * Binds the handle to {@code thread}.
     *
     * @throws IllegalStateException if already bound to another thread
     */
    public void bindTo(Thread thread) {
        Objects.requireNonNull(thread, "thread");
        if (!owner.compareAndSet(null, thread) && owner.get() != thread) {
            throw new IllegalStateException("Driver handle already owned by " + owner.get().getName());
        }
    }

    /**
     * Returns {@code true} once an owner thread has been bound.
     */
    public boolean isBound() {
        return owner.get() != null;
    }

    private void checkOwner(String operation) {
        Thread current = Thread.currentThread();
        Thread bound = owner.get();
        if (bound == null) {
            if (owner.compareAndSet(null, current)) {
                return;
            }
            bound = owner.get();
        }
        if (bound != current) {
            throw new IllegalStateException(
                    "Driver call " + operation + " from thread " + current.getName()
                            + " but the driver is owned by " + bound.getName());
        }
    }

    private <T> T call(String operation, Supplier<T> call) {
        checkOwner(operation);
        return call.get();
    }

    private void run(String operation, Runnable call) {
        checkOwner(operation);
        call.run();
    }

    @Override
    public FrequencyReading readChannelFrequency(ChannelId channel) {
        return call("readChannelFrequency", () -> delegate.readChannelFrequency(channel));
    }

    @Override
    public double readDeviationSignal(ChannelId channel) {
        return call("readDeviationSignal", () -> delegate.readDeviationSignal(channel));
    }

    @Override
    public void writeDeviationSignal(ChannelId channel, double millivolts) {
        run("writeDeviationSignal", () -> delegate.writeDeviationSignal(channel, millivolts));
    }

    @Override
    public CcdPair readExposure(ChannelId channel) {
        return call("readExposure", () -> delegate.readExposure(channel));
    }

    @Override
    public CcdPair readAmplitude(ChannelId channel) {
        return call("readAmplitude", () -> delegate.readAmplitude(channel));
    }

    @Override
    public double readChannelSetpoint(ChannelId channel) {
        return call("readChannelSetpoint", () -> delegate.readChannelSetpoint(channel));
    }

    @Override
    public void writeChannelSetpoint(ChannelId channel, double terahertz) {
        run("writeChannelSetpoint", () -> delegate.writeChannelSetpoint(channel, terahertz));
    }

    @Override
    public double readPidSetting(ChannelId channel, PidSettingKey key) {
        return call("readPidSetting", () -> delegate.readPidSetting(channel, key));
    }

    @Override
    public void writePidSetting(ChannelId channel, PidSettingKey key, double value) {
        run("writePidSetting", () -> delegate.writePidSetting(channel, key, value));
    }

    @Override
    public double readBoundsSetting(ChannelId channel, BoundsSettingKey key) {
        return call("readBoundsSetting", () -> delegate.readBoundsSetting(channel, key));
    }

    @Override
    public void writeBoundsSetting(ChannelId channel, BoundsSettingKey key, double value) {
        run("writeBoundsSetting", () -> delegate.writeBoundsSetting(channel, key, value));
    }

    @Override
    public SwitcherFlags readSwitcher(ChannelId channel) {
        return call("readSwitcher", () -> delegate.readSwitcher(channel));
    }

    @Override
    public void writeSwitcher(ChannelId channel, SwitcherFlags flags) {
        run("writeSwitcher", () -> delegate.writeSwitcher(channel, flags));
    }

    @Override
    public double readTemperature() {
        return call("readTemperature", delegate::readTemperature);
    }

    @Override
    public double readPressure() {
        return call("readPressure", delegate::readPressure);
    }

    @Override
    public boolean readAutocalibration() {
        return call("readAutocalibration", delegate::readAutocalibration);
    }

    @Override
    public void writeAutocalibration(boolean enabled) {
        run("writeAutocalibration", () -> delegate.writeAutocalibration(enabled));
    }

    @Override
    public boolean readDeviationMode() {
        return call("readDeviationMode", delegate::readDeviationMode);
    }

    @Override
    public void writeDeviationMode(boolean enabled) {
        run("writeDeviationMode", () -> delegate.writeDeviationMode(enabled));
    }
}
