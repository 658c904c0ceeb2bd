package com.questrail.wavemeter.owner;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.config.WavemeterTimingPolicy;
import com.questrail.wavemeter.driver.CcdPair;
import com.questrail.wavemeter.driver.DriverCallException;
import com.questrail.wavemeter.driver.ExclusiveDriverHandle;
import com.questrail.wavemeter.driver.FrequencyReading;
import com.questrail.wavemeter.driver.SwitcherFlags;
import com.questrail.wavemeter.observability.DriverErrorEvent;
import com.questrail.wavemeter.observability.NullObservabilitySink;
import com.questrail.wavemeter.observability.PollCycleEvent;
import com.questrail.wavemeter.observability.PollSkippedEvent;
import com.questrail.wavemeter.observability.WavemeterObservabilitySink;
import com.questrail.wavemeter.observability.WriteAppliedEvent;
import com.questrail.wavemeter.observability.WriteRejectedEvent;
import com.questrail.wavemeter.observer.PendingMarkerRegistry;
import com.questrail.wavemeter.queue.AppliedWrite;
import com.questrail.wavemeter.queue.EnqueueResult;
import com.questrail.wavemeter.queue.WriteRangePolicy;
import com.questrail.wavemeter.queue.WriteRejectedException;
import com.questrail.wavemeter.queue.WriteRequest;
import com.questrail.wavemeter.queue.WriteRequestQueue;
import com.questrail.wavemeter.state.QuantityValues;
import com.questrail.wavemeter.state.SharedStateStore;
import com.questrail.wavemeter.state.WavemeterSnapshot;
import com.questrail.wavemeter.time.FixedRateTicker;
import com.questrail.wavemeter.time.MonotonicClock;
import com.questrail.wavemeter.time.MonotonicScheduler;
import com.questrail.wavemeter.time.SystemWallClock;
import com.questrail.wavemeter.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * DeviceOwnerLoop
 * =============================================================================
 * The only component that talks to the wavemeter driver once started.
 *
 * <h2>Cycle</h2>
 * A {@link FixedRateTicker} fires every {@code fastPollPeriod}. Each tick
 * hands one cycle to the owner executor (a single dedicated thread in
 * production). A cycle:
 * <ol>
 *   <li>drains the write queue in FIFO order; every request is re-validated,
 *       written, immediately read back, stored, its pending marker cleared, and
 *       only then is its completion future completed</li>
 *   <li>fast poll: frequency, control voltage, CCD exposure and amplitude of
 *       every channel, folded into the store with one update</li>
 *   <li>status poll, when due (first cycle, then every
 *       {@code statusPollPeriod}): instrument readings and every per-channel
 *       setting, folded into the store with one update</li>
 * </ol>
 *
 * <h2>Re-entrancy guard</h2>
 * A tick that arrives while a cycle is in flight is skipped entirely: it is
 * counted and reported, never queued and never run concurrently, and it makes
 * no driver call.
 *
 * <h2>Failure semantics</h2>
 * A failing driver call is reported to the observability sink and leaves its
 * quantity stale for the cycle. Nothing a driver call throws ends the loop;
 * only {@link #stop()} does.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   loop.start()   → arms the ticker
 *   loop.tick()    → (ticker thread) submits one cycle unless one is in flight
 *   loop.stop()    → disarms the ticker, cancels queued writes
 * </pre>
 */
public final class DeviceOwnerLoop {
    private static final Logger log = LoggerFactory.getLogger(DeviceOwnerLoop.class);

    /**
     * Per-channel settings refreshed by the status poll, besides the switcher pair.
     */
    static final Set<Quantity> STATUS_QUANTITIES = EnumSet.of(
            Quantity.SETPOINT,
            Quantity.DEVIATION_CHANNEL,
            Quantity.PID_P, Quantity.PID_I, Quantity.PID_D, Quantity.PID_T, Quantity.PID_DT,
            Quantity.PID_USE_TA, Quantity.PID_CONST_DT,
            Quantity.PID_AUTO_CLEAR_HISTORY, Quantity.PID_CLEAR_HISTORY_ON_RANGE_EXCEED,
            Quantity.DEVIATION_POLARITY, Quantity.DEVIATION_SENSITIVITY_FACTOR,
            Quantity.DEVIATION_SENSITIVITY_DIMENSION, Quantity.DEVIATION_SENSITIVITY_EXPONENT,
            Quantity.DEVIATION_UNIT,
            Quantity.BOUNDS_MIN, Quantity.BOUNDS_MAX, Quantity.BOUNDS_REF_AT, Quantity.BOUNDS_REF_MID
    );

    private static final List<Quantity> GLOBAL_QUANTITIES = List.of(
            Quantity.TEMPERATURE, Quantity.PRESSURE, Quantity.AUTOCALIBRATION, Quantity.DEVIATION_MODE);

    private final ExclusiveDriverHandle driver;
    private final DriverQuantityAccess access;
    private final SharedStateStore store;
    private final WriteRequestQueue queue;
    private final PendingMarkerRegistry pendingMarkers;
    private final List<ChannelId> channels;
    private final WavemeterTimingPolicy timingPolicy;
    private final WriteRangePolicy rangePolicy;
    private final FrequencyNormalizer normalizer;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Executor ownerExecutor;
    private final WavemeterObservabilitySink observabilitySink;
    private final FixedRateTicker ticker;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);
    private final AtomicLong skippedTicks = new AtomicLong();
    private final AtomicLong completedCycles = new AtomicLong();

    // Owner thread only.
    private long lastStatusPollNanos;
    private boolean statusPolledOnce;
    private long driverNanos;
    private int driverErrors;

    public DeviceOwnerLoop(ExclusiveDriverHandle driver,
                           SharedStateStore store,
                           WriteRequestQueue queue,
                           PendingMarkerRegistry pendingMarkers,
                           List<ChannelId> channels,
                           WavemeterTimingPolicy timingPolicy,
                           double lockToleranceTerahertz,
                           MonotonicClock clock,
                           MonotonicScheduler scheduler,
                           Executor ownerExecutor,
                           WavemeterObservabilitySink observabilitySink)
    {
        this.driver = Objects.requireNonNull(driver, "driver");
        this.access = new DriverQuantityAccess(driver);
        this.store = Objects.requireNonNull(store, "store");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.pendingMarkers = Objects.requireNonNull(pendingMarkers, "pendingMarkers");
        this.channels = List.copyOf(Objects.requireNonNull(channels, "channels"));
        this.timingPolicy = Objects.requireNonNull(timingPolicy, "timingPolicy");
        this.rangePolicy = queue.rangePolicy();
        this.normalizer = new FrequencyNormalizer(lockToleranceTerahertz);
        this.clock = Objects.requireNonNull(clock, "clock");
        this.wallClock = SystemWallClock.INSTANCE;
        this.ownerExecutor = Objects.requireNonNull(ownerExecutor, "ownerExecutor");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.ticker = new FixedRateTicker(
                Objects.requireNonNull(scheduler, "scheduler"), clock, timingPolicy.fastPollPeriod(), this::tick);
    }

    /**
     * Arms the poll ticker. Idempotent.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Device owner started: {} channels, fast poll {} ms, status poll {} ms",
                    channels.size(),
                    timingPolicy.fastPollPeriod().toMillis(),
                    timingPolicy.statusPollPeriod().toMillis());
            ticker.start();
        }
    }

    /**
     * Disarms the ticker and cancels every write still queued. A cycle already
     * in flight finishes normally. Idempotent.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            ticker.stop();
            List<WriteRequest> abandoned = queue.drain();
            abandoned.forEach(r -> r.completion().cancel(false));
            log.info("Device owner stopped after {} cycles ({} ticks skipped, {} queued writes cancelled)",
                    completedCycles.get(), skippedTicks.get(), abandoned.size());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long skippedTicks() {
        return skippedTicks.get();
    }

    public long completedCycles() {
        return completedCycles.get();
    }

    /**
     * Entry point of every poll tick. Submits one cycle to the owner executor
     * unless a cycle is still in flight, in which case the tick is dropped.
     *
     * @return {@code true} if a cycle was submitted
     */
    public boolean tick() {
        if (!running.get()) {
            return false;
        }
        if (!cycleInFlight.compareAndSet(false, true)) {
            long skipped = skippedTicks.incrementAndGet();
            observabilitySink.onPollSkipped(new PollSkippedEvent(wallClock.now(), skipped));
            return false;
        }
        try {
            ownerExecutor.execute(this::runGuardedCycle);
            return true;
        } catch (RejectedExecutionException e) {
            cycleInFlight.set(false);
            log.warn("Owner executor rejected a poll cycle; is the runtime shutting down?", e);
            return false;
        }
    }

    private void runGuardedCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.error("Unexpected failure in device owner cycle", e);
            observabilitySink.onDriverError(new DriverErrorEvent(
                    wallClock.now(), "ownerCycle", String.valueOf(e.getMessage()), e));
        } finally {
            cycleInFlight.set(false);
        }
    }

    /**
     * Runs one full cycle on the calling thread. Must only be called on the
     * owner thread (directly from tests, or through {@link #tick()}).
     */
    void runCycle() {
        long cycleStart = clock.nowNanos();
        driverNanos = 0L;
        driverErrors = 0;

        int writesApplied = drainWrites();
        pollFast();

        boolean statusDue = isStatusPollDue(cycleStart);
        if (statusDue) {
            pollStatus();
            lastStatusPollNanos = cycleStart;
            statusPolledOnce = true;
        }

        long cycle = completedCycles.incrementAndGet();
        observabilitySink.onPollCycle(new PollCycleEvent(
                wallClock.now(),
                cycle,
                Duration.ofNanos(clock.nowNanos() - cycleStart),
                Duration.ofNanos(driverNanos),
                writesApplied,
                statusDue,
                driverErrors,
                store.read().revision()));
    }

    private boolean isStatusPollDue(long now) {
        if (!statusPolledOnce) {
            return true;
        }
        // Half a fast period of slack keeps tick jitter from pushing the status poll one cycle late.
        long slack = timingPolicy.fastPollPeriod().toNanos() / 2;
        return now - lastStatusPollNanos >= timingPolicy.statusPollPeriod().toNanos() - slack;
    }

    // -------------------------------------------------------------------------
    // Writes
    // -------------------------------------------------------------------------

    private int drainWrites() {
        int applied = 0;
        for (WriteRequest request : queue.drain()) {
            if (applyWrite(request)) {
                applied++;
            }
        }
        return applied;
    }

    private boolean applyWrite(WriteRequest request) {
        if (request.completion().isDone()) {
            // Cancelled by its producer before the owner got to it.
            return false;
        }

        Optional<String> rejection = rangePolicy.check(request);
        if (rejection.isPresent()) {
            log.warn("Dropping {} write {} = {}: {}",
                    request.origin(), request.target(), request.value(), rejection.get());
            observabilitySink.onWriteRejected(new WriteRejectedEvent(
                    wallClock.now(), request.target(), request.value(), request.origin(), rejection.get()));
            request.completion().completeExceptionally(
                    new WriteRejectedException(EnqueueResult.REJECTED_OUT_OF_RANGE, rejection.get()));
            return false;
        }

        ChannelId channel = request.channel();
        Quantity quantity = request.quantity();

        Optional<DriverCallException> writeFailure = guardedRun(
                DriverQuantityAccess.operationName(quantity, true),
                () -> access.write(channel, quantity, request.value()));
        if (writeFailure.isPresent()) {
            request.completion().completeExceptionally(writeFailure.get());
            return false;
        }

        String readOperation = DriverQuantityAccess.operationName(quantity, false);
        Optional<Double> readBack = guardedRead(readOperation, () -> access.read(channel, quantity));
        if (readBack.isEmpty()) {
            request.completion().completeExceptionally(
                    new DriverCallException(readOperation, "read-back after write failed"));
            return false;
        }

        double value = readBack.get();
        WavemeterSnapshot stored = store.update(s -> QuantityValues.apply(s, channel, quantity, value));
        pendingMarkers.clearIfMatches(channel, quantity, value);

        // The store already holds the read-back when the producer is released.
        long sampleCount = channel == null ? 0L : stored.channel(channel).frequencyChangeCount();
        request.completion().complete(new AppliedWrite(value, sampleCount));
        observabilitySink.onWriteApplied(new WriteAppliedEvent(
                wallClock.now(), request.target(), request.value(), value, request.origin()));
        return true;
    }

    // -------------------------------------------------------------------------
    // Polls
    // -------------------------------------------------------------------------

    private record ChannelMeasurement(ChannelId channel,
                                      FrequencyReading frequency,
                                      Double controlVoltage,
                                      CcdPair exposure,
                                      CcdPair amplitude) {
    }

    private record StoredValue(ChannelId channel, Quantity quantity, double value) {
    }

    private void pollFast() {
        List<ChannelMeasurement> measurements = new ArrayList<>(channels.size());
        for (ChannelId channel : channels) {
            FrequencyReading frequency = guardedCall("readChannelFrequency",
                    () -> driver.readChannelFrequency(channel)).orElse(null);
            Double voltage = guardedRead("readDeviationSignal",
                    () -> driver.readDeviationSignal(channel)).orElse(null);
            CcdPair exposure = guardedCall("readExposure", () -> driver.readExposure(channel)).orElse(null);
            CcdPair amplitude = guardedCall("readAmplitude", () -> driver.readAmplitude(channel)).orElse(null);
            measurements.add(new ChannelMeasurement(channel, frequency, voltage, exposure, amplitude));
        }

        store.update(snapshot -> {
            boolean deviationMode = snapshot.globals().deviationMode();
            WavemeterSnapshot next = snapshot;
            for (ChannelMeasurement m : measurements) {
                if (m.frequency() != null) {
                    next = next.withChannel(m.channel(), c -> normalizer.apply(c, m.frequency(), deviationMode));
                }
                if (m.controlVoltage() != null) {
                    double v = m.controlVoltage();
                    next = next.withChannel(m.channel(), c -> c.withControlVoltage(v));
                }
                if (m.exposure() != null) {
                    CcdPair e = m.exposure();
                    next = next.withChannel(m.channel(), c -> c.withSignal(c.signal().withExposure(e.first(), e.second())));
                }
                if (m.amplitude() != null) {
                    CcdPair a = m.amplitude();
                    next = next.withChannel(m.channel(), c -> c.withSignal(c.signal().withAmplitude(a.first(), a.second())));
                }
            }
            return next;
        });
    }

    private void pollStatus() {
        List<StoredValue> values = new ArrayList<>();

        for (Quantity q : GLOBAL_QUANTITIES) {
            guardedRead(DriverQuantityAccess.operationName(q, false), () -> access.read(null, q))
                    .ifPresent(v -> values.add(new StoredValue(null, q, v)));
        }

        for (ChannelId channel : channels) {
            guardedCall("readSwitcher", () -> driver.readSwitcher(channel)).ifPresent((SwitcherFlags f) -> {
                values.add(new StoredValue(channel, Quantity.SWITCHER_USE, Quantity.encode(f.use())));
                values.add(new StoredValue(channel, Quantity.SWITCHER_SHOW, Quantity.encode(f.show())));
            });
            for (Quantity q : STATUS_QUANTITIES) {
                guardedRead(DriverQuantityAccess.operationName(q, false), () -> access.read(channel, q))
                        .ifPresent(v -> values.add(new StoredValue(channel, q, v)));
            }
        }

        store.update(snapshot -> {
            WavemeterSnapshot next = snapshot;
            for (StoredValue v : values) {
                next = QuantityValues.apply(next, v.channel(), v.quantity(), v.value());
            }
            return next;
        });
    }

    // -------------------------------------------------------------------------
    // Guarded driver calls
    // -------------------------------------------------------------------------

    private Optional<Double> guardedRead(String operation, DoubleSupplier call) {
        return guardedCall(operation, call::getAsDouble);
    }

    private Optional<DriverCallException> guardedRun(String operation, Runnable call) {
        long start = clock.nowNanos();
        try {
            call.run();
            return Optional.empty();
        } catch (RuntimeException e) {
            return Optional.of(reportFailure(operation, e));
        } finally {
            driverNanos += clock.nowNanos() - start;
        }
    }

    private <T> Optional<T> guardedCall(String operation, Supplier<T> call) {
        long start = clock.nowNanos();
        try {
            return Optional.ofNullable(call.get());
        } catch (RuntimeException e) {
            reportFailure(operation, e);
            return Optional.empty();
        } finally {
            driverNanos += clock.nowNanos() - start;
        }
    }

    private DriverCallException reportFailure(String operation, RuntimeException e) {
        driverErrors++;
        DriverCallException failure = (e instanceof DriverCallException dce)
                ? dce
                : new DriverCallException(operation, String.valueOf(e.getMessage()), e);
        observabilitySink.onDriverError(new DriverErrorEvent(wallClock.now(), operation, failure.getMessage(), e));
        return failure;
    }
}
