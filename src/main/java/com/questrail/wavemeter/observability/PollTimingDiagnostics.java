package com.questrail.wavemeter.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * PollTimingDiagnostics
 * =============================================================================
 * Rolling timing statistics of the device owner cycle.
 *
 * <p>Keeps the last {@code window} cycle durations and driver subtotals,
 * separately for plain fast cycles and for cycles that also ran the status
 * poll. A cycle longer than the budget is logged at WARN; every
 * {@code summaryEvery} cycles a one-line summary is logged at INFO.</p>
 *
 * <p>Only {@link #onPollCycle(PollCycleEvent)} and
 * {@link #onPollSkipped(PollSkippedEvent)} are of interest; the other events
 * are ignored.</p>
 */
public final class PollTimingDiagnostics implements WavemeterObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(PollTimingDiagnostics.class);

    public static final int DEFAULT_WINDOW = 200;
    public static final int DEFAULT_SUMMARY_EVERY = 50;
    public static final Duration DEFAULT_BUDGET = Duration.ofMillis(40);

    private final int window;
    private final int summaryEvery;
    private final Duration budget;

    private final Deque<Double> fastMillis = new ArrayDeque<>();
    private final Deque<Double> fastDriverMillis = new ArrayDeque<>();
    private final Deque<Double> statusMillis = new ArrayDeque<>();

    private long cycles;
    private long overBudget;
    private long skipped;

    public PollTimingDiagnostics() {
        this(DEFAULT_WINDOW, DEFAULT_SUMMARY_EVERY, DEFAULT_BUDGET);
    }

    public PollTimingDiagnostics(int window, int summaryEvery, Duration budget) {
        if (window <= 0) throw new IllegalArgumentException("window must be > 0");
        if (summaryEvery <= 0) throw new IllegalArgumentException("summaryEvery must be > 0");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.window = window;
        this.summaryEvery = summaryEvery;
    }

    /**
     * Averages and maxima over the current window.
     */
    public record Summary(
        long cycles,
        long overBudget,
        long skipped,
        double fastAvgMillis,
        double fastMaxMillis,
        double driverAvgMillis,
        double driverMaxMillis,
        double statusAvgMillis,
        double statusMaxMillis
    ) {
    }

    @Override
    public synchronized void onPollCycle(PollCycleEvent event) {
        double cycleMs = toMillis(event.cycleDuration());
        if (event.statusPolled()) {
            push(statusMillis, cycleMs);
        } else {
            push(fastMillis, cycleMs);
            push(fastDriverMillis, toMillis(event.driverDuration()));
            if (event.cycleDuration().compareTo(budget) > 0) {
                overBudget++;
                log.warn("Poll cycle {} took {} ms (budget {} ms, driver {} ms)",
                    event.cycle(), String.format("%.1f", cycleMs), budget.toMillis(),
                    String.format("%.1f", toMillis(event.driverDuration())));
            }
        }

        cycles++;
        if (cycles % summaryEvery == 0) {
            Summary s = summaryLocked();
            log.info("Poll timing: fast avg={} ms max={} ms (driver avg={} ms max={} ms) | status avg={} ms max={} ms | over budget={} skipped={}",
                fmt(s.fastAvgMillis()), fmt(s.fastMaxMillis()),
                fmt(s.driverAvgMillis()), fmt(s.driverMaxMillis()),
                fmt(s.statusAvgMillis()), fmt(s.statusMaxMillis()),
                s.overBudget(), s.skipped());
        }
    }

    @Override
    public synchronized void onPollSkipped(PollSkippedEvent event) {
        skipped = event.skippedTotal();
    }

    @Override
    public void onWriteApplied(WriteAppliedEvent event) {}

    @Override
    public void onWriteRejected(WriteRejectedEvent event) {}

    @Override
    public void onDriverError(DriverErrorEvent event) {}

    public synchronized Summary summary() {
        return summaryLocked();
    }

    private Summary summaryLocked() {
        return new Summary(cycles, overBudget, skipped,
            avg(fastMillis), max(fastMillis),
            avg(fastDriverMillis), max(fastDriverMillis),
            avg(statusMillis), max(statusMillis));
    }

    private void push(Deque<Double> values, double v) {
        if (values.size() == window) {
            values.removeFirst();
        }
        values.addLast(v);
    }

    private static double avg(Deque<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private static double max(Deque<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
    }

    private static double toMillis(Duration d) {
        return d.toNanos() / 1_000_000.0;
    }

    private static String fmt(double ms) {
        return String.format("%.1f", ms);
    }
}
