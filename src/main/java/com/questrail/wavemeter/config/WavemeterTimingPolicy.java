package com.questrail.wavemeter.config;

import java.time.Duration;
import java.util.Objects;

/**
 * WavemeterTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration of the coordinator.
 *
 * <p>This is deliberately <em>operational only</em>: it controls cadences,
 * waits and windows. It does not decide what counts as converged or which
 * writes are legal.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>fastPollPeriod</b> - period of the owner cycle (frequency, control
 *       voltage, write draining)</li>
 *   <li><b>statusPollPeriod</b> - minimum interval between status polls
 *       (globals and per-channel settings); a status poll piggybacks on the
 *       first owner cycle at or after it falls due</li>
 *   <li><b>convergencePollInterval</b> - how often a waiting PROGRAM_VALUE
 *       re-reads the snapshot</li>
 *   <li><b>convergenceTimeout</b> - upper bound of a PROGRAM_VALUE wait</li>
 *   <li><b>requiredConsecutiveLocks</b> - consecutive locked observations that
 *       count as converged</li>
 *   <li><b>telemetryPeriod</b> - heartbeat and frequency publication period</li>
 *   <li><b>pendingMarkerExpiry</b> - how long a local write stays displayed
 *       without a matching read-back</li>
 *   <li><b>writeCoalesceWindow</b> - window in which repeated local writes to
 *       one quantity collapse to the latest value</li>
 *   <li><b>displayFastPeriod</b> / <b>displaySlowPeriod</b> - local observer
 *       pull cadences</li>
 * </ul>
 */
public record WavemeterTimingPolicy(
        Duration fastPollPeriod,
        Duration statusPollPeriod,
        Duration convergencePollInterval,
        Duration convergenceTimeout,
        int requiredConsecutiveLocks,
        Duration telemetryPeriod,
        Duration pendingMarkerExpiry,
        Duration writeCoalesceWindow,
        Duration displayFastPeriod,
        Duration displaySlowPeriod
) {
    /**
     * Canonical constructor with validation.
     */
    public WavemeterTimingPolicy {
        requirePositive(fastPollPeriod, "fastPollPeriod");
        requirePositive(statusPollPeriod, "statusPollPeriod");
        requirePositive(convergencePollInterval, "convergencePollInterval");
        requirePositive(convergenceTimeout, "convergenceTimeout");
        requirePositive(telemetryPeriod, "telemetryPeriod");
        requirePositive(pendingMarkerExpiry, "pendingMarkerExpiry");
        requirePositive(displayFastPeriod, "displayFastPeriod");
        requirePositive(displaySlowPeriod, "displaySlowPeriod");

        Objects.requireNonNull(writeCoalesceWindow, "writeCoalesceWindow");
        if (writeCoalesceWindow.isNegative()) {
            throw new IllegalArgumentException("writeCoalesceWindow must be non-negative");
        }
        if (requiredConsecutiveLocks < 1) {
            throw new IllegalArgumentException("requiredConsecutiveLocks must be >= 1");
        }
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0");
        }
    }

    /**
     * Creates a policy with the production defaults.
     *
     * <p>Default values:</p>
     * <ul>
     *   <li>fastPollPeriod: 100ms</li>
     *   <li>statusPollPeriod: 1000ms</li>
     *   <li>convergencePollInterval: 100ms</li>
     *   <li>convergenceTimeout: 60s</li>
     *   <li>requiredConsecutiveLocks: 2</li>
     *   <li>telemetryPeriod: 100ms</li>
     *   <li>pendingMarkerExpiry: 1s</li>
     *   <li>writeCoalesceWindow: 50ms</li>
     *   <li>displayFastPeriod: 50ms</li>
     *   <li>displaySlowPeriod: 1000ms</li>
     * </ul>
     */
    public static WavemeterTimingPolicy defaults() {
        return new WavemeterTimingPolicy(
                Duration.ofMillis(100),
                Duration.ofMillis(1000),
                Duration.ofMillis(100),
                Duration.ofSeconds(60),
                2,
                Duration.ofMillis(100),
                Duration.ofSeconds(1),
                Duration.ofMillis(50),
                Duration.ofMillis(50),
                Duration.ofMillis(1000)
        );
    }

    public WavemeterTimingPolicy withFastPollPeriod(Duration d) {
        return new WavemeterTimingPolicy(d, statusPollPeriod, convergencePollInterval, convergenceTimeout,
                requiredConsecutiveLocks, telemetryPeriod, pendingMarkerExpiry, writeCoalesceWindow,
                displayFastPeriod, displaySlowPeriod);
    }

    public WavemeterTimingPolicy withStatusPollPeriod(Duration d) {
        return new WavemeterTimingPolicy(fastPollPeriod, d, convergencePollInterval, convergenceTimeout,
                requiredConsecutiveLocks, telemetryPeriod, pendingMarkerExpiry, writeCoalesceWindow,
                displayFastPeriod, displaySlowPeriod);
    }

    public WavemeterTimingPolicy withConvergence(Duration pollInterval, Duration timeout, int requiredLocks) {
        return new WavemeterTimingPolicy(fastPollPeriod, statusPollPeriod, pollInterval, timeout,
                requiredLocks, telemetryPeriod, pendingMarkerExpiry, writeCoalesceWindow,
                displayFastPeriod, displaySlowPeriod);
    }

    public WavemeterTimingPolicy withTelemetryPeriod(Duration d) {
        return new WavemeterTimingPolicy(fastPollPeriod, statusPollPeriod, convergencePollInterval, convergenceTimeout,
                requiredConsecutiveLocks, d, pendingMarkerExpiry, writeCoalesceWindow,
                displayFastPeriod, displaySlowPeriod);
    }
}
