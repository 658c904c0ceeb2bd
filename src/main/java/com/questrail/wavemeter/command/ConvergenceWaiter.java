package com.questrail.wavemeter.command;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.queue.AppliedWrite;
import com.questrail.wavemeter.state.ChannelState;
import com.questrail.wavemeter.state.FrequencyStatus;
import com.questrail.wavemeter.state.SharedStateStore;
import com.questrail.wavemeter.state.WavemeterSnapshot;
import com.questrail.wavemeter.time.MonotonicClock;
import com.questrail.wavemeter.time.Sleeper;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * ConvergenceWaiter
 * =============================================================================
 * Blocks a command worker until a programmed channel has converged, or until
 * the timeout elapses.
 *
 * <h2>Algorithm</h2>
 * Every {@code pollInterval} the waiter re-reads the shared snapshot (never the
 * driver, never holding the store lock while sleeping):
 * <ol>
 *   <li>Until the write's completion future is done, nothing is counted: the
 *       store does not show the programmed value yet.</li>
 *   <li>The baseline is the sample count the owner reported with the applied
 *       write, i.e. the count in the snapshot that first held the read-back.
 *       Samples at or below it predate the write and never count. Samples the
 *       owner stored after the write, even in the same cycle, do.</li>
 *   <li>If the channel is not armed or deviation mode is off once the write is
 *       applied, nothing will regulate it and the wait ends as
 *       {@link Unregulated}.</li>
 *   <li>Each snapshot carrying a new sample (higher change count) is one
 *       observation: locked increments the consecutive counter, not locked
 *       resets it. An invalid reading resets it. A snapshot without a new
 *       sample is not an observation.</li>
 *   <li>Converged once the counter reaches {@code requiredConsecutive}.</li>
 * </ol>
 *
 * <p>The snapshot is checked in the same iteration that sees the write
 * complete, so a reply follows the deciding sample by less than one poll
 * interval.</p>
 *
 * <p>The timeout is measured on the monotonic clock from the start of the
 * wait and checked before every sleep, so a timed-out wait returns at or after
 * the timeout and less than one poll interval later.</p>
 */
public final class ConvergenceWaiter
{
    /**
     * Result of one wait.
     */
    public sealed interface Outcome permits Converged, Unregulated, TimedOut, WriteFailed {
    }

    public record Converged(double readBack, Duration elapsed, long observations) implements Outcome {
    }

    /**
     * The write was applied but the channel is not under regulation.
     */
    public record Unregulated(double readBack) implements Outcome {
    }

    public record TimedOut(Duration elapsed, int consecutiveLocked) implements Outcome {
    }

    public record WriteFailed(String reason) implements Outcome {
    }

    private final SharedStateStore store;
    private final MonotonicClock clock;
    private final Sleeper sleeper;
    private final Duration pollInterval;
    private final Duration timeout;
    private final int requiredConsecutive;

    public ConvergenceWaiter(SharedStateStore store,
                             MonotonicClock clock,
                             Sleeper sleeper,
                             Duration pollInterval,
                             Duration timeout,
                             int requiredConsecutive)
    {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (requiredConsecutive < 1) {
            throw new IllegalArgumentException("requiredConsecutive must be >= 1");
        }
        this.requiredConsecutive = requiredConsecutive;
    }

    /**
     * Waits for {@code channel} to converge after {@code completion} is done.
     *
     * @throws InterruptedException if the worker is interrupted (shutdown)
     */
    public Outcome await(ChannelId channel, CompletableFuture<AppliedWrite> completion) throws InterruptedException {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(completion, "completion");

        long start = clock.nowNanos();
        long timeoutNanos = timeout.toNanos();

        AppliedWrite applied = null;
        long lastCount = -1L;
        int consecutive = 0;
        long observations = 0;

        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("convergence wait interrupted");
            }

            if (applied == null && completion.isDone()) {
                try {
                    applied = completion.get();
                } catch (ExecutionException | CompletionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    return new WriteFailed(String.valueOf(cause.getMessage()));
                } catch (CancellationException e) {
                    return new WriteFailed("write cancelled before it was applied");
                }
                lastCount = applied.frequencyChangeCount();

                WavemeterSnapshot snapshot = store.read();
                if (!snapshot.channel(channel).lockEnabled() || !snapshot.globals().deviationMode()) {
                    return new Unregulated(applied.readBack());
                }
            }

            if (applied != null) {
                ChannelState state = store.read().channel(channel);
                if (state.frequencyStatus() == FrequencyStatus.INVALID) {
                    consecutive = 0;
                } else if (state.frequencyChangeCount() > lastCount) {
                    lastCount = state.frequencyChangeCount();
                    observations++;
                    consecutive = state.locked() ? consecutive + 1 : 0;
                    if (consecutive >= requiredConsecutive) {
                        return new Converged(applied.readBack(),
                                Duration.ofNanos(clock.nowNanos() - start), observations);
                    }
                }
            }

            long elapsed = clock.nowNanos() - start;
            if (elapsed >= timeoutNanos) {
                return new TimedOut(Duration.ofNanos(elapsed), consecutive);
            }
            sleeper.sleep(pollInterval);
        }
    }
}
