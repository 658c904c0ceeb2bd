package com.questrail.wavemeter.time;

import java.time.Duration;
import java.util.Objects;

/**
 * FixedRateTicker
 * =============================================================================
 * Re-arms a task on a {@link MonotonicScheduler} at a fixed monotonic period.
 *
 * <p>Deadlines advance by exactly one period per tick. When the scheduler falls
 * behind, missed slots are dropped rather than replayed in a burst, so a slow
 * consumer sees at most one tick per elapsed period.</p>
 *
 * <p>The ticker only fires; it does not prevent a tick from arriving while
 * the previous tick's work is still running. Consumers that must not overlap
 * (the device owner loop) carry their own guard.</p>
 */
public final class FixedRateTicker {

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final long periodNanos;
    private final Runnable task;

    private final Object lock = new Object();
    private boolean running;
    private long nextDeadlineNanos;
    private Cancellable armed;

    public FixedRateTicker(MonotonicScheduler scheduler, MonotonicClock clock, Duration period, Runnable task) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.task = Objects.requireNonNull(task, "task");
        Objects.requireNonNull(period, "period");
        if (period.isNegative() || period.isZero()) {
            throw new IllegalArgumentException("period must be > 0");
        }
        this.periodNanos = period.toNanos();
    }

    /**
     * Start ticking. The first tick fires one period from now.
     * Idempotent.
     */
    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            running = true;
            nextDeadlineNanos = clock.nowNanos() + periodNanos;
            armed = scheduler.scheduleAtNanos(nextDeadlineNanos, this::fire);
        }
    }

    /**
     * Stop ticking and cancel the armed tick. Idempotent.
     */
    public void stop() {
        synchronized (lock) {
            running = false;
            if (armed != null) {
                armed.cancel();
                armed = null;
            }
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    private void fire() {
        synchronized (lock) {
            if (!running) {
                return;
            }
            long now = clock.nowNanos();
            nextDeadlineNanos += periodNanos;
            if (nextDeadlineNanos <= now) {
                long missed = (now - nextDeadlineNanos) / periodNanos + 1;
                nextDeadlineNanos += missed * periodNanos;
            }
            armed = scheduler.scheduleAtNanos(nextDeadlineNanos, this::fire);
        }
        task.run();
    }
}
