package com.questrail.wavemeter.time;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FixedRateTickerTest {

    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);

    @Test
    void firesOncePerPeriodStartingOnePeriodAfterStart() {
        List<Long> firedAt = new ArrayList<>();
        FixedRateTicker ticker = new FixedRateTicker(scheduler, clock, Duration.ofMillis(100),
                () -> firedAt.add(clock.nowNanos() / 1_000_000));

        ticker.start();
        ticker.start();
        scheduler.advanceAndRun(300, 10);

        assertEquals(List.of(100L, 200L, 300L), firedAt);
    }

    @Test
    void missedSlotsAreDroppedNotReplayed() {
        int[] fired = new int[1];
        FixedRateTicker ticker = new FixedRateTicker(scheduler, clock, Duration.ofMillis(100), () -> fired[0]++);
        ticker.start();

        clock.advanceMillis(350);
        scheduler.runDueTasks();
        assertEquals(1, fired[0]);

        // next deadline is 400, not 200
        clock.advanceMillis(40);
        scheduler.runDueTasks();
        assertEquals(1, fired[0]);
        clock.advanceMillis(10);
        scheduler.runDueTasks();
        assertEquals(2, fired[0]);
    }

    @Test
    void stopCancelsTheArmedTick() {
        int[] fired = new int[1];
        FixedRateTicker ticker = new FixedRateTicker(scheduler, clock, Duration.ofMillis(100), () -> fired[0]++);
        ticker.start();
        ticker.stop();

        scheduler.advanceAndRun(500, 50);

        assertEquals(0, fired[0]);
        assertFalse(ticker.isRunning());
        assertEquals(0, scheduler.pendingTasks());
    }

    @Test
    void periodMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new FixedRateTicker(scheduler, clock, Duration.ZERO, () -> { }));
    }
}
