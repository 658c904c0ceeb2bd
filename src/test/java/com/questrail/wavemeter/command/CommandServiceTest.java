package com.questrail.wavemeter.command;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.config.WavemeterTimingPolicy;
import com.questrail.wavemeter.driver.ExclusiveDriverHandle;
import com.questrail.wavemeter.driver.PidSettingKey;
import com.questrail.wavemeter.driver.ScriptedWavemeterDriver;
import com.questrail.wavemeter.observability.NullObservabilitySink;
import com.questrail.wavemeter.observer.CoalescingWriteProducer;
import com.questrail.wavemeter.observer.DisplayState;
import com.questrail.wavemeter.observer.PendingMarkerRegistry;
import com.questrail.wavemeter.owner.DeviceOwnerLoop;
import com.questrail.wavemeter.queue.EnqueueResult;
import com.questrail.wavemeter.queue.WriteRangePolicy;
import com.questrail.wavemeter.queue.WriteRequestQueue;
import com.questrail.wavemeter.state.SharedStateStore;
import com.questrail.wavemeter.state.WavemeterSnapshot;
import com.questrail.wavemeter.time.DeterministicScheduler;
import com.questrail.wavemeter.time.ManualMonotonicClock;
import com.questrail.wavemeter.time.ManualSleeper;
import com.questrail.wavemeter.time.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandServiceTest
 * -----------------------------------------------------------------------------
 * Commands executed against a real owner loop and a scripted driver. Each
 * convergence-wait sleep advances the manual clock and runs one owner cycle.
 */
class CommandServiceTest {

    private static final ChannelId CH1 = ChannelId.of(1);
    private static final ChannelId CH3 = ChannelId.of(3);
    private static final List<ChannelId> CHANNELS = ChannelId.range(4);

    private ManualMonotonicClock clock;
    private ScriptedWavemeterDriver driver;
    private SharedStateStore store;
    private WriteRequestQueue queue;
    private PendingMarkerRegistry pendingMarkers;
    private CoalescingWriteProducer localWrites;
    private DeviceOwnerLoop owner;
    private boolean ownerRunsWhileWaiting;
    private CommandService service;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        driver = new ScriptedWavemeterDriver(CHANNELS);
        store = new SharedStateStore(WavemeterSnapshot.initial(CHANNELS));
        queue = new WriteRequestQueue(4, new WriteRangePolicy(1.0, CHANNELS.size()));
        WavemeterTimingPolicy timing = WavemeterTimingPolicy.defaults();
        pendingMarkers = new PendingMarkerRegistry(clock, timing.pendingMarkerExpiry());
        localWrites = new CoalescingWriteProducer(queue, pendingMarkers, clock, new DeterministicScheduler(clock), Duration.ZERO);

        owner = new DeviceOwnerLoop(
                new ExclusiveDriverHandle(driver),
                store,
                queue,
                pendingMarkers,
                CHANNELS,
                timing,
                5.0e-6,
                clock,
                new DeterministicScheduler(clock),
                Runnable::run,
                NullObservabilitySink.INSTANCE);
        owner.start();

        ownerRunsWhileWaiting = true;
        ManualSleeper sleeper = new ManualSleeper(clock, n -> {
            if (ownerRunsWhileWaiting) {
                owner.tick();
            }
        });
        ConvergenceWaiter waiter = new ConvergenceWaiter(store, clock, sleeper,
                timing.convergencePollInterval(), timing.convergenceTimeout(), timing.requiredConsecutiveLocks());
        service = new CommandService(store, queue, waiter, clock);
    }

    @AfterEach
    void tearDown() {
        owner.stop();
    }

    private void armChannel(ChannelId channel) {
        driver.presetDeviationMode(true);
        driver.presetPid(channel, PidSettingKey.DEVIATION_CHANNEL, channel.value());
        owner.tick();
    }

    @Test
    void helloSucceeds() {
        assertEquals("{\"status\":\"SUCCESS\"}", service.handleLine("{\"action\":\"HELLO\"}"));
        assertEquals("{\"status\":\"SUCCESS\"}", service.handleLine("{\"action\":\"HELLO\",\"connection\":9}"));
    }

    @Test
    void programValueWithWaitConvergesAndCheckValueReportsTheSetpoint() {
        driver.presetDeviationMode(true);
        driver.presetPid(CH3, PidSettingKey.DEVIATION_CHANNEL, 3);
        driver.enqueueSamples(CH3, 348.66641, 348.66641, 348.66641, 348.66641, 348.66641, 348.66641);
        owner.tick();

        CommandResponse programmed = service.handle(CommandRequest.programValue(CH3, Quantity.SETPOINT, 348.66641, true));

        assertEquals(CommandStatus.SUCCESS, programmed.status());
        assertEquals(CommandResponse.RESULT_CONVERGED, programmed.result());
        assertEquals(348.66641, programmed.value());

        CommandResponse checked = service.handle(CommandRequest.checkValue(CH3, Quantity.SETPOINT));
        assertEquals(CommandStatus.SUCCESS, checked.status());
        assertEquals("348.666410000", String.format(Locale.ROOT, "%.9f", checked.value()));
        assertTrue(driver.calls().contains("writeChannelSetpoint 3 348.66641"));
    }

    @Test
    void convergedReplyFollowsSecondLockedPollWithinOnePollPeriod() {
        armChannel(CH3);
        driver.enqueueSamples(CH3, new double[] {
                348.66641, 348.66641, 348.66641, 348.66641, 348.66641,
                348.66641, 348.66641, 348.66641, 348.66641, 348.66641});

        // The owner ticks half a poll period after each waiter poll.
        List<Long> lockedPollsAt = new ArrayList<>();
        Sleeper outOfPhase = d -> {
            clock.advance(d.dividedBy(2));
            owner.tick();
            if (store.read().channel(CH3).locked()) {
                lockedPollsAt.add(clock.nowNanos());
            }
            clock.advance(d.dividedBy(2));
        };
        WavemeterTimingPolicy timing = WavemeterTimingPolicy.defaults();
        ConvergenceWaiter waiter = new ConvergenceWaiter(store, clock, outOfPhase,
                timing.convergencePollInterval(), timing.convergenceTimeout(), timing.requiredConsecutiveLocks());
        CommandService outOfPhaseService = new CommandService(store, queue, waiter, clock);

        CommandResponse r = outOfPhaseService.handle(CommandRequest.programValue(CH3, Quantity.SETPOINT, 348.66641, true));

        assertEquals(CommandResponse.RESULT_CONVERGED, r.result());
        assertTrue(lockedPollsAt.size() >= 2);
        long latency = clock.nowNanos() - lockedPollsAt.get(1);
        assertTrue(latency < timing.convergencePollInterval().toNanos(), "latency " + latency + " ns");
    }

    @Test
    void programValueWithWaitOnUnregulatedChannelReturnsOnceApplied() {
        long start = clock.nowNanos();

        CommandResponse r = service.handle(CommandRequest.programValue(CH1, Quantity.SETPOINT, 350.0, true));

        assertEquals(CommandStatus.SUCCESS, r.status());
        assertEquals(CommandResponse.RESULT_APPLIED, r.result());
        assertEquals(350.0, r.value());
        assertEquals(Duration.ofMillis(100), Duration.ofNanos(clock.nowNanos() - start));
    }

    @Test
    void localSetpointWriteReachesCheckValueAfterOneOwnerCycle() {
        assertEquals(EnqueueResult.ACCEPTED, localWrites.submit(CH3, Quantity.SETPOINT, 348.66641));

        owner.tick();

        List<String> calls = driver.calls();
        int written = calls.indexOf("writeChannelSetpoint 3 348.66641");
        assertTrue(written >= 0, calls.toString());
        assertEquals("readChannelSetpoint 3", calls.get(written + 1));
        assertTrue(pendingMarkers.active(CH3, Quantity.SETPOINT).isEmpty());

        String reply = service.handleLine("{\"action\":\"CHECK_VALUE\",\"connection\":3,\"quantity\":\"Setpoint\"}");
        assertEquals("{\"status\":\"SUCCESS\",\"value\":348.66641}", reply);
        CommandResponse checked = service.handle(CommandRequest.checkValue(CH3, Quantity.SETPOINT));
        assertEquals("348.666410000", String.format(Locale.ROOT, "%.9f", checked.value()));
    }

    @Test
    void checkValueReportsStoredValueWhileLocalWriteIsPending() {
        driver.presetSetpoint(CH1, 350.5);
        owner.tick();

        localWrites.submit(CH1, Quantity.SETPOINT, 351.0);

        assertEquals(350.5, service.handle(CommandRequest.checkValue(CH1, Quantity.SETPOINT)).value());
        DisplayState display = new DisplayState(store.read(), pendingMarkers.activeMarkers());
        assertTrue(display.isPending(CH1, Quantity.SETPOINT));
        assertEquals(351.0, display.value(CH1, Quantity.SETPOINT));

        owner.tick();

        assertEquals(351.0, service.handle(CommandRequest.checkValue(CH1, Quantity.SETPOINT)).value());
        assertTrue(pendingMarkers.activeMarkers().isEmpty());
    }

    @Test
    void programValueWithoutWaitIsQueued() {
        String reply = service.handleLine(
                "{\"action\":\"PROGRAM_VALUE\",\"connection\":1,\"value\":\"350,25\"}");

        assertEquals("{\"status\":\"SUCCESS\",\"result\":\"QUEUED\"}", reply);
        assertEquals(1, queue.size());
    }

    @Test
    void checkValueNeverSeesQueuedRemoteWrites() {
        service.handle(CommandRequest.programValue(CH1, Quantity.SETPOINT, 351.0, false));

        assertEquals(0.0, service.handle(CommandRequest.checkValue(CH1, Quantity.SETPOINT)).value());

        owner.tick();
        assertEquals(351.0, service.handle(CommandRequest.checkValue(CH1, Quantity.SETPOINT)).value());
    }

    @Test
    void checkValueOfInstrumentQuantityNeedsNoChannel() {
        driver.presetDeviationMode(true);
        owner.tick();

        CommandResponse r = service.handle(CommandRequest.checkValue(null, Quantity.DEVIATION_MODE));

        assertEquals(CommandStatus.SUCCESS, r.status());
        assertEquals(1.0, r.value());
    }

    @Test
    void timeoutWhenTheChannelNeverLocks() {
        armChannel(CH1);

        CommandResponse r = service.handle(CommandRequest.programValue(CH1, Quantity.SETPOINT, 350.0, true));

        assertEquals(CommandStatus.TIMEOUT, r.status());
        assertEquals("Timeout waiting for lock on channel 1 after 60000 ms", r.message());
    }

    @Test
    void failedWriteIsReportedAsError() {
        driver.failOn("writeChannelSetpoint");

        CommandResponse r = service.handle(CommandRequest.programValue(CH1, Quantity.SETPOINT, 350.0, true));

        assertEquals(CommandStatus.ERROR, r.status());
        assertTrue(r.message().startsWith("Write failed"), r.message());
    }

    @Test
    void interruptedWaitReportsShutdown() {
        ownerRunsWhileWaiting = false;
        Thread.currentThread().interrupt();
        try {
            CommandResponse r = service.handle(CommandRequest.programValue(CH1, Quantity.SETPOINT, 350.0, true));
            assertEquals(CommandStatus.ERROR, r.status());
            assertEquals("Interrupted: server shutting down", r.message());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void validationErrors() {
        assertEquals("Missing connection",
                service.handle(new CommandRequest(CommandAction.CHECK_VALUE, null, Quantity.SETPOINT, null, false)).message());
        assertEquals("Missing value",
                service.handle(new CommandRequest(CommandAction.PROGRAM_VALUE, CH1, Quantity.SETPOINT, null, false)).message());
        assertEquals("Frequency is read-only",
                service.handle(CommandRequest.programValue(CH1, Quantity.FREQUENCY, 350.0, false)).message());
        assertEquals("Unknown channel: 6",
                service.handle(CommandRequest.checkValue(ChannelId.of(6), Quantity.SETPOINT)).message());
        assertEquals("wait needs a channel quantity",
                service.handle(new CommandRequest(CommandAction.PROGRAM_VALUE, null, Quantity.DEVIATION_MODE, 1.0, true)).message());
    }

    @Test
    void outOfRangeValueIsRejectedAndNotQueued() {
        CommandResponse r = service.handle(CommandRequest.programValue(CH1, Quantity.SETPOINT, 0.5, false));

        assertEquals(CommandStatus.ERROR, r.status());
        assertTrue(r.message().startsWith("Value out of range"), r.message());
        assertEquals(0, queue.size());
    }

    @Test
    void fullQueueIsReported() {
        for (int i = 0; i < queue.capacity(); i++) {
            service.handle(CommandRequest.programValue(CH1, Quantity.SETPOINT, 350.0 + i, false));
        }

        CommandResponse r = service.handle(CommandRequest.programValue(CH1, Quantity.SETPOINT, 360.0, false));

        assertEquals(CommandStatus.ERROR, r.status());
        assertEquals("Write queue full", r.message());
    }

    @Test
    void malformedLinesBecomeErrors() {
        assertTrue(service.handleLine("not json").startsWith("{\"status\":\"ERROR\""));
        assertTrue(service.handleLine("{\"action\":\"REBOOT\"}").contains("Unknown action"));
    }
}
