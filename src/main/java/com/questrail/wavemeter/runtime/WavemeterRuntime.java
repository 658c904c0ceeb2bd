package com.questrail.wavemeter.runtime;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.command.CommandServer;
import com.questrail.wavemeter.command.CommandService;
import com.questrail.wavemeter.command.ConvergenceWaiter;
import com.questrail.wavemeter.config.WavemeterRuntimeConfig;
import com.questrail.wavemeter.config.WavemeterTimingPolicy;
import com.questrail.wavemeter.driver.ExclusiveDriverHandle;
import com.questrail.wavemeter.driver.WavemeterDriver;
import com.questrail.wavemeter.observability.CompositeObservabilitySink;
import com.questrail.wavemeter.observability.NullObservabilitySink;
import com.questrail.wavemeter.observability.PollTimingDiagnostics;
import com.questrail.wavemeter.observability.Slf4jObservabilitySink;
import com.questrail.wavemeter.observability.WavemeterObservabilitySink;
import com.questrail.wavemeter.observer.CoalescingWriteProducer;
import com.questrail.wavemeter.observer.DisplayView;
import com.questrail.wavemeter.observer.LocalObserver;
import com.questrail.wavemeter.observer.PendingMarkerRegistry;
import com.questrail.wavemeter.owner.DeviceOwnerLoop;
import com.questrail.wavemeter.queue.WriteRangePolicy;
import com.questrail.wavemeter.queue.WriteRequestQueue;
import com.questrail.wavemeter.settings.SettingsFileStore;
import com.questrail.wavemeter.settings.SettingsService;
import com.questrail.wavemeter.state.SharedStateStore;
import com.questrail.wavemeter.state.WavemeterSnapshot;
import com.questrail.wavemeter.telemetry.TelemetryPublisher;
import com.questrail.wavemeter.time.MonotonicClock;
import com.questrail.wavemeter.time.MonotonicScheduler;
import com.questrail.wavemeter.time.ScheduledExecutorScheduler;
import com.questrail.wavemeter.time.SystemMonotonicClock;
import com.questrail.wavemeter.time.SystemWallClock;
import com.questrail.wavemeter.time.ThreadSleeper;
import com.questrail.wavemeter.transport.DatagramEndpoint;
import com.questrail.wavemeter.transport.RequestReplyEndpoint;
import com.questrail.wavemeter.transport.tcp.netty.NettyTcpLineEndpoint;
import com.questrail.wavemeter.transport.udp.netty.NettyUdpDatagramEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * WavemeterRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the wavemeter coordinator.
 *
 * <h2>Threads</h2>
 * <ul>
 *   <li>{@code wavemeter-device-owner}: the only thread that calls the driver</li>
 *   <li>{@code wavemeter-scheduler}: poll, telemetry and display tickers</li>
 *   <li>{@code wavemeter-command-N}: command workers, which may block in a
 *       convergence wait</li>
 *   <li>Netty event loops inside the transport adapters</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} brings up the owner first, so the first status poll has run
 * or is running before remote clients connect. {@link #stop()} tears down in
 * reverse order: transports, observer, owner, then the executors.
 */
public final class WavemeterRuntime {
    private static final Logger log = LoggerFactory.getLogger(WavemeterRuntime.class);

    private final WavemeterRuntimeConfig config;
    private final SharedStateStore store;
    private final WriteRequestQueue queue;
    private final DeviceOwnerLoop owner;
    private final CommandServer commandServer;
    private final TelemetryPublisher telemetry;
    private final LocalObserver observer;
    private final SettingsService settingsService;
    private final SettingsFileStore settingsFileStore;
    private final PollTimingDiagnostics diagnostics;
    private final ExecutorService ownerExecutor;
    private final ScheduledExecutorService schedulerExecutor;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private WavemeterRuntime(Builder b,
                             SharedStateStore store,
                             WriteRequestQueue queue,
                             DeviceOwnerLoop owner,
                             CommandServer commandServer,
                             TelemetryPublisher telemetry,
                             LocalObserver observer,
                             SettingsService settingsService,
                             PollTimingDiagnostics diagnostics,
                             ExecutorService ownerExecutor,
                             ScheduledExecutorService schedulerExecutor) {
        this.config = b.config;
        this.store = store;
        this.queue = queue;
        this.owner = owner;
        this.commandServer = commandServer;
        this.telemetry = telemetry;
        this.observer = observer;
        this.settingsService = settingsService;
        this.settingsFileStore = new SettingsFileStore(b.config.settingsFile());
        this.diagnostics = diagnostics;
        this.ownerExecutor = ownerExecutor;
        this.schedulerExecutor = schedulerExecutor;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting wavemeter runtime: {} channels, command port {}, telemetry port {}",
                config.channelCount(), config.commandPort(), config.telemetryPort());
        owner.start();
        if (observer != null) {
            observer.start();
        }
        commandServer.start();
        telemetry.start();
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping wavemeter runtime");
        telemetry.stop();
        commandServer.stop();
        if (observer != null) {
            observer.stop();
        }
        owner.stop();
        shutdown(schedulerExecutor);
        shutdown(ownerExecutor);
        log.info("Wavemeter runtime stopped");
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public WavemeterRuntimeConfig config() {
        return config;
    }

    public WavemeterSnapshot snapshot() {
        return store.read();
    }

    public WriteRequestQueue writeQueue() {
        return queue;
    }

    public DeviceOwnerLoop owner() {
        return owner;
    }

    public CommandServer commandServer() {
        return commandServer;
    }

    public TelemetryPublisher telemetry() {
        return telemetry;
    }

    public Optional<LocalObserver> observer() {
        return Optional.ofNullable(observer);
    }

    public SettingsService settings() {
        return settingsService;
    }

    public SettingsFileStore settingsFile() {
        return settingsFileStore;
    }

    public Optional<PollTimingDiagnostics> diagnostics() {
        return Optional.ofNullable(diagnostics);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private WavemeterRuntimeConfig config = WavemeterRuntimeConfig.builder().build();
        private WavemeterDriver driver;
        private WavemeterObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private DisplayView displayView;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private Function<InetSocketAddress, RequestReplyEndpoint> commandEndpointFactory = NettyTcpLineEndpoint::new;
        private Function<InetSocketAddress, DatagramEndpoint> telemetryEndpointFactory = NettyUdpDatagramEndpoint::new;

        public Builder withConfig(WavemeterRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withDriver(WavemeterDriver driver) {
            this.driver = driver;
            return this;
        }

        public Builder withObservabilitySink(WavemeterObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withDisplayView(DisplayView view) {
            this.displayView = view;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withCommandEndpointFactory(Function<InetSocketAddress, RequestReplyEndpoint> factory) {
            this.commandEndpointFactory = factory;
            return this;
        }

        public Builder withTelemetryEndpointFactory(Function<InetSocketAddress, DatagramEndpoint> factory) {
            this.telemetryEndpointFactory = factory;
            return this;
        }

        public WavemeterRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(driver, "driver");
            Objects.requireNonNull(clock, "clock");

            WavemeterTimingPolicy timing = config.timingPolicy();
            List<ChannelId> channels = config.channels();

            // 1. Threads and time
            ExecutorService ownerExec = Executors.newSingleThreadExecutor(named("wavemeter-device-owner"));
            ScheduledExecutorService schedulerExec = Executors.newScheduledThreadPool(1, named("wavemeter-scheduler"));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);

            // 2. Shared state and the write path
            SharedStateStore store = new SharedStateStore(WavemeterSnapshot.initial(channels));
            WriteRequestQueue queue = new WriteRequestQueue(
                    config.queueCapacity(),
                    new WriteRangePolicy(config.minimumSetpointTerahertz(), config.channelCount()));
            PendingMarkerRegistry pendingMarkers = new PendingMarkerRegistry(clock, timing.pendingMarkerExpiry());

            // 3. Observability
            List<WavemeterObservabilitySink> sinks = new ArrayList<>();
            sinks.add(new Slf4jObservabilitySink());
            sinks.add(Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE));
            PollTimingDiagnostics diagnostics = null;
            if (config.diagnosticsEnabled()) {
                diagnostics = new PollTimingDiagnostics();
                sinks.add(diagnostics);
            }
            WavemeterObservabilitySink sink = new CompositeObservabilitySink(sinks);

            // 4. Device owner
            DeviceOwnerLoop owner = new DeviceOwnerLoop(
                    new ExclusiveDriverHandle(driver),
                    store,
                    queue,
                    pendingMarkers,
                    channels,
                    timing,
                    config.lockToleranceTerahertz(),
                    clock,
                    scheduler,
                    ownerExec,
                    sink);

            // 5. Command server
            ConvergenceWaiter waiter = new ConvergenceWaiter(
                    store,
                    clock,
                    ThreadSleeper.INSTANCE,
                    timing.convergencePollInterval(),
                    timing.convergenceTimeout(),
                    timing.requiredConsecutiveLocks());
            CommandService commandService = new CommandService(store, queue, waiter, clock);
            ExecutorService workers = Executors.newFixedThreadPool(
                    config.commandWorkerThreads(), numbered("wavemeter-command-"));
            CommandServer commandServer = new CommandServer(
                    commandEndpointFactory.apply(new InetSocketAddress(config.bindHost(), config.commandPort())),
                    commandService,
                    workers);

            // 6. Telemetry
            TelemetryPublisher telemetry = new TelemetryPublisher(
                    telemetryEndpointFactory.apply(new InetSocketAddress(config.bindHost(), config.telemetryPort())),
                    store,
                    config.telemetrySubscribers(),
                    clock,
                    scheduler,
                    timing.telemetryPeriod());

            // 7. Optional local observer
            LocalObserver observer = null;
            if (displayView != null) {
                CoalescingWriteProducer producer = new CoalescingWriteProducer(
                        queue, pendingMarkers, clock, scheduler, timing.writeCoalesceWindow());
                observer = new LocalObserver(
                        store,
                        pendingMarkers,
                        producer,
                        displayView,
                        clock,
                        scheduler,
                        timing.displayFastPeriod(),
                        timing.displaySlowPeriod());
            }

            // 8. Settings
            SettingsService settings = new SettingsService(
                    store, queue, pendingMarkers, clock, SystemWallClock.INSTANCE);

            return new WavemeterRuntime(this, store, queue, owner, commandServer, telemetry,
                    observer, settings, diagnostics, ownerExec, schedulerExec);
        }

        private static ThreadFactory named(String name) {
            return r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            };
        }

        private static ThreadFactory numbered(String prefix) {
            AtomicInteger next = new AtomicInteger(1);
            return r -> {
                Thread t = new Thread(r, prefix + next.getAndIncrement());
                t.setDaemon(true);
                return t;
            };
        }
    }
}
