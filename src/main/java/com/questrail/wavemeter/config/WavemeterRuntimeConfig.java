package com.questrail.wavemeter.config;

import com.questrail.wavemeter.api.ChannelId;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Aggregated configuration for the wavemeter runtime.
 *
 * <p>Built in code through {@link #builder()} or loaded from a
 * {@code wavemeter.properties} file through {@link #fromProperties(Properties)}.
 * Keys that are absent keep their defaults.</p>
 */
public record WavemeterRuntimeConfig(
    int channelCount,
    String bindHost,
    int commandPort,
    int telemetryPort,
    List<InetSocketAddress> telemetrySubscribers,
    double lockToleranceTerahertz,
    double minimumSetpointTerahertz,
    int queueCapacity,
    int commandWorkerThreads,
    Path settingsFile,
    boolean diagnosticsEnabled,
    WavemeterTimingPolicy timingPolicy
) {
    public static final String DEFAULT_RESOURCE = "wavemeter.properties";

    public WavemeterRuntimeConfig {
        Objects.requireNonNull(bindHost, "bindHost");
        Objects.requireNonNull(settingsFile, "settingsFile");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        telemetrySubscribers = List.copyOf(Objects.requireNonNull(telemetrySubscribers, "telemetrySubscribers"));

        if (channelCount < ChannelId.MIN_VALUE || channelCount > ChannelId.MAX_VALUE) {
            throw new IllegalArgumentException("channelCount must be in range 1–8 (was " + channelCount + ")");
        }
        requirePort(commandPort, "commandPort");
        requirePort(telemetryPort, "telemetryPort");
        if (!(lockToleranceTerahertz > 0.0)) {
            throw new IllegalArgumentException("lockToleranceTerahertz must be > 0");
        }
        if (!(minimumSetpointTerahertz >= 0.0)) {
            throw new IllegalArgumentException("minimumSetpointTerahertz must be >= 0");
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0");
        }
        if (commandWorkerThreads <= 0) {
            throw new IllegalArgumentException("commandWorkerThreads must be > 0");
        }
    }

    private static void requirePort(int port, String name) {
        // 0 asks the OS for an ephemeral port.
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException(name + " must be in range 0–65535 (was " + port + ")");
        }
    }

    public List<ChannelId> channels() {
        return ChannelId.range(channelCount);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns the
     * defaults when the resource is absent.
     */
    public static WavemeterRuntimeConfig loadDefault() throws IOException {
        Properties props = new Properties();
        try (InputStream in = WavemeterRuntimeConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        }
        return fromProperties(props);
    }

    public static WavemeterRuntimeConfig load(Path file) throws IOException {
        Properties props = new Properties();
        try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(in);
        }
        return fromProperties(props);
    }

    /**
     * @throws IllegalArgumentException if a present key holds an unparsable or out-of-range value
     */
    public static WavemeterRuntimeConfig fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();
        WavemeterTimingPolicy t = WavemeterTimingPolicy.defaults();

        b.withChannelCount(intProp(props, "wavemeter.channels", b.channelCount));
        b.withBindHost(props.getProperty("wavemeter.bind-host", b.bindHost).trim());
        b.withCommandPort(intProp(props, "wavemeter.command.port", b.commandPort));
        b.withTelemetryPort(intProp(props, "wavemeter.telemetry.port", b.telemetryPort));
        b.withTelemetrySubscribers(subscribers(props.getProperty("wavemeter.telemetry.subscribers", "")));
        b.withLockToleranceTerahertz(doubleProp(props, "wavemeter.lock.tolerance-thz", b.lockToleranceTerahertz));
        b.withMinimumSetpointTerahertz(doubleProp(props, "wavemeter.setpoint.minimum-thz", b.minimumSetpointTerahertz));
        b.withQueueCapacity(intProp(props, "wavemeter.queue.capacity", b.queueCapacity));
        b.withCommandWorkerThreads(intProp(props, "wavemeter.command.workers", b.commandWorkerThreads));
        b.withSettingsFile(Path.of(props.getProperty("wavemeter.settings.file", b.settingsFile.toString()).trim()));
        b.withDiagnosticsEnabled(Boolean.parseBoolean(
                props.getProperty("wavemeter.diagnostics.enabled", Boolean.toString(b.diagnosticsEnabled)).trim()));

        b.withTimingPolicy(new WavemeterTimingPolicy(
                millisProp(props, "wavemeter.poll.fast-ms", t.fastPollPeriod()),
                millisProp(props, "wavemeter.poll.status-ms", t.statusPollPeriod()),
                millisProp(props, "wavemeter.convergence.interval-ms", t.convergencePollInterval()),
                millisProp(props, "wavemeter.convergence.timeout-ms", t.convergenceTimeout()),
                intProp(props, "wavemeter.convergence.required-locks", t.requiredConsecutiveLocks()),
                millisProp(props, "wavemeter.telemetry.period-ms", t.telemetryPeriod()),
                millisProp(props, "wavemeter.display.pending-expiry-ms", t.pendingMarkerExpiry()),
                millisProp(props, "wavemeter.display.coalesce-ms", t.writeCoalesceWindow()),
                millisProp(props, "wavemeter.display.fast-ms", t.displayFastPeriod()),
                millisProp(props, "wavemeter.display.slow-ms", t.displaySlowPeriod())
        ));
        return b.build();
    }

    private static int intProp(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + raw, e);
        }
    }

    private static double doubleProp(Properties props, String key, double fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a number: " + raw, e);
        }
    }

    private static Duration millisProp(Properties props, String key, Duration fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return Duration.ofMillis(intProp(props, key, 0));
    }

    /**
     * Parses a comma-separated {@code host:port} list.
     */
    static List<InetSocketAddress> subscribers(String raw) {
        List<InetSocketAddress> out = new ArrayList<>();
        for (String part : raw.split(",")) {
            String entry = part.trim();
            if (entry.isEmpty()) {
                continue;
            }
            int colon = entry.lastIndexOf(':');
            if (colon <= 0 || colon == entry.length() - 1) {
                throw new IllegalArgumentException("Telemetry subscriber must be host:port (was " + entry + ")");
            }
            int port;
            try {
                port = Integer.parseInt(entry.substring(colon + 1));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Telemetry subscriber port is not a number: " + entry, e);
            }
            out.add(new InetSocketAddress(entry.substring(0, colon), port));
        }
        return out;
    }

    public static final class Builder {
        private int channelCount = ChannelId.MAX_VALUE;
        private String bindHost = "0.0.0.0";
        private int commandPort = 3796;
        private int telemetryPort = 3797;
        private List<InetSocketAddress> telemetrySubscribers = List.of();
        private double lockToleranceTerahertz = 5.0e-6;
        private double minimumSetpointTerahertz = 1.0;
        private int queueCapacity = 1024;
        private int commandWorkerThreads = 4;
        private Path settingsFile = Path.of("pid_config.json");
        private boolean diagnosticsEnabled = false;
        private WavemeterTimingPolicy timingPolicy = WavemeterTimingPolicy.defaults();

        public Builder withChannelCount(int channelCount) {
            this.channelCount = channelCount;
            return this;
        }

        public Builder withBindHost(String bindHost) {
            this.bindHost = bindHost;
            return this;
        }

        public Builder withCommandPort(int commandPort) {
            this.commandPort = commandPort;
            return this;
        }

        public Builder withTelemetryPort(int telemetryPort) {
            this.telemetryPort = telemetryPort;
            return this;
        }

        public Builder withTelemetrySubscribers(List<InetSocketAddress> subscribers) {
            this.telemetrySubscribers = subscribers;
            return this;
        }

        public Builder withLockToleranceTerahertz(double tolerance) {
            this.lockToleranceTerahertz = tolerance;
            return this;
        }

        public Builder withMinimumSetpointTerahertz(double minimum) {
            this.minimumSetpointTerahertz = minimum;
            return this;
        }

        public Builder withQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder withCommandWorkerThreads(int threads) {
            this.commandWorkerThreads = threads;
            return this;
        }

        public Builder withSettingsFile(Path settingsFile) {
            this.settingsFile = settingsFile;
            return this;
        }

        public Builder withDiagnosticsEnabled(boolean enabled) {
            this.diagnosticsEnabled = enabled;
            return this;
        }

        public Builder withTimingPolicy(WavemeterTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public WavemeterRuntimeConfig build() {
            return new WavemeterRuntimeConfig(channelCount, bindHost, commandPort, telemetryPort,
                    telemetrySubscribers, lockToleranceTerahertz, minimumSetpointTerahertz, queueCapacity,
                    commandWorkerThreads, settingsFile, diagnosticsEnabled, timingPolicy);
        }
    }
}
