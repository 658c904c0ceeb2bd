package com.questrail.wavemeter.runtime;

import com.questrail.wavemeter.config.WavemeterRuntimeConfig;
import com.questrail.wavemeter.driver.sim.SimulatedWavemeterDriver;
import com.questrail.wavemeter.settings.SettingsRecord;
import com.questrail.wavemeter.settings.SettingsService;
import com.questrail.wavemeter.time.SystemMonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

/**
 * Runs the coordinator against the simulated driver.
 *
 * <p>Usage: {@code WavemeterServerMain [config.properties]}. Without an
 * argument the {@code wavemeter.properties} resource is used.</p>
 */
public final class WavemeterServerMain {
    private static final Logger log = LoggerFactory.getLogger(WavemeterServerMain.class);

    private static final Duration SIMULATED_EXPOSURE = Duration.ofMillis(200);

    private WavemeterServerMain() {
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        WavemeterRuntimeConfig config = args.length > 0
                ? WavemeterRuntimeConfig.load(Path.of(args[0]))
                : WavemeterRuntimeConfig.loadDefault();

        SimulatedWavemeterDriver driver = new SimulatedWavemeterDriver(
                SystemMonotonicClock.INSTANCE, config.channels(), SIMULATED_EXPOSURE.toNanos(), System.nanoTime());

        WavemeterRuntime runtime = WavemeterRuntime.builder()
                .withConfig(config)
                .withDriver(driver)
                .build();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.stop();
            stopped.countDown();
        }, "wavemeter-shutdown"));

        runtime.start();

        // Let the first status poll land before comparing against the saved file.
        Thread.sleep(config.timingPolicy().statusPollPeriod().multipliedBy(2).toMillis());
        reportSavedSettings(runtime);

        stopped.await();
    }

    private static void reportSavedSettings(WavemeterRuntime runtime) {
        try {
            Optional<SettingsRecord> saved = runtime.settingsFile().load();
            if (saved.isPresent()) {
                String summary = SettingsService.formatDiffSummary(runtime.settings().compare(saved.get()));
                log.info("Saved settings from {}: {}", saved.get().savedAt(), summary);
            }
        } catch (IOException e) {
            log.error("Failed to read saved settings", e);
        }
    }
}
