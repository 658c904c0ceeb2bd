package com.questrail.wavemeter.telemetry;

import com.questrail.wavemeter.state.SharedStateStore;
import com.questrail.wavemeter.time.FixedRateTicker;
import com.questrail.wavemeter.time.MonotonicClock;
import com.questrail.wavemeter.time.MonotonicScheduler;
import com.questrail.wavemeter.transport.DatagramEndpoint;
import com.questrail.wavemeter.transport.DatagramEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * TelemetryPublisher
 * =============================================================================
 * Publishes a heartbeat and every channel's displayed frequency to all
 * subscribers on a fixed period.
 *
 * <h2>Subscribers</h2>
 * Static subscribers come from configuration. Peers can also register by
 * sending a {@code SUBSCRIBE} datagram to the telemetry port and leave with
 * {@code UNSUBSCRIBE}. Static subscribers cannot be unsubscribed remotely.
 *
 * <h2>Delivery</h2>
 * Best-effort and fire-and-forget: one snapshot read per publication, no
 * acknowledgement, no retry. Send failures are logged at DEBUG and skipped.
 * The publisher never touches the driver.
 */
public final class TelemetryPublisher implements DatagramEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(TelemetryPublisher.class);

    public static final String SUBSCRIBE = "SUBSCRIBE";
    public static final String UNSUBSCRIBE = "UNSUBSCRIBE";

    private final DatagramEndpoint endpoint;
    private final SharedStateStore store;
    private final FixedRateTicker ticker;
    private final Set<SocketAddress> staticSubscribers;
    private final Set<SocketAddress> subscribers = new CopyOnWriteArraySet<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong publications = new AtomicLong();

    public TelemetryPublisher(DatagramEndpoint endpoint,
                              SharedStateStore store,
                              Collection<? extends SocketAddress> staticSubscribers,
                              MonotonicClock clock,
                              MonotonicScheduler scheduler,
                              Duration period)
    {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.store = Objects.requireNonNull(store, "store");
        this.staticSubscribers = Set.copyOf(Objects.requireNonNull(staticSubscribers, "staticSubscribers"));
        this.subscribers.addAll(this.staticSubscribers);
        this.ticker = new FixedRateTicker(scheduler, clock, period, this::publish);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            endpoint.setListener(this);
            endpoint.start();
            ticker.start();
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            ticker.stop();
            endpoint.stop();
        }
    }

    public Set<SocketAddress> subscribers() {
        return Set.copyOf(subscribers);
    }

    public long publications() {
        return publications.get();
    }

    /**
     * Sends one publication to every subscriber.
     */
    public void publish() {
        if (subscribers.isEmpty()) {
            return;
        }
        List<byte[]> payloads = TelemetryFormat.messages(store.read()).stream()
                .map(m -> m.getBytes(StandardCharsets.UTF_8))
                .toList();
        for (SocketAddress subscriber : subscribers) {
            for (byte[] payload : payloads) {
                try {
                    endpoint.send(subscriber, payload);
                } catch (RuntimeException e) {
                    log.debug("Telemetry send to {} failed: {}", subscriber, e.toString());
                    break;
                }
            }
        }
        publications.incrementAndGet();
    }

    @Override
    public void onTransportUp() {
        log.info("Telemetry publishing to {} subscriber(s)", subscribers.size());
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (cause != null) {
            log.warn("Telemetry transport down: {}", cause.toString());
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        String text = new String(payload, StandardCharsets.UTF_8).trim().toUpperCase(Locale.ROOT);
        switch (text) {
            case SUBSCRIBE -> {
                if (subscribers.add(remote)) {
                    log.info("Telemetry subscriber added: {}", remote);
                }
            }
            case UNSUBSCRIBE -> {
                if (!staticSubscribers.contains(remote) && subscribers.remove(remote)) {
                    log.info("Telemetry subscriber removed: {}", remote);
                }
            }
            default -> log.debug("Ignoring telemetry datagram from {}: {}", remote, text);
        }
    }
}
