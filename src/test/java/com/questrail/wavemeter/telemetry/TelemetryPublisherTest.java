package com.questrail.wavemeter.telemetry;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.state.SharedStateStore;
import com.questrail.wavemeter.state.WavemeterSnapshot;
import com.questrail.wavemeter.time.DeterministicScheduler;
import com.questrail.wavemeter.time.ManualMonotonicClock;
import com.questrail.wavemeter.transport.FakeDatagramEndpoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TelemetryPublisherTest
 * -----------------------------------------------------------------------------
 * Publication content, cadence and subscriber management over a fake
 * datagram endpoint.
 */
class TelemetryPublisherTest {

    private static final InetSocketAddress STATIC = new InetSocketAddress("127.0.0.1", 40001);
    private static final InetSocketAddress PEER = new InetSocketAddress("127.0.0.1", 40002);

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private SharedStateStore store;
    private FakeDatagramEndpoint endpoint;
    private TelemetryPublisher publisher;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        store = new SharedStateStore(WavemeterSnapshot.initial(ChannelId.range(2)));
        endpoint = new FakeDatagramEndpoint();
        publisher = new TelemetryPublisher(endpoint, store, List.of(STATIC), clock, scheduler,
                Duration.ofMillis(100));
    }

    @Test
    void publishesHeartbeatThenEveryChannel() {
        store.update(s -> s.withChannel(ChannelId.of(1), c -> c.withFreshSample(348.66641, false)));

        publisher.publish();

        assertEquals(List.of("heartbeat", "1 348.66641", "2 0.0"), endpoint.sentTextTo(STATIC));
    }

    @Test
    void publishesOncePerPeriod() {
        publisher.start();

        scheduler.advanceAndRun(1000, 10);

        assertEquals(10, publisher.publications());
        assertEquals(30, endpoint.sentTextTo(STATIC).size());

        publisher.stop();
        scheduler.advanceAndRun(500, 10);
        assertEquals(10, publisher.publications());
    }

    @Test
    void peersSubscribeAndUnsubscribe() {
        publisher.start();

        endpoint.injectDatagram(PEER, "subscribe\n");
        assertTrue(publisher.subscribers().contains(PEER));
        publisher.publish();
        assertEquals(3, endpoint.sentTextTo(PEER).size());

        endpoint.injectDatagram(PEER, "UNSUBSCRIBE");
        endpoint.clear();
        publisher.publish();
        assertTrue(endpoint.sentTextTo(PEER).isEmpty());
        assertEquals(3, endpoint.sentTextTo(STATIC).size());
    }

    @Test
    void staticSubscribersCannotBeRemovedRemotely() {
        publisher.start();

        endpoint.injectDatagram(STATIC, "UNSUBSCRIBE");

        assertTrue(publisher.subscribers().contains(STATIC));
    }

    @Test
    void refusedSubscriberDoesNotBlockOthers() {
        publisher.start();
        endpoint.injectDatagram(PEER, "SUBSCRIBE");
        endpoint.refuse(STATIC);

        publisher.publish();

        assertTrue(endpoint.sentTextTo(STATIC).isEmpty());
        assertEquals(3, endpoint.sentTextTo(PEER).size());
        assertEquals(1, publisher.publications());
    }

    @Test
    void nothingIsPublishedWithoutSubscribers() {
        TelemetryPublisher idle = new TelemetryPublisher(endpoint, store, List.of(), clock, scheduler,
                Duration.ofMillis(100));

        idle.publish();

        assertTrue(endpoint.sent().isEmpty());
        assertEquals(0, idle.publications());
    }

    @Test
    void unrelatedDatagramsAreIgnored() {
        publisher.start();

        endpoint.injectDatagram(PEER, "hello");

        assertEquals(1, publisher.subscribers().size());
    }
}
