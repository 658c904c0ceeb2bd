package com.questrail.wavemeter.transport.udp.netty;

import com.questrail.wavemeter.transport.DatagramEndpointListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loopback test of the telemetry socket against a plain JDK datagram socket.
 */
class NettyUdpDatagramEndpointTest {

    private final NettyUdpDatagramEndpoint endpoint =
            new NettyUdpDatagramEndpoint(new InetSocketAddress("127.0.0.1", 0));
    private final BlockingQueue<String> received = new ArrayBlockingQueue<>(16);
    private final CountDownLatch up = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        endpoint.stop();
    }

    private void startEndpoint() throws InterruptedException {
        endpoint.setListener(new DatagramEndpointListener() {
            @Override
            public void onTransportUp() {
                up.countDown();
            }

            @Override
            public void onTransportDown(Throwable cause) {
            }

            @Override
            public void onDatagram(SocketAddress remote, byte[] payload) {
                received.add(new String(payload, StandardCharsets.UTF_8));
            }
        });
        endpoint.start();
        assertTrue(up.await(5, TimeUnit.SECONDS));
    }

    @Test
    void sendsAndReceivesDatagrams() throws Exception {
        startEndpoint();
        InetSocketAddress local = endpoint.localAddress().orElseThrow();

        try (DatagramSocket peer = new DatagramSocket(new InetSocketAddress("127.0.0.1", 0))) {
            peer.setSoTimeout(5000);

            byte[] request = "SUBSCRIBE".getBytes(StandardCharsets.UTF_8);
            peer.send(new DatagramPacket(request, request.length, local));
            assertEquals("SUBSCRIBE", received.poll(5, TimeUnit.SECONDS));

            endpoint.send(peer.getLocalSocketAddress(), "heartbeat".getBytes(StandardCharsets.UTF_8));
            DatagramPacket packet = new DatagramPacket(new byte[64], 64);
            peer.receive(packet);
            assertEquals("heartbeat",
                    new String(packet.getData(), 0, packet.getLength(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void oversizedInboundDatagramsAreIgnored() throws Exception {
        startEndpoint();
        InetSocketAddress local = endpoint.localAddress().orElseThrow();

        try (DatagramSocket peer = new DatagramSocket(new InetSocketAddress("127.0.0.1", 0))) {
            byte[] big = new byte[NettyUdpDatagramEndpoint.MAX_INBOUND_BYTES + 1];
            peer.send(new DatagramPacket(big, big.length, local));
            byte[] small = "UNSUBSCRIBE".getBytes(StandardCharsets.UTF_8);
            peer.send(new DatagramPacket(small, small.length, local));
        }

        assertEquals("UNSUBSCRIBE", received.poll(5, TimeUnit.SECONDS));
        assertTrue(received.isEmpty());
    }

    @Test
    void sendBeforeStartIsCountedAsDropped() {
        endpoint.send(new InetSocketAddress("127.0.0.1", 9), new byte[] {1});

        assertEquals(1, endpoint.droppedCount());
        assertEquals(0, endpoint.sentCount());
    }
}
