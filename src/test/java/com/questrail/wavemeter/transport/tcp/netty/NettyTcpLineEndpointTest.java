package com.questrail.wavemeter.transport.tcp.netty;

import com.questrail.wavemeter.transport.ReplyChannel;
import com.questrail.wavemeter.transport.RequestReplyListener;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loopback test of the command transport: one line in, one line out.
 */
class NettyTcpLineEndpointTest {

    private final NettyTcpLineEndpoint endpoint =
            new NettyTcpLineEndpoint(new InetSocketAddress("127.0.0.1", 0));

    @AfterEach
    void tearDown() {
        endpoint.stop();
    }

    @Test
    void repliesArriveOnTheRequestingConnection() throws Exception {
        CountDownLatch up = new CountDownLatch(1);
        endpoint.setListener(new RequestReplyListener() {
            @Override
            public void onTransportUp() {
                up.countDown();
            }

            @Override
            public void onTransportDown(Throwable cause) {
            }

            @Override
            public void onRequest(SocketAddress remote, String request, ReplyChannel reply) {
                reply.reply("echo:" + request);
            }
        });
        endpoint.start();
        assertTrue(up.await(5, TimeUnit.SECONDS));

        int port = endpoint.localAddress().orElseThrow().getPort();
        try (Socket socket = new Socket("127.0.0.1", port)) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            BufferedReader in = new BufferedReader(
                    new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));

            out.write("{\"action\":\"HELLO\"}\r\nsecond\n".getBytes(StandardCharsets.UTF_8));
            out.flush();

            assertEquals("echo:{\"action\":\"HELLO\"}", in.readLine());
            assertEquals("echo:second", in.readLine());
        }
    }

    @Test
    void startWithoutListenerFails() {
        assertThrows(IllegalStateException.class, endpoint::start);
    }
}
