package io.ticketring.sync;

import io.ticketring.config.InstanceEndpoint;
import io.ticketring.error.ErrorCode;
import io.ticketring.error.TicketRingException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.UnixDomainSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

final class SocketCommandChannelTest {
    @Test
    void sendsCommandAndReadsResponseUntilClose() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            AtomicReference<String> received = new AtomicReference<>();
            Thread serverThread = new Thread(() -> {
                try (Socket socket = server.accept()) {
                    BufferedReader reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
                    received.set(reader.readLine());
                    OutputStream out = socket.getOutputStream();
                    out.write("# id (file)\n0 (/etc/lb/tls-ticket-keys)\n".getBytes(StandardCharsets.UTF_8));
                    out.flush();
                } catch (Exception e) {
                    received.set("server failed: " + e);
                }
            });
            serverThread.start();

            SocketCommandChannel channel = new SocketCommandChannel(Duration.ofSeconds(5));
            String response = channel.execute(
                    InstanceEndpoint.of("lb-1", "tcp://127.0.0.1:" + server.getLocalPort()), "show tls-keys");

            serverThread.join(5_000);
            Assertions.assertEquals("show tls-keys", received.get());
            Assertions.assertTrue(response.contains("0 (/etc/lb/tls-ticket-keys)"));
        }
    }

    @Test
    void silentInstanceTimesOut() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            CountDownLatch release = new CountDownLatch(1);
            Thread serverThread = new Thread(() -> {
                try (Socket ignored = server.accept()) {
                    release.await(10, TimeUnit.SECONDS);
                } catch (Exception e) {
                    Thread.currentThread().interrupt();
                }
            });
            serverThread.setDaemon(true);
            serverThread.start();

            SocketCommandChannel channel = new SocketCommandChannel(Duration.ofMillis(300));
            TicketRingException failure = Assertions.assertThrows(TicketRingException.class, () -> channel.execute(
                    InstanceEndpoint.of("lb-1", "127.0.0.1:" + server.getLocalPort()), "show tls-keys"));

            release.countDown();
            Assertions.assertEquals(ErrorCode.CHANNEL_TIMEOUT, failure.code());
        }
    }

    @Test
    void refusedConnectionIsChannelError() throws Exception {
        int port;
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
        }
        SocketCommandChannel channel = new SocketCommandChannel(Duration.ofSeconds(2));
        TicketRingException failure = Assertions.assertThrows(TicketRingException.class,
                () -> channel.execute(InstanceEndpoint.of("lb-1", "tcp://127.0.0.1:" + port), "show tls-keys"));
        Assertions.assertEquals(ErrorCode.CHANNEL_ERROR, failure.code());
    }

    @Test
    void resolvesSupportedAddressForms() {
        Assertions.assertEquals(new InetSocketAddress("127.0.0.1", 9999), SocketCommandChannel.resolve("tcp://127.0.0.1:9999"));
        Assertions.assertEquals(new InetSocketAddress("127.0.0.1", 9999), SocketCommandChannel.resolve("127.0.0.1:9999"));
        Assertions.assertEquals(new InetSocketAddress("::1", 9999), SocketCommandChannel.resolve("[::1]:9999"));
        Assertions.assertInstanceOf(UnixDomainSocketAddress.class, SocketCommandChannel.resolve("unix:///run/lb/admin.sock"));

        for (String invalid : new String[]{"localhost", "host:", "host:abc", "host:0", "unix://", ""}) {
            TicketRingException failure = Assertions.assertThrows(TicketRingException.class,
                    () -> SocketCommandChannel.resolve(invalid), invalid);
            Assertions.assertEquals(ErrorCode.INVALID_ARGUMENT, failure.code(), invalid);
        }
    }
}
