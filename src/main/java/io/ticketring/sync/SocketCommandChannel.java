package io.ticketring.sync;

import io.ticketring.config.InstanceEndpoint;
import io.ticketring.error.ErrorCode;
import io.ticketring.error.TicketRingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Line-oriented runtime API over TCP ({@code tcp://host:port}) or a Unix domain socket
 * ({@code unix:///run/lb/admin.sock}). One command per connection: write the command and a newline,
 * half-close, read until the instance closes. The whole exchange is bounded by one timeout.
 */
public final class SocketCommandChannel implements CommandChannel {
    private static final Logger LOGGER = LoggerFactory.getLogger(SocketCommandChannel.class);
    private static final int MAX_RESPONSE_BYTES = 1024 * 1024;
    private static final String TCP_SCHEME = "tcp://";
    private static final String UNIX_SCHEME = "unix://";

    private static final ScheduledExecutorService WATCHDOG = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "ticketring-channel-watchdog");
        thread.setDaemon(true);
        return thread;
    });

    private final Duration timeout;

    public SocketCommandChannel(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("channel timeout must be positive");
        }
        this.timeout = timeout;
    }

    @Override
    public String execute(InstanceEndpoint instance, String command) {
        SocketAddress address = resolve(instance.address());
        AtomicBoolean timedOut = new AtomicBoolean(false);
        SocketChannel channel;
        try {
            channel = address instanceof UnixDomainSocketAddress
                    ? SocketChannel.open(StandardProtocolFamily.UNIX)
                    : SocketChannel.open();
        } catch (IOException e) {
            throw new TicketRingException(ErrorCode.CHANNEL_ERROR,
                    "Failed to open channel to " + instance.name() + ": " + e.getMessage(), e);
        }
        // Blocking channels have no read timeout; closing the channel unblocks connect/read.
        ScheduledFuture<?> watchdog = WATCHDOG.schedule(() -> {
            timedOut.set(true);
            closeAfterTimeout(channel, instance);
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        try (channel) {
            channel.connect(address);
            ByteBuffer request = ByteBuffer.wrap((command + "\n").getBytes(StandardCharsets.UTF_8));
            while (request.hasRemaining()) {
                channel.write(request);
            }
            channel.shutdownOutput();
            return readResponse(channel, instance);
        } catch (IOException e) {
            if (timedOut.get()) {
                throw new TicketRingException(ErrorCode.CHANNEL_TIMEOUT,
                        "Instance " + instance.name() + " did not answer within " + timeout, e);
            }
            throw new TicketRingException(ErrorCode.CHANNEL_ERROR,
                    "Channel to " + instance.name() + " failed: " + e.getMessage(), e);
        } finally {
            watchdog.cancel(false);
        }
    }

    private static String readResponse(SocketChannel channel, InstanceEndpoint instance) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteBuffer buffer = ByteBuffer.allocate(8192);
        while (channel.read(buffer) >= 0) {
            buffer.flip();
            out.write(buffer.array(), 0, buffer.limit());
            buffer.clear();
            if (out.size() > MAX_RESPONSE_BYTES) {
                throw new IOException("response from " + instance.name() + " exceeds " + MAX_RESPONSE_BYTES + " bytes");
            }
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    private static void closeAfterTimeout(SocketChannel channel, InstanceEndpoint instance) {
        try {
            channel.close();
        } catch (IOException e) {
            LOGGER.debug("Closing timed out channel to {} failed", instance.name(), e);
        }
    }

    static SocketAddress resolve(String address) {
        String raw = address == null ? "" : address.trim();
        if (raw.startsWith(UNIX_SCHEME)) {
            String path = raw.substring(UNIX_SCHEME.length());
            if (path.isBlank()) {
                throw TicketRingException.invalidArgument("unix socket path is empty: " + address);
            }
            return UnixDomainSocketAddress.of(Path.of(path));
        }
        String hostPort = raw.startsWith(TCP_SCHEME) ? raw.substring(TCP_SCHEME.length()) : raw;
        int colon = hostPort.lastIndexOf(':');
        if (colon <= 0 || colon == hostPort.length() - 1) {
            throw TicketRingException.invalidArgument("instance address must be host:port or unix:///path: " + address);
        }
        String host = hostPort.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(hostPort.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw TicketRingException.invalidArgument("invalid port in instance address: " + address);
        }
        if (port < 1 || port > 65_535) {
            throw TicketRingException.invalidArgument("invalid port in instance address: " + address);
        }
        return new InetSocketAddress(host, port);
    }
}
