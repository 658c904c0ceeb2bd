package com.questrail.wavemeter.command;

import com.questrail.wavemeter.transport.ReplyChannel;
import com.questrail.wavemeter.transport.RequestReplyEndpoint;
import com.questrail.wavemeter.transport.RequestReplyListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CommandServer
 * =============================================================================
 * Binds the {@link CommandService} to a {@link RequestReplyEndpoint}.
 *
 * <h2>Threading</h2>
 * Request lines arrive on the transport's I/O thread and are handed straight
 * to the server's own worker pool. A PROGRAM_VALUE wait therefore occupies one
 * worker for up to the convergence timeout, never the I/O thread and never the
 * device owner.
 *
 * <h2>Shutdown</h2>
 * {@link #stop()} closes the endpoint and interrupts the workers; interrupted
 * waits answer {@link CommandStatus#ERROR} (if the connection is still open)
 * and release their worker.
 */
public final class CommandServer implements RequestReplyListener
{
    private static final Logger log = LoggerFactory.getLogger(CommandServer.class);

    private final RequestReplyEndpoint endpoint;
    private final CommandService service;
    private final ExecutorService workers;
    private final CommandCodec codec = new CommandCodec();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean transportUp = new AtomicBoolean(false);

    public CommandServer(RequestReplyEndpoint endpoint, CommandService service, ExecutorService workers) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.service = Objects.requireNonNull(service, "service");
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            endpoint.setListener(this);
            endpoint.start();
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            endpoint.stop();
            workers.shutdownNow();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Command workers did not terminate within 5 s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isTransportUp() {
        return transportUp.get();
    }

    public Optional<InetSocketAddress> localAddress() {
        return endpoint.localAddress();
    }

    @Override
    public void onTransportUp() {
        transportUp.set(true);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        transportUp.set(false);
        if (cause != null) {
            log.error("Command transport down", cause);
        }
    }

    @Override
    public void onRequest(SocketAddress remote, String request, ReplyChannel reply) {
        try {
            workers.execute(() -> reply.reply(service.handleLine(request)));
        } catch (RejectedExecutionException e) {
            log.debug("Command from {} refused during shutdown", remote);
            reply.reply(codec.encode(CommandResponse.error("Server shutting down")));
        }
    }
}
