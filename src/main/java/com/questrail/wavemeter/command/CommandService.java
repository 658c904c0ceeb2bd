package com.questrail.wavemeter.command;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.api.WriteOrigin;
import com.questrail.wavemeter.queue.EnqueueResult;
import com.questrail.wavemeter.queue.WriteRequest;
import com.questrail.wavemeter.queue.WriteRequestQueue;
import com.questrail.wavemeter.state.QuantityValues;
import com.questrail.wavemeter.state.SharedStateStore;
import com.questrail.wavemeter.state.WavemeterSnapshot;
import com.questrail.wavemeter.time.MonotonicClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * CommandService
 * =============================================================================
 * Executes decoded commands against the shared snapshot and the write queue.
 *
 * <p>Runs on command worker threads. It never calls the driver: writes go
 * through the {@link WriteRequestQueue}, reads come from the
 * {@link SharedStateStore}. CHECK_VALUE therefore reports what the device
 * last confirmed, never a pending local value.</p>
 *
 * <p>Every failure becomes an {@link CommandStatus#ERROR} response; nothing is
 * thrown back to the transport.</p>
 */
public final class CommandService
{
    private static final Logger log = LoggerFactory.getLogger(CommandService.class);

    private final SharedStateStore store;
    private final WriteRequestQueue queue;
    private final ConvergenceWaiter waiter;
    private final MonotonicClock clock;
    private final CommandCodec codec = new CommandCodec();

    public CommandService(SharedStateStore store, WriteRequestQueue queue, ConvergenceWaiter waiter, MonotonicClock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.waiter = Objects.requireNonNull(waiter, "waiter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Decodes, executes and encodes one request line.
     */
    public String handleLine(String line) {
        CommandResponse response;
        try {
            response = handle(codec.decode(line));
        } catch (CommandFormatException e) {
            log.debug("Rejected command {}: {}", line, e.getMessage());
            response = CommandResponse.error(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Command {} failed", line, e);
            response = CommandResponse.error("Internal error: " + e.getMessage());
        }
        return codec.encode(response);
    }

    public CommandResponse handle(CommandRequest request) {
        Objects.requireNonNull(request, "request");
        return switch (request.action()) {
            case HELLO -> CommandResponse.success();
            case CHECK_VALUE -> checkValue(request);
            case PROGRAM_VALUE -> programValue(request);
        };
    }

    private CommandResponse checkValue(CommandRequest request) {
        WavemeterSnapshot snapshot = store.read();
        Quantity quantity = request.quantity();
        ChannelId channel = null;
        if (quantity.scope() == Quantity.Scope.CHANNEL) {
            if (request.channel() == null) {
                return CommandResponse.error("Missing connection");
            }
            if (!snapshot.hasChannel(request.channel())) {
                return CommandResponse.error("Unknown channel: " + request.channel().value());
            }
            channel = request.channel();
        }
        return CommandResponse.value(QuantityValues.read(snapshot, channel, quantity));
    }

    private CommandResponse programValue(CommandRequest request) {
        Quantity quantity = request.quantity();
        if (!quantity.writable()) {
            return CommandResponse.error(quantity.wireName() + " is read-only");
        }
        if (request.value() == null) {
            return CommandResponse.error("Missing value");
        }

        ChannelId channel = request.channel();
        WriteRequest write;
        if (quantity.scope() == Quantity.Scope.CHANNEL) {
            if (channel == null) {
                return CommandResponse.error("Missing connection");
            }
            if (!store.read().hasChannel(channel)) {
                return CommandResponse.error("Unknown channel: " + channel.value());
            }
            write = WriteRequest.forChannel(channel, quantity, request.value(), WriteOrigin.REMOTE, clock.nowNanos());
        } else {
            if (request.waitForConvergence()) {
                return CommandResponse.error("wait needs a channel quantity");
            }
            write = WriteRequest.forInstrument(quantity, request.value(), WriteOrigin.REMOTE, clock.nowNanos());
        }

        EnqueueResult enqueued = queue.offer(write);
        if (enqueued == EnqueueResult.REJECTED_OUT_OF_RANGE) {
            return CommandResponse.error("Value out of range: " + rejectionMessage(write));
        }
        if (enqueued == EnqueueResult.REJECTED_QUEUE_FULL) {
            return CommandResponse.error("Write queue full");
        }

        if (!request.waitForConvergence()) {
            return CommandResponse.queued();
        }

        log.info("Waiting for {} to converge on {}", write.target(), request.value());
        try {
            ConvergenceWaiter.Outcome outcome = waiter.await(channel, write.completion());
            if (outcome instanceof ConvergenceWaiter.Converged c) {
                log.info("{} converged after {} ms", write.target(), c.elapsed().toMillis());
                return CommandResponse.converged(c.readBack());
            }
            if (outcome instanceof ConvergenceWaiter.Unregulated u) {
                log.info("{} applied; channel is not regulating, nothing to wait for", write.target());
                return CommandResponse.applied(u.readBack());
            }
            if (outcome instanceof ConvergenceWaiter.TimedOut t) {
                log.warn("{} did not converge within {} ms", write.target(), t.elapsed().toMillis());
                return CommandResponse.timeout("Timeout waiting for lock on channel " + channel.value()
                        + " after " + t.elapsed().toMillis() + " ms");
            }
            ConvergenceWaiter.WriteFailed f = (ConvergenceWaiter.WriteFailed) outcome;
            return CommandResponse.error("Write failed: " + f.reason());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Convergence wait for {} interrupted", write.target());
            return CommandResponse.error("Interrupted: server shutting down");
        }
    }

    private static String rejectionMessage(WriteRequest write) {
        Throwable cause = write.completion().handle((v, t) -> t).getNow(null);
        if (cause == null) {
            return String.valueOf(write.value());
        }
        Throwable root = cause.getCause() != null ? cause.getCause() : cause;
        return root.getMessage();
    }
}
