package com.questrail.wavemeter.settings;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import com.questrail.wavemeter.queue.AppliedWrite;
import com.questrail.wavemeter.queue.EnqueueResult;

import java.util.concurrent.CompletableFuture;

/**
 * Result of enqueueing one restored setting. {@code completion} finishes with
 * the applied write once the device owner has applied the write.
 */
public record RestoreOutcome(ChannelId channel,
                             Quantity quantity,
                             double value,
                             EnqueueResult result,
                             CompletableFuture<AppliedWrite> completion) {
}
