package com.questrail.wavemeter.command;

import java.util.Arrays;
import java.util.Optional;

/**
 * Actions understood by the command server.
 */
public enum CommandAction
{
    /** Liveness check; always answered with SUCCESS. */
    HELLO,
    /** Enqueue a remote write, optionally waiting for convergence. */
    PROGRAM_VALUE,
    /** Read a value from the shared snapshot. */
    CHECK_VALUE;

    public static Optional<CommandAction> fromWire(String action) {
        if (action == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(a -> a.name().equals(action.trim())).findFirst();
    }
}
