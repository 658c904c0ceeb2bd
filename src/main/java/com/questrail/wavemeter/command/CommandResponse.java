package com.questrail.wavemeter.command;

import java.util.Objects;

/**
 * Reply to one command. Absent fields are {@code null} and are not encoded.
 */
public record CommandResponse(
        CommandStatus status,
        String result,
        Double value,
        String message
) {
    public static final String RESULT_QUEUED = "QUEUED";
    public static final String RESULT_CONVERGED = "CONVERGED";
    public static final String RESULT_APPLIED = "APPLIED";

    public CommandResponse {
        Objects.requireNonNull(status, "status");
    }

    public static CommandResponse success() {
        return new CommandResponse(CommandStatus.SUCCESS, null, null, null);
    }

    public static CommandResponse queued() {
        return new CommandResponse(CommandStatus.SUCCESS, RESULT_QUEUED, null, null);
    }

    public static CommandResponse converged(double readBack) {
        return new CommandResponse(CommandStatus.SUCCESS, RESULT_CONVERGED, readBack, null);
    }

    /**
     * Written and read back, with no regulation to wait for.
     */
    public static CommandResponse applied(double readBack) {
        return new CommandResponse(CommandStatus.SUCCESS, RESULT_APPLIED, readBack, null);
    }

    public static CommandResponse value(double value) {
        return new CommandResponse(CommandStatus.SUCCESS, null, value, null);
    }

    public static CommandResponse timeout(String message) {
        return new CommandResponse(CommandStatus.TIMEOUT, null, null, message);
    }

    public static CommandResponse error(String message) {
        return new CommandResponse(CommandStatus.ERROR, null, null, message);
    }
}
