package com.questrail.wavemeter.command;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;

import java.util.Objects;

/**
 * A decoded command.
 *
 * @param channel  the {@code connection} field; {@code null} when absent
 * @param quantity defaults to {@link Quantity#SETPOINT}
 * @param value    {@code null} when absent
 * @param waitForConvergence the {@code wait} flag of PROGRAM_VALUE
 */
public record CommandRequest(
        CommandAction action,
        ChannelId channel,
        Quantity quantity,
        Double value,
        boolean waitForConvergence
) {
    public CommandRequest {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(quantity, "quantity");
    }

    public static CommandRequest hello() {
        return new CommandRequest(CommandAction.HELLO, null, Quantity.SETPOINT, null, false);
    }

    public static CommandRequest programValue(ChannelId channel, Quantity quantity, double value, boolean wait) {
        return new CommandRequest(CommandAction.PROGRAM_VALUE, channel, quantity, value, wait);
    }

    public static CommandRequest checkValue(ChannelId channel, Quantity quantity) {
        return new CommandRequest(CommandAction.CHECK_VALUE, channel, quantity, null, false);
    }
}
