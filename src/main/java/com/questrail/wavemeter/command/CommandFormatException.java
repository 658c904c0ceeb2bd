package com.questrail.wavemeter.command;

/**
 * A request line could not be decoded into a {@link CommandRequest}.
 */
public class CommandFormatException extends Exception
{
    public CommandFormatException(String message) {
        super(message);
    }

    public CommandFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
