package com.questrail.wavemeter.driver;

/**
 * A vendor driver call failed.
 *
 * <p>Caught at the device owner boundary; the affected quantity is left stale
 * for the current cycle and the loop continues.</p>
 */
public class DriverCallException extends RuntimeException
{
    private final String operation;

    public DriverCallException(String operation, String message) {
        super(operation + ": " + message);
        this.operation = operation;
    }

    public DriverCallException(String operation, String message, Throwable cause) {
        super(operation + ": " + message, cause);
        this.operation = operation;
    }

    /**
     * Name of the driver operation that failed, e.g. {@code readChannelSetpoint}.
     */
    public String operation() {
        return operation;
    }
}
