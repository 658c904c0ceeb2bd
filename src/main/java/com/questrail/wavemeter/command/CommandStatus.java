package com.questrail.wavemeter.command;

/**
 * Outcome class of a command.
 */
public enum CommandStatus
{
    SUCCESS,
    /** A PROGRAM_VALUE wait ran out of time before convergence. */
    TIMEOUT,
    ERROR
}
