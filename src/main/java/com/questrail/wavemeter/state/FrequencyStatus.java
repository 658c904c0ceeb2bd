package com.questrail.wavemeter.state;

/**
 * Outcome of the most recent frequency poll for a channel.
 */
public enum FrequencyStatus
{
    /** No usable sample has been observed yet. */
    NONE,

    /** The last poll delivered a new sample. */
    FRESH,

    /** The last poll reported "no new sample"; the stored value is the previous one. */
    UNCHANGED,

    /** The last poll returned an error code; the displayed value is the last good one. */
    INVALID
}
