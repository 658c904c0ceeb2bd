package com.questrail.wavemeter.time;

import java.time.Instant;

/**
 * Wall-clock source used strictly for observability and persisted timestamps.
 * It MUST NOT be used for cadence or timeout decisions.
 */
public interface WallClock
{
    Instant now();
}
