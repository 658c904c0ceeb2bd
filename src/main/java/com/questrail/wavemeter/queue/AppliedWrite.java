package com.questrail.wavemeter.queue;

/**
 * What the device owner reports when a write has been applied.
 *
 * <p>{@code frequencyChangeCount} is the written channel's sample count in the
 * snapshot that first holds {@code readBack}; every later sample was taken
 * after the write. It is {@code 0} for instrument-wide quantities.</p>
 */
public record AppliedWrite(double readBack, long frequencyChangeCount) {
}
