package com.questrail.wavemeter.driver;

/**
 * Per-channel switcher state: whether the channel is measured and whether it is shown.
 */
public record SwitcherFlags(boolean use, boolean show) {
}
