package com.questrail.wavemeter.settings;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;

/**
 * One setting whose current value differs from the saved one.
 */
public record SettingDifference(ChannelId channel, Quantity quantity, double current, double saved) {
}
