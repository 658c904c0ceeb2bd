package com.questrail.wavemeter.settings;

import com.questrail.wavemeter.api.ChannelId;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A complete saved-settings record: when it was taken, and the settings of
 * every channel it covers.
 */
public record SettingsRecord(Instant savedAt, Map<ChannelId, ChannelSettings> channels) {
    public SettingsRecord {
        Objects.requireNonNull(savedAt, "savedAt");
        channels = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(channels, "channels")));
    }
}
