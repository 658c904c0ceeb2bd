package com.questrail.wavemeter.telemetry;

import com.questrail.wavemeter.state.ChannelState;
import com.questrail.wavemeter.state.WavemeterSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Text format of one telemetry publication: {@code heartbeat}, then
 * {@code "<channel> <frequency>"} per channel in channel order, the frequency
 * being the last good sample in THz or {@code 0.0} before any.
 */
public final class TelemetryFormat
{
    public static final String HEARTBEAT = "heartbeat";

    private TelemetryFormat() {
    }

    public static List<String> messages(WavemeterSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        List<String> out = new ArrayList<>(snapshot.channels().size() + 1);
        out.add(HEARTBEAT);
        for (ChannelState c : snapshot.channels().values()) {
            out.add(c.channel().value() + " " + c.displayedFrequency());
        }
        return out;
    }
}
