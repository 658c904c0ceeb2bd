package com.questrail.wavemeter.state;

import com.questrail.wavemeter.api.ChannelId;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * WavemeterSnapshot
 * -----------------------------------------------------------------------------
 * Immutable, internally consistent copy of all observable wavemeter state as of
 * one revision.
 *
 * <p>Snapshots are pure data. The only way to obtain a newer one is through
 * {@link SharedStateStore#update(UnaryOperator)}, which also assigns the
 * revision; the {@code with*} methods here never touch the revision.</p>
 */
public final class WavemeterSnapshot
{
    private final long revision;
    private final Map<ChannelId, ChannelState> channels;
    private final GlobalReadings globals;

    private WavemeterSnapshot(long revision, Map<ChannelId, ChannelState> channels, GlobalReadings globals) {
        this.revision = revision;
        this.channels = channels;
        this.globals = Objects.requireNonNull(globals, "globals");
    }

    /**
     * Creates the revision-0 snapshot for the given channels.
     */
    public static WavemeterSnapshot initial(Collection<ChannelId> channelIds) {
        Map<ChannelId, ChannelState> map = new TreeMap<>();
        for (ChannelId id : channelIds) {
            map.put(id, ChannelState.initial(id));
        }
        return new WavemeterSnapshot(0L, Collections.unmodifiableMap(map), GlobalReadings.initial());
    }

    public long revision() {
        return revision;
    }

    /**
     * Returns an immutable view of all channel states in channel order.
     */
    public Map<ChannelId, ChannelState> channels() {
        return channels;
    }

    /**
     * @throws IllegalArgumentException if the channel is not configured
     */
    public ChannelState channel(ChannelId id) {
        ChannelState state = channels.get(Objects.requireNonNull(id, "id"));
        if (state == null) {
            throw new IllegalArgumentException("Unknown channel: " + id.value());
        }
        return state;
    }

    public boolean hasChannel(ChannelId id) {
        return channels.containsKey(id);
    }

    public GlobalReadings globals() {
        return globals;
    }

    public WavemeterSnapshot withChannel(ChannelId id, UnaryOperator<ChannelState> change) {
        ChannelState current = channel(id);
        ChannelState next = Objects.requireNonNull(change.apply(current), "changed channel state");
        if (next == current) {
            return this;
        }
        if (!next.channel().equals(id)) {
            throw new IllegalArgumentException("Channel state for " + next.channel() + " cannot replace " + id);
        }
        Map<ChannelId, ChannelState> map = new TreeMap<>(channels);
        map.put(id, next);
        return new WavemeterSnapshot(revision, Collections.unmodifiableMap(map), globals);
    }

    public WavemeterSnapshot withGlobals(UnaryOperator<GlobalReadings> change) {
        GlobalReadings next = Objects.requireNonNull(change.apply(globals), "changed globals");
        return next == globals ? this : new WavemeterSnapshot(revision, channels, next);
    }

    WavemeterSnapshot withRevision(long newRevision) {
        return new WavemeterSnapshot(newRevision, channels, globals);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WavemeterSnapshot that)) return false;
        return revision == that.revision && channels.equals(that.channels) && globals.equals(that.globals);
    }

    @Override
    public int hashCode() {
        return Objects.hash(revision, channels, globals);
    }

    @Override
    public String toString() {
        return "WavemeterSnapshot[revision=" + revision + ", channels=" + channels.size() + ", globals=" + globals + "]";
    }
}
