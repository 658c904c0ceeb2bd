package com.questrail.wavemeter.state;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * SharedStateStore
 * =============================================================================
 * The single lock-guarded holder of the latest {@link WavemeterSnapshot}.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #update(UnaryOperator)} acquires the lock, applies the mutator to
 *       the current snapshot, assigns the next revision and publishes the
 *       result before releasing the lock</li>
 *   <li>{@link #read()} acquires the lock and returns the current snapshot</li>
 * </ul>
 *
 * <p>Snapshots are immutable, so the value returned by {@link #read()} is a
 * copy in every observable sense: no caller can reach the guarded reference
 * and mutate it. Every state a reader sees was produced by exactly one
 * completed {@code update}.</p>
 *
 * <h2>Writers</h2>
 * Only the device owner loop calls {@link #update(UnaryOperator)}. Mutators run
 * under the lock and must be short and side-effect free; they must never call
 * the driver or block.
 *
 * <h2>Ordering</h2>
 * Updates are serialized by the lock, so revisions are totally ordered. A
 * reader that observes revision R has observed every update applied at or
 * before R.
 */
public final class SharedStateStore
{
    private final ReentrantLock lock = new ReentrantLock();

    private WavemeterSnapshot current;

    public SharedStateStore(WavemeterSnapshot initial) {
        this.current = Objects.requireNonNull(initial, "initial");
    }

    /**
     * Applies {@code mutator} to the current snapshot and publishes the result
     * under the next revision.
     *
     * @return the newly published snapshot
     */
    public WavemeterSnapshot update(UnaryOperator<WavemeterSnapshot> mutator) {
        Objects.requireNonNull(mutator, "mutator");
        lock.lock();
        try {
            WavemeterSnapshot mutated = Objects.requireNonNull(mutator.apply(current), "mutated snapshot");
            current = mutated.withRevision(current.revision() + 1);
            return current;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the snapshot of the most recently completed update.
     */
    public WavemeterSnapshot read() {
        lock.lock();
        try {
            return current;
        } finally {
            lock.unlock();
        }
    }
}
