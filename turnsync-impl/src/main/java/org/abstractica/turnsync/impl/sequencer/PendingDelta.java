package org.abstractica.turnsync.impl.sequencer;

import org.abstractica.turnsync.delta.Delta;

import java.util.Comparator;
import java.util.Objects;

/**
 * A delta waiting for its turn to be committed.
 *
 * @param arrival arrival sequence number within the session
 * @param delta   the delta
 */
public record PendingDelta(long arrival, Delta delta)
{
    /**
     * Commit order: arrival order, ties broken by the delta id string.
     */
    public static final Comparator<PendingDelta> COMMIT_ORDER = Comparator
            .comparingLong(PendingDelta::arrival)
            .thenComparing(p -> p.delta().id().toString());

    public PendingDelta
    {
        Objects.requireNonNull(delta, "delta");
    }
}
