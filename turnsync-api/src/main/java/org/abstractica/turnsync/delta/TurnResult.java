package org.abstractica.turnsync.delta;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of closing a turn.
 *
 * @param committed the committed batch, with effective deltas and checksum
 * @param rejected  deltas that failed validation and were left out
 * @param snapshotTaken whether the snapshot policy captured the resulting state
 */
public record TurnResult(TurnDeltas committed, List<RejectedDelta> rejected, boolean snapshotTaken)
{
    public TurnResult
    {
        Objects.requireNonNull(committed, "committed");
        rejected = List.copyOf(rejected);
    }

    public long turn()
    {
        return committed.turn();
    }

    public String checksum()
    {
        return committed.checksum();
    }

    public TurnResult withSnapshotTaken(boolean taken)
    {
        return new TurnResult(committed, rejected, taken);
    }
}
