package org.abstractica.turnsync.impl.snapshot;

/**
 * When to capture a snapshot.
 *
 * <p>A snapshot is taken once {@code everyTurns} turns or {@code everyDeltas}
 * deltas have been committed since the previous one, whichever comes first.
 * Replay from the nearest snapshot therefore never covers more than
 * {@code everyTurns} batches.</p>
 *
 * @param everyTurns  turns between snapshots
 * @param everyDeltas deltas between snapshots
 */
public record SnapshotPolicy(int everyTurns, int everyDeltas)
{
    public static final SnapshotPolicy DEFAULT = new SnapshotPolicy(10, 200);

    public SnapshotPolicy
    {
        if (everyTurns <= 0)
        {
            throw new IllegalArgumentException("everyTurns must be positive: " + everyTurns);
        }
        if (everyDeltas <= 0)
        {
            throw new IllegalArgumentException("everyDeltas must be positive: " + everyDeltas);
        }
    }

    public boolean isDue(long turnsSinceSnapshot, long deltasSinceSnapshot)
    {
        return turnsSinceSnapshot >= everyTurns || deltasSinceSnapshot >= everyDeltas;
    }
}
