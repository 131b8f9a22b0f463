package org.abstractica.turnsync.impl.snapshot;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.Snapshot;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.error.HistoryUnavailableException;
import org.abstractica.turnsync.error.IntegrityException;
import org.abstractica.turnsync.error.TurnSyncException;
import org.abstractica.turnsync.impl.delta.DeltaApplicator;
import org.abstractica.turnsync.impl.serialization.StateChecksum;
import org.abstractica.turnsync.state.StateValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keeps periodic snapshots and the committed batches since the oldest one.
 *
 * <p>{@link #recordCommit} is called by the session's sequencing thread only.
 * Readers on other threads see an immutable {@link History} published through
 * a volatile field, so a reconstruction always works on a consistent past
 * version and never blocks the writer.</p>
 *
 * <p>When more than {@code maxRetained} snapshots exist the oldest is dropped
 * together with the batches it made redundant; turns before the oldest
 * retained snapshot can no longer be reconstructed.</p>
 */
public class SnapshotManager
{
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotManager.class);

    public static final int DEFAULT_MAX_RETAINED = 4;

    /**
     * Retained snapshots and batches.
     *
     * @param snapshots snapshots in turn order, never empty
     * @param log       committed batches after the oldest snapshot, in turn order
     */
    public record History(List<Snapshot> snapshots, List<TurnDeltas> log)
    {
        public History
        {
            snapshots = List.copyOf(snapshots);
            log = List.copyOf(log);
        }

        public Snapshot oldest()
        {
            return snapshots.get(0);
        }

        public Snapshot latest()
        {
            return snapshots.get(snapshots.size() - 1);
        }

        public long latestTurn()
        {
            return log.isEmpty() ? latest().turn() : Math.max(latest().turn(), log.get(log.size() - 1).turn());
        }
    }

    private final SnapshotPolicy policy;
    private final int maxRetained;
    private final DeltaApplicator applicator;

    private volatile History history;
    private long deltasSinceSnapshot;

    /**
     * Creates a manager anchored at an initial snapshot.
     *
     * @param initial     the first snapshot, usually turn 0
     * @param policy      snapshot cadence
     * @param maxRetained number of snapshots to keep
     * @param applicator  applies deltas during replay
     */
    public SnapshotManager(Snapshot initial, SnapshotPolicy policy, int maxRetained, DeltaApplicator applicator)
    {
        Objects.requireNonNull(initial, "initial");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.applicator = Objects.requireNonNull(applicator, "applicator");
        if (maxRetained <= 0)
        {
            throw new IllegalArgumentException("maxRetained must be positive: " + maxRetained);
        }
        this.maxRetained = maxRetained;
        this.history = new History(List.of(initial), List.of());
    }

    /**
     * Appends a committed batch and takes a snapshot if the policy says so.
     *
     * @param batch the committed batch, for the turn after the latest recorded one
     * @param state the state after the batch
     * @return true if a snapshot was taken
     */
    public boolean recordCommit(TurnDeltas batch, StateValue state)
    {
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(state, "state");
        History current = history;
        if (batch.turn() != current.latestTurn() + 1)
        {
            throw new IllegalArgumentException("Expected batch for turn " + (current.latestTurn() + 1)
                    + ", got " + batch.turn());
        }

        List<Snapshot> snapshots = new ArrayList<>(current.snapshots());
        List<TurnDeltas> log = new ArrayList<>(current.log());
        log.add(batch);
        deltasSinceSnapshot += batch.deltas().size();

        boolean taken = policy.isDue(batch.turn() - current.latest().turn(), deltasSinceSnapshot);
        if (taken)
        {
            snapshots.add(new Snapshot(batch.turn(), state));
            deltasSinceSnapshot = 0;
            while (snapshots.size() > maxRetained)
            {
                snapshots.remove(0);
            }
            long horizon = snapshots.get(0).turn();
            log.removeIf(b -> b.turn() <= horizon);
            LOG.debug("Snapshot taken at turn {} (retaining turns {}..{})", batch.turn(), horizon, batch.turn());
        }
        history = new History(snapshots, log);
        return taken;
    }

    /**
     * Returns a snapshot of the state after {@code turn}.
     *
     * @param turn a turn within the retained history
     * @return a stored snapshot, or one reconstructed by replay
     * @throws HistoryUnavailableException if the turn is not retained
     */
    public Snapshot snapshotAt(long turn)
    {
        History h = history;
        Snapshot base = baseFor(h, turn);
        if (base.turn() == turn)
        {
            return base;
        }
        return new Snapshot(turn, replay(h, base, turn));
    }

    /**
     * Reconstructs the state after {@code turn}.
     *
     * <p>Starts from the latest snapshot at or before {@code turn} and replays
     * the batches after it. Every replayed batch is checked against its
     * recorded checksum.</p>
     *
     * @param turn a turn within the retained history
     * @return the state after that turn
     * @throws HistoryUnavailableException if the turn is not retained
     * @throws IntegrityException          if replay does not reproduce a recorded checksum
     */
    public StateValue stateAt(long turn)
    {
        return snapshotAt(turn).state();
    }

    public History getHistory()
    {
        return history;
    }

    public Snapshot latestSnapshot()
    {
        return history.latest();
    }

    public long oldestAvailableTurn()
    {
        return history.oldest().turn();
    }

    public long latestTurn()
    {
        return history.latestTurn();
    }

    // ========== Replay ==========

    private static Snapshot baseFor(History h, long turn)
    {
        if (turn < h.oldest().turn() || turn > h.latestTurn())
        {
            throw new HistoryUnavailableException(turn, h.oldest().turn(), h.latestTurn());
        }
        Snapshot base = h.oldest();
        for (Snapshot snapshot : h.snapshots())
        {
            if (snapshot.turn() <= turn)
            {
                base = snapshot;
            }
        }
        return base;
    }

    private StateValue replay(History h, Snapshot base, long turn)
    {
        StateValue working = base.state();
        for (TurnDeltas batch : h.log())
        {
            if (batch.turn() <= base.turn())
            {
                continue;
            }
            if (batch.turn() > turn)
            {
                break;
            }
            for (Delta delta : batch.deltas())
            {
                try
                {
                    working = applicator.apply(working, delta).state();
                }
                catch (TurnSyncException e)
                {
                    throw new IllegalStateException("Replay of turn " + batch.turn() + " failed at delta "
                            + delta.id() + ": " + e.getMessage(), e);
                }
            }
            if (batch.checksum() != null)
            {
                String actual = StateChecksum.compute(working);
                if (!batch.checksum().equals(actual))
                {
                    throw new IntegrityException(batch.turn(), batch.checksum(), actual);
                }
            }
        }
        return working;
    }
}
