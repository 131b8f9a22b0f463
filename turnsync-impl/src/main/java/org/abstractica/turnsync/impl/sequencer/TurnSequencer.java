package org.abstractica.turnsync.impl.sequencer;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.DeltaReceipt;
import org.abstractica.turnsync.delta.RejectedDelta;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.delta.TurnResult;
import org.abstractica.turnsync.error.IntegrityException;
import org.abstractica.turnsync.error.StaleTurnException;
import org.abstractica.turnsync.error.TurnGapException;
import org.abstractica.turnsync.error.TurnSyncException;
import org.abstractica.turnsync.impl.delta.AppliedDelta;
import org.abstractica.turnsync.impl.delta.DeltaApplicator;
import org.abstractica.turnsync.impl.serialization.StateChecksum;
import org.abstractica.turnsync.state.StateValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Groups deltas into turns and commits each turn atomically.
 *
 * <p>The sequencer is open on turn {@code T = lastCommittedTurn + 1}. A delta
 * for {@code T} is queued; a delta for an earlier turn is stale; a delta for
 * a later turn within the lookahead window is buffered until its turn opens.
 * Closing the turn applies the queued deltas in arrival order to a working
 * copy of the committed state. A delta that fails validation is left out and
 * reported; the others are committed. The checksum of the resulting state
 * is attached to the batch and, when the caller supplied one, must match it.
 * On a mismatch nothing is committed and only the deltas that batch brought
 * are discarded; deltas submitted on their own stay queued.</p>
 *
 * <p>The timeout clock of the open turn starts when it first has work: at
 * commit if deltas were promoted, otherwise at the first submitted delta.</p>
 *
 * <p>Committed delta ids are remembered for the lifetime of the sequencer;
 * re-submitting one returns the recorded effective delta and changes nothing.</p>
 *
 * <p>Not thread-safe. Each session drives its sequencer from one thread.</p>
 */
public class TurnSequencer
{
    private static final Logger LOG = LoggerFactory.getLogger(TurnSequencer.class);

    public static final int DEFAULT_LOOKAHEAD_TURNS = 4;
    public static final int DEFAULT_MAX_BUFFERED_DELTAS = 1024;

    private final DeltaApplicator applicator;
    private final int lookaheadTurns;
    private final int maxBufferedDeltas;

    private final List<PendingDelta> pending;
    private final Set<UUID> pendingIds;
    private final TreeMap<Long, List<PendingDelta>> buffered;
    private final Map<UUID, Delta> committed;

    private StateValue committedState;
    private long lastCommittedTurn;
    private long waitingSinceMs;
    private long nextArrival;
    private int bufferedCount;
    private TurnPhase phase;

    /**
     * Creates a sequencer with default limits.
     *
     * @param state             the committed state
     * @param lastCommittedTurn the turn that state belongs to
     * @param nowMs             current time, the opening time of the next turn
     */
    public TurnSequencer(StateValue state, long lastCommittedTurn, long nowMs)
    {
        this(new DeltaApplicator(), state, lastCommittedTurn,
                DEFAULT_LOOKAHEAD_TURNS, DEFAULT_MAX_BUFFERED_DELTAS, nowMs);
    }

    /**
     * Creates a sequencer.
     *
     * @param applicator        applies deltas
     * @param state             the committed state
     * @param lastCommittedTurn the turn that state belongs to
     * @param lookaheadTurns    how many turns past the open turn may be buffered
     * @param maxBufferedDeltas maximum number of buffered future deltas
     * @param nowMs             current time, the opening time of the next turn
     */
    public TurnSequencer(
            DeltaApplicator applicator,
            StateValue state,
            long lastCommittedTurn,
            int lookaheadTurns,
            int maxBufferedDeltas,
            long nowMs
    )
    {
        Objects.requireNonNull(applicator, "applicator");
        Objects.requireNonNull(state, "state");
        if (lastCommittedTurn < 0)
        {
            throw new IllegalArgumentException("lastCommittedTurn must be >= 0: " + lastCommittedTurn);
        }
        if (lookaheadTurns < 0)
        {
            throw new IllegalArgumentException("lookaheadTurns must be >= 0: " + lookaheadTurns);
        }
        if (maxBufferedDeltas <= 0)
        {
            throw new IllegalArgumentException("maxBufferedDeltas must be positive: " + maxBufferedDeltas);
        }
        this.applicator = applicator;
        this.lookaheadTurns = lookaheadTurns;
        this.maxBufferedDeltas = maxBufferedDeltas;
        this.pending = new ArrayList<>();
        this.pendingIds = new HashSet<>();
        this.buffered = new TreeMap<>();
        this.committed = new HashMap<>();
        this.committedState = state;
        this.lastCommittedTurn = lastCommittedTurn;
        this.waitingSinceMs = nowMs;
        this.phase = TurnPhase.OPEN;
    }

    // ========== Submission ==========

    /**
     * Submits a delta, reading the time from the system clock.
     *
     * @param delta the delta
     * @return what happened to the delta
     * @throws StaleTurnException if the delta's turn is already closed
     * @throws TurnGapException   if the delta's turn is beyond the lookahead window or the buffer is full
     */
    public DeltaReceipt submit(Delta delta)
    {
        return submit(delta, System.currentTimeMillis());
    }

    /**
     * Submits a delta.
     *
     * @param delta the delta
     * @param nowMs current time; starts the turn timeout if nothing was waiting
     * @return what happened to the delta
     * @throws StaleTurnException if the delta's turn is already closed
     * @throws TurnGapException   if the delta's turn is beyond the lookahead window or the buffer is full
     */
    public DeltaReceipt submit(Delta delta, long nowMs)
    {
        Objects.requireNonNull(delta, "delta");
        requirePhase(TurnPhase.OPEN);

        Delta previous = committed.get(delta.id());
        if (previous != null)
        {
            LOG.debug("Duplicate delta {} (committed in turn {})", delta.id(), previous.turn());
            return new DeltaReceipt(delta.id(), DeltaReceipt.Status.DUPLICATE, previous);
        }
        if (pendingIds.contains(delta.id()))
        {
            return new DeltaReceipt(delta.id(), DeltaReceipt.Status.ALREADY_PENDING, null);
        }

        long openTurn = getOpenTurn();
        if (delta.turn() < openTurn)
        {
            throw new StaleTurnException(delta.turn(), openTurn);
        }
        if (delta.turn() == openTurn)
        {
            startWaiting(nowMs);
            pending.add(new PendingDelta(nextArrival++, delta));
            pendingIds.add(delta.id());
            LOG.debug("Accepted delta {} for turn {}: {} {}:{}",
                    delta.id(), openTurn, delta.op().wireName(), delta.target(), delta.path());
            return new DeltaReceipt(delta.id(), DeltaReceipt.Status.ACCEPTED, null);
        }
        if (delta.turn() > openTurn + lookaheadTurns)
        {
            throw new TurnGapException(delta.turn(), openTurn, "Turn " + delta.turn()
                    + " is beyond the lookahead window (open turn " + openTurn + ", lookahead " + lookaheadTurns + ")");
        }
        if (bufferedCount >= maxBufferedDeltas)
        {
            throw new TurnGapException(delta.turn(), openTurn,
                    "Lookahead buffer full (" + maxBufferedDeltas + " deltas)");
        }
        startWaiting(nowMs);
        buffered.computeIfAbsent(delta.turn(), t -> new ArrayList<>()).add(new PendingDelta(nextArrival++, delta));
        pendingIds.add(delta.id());
        bufferedCount++;
        LOG.debug("Buffered delta {} for future turn {} (open turn {})", delta.id(), delta.turn(), openTurn);
        return new DeltaReceipt(delta.id(), DeltaReceipt.Status.BUFFERED, null);
    }

    // ========== Commit ==========

    /**
     * Closes the open turn and commits its deltas.
     *
     * @param nowMs current time, the opening time of the next turn
     * @return the committed batch and the rejected deltas
     */
    public TurnResult closeTurn(long nowMs)
    {
        return commit(null, nowMs);
    }

    /**
     * Submits a complete batch for the open turn and commits it.
     *
     * <p>Deltas already queued for the turn are committed together with the
     * batch. If the batch carries a checksum, it must equal the checksum of
     * the resulting state. When it does not, the deltas this batch added are
     * removed again and the rest of the open turn is left as it was.</p>
     *
     * @param batch the batch
     * @param nowMs current time
     * @return the committed batch and the rejected deltas
     * @throws StaleTurnException if the batch's turn is already closed
     * @throws TurnGapException   if the batch is not for the open turn
     * @throws IntegrityException if the checksum does not match; it lists the discarded deltas
     */
    public TurnResult submitBatch(TurnDeltas batch, long nowMs)
    {
        Objects.requireNonNull(batch, "batch");
        requirePhase(TurnPhase.OPEN);
        long openTurn = getOpenTurn();
        if (batch.turn() < openTurn)
        {
            throw new StaleTurnException(batch.turn(), openTurn);
        }
        if (batch.turn() > openTurn)
        {
            throw new TurnGapException(batch.turn(), openTurn,
                    "Batch for turn " + batch.turn() + " cannot be committed while turn " + openTurn + " is open");
        }
        int firstAdded = pending.size();
        for (Delta delta : batch.deltas())
        {
            submit(delta, nowMs);
        }
        List<PendingDelta> added = new ArrayList<>(pending.subList(firstAdded, pending.size()));
        try
        {
            return commit(batch.checksum(), nowMs);
        }
        catch (IntegrityException e)
        {
            List<UUID> discarded = new ArrayList<>(added.size());
            for (PendingDelta entry : added)
            {
                pending.remove(entry);
                pendingIds.remove(entry.delta().id());
                discarded.add(entry.delta().id());
            }
            LOG.warn("Discarded {} deltas of the batch for turn {}, {} remain queued",
                    discarded.size(), e.getTurn(), pending.size());
            throw new IntegrityException(e.getTurn(), e.getExpectedChecksum(), e.getActualChecksum(), discarded);
        }
    }

    private TurnResult commit(String expectedChecksum, long nowMs)
    {
        requirePhase(TurnPhase.OPEN);
        phase = TurnPhase.COMMITTING;
        long turn = getOpenTurn();
        try
        {
            pending.sort(PendingDelta.COMMIT_ORDER);

            StateValue working = committedState;
            List<Delta> effective = new ArrayList<>(pending.size());
            List<RejectedDelta> rejected = new ArrayList<>();
            for (PendingDelta entry : pending)
            {
                try
                {
                    AppliedDelta applied = applicator.apply(working, entry.delta());
                    working = applied.state();
                    effective.add(applied.effectiveDelta());
                }
                catch (TurnSyncException e)
                {
                    LOG.debug("Rejected delta {} in turn {}: {} {}", entry.delta().id(), turn, e.getCode(), e.getMessage());
                    rejected.add(new RejectedDelta(entry.delta(), e.getCode(), e.getMessage()));
                }
            }

            String checksum = StateChecksum.compute(working);
            if (expectedChecksum != null && !expectedChecksum.equals(checksum))
            {
                throw new IntegrityException(turn, expectedChecksum, checksum);
            }

            committedState = working;
            lastCommittedTurn = turn;
            for (Delta delta : effective)
            {
                committed.put(delta.id(), delta);
            }
            discardPending();
            waitingSinceMs = nowMs;
            promoteBuffered();

            LOG.debug("Committed turn {}: {} deltas, {} rejected, checksum {}",
                    turn, effective.size(), rejected.size(), checksum);
            return new TurnResult(new TurnDeltas(turn, effective, checksum), rejected, false);
        }
        finally
        {
            if (phase == TurnPhase.COMMITTING)
            {
                phase = TurnPhase.OPEN;
            }
        }
    }

    /**
     * Removes buffered deltas for turns after the open turn.
     *
     * <p>Used after a forced close: those deltas were waiting on turns that
     * did not complete in time and are reported to their submitters instead
     * of being held indefinitely.</p>
     *
     * @return the dropped deltas, in turn order
     */
    public List<Delta> dropBuffered()
    {
        List<Delta> dropped = new ArrayList<>();
        for (List<PendingDelta> entries : buffered.values())
        {
            for (PendingDelta entry : entries)
            {
                dropped.add(entry.delta());
                pendingIds.remove(entry.delta().id());
            }
        }
        buffered.clear();
        bufferedCount = 0;
        return dropped;
    }

    /**
     * Closes the sequencer. Further submissions fail.
     */
    public void close()
    {
        phase = TurnPhase.CLOSED;
        pending.clear();
        pendingIds.clear();
        buffered.clear();
        bufferedCount = 0;
    }

    // ========== Queries ==========

    public long getOpenTurn()
    {
        return lastCommittedTurn + 1;
    }

    public long getLastCommittedTurn()
    {
        return lastCommittedTurn;
    }

    public StateValue getCommittedState()
    {
        return committedState;
    }

    /**
     * Returns when the open turn started waiting: the commit that opened it
     * if deltas were promoted into it, otherwise the first delta submitted
     * while nothing was queued or buffered.
     *
     * @return time in milliseconds
     */
    public long getWaitingSinceMs()
    {
        return waitingSinceMs;
    }

    public TurnPhase getPhase()
    {
        return phase;
    }

    public int getPendingCount()
    {
        return pending.size();
    }

    public int getBufferedCount()
    {
        return bufferedCount;
    }

    /**
     * Returns whether the open turn or a future turn has deltas waiting.
     *
     * @return true if anything is queued or buffered
     */
    public boolean hasWork()
    {
        return !pending.isEmpty() || bufferedCount > 0;
    }

    /**
     * Looks up a committed delta.
     *
     * @param id the delta id
     * @return the effective delta, or empty if it was never committed
     */
    public Optional<Delta> findCommitted(UUID id)
    {
        return Optional.ofNullable(committed.get(id));
    }

    // ========== Internals ==========

    private void discardPending()
    {
        for (PendingDelta entry : pending)
        {
            pendingIds.remove(entry.delta().id());
        }
        pending.clear();
    }

    private void startWaiting(long nowMs)
    {
        if (!hasWork())
        {
            waitingSinceMs = nowMs;
        }
    }

    private void promoteBuffered()
    {
        List<PendingDelta> ready = buffered.remove(getOpenTurn());
        if (ready != null)
        {
            pending.addAll(ready);
            bufferedCount -= ready.size();
        }
    }

    private void requirePhase(TurnPhase expected)
    {
        if (phase != expected)
        {
            throw new IllegalStateException("Sequencer is " + phase + ", expected " + expected);
        }
    }
}
