package org.abstractica.turnsync.impl.session;

import org.abstractica.turnsync.impl.sequencer.TurnSequencer;
import org.abstractica.turnsync.impl.snapshot.SnapshotManager;
import org.abstractica.turnsync.impl.snapshot.SnapshotPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-session policy values.
 *
 * @param snapshotPolicy       snapshot cadence
 * @param maxRetainedSnapshots snapshots kept per session
 * @param lookaheadTurns       turns past the open turn that may be buffered
 * @param maxBufferedDeltas    buffered future delta capacity
 * @param turnTimeout          how long a turn with pending work may stay open
 * @param tickInterval         how often an idle session checks its turn timeout
 * @param queueCapacity        commands a session may have waiting before submissions are refused
 */
public record SessionSettings(
        SnapshotPolicy snapshotPolicy,
        int maxRetainedSnapshots,
        int lookaheadTurns,
        int maxBufferedDeltas,
        Duration turnTimeout,
        Duration tickInterval,
        int queueCapacity
)
{
    public static final SessionSettings DEFAULT = new SessionSettings(
            SnapshotPolicy.DEFAULT,
            SnapshotManager.DEFAULT_MAX_RETAINED,
            TurnSequencer.DEFAULT_LOOKAHEAD_TURNS,
            TurnSequencer.DEFAULT_MAX_BUFFERED_DELTAS,
            Duration.ofSeconds(30),
            Duration.ofSeconds(1),
            GameSession.DEFAULT_QUEUE_CAPACITY
    );

    public SessionSettings
    {
        Objects.requireNonNull(snapshotPolicy, "snapshotPolicy");
        Objects.requireNonNull(turnTimeout, "turnTimeout");
        Objects.requireNonNull(tickInterval, "tickInterval");
        if (queueCapacity <= 0)
        {
            throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
        }
    }
}
