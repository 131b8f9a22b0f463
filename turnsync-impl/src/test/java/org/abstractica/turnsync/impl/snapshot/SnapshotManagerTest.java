package org.abstractica.turnsync.impl.snapshot;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.DeltaOp;
import org.abstractica.turnsync.delta.Snapshot;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.delta.TurnResult;
import org.abstractica.turnsync.error.ErrorCode;
import org.abstractica.turnsync.error.HistoryUnavailableException;
import org.abstractica.turnsync.error.IntegrityException;
import org.abstractica.turnsync.impl.delta.DeltaApplicator;
import org.abstractica.turnsync.impl.delta.StateFixtures;
import org.abstractica.turnsync.impl.sequencer.TurnSequencer;
import org.abstractica.turnsync.state.StateValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SnapshotManager}.
 */
class SnapshotManagerTest
{
    private DeltaApplicator applicator;
    private TurnSequencer sequencer;
    private List<StateValue> liveStates;

    @BeforeEach
    void setUp()
    {
        applicator = new DeltaApplicator();
        StateValue initial = StateFixtures.game();
        sequencer = new TurnSequencer(applicator, initial, 0, 4, 64, 0);
        liveStates = new ArrayList<>();
        liveStates.add(initial);
    }

    /** Plays {@code turns} turns, each adding a gold coin and an item, and records them. */
    private void play(SnapshotManager manager, int turns)
    {
        for (int i = 0; i < turns; i++)
        {
            long turn = sequencer.getOpenTurn();
            sequencer.submit(Delta.of(turn, "player", "gold", DeltaOp.INCREMENT, StateValue.of(1)));
            sequencer.submit(Delta.of(turn, "player", "inventory[*]", DeltaOp.PUSH, StateValue.of("coin-" + turn)));
            TurnResult result = sequencer.closeTurn(0);
            manager.recordCommit(result.committed(), sequencer.getCommittedState());
            liveStates.add(sequencer.getCommittedState());
        }
    }

    private SnapshotManager manager(int everyTurns, int maxRetained)
    {
        return new SnapshotManager(new Snapshot(0, liveStates.get(0)),
                new SnapshotPolicy(everyTurns, 1000), maxRetained, applicator);
    }

    @Test
    void stateAt_replayFromSnapshot_matchesLiveState()
    {
        SnapshotManager manager = manager(5, 4);
        play(manager, 7);

        assertEquals(5, manager.latestSnapshot().turn());
        assertEquals(liveStates.get(7), manager.stateAt(7));
    }

    @Test
    void stateAt_everyRetainedTurn()
    {
        SnapshotManager manager = manager(3, 4);
        play(manager, 10);

        for (int turn = 0; turn <= 10; turn++)
        {
            assertEquals(liveStates.get(turn), manager.stateAt(turn), "turn " + turn);
        }
    }

    @Test
    void recordCommit_takesSnapshotsOnCadence()
    {
        SnapshotManager manager = manager(2, 10);
        play(manager, 5);

        List<Long> turns = new ArrayList<>();
        for (Snapshot snapshot : manager.getHistory().snapshots())
        {
            turns.add(snapshot.turn());
        }
        assertEquals(List.of(0L, 2L, 4L), turns);
    }

    @Test
    void recordCommit_deltaCountTriggersSnapshot()
    {
        SnapshotManager manager = new SnapshotManager(new Snapshot(0, liveStates.get(0)),
                new SnapshotPolicy(100, 3), 4, applicator);
        play(manager, 1);
        assertEquals(0, manager.latestSnapshot().turn());

        play(manager, 1);
        assertEquals(2, manager.latestSnapshot().turn());
    }

    @Test
    void pruning_dropsOldTurns()
    {
        SnapshotManager manager = manager(2, 2);
        play(manager, 6);

        assertEquals(4, manager.oldestAvailableTurn());
        assertEquals(6, manager.latestTurn());
        HistoryUnavailableException e = assertThrows(HistoryUnavailableException.class, () -> manager.stateAt(3));
        assertEquals(ErrorCode.HISTORY_UNAVAILABLE, e.getCode());
        for (TurnDeltas batch : manager.getHistory().log())
        {
            assertTrue(batch.turn() > 4);
        }
        assertEquals(liveStates.get(5), manager.stateAt(5));
    }

    @Test
    void stateAt_futureTurn_unavailable()
    {
        SnapshotManager manager = manager(5, 4);
        play(manager, 2);

        assertThrows(HistoryUnavailableException.class, () -> manager.stateAt(3));
    }

    @Test
    void recordCommit_outOfOrder_rejected()
    {
        SnapshotManager manager = manager(5, 4);

        assertThrows(IllegalArgumentException.class,
                () -> manager.recordCommit(new TurnDeltas(2, List.of(), null), liveStates.get(0)));
    }

    @Test
    void replay_checksumMismatch_integrityError()
    {
        SnapshotManager manager = manager(5, 4);
        Delta delta = Delta.of(1, "player", "hp", DeltaOp.INCREMENT, StateValue.of(-1));
        StateValue after = applicator.apply(liveStates.get(0), delta).state();
        manager.recordCommit(new TurnDeltas(1, List.of(delta), "f".repeat(64)), after);

        IntegrityException e = assertThrows(IntegrityException.class, () -> manager.stateAt(1));
        assertEquals(ErrorCode.INTEGRITY_ERROR, e.getCode());
    }
}
