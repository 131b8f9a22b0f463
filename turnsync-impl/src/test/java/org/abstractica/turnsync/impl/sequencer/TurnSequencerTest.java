package org.abstractica.turnsync.impl.sequencer;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.DeltaOp;
import org.abstractica.turnsync.delta.DeltaReceipt;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.delta.TurnResult;
import org.abstractica.turnsync.error.ErrorCode;
import org.abstractica.turnsync.error.IntegrityException;
import org.abstractica.turnsync.error.StaleTurnException;
import org.abstractica.turnsync.error.TurnGapException;
import org.abstractica.turnsync.impl.delta.DeltaApplicator;
import org.abstractica.turnsync.impl.delta.StateFixtures;
import org.abstractica.turnsync.impl.path.Path;
import org.abstractica.turnsync.impl.path.PathResolver;
import org.abstractica.turnsync.impl.serialization.StateChecksum;
import org.abstractica.turnsync.state.StateValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link TurnSequencer}.
 */
class TurnSequencerTest
{
    private TurnSequencer sequencer;

    @BeforeEach
    void setUp()
    {
        sequencer = new TurnSequencer(new DeltaApplicator(), StateFixtures.game(), 0, 2, 4, 0);
    }

    private Optional<StateValue> at(String path)
    {
        return PathResolver.resolve(sequencer.getCommittedState(), Path.parse(path));
    }

    private static Delta hp(long turn, long amount)
    {
        return Delta.of(turn, "player", "hp", DeltaOp.INCREMENT, StateValue.of(amount));
    }

    /** Commits empty turns until {@code turn} is the last committed turn. */
    private void advanceTo(long turn)
    {
        while (sequencer.getLastCommittedTurn() < turn)
        {
            sequencer.closeTurn(0);
        }
    }

    // ========== Submission ==========

    @Test
    void newSequencer_opensNextTurn()
    {
        assertEquals(0, sequencer.getLastCommittedTurn());
        assertEquals(1, sequencer.getOpenTurn());
        assertEquals(TurnPhase.OPEN, sequencer.getPhase());
        assertFalse(sequencer.hasWork());
    }

    @Test
    void submit_openTurn_accepted()
    {
        DeltaReceipt receipt = sequencer.submit(hp(1, -1));

        assertEquals(DeltaReceipt.Status.ACCEPTED, receipt.status());
        assertEquals(1, sequencer.getPendingCount());
        assertEquals(Optional.of(StateValue.of(10)), at("player.hp"));
    }

    @Test
    void submit_closedTurn_stale()
    {
        advanceTo(2);

        StaleTurnException e = assertThrows(StaleTurnException.class, () -> sequencer.submit(hp(2, -1)));
        assertEquals(ErrorCode.STALE_TURN, e.getCode());
    }

    @Test
    void submit_beyondLookahead_turnGap()
    {
        TurnGapException e = assertThrows(TurnGapException.class, () -> sequencer.submit(hp(4, -1)));

        assertEquals(ErrorCode.TURN_GAP, e.getCode());
        assertEquals(0, sequencer.getBufferedCount());
    }

    @Test
    void submit_futureTurn_bufferedUntilItOpens()
    {
        assertEquals(DeltaReceipt.Status.BUFFERED, sequencer.submit(hp(3, -2)).status());
        assertEquals(1, sequencer.getBufferedCount());
        assertTrue(sequencer.hasWork());

        sequencer.closeTurn(0);
        assertEquals(0, sequencer.getPendingCount());

        sequencer.closeTurn(0);
        assertEquals(1, sequencer.getPendingCount());
        assertEquals(0, sequencer.getBufferedCount());

        TurnResult result = sequencer.closeTurn(0);
        assertEquals(3, result.turn());
        assertEquals(1, result.committed().deltas().size());
        assertEquals(Optional.of(StateValue.of(8)), at("player.hp"));
    }

    @Test
    void submit_bufferFull_turnGap()
    {
        for (int i = 0; i < 4; i++)
        {
            sequencer.submit(hp(2, -1));
        }

        assertThrows(TurnGapException.class, () -> sequencer.submit(hp(3, -1)));
    }

    @Test
    void submit_sameIdTwiceBeforeCommit_alreadyPending()
    {
        Delta delta = hp(1, -1);
        sequencer.submit(delta);

        assertEquals(DeltaReceipt.Status.ALREADY_PENDING, sequencer.submit(delta).status());
        assertEquals(1, sequencer.getPendingCount());
    }

    @Test
    void submit_committedId_duplicateWithoutChange()
    {
        Delta delta = hp(1, -3);
        sequencer.submit(delta);
        sequencer.closeTurn(0);
        StateValue committed = sequencer.getCommittedState();

        DeltaReceipt receipt = sequencer.submit(delta);

        assertEquals(DeltaReceipt.Status.DUPLICATE, receipt.status());
        assertEquals(StateValue.of(10), receipt.effectiveDelta().previousValue());
        assertSame(committed, sequencer.getCommittedState());
        assertEquals(0, sequencer.getPendingCount());
    }

    // ========== Commit ==========

    @Test
    void closeTurn_appliesInArrivalOrder()
    {
        sequencer.submit(Delta.of(1, "world", "weather", DeltaOp.SET, StateValue.of("rain")));
        sequencer.submit(Delta.of(1, "world", "weather", DeltaOp.SET, StateValue.of("snow")));

        TurnResult result = sequencer.closeTurn(0);

        assertEquals(Optional.of(StateValue.of("snow")), at("world.weather"));
        assertEquals(StateValue.of("rain"), result.committed().deltas().get(1).previousValue());
    }

    @Test
    void closeTurn_failingDelta_rejectedAloneOthersCommit()
    {
        Delta good = hp(1, -3);
        Delta bad = Delta.of(1, "player", "inventory", DeltaOp.PULL, StateValue.of("torch"));
        Delta alsoGood = Delta.of(1, "player", "inventory[*]", DeltaOp.PUSH, StateValue.of("torch"));
        sequencer.submit(good);
        sequencer.submit(bad);
        sequencer.submit(alsoGood);

        TurnResult result = sequencer.closeTurn(0);

        assertEquals(2, result.committed().deltas().size());
        assertEquals(1, result.rejected().size());
        assertEquals(bad.id(), result.rejected().get(0).delta().id());
        assertEquals(ErrorCode.ELEMENT_NOT_FOUND, result.rejected().get(0).code());
        assertEquals(Optional.of(StateValue.of(7)), at("player.hp"));
        assertEquals(Optional.of(StateValue.of("torch")), at("player.inventory[2]"));
        assertTrue(sequencer.findCommitted(good.id()).isPresent());
        assertTrue(sequencer.findCommitted(bad.id()).isEmpty());
    }

    @Test
    void closeTurn_emptyTurn_advances()
    {
        StateValue before = sequencer.getCommittedState();

        TurnResult result = sequencer.closeTurn(5);

        assertEquals(1, result.turn());
        assertTrue(result.committed().deltas().isEmpty());
        assertEquals(StateChecksum.compute(before), result.checksum());
        assertEquals(2, sequencer.getOpenTurn());
        assertEquals(5, sequencer.getWaitingSinceMs());
    }

    @Test
    void closeTurn_checksumMatchesCommittedState()
    {
        sequencer.submit(hp(1, -1));

        TurnResult result = sequencer.closeTurn(0);

        assertEquals(StateChecksum.compute(sequencer.getCommittedState()), result.checksum());
        assertEquals(result.checksum(), result.committed().checksum());
    }

    @Test
    void closeTurn_checksumSensitiveToDeltaValue()
    {
        TurnSequencer other = new TurnSequencer(new DeltaApplicator(), StateFixtures.game(), 0, 2, 4, 0);
        sequencer.submit(hp(1, -3));
        other.submit(hp(1, -4));

        assertNotEquals(sequencer.closeTurn(0).checksum(), other.closeTurn(0).checksum());
    }

    // ========== Batches ==========

    @Test
    void submitBatch_matchingChecksum_commits()
    {
        Delta delta = hp(1, -4);
        StateValue expected = new DeltaApplicator().apply(sequencer.getCommittedState(), delta).state();
        TurnDeltas batch = new TurnDeltas(1, List.of(delta), StateChecksum.compute(expected));

        TurnResult result = sequencer.submitBatch(batch, 0);

        assertEquals(1, result.turn());
        assertEquals(expected, sequencer.getCommittedState());
    }

    @Test
    void submitBatch_wrongChecksum_discardsOnlyTheBatch()
    {
        advanceTo(4);
        Delta separate = hp(5, -1);
        assertEquals(DeltaReceipt.Status.ACCEPTED, sequencer.submit(separate).status());
        StateValue before = sequencer.getCommittedState();
        TurnDeltas batch = new TurnDeltas(5, List.of(
                hp(5, -2),
                Delta.of(5, "world", "weather", DeltaOp.SET, StateValue.of("storm"))
        ), "0".repeat(64));

        IntegrityException e = assertThrows(IntegrityException.class, () -> sequencer.submitBatch(batch, 0));

        assertEquals(ErrorCode.INTEGRITY_ERROR, e.getCode());
        assertEquals(List.of(batch.deltas().get(0).id(), batch.deltas().get(1).id()), e.getDiscardedDeltaIds());
        assertEquals(4, sequencer.getLastCommittedTurn());
        assertEquals(5, sequencer.getOpenTurn());
        assertSame(before, sequencer.getCommittedState());
        assertEquals(1, sequencer.getPendingCount());
        assertEquals(TurnPhase.OPEN, sequencer.getPhase());

        TurnResult result = sequencer.closeTurn(0);

        assertEquals(5, result.turn());
        assertEquals(List.of(separate.id()), result.committed().deltas().stream().map(Delta::id).toList());
        assertEquals(Optional.of(StateValue.of(9)), at("player.hp"));
        assertEquals(Optional.of(StateValue.of("clear")), at("world.weather"));
    }

    @Test
    void submitBatch_wrongChecksum_keepsPendingDeltaItRepeats()
    {
        Delta separate = hp(1, -1);
        sequencer.submit(separate);

        IntegrityException e = assertThrows(IntegrityException.class,
                () -> sequencer.submitBatch(new TurnDeltas(1, List.of(separate), "bad"), 0));

        assertTrue(e.getDiscardedDeltaIds().isEmpty());
        assertEquals(1, sequencer.getPendingCount());
    }

    @Test
    void submitBatch_discardedDeltas_canBeResubmitted()
    {
        Delta delta = hp(1, -1);
        assertThrows(IntegrityException.class,
                () -> sequencer.submitBatch(new TurnDeltas(1, List.of(delta), "bad"), 0));

        assertEquals(DeltaReceipt.Status.ACCEPTED, sequencer.submit(delta).status());
    }

    @Test
    void submitBatch_staleOrFuture_rejected()
    {
        advanceTo(2);

        assertThrows(StaleTurnException.class,
                () -> sequencer.submitBatch(new TurnDeltas(2, List.of(), null), 0));
        assertThrows(TurnGapException.class,
                () -> sequencer.submitBatch(new TurnDeltas(4, List.of(), null), 0));
    }

    // ========== Forced Close Support ==========

    @Test
    void waitingSince_startsAtFirstDeltaOfAnEmptyTurn()
    {
        sequencer.submit(hp(1, -1), 5000);
        sequencer.submit(hp(1, -1), 6000);

        assertEquals(5000, sequencer.getWaitingSinceMs());
    }

    @Test
    void waitingSince_bufferedDeltaStartsTheClock()
    {
        sequencer.submit(hp(2, -1), 5000);

        assertEquals(5000, sequencer.getWaitingSinceMs());
    }

    @Test
    void waitingSince_promotedDeltasWaitFromCommit()
    {
        sequencer.submit(hp(2, -1), 1000);
        sequencer.closeTurn(7000);
        sequencer.submit(hp(2, -1), 9000);

        assertEquals(7000, sequencer.getWaitingSinceMs());
    }

    @Test
    void dropBuffered_returnsWaitingDeltas()
    {
        Delta future = hp(3, -1);
        sequencer.submit(future);
        sequencer.submit(hp(1, -1));

        List<Delta> dropped = sequencer.dropBuffered();

        assertEquals(List.of(future), dropped);
        assertEquals(0, sequencer.getBufferedCount());
        assertEquals(1, sequencer.getPendingCount());
        assertEquals(DeltaReceipt.Status.BUFFERED, sequencer.submit(future).status());
    }

    @Test
    void close_rejectsFurtherWork()
    {
        sequencer.close();

        assertEquals(TurnPhase.CLOSED, sequencer.getPhase());
        assertThrows(IllegalStateException.class, () -> sequencer.submit(hp(1, -1)));
        assertThrows(IllegalStateException.class, () -> sequencer.closeTurn(0));
    }
}
