package org.abstractica.turnsync;

import org.abstractica.turnsync.delta.DeltaReceipt;
import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.Snapshot;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.delta.TurnResult;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * What a {@link CommandHandler} may see and do within one session.
 */
public interface SessionContext
{
    UUID getSessionId();

    /**
     * Returns the turn that new deltas should carry.
     *
     * @return the open turn, one past the last committed turn
     */
    long getOpenTurn();

    /**
     * Returns the last committed state.
     *
     * @return the committed state and its turn
     */
    Snapshot getCurrentState();

    CompletableFuture<DeltaReceipt> submitDelta(Delta delta);

    CompletableFuture<TurnResult> submitBatch(TurnDeltas batch);

    CompletableFuture<TurnResult> closeTurn();
}
