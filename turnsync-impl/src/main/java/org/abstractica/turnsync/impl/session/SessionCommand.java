package org.abstractica.turnsync.impl.session;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.DeltaReceipt;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.delta.TurnResult;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Work enqueued to a session for processing by its sequencing thread.
 */
public sealed interface SessionCommand
{
    /**
     * Submit one delta.
     *
     * @param delta  the delta
     * @param result completed with the receipt, or exceptionally with the refusal
     */
    record SubmitDelta(Delta delta, CompletableFuture<DeltaReceipt> result) implements SessionCommand
    {
        public SubmitDelta
        {
            Objects.requireNonNull(delta, "delta");
            Objects.requireNonNull(result, "result");
        }
    }

    /**
     * Submit and commit a whole batch for the open turn.
     *
     * @param batch  the batch
     * @param result completed with the turn result, or exceptionally on refusal or checksum mismatch
     */
    record SubmitBatch(TurnDeltas batch, CompletableFuture<TurnResult> result) implements SessionCommand
    {
        public SubmitBatch
        {
            Objects.requireNonNull(batch, "batch");
            Objects.requireNonNull(result, "result");
        }
    }

    /**
     * Close and commit the open turn.
     *
     * @param result completed with the turn result
     */
    record CloseTurn(CompletableFuture<TurnResult> result) implements SessionCommand
    {
        public CloseTurn
        {
            Objects.requireNonNull(result, "result");
        }
    }

    /**
     * Periodic tick: force-closes a turn that has been open too long.
     *
     * @param nowMs current time in milliseconds
     */
    record Tick(long nowMs) implements SessionCommand {}
}
