package org.abstractica.turnsync.impl.session;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.TurnResult;
import org.abstractica.turnsync.error.IntegrityException;

import java.util.List;

/**
 * Callback from a session to its owner.
 *
 * <p>Called on the session's sequencing thread after the state change has
 * been published, so listeners observe the new state.</p>
 */
public interface SessionListener
{
    /**
     * A turn was committed.
     *
     * @param session the session
     * @param result  the committed batch and rejected deltas
     */
    void onTurnCommitted(GameSession session, TurnResult result);

    /**
     * A batch failed its checksum. The turn stays open without the batch's deltas.
     *
     * @param session the session
     * @param turn    the turn that was not committed
     * @param error   the mismatch, listing the discarded delta ids
     */
    void onTurnRolledBack(GameSession session, long turn, IntegrityException error);

    /**
     * Buffered future-turn deltas were dropped after a forced close.
     *
     * @param session the session
     * @param dropped the dropped deltas
     */
    void onDeltasDropped(GameSession session, List<Delta> dropped);
}
