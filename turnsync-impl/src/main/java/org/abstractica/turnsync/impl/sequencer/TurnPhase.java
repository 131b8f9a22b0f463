package org.abstractica.turnsync.impl.sequencer;

/**
 * Phase of a {@link TurnSequencer}.
 */
public enum TurnPhase
{
    /** Accepting deltas for the open turn */
    OPEN,
    /** Applying the open turn's deltas; new submissions are refused */
    COMMITTING,
    /** Session closed; terminal */
    CLOSED
}
