package org.abstractica.turnsync.delta;

import org.abstractica.turnsync.state.StateValue;

import java.util.Objects;

/**
 * A complete state at a turn boundary, the anchor for replay.
 *
 * @param turn  the last turn folded into the state
 * @param state the full state tree
 */
public record Snapshot(long turn, StateValue state)
{
    public Snapshot
    {
        Objects.requireNonNull(state, "state");
        if (turn < 0)
        {
            throw new IllegalArgumentException("turn must be >= 0: " + turn);
        }
    }
}
