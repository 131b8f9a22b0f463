package org.abstractica.turnsync.impl.delta;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.state.StateValue;

import java.util.Objects;

/**
 * Result of applying one delta.
 *
 * @param state          the new state tree
 * @param effectiveDelta the delta with its previous value recorded
 */
public record AppliedDelta(StateValue state, Delta effectiveDelta)
{
    public AppliedDelta
    {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(effectiveDelta, "effectiveDelta");
    }
}
