package org.abstractica.turnsync.impl.delta;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.DeltaOp;
import org.abstractica.turnsync.impl.path.Path;
import org.abstractica.turnsync.impl.path.PathResolver;
import org.abstractica.turnsync.impl.path.PathStep;
import org.abstractica.turnsync.impl.path.TargetRef;
import org.abstractica.turnsync.state.StateValue;
import org.abstractica.turnsync.state.StateValue.ArrayValue;
import org.abstractica.turnsync.state.StateValue.ObjectValue;

import java.util.Objects;

/**
 * Reverts an applied delta using its recorded previous value.
 *
 * <p>Undo must be applied to the state the delta produced, and deltas must be
 * undone in reverse commit order: array indices are only meaningful against
 * that state.</p>
 */
public class DeltaInverter
{
    /**
     * Returns the state before {@code effective} was applied.
     *
     * @param state     the state right after the delta
     * @param effective the effective delta, as returned by the applicator
     * @return the restored state
     * @throws IllegalArgumentException if the delta lacks the previous value its op needs
     */
    public StateValue undo(StateValue state, Delta effective)
    {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(effective, "effective");

        Path path = TargetRef.parse(effective.target()).resolve(Path.parse(effective.path()));
        StateValue previous = effective.previousValue();

        PathResolver.Terminal terminal = switch (effective.op())
        {
            case SET -> previous == null
                    ? DeltaApplicator::remove
                    : (container, last) -> DeltaApplicator.replace(container, last, previous);
            case DELETE -> (container, last) -> reinsert(container, last, required(effective));
            case PUSH -> (container, last) -> last instanceof PathStep.Append
                    ? dropLast(container)
                    : DeltaApplicator.replace(container, last, dropLast(DeltaApplicator.childOf(container, last)));
            case PULL, INCREMENT -> (container, last) -> DeltaApplicator.replace(container, last, required(effective));
        };
        return PathResolver.mutate(state, path, DeltaOp.SET, terminal);
    }

    private static StateValue reinsert(StateValue container, PathStep last, StateValue previous)
    {
        if (last instanceof PathStep.Key key)
        {
            return ((ObjectValue) container).with(key.name(), previous);
        }
        return ((ArrayValue) container).insert(((PathStep.Index) last).index(), previous);
    }

    private static StateValue dropLast(StateValue array)
    {
        ArrayValue elements = (ArrayValue) array;
        if (elements.size() == 0)
        {
            throw new IllegalArgumentException("Cannot undo push: array is empty");
        }
        return elements.without(elements.size() - 1);
    }

    private static StateValue required(Delta effective)
    {
        return effective.previous().orElseThrow(() -> new IllegalArgumentException(
                "Delta " + effective.id() + " (" + effective.op().wireName() + ") has no previous value"));
    }
}
