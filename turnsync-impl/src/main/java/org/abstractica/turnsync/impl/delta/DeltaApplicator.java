package org.abstractica.turnsync.impl.delta;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.impl.path.PathResolver;
import org.abstractica.turnsync.impl.path.PathStep;
import org.abstractica.turnsync.state.StateValue;
import org.abstractica.turnsync.state.StateValue.ArrayValue;
import org.abstractica.turnsync.state.StateValue.NumberValue;
import org.abstractica.turnsync.state.StateValue.ObjectValue;

import java.util.Objects;

/**
 * Applies validated deltas to immutable state trees.
 *
 * <p>Semantics per operation:</p>
 * <ul>
 *   <li>{@code set} replaces the value at the path, or creates a new key under an existing object</li>
 *   <li>{@code delete} removes a key, or an array element; later elements shift down</li>
 *   <li>{@code push} appends the value to the array at the path (or at the parent of {@code [*]})</li>
 *   <li>{@code pull} removes the first element deep-equal to the value</li>
 *   <li>{@code increment} adds the numeric value; negative values decrement</li>
 * </ul>
 *
 * <p>The effective delta records the previous value: the replaced or deleted
 * value for {@code set} and {@code delete}, the whole prior array for
 * {@code pull}, the prior number for {@code increment}, and absent for
 * {@code push} and for {@code set} into a new key.</p>
 */
public class DeltaApplicator
{
    private final DeltaValidator validator;

    public DeltaApplicator()
    {
        this(new DeltaValidator());
    }

    public DeltaApplicator(DeltaValidator validator)
    {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    /**
     * Validates and applies a delta.
     *
     * @param state the current state, not modified
     * @param delta the delta
     * @return the new state and the effective delta
     * @throws org.abstractica.turnsync.error.TurnSyncException if validation fails
     */
    public AppliedDelta apply(StateValue state, Delta delta)
    {
        DeltaValidator.Validated validated = validator.validate(state, delta);
        PathResolver.Location location = validated.location();
        StateValue value = delta.value();

        StateValue previous;
        PathResolver.Terminal terminal;
        switch (delta.op())
        {
            case SET ->
            {
                previous = location.current().orElse(null);
                terminal = (container, last) -> replace(container, last, value);
            }
            case DELETE ->
            {
                previous = location.current().orElseThrow();
                terminal = DeltaApplicator::remove;
            }
            case PUSH ->
            {
                previous = null;
                terminal = (container, last) -> last instanceof PathStep.Append
                        ? ((ArrayValue) container).append(value)
                        : replace(container, last, ((ArrayValue) childOf(container, last)).append(value));
            }
            case PULL ->
            {
                ArrayValue array = (ArrayValue) location.current().orElseThrow();
                previous = array;
                terminal = (container, last) -> replace(container, last, array.without(array.indexOf(value)));
            }
            case INCREMENT ->
            {
                NumberValue number = (NumberValue) location.current().orElseThrow();
                previous = number;
                terminal = (container, last) -> replace(container, last, number.add((NumberValue) value));
            }
            default -> throw new IllegalStateException("Unknown op: " + delta.op());
        }

        StateValue newState = PathResolver.mutate(state, validated.path(), delta.op(), terminal);
        return new AppliedDelta(newState, delta.withPreviousValue(previous));
    }

    // ========== Container Edits ==========

    static StateValue replace(StateValue container, PathStep last, StateValue value)
    {
        if (last instanceof PathStep.Key key)
        {
            return ((ObjectValue) container).with(key.name(), value);
        }
        return ((ArrayValue) container).with(((PathStep.Index) last).index(), value);
    }

    static StateValue remove(StateValue container, PathStep last)
    {
        if (last instanceof PathStep.Key key)
        {
            return ((ObjectValue) container).without(key.name());
        }
        return ((ArrayValue) container).without(((PathStep.Index) last).index());
    }

    static StateValue childOf(StateValue container, PathStep last)
    {
        if (last instanceof PathStep.Key key)
        {
            return ((ObjectValue) container).entries().get(key.name());
        }
        return ((ArrayValue) container).get(((PathStep.Index) last).index());
    }
}
