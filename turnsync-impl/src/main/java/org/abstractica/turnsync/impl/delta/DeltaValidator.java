package org.abstractica.turnsync.impl.delta;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.DeltaOp;
import org.abstractica.turnsync.error.ErrorCode;
import org.abstractica.turnsync.error.PathException;
import org.abstractica.turnsync.error.ValidationException;
import org.abstractica.turnsync.impl.path.Path;
import org.abstractica.turnsync.impl.path.PathResolver;
import org.abstractica.turnsync.impl.path.PathStep;
import org.abstractica.turnsync.impl.path.TargetRef;
import org.abstractica.turnsync.impl.serialization.NumberLimits;
import org.abstractica.turnsync.state.StateValue;
import org.abstractica.turnsync.state.StateValue.ArrayValue;
import org.abstractica.turnsync.state.StateValue.NumberValue;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Checks a delta's preconditions against a state without changing it.
 *
 * <p>Checks run in a fixed order: path syntax, wildcard placement, target
 * reference, target presence, path resolution, the operation's type
 * requirements, then the range of the numbers involved. The first failing
 * check determines the error code.</p>
 */
public class DeltaValidator
{
    /**
     * A delta that passed validation.
     *
     * @param delta    the delta
     * @param path     the absolute path from the state root
     * @param location where the operation applies
     */
    public record Validated(Delta delta, Path path, PathResolver.Location location)
    {
    }

    /**
     * Validates a delta.
     *
     * @param state the state the delta would be applied to
     * @param delta the delta
     * @return the resolved location
     * @throws PathException       if the path is malformed or does not resolve
     * @throws ValidationException if the target or operation does not fit the state
     */
    public Validated validate(StateValue state, Delta delta)
    {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(delta, "delta");

        Path relative = Path.parse(delta.path());
        PathResolver.checkWildcard(relative, delta.op());

        TargetRef target = TargetRef.parse(delta.target());
        if (PathResolver.resolve(state, target.root()).isEmpty())
        {
            throw new ValidationException(ErrorCode.NOT_FOUND,
                    "Target '" + delta.target() + "' does not exist in state");
        }

        Path path = target.resolve(relative);
        PathResolver.Location location = PathResolver.locate(state, path, delta.op());
        checkOperation(delta, path, location);
        checkNumbers(delta, location);
        return new Validated(delta, path, location);
    }

    private static void checkOperation(Delta delta, Path path, PathResolver.Location location)
    {
        DeltaOp op = delta.op();
        switch (op)
        {
            case SET ->
            {
                // any existing slot, or a new key under an existing object
            }
            case DELETE ->
            {
                if (location.current().isEmpty())
                {
                    throw new ValidationException(ErrorCode.NOT_FOUND,
                            "Nothing to delete at " + describe(delta));
                }
            }
            case PUSH ->
            {
                if (location.last() instanceof PathStep.Append)
                {
                    return;
                }
                StateValue current = location.current().orElseThrow(() -> new PathException(
                        ErrorCode.MISSING_PARENT, path.toString(), "No array to push to at " + describe(delta)));
                requireArray(current, delta);
            }
            case PULL ->
            {
                StateValue current = location.current().orElseThrow(() -> missingKey(delta, path));
                ArrayValue array = requireArray(current, delta);
                if (array.indexOf(delta.value()) < 0)
                {
                    throw new ValidationException(ErrorCode.ELEMENT_NOT_FOUND,
                            "No element equal to the pulled value in " + describe(delta));
                }
            }
            case INCREMENT ->
            {
                StateValue current = location.current().orElseThrow(() -> missingKey(delta, path));
                if (!(current instanceof NumberValue))
                {
                    throw new ValidationException(ErrorCode.TYPE_MISMATCH,
                            "Cannot increment " + current.typeName() + " at " + describe(delta));
                }
                if (!(delta.value() instanceof NumberValue))
                {
                    throw new ValidationException(ErrorCode.TYPE_MISMATCH,
                            "Increment amount must be a number, got " + delta.value().typeName());
                }
            }
        }
    }

    private static void checkNumbers(Delta delta, PathResolver.Location location)
    {
        Optional<BigDecimal> outOfRange = NumberLimits.findOutOfRange(delta.value());
        if (outOfRange.isEmpty() && delta.op() == DeltaOp.INCREMENT)
        {
            BigDecimal current = ((NumberValue) location.current().orElseThrow()).value();
            BigDecimal sum = current.add(((NumberValue) delta.value()).value());
            if (!NumberLimits.isWithinLimits(sum))
            {
                outOfRange = Optional.of(sum);
            }
        }
        if (outOfRange.isPresent())
        {
            throw new ValidationException(ErrorCode.NUMBER_OUT_OF_RANGE,
                    NumberLimits.describe(outOfRange.get()) + " in " + describe(delta));
        }
    }

    private static ArrayValue requireArray(StateValue value, Delta delta)
    {
        if (value instanceof ArrayValue array)
        {
            return array;
        }
        throw new ValidationException(ErrorCode.TYPE_MISMATCH,
                delta.op().wireName() + " needs an array, found " + value.typeName() + " at " + describe(delta));
    }

    private static PathException missingKey(Delta delta, Path path)
    {
        return new PathException(ErrorCode.MISSING_KEY, path.toString(),
                "Nothing at " + describe(delta));
    }

    static String describe(Delta delta)
    {
        return delta.target() + ":" + delta.path();
    }
}
