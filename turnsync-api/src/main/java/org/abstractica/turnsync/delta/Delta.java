package org.abstractica.turnsync.delta;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.abstractica.turnsync.state.StateValue;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A single atomic mutation of the state tree.
 *
 * <p>The {@code target} selects a sub-root of the state ({@code world},
 * {@code player}, {@code npc:<id>} or {@code scene}) and {@code path}
 * addresses a location inside it using the dot/bracket grammar, for example
 * {@code inventory[2].charges} or {@code inventory[*]}.</p>
 *
 * <p>{@code previousValue} is filled in by the engine when the delta is
 * applied. It is informational (inspection and undo) and is never re-applied.
 * A {@code null} previous value means the location did not exist before the
 * delta (a fresh slot or a push).</p>
 *
 * @param id            globally unique identifier, used for idempotency
 * @param turn          the turn this delta belongs to
 * @param timestamp     when the delta was created
 * @param source        what produced the delta
 * @param target        state sub-root reference
 * @param path          location inside the target
 * @param op            operation to perform
 * @param value         operand of the operation; JSON null when not needed
 * @param previousValue value before application, or null if absent
 * @param description   optional human-readable description
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Delta(
        UUID id,
        long turn,
        Instant timestamp,
        DeltaSource source,
        String target,
        String path,
        DeltaOp op,
        StateValue value,
        StateValue previousValue,
        String description
)
{
    public Delta
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(op, "op");
        if (turn < 0)
        {
            throw new IllegalArgumentException("turn must be >= 0: " + turn);
        }
        if (value == null)
        {
            value = StateValue.nullValue();
        }
    }

    /**
     * Creates a delta with a random id, the current time and {@link DeltaSource#SYSTEM} as source.
     *
     * @param turn   the turn
     * @param target state sub-root reference
     * @param path   location inside the target
     * @param op     operation
     * @param value  operand
     * @return a new delta
     */
    public static Delta of(long turn, String target, String path, DeltaOp op, StateValue value)
    {
        return new Delta(UUID.randomUUID(), turn, Instant.now(), DeltaSource.SYSTEM,
                target, path, op, value, null, null);
    }

    /**
     * Returns the recorded previous value.
     *
     * @return the previous value, or empty if the location was absent or nothing was recorded
     */
    public Optional<StateValue> previous()
    {
        return Optional.ofNullable(previousValue);
    }

    /**
     * Returns a copy of this delta with the given previous value.
     *
     * @param previous the pre-mutation value, or null for absent
     * @return the effective delta
     */
    public Delta withPreviousValue(StateValue previous)
    {
        return new Delta(id, turn, timestamp, source, target, path, op, value, previous, description);
    }

    /**
     * Returns a copy of this delta with another operand.
     *
     * @param newValue the new operand
     * @return the modified delta
     */
    public Delta withValue(StateValue newValue)
    {
        return new Delta(id, turn, timestamp, source, target, path, op, newValue, previousValue, description);
    }

    /**
     * Returns a copy of this delta with another description.
     *
     * @param newDescription the description
     * @return the modified delta
     */
    public Delta withDescription(String newDescription)
    {
        return new Delta(id, turn, timestamp, source, target, path, op, value, previousValue, newDescription);
    }
}
