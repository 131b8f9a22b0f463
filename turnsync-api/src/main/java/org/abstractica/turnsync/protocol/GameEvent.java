package org.abstractica.turnsync.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.abstractica.turnsync.delta.Delta;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Events broadcast to subscribers of a session after a turn is processed.
 *
 * <p>Subscribers filter on the event type name returned by {@link #eventType()}.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public sealed interface GameEvent permits
        GameEvent.StateDelta,
        GameEvent.DeltaRejected,
        GameEvent.TurnEnd,
        GameEvent.TurnRolledBack,
        GameEvent.SnapshotTaken
{
    UUID id();

    Instant timestamp();

    long turn();

    UUID sessionId();

    /**
     * Returns the wire type name of this event.
     *
     * @return for example {@code STATE_DELTA}
     */
    default String eventType()
    {
        return MessageTypes.typeName(getClass());
    }

    /**
     * A delta was committed.
     *
     * @param delta the effective delta, including its previous value
     */
    record StateDelta(UUID id, Instant timestamp, long turn, UUID sessionId, Delta delta) implements GameEvent
    {
    }

    /**
     * A delta was left out of a turn.
     *
     * @param deltaId the rejected delta's id
     * @param code    stable error code
     * @param message human-readable detail
     */
    record DeltaRejected(UUID id, Instant timestamp, long turn, UUID sessionId,
                         UUID deltaId, String code, String message) implements GameEvent
    {
    }

    /**
     * A turn was committed.
     *
     * @param checksum     state checksum after the turn
     * @param deltaCount   number of committed deltas
     * @param changedPaths target-qualified paths touched by the turn, in commit order
     */
    record TurnEnd(UUID id, Instant timestamp, long turn, UUID sessionId,
                   String checksum, int deltaCount, List<String> changedPaths) implements GameEvent
    {
        public TurnEnd
        {
            changedPaths = List.copyOf(changedPaths);
        }
    }

    /**
     * A turn commit was refused and its working state discarded.
     *
     * @param code    stable error code
     * @param message human-readable detail
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TurnRolledBack(UUID id, Instant timestamp, long turn, UUID sessionId,
                          String code, String message) implements GameEvent
    {
    }

    /**
     * The state after {@code turn} was captured as a snapshot.
     */
    record SnapshotTaken(UUID id, Instant timestamp, long turn, UUID sessionId) implements GameEvent
    {
    }
}
