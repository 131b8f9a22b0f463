package org.abstractica.turnsync.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.abstractica.turnsync.state.StateValue;

import java.util.List;
import java.util.UUID;

/**
 * Messages sent from server to client.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public sealed interface ServerMessage permits
        ServerMessage.Event,
        ServerMessage.Events,
        ServerMessage.State,
        ServerMessage.Pong,
        ServerMessage.Error,
        ServerMessage.SessionList,
        ServerMessage.SessionLoaded,
        ServerMessage.Ack
{
    /**
     * A single game event.
     *
     * @param event the event
     */
    record Event(GameEvent event) implements ServerMessage
    {
    }

    /**
     * Several game events from the same turn, in order.
     *
     * @param events the events
     */
    record Events(List<GameEvent> events) implements ServerMessage
    {
        public Events
        {
            events = List.copyOf(events);
        }
    }

    /**
     * A full state tree.
     *
     * @param turn  the turn the state belongs to
     * @param state the state tree
     */
    record State(long turn, StateValue state) implements ServerMessage
    {
    }

    /**
     * Reply to a ping.
     *
     * @param timestamp  the client timestamp from the ping
     * @param serverTime server time in milliseconds
     */
    record Pong(long timestamp, long serverTime) implements ServerMessage
    {
    }

    /**
     * A rejected message, delta or turn.
     *
     * @param code    stable error code
     * @param message human-readable detail
     * @param details optional structured detail, for example the rejected delta id
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Error(String code, String message, StateValue details) implements ServerMessage
    {
    }

    /**
     * Known sessions.
     *
     * @param sessions one entry per session
     */
    record SessionList(List<SessionSummary> sessions) implements ServerMessage
    {
        public SessionList
        {
            sessions = List.copyOf(sessions);
        }
    }

    /**
     * The connection is now bound to a session.
     *
     * @param sessionId the session
     * @param state     its current state
     */
    record SessionLoaded(UUID sessionId, StateValue state) implements ServerMessage
    {
    }

    /**
     * Acknowledges a command or request.
     *
     * @param commandId the command id, absent for requests without one
     * @param success   whether it was handled
     * @param error     failure detail when not successful
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Ack(UUID commandId, boolean success, String error) implements ServerMessage
    {
    }
}
