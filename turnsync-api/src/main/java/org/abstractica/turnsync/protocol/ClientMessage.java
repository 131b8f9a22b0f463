package org.abstractica.turnsync.protocol;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.abstractica.turnsync.state.StateValue;

import java.util.List;
import java.util.UUID;

/**
 * Messages sent from client to server.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
public sealed interface ClientMessage permits
        ClientMessage.Command,
        ClientMessage.GetState,
        ClientMessage.GetStateAtTurn,
        ClientMessage.Ping,
        ClientMessage.Subscribe,
        ClientMessage.ListSessions,
        ClientMessage.LoadSession,
        ClientMessage.NewSession
{
    /**
     * Forwards a player command to the game rules.
     *
     * @param command the command
     */
    record Command(PlayerCommand command) implements ClientMessage
    {
    }

    /**
     * Requests the current state of the loaded session.
     */
    record GetState() implements ClientMessage
    {
    }

    /**
     * Requests the state of the loaded session as it was after a turn.
     *
     * @param turn the turn to reconstruct
     */
    record GetStateAtTurn(long turn) implements ClientMessage
    {
    }

    /**
     * Connection health check.
     *
     * @param timestamp client time, echoed in the pong
     */
    record Ping(long timestamp) implements ClientMessage
    {
    }

    /**
     * Restricts which event types this connection receives. An empty list means all events.
     *
     * @param eventTypes event type names such as {@code STATE_DELTA}
     */
    record Subscribe(List<String> eventTypes) implements ClientMessage
    {
        public Subscribe
        {
            eventTypes = eventTypes == null ? List.of() : List.copyOf(eventTypes);
        }
    }

    /**
     * Requests the list of known sessions.
     */
    record ListSessions() implements ClientMessage
    {
    }

    /**
     * Binds this connection to an existing session.
     *
     * @param sessionId the session to load
     */
    record LoadSession(UUID sessionId) implements ClientMessage
    {
    }

    /**
     * Creates a session and binds this connection to it.
     *
     * @param themeName         theme of the new game
     * @param playerName        name of the player
     * @param characterTemplate initial player character fields
     */
    record NewSession(String themeName, String playerName, StateValue characterTemplate) implements ClientMessage
    {
    }
}
