package org.abstractica.turnsync.impl.session;

import org.abstractica.turnsync.Connection;

import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * The session and event filter of one connection.
 */
public class ConnectionBinding
{
    private final Connection connection;
    private volatile UUID sessionId;
    private volatile Set<String> eventTypes;

    public ConnectionBinding(Connection connection)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.eventTypes = Set.of();
    }

    public Connection getConnection()
    {
        return connection;
    }

    /**
     * Returns the bound session.
     *
     * @return the session id, or null if no session is loaded
     */
    public UUID getSessionId()
    {
        return sessionId;
    }

    public void bind(UUID sessionId)
    {
        this.sessionId = sessionId;
    }

    public boolean isBoundTo(UUID id)
    {
        return id.equals(sessionId);
    }

    /**
     * Restricts delivered events. An empty set means all events.
     *
     * @param types event type names
     */
    public void subscribe(Set<String> types)
    {
        this.eventTypes = Set.copyOf(types);
    }

    public boolean accepts(String eventType)
    {
        Set<String> types = eventTypes;
        return types.isEmpty() || types.contains(eventType);
    }
}
