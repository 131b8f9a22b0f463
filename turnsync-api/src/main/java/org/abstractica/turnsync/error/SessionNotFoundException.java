package org.abstractica.turnsync.error;

import java.util.UUID;

/**
 * No session is registered under the requested identifier.
 */
public class SessionNotFoundException extends TurnSyncException
{
    private final UUID sessionId;

    public SessionNotFoundException(UUID sessionId)
    {
        super(ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId);
        this.sessionId = sessionId;
    }

    public UUID getSessionId()
    {
        return sessionId;
    }
}
