package org.abstractica.turnsync.protocol;

import java.time.Instant;
import java.util.UUID;

/**
 * Listing entry for a session.
 *
 * @param id         session identifier
 * @param name       display name
 * @param theme      theme the session was created with
 * @param turn       last committed turn
 * @param lastPlayed time of the last activity
 */
public record SessionSummary(UUID id, String name, String theme, long turn, Instant lastPlayed)
{
}
