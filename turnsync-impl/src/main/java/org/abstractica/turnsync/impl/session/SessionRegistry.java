package org.abstractica.turnsync.impl.session;

import org.abstractica.turnsync.error.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Manages session lifecycle and lookup.
 *
 * <p>Thread-safe for concurrent access from connection threads and the tick thread.</p>
 */
public class SessionRegistry
{
    private static final Logger LOG = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<UUID, GameSession> sessions;
    private final Duration idleTimeout;

    /**
     * Creates a registry.
     *
     * @param idleTimeout how long an unused session survives
     */
    public SessionRegistry(Duration idleTimeout)
    {
        this.idleTimeout = Objects.requireNonNull(idleTimeout, "idleTimeout");
        this.sessions = new ConcurrentHashMap<>();
    }

    // ========== Lookup ==========

    /**
     * Finds a session.
     *
     * @param id the session id
     * @return the session, or null if not found
     */
    public GameSession find(UUID id)
    {
        Objects.requireNonNull(id, "id");
        return sessions.get(id);
    }

    /**
     * Returns a session or fails.
     *
     * @param id the session id
     * @return the session
     * @throws SessionNotFoundException if the session is unknown
     */
    public GameSession require(UUID id)
    {
        GameSession session = find(id);
        if (session == null)
        {
            throw new SessionNotFoundException(id);
        }
        return session;
    }

    /**
     * Runs an action on a session while eviction of that session is held off.
     *
     * <p>The action runs inside the map's per-key compute, as does the
     * eviction check, so a connection bound by the action is always seen by
     * {@link #evictIdle}. The action must be short and must not touch the
     * registry.</p>
     *
     * @param id     the session id
     * @param action run with the session
     * @return the session
     * @throws SessionNotFoundException if the session is unknown or was just evicted
     */
    public GameSession acquire(UUID id, Consumer<GameSession> action)
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(action, "action");
        GameSession session = sessions.computeIfPresent(id, (key, found) ->
        {
            action.accept(found);
            return found;
        });
        if (session == null)
        {
            throw new SessionNotFoundException(id);
        }
        return session;
    }

    public Collection<GameSession> getAll()
    {
        return Collections.unmodifiableCollection(sessions.values());
    }

    public int size()
    {
        return sessions.size();
    }

    // ========== Registration ==========

    public void register(GameSession session)
    {
        Objects.requireNonNull(session, "session");
        sessions.put(session.getId(), session);
        LOG.info("Session registered: id={}, name={}", session.getId(), session.getName());
    }

    /**
     * Removes and stops a session.
     *
     * @param session the session
     */
    public void remove(GameSession session)
    {
        Objects.requireNonNull(session, "session");
        sessions.remove(session.getId());
        session.stop();
        LOG.info("Session removed: id={}", session.getId());
    }

    // ========== Maintenance ==========

    /**
     * Removes sessions that have been idle longer than the idle timeout.
     *
     * @param nowMs  current time in milliseconds
     * @param inUse  sessions for which this returns true are never evicted
     * @return the evicted sessions
     */
    public List<GameSession> evictIdle(long nowMs, Predicate<GameSession> inUse)
    {
        List<GameSession> evicted = new ArrayList<>();
        for (GameSession candidate : sessions.values())
        {
            if (!isIdle(candidate, nowMs))
            {
                continue;
            }
            // checked again under the key's lock, see acquire
            sessions.computeIfPresent(candidate.getId(), (id, session) ->
            {
                if (isIdle(session, nowMs) && !inUse.test(session))
                {
                    evicted.add(session);
                    return null;
                }
                return session;
            });
        }
        for (GameSession session : evicted)
        {
            session.stop();
            LOG.info("Session removed: id={}", session.getId());
        }
        return evicted;
    }

    private boolean isIdle(GameSession session, long nowMs)
    {
        return nowMs - session.getLastActivityMs() > idleTimeout.toMillis();
    }
}
