package org.abstractica.turnsync.impl.session;

import org.abstractica.turnsync.SessionContext;
import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.DeltaReceipt;
import org.abstractica.turnsync.delta.Snapshot;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.delta.TurnResult;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * {@link SessionContext} backed by a {@link GameSession}.
 */
public class DefaultSessionContext implements SessionContext
{
    private final GameSession session;

    public DefaultSessionContext(GameSession session)
    {
        this.session = Objects.requireNonNull(session, "session");
    }

    @Override
    public UUID getSessionId()
    {
        return session.getId();
    }

    @Override
    public long getOpenTurn()
    {
        return session.getOpenTurn();
    }

    @Override
    public Snapshot getCurrentState()
    {
        return session.getCurrent();
    }

    @Override
    public CompletableFuture<DeltaReceipt> submitDelta(Delta delta)
    {
        return session.submitDelta(delta);
    }

    @Override
    public CompletableFuture<TurnResult> submitBatch(TurnDeltas batch)
    {
        return session.submitBatch(batch);
    }

    @Override
    public CompletableFuture<TurnResult> closeTurn()
    {
        return session.closeTurn();
    }
}
