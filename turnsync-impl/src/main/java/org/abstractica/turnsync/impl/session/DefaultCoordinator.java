package org.abstractica.turnsync.impl.session;

import org.abstractica.turnsync.CommandHandler;
import org.abstractica.turnsync.Connection;
import org.abstractica.turnsync.Coordinator;
import org.abstractica.turnsync.InitialStateFactory;
import org.abstractica.turnsync.Protocol;
import org.abstractica.turnsync.SessionStats;
import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.DeltaReceipt;
import org.abstractica.turnsync.delta.RejectedDelta;
import org.abstractica.turnsync.delta.Snapshot;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.delta.TurnResult;
import org.abstractica.turnsync.error.ErrorCode;
import org.abstractica.turnsync.error.IntegrityException;
import org.abstractica.turnsync.error.SessionNotFoundException;
import org.abstractica.turnsync.error.TurnSyncException;
import org.abstractica.turnsync.impl.serialization.JsonProtocol;
import org.abstractica.turnsync.protocol.ClientMessage;
import org.abstractica.turnsync.protocol.GameEvent;
import org.abstractica.turnsync.protocol.PlayerCommand;
import org.abstractica.turnsync.protocol.ServerMessage;
import org.abstractica.turnsync.protocol.SessionSummary;
import org.abstractica.turnsync.state.StateValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Default implementation of the Coordinator interface.
 *
 * <p>Routes client messages to sessions, turns committed turns into game
 * events for subscribed connections and runs a tick thread that drives
 * turn timeouts and idle-session eviction. Routing holds no game logic:
 * commands go to the {@link CommandHandler}, which submits deltas back.</p>
 */
public class DefaultCoordinator implements Coordinator, SessionListener
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultCoordinator.class);

    private final JsonProtocol protocol;
    private final CommandHandler commandHandler;
    private final InitialStateFactory initialStateFactory;
    private final SessionSettings settings;
    private final SessionRegistry registry;
    private final Map<String, ConnectionBinding> bindings;
    private final List<Consumer<SessionSummary>> sessionEvictedCallbacks;

    private Thread tickThread;
    private volatile boolean running;

    /**
     * Creates a new coordinator.
     *
     * <p>Use {@link DefaultCoordinatorFactory} to create instances.</p>
     */
    DefaultCoordinator(
            JsonProtocol protocol,
            CommandHandler commandHandler,
            InitialStateFactory initialStateFactory,
            SessionSettings settings,
            Duration sessionIdleTimeout
    )
    {
        this.protocol = Objects.requireNonNull(protocol, "protocol");
        this.commandHandler = commandHandler;
        this.initialStateFactory = Objects.requireNonNull(initialStateFactory, "initialStateFactory");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.registry = new SessionRegistry(sessionIdleTimeout);
        this.bindings = new ConcurrentHashMap<>();
        this.sessionEvictedCallbacks = new CopyOnWriteArrayList<>();
        this.running = false;
    }

    // ========== Lifecycle ==========

    @Override
    public void start()
    {
        if (running)
        {
            throw new IllegalStateException("Coordinator already started");
        }
        running = true;
        tickThread = new Thread(this::tickLoop, "coordinator-tick");
        tickThread.setDaemon(true);
        tickThread.start();
        LOG.info("Coordinator started (protocol {}, checksum {})", protocol.getHash(), protocol.getChecksumAlgorithm());
    }

    @Override
    public void close()
    {
        LOG.info("Closing coordinator");
        running = false;
        if (tickThread != null)
        {
            tickThread.interrupt();
        }
        for (GameSession session : registry.getAll())
        {
            registry.remove(session);
        }
        bindings.clear();
        LOG.info("Coordinator closed");
    }

    // ========== Client Messages ==========

    @Override
    public void handle(Connection connection, String json)
    {
        Objects.requireNonNull(connection, "connection");
        ClientMessage message;
        try
        {
            message = protocol.decodeClientMessage(json);
        }
        catch (TurnSyncException e)
        {
            LOG.debug("Malformed message from {}: {}", connection.getId(), e.getMessage());
            send(connection, error(e));
            return;
        }
        handle(connection, message);
    }

    @Override
    public void handle(Connection connection, ClientMessage message)
    {
        Objects.requireNonNull(connection, "connection");
        Objects.requireNonNull(message, "message");
        ConnectionBinding binding = bindings.computeIfAbsent(connection.getId(), id -> new ConnectionBinding(connection));
        try
        {
            ServerMessage reply = dispatch(binding, message);
            send(connection, reply);
        }
        catch (TurnSyncException e)
        {
            send(connection, error(e));
        }
        catch (RuntimeException e)
        {
            LOG.error("Error handling {} from {}", message.getClass().getSimpleName(), connection.getId(), e);
            send(connection, new ServerMessage.Error(ErrorCode.INTERNAL_ERROR.name(), e.getMessage(), null));
        }
    }

    private ServerMessage dispatch(ConnectionBinding binding, ClientMessage message)
    {
        if (message instanceof ClientMessage.Command command)
        {
            return handleCommand(binding, command.command());
        }
        if (message instanceof ClientMessage.GetState)
        {
            Snapshot current = boundSession(binding).getCurrent();
            return new ServerMessage.State(current.turn(), current.state());
        }
        if (message instanceof ClientMessage.GetStateAtTurn request)
        {
            return new ServerMessage.State(request.turn(), boundSession(binding).stateAt(request.turn()));
        }
        if (message instanceof ClientMessage.Ping ping)
        {
            return new ServerMessage.Pong(ping.timestamp(), System.currentTimeMillis());
        }
        if (message instanceof ClientMessage.Subscribe subscribe)
        {
            binding.subscribe(new HashSet<>(subscribe.eventTypes()));
            return new ServerMessage.Ack(null, true, null);
        }
        if (message instanceof ClientMessage.ListSessions)
        {
            return new ServerMessage.SessionList(listSessions());
        }
        if (message instanceof ClientMessage.LoadSession load)
        {
            if (load.sessionId() == null)
            {
                throw new TurnSyncException(ErrorCode.INVALID_MESSAGE, "LOAD_SESSION requires a sessionId");
            }
            GameSession session = registry.acquire(load.sessionId(), found ->
            {
                found.touch();
                binding.bind(found.getId());
            });
            LOG.debug("Connection {} loaded session {}", binding.getConnection().getId(), session.getId());
            return new ServerMessage.SessionLoaded(session.getId(), session.getCurrent().state());
        }
        if (message instanceof ClientMessage.NewSession request)
        {
            if (request.themeName() == null || request.playerName() == null)
            {
                throw new TurnSyncException(ErrorCode.INVALID_MESSAGE, "NEW_SESSION requires themeName and playerName");
            }
            SessionSummary summary = createSession(request.themeName(), request.playerName(), request.characterTemplate());
            binding.bind(summary.id());
            return new ServerMessage.SessionLoaded(summary.id(), registry.require(summary.id()).getCurrent().state());
        }
        throw new TurnSyncException(ErrorCode.INVALID_MESSAGE, "Unsupported message: " + message.getClass().getSimpleName());
    }

    private ServerMessage handleCommand(ConnectionBinding binding, PlayerCommand command)
    {
        if (command == null)
        {
            throw new TurnSyncException(ErrorCode.INVALID_MESSAGE, "COMMAND requires a command");
        }
        UUID sessionId = binding.getSessionId();
        GameSession session = sessionId == null ? null : registry.find(sessionId);
        if (session == null)
        {
            return new ServerMessage.Ack(command.id(), false, "No session loaded");
        }
        if (commandHandler == null)
        {
            return new ServerMessage.Ack(command.id(), false, "No command handler configured");
        }
        session.touch();
        try
        {
            commandHandler.handle(new DefaultSessionContext(session), command);
            return new ServerMessage.Ack(command.id(), true, null);
        }
        catch (RuntimeException e)
        {
            LOG.error("Command handler failed: session={}, command={}, type={}",
                    session.getId(), command.id(), command.type(), e);
            return new ServerMessage.Ack(command.id(), false, e.getMessage());
        }
    }

    @Override
    public void disconnect(Connection connection)
    {
        Objects.requireNonNull(connection, "connection");
        ConnectionBinding removed = bindings.remove(connection.getId());
        if (removed != null && removed.getSessionId() != null)
        {
            GameSession session = registry.find(removed.getSessionId());
            if (session != null)
            {
                session.touch();
            }
        }
    }

    // ========== Producers ==========

    @Override
    public SessionSummary createSession(String themeName, String playerName, StateValue characterTemplate)
    {
        Objects.requireNonNull(themeName, "themeName");
        Objects.requireNonNull(playerName, "playerName");
        StateValue initialState = initialStateFactory.create(themeName, playerName, characterTemplate);
        GameSession session = new GameSession(UUID.randomUUID(), playerName + " in " + themeName, themeName,
                initialState, settings, this);
        session.start();
        registry.register(session);
        LOG.info("Session created: id={}, theme={}, player={}", session.getId(), themeName, playerName);
        return session.getSummary();
    }

    @Override
    public CompletableFuture<DeltaReceipt> submitDelta(UUID sessionId, Delta delta)
    {
        GameSession session = registry.find(sessionId);
        if (session == null)
        {
            return CompletableFuture.failedFuture(new SessionNotFoundException(sessionId));
        }
        return session.submitDelta(delta);
    }

    @Override
    public CompletableFuture<TurnResult> submitBatch(UUID sessionId, TurnDeltas batch)
    {
        GameSession session = registry.find(sessionId);
        if (session == null)
        {
            return CompletableFuture.failedFuture(new SessionNotFoundException(sessionId));
        }
        return session.submitBatch(batch);
    }

    @Override
    public CompletableFuture<TurnResult> closeTurn(UUID sessionId)
    {
        GameSession session = registry.find(sessionId);
        if (session == null)
        {
            return CompletableFuture.failedFuture(new SessionNotFoundException(sessionId));
        }
        return session.closeTurn();
    }

    // ========== Reads ==========

    @Override
    public Snapshot currentState(UUID sessionId)
    {
        return registry.require(sessionId).getCurrent();
    }

    @Override
    public StateValue stateAt(UUID sessionId, long turn)
    {
        return registry.require(sessionId).stateAt(turn);
    }

    @Override
    public List<SessionSummary> listSessions()
    {
        List<SessionSummary> summaries = new ArrayList<>();
        for (GameSession session : registry.getAll())
        {
            summaries.add(session.getSummary());
        }
        summaries.sort(Comparator.comparing(SessionSummary::lastPlayed).reversed());
        return summaries;
    }

    @Override
    public SessionStats getStats(UUID sessionId)
    {
        return registry.require(sessionId).getStats();
    }

    @Override
    public Protocol getProtocol()
    {
        return protocol;
    }

    @Override
    public void onSessionEvicted(Consumer<SessionSummary> handler)
    {
        Objects.requireNonNull(handler, "handler");
        sessionEvictedCallbacks.add(handler);
    }

    // ========== SessionListener Interface ==========

    @Override
    public void onTurnCommitted(GameSession session, TurnResult result)
    {
        UUID sessionId = session.getId();
        long turn = result.turn();
        List<GameEvent> events = new ArrayList<>();
        Set<String> changedPaths = new LinkedHashSet<>();
        for (Delta delta : result.committed().deltas())
        {
            events.add(new GameEvent.StateDelta(UUID.randomUUID(), Instant.now(), turn, sessionId, delta));
            changedPaths.add(delta.target() + "." + delta.path());
        }
        for (RejectedDelta rejected : result.rejected())
        {
            events.add(new GameEvent.DeltaRejected(UUID.randomUUID(), Instant.now(), turn, sessionId,
                    rejected.delta().id(), rejected.code().name(), rejected.message()));
        }
        events.add(new GameEvent.TurnEnd(UUID.randomUUID(), Instant.now(), turn, sessionId,
                result.checksum(), result.committed().deltas().size(), new ArrayList<>(changedPaths)));
        if (result.snapshotTaken())
        {
            events.add(new GameEvent.SnapshotTaken(UUID.randomUUID(), Instant.now(), turn, sessionId));
        }
        broadcast(sessionId, events);
    }

    @Override
    public void onTurnRolledBack(GameSession session, long turn, IntegrityException error)
    {
        UUID sessionId = session.getId();
        List<GameEvent> events = new ArrayList<>();
        for (UUID deltaId : error.getDiscardedDeltaIds())
        {
            events.add(new GameEvent.DeltaRejected(UUID.randomUUID(), Instant.now(), turn, sessionId,
                    deltaId, error.getCode().name(), "Discarded with the batch for turn " + turn));
        }
        events.add(new GameEvent.TurnRolledBack(UUID.randomUUID(), Instant.now(), turn,
                sessionId, error.getCode().name(), error.getMessage()));
        broadcast(sessionId, events);
    }

    @Override
    public void onDeltasDropped(GameSession session, List<Delta> dropped)
    {
        List<GameEvent> events = new ArrayList<>(dropped.size());
        for (Delta delta : dropped)
        {
            events.add(new GameEvent.DeltaRejected(UUID.randomUUID(), Instant.now(), delta.turn(), session.getId(),
                    delta.id(), ErrorCode.TURN_GAP.name(), "Dropped after turn " + session.getCurrent().turn()
                    + " was force-closed"));
        }
        broadcast(session.getId(), events);
    }

    // ========== Fan-out ==========

    private void broadcast(UUID sessionId, List<GameEvent> events)
    {
        for (ConnectionBinding binding : bindings.values())
        {
            if (!binding.isBoundTo(sessionId))
            {
                continue;
            }
            List<GameEvent> accepted = new ArrayList<>(events.size());
            for (GameEvent event : events)
            {
                if (binding.accepts(event.eventType()))
                {
                    accepted.add(event);
                }
            }
            if (accepted.size() == 1)
            {
                send(binding.getConnection(), new ServerMessage.Event(accepted.get(0)));
            }
            else if (accepted.size() > 1)
            {
                send(binding.getConnection(), new ServerMessage.Events(accepted));
            }
        }
    }

    private void send(Connection connection, ServerMessage message)
    {
        try
        {
            connection.send(message);
        }
        catch (Exception e)
        {
            LOG.error("Failed to send {} to connection {}", message.getClass().getSimpleName(), connection.getId(), e);
        }
    }

    private GameSession boundSession(ConnectionBinding binding)
    {
        UUID sessionId = binding.getSessionId();
        if (sessionId == null)
        {
            throw new TurnSyncException(ErrorCode.SESSION_NOT_FOUND, "No session loaded");
        }
        return registry.require(sessionId);
    }

    private static ServerMessage.Error error(TurnSyncException e)
    {
        return new ServerMessage.Error(e.getCode().name(), e.getMessage(), null);
    }

    private boolean hasConnections(GameSession session)
    {
        for (ConnectionBinding binding : bindings.values())
        {
            if (binding.isBoundTo(session.getId()))
            {
                return true;
            }
        }
        return false;
    }

    // ========== Tick Loop ==========

    private void tickLoop()
    {
        LOG.debug("Tick loop started");

        while (running)
        {
            try
            {
                Thread.sleep(settings.tickInterval().toMillis());

                if (!running)
                {
                    break;
                }

                long nowMs = System.currentTimeMillis();
                for (GameSession session : registry.getAll())
                {
                    session.tick(nowMs);
                }

                List<GameSession> evicted = registry.evictIdle(nowMs, this::hasConnections);
                for (GameSession session : evicted)
                {
                    notifySessionEvicted(session.getSummary());
                }
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                break;
            }
            catch (Exception e)
            {
                LOG.error("Error in tick loop", e);
            }
        }

        LOG.debug("Tick loop stopped");
    }

    private void notifySessionEvicted(SessionSummary summary)
    {
        LOG.info("Session evicted: id={}, turn={}", summary.id(), summary.turn());
        for (Consumer<SessionSummary> callback : sessionEvictedCallbacks)
        {
            try
            {
                callback.accept(summary);
            }
            catch (Exception e)
            {
                LOG.error("Session evicted callback error", e);
            }
        }
    }
}
