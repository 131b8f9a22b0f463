package org.abstractica.turnsync.impl.session;

import org.abstractica.turnsync.Connection;
import org.abstractica.turnsync.Coordinator;
import org.abstractica.turnsync.SessionContext;
import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.DeltaOp;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.delta.TurnResult;
import org.abstractica.turnsync.error.IntegrityException;
import org.abstractica.turnsync.error.SessionNotFoundException;
import org.abstractica.turnsync.impl.path.Path;
import org.abstractica.turnsync.impl.path.PathResolver;
import org.abstractica.turnsync.protocol.ClientMessage;
import org.abstractica.turnsync.protocol.GameEvent;
import org.abstractica.turnsync.protocol.PlayerCommand;
import org.abstractica.turnsync.protocol.ServerMessage;
import org.abstractica.turnsync.protocol.SessionSummary;
import org.abstractica.turnsync.state.StateValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultCoordinator}: message routing, event fan-out and
 * session maintenance, driven through in-memory connections.
 */
class DefaultCoordinatorTest
{
    private static final long TIMEOUT_SECONDS = 5;

    private Coordinator coordinator;

    @BeforeEach
    void setUp()
    {
        coordinator = new DefaultCoordinatorFactory().builder()
                .commandHandler(DefaultCoordinatorTest::applyCommand)
                .snapshotEveryTurns(2)
                .tickInterval(Duration.ofMinutes(10))
                .build();
        coordinator.start();
    }

    @AfterEach
    void tearDown()
    {
        coordinator.close();
    }

    /**
     * Rules used by these tests: {@code DAMAGE} lowers hp by {@code amount}
     * and ends the turn, {@code LOOT} pulls an item (failing if absent) and
     * ends the turn, {@code EXPLODE} throws.
     */
    private static void applyCommand(SessionContext context, PlayerCommand command)
    {
        StateValue.ObjectValue payload = (StateValue.ObjectValue) command.payload();
        long turn = context.getOpenTurn();
        switch (command.type())
        {
            case "DAMAGE" ->
            {
                StateValue amount = payload.get("amount").orElseThrow();
                context.submitDelta(Delta.of(turn, "player", "hp", DeltaOp.INCREMENT,
                        ((StateValue.NumberValue) amount).negate()));
                context.closeTurn();
            }
            case "LOOT" ->
            {
                context.submitDelta(Delta.of(turn, "player", "inventory", DeltaOp.PULL,
                        payload.get("item").orElseThrow()));
                context.closeTurn();
            }
            default -> throw new IllegalArgumentException("Unknown command " + command.type());
        }
    }

    private static PlayerCommand command(String type, StateValue.ObjectValue payload)
    {
        return new PlayerCommand(UUID.randomUUID(), Instant.now(), type, payload);
    }

    private static StateValue.ObjectValue template()
    {
        return StateValue.emptyObject()
                .with("hp", StateValue.of(10))
                .with("inventory", StateValue.arrayOf(StateValue.of("sword")));
    }

    private UUID newSession(RecordingConnection connection) throws InterruptedException
    {
        coordinator.handle(connection, new ClientMessage.NewSession("fantasy", "Aria", template()));
        return connection.next(ServerMessage.SessionLoaded.class).sessionId();
    }

    // ========== Requests ==========

    @Test
    void newSession_buildsInitialState() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");

        coordinator.handle(connection, "{\"type\":\"NEW_SESSION\",\"themeName\":\"fantasy\",\"playerName\":\"Aria\","
                + "\"characterTemplate\":{\"hp\":10,\"name\":\"ignored\"}}");

        ServerMessage.SessionLoaded loaded = connection.next(ServerMessage.SessionLoaded.class);
        StateValue state = loaded.state();
        assertEquals(Optional.of(StateValue.of("Aria")), PathResolver.resolve(state, Path.parse("player.name")));
        assertEquals(Optional.of(StateValue.of(10)), PathResolver.resolve(state, Path.parse("player.hp")));
        assertEquals(Optional.of(StateValue.of("fantasy")), PathResolver.resolve(state, Path.parse("world.theme")));
        assertEquals(Optional.of(StateValue.emptyObject()), PathResolver.resolve(state, Path.parse("npcs")));
        assertEquals(0, coordinator.currentState(loaded.sessionId()).turn());
    }

    @Test
    void ping_answeredWithPong() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");

        coordinator.handle(connection, "{\"type\":\"PING\",\"timestamp\":1234}");

        assertEquals(1234, connection.next(ServerMessage.Pong.class).timestamp());
    }

    @Test
    void malformedMessage_invalidMessageError() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");

        coordinator.handle(connection, "{\"type\":\"TELEPORT\"}");

        assertEquals("INVALID_MESSAGE", connection.next(ServerMessage.Error.class).code());
    }

    @Test
    void getState_withoutSession_sessionNotFound() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");

        coordinator.handle(connection, new ClientMessage.GetState());

        assertEquals("SESSION_NOT_FOUND", connection.next(ServerMessage.Error.class).code());
    }

    @Test
    void loadSession_unknown_sessionNotFound() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");

        coordinator.handle(connection, new ClientMessage.LoadSession(UUID.randomUUID()));

        assertEquals("SESSION_NOT_FOUND", connection.next(ServerMessage.Error.class).code());
    }

    @Test
    void listSessions_newestFirst() throws Exception
    {
        SessionSummary first = coordinator.createSession("fantasy", "Aria", null);
        Thread.sleep(5);
        SessionSummary second = coordinator.createSession("noir", "Sam", null);
        RecordingConnection connection = new RecordingConnection("c1");

        coordinator.handle(connection, new ClientMessage.ListSessions());

        List<SessionSummary> sessions = connection.next(ServerMessage.SessionList.class).sessions();
        assertEquals(List.of(second.id(), first.id()), List.of(sessions.get(0).id(), sessions.get(1).id()));
        assertEquals("noir", sessions.get(0).theme());
    }

    // ========== Commands ==========

    @Test
    void command_withoutSession_nack() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");
        PlayerCommand command = command("DAMAGE", StateValue.emptyObject().with("amount", StateValue.of(1)));

        coordinator.handle(connection, new ClientMessage.Command(command));

        ServerMessage.Ack ack = connection.next(ServerMessage.Ack.class);
        assertEquals(command.id(), ack.commandId());
        assertFalse(ack.success());
    }

    @Test
    void command_appliesDeltasAndBroadcastsTurn() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");
        UUID sessionId = newSession(connection);
        PlayerCommand command = command("DAMAGE", StateValue.emptyObject().with("amount", StateValue.of(3)));

        coordinator.handle(connection, new ClientMessage.Command(command));

        assertTrue(connection.next(ServerMessage.Ack.class).success());
        List<GameEvent> events = connection.next(ServerMessage.Events.class).events();
        GameEvent.StateDelta stateDelta = assertInstanceOf(GameEvent.StateDelta.class, events.get(0));
        assertEquals(StateValue.of(10), stateDelta.delta().previousValue());
        GameEvent.TurnEnd turnEnd = assertInstanceOf(GameEvent.TurnEnd.class, events.get(1));
        assertEquals(1, turnEnd.turn());
        assertEquals(1, turnEnd.deltaCount());
        assertEquals(List.of("player.hp"), turnEnd.changedPaths());
        assertEquals(sessionId, turnEnd.sessionId());

        coordinator.handle(connection, new ClientMessage.GetState());
        ServerMessage.State state = connection.next(ServerMessage.State.class);
        assertEquals(1, state.turn());
        assertEquals(Optional.of(StateValue.of(7)), PathResolver.resolve(state.state(), Path.parse("player.hp")));
    }

    @Test
    void command_failingDelta_reportsRejection() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");
        newSession(connection);

        coordinator.handle(connection, new ClientMessage.Command(
                command("LOOT", StateValue.emptyObject().with("item", StateValue.of("crown")))));

        List<GameEvent> events = connection.next(ServerMessage.Events.class).events();
        GameEvent.DeltaRejected rejected = assertInstanceOf(GameEvent.DeltaRejected.class, events.get(0));
        assertEquals("ELEMENT_NOT_FOUND", rejected.code());
        GameEvent.TurnEnd turnEnd = assertInstanceOf(GameEvent.TurnEnd.class, events.get(1));
        assertEquals(0, turnEnd.deltaCount());
    }

    @Test
    void command_handlerThrows_nackWithMessage() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");
        newSession(connection);

        coordinator.handle(connection, new ClientMessage.Command(command("EXPLODE", StateValue.emptyObject())));

        ServerMessage.Ack ack = connection.next(ServerMessage.Ack.class);
        assertFalse(ack.success());
        assertEquals("Unknown command EXPLODE", ack.error());
    }

    // ========== Fan-out ==========

    @Test
    void subscribe_filtersEventTypes() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");
        newSession(connection);
        coordinator.handle(connection, new ClientMessage.Subscribe(List.of("TURN_END")));
        assertTrue(connection.next(ServerMessage.Ack.class).success());

        coordinator.handle(connection, new ClientMessage.Command(
                command("DAMAGE", StateValue.emptyObject().with("amount", StateValue.of(1)))));

        ServerMessage.Event event = connection.next(ServerMessage.Event.class);
        assertInstanceOf(GameEvent.TurnEnd.class, event.event());
    }

    @Test
    void events_reachOnlyConnectionsOfTheSession() throws Exception
    {
        RecordingConnection player = new RecordingConnection("player");
        RecordingConnection spectator = new RecordingConnection("spectator");
        RecordingConnection other = new RecordingConnection("other");
        UUID sessionId = newSession(player);
        newSession(other);
        coordinator.handle(spectator, new ClientMessage.LoadSession(sessionId));
        spectator.next(ServerMessage.SessionLoaded.class);

        coordinator.handle(player, new ClientMessage.Command(
                command("DAMAGE", StateValue.emptyObject().with("amount", StateValue.of(2)))));

        player.next(ServerMessage.Events.class);
        spectator.next(ServerMessage.Events.class);
        coordinator.closeTurn(sessionId).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        player.next(ServerMessage.Event.class);
        assertTrue(other.received.isEmpty());
    }

    @Test
    void wrongChecksum_reportsEachDiscardedDelta() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");
        UUID sessionId = newSession(connection);
        Delta separate = Delta.of(1, "world", "weather", DeltaOp.SET, StateValue.of("fog"));
        coordinator.submitDelta(sessionId, separate).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        Delta batched = Delta.of(1, "player", "hp", DeltaOp.INCREMENT, StateValue.of(-5));

        ExecutionException e = assertThrows(ExecutionException.class, () -> coordinator.submitBatch(sessionId,
                new TurnDeltas(1, List.of(batched), "0".repeat(64))).get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertInstanceOf(IntegrityException.class, e.getCause());

        List<GameEvent> events = connection.next(ServerMessage.Events.class).events();
        GameEvent.DeltaRejected rejected = assertInstanceOf(GameEvent.DeltaRejected.class, events.get(0));
        assertEquals(batched.id(), rejected.deltaId());
        assertEquals("INTEGRITY_ERROR", rejected.code());
        assertInstanceOf(GameEvent.TurnRolledBack.class, events.get(1));

        TurnResult result = coordinator.closeTurn(sessionId).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertEquals(List.of(separate.id()), result.committed().deltas().stream().map(Delta::id).toList());
    }

    @Test
    void disconnect_stopsDelivery() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");
        UUID sessionId = newSession(connection);

        coordinator.disconnect(connection);
        coordinator.closeTurn(sessionId).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertTrue(connection.received.isEmpty());
    }

    // ========== History ==========

    @Test
    void getStateAtTurn_pastAndUnavailable() throws Exception
    {
        RecordingConnection connection = new RecordingConnection("c1");
        UUID sessionId = newSession(connection);
        coordinator.submitDelta(sessionId, Delta.of(1, "player", "hp", DeltaOp.SET, StateValue.of(1)));
        coordinator.closeTurn(sessionId).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        connection.next(ServerMessage.Events.class);

        coordinator.handle(connection, new ClientMessage.GetStateAtTurn(0));
        ServerMessage.State past = connection.next(ServerMessage.State.class);
        assertEquals(0, past.turn());
        assertEquals(Optional.of(StateValue.of(10)), PathResolver.resolve(past.state(), Path.parse("player.hp")));

        coordinator.handle(connection, new ClientMessage.GetStateAtTurn(9));
        assertEquals("HISTORY_UNAVAILABLE", connection.next(ServerMessage.Error.class).code());
    }

    @Test
    void stats_countTurnsAndDeltas() throws Exception
    {
        UUID sessionId = coordinator.createSession("fantasy", "Aria", template()).id();
        coordinator.submitDelta(sessionId, Delta.of(1, "player", "hp", DeltaOp.INCREMENT, StateValue.of(1)));
        coordinator.submitDelta(sessionId, Delta.of(1, "player", "mp", DeltaOp.INCREMENT, StateValue.of(1)));
        TurnResult result = coordinator.closeTurn(sessionId).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);

        assertEquals(1, result.rejected().size());
        assertEquals(1, coordinator.getStats(sessionId).totalTurns());
        assertEquals(1, coordinator.getStats(sessionId).totalDeltas());
        assertEquals(1, coordinator.getStats(sessionId).rejectedDeltas());
    }

    @Test
    void protocol_exposesChecksumAlgorithmAndHash()
    {
        assertEquals("sha256-canonical-json/1", coordinator.getProtocol().getChecksumAlgorithm());
        assertEquals(64, coordinator.getProtocol().getHash().length());
    }

    @Test
    void unknownSession_futuresFail()
    {
        UUID unknown = UUID.randomUUID();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> coordinator.closeTurn(unknown).get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        assertInstanceOf(SessionNotFoundException.class, e.getCause());
        assertThrows(SessionNotFoundException.class, () -> coordinator.currentState(unknown));
    }

    // ========== Maintenance ==========

    @Test
    void idleSession_evictedByTick() throws Exception
    {
        Coordinator fastCoordinator = new DefaultCoordinatorFactory().builder()
                .tickInterval(Duration.ofMillis(20))
                .sessionIdleTimeout(Duration.ofMillis(50))
                .build();
        CountDownLatch evicted = new CountDownLatch(1);
        AtomicReference<SessionSummary> evictedSummary = new AtomicReference<>();
        fastCoordinator.onSessionEvicted(summary ->
        {
            evictedSummary.set(summary);
            evicted.countDown();
        });
        fastCoordinator.start();
        try
        {
            SessionSummary summary = fastCoordinator.createSession("fantasy", "Aria", null);

            assertTrue(evicted.await(TIMEOUT_SECONDS, TimeUnit.SECONDS));
            assertEquals(summary.id(), evictedSummary.get().id());
            assertTrue(fastCoordinator.listSessions().isEmpty());
        }
        finally
        {
            fastCoordinator.close();
        }
    }

    @Test
    void stuckTurn_forceClosedByTick() throws Exception
    {
        Coordinator fastCoordinator = new DefaultCoordinatorFactory().builder()
                .tickInterval(Duration.ofMillis(20))
                .turnTimeout(Duration.ofMillis(50))
                .build();
        fastCoordinator.start();
        try
        {
            RecordingConnection connection = new RecordingConnection("c1");
            fastCoordinator.handle(connection, new ClientMessage.NewSession("fantasy", "Aria", template()));
            UUID sessionId = connection.next(ServerMessage.SessionLoaded.class).sessionId();

            fastCoordinator.submitDelta(sessionId, Delta.of(1, "player", "hp", DeltaOp.INCREMENT, StateValue.of(-1)));

            List<GameEvent> events = connection.next(ServerMessage.Events.class).events();
            assertEquals(1, events.get(events.size() - 1).turn());
            assertEquals(1, fastCoordinator.currentState(sessionId).turn());
        }
        finally
        {
            fastCoordinator.close();
        }
    }

    @Test
    void builder_rejectsNonPositiveSettings()
    {
        assertThrows(IllegalArgumentException.class,
                () -> new DefaultCoordinatorFactory().builder().lookaheadTurns(0));
        assertThrows(IllegalArgumentException.class,
                () -> new DefaultCoordinatorFactory().builder().turnTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new DefaultCoordinatorFactory().builder().snapshotEveryDeltas(-1));
        assertThrows(IllegalArgumentException.class,
                () -> new DefaultCoordinatorFactory().builder().sessionQueueCapacity(0));
    }

    // ========== Test Connection ==========

    private static class RecordingConnection implements Connection
    {
        private final String id;
        final BlockingQueue<ServerMessage> received = new LinkedBlockingQueue<>();

        RecordingConnection(String id)
        {
            this.id = id;
        }

        @Override
        public String getId()
        {
            return id;
        }

        @Override
        public void send(ServerMessage message)
        {
            received.add(message);
        }

        /**
         * Waits for the next message of a type, skipping others.
         */
        <T extends ServerMessage> T next(Class<T> type) throws InterruptedException
        {
            List<ServerMessage> skipped = new ArrayList<>();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
            while (System.nanoTime() < deadline)
            {
                ServerMessage message = received.poll(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
                if (message == null)
                {
                    break;
                }
                if (type.isInstance(message))
                {
                    return type.cast(message);
                }
                skipped.add(message);
            }
            throw new AssertionError("No " + type.getSimpleName() + " received, got " + skipped);
        }
    }
}
