package org.abstractica.turnsync;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.DeltaReceipt;
import org.abstractica.turnsync.delta.Snapshot;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.delta.TurnResult;
import org.abstractica.turnsync.protocol.ClientMessage;
import org.abstractica.turnsync.protocol.SessionSummary;
import org.abstractica.turnsync.state.StateValue;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Owns the game sessions and routes protocol messages to them.
 *
 * <p>Each session applies deltas on its own sequencing thread, so
 * submissions from many connections are serialized per session while
 * sessions proceed in parallel. Reads never wait for writers: they see the
 * last committed state.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Coordinator coordinator = new DefaultCoordinatorFactory().builder()
 *     .commandHandler((context, command) -> context.submitDelta(...))
 *     .snapshotEveryTurns(5)
 *     .build();
 * coordinator.start();
 *
 * // from the transport
 * coordinator.handle(connection, json);
 * }</pre>
 */
public interface Coordinator extends AutoCloseable
{
    /**
     * Starts the tick thread that force-closes stuck turns and evicts idle sessions.
     */
    void start();

    /**
     * Stops all sessions and the tick thread.
     */
    @Override
    void close();

    // ========== Client Messages ==========

    /**
     * Handles a decoded client message.
     *
     * <p>Every message is answered on the connection: requests with their
     * reply, failures with {@code ERROR} or {@code ACK{success:false}}.</p>
     *
     * @param connection the connection the message arrived on
     * @param message    the message
     */
    void handle(Connection connection, ClientMessage message);

    /**
     * Decodes and handles a client document. Malformed documents are
     * answered with {@code ERROR{code:INVALID_MESSAGE}}.
     *
     * @param connection the connection the document arrived on
     * @param json       the document
     */
    void handle(Connection connection, String json);

    /**
     * Unbinds a connection from its session and forgets its subscriptions.
     *
     * @param connection the closed connection
     */
    void disconnect(Connection connection);

    // ========== Producers ==========

    /**
     * Creates a session at turn 0.
     *
     * @param themeName         the theme of the game
     * @param playerName        the player's name
     * @param characterTemplate player character fields, may be null
     * @return the summary of the new session
     */
    SessionSummary createSession(String themeName, String playerName, StateValue characterTemplate);

    CompletableFuture<DeltaReceipt> submitDelta(UUID sessionId, Delta delta);

    CompletableFuture<TurnResult> submitBatch(UUID sessionId, TurnDeltas batch);

    CompletableFuture<TurnResult> closeTurn(UUID sessionId);

    // ========== Reads ==========

    /**
     * Returns the last committed state of a session.
     *
     * @param sessionId the session
     * @return the state and its turn
     * @throws org.abstractica.turnsync.error.SessionNotFoundException if the session is unknown
     */
    Snapshot currentState(UUID sessionId);

    /**
     * Reconstructs the state of a session as it was after {@code turn}.
     *
     * @param sessionId the session
     * @param turn      a committed turn within the retained history
     * @return the state after that turn
     * @throws org.abstractica.turnsync.error.SessionNotFoundException if the session is unknown
     * @throws org.abstractica.turnsync.error.HistoryUnavailableException if the turn is not retained
     */
    StateValue stateAt(UUID sessionId, long turn);

    List<SessionSummary> listSessions();

    SessionStats getStats(UUID sessionId);

    Protocol getProtocol();

    // ========== Callbacks ==========

    /**
     * Registers a callback for idle sessions removed by the tick.
     *
     * @param handler called with the evicted session's last summary
     */
    void onSessionEvicted(Consumer<SessionSummary> handler);
}
