package org.abstractica.turnsync;

import java.time.Duration;

/**
 * Factory for creating Coordinator instances.
 *
 * <pre>{@code
 * Coordinator coordinator = new DefaultCoordinatorFactory().builder()
 *     .commandHandler(rules)
 *     .lookaheadTurns(2)
 *     .turnTimeout(Duration.ofSeconds(10))
 *     .build();
 * }</pre>
 */
public interface CoordinatorFactory
{
    /**
     * Creates a new coordinator builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a Coordinator.
     *
     * <p>Every setting is optional. Non-positive counts and durations are
     * rejected with {@link IllegalArgumentException}.</p>
     */
    interface Builder
    {
        /**
         * Sets the handler that turns player commands into deltas.
         *
         * <p>Optional. Without one, {@code COMMAND} messages are answered with
         * {@code ACK{success:false}}.</p>
         *
         * @param handler the command handler
         * @return this builder
         */
        Builder commandHandler(CommandHandler handler);

        /**
         * Sets how new session states are built.
         *
         * <p>Optional. Defaults to a world holding the theme, a player holding
         * the name merged with the character template, no NPCs and an empty scene.</p>
         *
         * @param factory the initial state factory
         * @return this builder
         */
        Builder initialStateFactory(InitialStateFactory factory);

        /**
         * Takes a snapshot after every N committed turns.
         *
         * <p>Optional. Defaults to 10.</p>
         *
         * @param turns turns between snapshots
         * @return this builder
         */
        Builder snapshotEveryTurns(int turns);

        /**
         * Takes a snapshot once M deltas have been committed since the last one.
         *
         * <p>Optional. Defaults to 200.</p>
         *
         * @param deltas deltas between snapshots
         * @return this builder
         */
        Builder snapshotEveryDeltas(int deltas);

        /**
         * Sets how many snapshots each session keeps. Turns older than the
         * oldest retained snapshot can no longer be reconstructed.
         *
         * <p>Optional. Defaults to 4.</p>
         *
         * @param count retained snapshots
         * @return this builder
         */
        Builder maxRetainedSnapshots(int count);

        /**
         * Sets how many turns past the open turn a delta may target and still be buffered.
         *
         * <p>Optional. Defaults to 4.</p>
         *
         * @param turns the lookahead window
         * @return this builder
         */
        Builder lookaheadTurns(int turns);

        /**
         * Sets the maximum number of future-turn deltas buffered per session.
         *
         * <p>Optional. Defaults to 1024.</p>
         *
         * @param count buffer capacity
         * @return this builder
         */
        Builder maxBufferedDeltas(int count);

        /**
         * Sets how long a turn may stay open with pending deltas before it is force-closed.
         *
         * <p>Optional. Defaults to 30 seconds.</p>
         *
         * @param timeout the turn timeout
         * @return this builder
         */
        Builder turnTimeout(Duration timeout);

        /**
         * Sets how many submissions may wait for a session's sequencing thread.
         * Submissions beyond that fail instead of blocking the caller.
         *
         * <p>Optional. Defaults to 4096.</p>
         *
         * @param capacity the per-session queue capacity
         * @return this builder
         */
        Builder sessionQueueCapacity(int capacity);

        /**
         * Sets the interval of the maintenance tick.
         *
         * <p>Optional. Defaults to 1 second.</p>
         *
         * @param interval the tick interval
         * @return this builder
         */
        Builder tickInterval(Duration interval);

        /**
         * Sets how long a session without connections or activity survives.
         *
         * <p>Optional. Defaults to 30 minutes.</p>
         *
         * @param timeout the idle timeout
         * @return this builder
         */
        Builder sessionIdleTimeout(Duration timeout);

        /**
         * Builds the coordinator. It is not started.
         *
         * @return the configured coordinator
         */
        Coordinator build();
    }
}
