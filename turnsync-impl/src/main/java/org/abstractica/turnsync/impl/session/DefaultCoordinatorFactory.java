package org.abstractica.turnsync.impl.session;

import org.abstractica.turnsync.CommandHandler;
import org.abstractica.turnsync.Coordinator;
import org.abstractica.turnsync.CoordinatorFactory;
import org.abstractica.turnsync.InitialStateFactory;
import org.abstractica.turnsync.impl.sequencer.TurnSequencer;
import org.abstractica.turnsync.impl.serialization.JsonProtocol;
import org.abstractica.turnsync.impl.snapshot.SnapshotManager;
import org.abstractica.turnsync.impl.snapshot.SnapshotPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * Default implementation of CoordinatorFactory.
 *
 * <p>Creates DefaultCoordinator instances using a builder pattern.</p>
 */
public class DefaultCoordinatorFactory implements CoordinatorFactory
{
    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private CommandHandler commandHandler; // null = commands are refused
        private InitialStateFactory initialStateFactory = new DefaultInitialStateFactory();
        private int snapshotEveryTurns = SnapshotPolicy.DEFAULT.everyTurns();
        private int snapshotEveryDeltas = SnapshotPolicy.DEFAULT.everyDeltas();
        private int maxRetainedSnapshots = SnapshotManager.DEFAULT_MAX_RETAINED;
        private int lookaheadTurns = TurnSequencer.DEFAULT_LOOKAHEAD_TURNS;
        private int maxBufferedDeltas = TurnSequencer.DEFAULT_MAX_BUFFERED_DELTAS;
        private int sessionQueueCapacity = GameSession.DEFAULT_QUEUE_CAPACITY;
        private Duration turnTimeout = Duration.ofSeconds(30);
        private Duration tickInterval = Duration.ofSeconds(1);
        private Duration sessionIdleTimeout = Duration.ofMinutes(30);

        @Override
        public Builder commandHandler(CommandHandler handler)
        {
            this.commandHandler = Objects.requireNonNull(handler, "handler");
            return this;
        }

        @Override
        public Builder initialStateFactory(InitialStateFactory factory)
        {
            this.initialStateFactory = Objects.requireNonNull(factory, "factory");
            return this;
        }

        @Override
        public Builder snapshotEveryTurns(int turns)
        {
            this.snapshotEveryTurns = requirePositive(turns, "snapshotEveryTurns");
            return this;
        }

        @Override
        public Builder snapshotEveryDeltas(int deltas)
        {
            this.snapshotEveryDeltas = requirePositive(deltas, "snapshotEveryDeltas");
            return this;
        }

        @Override
        public Builder maxRetainedSnapshots(int count)
        {
            this.maxRetainedSnapshots = requirePositive(count, "maxRetainedSnapshots");
            return this;
        }

        @Override
        public Builder lookaheadTurns(int turns)
        {
            this.lookaheadTurns = requirePositive(turns, "lookaheadTurns");
            return this;
        }

        @Override
        public Builder maxBufferedDeltas(int count)
        {
            this.maxBufferedDeltas = requirePositive(count, "maxBufferedDeltas");
            return this;
        }

        @Override
        public Builder sessionQueueCapacity(int capacity)
        {
            this.sessionQueueCapacity = requirePositive(capacity, "sessionQueueCapacity");
            return this;
        }

        @Override
        public Builder turnTimeout(Duration timeout)
        {
            this.turnTimeout = requirePositive(timeout, "Turn timeout");
            return this;
        }

        @Override
        public Builder tickInterval(Duration interval)
        {
            this.tickInterval = requirePositive(interval, "Tick interval");
            return this;
        }

        @Override
        public Builder sessionIdleTimeout(Duration timeout)
        {
            this.sessionIdleTimeout = requirePositive(timeout, "Session idle timeout");
            return this;
        }

        @Override
        public Coordinator build()
        {
            SessionSettings settings = new SessionSettings(
                    new SnapshotPolicy(snapshotEveryTurns, snapshotEveryDeltas),
                    maxRetainedSnapshots,
                    lookaheadTurns,
                    maxBufferedDeltas,
                    turnTimeout,
                    tickInterval,
                    sessionQueueCapacity
            );
            return new DefaultCoordinator(
                    JsonProtocol.create(),
                    commandHandler,
                    initialStateFactory,
                    settings,
                    sessionIdleTimeout
            );
        }

        private static int requirePositive(int value, String name)
        {
            if (value <= 0)
            {
                throw new IllegalArgumentException(name + " must be positive: " + value);
            }
            return value;
        }

        private static Duration requirePositive(Duration value, String name)
        {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero())
            {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
