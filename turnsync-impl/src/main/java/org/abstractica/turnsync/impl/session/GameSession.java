package org.abstractica.turnsync.impl.session;

import org.abstractica.turnsync.SessionStats;
import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.DeltaReceipt;
import org.abstractica.turnsync.delta.Snapshot;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.delta.TurnResult;
import org.abstractica.turnsync.error.IntegrityException;
import org.abstractica.turnsync.error.TurnSyncException;
import org.abstractica.turnsync.impl.delta.DeltaApplicator;
import org.abstractica.turnsync.impl.sequencer.TurnSequencer;
import org.abstractica.turnsync.impl.snapshot.SnapshotManager;
import org.abstractica.turnsync.protocol.SessionSummary;
import org.abstractica.turnsync.state.StateValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One game session: its turn sequencer, snapshot history and current state.
 *
 * <p>All mutation happens on the session's own thread, which drains a queue
 * of {@link SessionCommand}s. Submitters get a {@link CompletableFuture}
 * completed by that thread. Readers use the volatile current snapshot or the
 * snapshot manager's published history and never wait for the writer.</p>
 */
public class GameSession
{
    private static final Logger LOG = LoggerFactory.getLogger(GameSession.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 4096;

    private final UUID id;
    private final String name;
    private final String theme;
    private final SessionSettings settings;
    private final SessionListener listener;
    private final TurnSequencer sequencer;
    private final SnapshotManager snapshots;
    private final BlockingQueue<SessionCommand> queue;

    private final AtomicLong totalTurns = new AtomicLong();
    private final AtomicLong totalDeltas = new AtomicLong();
    private final AtomicLong totalSnapshots = new AtomicLong(1);
    private final AtomicLong rejectedDeltas = new AtomicLong();

    private volatile Snapshot current;
    private volatile long lastActivityMs;

    private Thread thread;
    private volatile boolean running;

    /**
     * Creates a session at turn 0.
     *
     * @param id           the session id
     * @param name         display name
     * @param theme        theme name
     * @param initialState the state at turn 0
     * @param settings     policy values
     * @param listener     notified of commits, rollbacks and drops
     */
    public GameSession(
            UUID id,
            String name,
            String theme,
            StateValue initialState,
            SessionSettings settings,
            SessionListener listener
    )
    {
        this.id = Objects.requireNonNull(id, "id");
        this.name = Objects.requireNonNull(name, "name");
        this.theme = Objects.requireNonNull(theme, "theme");
        Objects.requireNonNull(initialState, "initialState");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.listener = Objects.requireNonNull(listener, "listener");

        long nowMs = System.currentTimeMillis();
        DeltaApplicator applicator = new DeltaApplicator();
        this.current = new Snapshot(0, initialState);
        this.sequencer = new TurnSequencer(applicator, initialState, 0,
                settings.lookaheadTurns(), settings.maxBufferedDeltas(), nowMs);
        this.snapshots = new SnapshotManager(current, settings.snapshotPolicy(),
                settings.maxRetainedSnapshots(), applicator);
        this.queue = new LinkedBlockingQueue<>(settings.queueCapacity());
        this.lastActivityMs = nowMs;
    }

    /**
     * Starts the session's sequencing thread.
     */
    public void start()
    {
        if (running)
        {
            return;
        }
        running = true;
        thread = new Thread(this::processLoop, "session-" + id.toString().substring(0, 8));
        thread.setDaemon(true);
        thread.start();
    }

    /**
     * Stops the sequencing thread. Queued work is failed.
     */
    public void stop()
    {
        running = false;
        if (thread != null)
        {
            thread.interrupt();
        }
    }

    // ========== Submission ==========

    public CompletableFuture<DeltaReceipt> submitDelta(Delta delta)
    {
        CompletableFuture<DeltaReceipt> result = new CompletableFuture<>();
        enqueue(new SessionCommand.SubmitDelta(delta, result), result);
        return result;
    }

    public CompletableFuture<TurnResult> submitBatch(TurnDeltas batch)
    {
        CompletableFuture<TurnResult> result = new CompletableFuture<>();
        enqueue(new SessionCommand.SubmitBatch(batch, result), result);
        return result;
    }

    public CompletableFuture<TurnResult> closeTurn()
    {
        CompletableFuture<TurnResult> result = new CompletableFuture<>();
        enqueue(new SessionCommand.CloseTurn(result), result);
        return result;
    }

    /**
     * Enqueues a maintenance tick.
     *
     * @param nowMs current time in milliseconds
     */
    public void tick(long nowMs)
    {
        if (!queue.offer(new SessionCommand.Tick(nowMs)))
        {
            LOG.warn("Session {} queue full, dropping tick", id);
        }
    }

    private void enqueue(SessionCommand command, CompletableFuture<?> result)
    {
        if (!running)
        {
            result.completeExceptionally(new IllegalStateException("Session " + id + " is not running"));
            return;
        }
        if (!queue.offer(command))
        {
            LOG.warn("Session {} queue full, refusing {}", id, command.getClass().getSimpleName());
            result.completeExceptionally(new IllegalStateException("Session " + id + " queue is full"));
        }
    }

    // ========== Reads ==========

    public UUID getId()
    {
        return id;
    }

    public String getName()
    {
        return name;
    }

    public String getTheme()
    {
        return theme;
    }

    /**
     * Returns the last committed state.
     *
     * @return the state and the turn it belongs to
     */
    public Snapshot getCurrent()
    {
        return current;
    }

    /**
     * Returns the turn new deltas should carry.
     *
     * @return the open turn
     */
    public long getOpenTurn()
    {
        return current.turn() + 1;
    }

    /**
     * Reconstructs the state after a committed turn.
     *
     * @param turn the turn
     * @return the state after that turn
     * @throws org.abstractica.turnsync.error.HistoryUnavailableException if the turn is not retained
     */
    public StateValue stateAt(long turn)
    {
        Snapshot latest = current;
        if (turn == latest.turn())
        {
            return latest.state();
        }
        return snapshots.stateAt(turn);
    }

    public SnapshotManager getSnapshots()
    {
        return snapshots;
    }

    public long getLastActivityMs()
    {
        return lastActivityMs;
    }

    /**
     * Marks the session as used, postponing idle eviction.
     */
    public void touch()
    {
        lastActivityMs = System.currentTimeMillis();
    }

    public boolean isRunning()
    {
        return running;
    }

    public SessionSummary getSummary()
    {
        return new SessionSummary(id, name, theme, current.turn(), Instant.ofEpochMilli(lastActivityMs));
    }

    public SessionStats getStats()
    {
        return new SessionStats(totalTurns.get(), totalDeltas.get(), totalSnapshots.get(), rejectedDeltas.get());
    }

    // ========== Processing Loop ==========

    private void processLoop()
    {
        LOG.debug("Session {} processing started", id);

        while (running)
        {
            try
            {
                SessionCommand command = queue.poll(settings.tickInterval().toMillis(), TimeUnit.MILLISECONDS);
                if (command == null)
                {
                    processTick(System.currentTimeMillis());
                    continue;
                }
                process(command);
            }
            catch (InterruptedException e)
            {
                Thread.currentThread().interrupt();
                break;
            }
            catch (Exception e)
            {
                LOG.error("Error processing command in session {}", id, e);
            }
        }

        sequencer.close();
        failQueued();
        LOG.debug("Session {} processing stopped", id);
    }

    private void process(SessionCommand command)
    {
        if (command instanceof SessionCommand.SubmitDelta submit)
        {
            processSubmit(submit);
        }
        else if (command instanceof SessionCommand.SubmitBatch batch)
        {
            processBatch(batch);
        }
        else if (command instanceof SessionCommand.CloseTurn close)
        {
            processClose(close);
        }
        else if (command instanceof SessionCommand.Tick tick)
        {
            processTick(tick.nowMs());
        }
    }

    private void processSubmit(SessionCommand.SubmitDelta command)
    {
        long nowMs = System.currentTimeMillis();
        lastActivityMs = nowMs;
        try
        {
            command.result().complete(sequencer.submit(command.delta(), nowMs));
        }
        catch (TurnSyncException e)
        {
            rejectedDeltas.incrementAndGet();
            LOG.debug("Session {} refused delta {}: {}", id, command.delta().id(), e.getMessage());
            command.result().completeExceptionally(e);
        }
        catch (RuntimeException e)
        {
            LOG.error("Session {} failed to submit delta {}", id, command.delta().id(), e);
            command.result().completeExceptionally(e);
        }
    }

    private void processBatch(SessionCommand.SubmitBatch command)
    {
        long nowMs = System.currentTimeMillis();
        lastActivityMs = nowMs;
        long turn = sequencer.getOpenTurn();
        try
        {
            command.result().complete(publish(sequencer.submitBatch(command.batch(), nowMs)));
        }
        catch (IntegrityException e)
        {
            LOG.warn("Session {} rolled back turn {}: {}", id, turn, e.getMessage());
            rejectedDeltas.addAndGet(e.getDiscardedDeltaIds().size());
            notifyRolledBack(turn, e);
            command.result().completeExceptionally(e);
        }
        catch (TurnSyncException e)
        {
            LOG.debug("Session {} refused batch for turn {}: {}", id, command.batch().turn(), e.getMessage());
            command.result().completeExceptionally(e);
        }
        catch (RuntimeException e)
        {
            LOG.error("Session {} failed to commit batch for turn {}", id, command.batch().turn(), e);
            command.result().completeExceptionally(e);
        }
    }

    private void processClose(SessionCommand.CloseTurn command)
    {
        long nowMs = System.currentTimeMillis();
        lastActivityMs = nowMs;
        try
        {
            command.result().complete(publish(sequencer.closeTurn(nowMs)));
        }
        catch (RuntimeException e)
        {
            LOG.error("Session {} failed to close turn {}", id, sequencer.getOpenTurn(), e);
            command.result().completeExceptionally(e);
        }
    }

    private void processTick(long nowMs)
    {
        if (!sequencer.hasWork())
        {
            return;
        }
        long openFor = nowMs - sequencer.getWaitingSinceMs();
        if (openFor < settings.turnTimeout().toMillis())
        {
            return;
        }

        LOG.info("Session {} force-closing turn {} after {} ms", id, sequencer.getOpenTurn(), openFor);
        publish(sequencer.closeTurn(nowMs));
        List<Delta> dropped = sequencer.dropBuffered();
        if (!dropped.isEmpty())
        {
            LOG.warn("Session {} dropped {} buffered deltas after forced close", id, dropped.size());
            rejectedDeltas.addAndGet(dropped.size());
            try
            {
                listener.onDeltasDropped(this, dropped);
            }
            catch (Exception e)
            {
                LOG.error("Deltas dropped callback error", e);
            }
        }
    }

    // ========== Commit Publication ==========

    private TurnResult publish(TurnResult result)
    {
        boolean snapshotTaken = snapshots.recordCommit(result.committed(), sequencer.getCommittedState());
        current = new Snapshot(result.turn(), sequencer.getCommittedState());

        totalTurns.incrementAndGet();
        totalDeltas.addAndGet(result.committed().deltas().size());
        rejectedDeltas.addAndGet(result.rejected().size());
        if (snapshotTaken)
        {
            totalSnapshots.incrementAndGet();
            LOG.info("Session {} snapshot taken at turn {}", id, result.turn());
        }

        TurnResult published = result.withSnapshotTaken(snapshotTaken);
        try
        {
            listener.onTurnCommitted(this, published);
        }
        catch (Exception e)
        {
            LOG.error("Turn committed callback error", e);
        }
        return published;
    }

    private void notifyRolledBack(long turn, IntegrityException error)
    {
        try
        {
            listener.onTurnRolledBack(this, turn, error);
        }
        catch (Exception e)
        {
            LOG.error("Turn rolled back callback error", e);
        }
    }

    private void failQueued()
    {
        IllegalStateException closed = new IllegalStateException("Session " + id + " stopped");
        SessionCommand command;
        while ((command = queue.poll()) != null)
        {
            if (command instanceof SessionCommand.SubmitDelta submit)
            {
                submit.result().completeExceptionally(closed);
            }
            else if (command instanceof SessionCommand.SubmitBatch batch)
            {
                batch.result().completeExceptionally(closed);
            }
            else if (command instanceof SessionCommand.CloseTurn close)
            {
                close.result().completeExceptionally(closed);
            }
        }
    }
}
