package org.abstractica.turnsync.error;

import java.util.List;
import java.util.UUID;

/**
 * A batch checksum did not match the checksum recomputed over the resulting state.
 *
 * <p>The turn is not committed and the deltas the batch brought are discarded;
 * they are listed by {@link #getDiscardedDeltaIds()} so each can be reported.</p>
 */
public class IntegrityException extends TurnSyncException
{
    private final long turn;
    private final String expectedChecksum;
    private final String actualChecksum;
    private final List<UUID> discardedDeltaIds;

    public IntegrityException(long turn, String expectedChecksum, String actualChecksum)
    {
        this(turn, expectedChecksum, actualChecksum, List.of());
    }

    public IntegrityException(long turn, String expectedChecksum, String actualChecksum, List<UUID> discardedDeltaIds)
    {
        super(ErrorCode.INTEGRITY_ERROR, "Checksum mismatch for turn " + turn
                + ": batch carries " + expectedChecksum + ", state hashes to " + actualChecksum);
        this.turn = turn;
        this.expectedChecksum = expectedChecksum;
        this.actualChecksum = actualChecksum;
        this.discardedDeltaIds = List.copyOf(discardedDeltaIds);
    }

    public long getTurn()
    {
        return turn;
    }

    public String getExpectedChecksum()
    {
        return expectedChecksum;
    }

    public String getActualChecksum()
    {
        return actualChecksum;
    }

    public List<UUID> getDiscardedDeltaIds()
    {
        return discardedDeltaIds;
    }
}
