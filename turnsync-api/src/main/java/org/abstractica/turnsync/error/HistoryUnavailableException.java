package org.abstractica.turnsync.error;

/**
 * A state reconstruction was requested for a turn outside the retained history.
 */
public class HistoryUnavailableException extends TurnSyncException
{
    public HistoryUnavailableException(long turn, long oldestTurn, long latestTurn)
    {
        super(ErrorCode.HISTORY_UNAVAILABLE, "Turn " + turn + " is outside the retained history ["
                + oldestTurn + ", " + latestTurn + "]");
    }
}
