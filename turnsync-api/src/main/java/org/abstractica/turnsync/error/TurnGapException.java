package org.abstractica.turnsync.error;

/**
 * A delta or batch is further ahead of the open turn than the lookahead window allows,
 * or could not be buffered.
 */
public class TurnGapException extends TurnSyncException
{
    private final long turn;
    private final long openTurn;

    public TurnGapException(long turn, long openTurn, String message)
    {
        super(ErrorCode.TURN_GAP, message);
        this.turn = turn;
        this.openTurn = openTurn;
    }

    public long getTurn()
    {
        return turn;
    }

    public long getOpenTurn()
    {
        return openTurn;
    }
}
