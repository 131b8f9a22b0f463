package org.abstractica.turnsync.error;

/**
 * A delta or batch targets a turn that has already been committed.
 */
public class StaleTurnException extends TurnSyncException
{
    private final long turn;
    private final long openTurn;

    public StaleTurnException(long turn, long openTurn)
    {
        super(ErrorCode.STALE_TURN, "Turn " + turn + " is already closed (open turn is " + openTurn + ")");
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
