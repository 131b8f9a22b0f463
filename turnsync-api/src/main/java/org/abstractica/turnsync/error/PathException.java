package org.abstractica.turnsync.error;

/**
 * A path could not be parsed or resolved against the state tree.
 *
 * <p>Local to one delta: the delta is rejected and the turn continues.</p>
 */
public class PathException extends TurnSyncException
{
    private final String path;

    public PathException(ErrorCode code, String path, String message)
    {
        super(code, message);
        if (code.getCategory() != ErrorCode.Category.PATH)
        {
            throw new IllegalArgumentException("Not a path error code: " + code);
        }
        this.path = path;
    }

    /**
     * Returns the path text that failed.
     *
     * @return the offending path
     */
    public String getPath()
    {
        return path;
    }
}
