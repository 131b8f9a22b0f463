package org.abstractica.turnsync.error;

import java.util.Objects;

/**
 * Base class of every failure the engine reports to a caller.
 *
 * <p>Each exception carries a stable {@link ErrorCode} that is sent to clients
 * verbatim in {@code ERROR} messages and rejection events.</p>
 */
public class TurnSyncException extends RuntimeException
{
    private final ErrorCode code;

    public TurnSyncException(ErrorCode code, String message)
    {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public TurnSyncException(ErrorCode code, String message, Throwable cause)
    {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode()
    {
        return code;
    }
}
