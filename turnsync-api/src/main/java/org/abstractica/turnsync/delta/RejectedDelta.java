package org.abstractica.turnsync.delta;

import org.abstractica.turnsync.error.ErrorCode;

import java.util.Objects;

/**
 * A delta that was excluded from a committed turn.
 *
 * @param delta   the rejected delta
 * @param code    why it was rejected
 * @param message human-readable detail
 */
public record RejectedDelta(Delta delta, ErrorCode code, String message)
{
    public RejectedDelta
    {
        Objects.requireNonNull(delta, "delta");
        Objects.requireNonNull(code, "code");
    }
}
