package org.abstractica.turnsync.error;

/**
 * A delta does not fit the current state (missing location, wrong type, no matching element).
 *
 * <p>Local to one delta: the delta is rejected and the turn continues.</p>
 */
public class ValidationException extends TurnSyncException
{
    public ValidationException(ErrorCode code, String message)
    {
        super(code, message);
        if (code.getCategory() != ErrorCode.Category.VALIDATION)
        {
            throw new IllegalArgumentException("Not a validation error code: " + code);
        }
    }
}
