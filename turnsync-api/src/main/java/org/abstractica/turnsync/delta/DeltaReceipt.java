package org.abstractica.turnsync.delta;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of submitting a single delta to a session.
 *
 * @param deltaId        the submitted delta's id
 * @param status         what happened to the delta
 * @param effectiveDelta the committed delta for {@link Status#DUPLICATE}, otherwise null
 */
public record DeltaReceipt(UUID deltaId, Status status, Delta effectiveDelta)
{
    /**
     * Result of a submission.
     */
    public enum Status
    {
        /** Queued for the open turn */
        ACCEPTED,
        /** Held back until its (future) turn opens */
        BUFFERED,
        /** Already committed earlier; nothing was changed */
        DUPLICATE,
        /** Same id is already waiting in the buffer; nothing was changed */
        ALREADY_PENDING
    }

    public DeltaReceipt
    {
        Objects.requireNonNull(deltaId, "deltaId");
        Objects.requireNonNull(status, "status");
    }

    public Optional<Delta> committed()
    {
        return Optional.ofNullable(effectiveDelta);
    }
}
