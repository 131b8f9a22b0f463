package org.abstractica.turnsync.error;

/**
 * Stable error codes reported in {@code ERROR} messages and rejection events.
 *
 * <p>The enum constant name is the wire code and must never be renamed.</p>
 */
public enum ErrorCode
{
    /** A key addressed by a path does not exist. */
    MISSING_KEY(Category.PATH),
    /** An intermediate container of a path does not exist. */
    MISSING_PARENT(Category.PATH),
    /** An index step addresses a non-array or an element that does not exist. */
    INDEX_OUT_OF_RANGE(Category.PATH),
    /** A wildcard step is used anywhere but as the final step of a push. */
    INVALID_WILDCARD_USAGE(Category.PATH),
    /** A path string does not follow the path grammar. */
    INVALID_PATH(Category.PATH),

    /** The addressed location does not exist. */
    NOT_FOUND(Category.VALIDATION),
    /** A pull found no element deep-equal to its value. */
    ELEMENT_NOT_FOUND(Category.VALIDATION),
    /** The operation does not fit the type of the addressed location or value. */
    TYPE_MISMATCH(Category.VALIDATION),
    /** The delta target is not one of world, player, npc:&lt;id&gt; or scene. */
    INVALID_TARGET(Category.VALIDATION),
    /** A number in the delta, or the result of an increment, is too large or too precise. */
    NUMBER_OUT_OF_RANGE(Category.VALIDATION),

    /** The delta or batch belongs to a turn that is already closed. */
    STALE_TURN(Category.SEQUENCING),
    /** The delta or batch is too far ahead of the open turn. */
    TURN_GAP(Category.SEQUENCING),

    /** A batch checksum did not match the recomputed state checksum. */
    INTEGRITY_ERROR(Category.INTEGRITY),

    /** No session exists with the requested identifier. */
    SESSION_NOT_FOUND(Category.SESSION),
    /** The requested turn lies outside the retained history. */
    HISTORY_UNAVAILABLE(Category.SESSION),

    /** An inbound message could not be decoded or is not allowed in this state. */
    INVALID_MESSAGE(Category.PROTOCOL),
    /** A command could not be handled. */
    COMMAND_FAILED(Category.PROTOCOL),

    /** An unexpected failure inside the engine. */
    INTERNAL_ERROR(Category.INTERNAL);

    /**
     * Error families, used to decide how far a failure propagates.
     */
    public enum Category
    {
        PATH,
        VALIDATION,
        SEQUENCING,
        INTEGRITY,
        SESSION,
        PROTOCOL,
        INTERNAL
    }

    private final Category category;

    ErrorCode(Category category)
    {
        this.category = category;
    }

    public Category getCategory()
    {
        return category;
    }

    /**
     * Returns whether the error only rejects a single delta and leaves the turn running.
     *
     * @return true for path and validation errors
     */
    public boolean isDeltaLocal()
    {
        return category == Category.PATH || category == Category.VALIDATION;
    }
}
