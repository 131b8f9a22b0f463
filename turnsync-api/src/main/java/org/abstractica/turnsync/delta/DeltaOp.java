package org.abstractica.turnsync.delta;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Mutation performed by a delta.
 */
public enum DeltaOp
{
    /** Replace the value at the path. */
    SET("set"),
    /** Remove the key or array element at the path; later array elements shift down. */
    DELETE("delete"),
    /** Append the value to the array at the path (or the parent of a {@code [*]} path). */
    PUSH("push"),
    /** Remove the first array element deep-equal to the value. */
    PULL("pull"),
    /** Add the numeric value to the number at the path; negative values decrement. */
    INCREMENT("increment");

    private final String wireName;

    DeltaOp(String wireName)
    {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName()
    {
        return wireName;
    }

    /**
     * Looks up an operation by its wire name.
     *
     * @param wireName the lowercase wire name
     * @return the operation
     * @throws IllegalArgumentException if the name is unknown
     */
    @JsonCreator
    public static DeltaOp fromWireName(String wireName)
    {
        for (DeltaOp op : values())
        {
            if (op.wireName.equals(wireName))
            {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown delta op: " + wireName);
    }
}
