package org.abstractica.turnsync.impl.path;

import java.util.Objects;

/**
 * One step of a {@link Path}.
 */
public sealed interface PathStep permits PathStep.Key, PathStep.Index, PathStep.Append
{
    /**
     * An object key.
     *
     * @param name the key
     */
    record Key(String name) implements PathStep
    {
        public Key
        {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String toString()
        {
            return name;
        }
    }

    /**
     * An array element.
     *
     * @param index the zero-based index
     */
    record Index(int index) implements PathStep
    {
        public Index
        {
            if (index < 0)
            {
                throw new IllegalArgumentException("index must be >= 0: " + index);
            }
        }

        @Override
        public String toString()
        {
            return "[" + index + "]";
        }
    }

    /**
     * The wildcard {@code [*]}: a new element appended to an array.
     */
    record Append() implements PathStep
    {
        public static final Append INSTANCE = new Append();

        @Override
        public String toString()
        {
            return "[*]";
        }
    }
}
