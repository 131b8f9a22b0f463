package org.abstractica.turnsync.state;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A node in the dynamically-typed game state tree.
 *
 * <p>The tree is a closed union of objects (string key to value), arrays,
 * and scalars. Every variant is immutable: the {@code with}/{@code without}
 * helpers return a new node that shares all untouched children with the
 * original, so a tree that has been handed to readers is never modified.</p>
 *
 * <p>Equality is deep: two objects are equal when they hold equal values
 * under the same keys (key order is irrelevant), arrays compare element by
 * element, and numbers compare by numeric value ({@code 1} equals
 * {@code 1.0}).</p>
 */
public sealed interface StateValue permits
        StateValue.ObjectValue,
        StateValue.ArrayValue,
        StateValue.StringValue,
        StateValue.NumberValue,
        StateValue.BooleanValue,
        StateValue.NullValue
{
    /**
     * Returns the JSON type name of this node.
     *
     * @return one of object, array, string, number, boolean, null
     */
    String typeName();

    // ========== Factories ==========

    static ObjectValue emptyObject()
    {
        return ObjectValue.EMPTY;
    }

    static ArrayValue emptyArray()
    {
        return ArrayValue.EMPTY;
    }

    static StringValue of(String value)
    {
        return new StringValue(value);
    }

    static NumberValue of(long value)
    {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    static NumberValue of(BigDecimal value)
    {
        return new NumberValue(value);
    }

    static BooleanValue of(boolean value)
    {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static NullValue nullValue()
    {
        return NullValue.INSTANCE;
    }

    /**
     * Creates an array node from the given elements.
     *
     * @param elements the elements in order
     * @return a new array node
     */
    static ArrayValue arrayOf(StateValue... elements)
    {
        return new ArrayValue(List.of(elements));
    }

    // ========== Variants ==========

    /**
     * A map from string keys to values. Insertion order is preserved for display only.
     *
     * @param entries the entries of this object
     */
    record ObjectValue(Map<String, StateValue> entries) implements StateValue
    {
        static final ObjectValue EMPTY = new ObjectValue(Map.of());

        public ObjectValue
        {
            Objects.requireNonNull(entries, "entries");
            LinkedHashMap<String, StateValue> copy = new LinkedHashMap<>(entries);
            for (Map.Entry<String, StateValue> entry : copy.entrySet())
            {
                Objects.requireNonNull(entry.getKey(), "key");
                Objects.requireNonNull(entry.getValue(), () -> "value of " + entry.getKey());
            }
            entries = Collections.unmodifiableMap(copy);
        }

        @Override
        public String typeName()
        {
            return "object";
        }

        public Optional<StateValue> get(String key)
        {
            return Optional.ofNullable(entries.get(key));
        }

        public boolean containsKey(String key)
        {
            return entries.containsKey(key);
        }

        public int size()
        {
            return entries.size();
        }

        /**
         * Returns a copy of this object with {@code key} bound to {@code value}.
         *
         * @param key   the key to add or replace
         * @param value the new value
         * @return the updated object
         */
        public ObjectValue with(String key, StateValue value)
        {
            Map<String, StateValue> copy = new LinkedHashMap<>(entries);
            copy.put(key, value);
            return new ObjectValue(copy);
        }

        /**
         * Returns a copy of this object without {@code key}.
         *
         * @param key the key to remove
         * @return the updated object, or this object if the key was absent
         */
        public ObjectValue without(String key)
        {
            if (!entries.containsKey(key))
            {
                return this;
            }
            Map<String, StateValue> copy = new LinkedHashMap<>(entries);
            copy.remove(key);
            return new ObjectValue(copy);
        }
    }

    /**
     * An ordered sequence of values.
     *
     * @param elements the elements in order
     */
    record ArrayValue(List<StateValue> elements) implements StateValue
    {
        static final ArrayValue EMPTY = new ArrayValue(List.of());

        public ArrayValue
        {
            elements = List.copyOf(elements);
        }

        @Override
        public String typeName()
        {
            return "array";
        }

        public StateValue get(int index)
        {
            return elements.get(index);
        }

        public int size()
        {
            return elements.size();
        }

        public boolean isValidIndex(int index)
        {
            return index >= 0 && index < elements.size();
        }

        /**
         * Returns the index of the first element deep-equal to {@code value}.
         *
         * @param value the value to look for
         * @return the index, or -1 if no element matches
         */
        public int indexOf(StateValue value)
        {
            return elements.indexOf(value);
        }

        public ArrayValue with(int index, StateValue value)
        {
            List<StateValue> copy = new ArrayList<>(elements);
            copy.set(index, value);
            return new ArrayValue(copy);
        }

        /**
         * Removes the element at {@code index}; later elements shift down by one.
         *
         * @param index the index to remove
         * @return the compacted array
         */
        public ArrayValue without(int index)
        {
            List<StateValue> copy = new ArrayList<>(elements);
            copy.remove(index);
            return new ArrayValue(copy);
        }

        public ArrayValue insert(int index, StateValue value)
        {
            List<StateValue> copy = new ArrayList<>(elements);
            copy.add(index, value);
            return new ArrayValue(copy);
        }

        public ArrayValue append(StateValue value)
        {
            List<StateValue> copy = new ArrayList<>(elements);
            copy.add(value);
            return new ArrayValue(copy);
        }
    }

    /**
     * A string scalar.
     *
     * @param value the string
     */
    record StringValue(String value) implements StateValue
    {
        public StringValue
        {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String typeName()
        {
            return "string";
        }
    }

    /**
     * A numeric scalar. Numbers are held as {@link BigDecimal} so that replay
     * and checksums never depend on floating point rounding.
     *
     * @param value the number
     */
    record NumberValue(BigDecimal value) implements StateValue
    {
        public NumberValue
        {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String typeName()
        {
            return "number";
        }

        public NumberValue add(NumberValue other)
        {
            return new NumberValue(value.add(other.value));
        }

        public NumberValue negate()
        {
            return new NumberValue(value.negate());
        }

        @Override
        public boolean equals(Object o)
        {
            return o instanceof NumberValue other && value.compareTo(other.value) == 0;
        }

        @Override
        public int hashCode()
        {
            return value.signum() == 0 ? 0 : value.stripTrailingZeros().hashCode();
        }

        @Override
        public String toString()
        {
            return "NumberValue[" + value.toPlainString() + "]";
        }
    }

    /**
     * A boolean scalar.
     *
     * @param value the boolean
     */
    record BooleanValue(boolean value) implements StateValue
    {
        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);

        @Override
        public String typeName()
        {
            return "boolean";
        }
    }

    /**
     * The JSON {@code null} scalar.
     */
    record NullValue() implements StateValue
    {
        static final NullValue INSTANCE = new NullValue();

        @Override
        public String typeName()
        {
            return "null";
        }
    }
}
