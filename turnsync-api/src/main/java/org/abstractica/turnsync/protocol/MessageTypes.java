package org.abstractica.turnsync.protocol;

import java.util.Objects;

/**
 * Derives wire type names from message record names.
 *
 * <p>{@code GetStateAtTurn} becomes {@code GET_STATE_AT_TURN}. The name is
 * used as the {@code type} discriminator of every message and event document
 * and as the event type in subscription filters.</p>
 */
public final class MessageTypes
{
    private MessageTypes()
    {
    }

    /**
     * Returns the wire type name for a message or event class.
     *
     * @param type the record class
     * @return the upper snake case name
     */
    public static String typeName(Class<?> type)
    {
        Objects.requireNonNull(type, "type");
        String simpleName = type.getSimpleName();
        StringBuilder sb = new StringBuilder(simpleName.length() + 8);
        for (int i = 0; i < simpleName.length(); i++)
        {
            char c = simpleName.charAt(i);
            if (Character.isUpperCase(c) && i > 0)
            {
                sb.append('_');
            }
            sb.append(Character.toUpperCase(c));
        }
        return sb.toString();
    }
}
