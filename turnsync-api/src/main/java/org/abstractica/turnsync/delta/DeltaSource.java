package org.abstractica.turnsync.delta;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What produced a delta.
 */
public enum DeltaSource
{
    PLAYER_ACTION("player_action"),
    GM_NARRATION("gm_narration"),
    NPC_ACTION("npc_action"),
    CONFLICT_RESOLUTION("conflict_resolution"),
    TIME_PASSAGE("time_passage"),
    SYSTEM("system");

    private final String wireName;

    DeltaSource(String wireName)
    {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName()
    {
        return wireName;
    }

    @JsonCreator
    public static DeltaSource fromWireName(String wireName)
    {
        for (DeltaSource source : values())
        {
            if (source.wireName.equals(wireName))
            {
                return source;
            }
        }
        throw new IllegalArgumentException("Unknown delta source: " + wireName);
    }
}
