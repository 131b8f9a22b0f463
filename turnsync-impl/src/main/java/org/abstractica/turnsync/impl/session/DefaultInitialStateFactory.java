package org.abstractica.turnsync.impl.session;

import org.abstractica.turnsync.InitialStateFactory;
import org.abstractica.turnsync.impl.path.TargetRef;
import org.abstractica.turnsync.state.StateValue;
import org.abstractica.turnsync.state.StateValue.ObjectValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@code {world:{theme}, player:{name, ...template}, npcs:{}, currentScene:{}}}.
 *
 * <p>Template fields are copied into the player object; the player name
 * always wins over a {@code name} field in the template.</p>
 */
public class DefaultInitialStateFactory implements InitialStateFactory
{
    @Override
    public ObjectValue create(String themeName, String playerName, StateValue characterTemplate)
    {
        Objects.requireNonNull(themeName, "themeName");
        Objects.requireNonNull(playerName, "playerName");

        Map<String, StateValue> player = new LinkedHashMap<>();
        if (characterTemplate instanceof ObjectValue template)
        {
            player.putAll(template.entries());
        }
        player.put("name", StateValue.of(playerName));

        Map<String, StateValue> root = new LinkedHashMap<>();
        root.put(TargetRef.WORLD_KEY, StateValue.emptyObject().with("theme", StateValue.of(themeName)));
        root.put(TargetRef.PLAYER_KEY, new ObjectValue(player));
        root.put(TargetRef.NPCS_KEY, StateValue.emptyObject());
        root.put(TargetRef.SCENE_KEY, StateValue.emptyObject());
        return new ObjectValue(root);
    }
}
