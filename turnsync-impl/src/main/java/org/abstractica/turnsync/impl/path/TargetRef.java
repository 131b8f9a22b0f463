package org.abstractica.turnsync.impl.path;

import org.abstractica.turnsync.error.ErrorCode;
import org.abstractica.turnsync.error.ValidationException;

import java.util.Objects;

/**
 * A delta target resolved to its location in the state root.
 *
 * <p>{@code world}, {@code player} and {@code scene} map to the root keys
 * {@code world}, {@code player} and {@code currentScene}. {@code npc:<id>}
 * maps to {@code npcs.<id>}, and a bare {@code npc} to the {@code npcs}
 * map itself, which is how NPCs are added and removed.</p>
 *
 * @param reference the target string as sent
 * @param root      the path of the target inside the state root
 */
public record TargetRef(String reference, Path root)
{
    public static final String WORLD = "world";
    public static final String PLAYER = "player";
    public static final String SCENE = "scene";
    public static final String NPC = "npc";
    public static final String NPC_PREFIX = "npc:";

    public static final String WORLD_KEY = "world";
    public static final String PLAYER_KEY = "player";
    public static final String NPCS_KEY = "npcs";
    public static final String SCENE_KEY = "currentScene";

    public TargetRef
    {
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(root, "root");
    }

    /**
     * Parses a target reference.
     *
     * @param reference the target string
     * @return the resolved target
     * @throws ValidationException with {@link ErrorCode#INVALID_TARGET} for unknown targets
     */
    public static TargetRef parse(String reference)
    {
        Objects.requireNonNull(reference, "reference");
        String rootKey = switch (reference)
        {
            case WORLD -> WORLD_KEY;
            case PLAYER -> PLAYER_KEY;
            case SCENE -> SCENE_KEY;
            case NPC -> NPCS_KEY;
            default -> null;
        };
        if (rootKey != null)
        {
            return new TargetRef(reference, Path.of(new PathStep.Key(rootKey)));
        }
        if (reference.startsWith(NPC_PREFIX) && reference.length() > NPC_PREFIX.length())
        {
            String npcId = reference.substring(NPC_PREFIX.length());
            return new TargetRef(reference, Path.of(new PathStep.Key(NPCS_KEY), new PathStep.Key(npcId)));
        }
        throw new ValidationException(ErrorCode.INVALID_TARGET, "Unknown target: '" + reference + "'");
    }

    /**
     * Returns the absolute path of {@code relative} inside this target.
     *
     * @param relative a path relative to the target
     * @return the path from the state root
     */
    public Path resolve(Path relative)
    {
        return root.concat(relative);
    }
}
