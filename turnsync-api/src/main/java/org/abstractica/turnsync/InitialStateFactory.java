package org.abstractica.turnsync;

import org.abstractica.turnsync.state.StateValue;

/**
 * Builds the state tree of a new session.
 *
 * <p>The returned object must contain the roots {@code world}, {@code player},
 * {@code npcs} and {@code currentScene}, since delta targets resolve to them.</p>
 */
@FunctionalInterface
public interface InitialStateFactory
{
    /**
     * Creates the initial state.
     *
     * @param themeName         the theme of the game
     * @param playerName        the player's name
     * @param characterTemplate player character fields, may be null
     * @return the root object of the new state tree
     */
    StateValue.ObjectValue create(String themeName, String playerName, StateValue characterTemplate);
}
