package org.abstractica.turnsync;

import org.abstractica.turnsync.protocol.PlayerCommand;

/**
 * Game rules that turn player commands into deltas.
 *
 * <p>The handler is called on the thread that delivered the {@code COMMAND}
 * message. It submits deltas through the context; the coordinator answers
 * the command with {@code ACK{success:true}} when the handler returns and
 * with {@code ACK{success:false}} when it throws.</p>
 */
@FunctionalInterface
public interface CommandHandler
{
    /**
     * Handles a player command.
     *
     * @param context the session the command was issued in
     * @param command the command
     */
    void handle(SessionContext context, PlayerCommand command);
}
