package org.abstractica.turnsync.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.abstractica.turnsync.state.StateValue;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A player command forwarded to the external command handler.
 *
 * <p>The engine does not interpret commands; it only routes them and acknowledges them.</p>
 *
 * @param id        command identifier, echoed in the {@code ACK}
 * @param timestamp when the command was issued
 * @param type      command kind, for example {@code PLAYER_ACTION}
 * @param payload   command-specific arguments
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlayerCommand(UUID id, Instant timestamp, String type, StateValue payload)
{
    public PlayerCommand
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        if (payload == null)
        {
            payload = StateValue.emptyObject();
        }
    }
}
