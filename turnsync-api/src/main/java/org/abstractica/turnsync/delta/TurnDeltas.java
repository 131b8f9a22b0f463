package org.abstractica.turnsync.delta;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Objects;

/**
 * The batch of deltas belonging to one turn.
 *
 * <p>When {@code checksum} is present it must equal the checksum of the state
 * that results from committing the batch, otherwise the batch is rejected.</p>
 *
 * @param turn     the turn number
 * @param deltas   the deltas in commit order, all with {@code turn == this.turn}
 * @param checksum state checksum after the turn, or null if not supplied
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnDeltas(long turn, List<Delta> deltas, String checksum)
{
    public TurnDeltas
    {
        if (turn < 0)
        {
            throw new IllegalArgumentException("turn must be >= 0: " + turn);
        }
        deltas = List.copyOf(Objects.requireNonNull(deltas, "deltas"));
        for (Delta delta : deltas)
        {
            if (delta.turn() != turn)
            {
                throw new IllegalArgumentException("Delta " + delta.id() + " belongs to turn "
                        + delta.turn() + ", batch is for turn " + turn);
            }
        }
    }

    public TurnDeltas withChecksum(String newChecksum)
    {
        return new TurnDeltas(turn, deltas, newChecksum);
    }
}
