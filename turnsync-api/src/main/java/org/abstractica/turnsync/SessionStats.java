package org.abstractica.turnsync;

/**
 * Counters for one session.
 *
 * @param totalTurns     committed turns
 * @param totalDeltas    committed deltas
 * @param totalSnapshots snapshots taken, including the initial one
 * @param rejectedDeltas deltas left out of a turn or refused on submission
 */
public record SessionStats(long totalTurns, long totalDeltas, long totalSnapshots, long rejectedDeltas)
{
}
