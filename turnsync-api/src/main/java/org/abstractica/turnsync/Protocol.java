package org.abstractica.turnsync;

import org.abstractica.turnsync.delta.Delta;
import org.abstractica.turnsync.delta.Snapshot;
import org.abstractica.turnsync.delta.TurnDeltas;
import org.abstractica.turnsync.protocol.ClientMessage;
import org.abstractica.turnsync.protocol.ServerMessage;

/**
 * Encodes and decodes the wire documents exchanged with clients.
 *
 * <p>Messages are JSON documents with a {@code type} discriminator. The
 * protocol hash is computed from the structure of every message type, so
 * client and server can detect a version mismatch. State checksums carry
 * their own algorithm identifier, returned by {@link #getChecksumAlgorithm()}.</p>
 */
public interface Protocol
{
    /**
     * Returns the protocol hash for version matching.
     *
     * @return hex SHA-256 over the message structure
     */
    String getHash();

    /**
     * Returns the identifier of the checksum algorithm used for {@link TurnDeltas#checksum()}.
     *
     * @return the algorithm identifier
     */
    String getChecksumAlgorithm();

    String encode(ServerMessage message);

    String encode(ClientMessage message);

    /**
     * Decodes a client document.
     *
     * @param json the document
     * @return the decoded message
     * @throws org.abstractica.turnsync.error.TurnSyncException with code
     *         {@code INVALID_MESSAGE} if the document is malformed
     */
    ClientMessage decodeClientMessage(String json);

    ServerMessage decodeServerMessage(String json);

    String encodeBatch(TurnDeltas batch);

    TurnDeltas decodeBatch(String json);

    String encodeSnapshot(Snapshot snapshot);

    Snapshot decodeSnapshot(String json);

    String encodeDelta(Delta delta);

    Delta decodeDelta(String json);
}
