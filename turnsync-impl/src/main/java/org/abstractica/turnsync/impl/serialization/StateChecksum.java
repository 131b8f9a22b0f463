package org.abstractica.turnsync.impl.serialization;

import org.abstractica.turnsync.state.StateValue;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Integrity checksum of a state tree.
 *
 * <p>The checksum is the lowercase hex SHA-256 of the UTF-8 bytes of the
 * tree's {@link CanonicalJson canonical JSON}. It is computed over the state
 * that results from a turn, so any two delta orderings that produce the
 * same state produce the same checksum.</p>
 */
public final class StateChecksum
{
    /**
     * Identifier of the checksum algorithm, published with the protocol.
     */
    public static final String ALGORITHM = "sha256-canonical-json/1";

    private StateChecksum()
    {
    }

    /**
     * Computes the checksum of a state tree.
     *
     * @param state the state tree
     * @return 64 lowercase hex characters
     */
    public static String compute(StateValue state)
    {
        try
        {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(CanonicalJson.write(state).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        }
        catch (NoSuchAlgorithmException e)
        {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
