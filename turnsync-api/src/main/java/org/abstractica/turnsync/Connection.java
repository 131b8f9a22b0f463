package org.abstractica.turnsync;

import org.abstractica.turnsync.protocol.ServerMessage;

/**
 * The outbound side of one client link.
 *
 * <p>Implemented by the transport. The coordinator calls {@link #send} from
 * session threads and from the caller's thread, so implementations must be
 * thread-safe. A connection is bound to at most one session at a time.</p>
 */
public interface Connection
{
    /**
     * Returns a stable identifier for this connection.
     *
     * @return connection ID
     */
    String getId();

    /**
     * Delivers a message to the client.
     *
     * @param message the message to send
     */
    void send(ServerMessage message);
}
