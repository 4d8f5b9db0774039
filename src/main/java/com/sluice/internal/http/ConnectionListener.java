package com.sluice.internal.http;

import com.sluice.ConnectionRejectionReason;

import java.net.InetSocketAddress;

/**
 * Listener for low-level connection events. Implementations must not throw.
 */
public interface ConnectionListener {

    /**
     * Called when a connection is accepted.
     *
     * @param remoteAddress best-effort remote address, or {@code null} if unavailable
     */
    void didAcceptConnection(InetSocketAddress remoteAddress);

    /**
     * Called when a connection is refused.
     *
     * @param remoteAddress best-effort remote address, or {@code null} if unavailable
     */
    void didFailToAcceptConnection(InetSocketAddress remoteAddress, ConnectionRejectionReason reason);

    /**
     * Called once per accepted connection, after its socket is closed.
     */
    void didCloseConnection(InetSocketAddress remoteAddress);

    /**
     * Called each time a response has been fully written.
     *
     * @param requestsServed running total across the whole server
     */
    void didServeRequest(long requestsServed);

}
