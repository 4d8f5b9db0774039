package com.sluice.internal.http;

/**
 * What a {@link RequestResponseCycle} needs from the connection that owns it. Called from application threads.
 */
interface CycleTransport {

    /**
     * New response bytes are waiting in the cycle, or its response was completed or aborted.
     */
    void outputReady(RequestResponseCycle cycle);

    /**
     * The application consumed enough buffered request body that the connection may read the socket again.
     */
    void bodyConsumed(RequestResponseCycle cycle);

    /**
     * Whether the connection will still parse further requests. {@code false} once shutdown started.
     */
    boolean isAcceptingRequests();

}
