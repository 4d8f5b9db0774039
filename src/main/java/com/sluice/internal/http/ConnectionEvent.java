package com.sluice.internal.http;

/**
 * Inputs to the {@link ConnectionState} transition table.
 */
enum ConnectionEvent {
    /** Bytes arrived from the client. */
    BYTES_RECEIVED,
    /** A request head was parsed (or a protocol error response was queued) and a new exchange joined the pipeline. */
    CYCLE_STARTED,
    /** Response bytes of the head-of-line exchange were moved to the socket write queue. */
    OUTPUT_COMMITTED,
    /** The head-of-line response was fully written, the connection stays open and no exchange is waiting. */
    RESPONSE_COMPLETE_PERSISTENT,
    /** The head-of-line response was fully written and a pipelined exchange is next in line. */
    RESPONSE_COMPLETE_PIPELINED,
    /** The head-of-line response was fully written and the connection must not be reused. */
    RESPONSE_COMPLETE_NON_PERSISTENT,
    /** The server decided to close: shutdown, timeout, request limit or an aborted response. */
    CLOSE_REQUESTED,
    /** An I/O error or client disconnect. */
    FAILED,
    /** The socket is closed. */
    CLOSED
}
