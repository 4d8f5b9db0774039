package com.sluice.internal.http;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.sluice.internal.http.ConnectionEvent.BYTES_RECEIVED;
import static com.sluice.internal.http.ConnectionEvent.CLOSED;
import static com.sluice.internal.http.ConnectionEvent.CLOSE_REQUESTED;
import static com.sluice.internal.http.ConnectionEvent.CYCLE_STARTED;
import static com.sluice.internal.http.ConnectionEvent.FAILED;
import static com.sluice.internal.http.ConnectionEvent.OUTPUT_COMMITTED;
import static com.sluice.internal.http.ConnectionEvent.RESPONSE_COMPLETE_NON_PERSISTENT;
import static com.sluice.internal.http.ConnectionEvent.RESPONSE_COMPLETE_PERSISTENT;
import static com.sluice.internal.http.ConnectionEvent.RESPONSE_COMPLETE_PIPELINED;

/**
 * Protocol state of one connection, with every legal transition spelled out in a single table.
 *
 * <pre>
 *            bytes            head parsed          output committed
 *   IDLE ----------> READING_REQUEST ---------> PROCESSING ----------> WRITING_RESPONSE
 *    ^ \                                           ^                     |  |  |
 *    |  \ head parsed (bytes already buffered)     |     pipelined       |  |  |
 *    |   +-----------------------------------------+---------------------+  |  |
 *    |                        persistent                                    |  |
 *    +----------------------------------------------------------------------+  |
 *                                                        non-persistent        v
 *   any non-terminal state --- close requested / failed -------------------> CLOSING ---> CLOSED
 * </pre>
 */
enum ConnectionState {
    IDLE,
    READING_REQUEST,
    PROCESSING,
    WRITING_RESPONSE,
    CLOSING,
    CLOSED;

    private static final Map<ConnectionState, Map<ConnectionEvent, ConnectionState>> TRANSITIONS;

    static {
        Map<ConnectionState, Map<ConnectionEvent, ConnectionState>> transitions = new EnumMap<>(ConnectionState.class);

        Map<ConnectionEvent, ConnectionState> idle = new EnumMap<>(ConnectionEvent.class);
        idle.put(BYTES_RECEIVED, READING_REQUEST);
        idle.put(CYCLE_STARTED, PROCESSING);
        idle.put(CLOSE_REQUESTED, CLOSING);
        idle.put(FAILED, CLOSING);
        transitions.put(IDLE, idle);

        Map<ConnectionEvent, ConnectionState> readingRequest = new EnumMap<>(ConnectionEvent.class);
        readingRequest.put(BYTES_RECEIVED, READING_REQUEST);
        readingRequest.put(CYCLE_STARTED, PROCESSING);
        readingRequest.put(CLOSE_REQUESTED, CLOSING);
        readingRequest.put(FAILED, CLOSING);
        transitions.put(READING_REQUEST, readingRequest);

        Map<ConnectionEvent, ConnectionState> processing = new EnumMap<>(ConnectionEvent.class);
        processing.put(BYTES_RECEIVED, PROCESSING);
        processing.put(CYCLE_STARTED, PROCESSING);
        processing.put(OUTPUT_COMMITTED, WRITING_RESPONSE);
        processing.put(CLOSE_REQUESTED, CLOSING);
        processing.put(FAILED, CLOSING);
        transitions.put(PROCESSING, processing);

        Map<ConnectionEvent, ConnectionState> writingResponse = new EnumMap<>(ConnectionEvent.class);
        writingResponse.put(BYTES_RECEIVED, WRITING_RESPONSE);
        writingResponse.put(CYCLE_STARTED, WRITING_RESPONSE);
        writingResponse.put(OUTPUT_COMMITTED, WRITING_RESPONSE);
        writingResponse.put(RESPONSE_COMPLETE_PERSISTENT, IDLE);
        writingResponse.put(RESPONSE_COMPLETE_PIPELINED, PROCESSING);
        writingResponse.put(RESPONSE_COMPLETE_NON_PERSISTENT, CLOSING);
        writingResponse.put(CLOSE_REQUESTED, CLOSING);
        writingResponse.put(FAILED, CLOSING);
        transitions.put(WRITING_RESPONSE, writingResponse);

        Map<ConnectionEvent, ConnectionState> closing = new EnumMap<>(ConnectionEvent.class);
        closing.put(CLOSE_REQUESTED, CLOSING);
        closing.put(FAILED, CLOSING);
        closing.put(ConnectionEvent.CLOSED, CLOSED);
        transitions.put(CLOSING, closing);

        // CLOSED is terminal
        transitions.put(CLOSED, new EnumMap<>(ConnectionEvent.class));

        transitions.replaceAll((state, events) -> Collections.unmodifiableMap(events));
        TRANSITIONS = Collections.unmodifiableMap(transitions);
    }

    /**
     * The state this one moves to on {@code event}, or empty if the event is illegal here.
     */
    Optional<ConnectionState> next(ConnectionEvent event) {
        return Optional.ofNullable(TRANSITIONS.get(this).get(event));
    }

    /**
     * Like {@link #next(ConnectionEvent)}, but an illegal event is a bug.
     *
     * @throws IllegalStateException if {@code event} is not legal in this state
     */
    ConnectionState transition(ConnectionEvent event) {
        return next(event).orElseThrow(() -> new IllegalStateException("Illegal connection transition " + this + " -> " + event));
    }

    boolean terminal() {
        return this == CLOSED;
    }
}
