package com.sluice.internal.http;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConnectionStateTests {

    @Test
    public void persistent_exchange_returns_to_idle() {
        ConnectionState state = ConnectionState.IDLE
                .transition(ConnectionEvent.BYTES_RECEIVED)
                .transition(ConnectionEvent.CYCLE_STARTED)
                .transition(ConnectionEvent.OUTPUT_COMMITTED)
                .transition(ConnectionEvent.RESPONSE_COMPLETE_PERSISTENT);

        assertEquals(ConnectionState.IDLE, state);
    }

    @Test
    public void pipelined_completion_goes_back_to_processing() {
        assertEquals(ConnectionState.PROCESSING,
                ConnectionState.WRITING_RESPONSE.transition(ConnectionEvent.RESPONSE_COMPLETE_PIPELINED));
    }

    @Test
    public void non_persistent_completion_closes() {
        ConnectionState state = ConnectionState.WRITING_RESPONSE
                .transition(ConnectionEvent.RESPONSE_COMPLETE_NON_PERSISTENT)
                .transition(ConnectionEvent.CLOSED);

        assertEquals(ConnectionState.CLOSED, state);
        assertTrue(state.terminal());
    }

    @Test
    public void every_live_state_can_fail_or_be_closed() {
        for (ConnectionState state : ConnectionState.values()) {
            if (state.terminal()) {
                continue;
            }
            assertEquals(Optional.of(ConnectionState.CLOSING), state.next(ConnectionEvent.FAILED), state.name());
            assertEquals(Optional.of(ConnectionState.CLOSING), state.next(ConnectionEvent.CLOSE_REQUESTED), state.name());
        }
    }

    @Test
    public void closed_accepts_nothing() {
        for (ConnectionEvent event : ConnectionEvent.values()) {
            assertFalse(ConnectionState.CLOSED.next(event).isPresent(), event.name());
        }
    }

    @Test
    public void output_cannot_be_committed_before_a_cycle_starts() {
        assertFalse(ConnectionState.IDLE.next(ConnectionEvent.OUTPUT_COMMITTED).isPresent());
        assertFalse(ConnectionState.READING_REQUEST.next(ConnectionEvent.OUTPUT_COMMITTED).isPresent());
        assertThrows(IllegalStateException.class,
                () -> ConnectionState.IDLE.transition(ConnectionEvent.RESPONSE_COMPLETE_PERSISTENT));
    }

    @Test
    public void only_closing_reaches_closed() {
        for (ConnectionState state : ConnectionState.values()) {
            boolean reachesClosed = state.next(ConnectionEvent.CLOSED).isPresent();
            assertEquals(state == ConnectionState.CLOSING, reachesClosed, state.name());
        }
    }
}
