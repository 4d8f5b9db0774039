package com.sluice.internal.http;

import com.sluice.ConnectionRejectionReason;
import com.sluice.CycleOutcome;
import com.sluice.LogEvent;
import com.sluice.LogEventType;
import com.sluice.Request;
import com.sluice.ServerState;
import com.sluice.exception.ClientDisconnectedException;
import com.sluice.exception.MalformedRequestException;
import com.sluice.exception.ResponseContractException;
import com.sluice.internal.util.EventPool;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RequestResponseCycleTests {

    private static final String DATE = "Sun, 06 Nov 1994 08:49:37 GMT";

    private final RecordingCycleListener cycleListener = new RecordingCycleListener();
    private final FakeTransport transport = new FakeTransport();
    private final ServerContext context = new ServerContext(
            new Options(),
            new ServerState(Clock.fixed(Instant.parse("1994-11-06T08:49:37Z"), ZoneOffset.UTC)),
            new EventPool(),
            cycle -> {
            },
            new NoopConnectionListener(),
            cycleListener,
            new NoopLogger());

    private RequestResponseCycle cycle(String method, String version, List<Header> headers, long contentLength) {
        RequestHead head = new RequestHead(method, "/test", version, headers, false, contentLength);
        return new RequestResponseCycle(head, "1-1", new InetSocketAddress("127.0.0.1", 40000), transport,
                new FlowControl(1_024, 256, context.eventPool()), context);
    }

    private RequestResponseCycle get() {
        return cycle("GET", "HTTP/1.1", List.of(new Header("Host", "localhost")), 0);
    }

    @Test
    public void fixed_length_response_is_framed_with_server_headers() {
        RequestResponseCycle cycle = get();

        cycle.run((request, writer) -> writer.respond(200, Map.of("X-Custom", List.of("1")), bytes("hello")));

        String wire = transport.wire();
        assertTrue(wire.startsWith("HTTP/1.1 200 OK\r\n"), wire);
        assertTrue(wire.contains("X-Custom: 1\r\n"));
        assertTrue(wire.contains("Content-Length: 5\r\n"));
        assertTrue(wire.contains("Server: sluice\r\n"));
        assertTrue(wire.contains("Date: " + DATE + "\r\n"));
        assertFalse(wire.contains("Connection:"), "HTTP/1.1 keep-alive is implicit");
        assertTrue(wire.endsWith("\r\n\r\nhello"));
        assertTrue(cycle.isKeepAlive());
        assertEquals(Optional.of(CycleOutcome.COMPLETED), cycle.outcome());
        assertEquals(1, cycleListener.started.size());
        assertEquals(List.of(CycleOutcome.COMPLETED), cycleListener.outcomes);
    }

    @Test
    public void response_without_length_is_chunked_on_http_1_1() {
        RequestResponseCycle cycle = get();

        cycle.run((request, writer) -> {
            writer.start(200, Map.of("Transfer-Encoding", List.of("identity")));
            writer.write(bytes("abc"));
            writer.write(new byte[0]);
            writer.write(bytes("0123456789abcdef"));
            writer.end();
        });

        String wire = transport.wire();
        assertTrue(wire.contains("Transfer-Encoding: chunked\r\n"));
        assertFalse(wire.contains("identity"), "application-supplied framing is replaced");
        assertTrue(wire.endsWith("\r\n\r\n3\r\nabc\r\n10\r\n0123456789abcdef\r\n0\r\n\r\n"), wire);
        assertEquals(Optional.of(CycleOutcome.COMPLETED), cycle.outcome());
    }

    @Test
    public void http_1_0_without_length_is_close_delimited() {
        RequestResponseCycle cycle = cycle("GET", "HTTP/1.0", List.of(), 0);

        cycle.run((request, writer) -> {
            writer.start(200);
            writer.write(bytes("abc"));
            writer.end();
        });

        String wire = transport.wire();
        assertTrue(wire.contains("Connection: close\r\n"));
        assertFalse(wire.contains("Transfer-Encoding"));
        assertTrue(wire.endsWith("\r\n\r\nabc"));
        assertFalse(cycle.isKeepAlive());
    }

    @Test
    public void http_1_0_keep_alive_is_acknowledged() {
        RequestResponseCycle cycle = cycle("GET", "HTTP/1.0", List.of(new Header("Connection", "Keep-Alive")), 0);

        cycle.run((request, writer) -> writer.respond(200, Map.of(), bytes("ok")));

        assertTrue(transport.wire().contains("Connection: keep-alive\r\n"));
        assertTrue(cycle.isKeepAlive());
    }

    @Test
    public void connection_close_from_client_is_honored() {
        RequestResponseCycle cycle = cycle("GET", "HTTP/1.1", List.of(new Header("Connection", "close")), 0);

        cycle.run((request, writer) -> writer.respond(200, Map.of(), bytes("ok")));

        assertTrue(transport.wire().contains("Connection: close\r\n"));
        assertFalse(cycle.isKeepAlive());
    }

    @Test
    public void shutting_down_connection_closes_after_response() {
        transport.acceptingRequests = false;
        RequestResponseCycle cycle = get();

        cycle.run((request, writer) -> writer.respond(200, Map.of(), bytes("ok")));

        assertTrue(transport.wire().contains("Connection: close\r\n"));
        assertFalse(cycle.isKeepAlive());
    }

    @Test
    public void head_response_keeps_headers_and_drops_body() {
        RequestResponseCycle cycle = cycle("HEAD", "HTTP/1.1", List.of(), 0);

        cycle.run((request, writer) -> writer.respond(200, Map.of(), bytes("hello")));

        String wire = transport.wire();
        assertTrue(wire.contains("Content-Length: 5\r\n"));
        assertTrue(wire.endsWith("\r\n\r\n"));
        assertFalse(wire.contains("hello"));
        assertEquals(Optional.of(CycleOutcome.COMPLETED), cycle.outcome());
    }

    @Test
    public void body_on_204_violates_contract_and_closes_afterwards() {
        RequestResponseCycle cycle = get();
        AtomicReference<Throwable> caught = new AtomicReference<>();

        cycle.run((request, writer) -> {
            writer.start(204, Map.of("Content-Length", List.of("0")));
            try {
                writer.write(bytes("nope"));
            } catch (ResponseContractException e) {
                caught.set(e);
            }
            writer.end();
        });

        assertInstanceOf(ResponseContractException.class, caught.get());
        String wire = transport.wire();
        assertTrue(wire.startsWith("HTTP/1.1 204 No Content\r\n"));
        assertFalse(wire.contains("Content-Length"));
        assertFalse(wire.contains("nope"));
        assertFalse(cycle.isKeepAlive());
        assertEquals(List.of(CycleOutcome.APPLICATION_FAILED), cycleListener.outcomes);
        assertSame(caught.get(), cycleListener.throwables.get(0));
    }

    @Test
    public void returning_without_a_response_yields_500() {
        RequestResponseCycle cycle = get();

        cycle.run((request, writer) -> {
        });

        String wire = transport.wire();
        assertTrue(wire.startsWith("HTTP/1.1 500 Internal Server Error\r\n"), wire);
        assertTrue(wire.contains("Content-Length: 0\r\n"));
        assertTrue(wire.contains("Connection: close\r\n"));
        assertEquals(List.of(CycleOutcome.APPLICATION_FAILED), cycleListener.outcomes);
        assertInstanceOf(ResponseContractException.class, cycleListener.throwables.get(0));
        assertEquals(List.of(LogEventType.RESPONSE_CONTRACT_VIOLATED), cycleListener.logEventTypes());
    }

    @Test
    public void exception_before_start_yields_500() {
        RequestResponseCycle cycle = get();
        IllegalStateException failure = new IllegalStateException("boom");

        cycle.run((request, writer) -> {
            throw failure;
        });

        assertTrue(transport.wire().startsWith("HTTP/1.1 500 Internal Server Error\r\n"));
        assertEquals(List.of(CycleOutcome.APPLICATION_FAILED), cycleListener.outcomes);
        assertSame(failure, cycleListener.throwables.get(0));
        assertEquals(List.of(LogEventType.APPLICATION_FAILED), cycleListener.logEventTypes());
    }

    @Test
    public void exception_mid_stream_aborts_connection() {
        RequestResponseCycle cycle = get();

        cycle.run((request, writer) -> {
            writer.start(200, Map.of("Content-Length", List.of("10")));
            writer.write(bytes("half"));
            throw new IllegalStateException("boom");
        });

        assertTrue(transport.disconnected);
        assertTrue(cycle.isAbrupt());
        assertTrue(transport.wire().endsWith("half"));
        assertEquals(List.of(CycleOutcome.APPLICATION_FAILED), cycleListener.outcomes);
    }

    @Test
    public void short_body_for_declared_length_is_a_violation() {
        RequestResponseCycle cycle = get();

        cycle.run((request, writer) -> {
            writer.start(200, Map.of("Content-Length", List.of("10")));
            writer.write(bytes("short"));
            writer.end();
        });

        assertTrue(transport.disconnected);
        assertEquals(List.of(CycleOutcome.APPLICATION_FAILED), cycleListener.outcomes);
        assertInstanceOf(ResponseContractException.class, cycleListener.throwables.get(0));
    }

    @Test
    public void invalid_status_and_headers_are_rejected() {
        RequestResponseCycle cycle = get();
        List<Throwable> caught = new ArrayList<>();

        cycle.run((request, writer) -> {
            for (Runnable attempt : List.<Runnable>of(
                    () -> writer.start(99),
                    () -> writer.start(600),
                    () -> writer.start(200, Map.of("Bad Name", List.of("x"))),
                    () -> writer.start(200, Map.of("X-Injected", List.of("a\r\nb"))))) {
                try {
                    attempt.run();
                } catch (ResponseContractException e) {
                    caught.add(e);
                }
            }
            assertFalse(writer.isStarted());
        });

        assertEquals(4, caught.size());
        // Nothing was started, so the recorded violation turns into a 500
        assertTrue(transport.wire().startsWith("HTTP/1.1 500 "));
    }

    @Test
    public void start_twice_is_a_violation() {
        RequestResponseCycle cycle = get();
        AtomicReference<Throwable> caught = new AtomicReference<>();

        cycle.run((request, writer) -> {
            writer.start(200, Map.of("Content-Length", List.of("0")));
            try {
                writer.start(200);
            } catch (ResponseContractException e) {
                caught.set(e);
            }
            writer.end();
        });

        assertNotNull(caught.get());
        assertEquals(List.of(CycleOutcome.APPLICATION_FAILED), cycleListener.outcomes);
    }

    @Test
    public void request_body_is_streamed_to_the_application() throws Exception {
        RequestResponseCycle cycle = cycle("POST", "HTTP/1.1", List.of(), 11);
        ByteArrayOutputStream received = new ByteArrayOutputStream();

        Thread eventLoop = new Thread(() -> {
            cycle.deliverBody(bytes("hello "));
            sleep(50);
            cycle.deliverBody(bytes("world"));
            cycle.completeBody();
        });
        eventLoop.start();

        cycle.run((request, writer) -> {
            Optional<byte[]> chunk;
            while ((chunk = request.getBody().readChunk()).isPresent()) {
                received.writeBytes(chunk.get());
            }
            writer.respond(200, Map.of(), bytes("ok"));
        });

        eventLoop.join();
        assertEquals("hello world", received.toString(StandardCharsets.UTF_8));
        assertEquals(0, cycle.bufferedBodyBytes());
        assertEquals(Optional.of(CycleOutcome.COMPLETED), cycle.outcome());
    }

    @Test
    public void disconnect_wakes_blocked_reader() throws Exception {
        RequestResponseCycle cycle = cycle("POST", "HTTP/1.1", List.of(), 100);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread application = new Thread(() -> {
            cycle.run((request, writer) -> {
                try {
                    request.getBody().readChunk();
                } catch (ClientDisconnectedException e) {
                    thrown.set(e);
                    throw e;
                }
            });
            done.countDown();
        });
        application.start();

        sleep(100);
        cycle.disconnect();

        assertTrue(done.await(5, TimeUnit.SECONDS));
        assertInstanceOf(ClientDisconnectedException.class, thrown.get());
        assertEquals(List.of(CycleOutcome.DISCONNECTED), cycleListener.outcomes);
        assertTrue(cycleListener.logEventTypes().contains(LogEventType.CLIENT_DISCONNECTED));
    }

    @Test
    public void writes_after_disconnect_fail() {
        RequestResponseCycle cycle = get();
        cycle.disconnect();

        assertThrows(ClientDisconnectedException.class, () -> cycle.start(200));
    }

    @Test
    public void reads_after_disconnect_fail_even_with_buffered_body() {
        RequestResponseCycle cycle = cycle("POST", "HTTP/1.1", List.of(), 100);
        cycle.deliverBody(bytes("hello"));
        cycle.disconnect();

        assertThrows(ClientDisconnectedException.class, cycle::readChunk);
    }

    @Test
    public void reads_after_disconnect_fail_even_when_body_was_complete() {
        RequestResponseCycle cycle = cycle("POST", "HTTP/1.1", List.of(), 5);
        cycle.deliverBody(bytes("hello"));
        cycle.completeBody();
        cycle.disconnect();

        assertThrows(ClientDisconnectedException.class, cycle::readChunk);
    }

    @Test
    public void write_before_start_is_a_violation() {
        RequestResponseCycle cycle = get();
        AtomicReference<Throwable> caught = new AtomicReference<>();

        cycle.run((request, writer) -> {
            try {
                writer.write(bytes("early"));
            } catch (ResponseContractException e) {
                caught.set(e);
                throw e;
            }
        });

        String wire = transport.wire();
        assertInstanceOf(ResponseContractException.class, caught.get());
        assertTrue(wire.startsWith("HTTP/1.1 500 Internal Server Error\r\n"), wire);
        assertTrue(wire.contains("Connection: close\r\n"));
        assertTrue(wire.endsWith("\r\n\r\n"), "the failsafe response has no body");
        assertFalse(wire.contains("early"));
        assertEquals(1, wire.split("HTTP/1.1 ", -1).length - 1, "only one response reaches the wire");
        assertFalse(cycle.isKeepAlive());
        assertEquals(List.of(CycleOutcome.APPLICATION_FAILED), cycleListener.outcomes);
        assertSame(caught.get(), cycleListener.throwables.get(0));
        assertEquals(List.of(LogEventType.RESPONSE_CONTRACT_VIOLATED), cycleListener.logEventTypes());

        LogEvent logEvent = cycleListener.logEvents.get(0);
        assertEquals(Optional.of(CycleOutcome.APPLICATION_FAILED), logEvent.getCycleOutcome());
        assertEquals(Optional.of(new InetSocketAddress("127.0.0.1", 40000)), logEvent.getRemoteAddress());
    }

    @Test
    public void abandon_finishes_exchange_whose_application_never_returns() {
        RequestResponseCycle cycle = get();
        cycle.disconnect();

        assertFalse(cycle.isFinished(), "application has not returned yet");
        cycle.abandon();

        assertEquals(Optional.of(CycleOutcome.DISCONNECTED), cycle.outcome());
        // A second finish attempt is ignored
        cycle.abandon();
        assertEquals(1, cycleListener.outcomes.size());
    }

    @Test
    public void broken_request_body_yields_protocol_error() {
        RequestResponseCycle cycle = cycle("POST", "HTTP/1.1", List.of(), 100);
        AtomicReference<Throwable> thrown = new AtomicReference<>();

        cycle.deliverBody(bytes("partial"));
        cycle.failRequestBody(new MalformedRequestException("invalid chunk size"));

        cycle.run((request, writer) -> {
            try {
                while (request.getBody().readChunk().isPresent()) {
                    // drain
                }
            } catch (MalformedRequestException e) {
                thrown.set(e);
            }
        });

        assertInstanceOf(MalformedRequestException.class, thrown.get());
        assertTrue(transport.wire().startsWith("HTTP/1.1 400 Bad Request\r\n"));
        assertEquals(List.of(CycleOutcome.PROTOCOL_ERROR), cycleListener.outcomes);
    }

    @Test
    public void protocol_error_exchange_carries_only_the_error_response() {
        RequestResponseCycle cycle = RequestResponseCycle.forProtocolError(
                new MalformedRequestException("too big", 431), transport, new FlowControl(1_024, 256, context.eventPool()), context);

        transport.outputReady(cycle);

        assertTrue(transport.wire().startsWith("HTTP/1.1 431 Request Header Fields Too Large\r\n"));
        assertTrue(transport.wire().contains("Connection: close\r\n"));
        assertEquals(Optional.of(CycleOutcome.PROTOCOL_ERROR), cycle.outcome());
        assertNull(cycle.request());
        assertTrue(cycleListener.started.isEmpty(), "there is no request to report");
    }

    @Test
    public void expect_continue_is_sent_on_first_read() {
        RequestResponseCycle cycle = cycle("PUT", "HTTP/1.1", List.of(new Header("Expect", "100-continue")), 3);
        cycle.deliverBody(bytes("abc"));
        cycle.completeBody();

        cycle.run((request, writer) -> {
            while (request.getBody().readChunk().isPresent()) {
                // drain
            }
            writer.respond(201, Map.of(), new byte[0]);
        });

        String wire = transport.wire();
        assertFalse(wire.startsWith("HTTP/1.1 100 Continue\r\n"), "body already complete, no interim response needed");
        assertTrue(wire.contains("HTTP/1.1 201 Created\r\n"));
        assertTrue(cycle.isKeepAlive());
    }

    @Test
    public void expect_continue_precedes_final_response_when_body_pending() throws Exception {
        RequestResponseCycle cycle = cycle("PUT", "HTTP/1.1", List.of(new Header("Expect", "100-continue")), 3);

        Thread eventLoop = new Thread(() -> {
            sleep(100);
            cycle.deliverBody(bytes("abc"));
            cycle.completeBody();
        });
        eventLoop.start();

        cycle.run((request, writer) -> {
            while (request.getBody().readChunk().isPresent()) {
                // drain
            }
            writer.respond(200, Map.of(), new byte[0]);
        });
        eventLoop.join();

        assertTrue(transport.wire().startsWith("HTTP/1.1 100 Continue\r\n\r\nHTTP/1.1 200 OK\r\n"));
    }

    @Test
    public void unread_expect_continue_body_closes_connection() {
        RequestResponseCycle cycle = cycle("PUT", "HTTP/1.1", List.of(new Header("Expect", "100-continue")), 3);

        cycle.run((request, writer) -> writer.respond(417, Map.of(), new byte[0]));

        String wire = transport.wire();
        assertTrue(wire.startsWith("HTTP/1.1 417 Expectation Failed\r\n"));
        assertTrue(wire.contains("Connection: close\r\n"));
        assertFalse(cycle.isKeepAlive());
    }

    @Test
    public void rejected_exchange_yields_503() {
        RequestResponseCycle cycle = get();

        cycle.reject(new IllegalStateException("executor saturated"));

        assertTrue(transport.wire().startsWith("HTTP/1.1 503 Service Unavailable\r\n"));
        assertEquals(List.of(CycleOutcome.APPLICATION_FAILED), cycleListener.outcomes);
        assertTrue(cycleListener.logEventTypes().isEmpty());
    }

    @Test
    public void request_view_exposes_head() {
        RequestResponseCycle cycle = cycle("GET", "HTTP/1.1", List.of(new Header("Accept", "a"), new Header("accept", "b")), 0);

        Request request = cycle.request();
        assertEquals("1-1", request.getId());
        assertEquals("GET", request.getMethod());
        assertEquals("/test", request.getTarget());
        assertEquals("HTTP/1.1", request.getHttpVersion());
        assertEquals(Optional.of("a"), request.getHeader("ACCEPT"));
        assertEquals(Optional.of(new InetSocketAddress("127.0.0.1", 40000)), request.getRemoteAddress());
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stands in for the connection: takes output immediately, completes the exchange once everything is taken, and
     * drops the connection on an abrupt abort.
     */
    private static class FakeTransport implements CycleTransport {
        private final ByteArrayOutputStream wire = new ByteArrayOutputStream();
        volatile boolean acceptingRequests = true;
        volatile boolean disconnected;

        @Override
        public synchronized void outputReady(RequestResponseCycle cycle) {
            for (ByteBuffer buffer : cycle.takeOutput()) {
                byte[] bytes = new byte[buffer.remaining()];
                buffer.get(bytes);
                wire.writeBytes(bytes);
            }
            if (cycle.isAbrupt()) {
                disconnected = true;
                cycle.disconnect();
            } else if (cycle.isOutputComplete()) {
                cycle.didFlush();
            }
        }

        @Override
        public void bodyConsumed(RequestResponseCycle cycle) {
        }

        @Override
        public boolean isAcceptingRequests() {
            return acceptingRequests;
        }

        synchronized String wire() {
            return wire.toString(StandardCharsets.ISO_8859_1);
        }
    }

    private static class RecordingCycleListener implements CycleListener {
        final List<Request> started = new CopyOnWriteArrayList<>();
        final List<CycleOutcome> outcomes = new CopyOnWriteArrayList<>();
        final List<Throwable> throwables = new CopyOnWriteArrayList<>();
        final List<LogEvent> logEvents = new CopyOnWriteArrayList<>();

        @Override
        public void didStartCycle(Request request) {
            started.add(request);
        }

        @Override
        public void didFinishCycle(Request request, CycleOutcome outcome, Duration duration, Throwable throwable) {
            outcomes.add(outcome);
            if (throwable != null) {
                throwables.add(throwable);
            }
        }

        @Override
        public void didReceiveLogEvent(LogEvent logEvent) {
            logEvents.add(logEvent);
        }

        List<LogEventType> logEventTypes() {
            return logEvents.stream().map(LogEvent::getLogEventType).toList();
        }
    }

    private static class NoopConnectionListener implements ConnectionListener {
        @Override
        public void didAcceptConnection(InetSocketAddress remoteAddress) {
        }

        @Override
        public void didFailToAcceptConnection(InetSocketAddress remoteAddress, ConnectionRejectionReason reason) {
        }

        @Override
        public void didCloseConnection(InetSocketAddress remoteAddress) {
        }

        @Override
        public void didServeRequest(long requestsServed) {
        }
    }

    private static class NoopLogger implements Logger {
        @Override
        public boolean enabled() {
            return false;
        }

        @Override
        public void log(LogEntry... entries) {
        }

        @Override
        public void log(Exception e, LogEntry... entries) {
        }
    }
}
