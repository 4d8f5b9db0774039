package com.sluice.internal.http;

import com.sluice.Application;
import com.sluice.CycleOutcome;
import com.sluice.LogEvent;
import com.sluice.LogEventType;
import com.sluice.Request;
import com.sluice.RequestBody;
import com.sluice.ResponseWriter;
import com.sluice.StatusCode;
import com.sluice.exception.ClientDisconnectedException;
import com.sluice.exception.MalformedRequestException;
import com.sluice.exception.ResponseContractException;
import com.sluice.internal.util.Signal;

import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import static java.util.Objects.requireNonNull;

/**
 * One request/response exchange on a connection.
 * <p>
 * The event loop thread feeds it request body chunks ({@link #deliverBody(byte[])}, {@link #completeBody()}) and
 * takes serialized response bytes out of it ({@link #takeOutput()}). An application thread runs
 * {@link #run(Application)}, pulling the body through the {@link RequestBody} view of this object and pushing the
 * response through its {@link ResponseWriter} view. Pulls block until data arrives; pushes block while too much
 * output is waiting. Both fail fast with {@link ClientDisconnectedException} once the client is gone.
 * <p>
 * Misuse of the response writer throws {@link ResponseContractException} and dooms the exchange: the client gets a
 * 500 if no response had been started, otherwise the connection is closed once the application returns.
 * <p>
 * Every exchange ends in exactly one {@link CycleOutcome}, reported once through {@link CycleListener}.
 */
public class RequestResponseCycle implements RequestBody, ResponseWriter {

    enum ResponseState {
        NOT_STARTED,
        STREAMING,
        ENDED
    }

    enum Framing {
        CONTENT_LENGTH,
        CHUNKED,
        NO_BODY,
        CLOSE_DELIMITED
    }

    private static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] LAST_CHUNK = "0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] CONTINUE_RESPONSE = "HTTP/1.1 100 Continue\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    private static final String HEADER_CONNECTION = "Connection";
    private static final String HEADER_CONTENT_LENGTH = "Content-Length";
    private static final String HEADER_TRANSFER_ENCODING = "Transfer-Encoding";
    private static final String HEADER_EXPECT = "Expect";
    private static final String HEADER_SERVER = "Server";
    private static final String HEADER_DATE = "Date";
    private static final String KEEP_ALIVE = "keep-alive";
    private static final String CLOSE = "close";
    private static final String CONTINUE = "100-continue";
    private static final String HEAD = "HEAD";

    private final Request request;
    private final boolean httpOneDotZero;
    private final boolean requestKeepAlive;
    private final boolean expectContinue;
    private final CycleTransport transport;
    private final FlowControl flowControl;
    private final ServerContext context;
    private final ReentrantLock lock;
    private final AtomicReference<CycleOutcome> outcome;
    private final long createdAtNanos;

    // Request body, guarded by lock
    private final Deque<byte[]> bodyChunks;
    private long bufferedBodyBytes;
    private boolean bodyComplete;
    private MalformedRequestException bodyFailure;
    private boolean continueHandled;

    // Response, guarded by lock
    private List<ByteBuffer> pendingOutput;
    private long pendingOutputBytes;
    private ResponseState responseState;
    private Framing framing;
    private long declaredContentLength;
    private long writtenBodyBytes;
    private boolean keepAlive;
    private boolean abrupt;

    // Lifecycle, guarded by lock
    private boolean disconnected;
    private boolean applicationReturned;
    private CycleOutcome pendingOutcome;
    private Throwable failure;
    private ResponseContractException contractViolation;
    private Signal applicationSignal;
    private Signal doneSignal;
    private Future<?> applicationFuture;

    RequestResponseCycle(RequestHead head,
                         String id,
                         InetSocketAddress remoteAddress,
                         CycleTransport transport,
                         FlowControl flowControl,
                         ServerContext context) {
        this(transport, flowControl, context, head.httpOneDotZero(), requestKeepAlive(head),
                !head.httpOneDotZero() && head.hasBody() && head.hasHeaderToken(HEADER_EXPECT, CONTINUE), head, id, remoteAddress);
    }

    private RequestResponseCycle(CycleTransport transport,
                                 FlowControl flowControl,
                                 ServerContext context,
                                 boolean httpOneDotZero,
                                 boolean requestKeepAlive,
                                 boolean expectContinue,
                                 RequestHead head,
                                 String id,
                                 InetSocketAddress remoteAddress) {
        this.transport = transport;
        this.flowControl = flowControl;
        this.context = context;
        this.httpOneDotZero = httpOneDotZero;
        this.requestKeepAlive = requestKeepAlive;
        this.expectContinue = expectContinue;
        this.lock = new ReentrantLock();
        this.outcome = new AtomicReference<>();
        this.createdAtNanos = System.nanoTime();
        this.bodyChunks = new ArrayDeque<>();
        this.pendingOutput = new ArrayList<>();
        this.responseState = ResponseState.NOT_STARTED;
        this.declaredContentLength = -1;
        this.request = head == null ? null : Request.with(head.method(), head.target())
                .id(id)
                .httpVersion(head.version())
                .headers(head.headerValues())
                .remoteAddress(remoteAddress)
                .body(this)
                .build();
    }

    /**
     * An exchange with no application behind it, carrying only the error response for a request that could not be
     * read. The connection closes after it is written.
     */
    static RequestResponseCycle forProtocolError(MalformedRequestException e,
                                                 CycleTransport transport,
                                                 FlowControl flowControl,
                                                 ServerContext context) {
        RequestResponseCycle cycle = new RequestResponseCycle(transport, flowControl, context, false, false, false, null, null, null);
        cycle.lock.lock();
        try {
            cycle.bodyComplete = true;
            cycle.applicationReturned = true;
            cycle.pendingOutcome = CycleOutcome.PROTOCOL_ERROR;
            cycle.failure = e;
            cycle.replaceWithFailsafeResponse(e.getStatusCode());
        } finally {
            cycle.lock.unlock();
        }
        return cycle;
    }

    private static boolean requestKeepAlive(RequestHead head) {
        if (head.hasHeaderToken(HEADER_CONNECTION, CLOSE)) {
            return false;
        }
        if (head.httpOneDotZero()) {
            return head.hasHeaderToken(HEADER_CONNECTION, KEEP_ALIVE);
        }
        return true;
    }

    // Application side

    /**
     * Invokes the application and blocks until the response has been fully written or the exchange was abandoned.
     * Never throws: failures are turned into an error response, an aborted connection or a disconnect outcome.
     */
    public void run(Application application) {
        requireNonNull(application);

        if (request == null) {
            return;
        }

        context.cycleListener().didStartCycle(request);

        Throwable thrown = null;

        try {
            application.handle(request, this);
        } catch (Throwable t) {
            thrown = t;
        }

        afterApplication(thrown, 500, true);
        awaitDone();
    }

    /**
     * Called when the application could not be scheduled at all. The client gets a 503.
     */
    public void reject(Throwable cause) {
        requireNonNull(cause);

        if (request != null) {
            context.cycleListener().didStartCycle(request);
        }

        afterApplication(cause, 503, false);
    }

    /**
     * Lets the exchange cancel its application task if the client goes away and the application does not stop in time.
     */
    public void applicationFuture(Future<?> future) {
        lock.lock();
        try {
            applicationFuture = future;
        } finally {
            lock.unlock();
        }
    }

    private void afterApplication(Throwable thrown, int failsafeStatusCode, boolean logFailure) {
        boolean disconnectedNow;
        LogEventType logEventType = null;
        Throwable logThrowable = null;
        String logMessage = null;

        lock.lock();
        try {
            applicationReturned = true;
            disconnectedNow = disconnected;

            if (!disconnected && pendingOutcome != CycleOutcome.PROTOCOL_ERROR) {
                Throwable cause = thrown != null ? thrown : contractViolation;

                if (cause == null && responseState == ResponseState.NOT_STARTED) {
                    cause = new ResponseContractException("Application returned without starting a response");
                } else if (cause == null && responseState == ResponseState.STREAMING) {
                    cause = new ResponseContractException("Application returned without ending the response");
                }

                if (cause != null) {
                    failure = cause;
                    pendingOutcome = CycleOutcome.APPLICATION_FAILED;

                    if (responseState == ResponseState.NOT_STARTED) {
                        replaceWithFailsafeResponse(failsafeStatusCode);
                    } else if (responseState == ResponseState.STREAMING) {
                        abrupt = true;
                    } else {
                        keepAlive = false;
                    }

                    logEventType = cause instanceof ResponseContractException
                            ? LogEventType.RESPONSE_CONTRACT_VIOLATED
                            : LogEventType.APPLICATION_FAILED;
                    logThrowable = cause;
                    logMessage = cause instanceof ResponseContractException
                            ? "Application violated the response contract: " + cause.getMessage()
                            : "Application threw an exception while handling the request";
                }
            }
        } finally {
            lock.unlock();
        }

        if (logFailure && logEventType != null) {
            context.cycleListener().didReceiveLogEvent(LogEvent.with(logEventType, logMessage)
                    .throwable(logThrowable)
                    .request(request)
                    .cycleOutcome(CycleOutcome.APPLICATION_FAILED)
                    .build());
        }

        if (disconnectedNow) {
            finish(pendingOutcomeOr(CycleOutcome.DISCONNECTED), currentFailure());
        } else {
            transport.outputReady(this);
        }
    }

    private void awaitDone() {
        Signal signal;

        lock.lock();
        try {
            if (outcome.get() != null) {
                return;
            }
            if (doneSignal == null) {
                doneSignal = context.eventPool().acquire();
            }
            signal = doneSignal;
            signal.reserve();
        } finally {
            lock.unlock();
        }

        try {
            signal.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (signal.leave()) {
                context.eventPool().release(signal);
            }
        }
    }

    @Override
    public Optional<byte[]> readChunk() {
        maybeSendContinue();

        while (true) {
            try {
                if (!flowControl.awaitResumed()) {
                    throw new ClientDisconnectedException("Connection closed while waiting for request body");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ClientDisconnectedException("Interrupted while waiting for request body", e);
            }

            Signal signal;
            byte[] chunk;
            boolean drained;

            lock.lock();
            try {
                if (disconnected) {
                    throw new ClientDisconnectedException("Client disconnected before the request body was read");
                }

                chunk = bodyChunks.pollFirst();

                if (chunk != null) {
                    long before = bufferedBodyBytes;
                    bufferedBodyBytes -= chunk.length;
                    drained = before > flowControl.lowWatermark() && bufferedBodyBytes <= flowControl.lowWatermark();
                    signal = null;
                } else {
                    if (bodyFailure != null) {
                        throw new MalformedRequestException(bodyFailure.getMessage(), bodyFailure);
                    }
                    if (bodyComplete) {
                        return Optional.empty();
                    }
                    drained = false;
                    signal = publishApplicationSignal();
                }
            } finally {
                lock.unlock();
            }

            if (chunk != null) {
                if (drained) {
                    transport.bodyConsumed(this);
                }
                return Optional.of(chunk);
            }

            awaitApplicationSignal(signal);
        }
    }

    private void maybeSendContinue() {
        boolean queued = false;

        lock.lock();
        try {
            if (expectContinue && !continueHandled) {
                continueHandled = true;
                if (responseState == ResponseState.NOT_STARTED && !bodyComplete && !disconnected) {
                    enqueue(CONTINUE_RESPONSE);
                    queued = true;
                }
            }
        } finally {
            lock.unlock();
        }

        if (queued) {
            transport.outputReady(this);
        }
    }

    @Override
    public void start(Integer statusCode, Map<String, List<String>> headers) {
        requireNonNull(statusCode);
        requireNonNull(headers);

        lock.lock();
        try {
            ensureConnected();

            if (responseState != ResponseState.NOT_STARTED) {
                throw violation("Response was already started");
            }
            if (statusCode < 200 || statusCode > 599) {
                throw violation("Status code " + statusCode + " is not a final status in 200-599");
            }

            boolean headRequest = HEAD.equalsIgnoreCase(request.getMethod());
            boolean bodyForbidden = statusCode == 204 || statusCode == 304;
            boolean responseClose = false;
            Long contentLength = null;
            Map<String, List<String>> outgoingHeaders = new LinkedHashMap<>();

            for (Map.Entry<String, List<String>> entry : headers.entrySet()) {
                String name = entry.getKey();
                List<String> values = entry.getValue();

                if (name == null || name.isEmpty() || !isValidHeaderName(name)) {
                    throw violation("Invalid response header name '" + name + "'");
                }
                if (values == null) {
                    continue;
                }
                for (String value : values) {
                    if (value == null || value.indexOf('\r') >= 0 || value.indexOf('\n') >= 0) {
                        throw violation("Invalid value for response header '" + name + "'");
                    }
                }

                if (name.equalsIgnoreCase(HEADER_TRANSFER_ENCODING)) {
                    // Framing is ours to decide
                    continue;
                }
                if (name.equalsIgnoreCase(HEADER_CONNECTION)) {
                    responseClose |= RequestHead.hasHeaderToken(values.stream().map(v -> new Header(name, v)).toList(), HEADER_CONNECTION, CLOSE);
                    continue;
                }
                if (name.equalsIgnoreCase(HEADER_CONTENT_LENGTH)) {
                    for (String value : values) {
                        long parsed = parseContentLength(value);
                        if (contentLength != null && contentLength != parsed) {
                            throw violation("Conflicting Content-Length response headers");
                        }
                        contentLength = parsed;
                    }
                    if (statusCode == 204) {
                        continue;
                    }
                }

                outgoingHeaders.merge(name, new ArrayList<>(values), (existing, added) -> {
                    existing.addAll(added);
                    return existing;
                });
            }

            Framing framing;
            if (headRequest || bodyForbidden) {
                framing = Framing.NO_BODY;
            } else if (contentLength != null) {
                framing = Framing.CONTENT_LENGTH;
            } else if (!httpOneDotZero) {
                framing = Framing.CHUNKED;
            } else {
                framing = Framing.CLOSE_DELIMITED;
            }

            boolean keepAlive = requestKeepAlive
                    && !responseClose
                    && framing != Framing.CLOSE_DELIMITED
                    && transport.isAcceptingRequests();

            // A client still waiting for "100 Continue" will not send the body we would have to skip
            if (expectContinue && !continueHandled) {
                continueHandled = true;
                keepAlive = false;
            }

            StringBuilder head = new StringBuilder(256);
            head.append("HTTP/1.1 ").append(statusCode).append(' ').append(StatusCode.reasonPhraseFor(statusCode)).append("\r\n");

            boolean hasServer = false;
            boolean hasDate = false;

            for (Map.Entry<String, List<String>> entry : outgoingHeaders.entrySet()) {
                hasServer |= entry.getKey().equalsIgnoreCase(HEADER_SERVER);
                hasDate |= entry.getKey().equalsIgnoreCase(HEADER_DATE);
                for (String value : entry.getValue()) {
                    head.append(entry.getKey()).append(": ").append(value).append("\r\n");
                }
            }

            if (framing == Framing.CHUNKED) {
                head.append(HEADER_TRANSFER_ENCODING).append(": chunked\r\n");
            }
            if (!keepAlive) {
                head.append(HEADER_CONNECTION).append(": ").append(CLOSE).append("\r\n");
            } else if (httpOneDotZero) {
                head.append(HEADER_CONNECTION).append(": ").append(KEEP_ALIVE).append("\r\n");
            }
            if (!hasServer && context.options().serverHeader() != null) {
                head.append(HEADER_SERVER).append(": ").append(context.options().serverHeader()).append("\r\n");
            }
            if (!hasDate && context.options().dateHeaderEnabled()) {
                head.append(HEADER_DATE).append(": ").append(context.serverState().getDateHeaderValue()).append("\r\n");
            }
            head.append("\r\n");

            this.framing = framing;
            this.keepAlive = keepAlive;
            this.declaredContentLength = contentLength == null ? -1 : contentLength;
            this.responseState = ResponseState.STREAMING;
            enqueue(head.toString().getBytes(StandardCharsets.ISO_8859_1));
        } finally {
            lock.unlock();
        }

        transport.outputReady(this);
    }

    @Override
    public void write(byte[] chunk) {
        requireNonNull(chunk);

        lock.lock();
        try {
            ensureConnected();

            if (responseState == ResponseState.NOT_STARTED) {
                throw violation("Response body was written before the response was started");
            }
            if (responseState == ResponseState.ENDED) {
                throw violation("Response body was written after the response ended");
            }
            if (chunk.length == 0) {
                return;
            }

            switch (framing) {
                case NO_BODY -> {
                    if (!HEAD.equalsIgnoreCase(request.getMethod())) {
                        throw violation("This response status does not permit a body");
                    }
                    // HEAD: headers describe the body, the body itself is never sent
                    return;
                }
                case CONTENT_LENGTH -> {
                    if (writtenBodyBytes + chunk.length > declaredContentLength) {
                        throw violation("Response body exceeds declared Content-Length of " + declaredContentLength);
                    }
                    enqueue(chunk.clone());
                }
                case CHUNKED -> {
                    byte[] size = (Integer.toHexString(chunk.length) + "\r\n").getBytes(StandardCharsets.US_ASCII);
                    byte[] framed = new byte[size.length + chunk.length + CRLF.length];
                    System.arraycopy(size, 0, framed, 0, size.length);
                    System.arraycopy(chunk, 0, framed, size.length, chunk.length);
                    System.arraycopy(CRLF, 0, framed, size.length + chunk.length, CRLF.length);
                    enqueue(framed);
                }
                case CLOSE_DELIMITED -> enqueue(chunk.clone());
            }

            writtenBodyBytes += chunk.length;
        } finally {
            lock.unlock();
        }

        transport.outputReady(this);
        awaitOutputCapacity();
    }

    @Override
    public void end() {
        lock.lock();
        try {
            ensureConnected();

            if (responseState == ResponseState.NOT_STARTED) {
                throw violation("Response was ended before it was started");
            }
            if (responseState == ResponseState.ENDED) {
                throw violation("Response was already ended");
            }
            if (framing == Framing.CONTENT_LENGTH && writtenBodyBytes != declaredContentLength) {
                throw violation("Response body was " + writtenBodyBytes + " bytes but Content-Length declared " + declaredContentLength);
            }
            if (framing == Framing.CHUNKED) {
                enqueue(LAST_CHUNK);
            }

            responseState = ResponseState.ENDED;
        } finally {
            lock.unlock();
        }

        transport.outputReady(this);
    }

    @Override
    public Boolean isStarted() {
        lock.lock();
        try {
            return responseState != ResponseState.NOT_STARTED;
        } finally {
            lock.unlock();
        }
    }

    private void awaitOutputCapacity() {
        while (true) {
            Signal signal = null;

            lock.lock();
            try {
                ensureConnected();
                if (pendingOutputBytes > flowControl.highWatermark()) {
                    signal = publishApplicationSignal();
                }
            } finally {
                lock.unlock();
            }

            if (signal == null) {
                break;
            }

            awaitApplicationSignal(signal);
        }

        try {
            if (!flowControl.awaitResumed()) {
                throw new ClientDisconnectedException("Connection closed while waiting to write the response");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientDisconnectedException("Interrupted while waiting to write the response", e);
        }
    }

    // Caller holds the lock
    private void ensureConnected() {
        if (disconnected) {
            throw new ClientDisconnectedException("Client disconnected");
        }
    }

    // Caller holds the lock
    private ResponseContractException violation(String message) {
        ResponseContractException e = new ResponseContractException(message);
        if (contractViolation == null) {
            contractViolation = e;
        }
        return e;
    }

    private static long parseContentLength(String value) {
        String trimmed = value.trim();
        if (trimmed.isEmpty() || !trimmed.chars().allMatch(Character::isDigit)) {
            throw new ResponseContractException("Invalid Content-Length response header value '" + value + "'");
        }
        try {
            return Long.parseLong(trimmed);
        } catch (NumberFormatException e) {
            throw new ResponseContractException("Invalid Content-Length response header value '" + value + "'");
        }
    }

    private static boolean isValidHeaderName(String name) {
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c <= 0x20 || c >= 0x7F || c == ':') {
                return false;
            }
        }
        return true;
    }

    // Event loop side

    void deliverBody(byte[] chunk) {
        Signal signal;

        lock.lock();
        try {
            if (disconnected || bodyFailure != null || bodyComplete) {
                return;
            }
            bodyChunks.addLast(chunk);
            bufferedBodyBytes += chunk.length;
            signal = unpublishApplicationSignal();
        } finally {
            lock.unlock();
        }

        wake(signal);
    }

    void completeBody() {
        Signal signal;

        lock.lock();
        try {
            bodyComplete = true;
            signal = unpublishApplicationSignal();
        } finally {
            lock.unlock();
        }

        wake(signal);
    }

    /**
     * The request body could not be read to its end. The application's next pull fails, and the client gets an
     * error response if none was started yet.
     */
    void failRequestBody(MalformedRequestException e) {
        Signal signal;

        lock.lock();
        try {
            if (bodyComplete || disconnected) {
                return;
            }
            bodyFailure = e;
            failure = e;
            pendingOutcome = CycleOutcome.PROTOCOL_ERROR;

            if (responseState == ResponseState.NOT_STARTED) {
                replaceWithFailsafeResponse(e.getStatusCode());
            } else {
                abrupt = true;
            }

            signal = unpublishApplicationSignal();
        } finally {
            lock.unlock();
        }

        wake(signal);
    }

    /**
     * Moves everything the application produced so far out of this exchange, for writing to the socket.
     */
    List<ByteBuffer> takeOutput() {
        List<ByteBuffer> output;
        Signal signal;

        lock.lock();
        try {
            if (pendingOutput.isEmpty()) {
                return List.of();
            }
            output = pendingOutput;
            pendingOutput = new ArrayList<>();
            pendingOutputBytes = 0;
            signal = unpublishApplicationSignal();
        } finally {
            lock.unlock();
        }

        wake(signal);
        return output;
    }

    /**
     * Whether every byte of a completed response has been taken and the application has returned.
     */
    boolean isOutputComplete() {
        lock.lock();
        try {
            return applicationReturned && responseState == ResponseState.ENDED && pendingOutput.isEmpty() && !abrupt;
        } finally {
            lock.unlock();
        }
    }

    boolean isAbrupt() {
        lock.lock();
        try {
            return abrupt;
        } finally {
            lock.unlock();
        }
    }

    boolean isKeepAlive() {
        lock.lock();
        try {
            return keepAlive;
        } finally {
            lock.unlock();
        }
    }

    boolean isRequestKeepAlive() {
        return requestKeepAlive;
    }

    long bufferedBodyBytes() {
        lock.lock();
        try {
            return bufferedBodyBytes;
        } finally {
            lock.unlock();
        }
    }

    /**
     * The response was fully written to the socket.
     */
    void didFlush() {
        finish(pendingOutcomeOr(CycleOutcome.COMPLETED), currentFailure());
    }

    /**
     * The connection is gone. Blocked pulls and pushes wake up and fail; if the application already returned the
     * exchange ends now, otherwise when the application returns or is abandoned.
     */
    void disconnect() {
        Signal applicationSignal;
        boolean returned;

        lock.lock();
        try {
            if (disconnected) {
                return;
            }
            disconnected = true;
            returned = applicationReturned;
            applicationSignal = unpublishApplicationSignal();
        } finally {
            lock.unlock();
        }

        wake(applicationSignal);

        if (returned) {
            finish(pendingOutcomeOr(CycleOutcome.DISCONNECTED), currentFailure());
        }
    }

    /**
     * The disconnect grace period ran out while the application was still running.
     */
    void abandon() {
        if (isFinished()) {
            return;
        }

        Future<?> future;

        lock.lock();
        try {
            future = applicationFuture;
        } finally {
            lock.unlock();
        }

        if (future != null) {
            future.cancel(true);
        }

        finish(pendingOutcomeOr(CycleOutcome.DISCONNECTED), currentFailure());
    }

    boolean isFinished() {
        return outcome.get() != null;
    }

    Optional<CycleOutcome> outcome() {
        return Optional.ofNullable(outcome.get());
    }

    Request request() {
        return request;
    }

    private boolean finish(CycleOutcome cycleOutcome, Throwable throwable) {
        if (!outcome.compareAndSet(null, cycleOutcome)) {
            return false;
        }

        Signal signal;

        lock.lock();
        try {
            signal = doneSignal;
            doneSignal = null;
        } finally {
            lock.unlock();
        }

        wake(signal);

        if (request != null) {
            if (cycleOutcome == CycleOutcome.DISCONNECTED) {
                context.cycleListener().didReceiveLogEvent(LogEvent.with(LogEventType.CLIENT_DISCONNECTED,
                                "Client disconnected before the response was fully written")
                        .request(request)
                        .cycleOutcome(cycleOutcome)
                        .build());
            }
            context.cycleListener().didFinishCycle(request, cycleOutcome, Duration.ofNanos(System.nanoTime() - createdAtNanos), throwable);
        }

        return true;
    }

    private CycleOutcome pendingOutcomeOr(CycleOutcome fallback) {
        lock.lock();
        try {
            return pendingOutcome != null ? pendingOutcome : fallback;
        } finally {
            lock.unlock();
        }
    }

    private Throwable currentFailure() {
        lock.lock();
        try {
            return failure;
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock
    private void replaceWithFailsafeResponse(int statusCode) {
        StringBuilder response = new StringBuilder(128);
        response.append("HTTP/1.1 ").append(statusCode).append(' ').append(StatusCode.reasonPhraseFor(statusCode)).append("\r\n");
        response.append(HEADER_CONTENT_LENGTH).append(": 0\r\n");
        response.append(HEADER_CONNECTION).append(": ").append(CLOSE).append("\r\n");
        if (context.options().serverHeader() != null) {
            response.append(HEADER_SERVER).append(": ").append(context.options().serverHeader()).append("\r\n");
        }
        if (context.options().dateHeaderEnabled()) {
            response.append(HEADER_DATE).append(": ").append(context.serverState().getDateHeaderValue()).append("\r\n");
        }
        response.append("\r\n");

        pendingOutput = new ArrayList<>();
        pendingOutputBytes = 0;
        enqueue(response.toString().getBytes(StandardCharsets.ISO_8859_1));
        framing = Framing.NO_BODY;
        keepAlive = false;
        responseState = ResponseState.ENDED;
    }

    // Caller holds the lock
    private void enqueue(byte[] bytes) {
        pendingOutput.add(ByteBuffer.wrap(bytes));
        pendingOutputBytes += bytes.length;
    }

    // Caller holds the lock
    private Signal publishApplicationSignal() {
        if (applicationSignal == null) {
            applicationSignal = context.eventPool().acquire();
        }
        applicationSignal.reserve();
        return applicationSignal;
    }

    // Caller holds the lock
    private Signal unpublishApplicationSignal() {
        Signal signal = applicationSignal;
        applicationSignal = null;
        return signal;
    }

    private void awaitApplicationSignal(Signal signal) {
        try {
            signal.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClientDisconnectedException("Interrupted while waiting on the connection", e);
        } finally {
            if (signal.leave()) {
                context.eventPool().release(signal);
            }
        }
    }

    private void wake(Signal signal) {
        if (signal != null && signal.set() == 0) {
            context.eventPool().release(signal);
        }
    }

    @Override
    public String toString() {
        return "RequestResponseCycle{request=" + request + ", outcome=" + outcome.get() + "}";
    }
}
