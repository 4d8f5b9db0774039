package com.sluice.internal.http;

import com.sluice.CycleOutcome;
import com.sluice.LogEvent;
import com.sluice.LogEventType;
import com.sluice.exception.MalformedRequestException;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.SocketChannel;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * This class represents an independent, threaded event loop for managing a group of connections.
 * It has its own selector, direct off-heap read buffer, timeout queue, task queue, and state-per-connection.
 * <p>
 * ConnectionEventLoop instances are managed by a parent {@link EventLoop}.
 * <p>
 * Each connection moves through the states of {@link ConnectionState}. Requests are parsed incrementally and
 * dispatched as soon as their head is complete; body bytes are streamed into the cycle as they arrive. At most
 * {@value #MAX_PIPELINE_DEPTH} cycles are queued per connection, and only the oldest one writes to the socket, so
 * responses leave in request order.
 *
 * <pre>
 *                       Write Complete Persistent
 *            +-------------------------------------------------+
 *            |                                                 |
 *            v     Read           Head          Output         |
 *        +------+  Bytes  +----------+ Parsed +------------+ Committed +------------------+
 * Accept |      +-------->| READING_ +------->|            +---------->|                  |
 * ------>| IDLE |         | REQUEST  |        | PROCESSING |           | WRITING_RESPONSE |
 *        |      +-------------------------------->|        |<----------+                  |
 *        +------+  Head Parsed        +--------+------------+  Write    +---------+--------+
 *                                                             Complete            |
 *                                                             Pipelined           | Write Complete
 *                  any state: error, timeout, shutdown                            | Non-Persistent
 *                  ------------------------------------> +---------+  +--------+  |
 *                                                        | CLOSING +->| CLOSED |<-+
 *                                                        +---------+  +--------+
 * </pre>
 */
class ConnectionEventLoop {

    static final int MAX_PIPELINE_DEPTH = 2;

    private final ServerContext context;
    private final Options options;
    private final Logger logger;
    private final AtomicLong connectionCounter;
    private final AtomicBoolean stop;

    private final Scheduler timeoutQueue;
    private final Queue<Runnable> taskQueue;
    private final ByteBuffer buffer;
    private final Selector selector;
    private final Thread thread;
    private final AtomicInteger connectionCount;

    ConnectionEventLoop(
            ServerContext context,
            AtomicLong connectionCounter,
            AtomicBoolean stop,
            int index) throws IOException {
        this.context = context;
        this.options = context.options();
        this.logger = context.logger();
        this.connectionCounter = connectionCounter;
        this.stop = stop;

        connectionCount = new AtomicInteger();
        timeoutQueue = new Scheduler();
        taskQueue = new ConcurrentLinkedQueue<>();
        buffer = ByteBuffer.allocateDirect(options.readBufferSize());
        selector = Selector.open();
        thread = new Thread(this::run, "sluice-connection-event-loop-" + index);
    }

    private enum TimeoutKind {
        NONE,
        REQUEST,
        KEEP_ALIVE
    }

    class Connection implements CycleTransport {

        final SocketChannel socketChannel;
        final SelectionKey selectionKey;
        final ByteTokenizer byteTokenizer;
        final RequestParser requestParser;
        final String id;
        final InetSocketAddress remoteAddress;
        final FlowControl flowControl;
        final Deque<RequestResponseCycle> pipeline;
        final Deque<ByteBuffer> writeQueue;
        final AtomicBoolean closed;
        final AtomicBoolean flushScheduled;
        ConnectionState state;
        RequestResponseCycle bodyTarget;
        Cancellable timeoutTask;
        TimeoutKind timeoutKind;
        long requestSequence;
        boolean servedAny;
        boolean requestsExhausted;
        volatile boolean acceptingRequests;

        private Connection(SocketChannel socketChannel, SelectionKey selectionKey, InetSocketAddress remoteAddress) {
            this.socketChannel = socketChannel;
            this.selectionKey = selectionKey;
            this.remoteAddress = remoteAddress;
            byteTokenizer = new ByteTokenizer();
            requestParser = new RequestParser(byteTokenizer, options.maxRequestHeadSize());
            id = Long.toString(connectionCounter.getAndIncrement());
            flowControl = new FlowControl(options.writeHighWatermark(), options.writeLowWatermark(), context.eventPool());
            pipeline = new ArrayDeque<>(MAX_PIPELINE_DEPTH);
            writeQueue = new ArrayDeque<>();
            closed = new AtomicBoolean(false);
            flushScheduled = new AtomicBoolean(false);
            state = ConnectionState.IDLE;
            timeoutKind = TimeoutKind.NONE;
            acceptingRequests = true;
            updateTimeout(false);
        }

        // Cycle transport, called from application threads

        @Override
        public void outputReady(RequestResponseCycle cycle) {
            if (flushScheduled.compareAndSet(false, true)) {
                execute(() -> {
                    flushScheduled.set(false);
                    flush();
                });
            }
        }

        @Override
        public void bodyConsumed(RequestResponseCycle cycle) {
            execute(() -> {
                if (closed.get()) {
                    return;
                }
                if (flowControl.resumeReading() && logger.enabled()) {
                    logger.log(
                            new LogEntry("event", "read_resumed"),
                            new LogEntry("id", id));
                }
                drainParser();
                flush();
            });
        }

        @Override
        public boolean isAcceptingRequests() {
            return acceptingRequests;
        }

        // Event loop side

        private void onReadable() {
            try {
                doOnReadable();
            } catch (IOException | RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogEntry("event", "read_error"),
                            new LogEntry("id", id));
                }
                failSafeClose(ConnectionEvent.FAILED);
            }
        }

        private void doOnReadable() throws IOException {
            buffer.clear();
            int numBytes = socketChannel.read(buffer);
            if (numBytes < 0) {
                if (logger.enabled()) {
                    logger.log(
                            new LogEntry("event", "read_close"),
                            new LogEntry("id", id));
                }
                failSafeClose(pipeline.isEmpty() && bodyTarget == null ? ConnectionEvent.CLOSE_REQUESTED : ConnectionEvent.FAILED);
                return;
            }
            buffer.flip();
            byteTokenizer.add(buffer);
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "read_bytes"),
                        new LogEntry("id", id),
                        new LogEntry("read_bytes", Integer.toString(numBytes)),
                        new LogEntry("request_bytes", Integer.toString(byteTokenizer.remaining())));
            }
            fire(ConnectionEvent.BYTES_RECEIVED);
            drainParser();
            flush();
            updateTimeout(true);
        }

        private void drainParser() {
            try {
                while (!closed.get()) {
                    if (bodyTarget == null && (requestsExhausted || pipeline.size() >= MAX_PIPELINE_DEPTH)) {
                        break;
                    }
                    if (bodyTarget != null && bodyTarget.bufferedBodyBytes() > flowControl.highWatermark()) {
                        if (flowControl.pauseReading() && logger.enabled()) {
                            logger.log(
                                    new LogEntry("event", "read_paused"),
                                    new LogEntry("id", id));
                        }
                        break;
                    }

                    RequestParser.Event event = requestParser.next();

                    if (event == RequestParser.Event.NEED_MORE_DATA) {
                        break;
                    } else if (event == RequestParser.Event.HEAD_COMPLETE) {
                        onRequestHead(requestParser.head());
                    } else if (event == RequestParser.Event.BODY_CHUNK) {
                        bodyTarget.deliverBody(requestParser.chunk());
                    } else if (event == RequestParser.Event.MESSAGE_COMPLETE) {
                        if (bodyTarget != null) {
                            bodyTarget.completeBody();
                            bodyTarget = null;
                        }
                    }
                }
            } catch (MalformedRequestException e) {
                onProtocolError(e);
            }
            byteTokenizer.compact();
        }

        private void onRequestHead(RequestHead head) {
            RequestResponseCycle cycle = new RequestResponseCycle(head, id + "-" + (++requestSequence), remoteAddress, this, flowControl, context);
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", pipeline.isEmpty() ? "read_request" : "pipeline_request"),
                        new LogEntry("id", id),
                        new LogEntry("method", head.method()),
                        new LogEntry("target", head.target()));
            }
            pipeline.addLast(cycle);
            bodyTarget = cycle;
            fire(ConnectionEvent.CYCLE_STARTED);
            if (!cycle.isRequestKeepAlive()) {
                requestsExhausted = true;
            }
            context.handler().handle(cycle);
        }

        private void onProtocolError(MalformedRequestException e) {
            LogEventType logEventType = e.getStatusCode() == 408 ? LogEventType.REQUEST_TIMEOUT : LogEventType.SERVER_UNPARSEABLE_REQUEST;
            context.cycleListener().didReceiveLogEvent(LogEvent.with(logEventType,
                            "Unable to read request from " + remoteAddress + ": " + e.getMessage())
                    .throwable(e)
                    .remoteAddress(remoteAddress)
                    .cycleOutcome(CycleOutcome.PROTOCOL_ERROR)
                    .build());

            requestsExhausted = true;

            if (bodyTarget != null) {
                bodyTarget.failRequestBody(e);
                bodyTarget = null;
            } else {
                pipeline.addLast(RequestResponseCycle.forProtocolError(e, this, flowControl, context));
                fire(ConnectionEvent.CYCLE_STARTED);
            }
        }

        private void onWritable() {
            flush();
        }

        private void flush() {
            try {
                doFlush();
            } catch (IOException | RuntimeException e) {
                if (logger.enabled()) {
                    logger.log(e,
                            new LogEntry("event", "write_error"),
                            new LogEntry("id", id));
                }
                failSafeClose(ConnectionEvent.FAILED);
            }
        }

        private void doFlush() throws IOException {
            while (!closed.get()) {
                RequestResponseCycle head = pipeline.peekFirst();

                if (head != null) {
                    if (head.isAbrupt()) {
                        if (logger.enabled()) {
                            logger.log(
                                    new LogEntry("event", "abort_response"),
                                    new LogEntry("id", id));
                        }
                        failSafeClose(ConnectionEvent.FAILED);
                        return;
                    }

                    List<ByteBuffer> output = head.takeOutput();
                    if (!output.isEmpty()) {
                        long numBytes = 0;
                        for (ByteBuffer byteBuffer : output) {
                            numBytes += byteBuffer.remaining();
                        }
                        writeQueue.addAll(output);
                        flowControl.didQueueBytes(numBytes);
                        fire(ConnectionEvent.OUTPUT_COMMITTED);
                    }
                }

                if (!writeQueue.isEmpty()) {
                    long written = write();
                    flowControl.didDrainBytes(written);
                    if (!writeQueue.isEmpty()) {
                        break;
                    }
                }

                if (head != null && head.isOutputComplete()) {
                    retire(head);
                    if (closed.get()) {
                        return;
                    }
                    drainParser();
                    continue;
                }

                break;
            }

            if (!closed.get()) {
                updateInterestOps();
                updateTimeout(false);
            }
        }

        private long write() throws IOException {
            long total = 0;
            while (!writeQueue.isEmpty()) {
                long written = socketChannel.write(writeQueue.toArray(new ByteBuffer[0]));
                total += written;
                while (!writeQueue.isEmpty() && !writeQueue.peekFirst().hasRemaining()) {
                    writeQueue.pollFirst();
                }
                if (written == 0) {
                    break;
                }
            }
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "write"),
                        new LogEntry("id", id),
                        new LogEntry("num_bytes", Long.toString(total)));
            }
            return total;
        }

        private void retire(RequestResponseCycle cycle) {
            pipeline.pollFirst();
            servedAny = true;
            cycle.didFlush();

            if (cycle.request() != null) {
                context.connectionListener().didServeRequest(context.serverState().didServeRequest());
            }

            boolean persistent = cycle.isKeepAlive()
                    && cycle != bodyTarget
                    && !(requestsExhausted && pipeline.isEmpty());

            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "write_response"),
                        new LogEntry("id", id),
                        new LogEntry("persistent", Boolean.toString(persistent)));
            }

            if (!persistent) {
                fire(ConnectionEvent.RESPONSE_COMPLETE_NON_PERSISTENT);
                failSafeClose(ConnectionEvent.CLOSE_REQUESTED);
            } else if (!pipeline.isEmpty()) {
                fire(ConnectionEvent.RESPONSE_COMPLETE_PIPELINED);
            } else {
                fire(ConnectionEvent.RESPONSE_COMPLETE_PERSISTENT);
            }
        }

        private void updateInterestOps() {
            int ops = 0;
            // Keep a small read open while nothing is parsed so that a client hanging up is noticed
            boolean wantsRequestBytes = bodyTarget != null
                    || (!requestsExhausted && pipeline.size() < MAX_PIPELINE_DEPTH)
                    || byteTokenizer.remaining() < options.readBufferSize();
            if (wantsRequestBytes && !flowControl.isReadingPaused()) {
                ops |= SelectionKey.OP_READ;
            }
            if (!writeQueue.isEmpty()) {
                ops |= SelectionKey.OP_WRITE;
            }
            if (selectionKey.isValid() && selectionKey.interestOps() != ops) {
                selectionKey.interestOps(ops);
            }
        }

        private TimeoutKind desiredTimeout() {
            if (closed.get()) {
                return TimeoutKind.NONE;
            }
            if (bodyTarget != null) {
                return flowControl.isReadingPaused() ? TimeoutKind.NONE : TimeoutKind.REQUEST;
            }
            if (!pipeline.isEmpty() || requestsExhausted) {
                return TimeoutKind.NONE;
            }
            return requestParser.hasPartialHead() ? TimeoutKind.REQUEST : TimeoutKind.KEEP_ALIVE;
        }

        /**
         * Re-arms the timer when the kind of wait changes; inbound bytes restart a request timeout.
         */
        private void updateTimeout(boolean bytesReceived) {
            TimeoutKind kind = desiredTimeout();
            if (kind == timeoutKind && !(bytesReceived && kind == TimeoutKind.REQUEST)) {
                return;
            }
            cancelTimeout();
            timeoutKind = kind;
            if (kind == TimeoutKind.REQUEST) {
                timeoutTask = timeoutQueue.schedule(this::onRequestTimeout, options.requestTimeout());
            } else if (kind == TimeoutKind.KEEP_ALIVE) {
                // Before the first request, the client gets the full request timeout to start talking
                timeoutTask = timeoutQueue.schedule(this::onKeepAliveTimeout, servedAny ? options.keepAliveTimeout() : options.requestTimeout());
            }
        }

        private void cancelTimeout() {
            if (timeoutTask != null) {
                timeoutTask.cancel();
                timeoutTask = null;
            }
            timeoutKind = TimeoutKind.NONE;
        }

        private void onRequestTimeout() {
            timeoutTask = null;
            timeoutKind = TimeoutKind.NONE;
            if (closed.get()) {
                return;
            }
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "request_timeout"),
                        new LogEntry("id", id));
            }
            onProtocolError(new MalformedRequestException("Request timed out after " + options.requestTimeout(), 408));
            flush();
        }

        private void onKeepAliveTimeout() {
            timeoutTask = null;
            timeoutKind = TimeoutKind.NONE;
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "keep_alive_timeout"),
                        new LogEntry("id", id));
            }
            failSafeClose(ConnectionEvent.CLOSE_REQUESTED);
        }

        /**
         * Stops parsing new requests. Cycles already dispatched finish and are written with {@code Connection: close},
         * then the connection closes.
         */
        private void shutdown() {
            if (closed.get()) {
                return;
            }
            acceptingRequests = false;
            requestsExhausted = true;
            if (pipeline.isEmpty() && bodyTarget == null) {
                failSafeClose(ConnectionEvent.CLOSE_REQUESTED);
            } else {
                updateInterestOps();
                updateTimeout(false);
            }
        }

        private void fire(ConnectionEvent event) {
            Optional<ConnectionState> next = state.next(event);
            if (next.isEmpty()) {
                if (logger.enabled()) {
                    logger.log(
                            new LogEntry("event", "ignored_transition"),
                            new LogEntry("id", id),
                            new LogEntry("state", state.name()),
                            new LogEntry("connection_event", event.name()));
                }
                return;
            }
            state = next.get();
        }

        void failSafeClose(ConnectionEvent cause) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            if (state != ConnectionState.CLOSING) {
                fire(cause);
            }
            fire(ConnectionEvent.CLOSED);
            cancelTimeout();
            selectionKey.cancel();
            CloseUtils.closeQuietly(socketChannel, logger);
            flowControl.close();

            List<RequestResponseCycle> orphans = new ArrayList<>(pipeline);
            if (bodyTarget != null && !orphans.contains(bodyTarget)) {
                orphans.add(bodyTarget);
            }
            pipeline.clear();
            bodyTarget = null;
            writeQueue.clear();

            for (RequestResponseCycle cycle : orphans) {
                cycle.disconnect();
                if (!cycle.isFinished()) {
                    timeoutQueue.schedule(cycle::abandon, options.disconnectGracePeriod());
                }
            }

            connectionCount.decrementAndGet();
            context.serverState().didCloseConnection();
            context.connectionListener().didCloseConnection(remoteAddress);

            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "close"),
                        new LogEntry("id", id),
                        new LogEntry("cause", cause.name()));
            }
        }
    }

    int numConnections() {
        return connectionCount.get();
    }

    void start() {
        thread.start();
    }

    void join() throws InterruptedException {
        thread.join();
    }

    /**
     * Asks every connection to finish its dispatched cycles and close.
     */
    void shutdownConnections() {
        execute(() -> forEachConnection(Connection::shutdown));
    }

    /**
     * Closes every connection now, disconnecting any cycle still in flight.
     */
    void forceCloseConnections() {
        execute(() -> forEachConnection(connection -> connection.failSafeClose(ConnectionEvent.CLOSE_REQUESTED)));
    }

    private void forEachConnection(Consumer<Connection> action) {
        for (SelectionKey selKey : new ArrayList<>(selector.keys())) {
            if (selKey.attachment() instanceof Connection connection) {
                action.accept(connection);
            }
        }
    }

    private void execute(Runnable task) {
        taskQueue.add(task);
        // selector wakeup is not necessary if invoked within event loop thread
        // since tasks are processed at the end of every event loop iteration
        if (Thread.currentThread() != thread) {
            selector.wakeup();
        }
    }

    private void run() {
        try {
            doStart();
        } catch (IOException | RuntimeException e) {
            if (logger.enabled()) {
                logger.log(e, new LogEntry("event", "sub_event_loop_terminate"));
            }
            stop.set(true); // stop the world on critical error
        } finally {
            forEachConnection(connection -> connection.failSafeClose(ConnectionEvent.CLOSE_REQUESTED));
            // Registrations that never ran still hold a connection slot
            Runnable task;
            while ((task = taskQueue.poll()) != null) {
                task.run();
            }
            CloseUtils.closeQuietly(selector, logger);
        }
    }

    private void doStart() throws IOException {
        while (!stop.get()) {
            selector.select(options.resolution().toMillis());
            Set<SelectionKey> selectedKeys = selector.selectedKeys();
            Iterator<SelectionKey> it = selectedKeys.iterator();
            while (it.hasNext()) {
                SelectionKey selKey = it.next();
                Connection connection = (Connection) selKey.attachment();
                if (selKey.isValid() && selKey.isReadable()) {
                    connection.onReadable();
                }
                if (selKey.isValid() && selKey.isWritable()) {
                    connection.onWritable();
                }
                it.remove();
            }
            timeoutQueue.expired().forEach(Runnable::run);
            Runnable task;
            while ((task = taskQueue.poll()) != null) {
                task.run();
            }
        }
    }

    void register(SocketChannel socketChannel) {
        execute(() -> {
            try {
                doRegister(socketChannel);
            } catch (IOException e) {
                if (logger.enabled()) {
                    logger.log(e, new LogEntry("event", "register_error"));
                }
                CloseUtils.closeQuietly(socketChannel, logger);
                context.serverState().didCloseConnection();
                context.connectionListener().didCloseConnection(null);
            }
        });
    }

    private void doRegister(SocketChannel socketChannel) throws IOException {
        SocketAddress socketAddress = socketChannel.getRemoteAddress();
        InetSocketAddress remoteAddress = socketAddress instanceof InetSocketAddress
                ? (InetSocketAddress) socketAddress
                : null;

        if (stop.get() || !selector.isOpen()) {
            CloseUtils.closeQuietly(socketChannel, logger);
            context.serverState().didCloseConnection();
            context.connectionListener().didCloseConnection(remoteAddress);
            return;
        }

        socketChannel.configureBlocking(false);
        SelectionKey selectionKey = socketChannel.register(selector, SelectionKey.OP_READ);
        Connection connection = new Connection(socketChannel, selectionKey, remoteAddress);
        connectionCount.incrementAndGet();
        selectionKey.attach(connection);
        if (logger.enabled()) {
            logger.log(
                    new LogEntry("event", "accept"),
                    new LogEntry("remote_address", String.valueOf(remoteAddress)),
                    new LogEntry("id", connection.id));
        }
    }
}
