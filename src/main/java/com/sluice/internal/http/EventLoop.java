package com.sluice.internal.http;

import com.sluice.ConnectionRejectionReason;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * EventLoop is the transport side of a server. It binds the listening socket, accepts connections and hands each
 * one to the least-loaded {@link ConnectionEventLoop}, which does network I/O, request parsing and dispatching.
 * <p>
 * Shutdown happens in steps so that in-flight exchanges can finish: {@link #stopAccepting()},
 * {@link #shutdownConnections()}, optionally {@link #forceCloseConnections()}, then {@link #stop()} and
 * {@link #join()}.
 */
public class EventLoop {

    private final ServerContext context;
    private final Options options;
    private final Logger logger;

    private final Selector selector;
    private final AtomicBoolean stop;
    private final AtomicBoolean accepting;
    private final ServerSocketChannel serverSocketChannel;
    private final List<ConnectionEventLoop> connectionEventLoops;
    private final Thread thread;

    public EventLoop(ServerContext context) throws IOException {
        this.context = context;
        this.options = context.options();
        this.logger = context.logger();

        stop = new AtomicBoolean();
        accepting = new AtomicBoolean(true);

        AtomicLong connectionCounter = new AtomicLong();
        connectionEventLoops = new ArrayList<>();
        for (int i = 0; i < options.concurrency(); i++) {
            connectionEventLoops.add(new ConnectionEventLoop(context, connectionCounter, stop, i));
        }

        thread = new Thread(this::run, "sluice-event-loop");

        InetSocketAddress address = options.host() == null
                ? new InetSocketAddress(options.port()) // wildcard address
                : new InetSocketAddress(options.host(), options.port());

        selector = Selector.open();
        serverSocketChannel = ServerSocketChannel.open();
        try {
            if (options.reuseAddr()) {
                serverSocketChannel.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            }
            serverSocketChannel.configureBlocking(false);
            serverSocketChannel.bind(address, options.acceptLength());
            serverSocketChannel.register(selector, SelectionKey.OP_ACCEPT);
        } catch (IOException e) {
            CloseUtils.closeQuietly(serverSocketChannel, logger);
            CloseUtils.closeQuietly(selector, logger);
            throw e;
        }
    }

    public int getPort() throws IOException {
        return serverSocketChannel.getLocalAddress() instanceof InetSocketAddress a ? a.getPort() : -1;
    }

    public void start() {
        thread.start();
        connectionEventLoops.forEach(ConnectionEventLoop::start);
    }

    private void run() {
        try {
            doRun();
        } catch (IOException | RuntimeException e) {
            if (logger.enabled()) {
                logger.log(e, new LogEntry("event", "event_loop_terminate"));
            }
            stop.set(true); // stop the world on critical error
        } finally {
            CloseUtils.closeQuietly(selector, logger);
            CloseUtils.closeQuietly(serverSocketChannel, logger);
        }
    }

    private void doRun() throws IOException {
        while (!stop.get() && accepting.get()) {
            selector.select(options.resolution().toMillis());
            Set<SelectionKey> selectedKeys = selector.selectedKeys();
            Iterator<SelectionKey> it = selectedKeys.iterator();
            while (it.hasNext()) {
                SelectionKey selKey = it.next();
                it.remove();
                if (selKey.isValid() && selKey.isAcceptable()) {
                    onAcceptable();
                }
            }
        }
    }

    private void onAcceptable() throws IOException {
        SocketChannel socketChannel = serverSocketChannel.accept();
        if (socketChannel == null) {
            return;
        }

        InetSocketAddress remoteAddress = remoteAddress(socketChannel);
        ConnectionRejectionReason rejectionReason = null;

        if (!accepting.get()) {
            rejectionReason = ConnectionRejectionReason.SERVER_STOPPING;
        } else if (options.maxConnections() > 0 && context.serverState().getActiveConnections() >= options.maxConnections()) {
            rejectionReason = ConnectionRejectionReason.MAXIMUM_CONNECTIONS_REACHED;
        }

        if (rejectionReason != null) {
            if (logger.enabled()) {
                logger.log(
                        new LogEntry("event", "accept_reject"),
                        new LogEntry("reason", rejectionReason.name()),
                        new LogEntry("max_connections", Integer.toString(options.maxConnections())));
            }
            CloseUtils.closeQuietly(socketChannel, logger);
            context.connectionListener().didFailToAcceptConnection(remoteAddress, rejectionReason);
            return;
        }

        context.serverState().didOpenConnection();
        context.connectionListener().didAcceptConnection(remoteAddress);
        leastConnections().register(socketChannel);
    }

    private InetSocketAddress remoteAddress(SocketChannel socketChannel) {
        try {
            SocketAddress socketAddress = socketChannel.getRemoteAddress();
            return socketAddress instanceof InetSocketAddress inetSocketAddress ? inetSocketAddress : null;
        } catch (IOException e) {
            if (logger.enabled()) {
                logger.log(e, new LogEntry("event", "remote_address_unavailable"));
            }
            return null;
        }
    }

    private ConnectionEventLoop leastConnections() {
        return connectionEventLoops.stream()
                .min(Comparator.comparing(ConnectionEventLoop::numConnections))
                .get();
    }

    /**
     * Closes the listening socket and waits for the acceptor thread to exit. Connection event loops keep running.
     */
    public void stopAccepting() throws InterruptedException {
        accepting.set(false);
        selector.wakeup();
        if (thread.isAlive() && Thread.currentThread() != thread) {
            thread.join();
        }
    }

    public void shutdownConnections() {
        connectionEventLoops.forEach(ConnectionEventLoop::shutdownConnections);
    }

    public void forceCloseConnections() {
        connectionEventLoops.forEach(ConnectionEventLoop::forceCloseConnections);
    }

    public int numConnections() {
        int total = 0;
        for (ConnectionEventLoop loop : connectionEventLoops) {
            total += loop.numConnections();
        }
        return total;
    }

    public void stop() {
        stop.set(true);
        selector.wakeup();
    }

    public void join() throws InterruptedException {
        thread.join();
        for (ConnectionEventLoop connectionEventLoop : connectionEventLoops) {
            connectionEventLoop.join();
        }
    }
}
