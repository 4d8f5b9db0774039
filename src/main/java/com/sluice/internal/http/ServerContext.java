package com.sluice.internal.http;

import com.sluice.ServerState;
import com.sluice.internal.util.EventPool;

/**
 * Everything the acceptor and connection event loops of one server share.
 */
public record ServerContext(Options options,
                            ServerState serverState,
                            EventPool eventPool,
                            Handler handler,
                            ConnectionListener connectionListener,
                            CycleListener cycleListener,
                            Logger logger) {
}
