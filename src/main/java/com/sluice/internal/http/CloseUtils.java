package com.sluice.internal.http;

import java.io.Closeable;
import java.io.IOException;

final class CloseUtils {

    private CloseUtils() {
    }

    /**
     * Closes the resource, reporting a failure to the logger rather than to the caller. Used on teardown paths where
     * the connection is already being abandoned.
     */
    static void closeQuietly(Closeable closeable, Logger logger) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            if (logger.enabled()) {
                logger.log(e, new LogEntry("event", "close_error"));
            }
        }
    }
}
