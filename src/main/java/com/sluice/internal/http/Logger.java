package com.sluice.internal.http;

/**
 * Fine-grained transport tracing. Callers guard each call with {@link #enabled()} so that entries are only built
 * when someone is listening.
 */
public interface Logger {

    boolean enabled();

    void log(LogEntry... entries);

    void log(Exception e, LogEntry... entries);

}
