package com.sluice.internal.http;

import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * {@link Logger} that writes {@code key=value} trace lines to SLF4J at DEBUG level.
 */
public class Slf4jLogger implements Logger {

    private final org.slf4j.Logger logger;

    public Slf4jLogger() {
        this(org.slf4j.LoggerFactory.getLogger("com.sluice.transport"));
    }

    public Slf4jLogger(org.slf4j.Logger logger) {
        this.logger = logger;
    }

    @Override
    public boolean enabled() {
        return logger.isDebugEnabled();
    }

    @Override
    public void log(LogEntry... entries) {
        logger.debug(format(entries));
    }

    @Override
    public void log(Exception e, LogEntry... entries) {
        logger.debug(format(entries), e);
    }

    private static String format(LogEntry... entries) {
        return Stream.of(entries)
                .map(e -> e.key() + "=" + e.value())
                .collect(Collectors.joining(", "));
    }
}
