package com.sluice.internal.http;

/**
 * Hands a freshly parsed exchange to whatever runs application code. Called on the event loop thread, so it must
 * not block.
 */
@FunctionalInterface
public interface Handler {

    void handle(RequestResponseCycle cycle);

}
