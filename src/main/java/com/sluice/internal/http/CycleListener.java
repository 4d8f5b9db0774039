package com.sluice.internal.http;

import com.sluice.CycleOutcome;
import com.sluice.LogEvent;
import com.sluice.Request;

import java.time.Duration;

/**
 * Receives per-exchange notifications. Implementations must not throw.
 */
public interface CycleListener {

    void didStartCycle(Request request);

    void didFinishCycle(Request request, CycleOutcome outcome, Duration duration, Throwable throwable);

    void didReceiveLogEvent(LogEvent logEvent);

}
