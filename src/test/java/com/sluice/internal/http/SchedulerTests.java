package com.sluice.internal.http;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SchedulerTests {

    private static class ManualClock implements Clock {
        long time;

        @Override
        public long nanoTime() {
            return time;
        }
    }

    @Test
    public void expires_tasks_in_deadline_order() {
        ManualClock clock = new ManualClock();
        Scheduler scheduler = new Scheduler(clock);
        List<String> ran = new ArrayList<>();

        scheduler.schedule(() -> ran.add("late"), Duration.ofSeconds(2));
        scheduler.schedule(() -> ran.add("early"), Duration.ofSeconds(1));
        scheduler.schedule(() -> ran.add("early-too"), Duration.ofSeconds(1));

        assertTrue(scheduler.expired().isEmpty());

        clock.time = Duration.ofSeconds(1).toNanos();
        scheduler.expired().forEach(Runnable::run);
        assertEquals(List.of("early", "early-too"), ran);
        assertEquals(1, scheduler.size());

        clock.time = Duration.ofSeconds(5).toNanos();
        scheduler.expired().forEach(Runnable::run);
        assertEquals(List.of("early", "early-too", "late"), ran);
        assertEquals(0, scheduler.size());
    }

    @Test
    public void cancelled_task_never_runs() {
        ManualClock clock = new ManualClock();
        Scheduler scheduler = new Scheduler(clock);
        List<String> ran = new ArrayList<>();

        Cancellable cancellable = scheduler.schedule(() -> ran.add("cancelled"), Duration.ofMillis(10));
        scheduler.schedule(() -> ran.add("kept"), Duration.ofMillis(10));
        cancellable.cancel();

        clock.time = Duration.ofMillis(10).toNanos();
        scheduler.expired().forEach(Runnable::run);

        assertEquals(List.of("kept"), ran);
    }
}
