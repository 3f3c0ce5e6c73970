package com.livedesk.relay.support;

import java.time.Instant;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A scheduled task that only runs when a test says so.
 */
public class ManualScheduledTask implements ScheduledFuture<Object> {

    private final Runnable task;
    private final Instant due;
    private volatile boolean cancelled;
    private volatile boolean done;

    public ManualScheduledTask(Runnable task, Instant due) {
        this.task = task;
        this.due = due;
    }

    public Instant due() {
        return due;
    }

    /** Runs the task regardless of cancellation, as a late fire racing a cancel would. */
    public void forceRun() {
        done = true;
        task.run();
    }

    public boolean runIfDue(Instant now) {
        synchronized (this) {
            if (cancelled || done || due.isAfter(now)) return false;
            done = true;
        }
        task.run();
        return true;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return 0;
    }

    @Override
    public int compareTo(Delayed o) {
        return 0;
    }

    @Override
    public synchronized boolean cancel(boolean mayInterruptIfRunning) {
        if (done) return false;
        cancelled = true;
        return true;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public boolean isDone() {
        return done || cancelled;
    }

    @Override
    public Object get() {
        return null;
    }

    @Override
    public Object get(long timeout, TimeUnit unit) {
        return null;
    }
}
