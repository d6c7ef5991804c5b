package com.apex.decisioncore.service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ScheduledFuture;

/**
 * A background loop owned by {@link SupervisedTaskRunner}. Every run stamps a heartbeat when it starts
 * and when it ends; a heartbeat that stops moving means the loop is stuck or dead.
 */
public class SupervisedTask {

    private final String name;
    private final Duration interval;
    private final Runnable body;
    private final Instant registeredAt;
    private final Deque<Instant> restarts = new ArrayDeque<>();

    private volatile Instant lastHeartbeat;
    private volatile Instant lastSuccessAt;
    private volatile String lastError;
    private volatile long runs;
    private ScheduledFuture<?> future;

    SupervisedTask(String name, Duration interval, Runnable body, Instant registeredAt) {
        this.name = name;
        this.interval = interval;
        this.body = body;
        this.registeredAt = registeredAt;
        this.lastHeartbeat = registeredAt;
    }

    public String getName() {
        return name;
    }

    public Duration getInterval() {
        return interval;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public Instant getLastSuccessAt() {
        return lastSuccessAt;
    }

    public String getLastError() {
        return lastError;
    }

    public long getRuns() {
        return runs;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }

    Runnable body() {
        return body;
    }

    void heartbeat(Instant at) {
        lastHeartbeat = at;
    }

    void completed(Instant at, boolean success) {
        runs++;
        lastHeartbeat = at;
        if (success) {
            lastSuccessAt = at;
            lastError = null;
        } else {
            lastError = "run failed at " + at;
        }
    }

    synchronized ScheduledFuture<?> replaceFuture(ScheduledFuture<?> next) {
        ScheduledFuture<?> previous = future;
        future = next;
        return previous;
    }

    synchronized int restartsSince(Instant cutoff) {
        while (!restarts.isEmpty() && restarts.peekFirst().isBefore(cutoff)) {
            restarts.pollFirst();
        }
        return restarts.size();
    }

    synchronized void recordRestart(Instant at) {
        restarts.addLast(at);
    }
}
