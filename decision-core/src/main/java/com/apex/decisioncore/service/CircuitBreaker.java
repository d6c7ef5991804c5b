package com.apex.decisioncore.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Entry halt consulted by the risk gate. Engaged by the performance health check; expires on its own
 * once {@code haltUntil} has passed.
 */
@Service
@Slf4j
public class CircuitBreaker {

    private final Clock clock;

    private Instant haltUntil;
    private String reason;

    public CircuitBreaker(Clock clock) {
        this.clock = clock;
    }

    public synchronized void engage(String reason, Instant until) {
        if (haltUntil != null && haltUntil.isAfter(until)) {
            log.info("Circuit breaker already engaged until {}, keeping longer halt", haltUntil);
            return;
        }
        this.haltUntil = until;
        this.reason = reason;
        log.error("Circuit breaker engaged until {} reason={}", until, reason);
    }

    public synchronized void release() {
        if (haltUntil != null) {
            log.info("Circuit breaker released (was {})", reason);
        }
        haltUntil = null;
        reason = null;
    }

    public boolean canEnter() {
        return canEnter(clock.instant());
    }

    public synchronized boolean canEnter(Instant now) {
        if (haltUntil == null) {
            return true;
        }
        if (now.isBefore(haltUntil)) {
            return false;
        }
        log.info("Circuit breaker expired at {}", haltUntil);
        haltUntil = null;
        reason = null;
        return true;
    }

    public synchronized String getReason() {
        return reason;
    }

    public synchronized Instant getHaltUntil() {
        return haltUntil;
    }
}
