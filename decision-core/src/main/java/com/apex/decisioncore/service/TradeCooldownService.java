package com.apex.decisioncore.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
public class TradeCooldownService {

    private final Map<String, Instant> lastTradeBySymbol = new ConcurrentHashMap<>();
    private final Clock clock;

    @Value("${risk.trade-cooldown.minutes:5}")
    private long cooldownMinutes;

    public TradeCooldownService(Clock clock) {
        this.clock = clock;
    }

    public void recordTrade(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            return;
        }
        lastTradeBySymbol.put(key(symbol), clock.instant());
        log.debug("Recorded trade cooldown for symbol {}", symbol);
    }

    public boolean isInCooldown(String symbol, Instant now) {
        return getRemainingCooldown(symbol, now) > 0;
    }

    public long getRemainingCooldown(String symbol, Instant now) {
        if (symbol == null || symbol.isBlank()) {
            return 0;
        }
        Instant lastTrade = lastTradeBySymbol.get(key(symbol));
        if (lastTrade == null) {
            return 0;
        }
        long elapsedSeconds = Duration.between(lastTrade, now).getSeconds();
        long totalSeconds = Duration.ofMinutes(cooldownMinutes).getSeconds();
        return Math.max(0, totalSeconds - elapsedSeconds);
    }

    private String key(String symbol) {
        return symbol.toUpperCase(Locale.ROOT);
    }
}
