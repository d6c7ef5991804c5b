package com.apex.decisioncore.service;

import com.apex.decisioncore.config.DecisionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

@Service
@Slf4j
public class TradingWindowService {

    private static final DateTimeFormatter WINDOW_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final DecisionProperties decisionProperties;

    public TradingWindowService(DecisionProperties decisionProperties) {
        this.decisionProperties = decisionProperties;
    }

    public record WindowDecision(boolean allowed, String reason) {}

    public WindowDecision evaluate(Instant nowUtc) {
        DecisionProperties.TradingWindow config = decisionProperties.getTradingWindow();
        if (!config.isEnabled()) {
            return new WindowDecision(true, "Trading window disabled");
        }
        ZonedDateTime now = nowUtc.atZone(ZoneId.of(config.getTimezone()));
        if (now.getDayOfWeek() == DayOfWeek.SATURDAY || now.getDayOfWeek() == DayOfWeek.SUNDAY) {
            return new WindowDecision(false, "Weekend");
        }
        LocalTime time = now.toLocalTime();
        if (isWithinAny(time, config.getBlackout())) {
            return new WindowDecision(false, "Blackout window");
        }
        if (!isWithinAny(time, config.getWindows())) {
            return new WindowDecision(false, "Outside trading window");
        }
        return new WindowDecision(true, "Within trading window");
    }

    /**
     * Whether the market is open at all, ignoring the narrower entry windows. Used by checks that only
     * make sense during the session.
     */
    public boolean isMarketHours(Instant nowUtc) {
        DecisionProperties.TradingWindow config = decisionProperties.getTradingWindow();
        if (!config.isEnabled()) {
            return true;
        }
        ZonedDateTime now = nowUtc.atZone(ZoneId.of(config.getTimezone()));
        if (now.getDayOfWeek() == DayOfWeek.SATURDAY || now.getDayOfWeek() == DayOfWeek.SUNDAY) {
            return false;
        }
        return isWithinAny(now.toLocalTime(), config.getWindows());
    }

    private boolean isWithinAny(LocalTime time, List<String> ranges) {
        if (ranges == null || ranges.isEmpty()) {
            return false;
        }
        for (String window : ranges) {
            if (window == null || window.isBlank()) {
                continue;
            }
            String[] parts = window.split("-");
            if (parts.length != 2) {
                log.warn("Ignoring malformed trading window '{}'", window);
                continue;
            }
            try {
                LocalTime start = LocalTime.parse(parts[0].trim(), WINDOW_FORMAT);
                LocalTime end = LocalTime.parse(parts[1].trim(), WINDOW_FORMAT);
                if (isWithinRange(time, start, end)) {
                    return true;
                }
            } catch (DateTimeParseException e) {
                log.warn("Ignoring malformed trading window '{}': {}", window, e.getMessage());
            }
        }
        return false;
    }

    private boolean isWithinRange(LocalTime time, LocalTime start, LocalTime end) {
        if (end.isAfter(start) || end.equals(start)) {
            return !time.isBefore(start) && !time.isAfter(end);
        }
        return !time.isBefore(start) || !time.isAfter(end);
    }
}
