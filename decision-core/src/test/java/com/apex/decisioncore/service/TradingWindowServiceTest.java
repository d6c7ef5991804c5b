package com.apex.decisioncore.service;

import com.apex.decisioncore.config.DecisionProperties;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TradingWindowServiceTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Test
    void allowsInsideWindow() {
        TradingWindowService service = new TradingWindowService(props(List.of()));

        TradingWindowService.WindowDecision decision = service.evaluate(at(2024, 3, 5, 10, 0));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isEqualTo("Within trading window");
    }

    @Test
    void blocksOutsideWindow() {
        TradingWindowService service = new TradingWindowService(props(List.of()));

        TradingWindowService.WindowDecision decision = service.evaluate(at(2024, 3, 5, 9, 31));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo("Outside trading window");
        assertThat(service.isMarketHours(at(2024, 3, 5, 9, 31))).isFalse();
    }

    @Test
    void blocksBlackout() {
        TradingWindowService service = new TradingWindowService(props(List.of("12:00-12:30")));

        TradingWindowService.WindowDecision decision = service.evaluate(at(2024, 3, 5, 12, 15));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo("Blackout window");
        assertThat(service.isMarketHours(at(2024, 3, 5, 12, 15))).isTrue();
    }

    @Test
    void blocksWeekend() {
        TradingWindowService service = new TradingWindowService(props(List.of()));

        assertThat(service.evaluate(at(2024, 3, 9, 11, 0)).reason()).isEqualTo("Weekend");
    }

    @Test
    void disabledWindowAllowsEverything() {
        DecisionProperties props = props(List.of());
        props.getTradingWindow().setEnabled(false);
        TradingWindowService service = new TradingWindowService(props);

        assertThat(service.evaluate(at(2024, 3, 9, 3, 0)).allowed()).isTrue();
    }

    @Test
    void malformedWindowsAreIgnored() {
        DecisionProperties props = props(List.of());
        props.getTradingWindow().setWindows(List.of("garbage", "25:00-26:00", "09:35-15:45"));
        TradingWindowService service = new TradingWindowService(props);

        assertThat(service.evaluate(at(2024, 3, 5, 10, 0)).allowed()).isTrue();
    }

    private static DecisionProperties props(List<String> blackout) {
        DecisionProperties props = new DecisionProperties();
        props.getTradingWindow().setEnabled(true);
        props.getTradingWindow().setTimezone("America/New_York");
        props.getTradingWindow().setWindows(List.of("09:35-15:45"));
        props.getTradingWindow().setBlackout(blackout);
        return props;
    }

    private static Instant at(int year, int month, int day, int hour, int minute) {
        return ZonedDateTime.of(year, month, day, hour, minute, 0, 0, NEW_YORK).toInstant();
    }
}
