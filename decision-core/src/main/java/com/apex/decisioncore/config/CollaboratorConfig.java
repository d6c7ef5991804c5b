package com.apex.decisioncore.config;

import com.apex.decisioncore.health.BrokerConnectivityProbe;
import com.apex.decisioncore.health.MarketDataFreshnessProvider;
import com.apex.decisioncore.service.DecisionActivityTracker;
import com.apex.decisioncore.shadow.PriceHistoryProvider;
import com.apex.decisioncore.trading.pipeline.MarketContext;
import com.apex.decisioncore.trading.pipeline.PortfolioSnapshot;
import com.apex.decisioncore.trading.pipeline.PositionSnapshotProvider;
import com.apex.decisioncore.trading.pipeline.SignalFeed;
import com.apex.decisioncore.trading.pipeline.SymbolSignals;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Inert stand-ins for the external collaborators. Each backs off as soon as the deployment provides a
 * real bean of the same type.
 */
@Slf4j
@Configuration
public class CollaboratorConfig {

    @Bean
    @ConditionalOnMissingBean
    public SignalFeed signalFeed() {
        log.warn("No SignalFeed configured, decision cycles will see no candidates");
        return new SignalFeed() {
            @Override
            public List<SymbolSignals> latest() {
                return List.of();
            }

            @Override
            public MarketContext marketContext() {
                return MarketContext.neutral();
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public PositionSnapshotProvider positionSnapshotProvider(Clock clock) {
        return new PositionSnapshotProvider() {
            @Override
            public PortfolioSnapshot snapshot() {
                return PortfolioSnapshot.empty(clock.instant());
            }

            @Override
            public OptionalInt brokerPositionCount() {
                return OptionalInt.empty();
            }
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public PriceHistoryProvider priceHistoryProvider() {
        return (symbol, from, to) -> Optional.empty();
    }

    @Bean
    @ConditionalOnMissingBean
    public BrokerConnectivityProbe brokerConnectivityProbe() {
        return () -> true;
    }

    /**
     * Without a market-data cache to ask, freshness is the time the signal feed last delivered anything.
     */
    @Bean
    @ConditionalOnMissingBean
    public MarketDataFreshnessProvider marketDataFreshnessProvider(DecisionActivityTracker activityTracker) {
        return new MarketDataFreshnessProvider() {
            @Override
            public Optional<Instant> lastUpdate() {
                return activityTracker.getLastSignalsAt();
            }

            @Override
            public void requestRefresh() {
                log.info("Market data refresh requested, no market data collaborator configured");
            }
        };
    }
}
