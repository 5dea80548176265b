package com.autotrader.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Common tags applied to every metric. The engine's own meters are defined in
 * {@link com.autotrader.observability.EngineMetrics}.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final TradingProperties tradingProperties;

    public MetricsConfig(MeterRegistry meterRegistry, TradingProperties tradingProperties) {
        this.meterRegistry = meterRegistry;
        this.tradingProperties = tradingProperties;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry
                .config()
                .commonTags(
                        "application", "autotrader-engine",
                        "symbol", tradingProperties.getSymbol(),
                        "mode", tradingProperties.getTradingMode().name());
    }
}
