package com.autotrader.config;

import com.autotrader.signal.AnalysisSource;
import com.autotrader.signal.AnalysisSourceRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Core engine wiring: the UTC clock every component reads time from, and the analysis source
 * registry populated from the {@link AnalysisSource} beans in the context.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Registers every analysis source bean, in bean order, with its configured weight
     * ({@code autotrader.signal.weights.<name>}) or its own default.
     */
    @Bean
    public AnalysisSourceRegistry analysisSourceRegistry(
            List<AnalysisSource> analysisSources, TradingProperties tradingProperties) {
        Map<String, BigDecimal> weights = tradingProperties.getSignal().getWeights();
        AnalysisSourceRegistry registry = new AnalysisSourceRegistry();
        for (AnalysisSource source : analysisSources) {
            registry.register(source, weights.getOrDefault(source.name(), source.defaultWeight()));
        }
        for (String configured : weights.keySet()) {
            if (analysisSources.stream().noneMatch(s -> s.name().equals(configured))) {
                log.warn("Weight configured for unknown analysis source '{}'", configured);
            }
        }
        return registry;
    }
}
