package com.autotrader.config;

import com.autotrader.risk.RiskLimits;
import java.math.BigDecimal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link RiskLimits} bean from application.yml.
 *
 * <p>Properties prefix: {@code autotrader.risk.*}. Every limit has a conservative default, so the
 * governor never runs without one. Invalid limits fail startup.
 */
@Configuration
public class RiskConfig {

    private static final Logger log = LoggerFactory.getLogger(RiskConfig.class);

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    @Bean
    public RiskLimits riskLimits(
            @Value("${autotrader.risk.position-size-percent:5}") BigDecimal positionSizePercent,
            @Value("${autotrader.risk.daily-loss-limit-percent:15}") BigDecimal dailyLossLimitPercent,
            @Value("${autotrader.risk.kill-switch-percent:50}") BigDecimal killSwitchPercent,
            @Value("${autotrader.risk.starting-capital:10000}") BigDecimal startingCapital,
            @Value("${autotrader.risk.min-position-usd:10}") BigDecimal minPositionUsd,
            @Value("${autotrader.risk.stop-loss-percent:5}") BigDecimal stopLossPercent) {
        requireRange("position-size-percent", positionSizePercent);
        requireRange("daily-loss-limit-percent", dailyLossLimitPercent);
        requireRange("kill-switch-percent", killSwitchPercent);
        requireRange("stop-loss-percent", stopLossPercent);
        if (startingCapital.signum() <= 0) {
            throw new IllegalArgumentException("autotrader.risk.starting-capital must be positive");
        }
        if (minPositionUsd.signum() < 0) {
            throw new IllegalArgumentException("autotrader.risk.min-position-usd must not be negative");
        }

        RiskLimits limits = RiskLimits.builder()
                .positionSizePercent(positionSizePercent)
                .dailyLossLimitPercent(dailyLossLimitPercent)
                .killSwitchPercent(killSwitchPercent)
                .startingCapital(startingCapital)
                .minPositionUsd(minPositionUsd)
                .stopLossPercent(stopLossPercent)
                .build();
        log.info("Risk limits: {}", limits);
        return limits;
    }

    /** Percentages must lie in (0, 100]. */
    private static void requireRange(String name, BigDecimal value) {
        if (value.signum() <= 0 || value.compareTo(HUNDRED) > 0) {
            throw new IllegalArgumentException("autotrader.risk." + name + " must be in (0, 100], got " + value);
        }
    }
}
