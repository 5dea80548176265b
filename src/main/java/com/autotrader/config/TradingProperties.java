package com.autotrader.config;

import com.autotrader.domain.enums.ExchangeVenue;
import com.autotrader.domain.enums.TradingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Engine configuration, loaded from application.yml.
 *
 * <p>Properties prefix: {@code autotrader.*}. Risk limits live under {@code autotrader.risk.*}
 * and are read by {@link RiskConfig}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>tradingMode: PAPER</li>
 *   <li>symbol: BTC/USDT on OKX</li>
 *   <li>engine: 5 minute poll interval, 60 second error backoff, no auto-start</li>
 *   <li>signal: confidence threshold 70</li>
 * </ul>
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "autotrader")
public class TradingProperties {

    @NotNull
    private TradingMode tradingMode = TradingMode.PAPER;

    @NotBlank
    private String symbol = "BTC/USDT";

    @NotNull
    private ExchangeVenue venue = ExchangeVenue.OKX;

    @Valid
    private Engine engine = new Engine();

    @Valid
    private Signal signal = new Signal();

    @Valid
    private Paper paper = new Paper();

    @Valid
    private MarketData marketData = new MarketData();

    @Data
    public static class Engine {

        @NotNull
        private Duration pollInterval = Duration.ofMinutes(5);

        @NotNull
        private Duration errorBackoff = Duration.ofSeconds(60);

        private boolean autoStart = false;
    }

    @Data
    public static class Signal {

        @NotNull
        @DecimalMin("0")
        @DecimalMax("100")
        private BigDecimal confidenceThreshold = new BigDecimal("70");

        /** Per-source weight overrides keyed by source name. Sources not listed use their default. */
        private Map<String, BigDecimal> weights = new LinkedHashMap<>();
    }

    @Data
    public static class Paper {

        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal referencePrice = new BigDecimal("50000");
    }

    @Data
    public static class MarketData {

        @NotBlank
        private String timeframe = "1h";

        @Min(1)
        private int candleLimit = 100;
    }
}
