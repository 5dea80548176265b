package com.autotrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Point-in-time market state for the traded symbol, fetched once per cycle.
 *
 * <p>Carries the current price used for revaluation, stop-loss checks and entries, plus the
 * recent candle series that analysis sources compute indicators from (oldest first).
 */
@Value
@Builder
public class MarketSnapshot {

    String symbol;
    BigDecimal price;

    @Singular("candle")
    List<Candle> recentSeries;

    LocalDateTime timestamp;
}
