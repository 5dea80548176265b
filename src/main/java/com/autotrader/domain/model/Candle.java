package com.autotrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * A single OHLCV candle of the traded instrument.
 *
 * <p>{@code openTime} is the UTC start of the candle bucket. All price fields use
 * {@link BigDecimal} for precision in financial calculations.
 */
@Value
@Builder
public class Candle {

    LocalDateTime openTime;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    BigDecimal volume;
}
