package com.autotrader.broker;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/** Order acknowledgement as reported by the exchange. Prices may be null when not yet known. */
@Value
@Builder
public class ExchangeOrder {

    String id;
    String symbol;

    /** Exchange status string, e.g. {@code closed}, {@code open}, {@code canceled}. */
    String status;

    BigDecimal amount;
    BigDecimal filled;
    BigDecimal price;
    BigDecimal averagePrice;
    LocalDateTime timestamp;
}
