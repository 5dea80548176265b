package com.autotrader.broker;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Ticker {

    String symbol;
    BigDecimal last;
    BigDecimal bid;
    BigDecimal ask;
    LocalDateTime timestamp;
}
