package com.autotrader.domain.model;

import com.autotrader.domain.enums.OrderSide;
import com.autotrader.domain.enums.OrderStatus;
import com.autotrader.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Confirmation returned by an execution adapter for a placed order.
 *
 * <p>{@code simulated} is true for paper fills. {@code fillPrice} is null for resting
 * stop-loss orders and for live orders the exchange has not reported a fill for yet.
 */
@Value
@Builder
public class OrderResult {

    String id;
    String symbol;
    OrderSide side;
    OrderType type;
    BigDecimal amount;
    BigDecimal fillPrice;
    BigDecimal stopPrice;
    OrderStatus status;
    boolean simulated;
    LocalDateTime placedAt;
}
