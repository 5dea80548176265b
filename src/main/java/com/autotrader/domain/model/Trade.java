package com.autotrader.domain.model;

import com.autotrader.domain.enums.OrderSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Append-only audit record of one executed order.
 *
 * <p>Opening trades (BUY) carry the signal snapshot that caused them and have no exit price or
 * P&L. Closing trades (SELL) carry the exit price and realized P&L of the position they closed.
 * Stop-loss and kill-switch exits have no signal snapshot; their rationale says why.
 */
@Value
@Builder
public class Trade {

    String id;
    String positionId;
    String orderId;
    String symbol;
    OrderSide side;
    BigDecimal amount;
    BigDecimal entryPrice;

    /** Null for opening trades. */
    BigDecimal exitPrice;

    /** Null for opening trades (no P&L until the position is closed). */
    BigDecimal realizedPnl;

    SignalSnapshot signalSnapshot;
    String rationale;
    boolean simulated;
    LocalDateTime executedAt;
}
