package com.autotrader.domain.model;

import com.autotrader.domain.enums.PositionStatus;
import com.autotrader.exception.PositionStateException;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A long position in the traded instrument.
 *
 * <p>Created OPEN by the PositionLedger after a buy confirmation and revalued every cycle.
 * It transitions to CLOSED exactly once (sell on signal, stop-loss breach or kill switch),
 * at which point {@code realizedPnl} is frozen and every further mutation is rejected.
 *
 * <p>Only the ledger mutates positions. Everything else sees copies from {@link #copy()}.
 * Mutations and copies hold the position's lock, so a copy never mixes the price of one
 * revaluation with the P&L of another.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
public class Position {

    private final String id;
    private final String symbol;
    private final BigDecimal entryPrice;
    private final BigDecimal amount;
    private final BigDecimal stopLossPrice;

    private BigDecimal currentPrice;
    private BigDecimal unrealizedPnl;

    /** Null while OPEN. */
    private BigDecimal realizedPnl;

    private PositionStatus status;
    private LocalDateTime openedAt;
    private LocalDateTime closedAt;
    private LocalDateTime lastUpdated;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    /** Entry notional: entryPrice * amount. */
    public BigDecimal costBasis() {
        return entryPrice.multiply(amount);
    }

    /** Records a revaluation. Rejected once the position is closed. */
    public synchronized void markToMarket(BigDecimal price, BigDecimal pnl, LocalDateTime at) {
        requireOpen("revalue");
        this.currentPrice = price;
        this.unrealizedPnl = pnl;
        this.lastUpdated = at;
    }

    /** Freezes realized P&L and moves to CLOSED. Rejected if already closed. */
    public synchronized void markClosed(BigDecimal exitPrice, BigDecimal pnl, LocalDateTime at) {
        requireOpen("close");
        this.currentPrice = exitPrice;
        this.unrealizedPnl = pnl;
        this.realizedPnl = pnl;
        this.status = PositionStatus.CLOSED;
        this.closedAt = at;
        this.lastUpdated = at;
    }

    /** Detached copy for readers outside the engine thread. */
    public synchronized Position copy() {
        return toBuilder().build();
    }

    private void requireOpen(String operation) {
        if (status != PositionStatus.OPEN) {
            throw new PositionStateException(
                    "Cannot " + operation + " position " + id + " in status " + status, id);
        }
    }
}
