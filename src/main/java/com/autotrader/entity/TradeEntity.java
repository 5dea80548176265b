package com.autotrader.entity;

import com.autotrader.domain.enums.OrderSide;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the trades table.
 * Append-only audit log: one row per executed order, never updated.
 */
@Entity
@Table(name = "trades", indexes = @Index(name = "idx_trades_position", columnList = "position_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TradeEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "position_id", length = 36)
    private String positionId;

    @Column(name = "order_id", length = 64)
    private String orderId;

    @Column(length = 30)
    private String symbol;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private OrderSide side;

    @Column(precision = 24, scale = 8)
    private BigDecimal amount;

    @Column(name = "entry_price", precision = 24, scale = 8)
    private BigDecimal entryPrice;

    @Column(name = "exit_price", precision = 24, scale = 8)
    private BigDecimal exitPrice;

    @Column(name = "realized_pnl", precision = 24, scale = 8)
    private BigDecimal realizedPnl;

    /** Aggregated signal and per-source contributions, as JSON. */
    @Lob
    @Column(name = "signal_snapshot")
    private String signalSnapshot;

    @Column(length = 1000)
    private String rationale;

    private boolean simulated;

    @Column(name = "executed_at")
    private LocalDateTime executedAt;
}
