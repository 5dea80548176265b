package com.autotrader.entity;

import com.autotrader.domain.enums.PositionStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the positions table.
 * Latest snapshot of each position, upserted on open, every revaluation and close. Open rows
 * are reloaded into the ledger on startup.
 */
@Entity
@Table(name = "positions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PositionEntity {

    @Id
    @Column(length = 36)
    private String id;

    @Column(length = 30)
    private String symbol;

    @Column(name = "entry_price", precision = 24, scale = 8)
    private BigDecimal entryPrice;

    @Column(precision = 24, scale = 8)
    private BigDecimal amount;

    @Column(name = "stop_loss_price", precision = 24, scale = 8)
    private BigDecimal stopLossPrice;

    @Column(name = "current_price", precision = 24, scale = 8)
    private BigDecimal currentPrice;

    @Column(name = "unrealized_pnl", precision = 24, scale = 8)
    private BigDecimal unrealizedPnl;

    @Column(name = "realized_pnl", precision = 24, scale = 8)
    private BigDecimal realizedPnl;

    @Enumerated(EnumType.STRING)
    @Column(columnDefinition = "varchar(10)")
    private PositionStatus status;

    @Column(name = "opened_at")
    private LocalDateTime openedAt;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;

    @Column(name = "last_updated")
    private LocalDateTime lastUpdated;
}
