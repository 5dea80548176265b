package com.autotrader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the risk_state table. Single row ({@link #SINGLETON_ID}) overwritten after every
 * risk governor mutation so the kill-switch latch survives restarts.
 */
@Entity
@Table(name = "risk_state")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskStateEntity {

    public static final Long SINGLETON_ID = 1L;

    @Id
    private Long id;

    @Column(name = "starting_capital", precision = 24, scale = 8)
    private BigDecimal startingCapital;

    @Column(name = "daily_realized_pnl", precision = 24, scale = 8)
    private BigDecimal dailyRealizedPnl;

    @Column(name = "total_realized_pnl", precision = 24, scale = 8)
    private BigDecimal totalRealizedPnl;

    @Column(name = "daily_loss_percent", precision = 10, scale = 4)
    private BigDecimal dailyLossPercent;

    @Column(name = "total_loss_percent", precision = 10, scale = 4)
    private BigDecimal totalLossPercent;

    private boolean locked;

    @Column(name = "lock_reason", length = 500)
    private String lockReason;

    @Column(name = "locked_at")
    private LocalDateTime lockedAt;

    @Column(name = "daily_anchor_date")
    private LocalDate dailyAnchorDate;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
