package com.autotrader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the daily_stats table.
 * One row per UTC trading day, written at rollover and on shutdown.
 */
@Entity
@Table(name = "daily_stats")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailyStatsEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "trading_date", unique = true)
    private LocalDate tradingDate;

    @Column(name = "total_trades")
    private int totalTrades;

    @Column(name = "winning_trades")
    private int winningTrades;

    @Column(name = "losing_trades")
    private int losingTrades;

    @Column(name = "realized_pnl", precision = 24, scale = 8)
    private BigDecimal realizedPnl;
}
