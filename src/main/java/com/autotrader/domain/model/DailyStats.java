package com.autotrader.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Trade statistics for one UTC trading day. A closing trade with positive P&L counts as a win,
 * negative as a loss; break-even closes count toward the total only.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyStats {

    private LocalDate tradingDate;
    private int totalTrades;
    private int winningTrades;
    private int losingTrades;

    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    public static DailyStats empty(LocalDate tradingDate) {
        return DailyStats.builder().tradingDate(tradingDate).build();
    }
}
