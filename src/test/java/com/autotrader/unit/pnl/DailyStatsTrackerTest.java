package com.autotrader.unit.pnl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.autotrader.domain.enums.OrderSide;
import com.autotrader.domain.model.DailyStats;
import com.autotrader.domain.model.Trade;
import com.autotrader.pnl.DailyStatsTracker;
import com.autotrader.repository.TradingStore;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for DailyStatsTracker.
 */
@ExtendWith(MockitoExtension.class)
class DailyStatsTrackerTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    @Mock
    private TradingStore tradingStore;

    private DailyStatsTracker dailyStatsTracker;

    @BeforeEach
    void setUp() {
        dailyStatsTracker = new DailyStatsTracker(
                tradingStore, Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC));
    }

    private static Trade sell(String pnl) {
        return Trade.builder().id(pnl).side(OrderSide.SELL).realizedPnl(new BigDecimal(pnl)).build();
    }

    @Test
    @DisplayName("Closing trades count as wins, losses or break-even")
    void countsClosingTrades() {
        dailyStatsTracker.record(sell("20"));
        dailyStatsTracker.record(sell("-5"));
        dailyStatsTracker.record(sell("0"));

        DailyStats stats = dailyStatsTracker.current();
        assertThat(stats.getTotalTrades()).isEqualTo(3);
        assertThat(stats.getWinningTrades()).isEqualTo(1);
        assertThat(stats.getLosingTrades()).isEqualTo(1);
        assertThat(stats.getRealizedPnl()).isEqualByComparingTo("15");
    }

    @Test
    @DisplayName("Opening trades are ignored")
    void ignoresOpeningTrades() {
        dailyStatsTracker.record(Trade.builder().id("T-1").side(OrderSide.BUY).build());

        assertThat(dailyStatsTracker.current().getTotalTrades()).isZero();
    }

    @Test
    @DisplayName("Finishing a day the tracker does not hold leaves the stored row untouched")
    void finishDayForUntrackedDate() {
        LocalDate yesterday = TODAY.minusDays(1);

        assertThat(dailyStatsTracker.finishDay(yesterday, TODAY)).isEmpty();

        verify(tradingStore, never()).saveDailyStats(any());
        assertThat(dailyStatsTracker.current().getTradingDate()).isEqualTo(TODAY);
    }

    @Test
    @DisplayName("Restored day is finished with its restored figures")
    void finishRestoredDay() {
        LocalDate yesterday = TODAY.minusDays(1);
        dailyStatsTracker.restore(DailyStats.builder()
                .tradingDate(yesterday)
                .totalTrades(2)
                .winningTrades(2)
                .realizedPnl(new BigDecimal("35"))
                .build());

        dailyStatsTracker.finishDay(yesterday, TODAY);

        verify(tradingStore).saveDailyStats(argThat(s -> s.getTradingDate().equals(yesterday)
                && s.getTotalTrades() == 2
                && s.getRealizedPnl().compareTo(new BigDecimal("35")) == 0));
        assertThat(dailyStatsTracker.current().getTradingDate()).isEqualTo(TODAY);
    }

    @Test
    @DisplayName("Finishing a day persists it under its date and starts an empty day")
    void finishDay() {
        dailyStatsTracker.record(sell("20"));

        DailyStats finished = dailyStatsTracker.finishDay(TODAY, TODAY.plusDays(1)).orElseThrow();

        assertThat(finished.getTradingDate()).isEqualTo(TODAY);
        verify(tradingStore).saveDailyStats(argThat(s -> s.getTradingDate().equals(TODAY) && s.getTotalTrades() == 1));
        assertThat(dailyStatsTracker.current().getTradingDate()).isEqualTo(TODAY.plusDays(1));
        assertThat(dailyStatsTracker.current().getTotalTrades()).isZero();
    }

    @Test
    @DisplayName("Restored day keeps counting from its persisted figures")
    void restore() {
        dailyStatsTracker.restore(DailyStats.builder()
                .tradingDate(TODAY)
                .totalTrades(4)
                .winningTrades(3)
                .losingTrades(1)
                .realizedPnl(new BigDecimal("40"))
                .build());

        dailyStatsTracker.record(sell("10"));

        assertThat(dailyStatsTracker.current().getTotalTrades()).isEqualTo(5);
        assertThat(dailyStatsTracker.current().getRealizedPnl()).isEqualByComparingTo("50");
    }
}
