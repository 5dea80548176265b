package com.autotrader.pnl;

import com.autotrader.domain.model.DailyStats;
import com.autotrader.domain.model.Trade;
import com.autotrader.repository.TradingStore;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Running trade statistics for the current UTC trading day.
 *
 * <p>Every closing trade counts toward the total; positive realized P&L is a win, negative a loss.
 * The day's row is persisted when the engine rolls over to a new day ({@link #finishDay}) and on
 * shutdown ({@link #flush}).
 */
@Service
public class DailyStatsTracker {

    private static final Logger log = LoggerFactory.getLogger(DailyStatsTracker.class);

    private final TradingStore tradingStore;

    private DailyStats current;

    public DailyStatsTracker(TradingStore tradingStore, Clock clock) {
        this.tradingStore = tradingStore;
        this.current = DailyStats.empty(LocalDate.now(clock));
    }

    /** Counts a closing trade. Opening trades carry no realized P&L and are ignored. */
    public synchronized void record(Trade trade) {
        if (trade.getRealizedPnl() == null) {
            return;
        }
        current.setTotalTrades(current.getTotalTrades() + 1);
        int sign = trade.getRealizedPnl().signum();
        if (sign > 0) {
            current.setWinningTrades(current.getWinningTrades() + 1);
        } else if (sign < 0) {
            current.setLosingTrades(current.getLosingTrades() + 1);
        }
        current.setRealizedPnl(current.getRealizedPnl().add(trade.getRealizedPnl()));
    }

    /**
     * Persists the finished day's statistics and starts an empty day.
     *
     * <p>Nothing is persisted when the tracker holds a different day than {@code finishedDate}
     * (after a restart across midnight), so the stored row for that day is left as it is.
     *
     * @return the statistics that were persisted, empty if none were
     */
    public synchronized Optional<DailyStats> finishDay(LocalDate finishedDate, LocalDate newDate) {
        if (!finishedDate.equals(current.getTradingDate())) {
            log.info(
                    "No statistics tracked for {} (tracking {}), keeping the stored row",
                    finishedDate,
                    current.getTradingDate());
            if (!newDate.equals(current.getTradingDate())) {
                current = DailyStats.empty(newDate);
            }
            return Optional.empty();
        }

        DailyStats finished = copy(current);
        tradingStore.saveDailyStats(finished);
        log.info(
                "Day {} closed: {} trade(s), {} win(s), {} loss(es), realized P&L {}",
                finishedDate,
                finished.getTotalTrades(),
                finished.getWinningTrades(),
                finished.getLosingTrades(),
                finished.getRealizedPnl());
        current = DailyStats.empty(newDate);
        return Optional.of(finished);
    }

    /** Persists the current day's statistics without resetting them. */
    public synchronized void flush() {
        tradingStore.saveDailyStats(copy(current));
    }

    /** Continues a day whose statistics were persisted before a restart. */
    public synchronized void restore(DailyStats persisted) {
        current = copy(persisted);
    }

    public synchronized DailyStats current() {
        return copy(current);
    }

    private static DailyStats copy(DailyStats stats) {
        return DailyStats.builder()
                .tradingDate(stats.getTradingDate())
                .totalTrades(stats.getTotalTrades())
                .winningTrades(stats.getWinningTrades())
                .losingTrades(stats.getLosingTrades())
                .realizedPnl(stats.getRealizedPnl())
                .build();
    }
}
