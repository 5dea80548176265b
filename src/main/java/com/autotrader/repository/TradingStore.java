package com.autotrader.repository;

import com.autotrader.domain.model.DailyStats;
import com.autotrader.domain.model.Position;
import com.autotrader.domain.model.RiskState;
import com.autotrader.domain.model.Trade;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port used by the engine. Trades are append-only; positions, the risk state and
 * daily statistics are upserted by their natural key.
 *
 * <p>Failures surface as unchecked exceptions and are handled at the cycle boundary.
 */
public interface TradingStore {

    void saveTrade(Trade trade);

    void savePosition(Position position);

    List<Position> loadOpenPositions();

    void saveRiskState(RiskState riskState);

    Optional<RiskState> loadRiskState();

    void saveDailyStats(DailyStats dailyStats);

    Optional<DailyStats> loadDailyStats(LocalDate tradingDate);
}
