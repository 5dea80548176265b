package com.autotrader.repository;

import com.autotrader.domain.enums.PositionStatus;
import com.autotrader.domain.model.DailyStats;
import com.autotrader.domain.model.Position;
import com.autotrader.domain.model.RiskState;
import com.autotrader.domain.model.Trade;
import com.autotrader.entity.DailyStatsEntity;
import com.autotrader.entity.RiskStateEntity;
import com.autotrader.mapper.DailyStatsMapper;
import com.autotrader.mapper.PositionMapper;
import com.autotrader.mapper.RiskStateMapper;
import com.autotrader.mapper.TradeMapper;
import com.autotrader.repository.jpa.DailyStatsJpaRepository;
import com.autotrader.repository.jpa.PositionJpaRepository;
import com.autotrader.repository.jpa.RiskStateJpaRepository;
import com.autotrader.repository.jpa.TradeJpaRepository;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link TradingStore} backed by Spring Data JPA.
 *
 * <p>Trades are inserted once and never updated. Positions are upserted by id, the risk state is
 * a single overwritten row, and daily statistics are upserted by trading date.
 */
@Component
public class JpaTradingStore implements TradingStore {

    private static final Logger log = LoggerFactory.getLogger(JpaTradingStore.class);

    private final TradeJpaRepository tradeJpaRepository;
    private final PositionJpaRepository positionJpaRepository;
    private final RiskStateJpaRepository riskStateJpaRepository;
    private final DailyStatsJpaRepository dailyStatsJpaRepository;
    private final TradeMapper tradeMapper;
    private final PositionMapper positionMapper;
    private final RiskStateMapper riskStateMapper;
    private final DailyStatsMapper dailyStatsMapper;
    private final Clock clock;

    public JpaTradingStore(
            TradeJpaRepository tradeJpaRepository,
            PositionJpaRepository positionJpaRepository,
            RiskStateJpaRepository riskStateJpaRepository,
            DailyStatsJpaRepository dailyStatsJpaRepository,
            TradeMapper tradeMapper,
            PositionMapper positionMapper,
            RiskStateMapper riskStateMapper,
            DailyStatsMapper dailyStatsMapper,
            Clock clock) {
        this.tradeJpaRepository = tradeJpaRepository;
        this.positionJpaRepository = positionJpaRepository;
        this.riskStateJpaRepository = riskStateJpaRepository;
        this.dailyStatsJpaRepository = dailyStatsJpaRepository;
        this.tradeMapper = tradeMapper;
        this.positionMapper = positionMapper;
        this.riskStateMapper = riskStateMapper;
        this.dailyStatsMapper = dailyStatsMapper;
        this.clock = clock;
    }

    @Override
    @Transactional
    public void saveTrade(Trade trade) {
        if (tradeJpaRepository.existsById(trade.getId())) {
            throw new IllegalStateException("Trade " + trade.getId() + " already recorded; trades are append-only");
        }
        tradeJpaRepository.save(tradeMapper.toEntity(trade));
        log.debug("Saved trade {} ({} {} @ {})", trade.getId(), trade.getSide(), trade.getAmount(), trade.getSymbol());
    }

    @Override
    @Transactional
    public void savePosition(Position position) {
        positionJpaRepository.save(positionMapper.toEntity(position));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Position> loadOpenPositions() {
        return positionMapper.toDomainList(positionJpaRepository.findByStatusOrderByOpenedAtAsc(PositionStatus.OPEN));
    }

    @Override
    @Transactional
    public void saveRiskState(RiskState riskState) {
        RiskStateEntity entity = riskStateMapper.toEntity(riskState);
        entity.setId(RiskStateEntity.SINGLETON_ID);
        entity.setUpdatedAt(LocalDateTime.now(clock));
        riskStateJpaRepository.save(entity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<RiskState> loadRiskState() {
        return riskStateJpaRepository.findById(RiskStateEntity.SINGLETON_ID).map(riskStateMapper::toDomain);
    }

    @Override
    @Transactional
    public void saveDailyStats(DailyStats dailyStats) {
        Optional<DailyStatsEntity> existing = dailyStatsJpaRepository.findByTradingDate(dailyStats.getTradingDate());
        if (existing.isPresent()) {
            dailyStatsMapper.updateEntity(dailyStats, existing.get());
            dailyStatsJpaRepository.save(existing.get());
        } else {
            dailyStatsJpaRepository.save(dailyStatsMapper.toEntity(dailyStats));
        }
        log.info(
                "Saved daily stats for {}: trades={} wins={} losses={} pnl={}",
                dailyStats.getTradingDate(),
                dailyStats.getTotalTrades(),
                dailyStats.getWinningTrades(),
                dailyStats.getLosingTrades(),
                dailyStats.getRealizedPnl());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<DailyStats> loadDailyStats(LocalDate tradingDate) {
        return dailyStatsJpaRepository.findByTradingDate(tradingDate).map(dailyStatsMapper::toDomain);
    }
}
