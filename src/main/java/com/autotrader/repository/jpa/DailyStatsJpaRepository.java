package com.autotrader.repository.jpa;

import com.autotrader.entity.DailyStatsEntity;
import java.time.LocalDate;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the daily_stats table. One row per trading day.
 */
@Repository
public interface DailyStatsJpaRepository extends JpaRepository<DailyStatsEntity, Long> {

    Optional<DailyStatsEntity> findByTradingDate(LocalDate tradingDate);
}
