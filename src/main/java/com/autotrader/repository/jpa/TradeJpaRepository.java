package com.autotrader.repository.jpa;

import com.autotrader.entity.TradeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the trades table.
 */
@Repository
public interface TradeJpaRepository extends JpaRepository<TradeEntity, String> {

    List<TradeEntity> findByPositionIdOrderByExecutedAtAsc(String positionId);
}
