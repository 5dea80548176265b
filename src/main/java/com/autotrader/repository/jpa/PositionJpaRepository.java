package com.autotrader.repository.jpa;

import com.autotrader.domain.enums.PositionStatus;
import com.autotrader.entity.PositionEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the positions table.
 */
@Repository
public interface PositionJpaRepository extends JpaRepository<PositionEntity, String> {

    List<PositionEntity> findByStatusOrderByOpenedAtAsc(PositionStatus status);
}
