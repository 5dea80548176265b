package com.autotrader.repository.jpa;

import com.autotrader.entity.RiskStateEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RiskStateJpaRepository extends JpaRepository<RiskStateEntity, Long> {}
