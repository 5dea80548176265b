package com.autotrader.mapper;

import com.autotrader.domain.model.RiskState;
import com.autotrader.entity.RiskStateEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper between RiskState and its single-row RiskStateEntity. The row id and update
 * timestamp are owned by the store.
 */
@Mapper
public interface RiskStateMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "updatedAt", ignore = true)
    RiskStateEntity toEntity(RiskState riskState);

    RiskState toDomain(RiskStateEntity entity);
}
