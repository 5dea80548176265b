package com.autotrader.mapper;

import com.autotrader.domain.model.Position;
import com.autotrader.entity.PositionEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper between Position domain model and PositionEntity. Field names match one to one.
 */
@Mapper
public interface PositionMapper {

    PositionEntity toEntity(Position position);

    Position toDomain(PositionEntity entity);

    List<Position> toDomainList(List<PositionEntity> entities);
}
