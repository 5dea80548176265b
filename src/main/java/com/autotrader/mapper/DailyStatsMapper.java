package com.autotrader.mapper;

import com.autotrader.domain.model.DailyStats;
import com.autotrader.entity.DailyStatsEntity;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.MappingTarget;

/**
 * MapStruct mapper between DailyStats and DailyStatsEntity.
 */
@Mapper
public interface DailyStatsMapper {

    @Mapping(target = "id", ignore = true)
    DailyStatsEntity toEntity(DailyStats dailyStats);

    DailyStats toDomain(DailyStatsEntity entity);

    /** Overwrites an existing day's row in place, keeping its id. */
    @Mapping(target = "id", ignore = true)
    void updateEntity(DailyStats dailyStats, @MappingTarget DailyStatsEntity entity);
}
