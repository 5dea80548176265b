package com.autotrader.mapper;

import com.autotrader.domain.model.SignalSnapshot;
import com.autotrader.domain.model.Trade;
import com.autotrader.entity.TradeEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between Trade domain model and TradeEntity.
 *
 * <p>The signal snapshot is an object in the domain model and a JSON string in the entity.
 */
@Mapper
public interface TradeMapper {

    @Mapping(source = "signalSnapshot", target = "signalSnapshot", qualifiedByName = "snapshotToJson")
    TradeEntity toEntity(Trade trade);

    @Mapping(source = "signalSnapshot", target = "signalSnapshot", qualifiedByName = "jsonToSnapshot")
    Trade toDomain(TradeEntity entity);

    List<Trade> toDomainList(List<TradeEntity> entities);

    @Named("snapshotToJson")
    default String snapshotToJson(SignalSnapshot snapshot) {
        return JsonHelper.toJson(snapshot);
    }

    @Named("jsonToSnapshot")
    default SignalSnapshot jsonToSnapshot(String json) {
        return JsonHelper.fromJson(json, SignalSnapshot.class);
    }
}
