package com.autotrader.broker.mapper;

import java.util.Map;
import lombok.Value;

/** Venue-specific order type and parameters for a stop-loss order. */
@Value
public class StopOrderRequest {

    String orderType;
    Map<String, Object> params;

    public StopOrderRequest(String orderType, Map<String, Object> params) {
        this.orderType = orderType;
        this.params = Map.copyOf(params);
    }
}
