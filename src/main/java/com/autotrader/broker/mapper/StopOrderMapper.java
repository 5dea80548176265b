package com.autotrader.broker.mapper;

import com.autotrader.domain.enums.ExchangeVenue;
import java.math.BigDecimal;

/**
 * Translates a stop price into the order type and parameters a venue expects for a sell-side
 * stop-loss. One mapper is chosen per venue when the live adapter is built.
 */
public interface StopOrderMapper {

    StopOrderRequest toStopOrder(BigDecimal stopPrice);

    static StopOrderMapper forVenue(ExchangeVenue venue) {
        return switch (venue) {
            case OKX -> new OkxStopOrderMapper();
            case BINANCE, BINANCE_US -> new BinanceStopOrderMapper();
        };
    }
}
