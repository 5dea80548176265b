package com.autotrader.marketdata;

import com.autotrader.domain.model.MarketSnapshot;

/**
 * Supplies the engine with one market snapshot per cycle.
 */
public interface MarketDataProvider {

    /**
     * @throws com.autotrader.exception.MarketDataException if no usable snapshot can be produced
     */
    MarketSnapshot fetchSnapshot(String symbol);
}
