package com.autotrader.marketdata;

import com.autotrader.broker.ExchangeClient;
import com.autotrader.broker.Ticker;
import com.autotrader.domain.model.Candle;
import com.autotrader.domain.model.MarketSnapshot;
import com.autotrader.exception.MarketDataException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds snapshots from the exchange: the ticker's last price plus the most recent candles at
 * the configured timeframe.
 */
public class ExchangeMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(ExchangeMarketDataProvider.class);

    private final ExchangeClient exchangeClient;
    private final String timeframe;
    private final int candleLimit;
    private final Clock clock;

    public ExchangeMarketDataProvider(ExchangeClient exchangeClient, String timeframe, int candleLimit, Clock clock) {
        this.exchangeClient = exchangeClient;
        this.timeframe = timeframe;
        this.candleLimit = candleLimit;
        this.clock = clock;
    }

    @Override
    public MarketSnapshot fetchSnapshot(String symbol) {
        Ticker ticker;
        List<Candle> candles;
        try {
            ticker = exchangeClient.fetchTicker(symbol);
            candles = exchangeClient.fetchOhlcv(symbol, timeframe, candleLimit);
        } catch (RuntimeException e) {
            throw new MarketDataException("Failed to fetch market data for " + symbol + ": " + e.getMessage(), e);
        }

        if (ticker == null || ticker.getLast() == null) {
            throw new MarketDataException("Exchange returned no last price for " + symbol);
        }
        if (candles == null) {
            candles = List.of();
        }

        log.debug("Fetched {} price={} with {} {} candles", symbol, ticker.getLast(), candles.size(), timeframe);
        return MarketSnapshot.builder()
                .symbol(symbol)
                .price(ticker.getLast())
                .recentSeries(candles)
                .timestamp(ticker.getTimestamp() != null ? ticker.getTimestamp() : LocalDateTime.now(clock))
                .build();
    }
}
