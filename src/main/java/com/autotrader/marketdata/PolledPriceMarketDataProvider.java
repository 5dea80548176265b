package com.autotrader.marketdata;

import com.autotrader.domain.model.Candle;
import com.autotrader.domain.model.MarketSnapshot;
import com.autotrader.exception.MarketDataException;
import com.autotrader.execution.ExecutionAdapter;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Snapshot source for deployments without an exchange connection.
 *
 * <p>Polls {@link ExecutionAdapter#currentPrice} once per call and appends a flat candle (open,
 * high, low and close all equal to the polled price) to a bounded series, so indicators warm up
 * over successive cycles from observed prices only.
 */
public class PolledPriceMarketDataProvider implements MarketDataProvider {

    private static final Logger log = LoggerFactory.getLogger(PolledPriceMarketDataProvider.class);

    private final ExecutionAdapter executionAdapter;
    private final int maxCandles;
    private final Clock clock;

    private final Deque<Candle> series = new ArrayDeque<>();

    public PolledPriceMarketDataProvider(ExecutionAdapter executionAdapter, int maxCandles, Clock clock) {
        this.executionAdapter = executionAdapter;
        this.maxCandles = maxCandles;
        this.clock = clock;
    }

    @Override
    public synchronized MarketSnapshot fetchSnapshot(String symbol) {
        BigDecimal price;
        try {
            price = executionAdapter.currentPrice(symbol);
        } catch (RuntimeException e) {
            throw new MarketDataException("Failed to poll price for " + symbol + ": " + e.getMessage(), e);
        }
        if (price == null) {
            throw new MarketDataException("No price available for " + symbol);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        series.addLast(Candle.builder()
                .openTime(now)
                .open(price)
                .high(price)
                .low(price)
                .close(price)
                .volume(BigDecimal.ZERO)
                .build());
        while (series.size() > maxCandles) {
            series.removeFirst();
        }

        log.debug("Polled {} price={} ({} candles buffered)", symbol, price, series.size());
        return MarketSnapshot.builder()
                .symbol(symbol)
                .price(price)
                .recentSeries(List.copyOf(series))
                .timestamp(now)
                .build();
    }
}
