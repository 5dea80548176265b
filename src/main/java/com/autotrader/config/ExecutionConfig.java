package com.autotrader.config;

import com.autotrader.broker.ExchangeClient;
import com.autotrader.broker.LiveExecutionAdapter;
import com.autotrader.execution.ExecutionAdapter;
import com.autotrader.marketdata.ExchangeMarketDataProvider;
import com.autotrader.marketdata.MarketDataProvider;
import com.autotrader.marketdata.PolledPriceMarketDataProvider;
import com.autotrader.simulator.PaperExecutionAdapter;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the execution adapter and market data provider once at startup.
 *
 * <p>{@code autotrader.trading-mode=PAPER} uses the {@link PaperExecutionAdapter};
 * {@code LIVE} uses the {@link LiveExecutionAdapter} and refuses to start without an
 * {@link ExchangeClient} bean. Market data comes from the exchange when a client is present and
 * from polling the execution adapter otherwise.
 */
@Configuration
public class ExecutionConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutionConfig.class);

    @Bean
    public ExecutionAdapter executionAdapter(
            TradingProperties tradingProperties, ObjectProvider<ExchangeClient> exchangeClient, Clock clock) {
        return switch (tradingProperties.getTradingMode()) {
            case PAPER -> {
                log.info(
                        "Trading mode PAPER: simulated fills at reference price {}",
                        tradingProperties.getPaper().getReferencePrice());
                yield new PaperExecutionAdapter(tradingProperties.getPaper().getReferencePrice(), clock);
            }
            case LIVE -> {
                ExchangeClient client = exchangeClient.getIfAvailable();
                if (client == null) {
                    throw new IllegalStateException(
                            "autotrader.trading-mode=LIVE requires an ExchangeClient bean, none is configured");
                }
                log.warn("Trading mode LIVE on {}: orders will be sent to the exchange", tradingProperties.getVenue());
                yield new LiveExecutionAdapter(client, tradingProperties.getVenue(), clock);
            }
        };
    }

    @Bean
    public MarketDataProvider marketDataProvider(
            TradingProperties tradingProperties,
            ObjectProvider<ExchangeClient> exchangeClient,
            ExecutionAdapter executionAdapter,
            Clock clock) {
        TradingProperties.MarketData marketData = tradingProperties.getMarketData();
        ExchangeClient client = exchangeClient.getIfAvailable();
        if (client != null) {
            log.info("Market data from exchange: {} x {} candles", marketData.getTimeframe(), marketData.getCandleLimit());
            return new ExchangeMarketDataProvider(
                    client, marketData.getTimeframe(), marketData.getCandleLimit(), clock);
        }
        log.info("No exchange client configured, building candles from polled prices");
        return new PolledPriceMarketDataProvider(executionAdapter, marketData.getCandleLimit(), clock);
    }
}
