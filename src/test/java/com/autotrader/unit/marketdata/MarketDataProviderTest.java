package com.autotrader.unit.marketdata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.autotrader.broker.ExchangeClient;
import com.autotrader.broker.Ticker;
import com.autotrader.domain.model.Candle;
import com.autotrader.domain.model.MarketSnapshot;
import com.autotrader.exception.ExecutionException;
import com.autotrader.exception.MarketDataException;
import com.autotrader.execution.ExecutionAdapter;
import com.autotrader.marketdata.ExchangeMarketDataProvider;
import com.autotrader.marketdata.PolledPriceMarketDataProvider;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for the exchange-backed and polled-price market data providers.
 */
@ExtendWith(MockitoExtension.class)
class MarketDataProviderTest {

    private static final String SYMBOL = "BTC/USDT";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private ExchangeClient exchangeClient;

    @Mock
    private ExecutionAdapter executionAdapter;

    @Nested
    @DisplayName("ExchangeMarketDataProvider")
    class Exchange {

        @Test
        @DisplayName("Combines ticker price with OHLCV candles")
        void combines() {
            Candle candle = Candle.builder()
                    .openTime(LocalDateTime.of(2024, 3, 15, 9, 0))
                    .open(new BigDecimal("49900"))
                    .high(new BigDecimal("50100"))
                    .low(new BigDecimal("49800"))
                    .close(new BigDecimal("50000"))
                    .volume(new BigDecimal("12.5"))
                    .build();
            when(exchangeClient.fetchTicker(SYMBOL))
                    .thenReturn(Ticker.builder().symbol(SYMBOL).last(new BigDecimal("50050")).build());
            when(exchangeClient.fetchOhlcv(SYMBOL, "1h", 100)).thenReturn(List.of(candle));

            MarketSnapshot snapshot =
                    new ExchangeMarketDataProvider(exchangeClient, "1h", 100, CLOCK).fetchSnapshot(SYMBOL);

            assertThat(snapshot.getPrice()).isEqualByComparingTo("50050");
            assertThat(snapshot.getRecentSeries()).containsExactly(candle);
            assertThat(snapshot.getTimestamp()).isEqualTo(LocalDateTime.of(2024, 3, 15, 10, 0));
        }

        @Test
        @DisplayName("Exchange failure becomes a MarketDataException")
        void failureWrapped() {
            when(exchangeClient.fetchTicker(SYMBOL)).thenThrow(new IllegalStateException("timeout"));

            assertThatThrownBy(() -> new ExchangeMarketDataProvider(exchangeClient, "1h", 100, CLOCK)
                            .fetchSnapshot(SYMBOL))
                    .isInstanceOf(MarketDataException.class)
                    .hasMessageContaining("timeout");
        }

        @Test
        @DisplayName("Missing last price is rejected")
        void missingPrice() {
            when(exchangeClient.fetchTicker(SYMBOL)).thenReturn(Ticker.builder().symbol(SYMBOL).build());
            when(exchangeClient.fetchOhlcv(SYMBOL, "1h", 100)).thenReturn(List.of());

            assertThatThrownBy(() -> new ExchangeMarketDataProvider(exchangeClient, "1h", 100, CLOCK)
                            .fetchSnapshot(SYMBOL))
                    .isInstanceOf(MarketDataException.class);
        }
    }

    @Nested
    @DisplayName("PolledPriceMarketDataProvider")
    class Polled {

        @Test
        @DisplayName("Each poll appends one flat candle at the polled price")
        void appendsCandles() {
            when(executionAdapter.currentPrice(SYMBOL))
                    .thenReturn(new BigDecimal("50000"), new BigDecimal("50500"));
            PolledPriceMarketDataProvider provider = new PolledPriceMarketDataProvider(executionAdapter, 10, CLOCK);

            provider.fetchSnapshot(SYMBOL);
            MarketSnapshot second = provider.fetchSnapshot(SYMBOL);

            assertThat(second.getPrice()).isEqualByComparingTo("50500");
            assertThat(second.getRecentSeries()).hasSize(2);
            Candle last = second.getRecentSeries().get(1);
            assertThat(last.getHigh()).isEqualByComparingTo(last.getLow());
            assertThat(last.getVolume()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Series is bounded to the configured size")
        void bounded() {
            when(executionAdapter.currentPrice(SYMBOL)).thenReturn(new BigDecimal("50000"));
            PolledPriceMarketDataProvider provider = new PolledPriceMarketDataProvider(executionAdapter, 3, CLOCK);

            MarketSnapshot snapshot = null;
            for (int i = 0; i < 5; i++) {
                snapshot = provider.fetchSnapshot(SYMBOL);
            }

            assertThat(snapshot.getRecentSeries()).hasSize(3);
        }

        @Test
        @DisplayName("Adapter failure becomes a MarketDataException")
        void failureWrapped() {
            when(executionAdapter.currentPrice(SYMBOL)).thenThrow(new ExecutionException("down"));

            assertThatThrownBy(() -> new PolledPriceMarketDataProvider(executionAdapter, 3, CLOCK)
                            .fetchSnapshot(SYMBOL))
                    .isInstanceOf(MarketDataException.class)
                    .hasCauseInstanceOf(ExecutionException.class);
        }
    }
}
