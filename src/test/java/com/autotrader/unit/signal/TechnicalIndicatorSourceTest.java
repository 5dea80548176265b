package com.autotrader.unit.signal;

import static org.assertj.core.api.Assertions.assertThat;

import com.autotrader.domain.enums.SignalDirection;
import com.autotrader.domain.model.Candle;
import com.autotrader.domain.model.MarketSnapshot;
import com.autotrader.domain.model.Signal;
import com.autotrader.signal.impl.TechnicalIndicatorSource;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TechnicalIndicatorSource using deterministic linear price series.
 */
class TechnicalIndicatorSourceTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 0, 0);

    private TechnicalIndicatorSource source;

    @BeforeEach
    void setUp() {
        source = new TechnicalIndicatorSource();
    }

    @Nested
    @DisplayName("Trending series")
    class TrendingSeries {

        @Test
        @DisplayName("Steadily rising closes vote BUY 45 (MA and MACD bullish outweigh overbought RSI)")
        void risingSeries() {
            Signal signal = source.evaluate(snapshot(linear(60, 100, 1)));

            assertThat(signal.getDirection()).isEqualTo(SignalDirection.BUY);
            assertThat(signal.getConfidence()).isEqualByComparingTo("45");
            assertThat(signal.getRationale())
                    .contains("RSI overbought")
                    .contains("MA bullish crossover")
                    .contains("MACD bullish");
        }

        @Test
        @DisplayName("Steadily falling closes vote SELL 45")
        void fallingSeries() {
            Signal signal = source.evaluate(snapshot(linear(60, 200, -1)));

            assertThat(signal.getDirection()).isEqualTo(SignalDirection.SELL);
            assertThat(signal.getConfidence()).isEqualByComparingTo("45");
            assertThat(signal.getRationale()).contains("RSI oversold").contains("MA bearish crossover");
        }
    }

    @Nested
    @DisplayName("Insufficient data")
    class InsufficientData {

        @Test
        @DisplayName("Fewer than 50 candles gives HOLD 0")
        void tooFewCandles() {
            Signal signal = source.evaluate(snapshot(linear(49, 100, 1)));

            assertThat(signal.getDirection()).isEqualTo(SignalDirection.HOLD);
            assertThat(signal.getConfidence()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Duplicate candle times are dropped before counting")
        void duplicateTimesDropped() {
            List<Candle> candles = new ArrayList<>(linear(40, 100, 1));
            for (int i = 0; i < 20; i++) {
                candles.add(candle(START, new BigDecimal("150")));
            }

            Signal signal = source.evaluate(snapshot(candles));

            assertThat(signal.getDirection()).isEqualTo(SignalDirection.HOLD);
            assertThat(signal.getConfidence()).isEqualByComparingTo("0");
        }
    }

    @Test
    @DisplayName("Default weight is 0.3 under its stable name")
    void defaults() {
        assertThat(source.name()).isEqualTo(TechnicalIndicatorSource.NAME);
        assertThat(source.defaultWeight()).isEqualByComparingTo("0.3");
    }

    private static List<Candle> linear(int count, int start, int step) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(candle(START.plusHours(i), BigDecimal.valueOf(start + (long) i * step)));
        }
        return candles;
    }

    private static Candle candle(LocalDateTime openTime, BigDecimal close) {
        return Candle.builder()
                .openTime(openTime)
                .open(close)
                .high(close)
                .low(close)
                .close(close)
                .volume(BigDecimal.ONE)
                .build();
    }

    private static MarketSnapshot snapshot(List<Candle> candles) {
        return MarketSnapshot.builder()
                .symbol("BTC/USDT")
                .price(candles.get(candles.size() - 1).getClose())
                .recentSeries(candles)
                .timestamp(START)
                .build();
    }
}
