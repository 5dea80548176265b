package com.autotrader.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;

import com.autotrader.domain.enums.OrderSide;
import com.autotrader.domain.enums.OrderStatus;
import com.autotrader.domain.enums.OrderType;
import com.autotrader.domain.model.OrderResult;
import com.autotrader.simulator.PaperExecutionAdapter;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PaperExecutionAdapter: deterministic fills, sequential ids and price following.
 */
class PaperExecutionAdapterTest {

    private static final String SYMBOL = "BTC/USDT";

    private PaperExecutionAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new PaperExecutionAdapter(
                null, Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Market orders")
    class MarketOrders {

        @Test
        @DisplayName("Buy fills in full at the default 50000 reference price")
        void buyFills() {
            OrderResult order = adapter.buy(SYMBOL, new BigDecimal("0.01"));

            assertThat(order.getId()).isEqualTo("SIM-000001");
            assertThat(order.getSide()).isEqualTo(OrderSide.BUY);
            assertThat(order.getType()).isEqualTo(OrderType.MARKET);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
            assertThat(order.getFillPrice()).isEqualByComparingTo("50000");
            assertThat(order.isSimulated()).isTrue();
        }

        @Test
        @DisplayName("Ids are sequential across order types")
        void sequentialIds() {
            adapter.buy(SYMBOL, BigDecimal.ONE);
            adapter.placeStopLoss(SYMBOL, BigDecimal.ONE, new BigDecimal("47500"));
            OrderResult sell = adapter.sell(SYMBOL, BigDecimal.ONE);

            assertThat(sell.getId()).isEqualTo("SIM-000003");
            assertThat(adapter.getPlacedOrders()).extracting(OrderResult::getId)
                    .containsExactly("SIM-000001", "SIM-000002", "SIM-000003");
        }

        @Test
        @DisplayName("Same call sequence on a fresh adapter gives identical results")
        void deterministic() {
            PaperExecutionAdapter other = new PaperExecutionAdapter(
                    null, Clock.fixed(Instant.parse("2024-03-15T10:00:00Z"), ZoneOffset.UTC));

            assertThat(adapter.buy(SYMBOL, BigDecimal.ONE)).isEqualTo(other.buy(SYMBOL, BigDecimal.ONE));
        }
    }

    @Nested
    @DisplayName("Stop-loss and pricing")
    class StopLossAndPricing {

        @Test
        @DisplayName("Stop-loss is accepted OPEN with its stop price")
        void stopLossOpen() {
            OrderResult order = adapter.placeStopLoss(SYMBOL, new BigDecimal("0.01"), new BigDecimal("47500"));

            assertThat(order.getType()).isEqualTo(OrderType.STOP_LOSS);
            assertThat(order.getStatus()).isEqualTo(OrderStatus.OPEN);
            assertThat(order.getStopPrice()).isEqualByComparingTo("47500");
            assertThat(order.getFillPrice()).isNull();
        }

        @Test
        @DisplayName("Observed market price becomes the fill price")
        void followsMarket() {
            adapter.observePrice(SYMBOL, new BigDecimal("52000"));

            assertThat(adapter.currentPrice(SYMBOL)).isEqualByComparingTo("52000");
            assertThat(adapter.sell(SYMBOL, BigDecimal.ONE).getFillPrice()).isEqualByComparingTo("52000");
        }

        @Test
        @DisplayName("Reference price can be moved explicitly")
        void setReferencePrice() {
            adapter.setReferencePrice(new BigDecimal("45000"));

            assertThat(adapter.buy(SYMBOL, BigDecimal.ONE).getFillPrice()).isEqualByComparingTo("45000");
        }
    }
}
