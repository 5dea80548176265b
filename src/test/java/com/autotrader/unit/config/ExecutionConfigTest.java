package com.autotrader.unit.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.autotrader.broker.ExchangeClient;
import com.autotrader.broker.LiveExecutionAdapter;
import com.autotrader.config.ExecutionConfig;
import com.autotrader.config.TradingProperties;
import com.autotrader.domain.enums.TradingMode;
import com.autotrader.execution.ExecutionAdapter;
import com.autotrader.marketdata.ExchangeMarketDataProvider;
import com.autotrader.marketdata.PolledPriceMarketDataProvider;
import com.autotrader.simulator.PaperExecutionAdapter;
import java.time.Clock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class ExecutionConfigTest {

    @Mock
    private ObjectProvider<ExchangeClient> exchangeClientProvider;

    @Mock
    private ExchangeClient exchangeClient;

    private final ExecutionConfig executionConfig = new ExecutionConfig();
    private final TradingProperties tradingProperties = new TradingProperties();
    private final Clock clock = Clock.systemUTC();

    @Test
    @DisplayName("PAPER mode uses simulated fills")
    void paperMode() {
        ExecutionAdapter adapter = executionConfig.executionAdapter(tradingProperties, exchangeClientProvider, clock);

        assertThat(adapter).isInstanceOf(PaperExecutionAdapter.class);
        assertThat(adapter.isSimulated()).isTrue();
    }

    @Test
    @DisplayName("LIVE mode without an exchange client refuses to start")
    void liveWithoutClient() {
        tradingProperties.setTradingMode(TradingMode.LIVE);

        assertThatThrownBy(() -> executionConfig.executionAdapter(tradingProperties, exchangeClientProvider, clock))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ExchangeClient");
    }

    @Test
    @DisplayName("LIVE mode with an exchange client sends real orders")
    void liveWithClient() {
        tradingProperties.setTradingMode(TradingMode.LIVE);
        when(exchangeClientProvider.getIfAvailable()).thenReturn(exchangeClient);

        ExecutionAdapter adapter = executionConfig.executionAdapter(tradingProperties, exchangeClientProvider, clock);

        assertThat(adapter).isInstanceOf(LiveExecutionAdapter.class);
    }

    @Test
    @DisplayName("Market data falls back to polled prices without an exchange client")
    void marketDataSelection() {
        ExecutionAdapter paper = new PaperExecutionAdapter(null, clock);

        assertThat(executionConfig.marketDataProvider(tradingProperties, exchangeClientProvider, paper, clock))
                .isInstanceOf(PolledPriceMarketDataProvider.class);

        when(exchangeClientProvider.getIfAvailable()).thenReturn(exchangeClient);
        assertThat(executionConfig.marketDataProvider(tradingProperties, exchangeClientProvider, paper, clock))
                .isInstanceOf(ExchangeMarketDataProvider.class);
    }
}
