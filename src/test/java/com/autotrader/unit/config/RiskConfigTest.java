package com.autotrader.unit.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.autotrader.config.RiskConfig;
import com.autotrader.risk.RiskLimits;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RiskConfigTest {

    private final RiskConfig riskConfig = new RiskConfig();

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }

    @Test
    @DisplayName("Valid limits build the RiskLimits bean")
    void validLimits() {
        RiskLimits limits = riskConfig.riskLimits(bd("5"), bd("15"), bd("50"), bd("10000"), bd("10"), bd("5"));

        assertThat(limits.getKillSwitchPercent()).isEqualByComparingTo("50");
        assertThat(limits.getStartingCapital()).isEqualByComparingTo("10000");
    }

    @Test
    @DisplayName("Percentage above 100 fails startup")
    void percentOutOfRange() {
        assertThatThrownBy(() -> riskConfig.riskLimits(bd("5"), bd("15"), bd("150"), bd("10000"), bd("10"), bd("5")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kill-switch-percent");
    }

    @Test
    @DisplayName("Zero percentage fails startup")
    void zeroPercent() {
        assertThatThrownBy(() -> riskConfig.riskLimits(bd("0"), bd("15"), bd("50"), bd("10000"), bd("10"), bd("5")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("position-size-percent");
    }

    @Test
    @DisplayName("Non-positive starting capital fails startup")
    void startingCapital() {
        assertThatThrownBy(() -> riskConfig.riskLimits(bd("5"), bd("15"), bd("50"), bd("0"), bd("10"), bd("5")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("starting-capital");
    }
}
