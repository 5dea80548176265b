package com.autotrader.signal.impl;

import com.autotrader.domain.enums.SignalDirection;
import com.autotrader.domain.model.Candle;
import com.autotrader.domain.model.MarketSnapshot;
import com.autotrader.domain.model.Signal;
import com.autotrader.signal.AnalysisSource;
import java.math.BigDecimal;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.ta4j.core.BarSeries;
import org.ta4j.core.BaseBarSeriesBuilder;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.MACDIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;
import org.ta4j.core.num.Num;

/**
 * Votes on direction from three classic indicators over the snapshot's candle closes.
 *
 * <p>Votes:
 * <ul>
 *   <li><b>RSI(14):</b> below 30 is BUY 30, above 70 is SELL 30</li>
 *   <li><b>SMA(20) vs SMA(50):</b> short above long is BUY 25, below is SELL 25</li>
 *   <li><b>MACD(12,26) vs EMA(9) signal line:</b> above is BUY 20, below is SELL 20</li>
 * </ul>
 *
 * <p>The direction with the larger vote total wins and its total is the confidence. Equal totals
 * give HOLD at that total. Needs at least 50 candles.
 */
@Component
public class TechnicalIndicatorSource implements AnalysisSource {

    private static final Logger log = LoggerFactory.getLogger(TechnicalIndicatorSource.class);

    public static final String NAME = "technical-indicators";

    static final int RSI_PERIOD = 14;
    static final int MA_SHORT = 20;
    static final int MA_LONG = 50;
    static final int MACD_SHORT = 12;
    static final int MACD_LONG = 26;
    static final int MACD_SIGNAL = 9;

    private static final double RSI_OVERSOLD = 30;
    private static final double RSI_OVERBOUGHT = 70;
    private static final int RSI_VOTE = 30;
    private static final int MA_VOTE = 25;
    private static final int MACD_VOTE = 20;

    private static final BigDecimal DEFAULT_WEIGHT = new BigDecimal("0.3");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BigDecimal defaultWeight() {
        return DEFAULT_WEIGHT;
    }

    @Override
    public Signal evaluate(MarketSnapshot snapshot) {
        List<Candle> candles = snapshot.getRecentSeries();
        if (candles == null || candles.size() < MA_LONG) {
            return Signal.hold(0, "insufficient data for technical analysis");
        }

        BarSeries series = toBarSeries(snapshot.getSymbol(), candles);
        if (series.getBarCount() < MA_LONG) {
            return Signal.hold(0, "insufficient data for technical analysis");
        }
        int last = series.getEndIndex();

        ClosePriceIndicator close = new ClosePriceIndicator(series);
        Num rsi = new RSIIndicator(close, RSI_PERIOD).getValue(last);
        Num smaShort = new SMAIndicator(close, MA_SHORT).getValue(last);
        Num smaLong = new SMAIndicator(close, MA_LONG).getValue(last);
        MACDIndicator macdIndicator = new MACDIndicator(close, MACD_SHORT, MACD_LONG);
        Num macd = macdIndicator.getValue(last);
        Num macdSignal = new EMAIndicator(macdIndicator, MACD_SIGNAL).getValue(last);

        int buyVotes = 0;
        int sellVotes = 0;
        List<String> reasons = new ArrayList<>();

        double rsiValue = rsi.doubleValue();
        if (rsiValue < RSI_OVERSOLD) {
            buyVotes += RSI_VOTE;
            reasons.add(String.format("RSI oversold at %.1f", rsiValue));
        } else if (rsiValue > RSI_OVERBOUGHT) {
            sellVotes += RSI_VOTE;
            reasons.add(String.format("RSI overbought at %.1f", rsiValue));
        }

        if (smaShort.isGreaterThan(smaLong)) {
            buyVotes += MA_VOTE;
            reasons.add("MA bullish crossover");
        } else if (smaShort.isLessThan(smaLong)) {
            sellVotes += MA_VOTE;
            reasons.add("MA bearish crossover");
        }

        if (macd.isGreaterThan(macdSignal)) {
            buyVotes += MACD_VOTE;
            reasons.add("MACD bullish");
        } else if (macd.isLessThan(macdSignal)) {
            sellVotes += MACD_VOTE;
            reasons.add("MACD bearish");
        }

        if (reasons.isEmpty()) {
            return Signal.hold(50, "no clear technical signals");
        }

        String rationale = String.join("; ", reasons);
        log.debug("{} votes for {}: buy={} sell={} ({})", NAME, snapshot.getSymbol(), buyVotes, sellVotes, rationale);

        if (buyVotes > sellVotes) {
            return Signal.of(SignalDirection.BUY, buyVotes, rationale);
        }
        if (sellVotes > buyVotes) {
            return Signal.of(SignalDirection.SELL, sellVotes, rationale);
        }
        return Signal.of(SignalDirection.HOLD, buyVotes, rationale + "; votes tied");
    }

    /**
     * Converts candles to a ta4j series. Candles whose open time does not advance past the
     * previous one are skipped since ta4j requires strictly increasing bar end times.
     */
    static BarSeries toBarSeries(String symbol, List<Candle> candles) {
        BarSeries series = new BaseBarSeriesBuilder().withName(symbol).build();
        ZonedDateTime previous = null;
        for (Candle candle : candles) {
            ZonedDateTime endTime = candle.getOpenTime().atZone(ZoneOffset.UTC);
            if (previous != null && !endTime.isAfter(previous)) {
                continue;
            }
            series.addBar(
                    endTime, candle.getOpen(), candle.getHigh(), candle.getLow(), candle.getClose(), candle.getVolume());
            previous = endTime;
        }
        return series;
    }
}
