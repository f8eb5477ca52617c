package com.kalbot.strategy;

import com.kalbot.domain.Side;
import com.kalbot.strategy.model.MarketSnapshot;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.service.BankrollLedger;
import com.kalbot.strategy.service.ConsensusRiskBook;
import com.kalbot.strategy.service.RollingPerformanceTracker;

import java.math.BigDecimal;
import java.time.Instant;

public final class Fixtures {

    public static final Instant NOW = Instant.parse("2025-01-06T12:00:00Z");

    private Fixtures() {
    }

    public static MarketSnapshot snapshot(String ticker, String yesAsk, String noAsk) {
        return new MarketSnapshot(ticker, new BigDecimal(yesAsk), new BigDecimal(noAsk), false,
                null, null, NOW.plusSeconds(600), NOW);
    }

    public static MarketSnapshot rolledOver(String ticker, String yesAsk, String noAsk, String previousTicker, Side previousResult) {
        return new MarketSnapshot(ticker, new BigDecimal(yesAsk), new BigDecimal(noAsk), false,
                previousTicker, previousResult, NOW.plusSeconds(600), NOW);
    }

    public static ConsensusRiskBook riskBook(String bankroll, double feePct) {
        return new ConsensusRiskBook(
                new BankrollLedger(new BigDecimal(bankroll), 0.01, 3.0, 8.0),
                new RollingPerformanceTracker(30),
                0.01, 0.02, feePct);
    }

    public static Position position(StrategyId strategy, String ticker, Side side, String stake, String price,
                                    String contracts, String fee) {
        return new Position(strategy, ticker, side, new BigDecimal(stake), new BigDecimal(price),
                new BigDecimal(contracts), new BigDecimal(fee), NOW, null, null);
    }
}
