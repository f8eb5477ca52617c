package com.kalbot.strategy.evaluator;

import com.kalbot.domain.Side;
import com.kalbot.strategy.model.ArbitragePosition;
import com.kalbot.strategy.model.MarketSnapshot;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.service.PositionSizer;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

/**
 * Second arbitrage leg: buys the opposite side once {@code 1 - (firstPrice + oppositeAsk) > 0},
 * keeping the hedge notional strictly below {@code maxBet}.
 */
public class ArbitrageHedgeEvaluator implements StrategyEvaluator {

    private final BigDecimal maxBet;

    public ArbitrageHedgeEvaluator(BigDecimal maxBet) {
        this.maxBet = maxBet;
    }

    @Override
    public StrategyId strategy() {
        return StrategyId.ARBITRAGE_HEDGE;
    }

    @Override
    public EntryDecision evaluate(EvaluationContext context) {
        MarketSnapshot snapshot = context.snapshot();
        Optional<ArbitragePosition> leg = context.store().arbitrage(snapshot.ticker());
        if (leg.isEmpty() || leg.get().hedged()) {
            return EntryDecision.waitFor("no unhedged first leg");
        }
        ArbitragePosition first = leg.get();
        Side opposite = first.firstSide().opposite();
        BigDecimal oppositeAsk = snapshot.askFor(opposite);
        if (oppositeAsk.signum() <= 0) {
            return EntryDecision.waitFor("invalid ask %s".formatted(oppositeAsk.toPlainString()));
        }
        BigDecimal edge = BigDecimal.ONE.subtract(first.firstPrice().add(oppositeAsk));
        if (edge.signum() <= 0) {
            return EntryDecision.waitFor("no edge (%s)".formatted(edge.toPlainString()));
        }
        long contracts = PositionSizer.hedgeContracts(first.firstContracts(), maxBet, oppositeAsk);
        if (contracts < 1) {
            return EntryDecision.waitFor("hedge size below one contract");
        }
        BigDecimal stake = oppositeAsk.multiply(BigDecimal.valueOf(contracts)).setScale(4, RoundingMode.HALF_UP);
        return EntryDecision.enter(new Position(
                StrategyId.ARBITRAGE_HEDGE,
                snapshot.ticker(),
                opposite,
                stake,
                oppositeAsk,
                BigDecimal.valueOf(contracts),
                BigDecimal.ZERO,
                context.now(),
                null,
                "hedge_of=%s edge=%s".formatted(first.firstSide().label(), edge.setScale(4, RoundingMode.HALF_UP).toPlainString())
        ));
    }
}
