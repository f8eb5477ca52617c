package com.kalbot.strategy.evaluator;

import com.kalbot.domain.Side;
import com.kalbot.strategy.model.MarketSnapshot;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.service.PositionSizer;
import com.kalbot.strategy.signal.SignalSources;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * First arbitrage leg: fixed stake on the cheaper side as soon as both asks are valid.
 */
public class ArbitrageEntryEvaluator implements StrategyEvaluator {

    private final BigDecimal stake;

    public ArbitrageEntryEvaluator(BigDecimal stake) {
        this.stake = stake;
    }

    @Override
    public StrategyId strategy() {
        return StrategyId.ARBITRAGE;
    }

    @Override
    public EntryDecision evaluate(EvaluationContext context) {
        MarketSnapshot snapshot = context.snapshot();
        Optional<Side> first = SignalSources.arbitrageFirstSide(snapshot.yesAsk(), snapshot.noAsk());
        if (first.isEmpty()) {
            return EntryDecision.waitFor("invalid asks yes=%s no=%s".formatted(
                    snapshot.yesAsk().toPlainString(), snapshot.noAsk().toPlainString()));
        }
        BigDecimal price = snapshot.askFor(first.get());
        return EntryDecision.enter(new Position(
                StrategyId.ARBITRAGE,
                snapshot.ticker(),
                first.get(),
                stake,
                price,
                PositionSizer.fixedStakeContracts(stake, price),
                BigDecimal.ZERO,
                context.now(),
                null,
                "first_leg"
        ));
    }
}
