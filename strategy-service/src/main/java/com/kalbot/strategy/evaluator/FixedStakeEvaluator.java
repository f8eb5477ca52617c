package com.kalbot.strategy.evaluator;

import com.kalbot.domain.Side;
import com.kalbot.strategy.model.MarketSnapshot;
import com.kalbot.strategy.model.Position;
import com.kalbot.strategy.model.Signal;
import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.service.PositionSizer;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.function.Function;

/**
 * Fee-less fixed-stake entry on the side picked by one signal: PREVIOUS, PREVIOUS_2, MOMENTUM and
 * MOMENTUM_15. Every unmet gate is retried next cycle.
 */
public class FixedStakeEvaluator implements StrategyEvaluator {

    private final StrategyId strategy;
    private final Function<EvaluationContext, Signal> signalSelector;
    private final boolean requiresRollover;
    private final BigDecimal priceCeiling;
    private final BigDecimal stake;

    /**
     * @param priceCeiling highest acceptable ask, or null for none
     */
    public FixedStakeEvaluator(StrategyId strategy,
                               Function<EvaluationContext, Signal> signalSelector,
                               boolean requiresRollover,
                               BigDecimal priceCeiling,
                               BigDecimal stake) {
        this.strategy = strategy;
        this.signalSelector = signalSelector;
        this.requiresRollover = requiresRollover;
        this.priceCeiling = priceCeiling;
        this.stake = stake;
    }

    @Override
    public StrategyId strategy() {
        return strategy;
    }

    @Override
    public EntryDecision evaluate(EvaluationContext context) {
        MarketSnapshot snapshot = context.snapshot();
        if (requiresRollover && !snapshot.rolloverOccurred()) {
            return EntryDecision.waitFor("no rollover observed");
        }
        Signal signal = signalSelector.apply(context);
        Optional<Side> side = signal.vote().side();
        if (side.isEmpty()) {
            return EntryDecision.waitFor("no %s signal".formatted(signal.kind()));
        }
        BigDecimal price = snapshot.askFor(side.get());
        if (price.signum() <= 0) {
            return EntryDecision.waitFor("invalid ask %s".formatted(price.toPlainString()));
        }
        if (priceCeiling != null && price.compareTo(priceCeiling) > 0) {
            return EntryDecision.waitFor("ask %s above %s".formatted(price.toPlainString(), priceCeiling.toPlainString()));
        }
        BigDecimal contracts = PositionSizer.fixedStakeContracts(stake, price);
        if (contracts.signum() <= 0) {
            return EntryDecision.waitFor("zero contracts");
        }
        return EntryDecision.enter(new Position(
                strategy,
                snapshot.ticker(),
                side.get(),
                stake,
                price,
                contracts,
                BigDecimal.ZERO,
                context.now(),
                snapshot.rolloverPreviousTicker(),
                note(signal)
        ));
    }

    private static String note(Signal signal) {
        return switch (signal.kind()) {
            case PREVIOUS -> signal.vote().label();
            case MOMENTUM_SHORT -> "BTC %+.3f%%".formatted(magnitude(signal));
            case MOMENTUM_LONG -> "BTC15 %+.3f%%".formatted(magnitude(signal));
        };
    }

    private static double magnitude(Signal signal) {
        return signal.magnitudePct() == null ? 0.0 : signal.magnitudePct().doubleValue();
    }
}
