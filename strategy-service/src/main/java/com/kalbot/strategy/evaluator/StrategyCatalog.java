package com.kalbot.strategy.evaluator;

import com.kalbot.config.KalbotProperties;
import com.kalbot.strategy.model.StrategyId;

import java.util.List;

/**
 * Descriptor table of all strategies in evaluation order.
 */
public final class StrategyCatalog {

    private final List<StrategyDescriptor> descriptors;

    private StrategyCatalog(List<StrategyDescriptor> descriptors) {
        this.descriptors = List.copyOf(descriptors);
    }

    public static StrategyCatalog from(KalbotProperties properties) {
        KalbotProperties.Strategy s = properties.strategy();
        KalbotProperties.Consensus c = properties.consensus();
        return new StrategyCatalog(List.of(
                new StrategyDescriptor(
                        "Buy same side as previous market result",
                        new FixedStakeEvaluator(StrategyId.PREVIOUS,
                                ctx -> ctx.signals().previous(), true, null, s.stakeUsd())),
                new StrategyDescriptor(
                        "Buy BTC direction over the last %ds".formatted(s.momentumWindowSeconds()),
                        new FixedStakeEvaluator(StrategyId.MOMENTUM,
                                ctx -> ctx.signals().latchedMomentum(), true, null, s.stakeUsd())),
                new StrategyDescriptor(
                        "Buy BTC direction over the last %ds".formatted(s.momentum15WindowSeconds()),
                        new FixedStakeEvaluator(StrategyId.MOMENTUM_15,
                                ctx -> ctx.signals().longMomentum(), true, null, s.stakeUsd())),
                new StrategyDescriptor(
                        "Buy when PREVIOUS and MOMENTUM agree, ask <= $%s, bankroll sized".formatted(c.maxPrice().toPlainString()),
                        new ConsensusEvaluator(StrategyId.CONSENSUS, c.maxPrice(), true)),
                new StrategyDescriptor(
                        "Wait for PREVIOUS side at ask <= $%s".formatted(s.dealMaxPrice().toPlainString()),
                        new FixedStakeEvaluator(StrategyId.PREVIOUS_2,
                                ctx -> ctx.signals().previous(), true, s.dealMaxPrice(), s.stakeUsd())),
                new StrategyDescriptor(
                        "Wait for CONSENSUS side at ask <= $%s, bankroll sized".formatted(s.dealMaxPrice().toPlainString()),
                        new ConsensusEvaluator(StrategyId.CONSENSUS_2, s.dealMaxPrice(), false)),
                new StrategyDescriptor(
                        "Buy cheaper side first",
                        new ArbitrageEntryEvaluator(s.stakeUsd())),
                new StrategyDescriptor(
                        "Hedge opposite side when yes + no < $1, bet < $%s".formatted(s.arbitrageMaxBetUsd().toPlainString()),
                        new ArbitrageHedgeEvaluator(s.arbitrageMaxBetUsd()))
        ));
    }

    public List<StrategyDescriptor> descriptors() {
        return descriptors;
    }

    public List<StrategyEvaluator> evaluators() {
        return descriptors.stream().map(StrategyDescriptor::evaluator).toList();
    }

    public record StrategyDescriptor(String description, StrategyEvaluator evaluator) {
        public StrategyId strategy() {
            return evaluator.strategy();
        }
    }
}
