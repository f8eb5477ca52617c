package com.kalbot.strategy.model;

import java.math.BigDecimal;

public record StrategyStats(
        StrategyId strategy,
        BigDecimal staked,
        BigDecimal profit,
        int wins,
        int losses,
        int pending
) {
    public static StrategyStats empty(StrategyId strategy) {
        return new StrategyStats(strategy, BigDecimal.ZERO, BigDecimal.ZERO, 0, 0, 0);
    }

    public int settled() {
        return wins + losses;
    }
}
