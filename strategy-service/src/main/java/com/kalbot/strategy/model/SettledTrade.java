package com.kalbot.strategy.model;

import com.kalbot.domain.Side;

import java.math.BigDecimal;
import java.time.Instant;

public record SettledTrade(
        Position position,
        Outcome outcome,
        BigDecimal payout,
        BigDecimal grossProfit,
        BigDecimal fee,
        BigDecimal netProfit,
        Side settledSide,
        Instant settledAt
) {
    public StrategyId strategy() {
        return position.strategy();
    }

    public String ticker() {
        return position.ticker();
    }

    public boolean win() {
        return netProfit.signum() > 0;
    }
}
