package com.kalbot.strategy.model;

import com.kalbot.domain.Side;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An open simulated trade. {@code feeReserved} is charged at settlement.
 */
public record Position(
        StrategyId strategy,
        String ticker,
        Side side,
        BigDecimal stake,
        BigDecimal price,
        BigDecimal contracts,
        BigDecimal feeReserved,
        Instant openedAt,
        String previousTicker,
        String note
) {
    public Position {
        if (feeReserved == null) feeReserved = BigDecimal.ZERO;
    }

    public TradeKey key() {
        return new TradeKey(strategy, ticker);
    }
}
