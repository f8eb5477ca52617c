package com.kalbot.strategy.model;

import com.kalbot.domain.Side;

import java.math.BigDecimal;

/**
 * First-leg state of the arbitrage strategy for one ticker. Once hedged, never hedged again.
 */
public record ArbitragePosition(
        String ticker,
        Side firstSide,
        BigDecimal firstPrice,
        BigDecimal firstContracts,
        boolean hedged
) {
    public ArbitragePosition markHedged() {
        return new ArbitragePosition(ticker, firstSide, firstPrice, firstContracts, true);
    }
}
