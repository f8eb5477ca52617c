package com.kalbot.strategy.evaluator;

import com.kalbot.strategy.model.CycleSignals;
import com.kalbot.strategy.model.MarketSnapshot;
import com.kalbot.strategy.model.RiskSnapshot;
import com.kalbot.strategy.service.ConsensusRiskBook;
import com.kalbot.strategy.service.TradeStateStore;

import java.time.Instant;

/**
 * Inputs of one evaluation pass. {@code risk} is taken from {@code riskBook} once per cycle.
 */
public record EvaluationContext(
        MarketSnapshot snapshot,
        CycleSignals signals,
        ConsensusRiskBook riskBook,
        RiskSnapshot risk,
        TradeStateStore store,
        Instant now
) {
    public String ticker() {
        return snapshot.ticker();
    }
}
