package com.kalbot.strategy.evaluator;

import com.kalbot.strategy.model.StrategyId;

public interface StrategyEvaluator {

    StrategyId strategy();

    /**
     * Called only when the strategy has no existence record for the ticker and the market is open.
     * Must not throw for bad market data; invalid prices are a WAIT.
     */
    EntryDecision evaluate(EvaluationContext context);
}
