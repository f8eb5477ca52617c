package com.kalbot.strategy.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record CycleStats(
        Instant at,
        String ticker,
        long secondsToClose,
        BigDecimal yesAsk,
        BigDecimal noAsk,
        BigDecimal btcPrice,
        List<Position> opened,
        List<SettledTrade> settled,
        int openPositions,
        BigDecimal consensusBankroll,
        Map<StrategyId, StrategyStats> stats
) {
}
