package com.kalbot.analytics.service;

import java.util.List;

public record PerformanceReport(
    String source,
    int tradesLoaded,
    int pendingTrades,
    List<StrategyPerformance> strategies,
    StrategyPerformance totals,
    String bestByWinRate,
    String bestByProfit,
    String bestByRoi
) {
}
