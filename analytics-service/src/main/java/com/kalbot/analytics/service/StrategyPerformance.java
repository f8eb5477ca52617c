package com.kalbot.analytics.service;

import java.math.BigDecimal;

/**
 * Settled-trade performance of one journal strategy label. Rates are percentages.
 */
public record StrategyPerformance(
    String strategy,
    int wins,
    int losses,
    int totalTrades,
    double winRatePct,
    BigDecimal totalProfitUsd,
    BigDecimal totalStakedUsd,
    double roiPct,
    BigDecimal avgProfitPerTradeUsd
) {
}
