package com.kalbot.strategy.service;

import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.model.StrategyStats;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running per-strategy totals: staked, realized profit, wins (net > 0), losses and pending trades.
 * The hedge leg is counted under ARBITRAGE.
 */
public class StrategyScoreboard {

    private final Map<StrategyId, StrategyStats> stats = new EnumMap<>(StrategyId.class);

    public StrategyScoreboard() {
        for (StrategyId id : StrategyId.values()) {
            if (id.statsGroup() == id) {
                stats.put(id, StrategyStats.empty(id));
            }
        }
    }

    public synchronized void recordOpened(StrategyId strategy, BigDecimal stake) {
        stats.computeIfPresent(strategy.statsGroup(), (id, s) -> new StrategyStats(
                id, s.staked().add(stake), s.profit(), s.wins(), s.losses(), s.pending() + 1));
    }

    public synchronized void recordSettled(StrategyId strategy, BigDecimal netProfit) {
        boolean win = netProfit.signum() > 0;
        stats.computeIfPresent(strategy.statsGroup(), (id, s) -> new StrategyStats(
                id,
                s.staked(),
                s.profit().add(netProfit),
                s.wins() + (win ? 1 : 0),
                s.losses() + (win ? 0 : 1),
                Math.max(0, s.pending() - 1)));
    }

    public synchronized StrategyStats get(StrategyId strategy) {
        return stats.get(strategy.statsGroup());
    }

    /**
     * Copy of all buckets in catalog order.
     */
    public synchronized Map<StrategyId, StrategyStats> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(stats));
    }

    public synchronized StrategyStats totals() {
        BigDecimal staked = BigDecimal.ZERO;
        BigDecimal profit = BigDecimal.ZERO;
        int wins = 0;
        int losses = 0;
        int pending = 0;
        for (StrategyStats s : stats.values()) {
            staked = staked.add(s.staked());
            profit = profit.add(s.profit());
            wins += s.wins();
            losses += s.losses();
            pending += s.pending();
        }
        return new StrategyStats(null, staked, profit, wins, losses, pending);
    }
}
