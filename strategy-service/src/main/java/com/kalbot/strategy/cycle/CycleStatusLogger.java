package com.kalbot.strategy.cycle;

import com.kalbot.strategy.model.CycleStats;
import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.model.StrategyStats;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Logs one status line per cycle and the final statistics table.
 */
@Slf4j
public class CycleStatusLogger implements TradeEventSink {

    @Override
    public void onCycleStats(CycleStats stats) {
        if (stats.ticker() == null) {
            log.info("No open market | BTC ${} | open={}", plain(stats.btcPrice()), stats.openPositions());
            return;
        }
        StringJoiner pnl = new StringJoiner(" ");
        for (Map.Entry<StrategyId, StrategyStats> e : stats.stats().entrySet()) {
            pnl.add("%s:%s".formatted(shortName(e.getKey()), signed(e.getValue().profit())));
        }
        log.info("{} | {}s left | yes=${} no=${} | BTC ${} | {} | bankroll ${} | open={}",
                stats.ticker(),
                stats.secondsToClose(),
                plain(stats.yesAsk()),
                plain(stats.noAsk()),
                plain(stats.btcPrice()),
                pnl,
                plain(stats.consensusBankroll()),
                stats.openPositions());
    }

    public void logFinalStats(Map<StrategyId, StrategyStats> stats, StrategyStats totals) {
        log.info("Final statistics:");
        for (StrategyStats s : stats.values()) {
            log.info("  {} staked=${} profit=${} wins={} losses={} pending={}",
                    s.strategy(), plain(s.staked()), signed(s.profit()), s.wins(), s.losses(), s.pending());
        }
        log.info("  TOTAL staked=${} profit=${} wins={} losses={} pending={}",
                plain(totals.staked()), signed(totals.profit()), totals.wins(), totals.losses(), totals.pending());
    }

    private static String shortName(StrategyId id) {
        return switch (id) {
            case PREVIOUS -> "P";
            case MOMENTUM -> "M";
            case MOMENTUM_15 -> "M15";
            case CONSENSUS -> "C";
            case PREVIOUS_2 -> "P2";
            case CONSENSUS_2 -> "C2";
            case ARBITRAGE, ARBITRAGE_HEDGE -> "A";
        };
    }

    private static String plain(BigDecimal value) {
        return value == null ? "-" : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String signed(BigDecimal value) {
        if (value == null) return "-";
        String s = value.setScale(2, RoundingMode.HALF_UP).toPlainString();
        return value.signum() >= 0 ? "+" + s : s;
    }
}
