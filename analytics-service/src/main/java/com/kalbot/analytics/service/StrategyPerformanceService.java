package com.kalbot.analytics.service;

import com.kalbot.analytics.repo.TradeJournalRepository;
import com.kalbot.journal.TradeRecord;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-strategy win rate, profit and ROI over settled journal rows. Pending rows are only counted.
 * Each journal label is its own bucket, so ARBITRAGE_HEDGE is reported separately here.
 */
@RequiredArgsConstructor
public class StrategyPerformanceService {

  private static final String TOTALS = "TOTALS";
  private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

  private final @NonNull TradeJournalRepository repository;

  public PerformanceReport report() {
    return analyze(repository.source(), repository.trades());
  }

  static PerformanceReport analyze(String source, List<TradeRecord> trades) {
    Map<String, Accumulator> byStrategy = new LinkedHashMap<>();
    int pending = 0;
    for (TradeRecord trade : trades) {
      if (!trade.isSettled()) {
        pending++;
        continue;
      }
      byStrategy.computeIfAbsent(trade.strategy(), k -> new Accumulator()).add(trade);
    }

    List<StrategyPerformance> rows = new ArrayList<>();
    Accumulator all = new Accumulator();
    for (Map.Entry<String, Accumulator> e : byStrategy.entrySet()) {
      rows.add(e.getValue().toPerformance(e.getKey()));
      all.merge(e.getValue());
    }
    List<StrategyPerformance> byWinRate = new ArrayList<>(rows);
    byWinRate.sort(Comparator.comparingDouble(StrategyPerformance::winRatePct).reversed());

    // totals count every non-win as a loss
    StrategyPerformance totals = all.toPerformance(TOTALS);
    totals = new StrategyPerformance(TOTALS, totals.wins(), totals.totalTrades() - totals.wins(), totals.totalTrades(),
        totals.winRatePct(), totals.totalProfitUsd(), totals.totalStakedUsd(), totals.roiPct(), totals.avgProfitPerTradeUsd());

    return new PerformanceReport(
        source,
        trades.size(),
        pending,
        List.copyOf(byWinRate),
        totals,
        byWinRate.isEmpty() ? null : byWinRate.get(0).strategy(),
        best(rows, Comparator.comparing(StrategyPerformance::totalProfitUsd)),
        best(rows, Comparator.comparingDouble(StrategyPerformance::roiPct))
    );
  }

  /**
   * First strategy with the maximum value, in journal order.
   */
  private static String best(List<StrategyPerformance> rows, Comparator<StrategyPerformance> comparator) {
    StrategyPerformance best = null;
    for (StrategyPerformance row : rows) {
      if (best == null || comparator.compare(row, best) > 0) {
        best = row;
      }
    }
    return best == null ? null : best.strategy();
  }

  private static final class Accumulator {
    private int wins;
    private int losses;
    private int settled;
    private BigDecimal profit = BigDecimal.ZERO;
    private BigDecimal staked = BigDecimal.ZERO;

    void add(TradeRecord trade) {
      settled++;
      if (TradeRecord.WIN.equals(trade.outcome().trim())) {
        wins++;
      } else if (TradeRecord.LOSS.equals(trade.outcome().trim())) {
        losses++;
      }
      profit = profit.add(trade.profitUsd() == null ? BigDecimal.ZERO : trade.profitUsd());
      staked = staked.add(trade.stakeUsd() == null ? BigDecimal.ZERO : trade.stakeUsd());
    }

    void merge(Accumulator other) {
      wins += other.wins;
      losses += other.losses;
      settled += other.settled;
      profit = profit.add(other.profit);
      staked = staked.add(other.staked);
    }

    StrategyPerformance toPerformance(String strategy) {
      int total = wins + losses;
      double winRate = total > 0 ? (double) wins / total * 100.0 : 0.0;
      double roi = staked.signum() > 0
          ? profit.multiply(HUNDRED).divide(staked, MathContext.DECIMAL64).doubleValue()
          : 0.0;
      BigDecimal avg = total > 0
          ? profit.divide(BigDecimal.valueOf(total), 4, RoundingMode.HALF_UP)
          : BigDecimal.ZERO;
      return new StrategyPerformance(strategy, wins, losses, total, winRate, profit, staked, roi, avg);
    }
  }
}
