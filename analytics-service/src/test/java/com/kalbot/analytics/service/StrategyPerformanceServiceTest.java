package com.kalbot.analytics.service;

import com.kalbot.analytics.repo.TradeJournalRepository;
import com.kalbot.journal.TradeRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StrategyPerformanceServiceTest {

  @Mock
  private TradeJournalRepository repository;

  @Test
  void reportsPerStrategyMetricsSortedByWinRate() {
    // Given
    when(repository.source()).thenReturn("/data/mock_trades.csv");
    when(repository.trades()).thenReturn(List.of(
        settled("PREVIOUS", "5", TradeRecord.WIN, "7.50"),
        settled("PREVIOUS", "5", TradeRecord.LOSS, "-5"),
        settled("CONSENSUS", "4.80", TradeRecord.WIN, "7.20"),
        settled("ARBITRAGE", "5", TradeRecord.LOSS, "-5"),
        settled("ARBITRAGE", "5", TradeRecord.WIN, "5.4167"),
        settled("ARBITRAGE", "5", TradeRecord.WIN, "1"),
        pending("MOMENTUM")
    ));

    // When
    PerformanceReport report = new StrategyPerformanceService(repository).report();

    // Then
    assertThat(report.tradesLoaded()).isEqualTo(7);
    assertThat(report.pendingTrades()).isEqualTo(1);
    assertThat(report.strategies()).extracting(StrategyPerformance::strategy)
        .containsExactly("CONSENSUS", "ARBITRAGE", "PREVIOUS");

    StrategyPerformance previous = report.strategies().get(2);
    assertThat(previous.wins()).isEqualTo(1);
    assertThat(previous.losses()).isEqualTo(1);
    assertThat(previous.winRatePct()).isEqualTo(50.0);
    assertThat(previous.totalProfitUsd()).isEqualByComparingTo("2.50");
    assertThat(previous.totalStakedUsd()).isEqualByComparingTo("10");
    assertThat(previous.roiPct()).isCloseTo(25.0, within(1e-9));
    assertThat(previous.avgProfitPerTradeUsd()).isEqualByComparingTo("1.25");

    assertThat(report.bestByWinRate()).isEqualTo("CONSENSUS");
    assertThat(report.bestByProfit()).isEqualTo("CONSENSUS");
    assertThat(report.bestByRoi()).isEqualTo("CONSENSUS");

    StrategyPerformance totals = report.totals();
    assertThat(totals.totalTrades()).isEqualTo(6);
    assertThat(totals.wins()).isEqualTo(4);
    assertThat(totals.losses()).isEqualTo(2);
    assertThat(totals.totalProfitUsd()).isEqualByComparingTo("11.1167");
  }

  @Test
  void emptyJournalHasNoBestStrategy() {
    PerformanceReport report = StrategyPerformanceService.analyze("none", List.of(pending("PREVIOUS")));

    assertThat(report.strategies()).isEmpty();
    assertThat(report.pendingTrades()).isEqualTo(1);
    assertThat(report.bestByWinRate()).isNull();
    assertThat(report.totals().winRatePct()).isZero();
    assertThat(report.totals().roiPct()).isZero();
  }

  @Test
  void tiesKeepJournalOrder() {
    PerformanceReport report = StrategyPerformanceService.analyze("x", List.of(
        settled("MOMENTUM", "5", TradeRecord.WIN, "5"),
        settled("PREVIOUS", "5", TradeRecord.WIN, "5")));

    assertThat(report.strategies()).extracting(StrategyPerformance::strategy).containsExactly("MOMENTUM", "PREVIOUS");
    assertThat(report.bestByProfit()).isEqualTo("MOMENTUM");
  }

  private static TradeRecord pending(String strategy) {
    return TradeRecord.opened(Instant.parse("2025-01-06T12:00:00Z"), strategy, "T0", "yes", "T1", "yes",
        new BigDecimal("5"), new BigDecimal("0.40"), new BigDecimal("12.5"));
  }

  private static TradeRecord settled(String strategy, String stake, String outcome, String net) {
    return new TradeRecord("2025-01-06T12:00:00+00:00", strategy, "T0", "yes", "T1", "yes",
        new BigDecimal(stake), new BigDecimal("0.40"), new BigDecimal("12.5"),
        BigDecimal.ZERO, new BigDecimal(net), outcome, BigDecimal.ZERO, new BigDecimal(net), null);
  }
}
