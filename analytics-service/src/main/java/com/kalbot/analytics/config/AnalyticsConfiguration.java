package com.kalbot.analytics.config;

import com.kalbot.analytics.repo.CsvTradeJournalRepository;
import com.kalbot.analytics.repo.TradeJournalRepository;
import com.kalbot.analytics.service.PerformanceReport;
import com.kalbot.analytics.service.StrategyPerformance;
import com.kalbot.analytics.service.StrategyPerformanceService;
import com.kalbot.config.KalbotProperties;
import com.kalbot.journal.TradeJournalCsv;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Slf4j
@Configuration
public class AnalyticsConfiguration {

  @Bean
  public TradeJournalRepository tradeJournalRepository(KalbotProperties properties) {
    return new CsvTradeJournalRepository(new TradeJournalCsv(Path.of(properties.journal().tradesCsvPath())));
  }

  @Bean
  public StrategyPerformanceService strategyPerformanceService(TradeJournalRepository repository) {
    return new StrategyPerformanceService(repository);
  }

  /**
   * Logs the performance table once at startup.
   */
  @Bean
  @ConditionalOnProperty(prefix = "kalbot.analytics", name = "log-report-on-startup", havingValue = "true", matchIfMissing = true)
  public ApplicationRunner performanceReportLogger(StrategyPerformanceService service) {
    return args -> {
      try {
        logReport(service.report());
      } catch (RuntimeException e) {
        log.warn("Performance report failed: {}", e.getMessage());
      }
    };
  }

  static void logReport(PerformanceReport report) {
    log.info("Loaded {} trades from {}", report.tradesLoaded(), report.source());
    if (report.pendingTrades() > 0) {
      log.info("{} trades are pending (no outcome yet)", report.pendingTrades());
    }
    if (report.strategies().isEmpty()) {
      log.info("No settled trades");
      return;
    }
    log.info(String.format("%-16s %6s %7s %6s %10s %12s %10s", "Strategy", "Wins", "Losses", "Total", "Win Rate", "Profit", "ROI"));
    for (StrategyPerformance row : report.strategies()) {
      log.info(line(row));
    }
    log.info(line(report.totals()));
    log.info("Best by win rate: {} | by profit: {} | by ROI: {}",
        report.bestByWinRate(), report.bestByProfit(), report.bestByRoi());
  }

  private static String line(StrategyPerformance row) {
    return String.format("%-16s %6d %7d %6d %9.1f%% $%10.2f %9.1f%%",
        row.strategy(), row.wins(), row.losses(), row.totalTrades(), row.winRatePct(),
        row.totalProfitUsd(), row.roiPct());
  }
}
