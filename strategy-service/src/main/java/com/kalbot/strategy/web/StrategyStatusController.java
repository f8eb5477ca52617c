package com.kalbot.strategy.web;

import com.kalbot.config.KalbotProperties;
import com.kalbot.strategy.cycle.TradingCycleEngine;
import com.kalbot.strategy.model.CycleStats;
import com.kalbot.strategy.model.RiskSnapshot;
import com.kalbot.strategy.model.StrategyStats;
import com.kalbot.strategy.service.ConsensusRiskBook;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/strategy")
@RequiredArgsConstructor
public class StrategyStatusController {

  private final @NonNull KalbotProperties properties;
  private final @NonNull TradingCycleEngine engine;
  private final @NonNull ConsensusRiskBook riskBook;

  @GetMapping("/status")
  public ResponseEntity<StrategyStatusResponse> status() {
    CycleStats last = engine.lastCycle().orElse(null);
    return ResponseEntity.ok(new StrategyStatusResponse(
        "PAPER",
        properties.kalshi().seriesTicker(),
        properties.engine().enabled(),
        engine.isRunning(),
        last == null ? null : last.at(),
        last == null ? null : last.ticker(),
        last == null ? 0L : last.secondsToClose(),
        last == null ? null : last.yesAsk(),
        last == null ? null : last.noAsk(),
        last == null ? null : last.btcPrice(),
        last == null ? 0 : last.openPositions(),
        last == null ? riskBook.currentBankroll() : last.consensusBankroll(),
        engine.lastRisk().orElse(null)
    ));
  }

  @GetMapping("/stats")
  public ResponseEntity<StrategyStatsResponse> stats() {
    return ResponseEntity.ok(new StrategyStatsResponse(
        List.copyOf(engine.scoreboard().snapshot().values()),
        engine.scoreboard().totals()
    ));
  }

  public record StrategyStatusResponse(
      String mode,
      String seriesTicker,
      boolean engineEnabled,
      boolean cycleRunning,
      Instant lastCycleAt,
      String ticker,
      long secondsToClose,
      BigDecimal yesAsk,
      BigDecimal noAsk,
      BigDecimal btcPrice,
      int openPositions,
      BigDecimal consensusBankroll,
      RiskSnapshot risk
  ) {
  }

  public record StrategyStatsResponse(
      List<StrategyStats> strategies,
      StrategyStats totals
  ) {
  }
}
