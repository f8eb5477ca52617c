package com.kalbot.analytics.web;

import com.kalbot.analytics.service.PerformanceReport;
import com.kalbot.analytics.service.StrategyPerformanceService;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/analytics")
@RequiredArgsConstructor
public class StrategyPerformanceController {

  private final @NonNull StrategyPerformanceService performanceService;

  @GetMapping("/strategies")
  public ResponseEntity<PerformanceReport> strategies() {
    return ResponseEntity.ok(performanceService.report());
  }
}
