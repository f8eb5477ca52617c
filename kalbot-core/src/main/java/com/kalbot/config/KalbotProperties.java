package com.kalbot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix="kalbot")
public record KalbotProperties(
    @Valid Kalshi kalshi,
    @Valid Coinbase coinbase,
    @Valid Engine engine,
    @Valid Journal journal,
    @Valid Strategy strategy,
    @Valid Consensus consensus
) {

  public KalbotProperties {
    if (kalshi == null) {
      kalshi = new Kalshi(null, null, null, null);
    }
    if (coinbase == null) {
      coinbase = new Coinbase(null, null, null);
    }
    if (engine == null) {
      engine = new Engine(null, null, null);
    }
    if (journal == null) {
      journal = new Journal(null, null);
    }
    if (strategy == null) {
      strategy = new Strategy(null, null, null, null, null);
    }
    if (consensus == null) {
      consensus = new Consensus(null, null, null, null, null, null, null, null);
    }
  }

  public static KalbotProperties defaults() {
    return new KalbotProperties(null, null, null, null, null, null);
  }

  public record Kalshi(
      String baseUrl,
      /**
       * Series whose markets are traded; the engine always follows the next-expiring open market.
       */
      String seriesTicker,
      @NotNull @Min(1) Integer marketsLimit,
      @NotNull @Min(100) Long httpTimeoutMillis
  ) {
    public Kalshi {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "https://api.elections.kalshi.com/trade-api/v2";
      }
      if (seriesTicker == null || seriesTicker.isBlank()) {
        seriesTicker = "KXBTC15M";
      }
      if (marketsLimit == null) {
        marketsLimit = 50;
      }
      if (httpTimeoutMillis == null) {
        httpTimeoutMillis = 20_000L;
      }
    }
  }

  public record Coinbase(
      String baseUrl,
      String productId,
      @NotNull @Min(100) Long httpTimeoutMillis
  ) {
    public Coinbase {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "https://api.coinbase.com";
      }
      if (productId == null || productId.isBlank()) {
        productId = "BTC-USD";
      }
      if (httpTimeoutMillis == null) {
        httpTimeoutMillis = 10_000L;
      }
    }
  }

  public record Engine(
      @NotNull Boolean enabled,
      /**
       * Delay between the end of one poll cycle and the start of the next.
       */
      @NotNull @Min(500) Long pollMillis,
      /**
       * Consecutive failed settlement lookups after which a ticker stops failing the cycle and is
       * left pending.
       */
      @NotNull @Min(1) Integer settlementLookupFailureLimit
  ) {
    public Engine {
      if (enabled == null) {
        enabled = true;
      }
      if (pollMillis == null) {
        pollMillis = 5_000L;
      }
      if (settlementLookupFailureLimit == null) {
        settlementLookupFailureLimit = 5;
      }
    }
  }

  public record Journal(
      String tradesCsvPath,
      /**
       * Rebuild trade state, bankroll and rolling window from the journal on startup.
       */
      @NotNull Boolean restoreOnStartup
  ) {
    public Journal {
      if (tradesCsvPath == null || tradesCsvPath.isBlank()) {
        tradesCsvPath = "data/mock_trades.csv";
      }
      if (restoreOnStartup == null) {
        restoreOnStartup = true;
      }
    }
  }

  /**
   * Fixed-stake strategy settings (PREVIOUS, MOMENTUM, ARBITRAGE and their variants).
   */
  public record Strategy(
      @NotNull @PositiveOrZero BigDecimal stakeUsd,
      @NotNull @Min(1) Long momentumWindowSeconds,
      @NotNull @Min(1) Long momentum15WindowSeconds,
      /**
       * Ask ceiling for the delayed-entry variants (PREVIOUS_2, CONSENSUS_2).
       */
      @NotNull @PositiveOrZero @DecimalMax("1.0") BigDecimal dealMaxPrice,
      /**
       * Exclusive notional ceiling for the arbitrage hedge leg.
       */
      @NotNull @PositiveOrZero BigDecimal arbitrageMaxBetUsd
  ) {
    public Strategy {
      if (stakeUsd == null) {
        stakeUsd = BigDecimal.valueOf(5);
      }
      if (momentumWindowSeconds == null) {
        momentumWindowSeconds = 60L;
      }
      if (momentum15WindowSeconds == null) {
        momentum15WindowSeconds = 900L;
      }
      if (dealMaxPrice == null) {
        dealMaxPrice = new BigDecimal("0.45");
      }
      if (arbitrageMaxBetUsd == null) {
        arbitrageMaxBetUsd = BigDecimal.TEN;
      }
    }
  }

  /**
   * Bankroll, sizing and loss-budget controls shared by CONSENSUS and CONSENSUS_2.
   */
  public record Consensus(
      @NotNull @PositiveOrZero BigDecimal initialBankrollUsd,
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double riskPct,
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double maxRiskPct,
      @NotNull @PositiveOrZero @DecimalMax("1.0") BigDecimal maxPrice,
      /**
       * Daily realized-loss budget, in multiples of R (bankroll * riskPct).
       */
      @NotNull @PositiveOrZero Double dailyLossCapR,
      @NotNull @PositiveOrZero Double weeklyLossCapR,
      @NotNull @Min(1) Integer rollingWindow,
      @NotNull @PositiveOrZero @DecimalMax("1.0") Double feePct
  ) {
    public Consensus {
      if (initialBankrollUsd == null) {
        initialBankrollUsd = BigDecimal.valueOf(500);
      }
      if (riskPct == null) {
        riskPct = 0.01;
      }
      if (maxRiskPct == null) {
        maxRiskPct = 0.02;
      }
      if (maxPrice == null) {
        maxPrice = new BigDecimal("0.55");
      }
      if (dailyLossCapR == null) {
        dailyLossCapR = 3.0;
      }
      if (weeklyLossCapR == null) {
        weeklyLossCapR = 8.0;
      }
      if (rollingWindow == null) {
        rollingWindow = 30;
      }
      if (feePct == null) {
        feePct = 0.0;
      }
    }
  }
}
