package com.kalbot.journal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * One row of the trade journal. Settlement columns ({@code outcome}, {@code payout_usd},
 * {@code gross_profit_usd}, {@code profit_usd}, {@code settled_time}) stay empty while the trade is
 * pending. {@code previous_result} carries the signal note of the entry. Journals written before
 * {@code settled_time} existed read back with it empty.
 */
@JsonPropertyOrder({
    "time", "strategy", "previous_ticker", "previous_result", "buy_ticker", "buy_side",
    "stake_usd", "price_usd", "contracts", "fee_usd", "gross_profit_usd",
    "outcome", "payout_usd", "profit_usd", "settled_time"
})
public record TradeRecord(
    @JsonProperty("time") String time,
    @JsonProperty("strategy") String strategy,
    @JsonProperty("previous_ticker") String previousTicker,
    @JsonProperty("previous_result") String previousResult,
    @JsonProperty("buy_ticker") String buyTicker,
    @JsonProperty("buy_side") String buySide,
    @JsonProperty("stake_usd") BigDecimal stakeUsd,
    @JsonProperty("price_usd") BigDecimal priceUsd,
    @JsonProperty("contracts") BigDecimal contracts,
    @JsonProperty("fee_usd") BigDecimal feeUsd,
    @JsonProperty("gross_profit_usd") BigDecimal grossProfitUsd,
    @JsonProperty("outcome") String outcome,
    @JsonProperty("payout_usd") BigDecimal payoutUsd,
    @JsonProperty("profit_usd") BigDecimal profitUsd,
    @JsonProperty("settled_time") String settledTime
) {

  public static final String WIN = "WIN";
  public static final String LOSS = "LOSS";

  public static TradeRecord opened(Instant time,
                                   String strategy,
                                   String previousTicker,
                                   String note,
                                   String buyTicker,
                                   String buySide,
                                   BigDecimal stakeUsd,
                                   BigDecimal priceUsd,
                                   BigDecimal contracts) {
    return new TradeRecord(time.toString(), strategy, previousTicker, note, buyTicker, buySide,
        stakeUsd, priceUsd, contracts, null, null, null, null, null, null);
  }

  public TradeRecord settled(String outcome, BigDecimal payout, BigDecimal gross, BigDecimal fee, BigDecimal net,
                             Instant settledAt) {
    return new TradeRecord(time, strategy, previousTicker, previousResult, buyTicker, buySide,
        stakeUsd, priceUsd, contracts, fee, gross, outcome, payout, net,
        settledAt == null ? null : settledAt.toString());
  }

  @JsonIgnore
  public boolean isSettled() {
    return outcome != null && !outcome.isBlank();
  }

  @JsonIgnore
  public Optional<Instant> parsedTime() {
    return parseInstant(time);
  }

  @JsonIgnore
  public Optional<Instant> parsedSettledTime() {
    return parseInstant(settledTime);
  }

  private static Optional<Instant> parseInstant(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(OffsetDateTime.parse(value.trim()).toInstant());
    } catch (DateTimeParseException e) {
      try {
        return Optional.of(Instant.parse(value.trim()));
      } catch (DateTimeParseException ignored) {
        return Optional.empty();
      }
    }
  }

  @JsonIgnore
  public boolean sameTrade(String strategy, String buyTicker) {
    return strategy != null && strategy.equals(this.strategy)
        && buyTicker != null && buyTicker.equals(this.buyTicker);
  }
}
