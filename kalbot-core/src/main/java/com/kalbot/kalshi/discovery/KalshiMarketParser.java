package com.kalbot.kalshi.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.kalbot.domain.Side;
import com.kalbot.kalshi.api.KalshiMarket;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class KalshiMarketParser {

  private static final BigDecimal CENTS_PER_DOLLAR = BigDecimal.valueOf(100);

  private KalshiMarketParser() {
  }

  public static List<JsonNode> extractMarkets(JsonNode root) {
    List<JsonNode> out = new ArrayList<>();
    if (root == null || root.isMissingNode() || root.isNull()) {
      return out;
    }
    JsonNode markets = root.path("markets");
    if (!markets.isArray()) {
      return out;
    }
    for (JsonNode market : markets) {
      if (market != null && market.isObject()) {
        out.add(market);
      }
    }
    return out;
  }

  public static Optional<KalshiMarket> parse(JsonNode market) {
    if (market == null || !market.isObject()) {
      return Optional.empty();
    }
    String ticker = market.path("ticker").asText("");
    if (ticker.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(new KalshiMarket(
        ticker,
        market.path("status").asText(null),
        centsToDollars(market.path("yes_ask")),
        centsToDollars(market.path("no_ask")),
        closeTime(market),
        settledSide(market).orElse(null)
    ));
  }

  /**
   * Picks the open market that closes soonest but still after {@code now}.
   */
  public static Optional<KalshiMarket> nextExpiringOpen(JsonNode root, Instant now) {
    return extractMarkets(root).stream()
        .map(KalshiMarketParser::parse)
        .flatMap(Optional::stream)
        .filter(m -> m.closeTime() != null && m.closeTime().isAfter(now))
        .min(Comparator.comparing(KalshiMarket::closeTime));
  }

  public static Optional<Side> settledSide(JsonNode market) {
    if (market == null || market.isMissingNode()) {
      return Optional.empty();
    }
    return Side.fromLabel(market.path("result").asText(null));
  }

  static Instant closeTime(JsonNode market) {
    String raw = market.path("close_time").asText("");
    if (raw.isBlank()) {
      return null;
    }
    try {
      return OffsetDateTime.parse(raw).toInstant();
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  private static BigDecimal centsToDollars(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return BigDecimal.ZERO;
    }
    BigDecimal cents = node.isNumber() ? node.decimalValue() : parseOrZero(node.asText());
    return Objects.requireNonNull(cents).divide(CENTS_PER_DOLLAR, 4, RoundingMode.HALF_UP);
  }

  private static BigDecimal parseOrZero(String raw) {
    try {
      return new BigDecimal(raw.trim());
    } catch (NumberFormatException e) {
      return BigDecimal.ZERO;
    }
  }
}
