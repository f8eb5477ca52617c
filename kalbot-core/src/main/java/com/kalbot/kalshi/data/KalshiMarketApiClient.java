package com.kalbot.kalshi.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kalbot.domain.Side;
import com.kalbot.kalshi.api.KalshiMarket;
import com.kalbot.kalshi.discovery.KalshiMarketParser;
import lombok.NonNull;
import org.springframework.web.client.RestClient;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only client for the public Kalshi trade API.
 */
public final class KalshiMarketApiClient {

  private final RestClient restClient;
  private final ObjectMapper objectMapper;

  public KalshiMarketApiClient(@NonNull RestClient kalshiRestClient, @NonNull ObjectMapper objectMapper) {
    this.restClient = Objects.requireNonNull(kalshiRestClient, "kalshiRestClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  public JsonNode getMarkets(String seriesTicker, String status, int limit) {
    String body = restClient.get()
        .uri(uriBuilder -> uriBuilder
            .path("/markets")
            .queryParam("series_ticker", seriesTicker)
            .queryParam("status", status)
            .queryParam("limit", Math.max(1, limit))
            .build())
        .retrieve()
        .body(String.class);
    return readTree(body, "markets series=%s".formatted(seriesTicker));
  }

  /**
   * Returns the {@code market} object of {@code GET /markets/{ticker}}, or a missing node.
   */
  public JsonNode getMarket(String ticker) {
    if (ticker == null || ticker.isBlank()) {
      throw new IllegalArgumentException("ticker must not be blank");
    }
    String body = restClient.get()
        .uri("/markets/{ticker}", ticker)
        .retrieve()
        .body(String.class);
    return readTree(body, "market ticker=%s".formatted(ticker)).path("market");
  }

  public Optional<KalshiMarket> findNextOpenMarket(String seriesTicker, int limit, Instant now) {
    return KalshiMarketParser.nextExpiringOpen(getMarkets(seriesTicker, "open", limit), now);
  }

  public Optional<Side> getSettledSide(String ticker) {
    return KalshiMarketParser.settledSide(getMarket(ticker));
  }

  private JsonNode readTree(String body, String what) {
    if (body == null || body.isBlank()) {
      return objectMapper.createObjectNode();
    }
    try {
      return objectMapper.readTree(body);
    } catch (Exception e) {
      throw new RuntimeException("Failed parsing kalshi %s response".formatted(what), e);
    }
  }
}
