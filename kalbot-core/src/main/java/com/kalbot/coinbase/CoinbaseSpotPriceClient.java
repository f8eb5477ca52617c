package com.kalbot.coinbase;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.NonNull;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.util.Objects;

public final class CoinbaseSpotPriceClient {

  private final RestClient restClient;
  private final ObjectMapper objectMapper;

  public CoinbaseSpotPriceClient(@NonNull RestClient coinbaseRestClient, @NonNull ObjectMapper objectMapper) {
    this.restClient = Objects.requireNonNull(coinbaseRestClient, "coinbaseRestClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  /**
   * Current spot price for a Coinbase product such as {@code BTC-USD}.
   */
  public BigDecimal getSpotPrice(String productId) {
    if (productId == null || productId.isBlank()) {
      throw new IllegalArgumentException("productId must not be blank");
    }
    String body = restClient.get()
        .uri("/v2/prices/{product}/spot", productId)
        .retrieve()
        .body(String.class);
    return parseSpotPrice(body, productId);
  }

  BigDecimal parseSpotPrice(String body, String productId) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body == null ? "" : body);
    } catch (Exception e) {
      throw new RuntimeException("Failed parsing coinbase spot response product=%s".formatted(productId), e);
    }
    JsonNode amount = root == null ? null : root.path("data").path("amount");
    if (amount == null || amount.isMissingNode() || amount.isNull() || amount.asText().isBlank()) {
      throw new IllegalStateException("Coinbase spot response has no data.amount product=%s".formatted(productId));
    }
    try {
      return new BigDecimal(amount.asText().trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Coinbase spot amount is not numeric: %s".formatted(amount.asText()), e);
    }
  }
}
