package com.kalbot.kalshi.api;

import com.kalbot.domain.Side;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

/**
 * One Kalshi market as seen by the engine. Asks are in dollars (the API reports cents).
 */
public record KalshiMarket(
    String ticker,
    String status,
    BigDecimal yesAsk,
    BigDecimal noAsk,
    Instant closeTime,
    Side result
) {
  public KalshiMarket {
    if (yesAsk == null) {
      yesAsk = BigDecimal.ZERO;
    }
    if (noAsk == null) {
      noAsk = BigDecimal.ZERO;
    }
  }

  public Optional<Side> settledSide() {
    return Optional.ofNullable(result);
  }

  public BigDecimal askFor(Side side) {
    return side == Side.YES ? yesAsk : noAsk;
  }
}
