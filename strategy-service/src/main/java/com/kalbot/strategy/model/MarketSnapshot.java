package com.kalbot.strategy.model;

import com.kalbot.domain.Side;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Per-cycle view of the market being traded.
 *
 * <p>{@code newlyOpen} is true only on the first cycle that sees {@code ticker}. The rollover
 * fields name the market that closed when {@code ticker} opened and stay set for the whole life of
 * {@code ticker}; the result is null until that market has settled.
 */
public record MarketSnapshot(
        String ticker,
        BigDecimal yesAsk,
        BigDecimal noAsk,
        boolean newlyOpen,
        String rolloverPreviousTicker,
        Side rolloverPreviousResult,
        Instant closeTime,
        Instant observedAt
) {
    public MarketSnapshot {
        if (yesAsk == null) yesAsk = BigDecimal.ZERO;
        if (noAsk == null) noAsk = BigDecimal.ZERO;
    }

    public BigDecimal askFor(Side side) {
        return side == Side.YES ? yesAsk : noAsk;
    }

    public boolean rolloverOccurred() {
        return rolloverPreviousTicker != null && !rolloverPreviousTicker.isBlank();
    }

    public Optional<Side> previousResult() {
        return Optional.ofNullable(rolloverPreviousResult);
    }

    public long secondsToClose() {
        if (closeTime == null || observedAt == null) return 0L;
        return Math.max(0L, Duration.between(observedAt, closeTime).getSeconds());
    }
}
