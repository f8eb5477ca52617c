package com.kalbot.strategy.signal;

import com.kalbot.domain.Side;
import com.kalbot.strategy.model.CycleSignals;
import com.kalbot.strategy.model.MarketSnapshot;
import com.kalbot.strategy.model.PriceSample;
import com.kalbot.strategy.model.Signal;
import com.kalbot.strategy.model.SignalKind;
import com.kalbot.strategy.model.Vote;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * Derives the previous-result, short and long momentum, and arbitrage votes.
 */
@Slf4j
public class SignalSources {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PriceHistory shortHistory;
    private final PriceHistory longHistory;

    private String latchedTicker;
    private Signal latchedMomentum = Signal.none(SignalKind.MOMENTUM_SHORT);

    public SignalSources(long shortWindowSeconds, long longWindowSeconds) {
        this.shortHistory = new PriceHistory(shortWindowSeconds);
        this.longHistory = new PriceHistory(longWindowSeconds);
    }

    public void recordPrice(PriceSample sample) {
        shortHistory.add(sample);
        longHistory.add(sample);
    }

    /**
     * Computes this cycle's votes and latches the first short-window vote seen after a rollover.
     */
    public CycleSignals refresh(MarketSnapshot snapshot, Instant now) {
        Signal previous = previousVote(snapshot);
        Signal shortMomentum = momentumVote(shortHistory, now, shortHistory.windowSeconds(), SignalKind.MOMENTUM_SHORT);
        Signal longMomentum = momentumVote(longHistory, now, longHistory.windowSeconds(), SignalKind.MOMENTUM_LONG);

        if (!snapshot.ticker().equals(latchedTicker)) {
            latchedTicker = snapshot.ticker();
            latchedMomentum = Signal.none(SignalKind.MOMENTUM_SHORT);
        }
        if (!latchedMomentum.present() && snapshot.rolloverOccurred() && shortMomentum.present()) {
            latchedMomentum = shortMomentum;
            log.debug("Latched momentum {} for {}", shortMomentum.vote(), snapshot.ticker());
        }
        return new CycleSignals(previous, shortMomentum, longMomentum, latchedMomentum);
    }

    public Signal previousVote(MarketSnapshot snapshot) {
        if (snapshot == null || !snapshot.rolloverOccurred()) {
            return Signal.none(SignalKind.PREVIOUS);
        }
        return new Signal(SignalKind.PREVIOUS, Vote.of(snapshot.rolloverPreviousResult()), null);
    }

    /**
     * yes when the latest price is strictly above the last price sampled at or before
     * {@code now - windowSeconds}, no otherwise, none when there is no such sample.
     */
    public static Signal momentumVote(PriceHistory history, Instant now, long windowSeconds, SignalKind kind) {
        Optional<PriceSample> latest = history.latest();
        Optional<PriceSample> reference = history.atOrBefore(now.minusSeconds(windowSeconds));
        if (latest.isEmpty() || reference.isEmpty()) {
            return Signal.none(kind);
        }
        BigDecimal then = reference.get().price();
        BigDecimal current = latest.get().price();
        if (then.signum() <= 0) {
            return Signal.none(kind);
        }
        Vote vote = current.compareTo(then) > 0 ? Vote.YES : Vote.NO;
        BigDecimal pct = current.subtract(then).multiply(HUNDRED).divide(then, 4, RoundingMode.HALF_UP);
        return new Signal(kind, vote, pct);
    }

    /**
     * Cheaper side of the book, yes on a tie. Empty unless both asks are positive.
     */
    public static Optional<Side> arbitrageFirstSide(BigDecimal yesAsk, BigDecimal noAsk) {
        if (yesAsk == null || noAsk == null || yesAsk.signum() <= 0 || noAsk.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(yesAsk.compareTo(noAsk) <= 0 ? Side.YES : Side.NO);
    }

    PriceHistory shortHistory() {
        return shortHistory;
    }

    PriceHistory longHistory() {
        return longHistory;
    }
}
