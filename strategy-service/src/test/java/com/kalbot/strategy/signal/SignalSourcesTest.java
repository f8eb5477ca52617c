package com.kalbot.strategy.signal;

import com.kalbot.domain.Side;
import com.kalbot.strategy.Fixtures;
import com.kalbot.strategy.model.CycleSignals;
import com.kalbot.strategy.model.PriceSample;
import com.kalbot.strategy.model.Signal;
import com.kalbot.strategy.model.SignalKind;
import com.kalbot.strategy.model.Vote;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SignalSourcesTest {

    private static final Instant T0 = Fixtures.NOW;

    private final SignalSources sources = new SignalSources(60, 900);

    @Test
    void risingPriceVotesYesWithMagnitude() {
        sources.recordPrice(sample(0, "100"));
        sources.recordPrice(sample(30, "101"));
        sources.recordPrice(sample(61, "102"));

        Signal vote = SignalSources.momentumVote(sources.shortHistory(), T0.plusSeconds(61), 60, SignalKind.MOMENTUM_SHORT);

        assertThat(vote.vote()).isEqualTo(Vote.YES);
        assertThat(vote.magnitudePct()).isEqualByComparingTo("2.0000");
    }

    @Test
    void unchangedPriceVotesNo() {
        sources.recordPrice(sample(0, "100"));
        sources.recordPrice(sample(61, "100"));

        Signal vote = SignalSources.momentumVote(sources.shortHistory(), T0.plusSeconds(61), 60, SignalKind.MOMENTUM_SHORT);

        assertThat(vote.vote()).isEqualTo(Vote.NO);
    }

    @Test
    void tooLittleHistoryVotesNone() {
        sources.recordPrice(sample(30, "100"));
        sources.recordPrice(sample(61, "101"));

        Signal vote = SignalSources.momentumVote(sources.longHistory(), T0.plusSeconds(61), 900, SignalKind.MOMENTUM_LONG);

        assertThat(vote.present()).isFalse();
    }

    @Test
    void previousVoteRequiresRollover() {
        assertThat(sources.previousVote(Fixtures.snapshot("T1", "0.40", "0.60")).present()).isFalse();
        assertThat(sources.previousVote(Fixtures.rolledOver("T1", "0.40", "0.60", "T0", null)).present()).isFalse();
        assertThat(sources.previousVote(Fixtures.rolledOver("T1", "0.40", "0.60", "T0", Side.NO)).vote()).isEqualTo(Vote.NO);
    }

    @Test
    void latchesFirstShortVoteAfterRolloverAndHoldsIt() {
        // Given: no reference sample yet
        sources.recordPrice(sample(0, "100"));
        CycleSignals first = sources.refresh(Fixtures.rolledOver("T1", "0.40", "0.60", "T0", Side.YES), T0);
        assertThat(first.latchedMomentum().present()).isFalse();

        // When: price rises past the window
        sources.recordPrice(sample(70, "101"));
        CycleSignals second = sources.refresh(Fixtures.rolledOver("T1", "0.40", "0.60", "T0", Side.YES), T0.plusSeconds(70));

        // Then
        assertThat(second.latchedMomentum().vote()).isEqualTo(Vote.YES);

        // And: a later fall does not move the latch
        sources.recordPrice(sample(140, "99"));
        CycleSignals third = sources.refresh(Fixtures.rolledOver("T1", "0.40", "0.60", "T0", Side.YES), T0.plusSeconds(140));
        assertThat(third.shortMomentum().vote()).isEqualTo(Vote.NO);
        assertThat(third.latchedMomentum().vote()).isEqualTo(Vote.YES);
    }

    @Test
    void doesNotLatchWithoutRolloverAndResetsOnNewTicker() {
        sources.recordPrice(sample(0, "100"));
        sources.recordPrice(sample(70, "101"));

        CycleSignals fresh = sources.refresh(Fixtures.snapshot("T1", "0.40", "0.60"), T0.plusSeconds(70));
        assertThat(fresh.shortMomentum().vote()).isEqualTo(Vote.YES);
        assertThat(fresh.latchedMomentum().present()).isFalse();

        sources.refresh(Fixtures.rolledOver("T2", "0.40", "0.60", "T1", null), T0.plusSeconds(70));
        sources.recordPrice(sample(140, "99"));
        CycleSignals next = sources.refresh(Fixtures.rolledOver("T3", "0.40", "0.60", "T2", null), T0.plusSeconds(140));
        assertThat(next.latchedMomentum().vote()).isEqualTo(Vote.NO);
    }

    @Test
    void latchesVoteWhenSamplesArriveAfterCycleClock() {
        // Given: every price lands 200ms after the cycle clock, cycles 5s apart
        CycleSignals signals = null;
        for (int k = 0; k <= 30; k++) {
            Instant now = T0.plusSeconds(5L * k);
            sources.recordPrice(new PriceSample(now.plusMillis(200), BigDecimal.valueOf(100 + k)));
            signals = sources.refresh(Fixtures.rolledOver("T1", "0.40", "0.60", "T0", Side.YES), now);
            if (k < 13) {
                assertThat(signals.shortMomentum().present()).isFalse();
            } else {
                // Then: the reference a full window back is still there
                assertThat(signals.shortMomentum().vote()).isEqualTo(Vote.YES);
            }
        }

        assertThat(signals.latchedMomentum().vote()).isEqualTo(Vote.YES);
    }

    @Test
    void arbitrageFirstSideIsCheaperSideYesOnTie() {
        assertThat(SignalSources.arbitrageFirstSide(new BigDecimal("0.48"), new BigDecimal("0.50"))).contains(Side.YES);
        assertThat(SignalSources.arbitrageFirstSide(new BigDecimal("0.55"), new BigDecimal("0.47"))).contains(Side.NO);
        assertThat(SignalSources.arbitrageFirstSide(new BigDecimal("0.50"), new BigDecimal("0.50"))).contains(Side.YES);
        assertThat(SignalSources.arbitrageFirstSide(BigDecimal.ZERO, new BigDecimal("0.50"))).isEmpty();
    }

    private static PriceSample sample(long offsetSeconds, String price) {
        return new PriceSample(T0.plusSeconds(offsetSeconds), new BigDecimal(price));
    }
}
