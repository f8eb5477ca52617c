package com.kalbot.strategy.evaluator;

import com.kalbot.config.KalbotProperties;
import com.kalbot.domain.Side;
import com.kalbot.strategy.Fixtures;
import com.kalbot.strategy.model.CycleSignals;
import com.kalbot.strategy.model.MarketSnapshot;
import com.kalbot.strategy.model.Signal;
import com.kalbot.strategy.model.SignalKind;
import com.kalbot.strategy.model.StrategyId;
import com.kalbot.strategy.model.Vote;
import com.kalbot.strategy.service.ConsensusRiskBook;
import com.kalbot.strategy.service.TradeStateStore;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class FixedStakeEvaluatorTest {

    private final Map<StrategyId, StrategyEvaluator> evaluators = StrategyCatalog.from(KalbotProperties.defaults())
            .evaluators().stream()
            .collect(Collectors.toMap(StrategyEvaluator::strategy, e -> e));
    private final ConsensusRiskBook book = Fixtures.riskBook("500", 0);
    private final TradeStateStore store = new TradeStateStore();

    @Test
    void catalogListsStrategiesInEvaluationOrder() {
        assertThat(StrategyCatalog.from(KalbotProperties.defaults()).descriptors())
                .extracting(StrategyCatalog.StrategyDescriptor::strategy)
                .containsExactly(StrategyId.values());
    }

    @Test
    void previousWaitsUntilRolloverResultIsKnown() {
        StrategyEvaluator previous = evaluators.get(StrategyId.PREVIOUS);

        assertThat(previous.evaluate(context(Fixtures.snapshot("T1", "0.40", "0.60"), CycleSignals.none())).action())
                .isEqualTo(EntryDecision.Action.WAIT);
        assertThat(previous.evaluate(context(Fixtures.rolledOver("T1", "0.40", "0.60", "T0", null), CycleSignals.none())).action())
                .isEqualTo(EntryDecision.Action.WAIT);
    }

    @Test
    void previousBuysLastResultSideWithFixedStake() {
        MarketSnapshot snapshot = Fixtures.rolledOver("T1", "0.70", "0.30", "T0", Side.NO);
        CycleSignals signals = signals(Vote.NO, Vote.NONE, Vote.NONE);

        EntryDecision decision = evaluators.get(StrategyId.PREVIOUS).evaluate(context(snapshot, signals));

        assertThat(decision.action()).isEqualTo(EntryDecision.Action.ENTER);
        assertThat(decision.position().side()).isEqualTo(Side.NO);
        assertThat(decision.position().stake()).isEqualByComparingTo("5");
        assertThat(decision.position().contracts()).isEqualByComparingTo("16.666667");
        assertThat(decision.position().feeReserved()).isEqualByComparingTo("0");
        assertThat(decision.position().note()).isEqualTo("no");
    }

    @Test
    void previous2WaitsForDealPrice() {
        StrategyEvaluator previous2 = evaluators.get(StrategyId.PREVIOUS_2);
        CycleSignals signals = signals(Vote.YES, Vote.NONE, Vote.NONE);

        assertThat(previous2.evaluate(context(Fixtures.rolledOver("T1", "0.50", "0.52", "T0", Side.YES), signals)).action())
                .isEqualTo(EntryDecision.Action.WAIT);
        assertThat(previous2.evaluate(context(Fixtures.rolledOver("T1", "0.45", "0.57", "T0", Side.YES), signals)).action())
                .isEqualTo(EntryDecision.Action.ENTER);
    }

    @Test
    void momentum15UsesLongWindowVote() {
        MarketSnapshot snapshot = Fixtures.rolledOver("T1", "0.40", "0.62", "T0", Side.NO);
        CycleSignals signals = new CycleSignals(
                new Signal(SignalKind.PREVIOUS, Vote.NO, null),
                new Signal(SignalKind.MOMENTUM_SHORT, Vote.NO, new BigDecimal("-0.1")),
                new Signal(SignalKind.MOMENTUM_LONG, Vote.YES, new BigDecimal("0.5")),
                Signal.none(SignalKind.MOMENTUM_SHORT));

        EntryDecision m15 = evaluators.get(StrategyId.MOMENTUM_15).evaluate(context(snapshot, signals));
        EntryDecision momentum = evaluators.get(StrategyId.MOMENTUM).evaluate(context(snapshot, signals));

        assertThat(m15.action()).isEqualTo(EntryDecision.Action.ENTER);
        assertThat(m15.position().side()).isEqualTo(Side.YES);
        assertThat(m15.position().note()).isEqualTo("BTC15 +0.500%");
        assertThat(momentum.action()).isEqualTo(EntryDecision.Action.WAIT);
    }

    private EvaluationContext context(MarketSnapshot snapshot, CycleSignals signals) {
        return new EvaluationContext(snapshot, signals, book, book.snapshot(Fixtures.NOW), store, Fixtures.NOW);
    }

    private static CycleSignals signals(Vote previous, Vote shortVote, Vote longVote) {
        return new CycleSignals(
                new Signal(SignalKind.PREVIOUS, previous, null),
                new Signal(SignalKind.MOMENTUM_SHORT, shortVote, BigDecimal.ONE),
                new Signal(SignalKind.MOMENTUM_LONG, longVote, BigDecimal.ONE),
                new Signal(SignalKind.MOMENTUM_SHORT, shortVote, BigDecimal.ONE));
    }
}
